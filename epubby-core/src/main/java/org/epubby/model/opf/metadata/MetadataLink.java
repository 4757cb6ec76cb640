package org.epubby.model.opf.metadata;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.epubby.property.Properties;

/**
 * A {@code link} inside {@code metadata}, associating a resource with the publication or with one of its elements.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetadataLink {

    private String href;
    private Properties relation;
    private String mediaType;
    private String id;
    private Properties properties;
    private String refines;

    public MetadataLink(String href) {
        this.href = href;
    }
}

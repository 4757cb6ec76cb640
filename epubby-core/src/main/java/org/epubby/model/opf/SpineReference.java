package org.epubby.model.opf;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.epubby.property.Properties;

/**
 * An {@code itemref} of the spine. References are linear unless marked otherwise.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SpineReference {

    private String idref;
    private String id;
    private boolean linear = true;
    private Properties properties;

    public SpineReference(String idref) {
        this.idref = idref;
    }
}

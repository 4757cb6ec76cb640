package org.epubby.model.opf;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.epubby.property.DefaultVocabulary;
import org.epubby.property.Properties;
import org.epubby.property.Property;
import org.epubby.property.PropertyResolver;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ManifestItem {

    private String id;
    private String href;
    private String mediaType;
    private String fallback;
    private String mediaOverlay;
    private Properties properties;

    public ManifestItem(String id, String href, String mediaType) {
        this.id = id;
        this.href = href;
        this.mediaType = mediaType;
    }

    public boolean hasProperty(String reference) {
        return hasProperty(reference, PropertyResolver.RESERVED);
    }

    /**
     * Whether {@code reference} of the manifest vocabulary is set, unprefixed or through a prefix bound to that
     * vocabulary.
     */
    public boolean hasProperty(String reference, PropertyResolver resolver) {
        if (properties == null) {
            return false;
        }
        for (Property property : properties) {
            if (resolver.denotes(property, DefaultVocabulary.MANIFEST, reference)) {
                return true;
            }
        }
        return false;
    }
}

package org.epubby.model.opf.metadata;

import org.epubby.property.Property;

/**
 * Decodes {@code marc:relators} values into {@link CreativeRole}s.
 */
public class MarcRelatorConverter implements Opf3MetaConverter<CreativeRole> {

    public static final Property SCHEME = Property.of("marc", "relators");

    @Override
    public Property getScheme() {
        return SCHEME;
    }

    @Override
    public Class<CreativeRole> getValueType() {
        return CreativeRole.class;
    }

    @Override
    public CreativeRole decode(String value) {
        return CreativeRole.of(value);
    }

    @Override
    public String encode(CreativeRole value) {
        return value.getCode();
    }
}

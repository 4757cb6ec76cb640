package org.epubby.model.opf.metadata;

import lombok.Getter;
import org.epubby.property.Property;

/**
 * Raised when a plain string {@code meta} is created for a scheme that has a registered converter.
 */
@Getter
public class KnownOpf3MetaSchemeException extends IllegalArgumentException {

    private final Property scheme;

    public KnownOpf3MetaSchemeException(Property scheme, Class<?> valueType) {
        super("Scheme '" + scheme + "' is decoded to " + valueType.getSimpleName() + ", create the meta through its converter");
        this.scheme = scheme;
    }
}

package org.epubby.model.opf.metadata;

import org.epubby.property.Property;

/**
 * Turns the text of an EPUB 3 {@code meta} element with a given {@code scheme} into a typed value and back.
 * Converters are looked up through {@link Opf3MetaConverters}; declare one as a Spring bean to have it registered.
 *
 * @param <T> the value type
 */
public interface Opf3MetaConverter<T> {

    Property getScheme();

    Class<T> getValueType();

    /**
     * @throws IllegalArgumentException if {@code value} is not a valid value of this scheme
     */
    T decode(String value);

    String encode(T value);
}

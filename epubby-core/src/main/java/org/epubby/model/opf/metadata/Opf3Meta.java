package org.epubby.model.opf.metadata;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;
import org.epubby.property.Property;
import org.epubby.xml.ReadingDirection;

import java.util.Objects;

/**
 * An EPUB 3 {@code meta} element: a {@code property} with a typed value. The value type follows the {@code scheme},
 * see {@link Opf3MetaConverters}. A meta with {@code refines} set describes the element whose {@code id} is the
 * fragment of that IRI.
 *
 * @param <T> the value type
 */
@Getter
@Setter
public final class Opf3Meta<T> {

    @NonNull
    private Property property;
    @NonNull
    private T value;
    @Setter(AccessLevel.NONE)
    private final Opf3MetaConverter<T> converter;
    private String refines;
    private String id;
    private ReadingDirection direction;
    private String language;

    Opf3Meta(Opf3MetaConverter<T> converter, @NonNull Property property, @NonNull T value) {
        this.converter = converter;
        this.property = property;
        this.value = value;
    }

    /**
     * The scheme of the value, {@code null} for a plain string meta without one.
     */
    public Property getScheme() {
        return converter.getScheme();
    }

    public String getEncodedValue() {
        return converter.encode(value);
    }

    /**
     * The id this meta refines, the fragment of {@link #getRefines()}. {@code null} when it refines nothing.
     */
    public String getRefinedId() {
        if (StringUtils.isEmpty(refines)) {
            return null;
        }
        return refines.contains("#") ? StringUtils.substringAfter(refines, "#") : refines;
    }

    public boolean isRefinement() {
        return getRefinedId() != null;
    }

    /**
     * Points {@link #getRefines()} at the element with the given id.
     */
    public Opf3Meta<T> refining(String targetId) {
        this.refines = targetId == null ? null : "#" + targetId;
        return this;
    }

    public Opf3Meta<T> withId(String id) {
        this.id = id;
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Opf3Meta<?> other)) {
            return false;
        }
        return property.equals(other.property)
                && value.equals(other.value)
                && Objects.equals(getScheme(), other.getScheme())
                && Objects.equals(refines, other.refines)
                && Objects.equals(id, other.id)
                && direction == other.direction
                && Objects.equals(language, other.language);
    }

    @Override
    public int hashCode() {
        return Objects.hash(property, value, getScheme(), refines, id, direction, language);
    }

    @Override
    public String toString() {
        return "Opf3Meta[property=" + property + ", value=" + getEncodedValue() + ", scheme=" + getScheme()
                + ", refines=" + refines + ", id=" + id + "]";
    }
}

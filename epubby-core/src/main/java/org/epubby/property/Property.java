package org.epubby.property;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A compact property value, {@code prefix:reference} or just {@code reference} for the default vocabulary.
 */
@Getter
@EqualsAndHashCode
public final class Property {

    private final String prefix;
    private final String reference;

    private Property(String prefix, String reference) {
        this.prefix = prefix;
        this.reference = reference;
    }

    public static Property of(String prefix, String reference) {
        if (prefix != null && !NcNames.isNcName(prefix)) {
            throw new IllegalArgumentException("Prefix '" + prefix + "' is not a valid NCName");
        }
        if (reference == null || reference.isEmpty() || containsWhitespace(reference)) {
            throw new IllegalArgumentException("Reference '" + reference + "' must be non-empty and without whitespace");
        }
        return new Property(prefix, reference);
    }

    public static Property of(String reference) {
        return of(null, reference);
    }

    /**
     * Parses {@code (prefix ":")? reference}. Round-trips through {@link #toString()}.
     */
    public static Property parse(String input) throws PropertyParseException {
        if (input == null || input.isEmpty()) {
            throw new PropertyParseException(String.valueOf(input), 0, "Property is empty");
        }
        for (int i = 0; i < input.length(); i++) {
            if (Character.isWhitespace(input.charAt(i))) {
                throw new PropertyParseException(input, i, "Property must not contain whitespace");
            }
        }
        int colon = input.indexOf(':');
        if (colon < 0) {
            return new Property(null, input);
        }
        String prefix = input.substring(0, colon);
        String reference = input.substring(colon + 1);
        if (!NcNames.isNcName(prefix)) {
            throw new PropertyParseException(input, 0, "Prefix '" + prefix + "' is not a valid NCName");
        }
        if (reference.isEmpty()) {
            throw new PropertyParseException(input, colon + 1, "Reference after prefix is empty");
        }
        return new Property(prefix, reference);
    }

    private static boolean containsWhitespace(String value) {
        return value.chars().anyMatch(Character::isWhitespace);
    }

    public boolean hasPrefix() {
        return prefix != null;
    }

    @Override
    public String toString() {
        return prefix == null ? reference : prefix + ":" + reference;
    }
}

package org.epubby.property;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Prefix to IRI mappings of a {@code prefix} attribute:
 * {@code mapping ((whitespace)+ mapping)*} where {@code mapping = prefix ":" (space)+ iri}.
 */
public final class Prefixes {

    private final Map<String, String> mappings;

    private Prefixes(Map<String, String> mappings) {
        this.mappings = mappings;
    }

    public static Prefixes empty() {
        return new Prefixes(new LinkedHashMap<>());
    }

    public static Prefixes parse(String input) throws PropertyParseException {
        Prefixes result = empty();
        if (input == null) {
            return result;
        }
        int index = skipWhitespace(input, 0);
        while (index < input.length()) {
            int colon = input.indexOf(':', index);
            if (colon < 0) {
                throw new PropertyParseException(input, index, "Expected ':' after prefix");
            }
            String prefix = input.substring(index, colon);
            if (!NcNames.isNcName(prefix)) {
                throw new PropertyParseException(input, index, "Prefix '" + prefix + "' is not a valid NCName");
            }
            int iriStart = colon + 1;
            if (iriStart >= input.length() || input.charAt(iriStart) != ' ') {
                throw new PropertyParseException(input, iriStart, "Expected a space after ':'");
            }
            while (iriStart < input.length() && input.charAt(iriStart) == ' ') {
                iriStart++;
            }
            int iriEnd = iriStart;
            while (iriEnd < input.length() && !Character.isWhitespace(input.charAt(iriEnd))) {
                iriEnd++;
            }
            if (iriEnd == iriStart) {
                throw new PropertyParseException(input, iriStart, "Expected an IRI for prefix '" + prefix + "'");
            }
            result.mappings.put(prefix, input.substring(iriStart, iriEnd));
            index = skipWhitespace(input, iriEnd);
        }
        return result;
    }

    private static int skipWhitespace(String input, int index) {
        while (index < input.length() && Character.isWhitespace(input.charAt(index))) {
            index++;
        }
        return index;
    }

    public void put(String prefix, String iri) {
        if (!NcNames.isNcName(prefix)) {
            throw new IllegalArgumentException("Prefix '" + prefix + "' is not a valid NCName");
        }
        mappings.put(prefix, iri);
    }

    public String getIri(String prefix) {
        return mappings.get(prefix);
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(mappings);
    }

    public boolean isEmpty() {
        return mappings.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Prefixes other && mappings.equals(other.mappings);
    }

    @Override
    public int hashCode() {
        return mappings.hashCode();
    }

    @Override
    public String toString() {
        return mappings.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining(" "));
    }
}

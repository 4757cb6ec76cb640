package org.epubby.property;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An ordered set of {@link Property} values written space separated, as in {@code properties="nav scripted"}.
 */
public final class Properties implements Iterable<Property> {

    private final Set<Property> values;

    private Properties(Set<Property> values) {
        this.values = values;
    }

    public static Properties empty() {
        return new Properties(new LinkedHashSet<>());
    }

    public static Properties of(Property... properties) {
        Properties result = empty();
        for (Property property : properties) {
            result.add(property);
        }
        return result;
    }

    public static Properties parse(String input) throws PropertyParseException {
        Properties result = empty();
        if (input == null) {
            return result;
        }
        int offset = 0;
        for (String token : input.split("\\s+")) {
            if (token.isEmpty()) {
                continue;
            }
            offset = input.indexOf(token, offset);
            try {
                result.add(Property.parse(token));
            } catch (PropertyParseException e) {
                throw new PropertyParseException(input, offset + e.getIndex(), "Invalid property '" + token + "'");
            }
            offset += token.length();
        }
        return result;
    }

    public void add(Property property) {
        values.add(Objects.requireNonNull(property, "property"));
    }

    public boolean remove(Property property) {
        return values.remove(property);
    }

    public boolean contains(Property property) {
        return values.contains(property);
    }

    /**
     * Whether an unprefixed property with {@code reference} is present, e.g. {@code nav}.
     */
    public boolean containsReference(String reference) {
        return values.stream().anyMatch(p -> !p.hasPrefix() && p.getReference().equals(reference));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public List<Property> asList() {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    @Override
    public Iterator<Property> iterator() {
        return Collections.unmodifiableSet(values).iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Properties other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.stream().map(Property::toString).collect(Collectors.joining(" "));
    }
}

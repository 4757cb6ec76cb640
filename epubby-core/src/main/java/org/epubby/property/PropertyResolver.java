package org.epubby.property;

import java.util.Objects;

/**
 * Expands {@link Property} values into absolute IRIs. A prefix is looked up in the package's own {@code prefix}
 * mappings first, so a package may remap a reserved prefix, and then among the {@link ReservedPrefix}es. A property
 * without prefix expands into the {@link DefaultVocabulary} of the attribute it was read from.
 */
public final class PropertyResolver {

    /**
     * Knows only the reserved prefixes, as for a package without a {@code prefix} attribute.
     */
    public static final PropertyResolver RESERVED = new PropertyResolver(Prefixes.empty());

    private final Prefixes prefixes;

    private PropertyResolver(Prefixes prefixes) {
        this.prefixes = prefixes;
    }

    public static PropertyResolver of(Prefixes prefixes) {
        return new PropertyResolver(Objects.requireNonNull(prefixes, "prefixes"));
    }

    /**
     * The IRI {@code prefix} is bound to, or {@code null} if it is neither declared nor reserved.
     */
    public String resolvePrefix(String prefix) {
        String declared = prefixes.getIri(prefix);
        if (declared != null) {
            return declared;
        }
        ReservedPrefix reserved = ReservedPrefix.fromPrefix(prefix);
        return reserved == null ? null : reserved.getIri();
    }

    /**
     * @param vocabulary default vocabulary for an unprefixed property, may be {@code null}
     * @return the absolute IRI, or {@code null} if the prefix is unknown or an unprefixed property has no vocabulary
     */
    public String expand(Property property, DefaultVocabulary vocabulary) {
        if (!property.hasPrefix()) {
            return vocabulary == null ? null : vocabulary.getIri() + property.getReference();
        }
        String iri = resolvePrefix(property.getPrefix());
        return iri == null ? null : iri + property.getReference();
    }

    /**
     * The expanded IRI of {@code property}, or its compact form when it can not be expanded.
     */
    public String key(Property property, DefaultVocabulary vocabulary) {
        String expanded = expand(property, vocabulary);
        return expanded == null ? property.toString() : expanded;
    }

    /**
     * Whether {@code property} names {@code reference} of {@code vocabulary}, with or without a prefix bound to it.
     */
    public boolean denotes(Property property, DefaultVocabulary vocabulary, String reference) {
        return (vocabulary.getIri() + reference).equals(expand(property, vocabulary));
    }

    /**
     * Whether {@code property} expands into {@code vocabulary} but names a term it does not define.
     */
    public boolean isUndefinedIn(Property property, DefaultVocabulary vocabulary) {
        String expanded = expand(property, vocabulary);
        return expanded != null
                && expanded.startsWith(vocabulary.getIri())
                && !vocabulary.defines(expanded.substring(vocabulary.getIri().length()));
    }
}

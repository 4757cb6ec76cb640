package org.epubby.property;

import lombok.Getter;

import java.util.Set;

/**
 * The vocabularies an unprefixed property belongs to, depending on the attribute it is used in.
 */
@Getter
public enum DefaultVocabulary {
    /**
     * {@code item/@properties}.
     */
    MANIFEST("http://idpf.org/epub/vocab/package/item/#",
            "cover-image", "mathml", "nav", "remote-resources", "scripted", "svg", "switch"),
    /**
     * {@code itemref/@properties}.
     */
    SPINE("http://idpf.org/epub/vocab/package/itemref/#",
            "page-spread-left", "page-spread-right"),
    /**
     * {@code meta/@property}.
     */
    METADATA_META("http://idpf.org/epub/vocab/package/meta/#",
            "alternate-script", "authority", "belongs-to-collection", "collection-type", "display-seq", "file-as",
            "group-position", "identifier-type", "meta-auth", "role", "source-of", "term", "title-type"),
    /**
     * {@code link/@rel} and {@code link/@properties}.
     */
    METADATA_LINK("http://idpf.org/epub/vocab/package/link/#",
            "acquire", "alternate", "marc21xml-record", "mods-record", "onix-record", "record", "voicing",
            "xml-signature", "xmp-record", "onix", "xmp");

    private final String iri;
    private final Set<String> references;

    DefaultVocabulary(String iri, String... references) {
        this.iri = iri;
        this.references = Set.of(references);
    }

    public boolean defines(String reference) {
        return references.contains(reference);
    }
}

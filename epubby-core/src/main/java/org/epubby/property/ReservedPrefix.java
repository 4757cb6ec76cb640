package org.epubby.property;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Prefixes every EPUB 3 package may use without declaring them in its {@code prefix} attribute.
 */
@Getter
@RequiredArgsConstructor
public enum ReservedPrefix {
    A11Y("a11y", "http://www.idpf.org/epub/vocab/package/a11y/#"),
    DCTERMS("dcterms", "http://purl.org/dc/terms/"),
    MARC("marc", "http://id.loc.gov/vocabulary/"),
    MEDIA("media", "http://www.idpf.org/epub/vocab/overlays/#"),
    ONIX("onix", "http://www.editeur.org/ONIX/book/codelists/current.html#"),
    RENDITION("rendition", "http://www.idpf.org/vocab/rendition/#"),
    SCHEMA("schema", "http://schema.org/"),
    XSD("xsd", "http://www.w3.org/2001/XMLSchema#");

    private final String prefix;
    private final String iri;

    /**
     * The reserved prefix named {@code prefix}, or {@code null}. Prefix names are case-sensitive.
     */
    public static ReservedPrefix fromPrefix(String prefix) {
        for (ReservedPrefix reserved : values()) {
            if (reserved.prefix.equals(prefix)) {
                return reserved;
            }
        }
        return null;
    }
}

package org.epubby.property;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PrefixesTest {

    @Test
    void parsesMappingsInOrder() throws PropertyParseException {
        Prefixes prefixes = Prefixes.parse("foaf: http://xmlns.com/foaf/spec/\n  dbp:   http://dbpedia.org/ontology/");

        assertThat(prefixes.asMap()).containsExactly(
                org.assertj.core.api.Assertions.entry("foaf", "http://xmlns.com/foaf/spec/"),
                org.assertj.core.api.Assertions.entry("dbp", "http://dbpedia.org/ontology/"));
        assertEquals("foaf: http://xmlns.com/foaf/spec/ dbp: http://dbpedia.org/ontology/", prefixes.toString());
    }

    @Test
    void nullAndBlankInputGiveEmptyMappings() throws PropertyParseException {
        assertTrue(Prefixes.parse(null).isEmpty());
        assertTrue(Prefixes.parse("   ").isEmpty());
    }

    @Test
    void requiresSpaceAfterColon() {
        PropertyParseException e = assertThrows(PropertyParseException.class,
                () -> Prefixes.parse("foaf:http://xmlns.com/foaf/spec/"));
        assertEquals(5, e.getIndex());
    }

    @Test
    void requiresIri() {
        assertThrows(PropertyParseException.class, () -> Prefixes.parse("foaf: "));
    }

    @Test
    void rejectsInvalidPrefix() {
        assertThrows(PropertyParseException.class, () -> Prefixes.parse("1a: http://example.org/"));
        assertThrows(IllegalArgumentException.class, () -> Prefixes.empty().put("a b", "http://example.org/"));
    }
}

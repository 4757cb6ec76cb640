package org.epubby.property;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class PropertyTest {

    @Test
    void parsesPrefixedProperty() throws PropertyParseException {
        Property property = Property.parse("dcterms:modified");

        assertTrue(property.hasPrefix());
        assertEquals("dcterms", property.getPrefix());
        assertEquals("modified", property.getReference());
        assertEquals("dcterms:modified", property.toString());
    }

    @Test
    void parsesDefaultVocabularyProperty() throws PropertyParseException {
        Property property = Property.parse("nav");

        assertFalse(property.hasPrefix());
        assertEquals(Property.of("nav"), property);
    }

    @Test
    void referenceMayContainFurtherColons() throws PropertyParseException {
        Property property = Property.parse("ex:a:b");

        assertEquals("ex", property.getPrefix());
        assertEquals("a:b", property.getReference());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a b", "1x:ref", "pre:", ":ref"})
    void rejectsMalformedInput(String input) {
        assertThrows(PropertyParseException.class, () -> Property.parse(input));
    }

    @Test
    void reportsIndexOfWhitespace() {
        PropertyParseException e = assertThrows(PropertyParseException.class, () -> Property.parse("ab c"));
        assertEquals(2, e.getIndex());
    }

    @Test
    void factoryRejectsInvalidPrefix() {
        assertThrows(IllegalArgumentException.class, () -> Property.of("9", "ref"));
        assertThrows(IllegalArgumentException.class, () -> Property.of("ok", " "));
    }

    @Test
    void propertiesKeepOrderAndDropDuplicates() throws PropertyParseException {
        Properties properties = Properties.parse("  nav  scripted nav ");

        assertEquals(2, properties.size());
        assertEquals("nav scripted", properties.toString());
        assertTrue(properties.containsReference("scripted"));
    }

    @Test
    void propertiesReportOffsetOfBadToken() {
        PropertyParseException e = assertThrows(PropertyParseException.class, () -> Properties.parse("nav 1x:y"));
        assertEquals(4, e.getIndex());
    }
}

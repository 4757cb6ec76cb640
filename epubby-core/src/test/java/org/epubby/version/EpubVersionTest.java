package org.epubby.version;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class EpubVersionTest {

    @Nested
    class Parsing {

        @Test
        void parsesMajorAndMinor() throws EpubVersionException {
            EpubVersion version = EpubVersion.parse("3.0");

            assertEquals(3, version.getMajor());
            assertEquals(0, version.getMinor());
            assertEquals(0, version.getPatch());
        }

        @Test
        void parsesPatchAndSurroundingWhitespace() throws EpubVersionException {
            assertEquals(new EpubVersion(3, 2, 1), EpubVersion.parse(" 3.2.1 "));
        }

        @Test
        void blankInputIsRejected() {
            EpubVersionException e = assertThrows(EpubVersionException.class, () -> EpubVersion.parse("  "));
            assertEquals(EpubVersionException.Reason.NO_VERSION, e.getReason());
        }

        @Test
        void missingSeparatorIsRejected() {
            EpubVersionException e = assertThrows(EpubVersionException.class, () -> EpubVersion.parse("3"));
            assertEquals(EpubVersionException.Reason.MISSING_SEPARATOR, e.getReason());
        }

        @Test
        void tooManySeparatorsAreRejected() {
            EpubVersionException e = assertThrows(EpubVersionException.class, () -> EpubVersion.parse("3.0.0.1"));
            assertEquals(EpubVersionException.Reason.TOO_MANY_SEPARATORS, e.getReason());
        }

        @ParameterizedTest
        @ValueSource(strings = {"3.x", "a.0", "3.", "-1.0", "3.0.99999999999"})
        void nonNumericPartsAreRejected(String input) {
            EpubVersionException e = assertThrows(EpubVersionException.class, () -> EpubVersion.parse(input));
            assertEquals(EpubVersionException.Reason.INVALID_NUMBER, e.getReason());
            assertEquals(input, e.getInput());
        }
    }

    @Test
    void ordersByMajorThenMinorThenPatch() {
        assertTrue(EpubVersion.EPUB_2_0.isOlderThan(EpubVersion.EPUB_3_0));
        assertTrue(new EpubVersion(3, 0, 1).isOlderThan(EpubVersion.EPUB_3_1));
        assertTrue(EpubVersion.EPUB_3_2.isAtLeast(new EpubVersion(3, 1, 9)));
        assertEquals(0, new EpubVersion(3, 2, 0).compareTo(EpubVersion.EPUB_3_2));
    }

    @Test
    void omitsZeroPatchWhenPrinted() {
        assertEquals("2.0", EpubVersion.EPUB_2_0.toString());
        assertEquals("3.0.1", new EpubVersion(3, 0, 1).toString());
    }

    @Test
    void negativePartsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EpubVersion(3, -1, 0));
    }
}

package org.epubby.util;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HrefUtilsTest {

    @Nested
    class Resolve {

        @Test
        void resolvesAgainstDocumentDirectory() {
            assertEquals("/OEBPS/chapter1.xhtml", HrefUtils.resolve("/OEBPS", "chapter1.xhtml"));
            assertEquals("/OEBPS/text/ch.xhtml", HrefUtils.resolve("/OEBPS/", "./text/ch.xhtml"));
        }

        @Test
        void dropsFragmentAndQuery() {
            assertEquals("/OEBPS/chapter1.xhtml", HrefUtils.resolve("/OEBPS", "chapter1.xhtml#section1"));
            assertEquals("/OEBPS/chapter1.xhtml", HrefUtils.resolve("/OEBPS", "chapter1.xhtml?page=2"));
        }

        @Test
        void climbsToSiblingDirectories() {
            assertEquals("/images/cover.png", HrefUtils.resolve("/OEBPS", "../images/cover.png"));
        }

        @Test
        void absoluteReferencesIgnoreBase() {
            assertEquals("/OEBPS/chapter1.xhtml", HrefUtils.resolve("/other", "/OEBPS/chapter1.xhtml"));
        }

        @Test
        void decodesPercentEscapes() {
            assertEquals("/OEBPS/my chapter.xhtml", HrefUtils.resolve("/OEBPS", "my%20chapter.xhtml"));
        }

        @Test
        void unresolvableReferencesGiveNull() {
            assertNull(HrefUtils.resolve("/", "../outside.xhtml"));
            assertNull(HrefUtils.resolve("/OEBPS", "https://example.org/chapter.xhtml"));
            assertNull(HrefUtils.resolve("/OEBPS", "#only-fragment"));
            assertNull(HrefUtils.resolve("/OEBPS", null));
        }
    }

    @Test
    void detectsRemoteReferences() {
        assertTrue(HrefUtils.isRemote("https://example.org"));
        assertTrue(HrefUtils.isRemote("mailto:someone@example.org"));
        assertFalse(HrefUtils.isRemote("chapter1.xhtml#a"));
        assertFalse(HrefUtils.isRemote("../images/a b.png"));
        assertFalse(HrefUtils.isRemote(" "));
    }

    @Test
    void splitsFragment() {
        assertEquals("section1", HrefUtils.fragmentOf("chapter1.xhtml#section1"));
        assertNull(HrefUtils.fragmentOf("chapter1.xhtml"));
        assertEquals("chapter1.xhtml", HrefUtils.stripFragment("chapter1.xhtml#section1"));
    }

    @Test
    void findsDirectoryOfPath() {
        assertEquals("/OEBPS", HrefUtils.directoryOf("/OEBPS/content.opf"));
        assertEquals("/", HrefUtils.directoryOf("/content.opf"));
    }
}

package org.epubby.version;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class EpubFormatTest {

    @ParameterizedTest
    @CsvSource({
            "1.0, UNKNOWN",
            "2.0, EPUB_2_0",
            "2.0.1, EPUB_2_0",
            "3.0, EPUB_3_0",
            "3.0.1, EPUB_3_0",
            "3.2, EPUB_3_2",
            "3.9, EPUB_3_2",
            "4.0, NOT_SUPPORTED"
    })
    void resolvesHalfOpenBuckets(String version, EpubFormat expected) throws EpubVersionException {
        assertEquals(expected, EpubFormat.resolve(EpubVersion.parse(version)));
    }

    @Test
    void withdrawnGenerationIsRefused() throws EpubVersionException {
        EpubVersion version = EpubVersion.parse("3.1");

        EpubVersionException e = assertThrows(EpubVersionException.class, () -> EpubFormat.resolve(version));
        assertEquals(EpubVersionException.Reason.WITHDRAWN_VERSION, e.getReason());
        assertEquals(EpubFormat.EPUB_3_1, EpubFormat.bucketOf(version));
    }

    @Test
    void resolvingTwiceGivesTheSameFormat() throws EpubVersionException {
        EpubVersion version = new EpubVersion(3, 0, 1);

        assertSame(EpubFormat.resolve(version), EpubFormat.resolve(version));
    }

    @Test
    void onlyKnownGenerationsAreReadable() {
        assertTrue(EpubFormat.EPUB_2_0.isReadable());
        assertTrue(EpubFormat.EPUB_3_2.isReadable());
        assertFalse(EpubFormat.UNKNOWN.isReadable());
        assertFalse(EpubFormat.NOT_SUPPORTED.isReadable());
        assertFalse(EpubFormat.EPUB_2_0.isEpub3());
        assertTrue(EpubFormat.EPUB_3_0.isEpub3());
    }
}

package org.epubby.version;

/**
 * EPUB generation a package document belongs to. Buckets are half-open ranges over {@link EpubVersion}.
 */
public enum EpubFormat {
    UNKNOWN,
    EPUB_2_0,
    EPUB_3_0,
    EPUB_3_1,
    EPUB_3_2,
    NOT_SUPPORTED;

    /**
     * Returns the bucket {@code version} falls into, {@link #EPUB_3_1} included.
     */
    public static EpubFormat bucketOf(EpubVersion version) {
        if (version.isOlderThan(EpubVersion.EPUB_2_0)) {
            return UNKNOWN;
        }
        if (version.isOlderThan(EpubVersion.EPUB_3_0)) {
            return EPUB_2_0;
        }
        if (version.isOlderThan(EpubVersion.EPUB_3_1)) {
            return EPUB_3_0;
        }
        if (version.isOlderThan(EpubVersion.EPUB_3_2)) {
            return EPUB_3_1;
        }
        if (version.isOlderThan(EpubVersion.EPUB_4_0)) {
            return EPUB_3_2;
        }
        return NOT_SUPPORTED;
    }

    /**
     * Resolves the format of {@code version}, refusing the withdrawn 3.1 generation.
     *
     * @throws EpubVersionException if {@code version} lies in {@code [3.1, 3.2)}
     */
    public static EpubFormat resolve(EpubVersion version) throws EpubVersionException {
        EpubFormat format = bucketOf(version);
        if (format == EPUB_3_1) {
            throw new EpubVersionException(EpubVersionException.Reason.WITHDRAWN_VERSION, version.toString(),
                    "EPUB " + version + " belongs to the withdrawn 3.1 generation");
        }
        return format;
    }

    public boolean isReadable() {
        return this == EPUB_2_0 || this == EPUB_3_0 || this == EPUB_3_2;
    }

    public boolean isEpub3() {
        return this == EPUB_3_0 || this == EPUB_3_1 || this == EPUB_3_2;
    }
}

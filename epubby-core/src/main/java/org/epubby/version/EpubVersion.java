package org.epubby.version;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.Comparator;

/**
 * A {@code major.minor.patch} version as found in the {@code version} attribute of a package document.
 */
@Getter
@EqualsAndHashCode
public final class EpubVersion implements Comparable<EpubVersion> {

    public static final EpubVersion EPUB_2_0 = new EpubVersion(2, 0, 0);
    public static final EpubVersion EPUB_3_0 = new EpubVersion(3, 0, 0);
    public static final EpubVersion EPUB_3_1 = new EpubVersion(3, 1, 0);
    public static final EpubVersion EPUB_3_2 = new EpubVersion(3, 2, 0);
    public static final EpubVersion EPUB_4_0 = new EpubVersion(4, 0, 0);

    private static final Comparator<EpubVersion> ORDER = Comparator.comparingInt(EpubVersion::getMajor)
            .thenComparingInt(EpubVersion::getMinor)
            .thenComparingInt(EpubVersion::getPatch);

    private final int major;
    private final int minor;
    private final int patch;

    public EpubVersion(int major, int minor, int patch) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version parts must be non-negative: " + major + "." + minor + "." + patch);
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
    }

    public static EpubVersion parse(String text) throws EpubVersionException {
        if (StringUtils.isBlank(text)) {
            throw new EpubVersionException(EpubVersionException.Reason.NO_VERSION, text, "Version is blank");
        }
        String trimmed = text.trim();
        int separators = StringUtils.countMatches(trimmed, '.');
        if (separators == 0) {
            throw new EpubVersionException(EpubVersionException.Reason.MISSING_SEPARATOR, text,
                    "Version '" + text + "' has no '.' separator");
        }
        if (separators > 2) {
            throw new EpubVersionException(EpubVersionException.Reason.TOO_MANY_SEPARATORS, text,
                    "Version '" + text + "' has too many '.' separators");
        }
        String[] parts = trimmed.split("\\.", -1);
        int major = parsePart(parts[0], text);
        int minor = parsePart(parts[1], text);
        int patch = parts.length == 3 ? parsePart(parts[2], text) : 0;
        return new EpubVersion(major, minor, patch);
    }

    private static int parsePart(String part, String text) throws EpubVersionException {
        if (!StringUtils.isNumeric(part)) {
            throw new EpubVersionException(EpubVersionException.Reason.INVALID_NUMBER, text,
                    "Version part '" + part + "' of '" + text + "' is not a number");
        }
        try {
            return Integer.parseInt(part);
        } catch (NumberFormatException e) {
            throw new EpubVersionException(EpubVersionException.Reason.INVALID_NUMBER, text,
                    "Version part '" + part + "' of '" + text + "' is out of range");
        }
    }

    public boolean isOlderThan(EpubVersion other) {
        return compareTo(other) < 0;
    }

    public boolean isAtLeast(EpubVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public int compareTo(EpubVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return patch == 0 ? major + "." + minor : major + "." + minor + "." + patch;
    }
}

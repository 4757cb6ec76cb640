package org.epubby.util;

import lombok.experimental.UtilityClass;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Resolution of the relative IRIs found in package and navigation documents against archive paths.
 */
@UtilityClass
public class HrefUtils {

    /**
     * Whether {@code href} carries a scheme, e.g. {@code https:} or {@code mailto:}, and so points outside the archive.
     */
    public static boolean isRemote(String href) {
        if (StringUtils.isBlank(href)) {
            return false;
        }
        try {
            return new URI(href.trim()).isAbsolute();
        } catch (URISyntaxException e) {
            return StringUtils.substringBefore(href, "/").contains(":");
        }
    }

    public static String stripFragment(String href) {
        return StringUtils.substringBefore(StringUtils.substringBefore(href, "#"), "?");
    }

    public static String fragmentOf(String href) {
        return href.contains("#") ? StringUtils.substringAfter(href, "#") : null;
    }

    /**
     * Absolute archive path {@code href} points at when read from a document inside {@code baseDirectory}. The
     * fragment and query are dropped and percent escapes decoded.
     *
     * @return {@code null} for remote targets, an empty reference and paths climbing above the archive root
     */
    public static String resolve(String baseDirectory, String href) {
        if (href == null || isRemote(href)) {
            return null;
        }
        String path = decode(stripFragment(href.trim()));
        if (path.isEmpty()) {
            return null;
        }
        String combined = path.startsWith("/") ? path : StringUtils.appendIfMissing(baseDirectory, "/") + path;
        return FilenameUtils.normalizeNoEndSeparator(combined, true);
    }

    /**
     * Directory part of an absolute archive path, {@code "/"} for files at the root.
     */
    public static String directoryOf(String absolutePath) {
        int index = absolutePath.lastIndexOf('/');
        return index <= 0 ? "/" : absolutePath.substring(0, index);
    }

    private static String decode(String path) {
        if (!path.contains("%")) {
            return path;
        }
        try {
            return new URI(path).getPath();
        } catch (URISyntaxException e) {
            return path;
        }
    }
}

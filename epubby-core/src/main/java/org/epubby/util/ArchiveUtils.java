package org.epubby.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

@Slf4j
@UtilityClass
public class ArchiveUtils {

    private static final byte[] ZIP_MAGIC = {0x50, 0x4B, 0x03, 0x04};
    // empty archive: end of central directory record only
    private static final byte[] EMPTY_ZIP_MAGIC = {0x50, 0x4B, 0x05, 0x06};

    public static boolean isZipArchive(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            return false;
        }

        try (InputStream is = new BufferedInputStream(Files.newInputStream(file))) {
            byte[] buffer = is.readNBytes(4);
            if (buffer.length < 4) {
                return false;
            }
            return Arrays.equals(buffer, ZIP_MAGIC) || Arrays.equals(buffer, EMPTY_ZIP_MAGIC);
        } catch (IOException e) {
            log.warn("Failed to read archive signature of file: {}", file.toAbsolutePath());
            return false;
        }
    }
}

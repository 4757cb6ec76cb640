package org.epubby.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArchiveUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void isZipArchive_ZipWithEpubExtension() throws IOException {
        Path file = tempDir.resolve("test.epub");
        try (ZipOutputStream zos = new ZipOutputStream(new FileOutputStream(file.toFile()))) {
            zos.putNextEntry(new ZipEntry("mimetype"));
            zos.write("application/epub+zip".getBytes());
            zos.closeEntry();
        }

        assertTrue(ArchiveUtils.isZipArchive(file));
    }

    @Test
    void isZipArchive_EmptyZip() throws IOException {
        Path file = tempDir.resolve("empty.epub");
        new ZipOutputStream(new FileOutputStream(file.toFile())).close();

        assertTrue(ArchiveUtils.isZipArchive(file));
    }

    @Test
    void isZipArchive_RarWithEpubExtension() throws IOException {
        Path file = tempDir.resolve("test.epub");
        Files.write(file, new byte[]{0x52, 0x61, 0x72, 0x21, 0x1A, 0x07, 0x00});

        assertFalse(ArchiveUtils.isZipArchive(file));
    }

    @Test
    void isZipArchive_TooShort() throws IOException {
        Path file = tempDir.resolve("short.epub");
        Files.write(file, new byte[]{0x50, 0x4B});

        assertFalse(ArchiveUtils.isZipArchive(file));
    }

    @Test
    void isZipArchive_MissingOrDirectory() {
        assertFalse(ArchiveUtils.isZipArchive(tempDir.resolve("missing.epub")));
        assertFalse(ArchiveUtils.isZipArchive(tempDir));
        assertFalse(ArchiveUtils.isZipArchive(null));
    }
}

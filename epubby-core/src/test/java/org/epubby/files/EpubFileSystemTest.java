package org.epubby.files;

import org.epubby.TestEpubs;
import org.epubby.exception.FileError;
import org.epubby.exception.FileException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EpubFileSystemTest {

    @TempDir
    Path tempDir;

    private EpubFileSystem fileSystem;

    @BeforeEach
    void setUp() throws IOException {
        fileSystem = EpubFileSystem.mount(TestEpubs.writeEpub2(tempDir), false);
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    @Nested
    class Resolution {

        @Test
        void resolvesFilesAndDirectories() throws FileException {
            assertTrue(fileSystem.resolve("/OEBPS/content.opf").isFile());
            assertTrue(fileSystem.resolve("/OEBPS", "styles").isDirectory());
            assertEquals("/OEBPS/chapter1.xhtml", fileSystem.resolve("OEBPS/./text/../chapter1.xhtml").getPath().toString());
        }

        @Test
        void rootIsAbsolute() throws FileException {
            assertEquals("/", fileSystem.getRoot().toString());
            assertTrue(fileSystem.getRoot().isAbsolute());
            assertEquals(fileSystem.getRoot(), fileSystem.getRootDirectory().getPath());
            assertEquals(fileSystem.getRoot().resolve("OEBPS"), fileSystem.getPath("/OEBPS"));
        }

        @Test
        void missingPathIsNil() throws FileException {
            Resource resource = fileSystem.resolve("/OEBPS/missing.xhtml");

            assertTrue(resource.isNil());
            assertEquals(ResourceKind.NIL, resource.getKind());
        }

        @Test
        void kindMismatchIsReported() throws FileException {
            FileException e = assertThrows(FileException.class, () -> fileSystem.resolve("/OEBPS").asFile());
            assertEquals(FileError.NOT_FILE, e.getError());

            e = assertThrows(FileException.class, () -> fileSystem.resolve("/mimetype").asDirectory());
            assertEquals(FileError.NOT_DIRECTORY, e.getError());
        }

        @Test
        void climbingAboveRootIsRejected() {
            FileException e = assertThrows(FileException.class, () -> fileSystem.resolve("/OEBPS/../../secret"));
            assertEquals(FileError.PATH_OUTSIDE_ROOT, e.getError());
            assertEquals("/OEBPS/../../secret", e.getPath());
        }

        @Test
        void parentOfRootDoesNotExist() throws FileException {
            DirectoryResource root = fileSystem.getRootDirectory();

            FileException e = assertThrows(FileException.class, root::getParent);
            assertEquals(FileError.NO_SUCH_RESOURCE, e.getError());
        }
    }

    @Nested
    class Import {

        @Test
        void importsHostFileKeepingItsName() throws IOException, FileException {
            Path hostFile = Files.writeString(tempDir.resolve("extra.css"), "p { color: red; }");
            DirectoryResource styles = fileSystem.resolve("/OEBPS/styles").asDirectory();

            FileResource imported = fileSystem.importFile(hostFile, styles);

            assertEquals("/OEBPS/styles/extra.css", imported.getPath().toString());
            assertEquals("p { color: red; }", imported.readText());
        }

        @Test
        void importsStream() throws FileException {
            DirectoryResource oebps = fileSystem.resolve("/OEBPS").asDirectory();
            byte[] content = "<svg/>".getBytes(StandardCharsets.UTF_8);

            FileResource imported = fileSystem.importStream(new ByteArrayInputStream(content), "image.svg", oebps);

            assertArrayEquals(content, imported.readBytes());
        }

        @Test
        void refusesToOverwrite() throws IOException, FileException {
            Path hostFile = Files.writeString(tempDir.resolve("chapter1.xhtml"), "replacement");
            DirectoryResource oebps = fileSystem.resolve("/OEBPS").asDirectory();

            FileException e = assertThrows(FileException.class, () -> fileSystem.importFile(hostFile, oebps));
            assertEquals(FileError.RESOURCE_ALREADY_EXISTS, e.getError());
        }

        @Test
        void refusesNamesEscapingTarget() throws FileException {
            DirectoryResource styles = fileSystem.resolve("/OEBPS/styles").asDirectory();

            FileException e = assertThrows(FileException.class,
                    () -> fileSystem.importStream(new ByteArrayInputStream(new byte[0]), "../escaped.css", styles));
            assertEquals(FileError.PATH_OUTSIDE_ROOT, e.getError());
        }

        @Test
        void refusesTargetsOfAnotherFileSystem() throws IOException, FileException {
            try (EpubFileSystem other = EpubFileSystem.create(tempDir.resolve("other.epub"))) {
                DirectoryResource foreignRoot = other.getRootDirectory();
                Path hostFile = Files.writeString(tempDir.resolve("note.txt"), "note");

                assertThrows(IllegalArgumentException.class, () -> fileSystem.importFile(hostFile, foreignRoot));
            }
        }
    }

    @Nested
    class Closing {

        @Test
        void everyOperationFailsAfterClose() throws IOException, FileException {
            FileResource chapter = fileSystem.resolve("/OEBPS/chapter1.xhtml").asFile();

            fileSystem.close();

            assertFalse(fileSystem.isOpen());
            FileException e = assertThrows(FileException.class, () -> fileSystem.resolve("/mimetype"));
            assertEquals(FileError.FILESYSTEM_CLOSED, e.getError());
            e = assertThrows(FileException.class, chapter::readText);
            assertEquals(FileError.FILESYSTEM_CLOSED, e.getError());
        }

        @Test
        void existenceChecksFailAfterClose() throws IOException, FileException {
            EpubPath chapter = fileSystem.getPath("/OEBPS/chapter1.xhtml");
            EpubPath missing = fileSystem.getPath("/OEBPS/missing.xhtml");
            assertTrue(chapter.exists());
            assertTrue(missing.notExists());

            fileSystem.close();

            FileException e = assertThrows(FileException.class, chapter::exists);
            assertEquals(FileError.FILESYSTEM_CLOSED, e.getError());
            assertEquals("/OEBPS/chapter1.xhtml", e.getPath());
            e = assertThrows(FileException.class, missing::notExists);
            assertEquals(FileError.FILESYSTEM_CLOSED, e.getError());
        }

        @Test
        void closingTwiceIsHarmless() throws IOException {
            fileSystem.close();

            assertDoesNotThrow(() -> fileSystem.close());
        }

        @Test
        void workingCopyIsDeletedOnClose() throws IOException {
            Path copy = Files.copy(fileSystem.getArchive(), tempDir.resolve("copy.epub"));
            EpubFileSystem workingCopy = EpubFileSystem.mount(copy, true);

            workingCopy.close();

            assertFalse(Files.exists(copy));
        }

        @Test
        void changesAreFlushedIntoArchive() throws IOException, FileException {
            Path archive = tempDir.resolve("created.epub");
            try (EpubFileSystem created = EpubFileSystem.create(archive)) {
                created.getRootDirectory().createFile("notes.txt").writeText("kept");
            }

            try (EpubFileSystem reopened = EpubFileSystem.mount(archive, false)) {
                assertEquals("kept", reopened.resolve("/notes.txt").asFile().readText());
            }
        }
    }

    @Test
    void createRefusesExistingArchive() {
        assertThrows(FileAlreadyExistsException.class, () -> EpubFileSystem.create(fileSystem.getArchive()));
    }
}

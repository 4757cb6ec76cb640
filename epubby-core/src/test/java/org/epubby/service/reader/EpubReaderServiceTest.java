package org.epubby.service.reader;

import org.epubby.TestEpubs;
import org.epubby.config.EpubProperties;
import org.epubby.exception.EpubReaderError;
import org.epubby.exception.EpubReaderException;
import org.epubby.exception.FileError;
import org.epubby.exception.FileException;
import org.epubby.model.opf.metadata.Opf3MetaConverters;
import org.epubby.model.toc.NavigationDocument;
import org.epubby.version.EpubFormat;
import org.epubby.version.EpubVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class EpubReaderServiceTest {

    @TempDir
    Path tempDir;

    private Path workingDirectory;
    private EpubReaderService readerService;

    @BeforeEach
    void setUp() {
        workingDirectory = tempDir.resolve("work");
        EpubProperties properties = new EpubProperties();
        properties.setWorkingDirectory(workingDirectory);
        readerService = new EpubReaderService(properties, Opf3MetaConverters.withDefaults());
    }

    private Path epub2With(Consumer<Map<String, String>> change) throws IOException {
        Map<String, String> entries = TestEpubs.epub2Entries();
        change.accept(entries);
        return TestEpubs.writeArchive(tempDir.resolve("book.epub"), entries);
    }

    private EpubReaderError openFailure(Path file) {
        return assertThrows(EpubReaderException.class, () -> readerService.open(file)).getError();
    }

    @Nested
    class Bootstrap {

        @Test
        void directoryIsNotAFile() {
            assertEquals(EpubReaderError.FAILED_TO_OPEN_FILE, openFailure(tempDir));
        }

        @Test
        void plainFileIsNotAZip() throws IOException {
            Path file = Files.writeString(tempDir.resolve("book.epub"), "plain text");

            assertEquals(EpubReaderError.NOT_A_ZIP_ARCHIVE, openFailure(file));
        }

        @Test
        void mimetypeIsRequired() throws IOException {
            assertEquals(EpubReaderError.MISSING_MIME_TYPE, openFailure(epub2With(entries -> entries.remove("mimetype"))));
        }

        @Test
        void mimetypeMustMatch() throws IOException {
            assertEquals(EpubReaderError.MIME_TYPE_CONTENT_MISMATCH,
                    openFailure(epub2With(entries -> entries.put("mimetype", "application/zip"))));
        }

        @Test
        void trailingLineBreakInMimetypeIsTolerated() throws Exception {
            try (LoadedEpub epub = readerService.open(epub2With(entries -> entries.put("mimetype", "application/epub+zip\r\n")))) {
                assertEquals(EpubFormat.EPUB_2_0, epub.getFormat());
            }
        }

        @Test
        void metaInfIsRequired() throws IOException {
            assertEquals(EpubReaderError.MISSING_META_INF,
                    openFailure(epub2With(entries -> entries.remove("META-INF/container.xml"))));
        }

        @Test
        void containerIsRequired() throws IOException {
            assertEquals(EpubReaderError.MISSING_META_INF_CONTAINER, openFailure(epub2With(entries -> {
                entries.remove("META-INF/container.xml");
                entries.put("META-INF/manifest.xml", "<manifest/>");
            })));
        }

        @Test
        void malformedContainerIsReported() throws IOException {
            assertEquals(EpubReaderError.META_INF_ERROR,
                    openFailure(epub2With(entries -> entries.put("META-INF/container.xml", "<container"))));
        }

        @Test
        void declaredPackageDocumentMustExist() throws IOException {
            assertEquals(EpubReaderError.MISSING_OPF_FILE,
                    openFailure(epub2With(entries -> entries.remove("OEBPS/content.opf"))));
        }

        @Test
        void malformedPackageDocumentIsReported() throws IOException {
            assertEquals(EpubReaderError.OPF_ERROR, openFailure(epub2With(entries -> entries.put("OEBPS/content.opf",
                    TestEpubs.EPUB2_OPF.replace("<dc:title>Test Book</dc:title>", "")))));
        }

        @Test
        void withdrawnVersionIsRejected() throws IOException {
            assertEquals(EpubReaderError.INVALID_VERSION, openFailure(epub2With(entries -> entries.put("OEBPS/content.opf",
                    TestEpubs.EPUB2_OPF.replace("version=\"2.0\"", "version=\"3.1\"")))));
        }

        @Test
        void failedOpenLeavesNoWorkingCopy() throws IOException {
            openFailure(epub2With(entries -> entries.remove("OEBPS/content.opf")));

            try (Stream<Path> files = Files.list(workingDirectory)) {
                assertEquals(0, files.count());
            }
        }
    }

    @Nested
    class Epub2 {

        @Test
        void loadsPackageAndNcx() throws Exception {
            try (LoadedEpub epub = readerService.open(TestEpubs.writeEpub2(tempDir))) {
                assertEquals(EpubVersion.EPUB_2_0, epub.getVersion());
                assertEquals("/OEBPS/content.opf", epub.getOpfPath());
                assertEquals("Test Book", epub.getPackageDocument().getMetadata().getPrimaryTitle().getContent());
                assertEquals("/OEBPS/toc.ncx", epub.getNcxPath());
                assertEquals(3, epub.getNcx().getNavMap().getNavPoints().size());
                assertNull(epub.getNavigationDocument());
            }
        }

        @Test
        void unreadableNcxIsLeftOut() throws Exception {
            Path file = epub2With(entries -> entries.put("OEBPS/toc.ncx", TestEpubs.EPUB2_NCX.replace("text/chapter3.xhtml", "gone.xhtml")));

            try (LoadedEpub epub = readerService.open(file)) {
                assertNull(epub.getNcx());
                assertNull(epub.getNcxPath());
            }
        }

        @Test
        void packageFilesAreProtected() throws Exception {
            try (LoadedEpub epub = readerService.open(TestEpubs.writeEpub2(tempDir))) {
                FileException e = assertThrows(FileException.class, () -> epub.getOpfFile().delete());
                assertEquals(FileError.NOT_DELETABLE, e.getError());
                assertEquals("/OEBPS/content.opf", epub.getFileSystem().getClassifier().getPackageDocumentPath());
                assertTrue(epub.getFileSystem().resolve("/OEBPS/chapter1.xhtml").asFile().isModifiable());
                assertTrue(epub.getFileSystem().resolve("/OEBPS/notes.txt").isNil());
            }
        }

        @Test
        void sourceIsNotModified() throws Exception {
            Path file = TestEpubs.writeEpub2(tempDir);
            byte[] before = Files.readAllBytes(file);

            try (LoadedEpub epub = readerService.open(file)) {
                epub.getFileSystem().resolve("/OEBPS/chapter2.xhtml").asFile().writeText("changed");
            }

            assertArrayEquals(before, Files.readAllBytes(file));
            try (Stream<Path> files = Files.list(workingDirectory)) {
                assertEquals(0, files.count());
            }
        }
    }

    @Nested
    class Epub3 {

        @Test
        void loadsNavigationDocument() throws Exception {
            try (LoadedEpub epub = readerService.open(TestEpubs.writeEpub3(tempDir))) {
                assertEquals(EpubFormat.EPUB_3_0, epub.getFormat());
                assertNull(epub.getNcx());
                assertEquals("/OEBPS/nav.xhtml", epub.getNavigationDocumentPath());
                NavigationDocument navigation = epub.getNavigationDocument();
                assertThat(navigation.getToc().getItems()).extracting(NavigationDocument.NavItem::getText)
                        .containsExactly("Chapter 1", "Chapter 2");
            }
        }

        @Test
        void missingNavigationDocumentIsTolerated() throws Exception {
            Path file = TestEpubs.writeArchive(tempDir.resolve("book.epub"), withoutNav());

            try (LoadedEpub epub = readerService.open(file)) {
                assertNull(epub.getNavigationDocument());
                assertNotNull(epub.getPackageDocument().getManifest().getItem("nav"));
            }
        }

        private Map<String, String> withoutNav() {
            Map<String, String> entries = TestEpubs.epub3Entries();
            entries.remove("OEBPS/nav.xhtml");
            return entries;
        }
    }
}

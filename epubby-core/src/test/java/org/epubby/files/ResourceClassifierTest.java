package org.epubby.files;

import org.epubby.TestEpubs;
import org.epubby.exception.FileError;
import org.epubby.exception.FileException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResourceClassifierTest {

    @TempDir
    Path tempDir;

    private EpubFileSystem fileSystem;
    private ResourceClassifier classifier;

    @BeforeEach
    void setUp() throws IOException {
        fileSystem = EpubFileSystem.mount(TestEpubs.writeEpub2(tempDir), false);
        classifier = fileSystem.getClassifier();
        Set<String> manifest = Set.of("/OEBPS/chapter1.xhtml", "/OEBPS/chapter2.xhtml", "/OEBPS/toc.ncx");
        classifier.bind("/OEBPS/content.opf", manifest::contains);
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    private EpubPath location(String path) throws FileException {
        return fileSystem.getPath(path).toRealLocation();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "/mimetype", "mimetype", "./mimetype", "/MIMETYPE", "/OEBPS/../mimetype",
            "/OEBPS/content.opf", "/oebps/Content.OPF", "OEBPS/./content.opf",
            "/META-INF/container.xml", "/meta-inf/CONTAINER.XML", "/META-INF/signatures.xml", "/META-INF/rights.xml"
    })
    void protectedFilesAreReadOnlyUnderAnySpelling(String path) throws FileException {
        assertTrue(classifier.isProtectedFile(location(path)));
        assertEquals(ResourceAccess.READ_ONLY, classifier.classifyFile(location(path)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"/", "/META-INF", "/meta-inf/", "/OEBPS", "/oebps/./"})
    void controlDirectoriesAreReadOnly(String path) throws FileException {
        assertEquals(ResourceAccess.READ_ONLY, classifier.classifyDirectory(location(path)));
    }

    @Test
    void manifestResourcesAreModifiable() throws FileException {
        assertEquals(ResourceAccess.MODIFIABLE, classifier.classifyFile(location("/OEBPS/chapter1.xhtml")));
        assertEquals(ResourceAccess.MODIFIABLE, classifier.classifyFile(location("OEBPS/text/../chapter2.xhtml")));
    }

    @Test
    void everythingElseIsUnprotected() throws FileException {
        assertEquals(ResourceAccess.UNPROTECTED, classifier.classifyFile(location("/OEBPS/styles/style.css")));
        assertEquals(ResourceAccess.UNPROTECTED, classifier.classifyFile(location("/META-INF/calibre_bookmarks.txt")));
        assertEquals(ResourceAccess.UNPROTECTED, classifier.classifyFile(location("/META-INF/sub/container.xml")));
        assertEquals(ResourceAccess.UNPROTECTED, classifier.classifyDirectory(location("/OEBPS/styles")));
    }

    @Test
    void deletingPackageDocumentIsRejected() throws FileException {
        FileResource opf = fileSystem.resolve("/OEBPS/content.opf").asFile();

        FileException e = assertThrows(FileException.class, opf::delete);
        assertEquals(FileError.NOT_DELETABLE, e.getError());
        assertTrue(fileSystem.resolve("/OEBPS/content.opf").isFile());
    }

    @Test
    void writingProtectedFileIsRejected() throws FileException {
        FileResource mimetype = fileSystem.resolve("./mimetype").asFile();

        FileException e = assertThrows(FileException.class, () -> mimetype.writeText("text/plain"));
        assertEquals(FileError.NOT_MODIFIABLE, e.getError());
    }

    @Test
    void deletingChapterIsAcceptedOnce() throws FileException {
        FileResource chapter = fileSystem.resolve("/OEBPS/chapter2.xhtml").asFile();

        assertTrue(chapter.isModifiable());
        assertFalse(chapter.isUnprotected());
        chapter.delete();

        assertTrue(fileSystem.resolve("/OEBPS/chapter2.xhtml").isNil());
        FileException e = assertThrows(FileException.class, chapter::delete);
        assertEquals(FileError.NO_SUCH_RESOURCE, e.getError());
    }

    @Test
    void rawStreamsNeedUnprotectedFiles() throws FileException {
        FileResource chapter = fileSystem.resolve("/OEBPS/chapter1.xhtml").asFile();

        FileException e = assertThrows(FileException.class, chapter::newOutputStream);
        assertEquals(FileError.NOT_MODIFIABLE, e.getError());
    }

    @Test
    void protectedDirectoryCanNotBeDeleted() throws FileException {
        DirectoryResource metaInf = fileSystem.resolve("/META-INF").asDirectory();

        FileException e = assertThrows(FileException.class, metaInf::deleteRecursively);
        assertEquals(FileError.NOT_DELETABLE, e.getError());
    }

    @Test
    void tiersIncludeLowerTiers() {
        assertTrue(ResourceAccess.UNPROTECTED.includes(ResourceAccess.READ_ONLY));
        assertTrue(ResourceAccess.MODIFIABLE.includes(ResourceAccess.DELETABLE));
        assertFalse(ResourceAccess.DELETABLE.includes(ResourceAccess.MODIFIABLE));
    }
}

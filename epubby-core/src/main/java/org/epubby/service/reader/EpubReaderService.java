package org.epubby.service.reader;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.epubby.config.EpubProperties;
import org.epubby.exception.DocumentReadException;
import org.epubby.exception.EpubReaderError;
import org.epubby.exception.EpubReaderException;
import org.epubby.exception.FileException;
import org.epubby.exception.ReadError;
import org.epubby.files.EpubFileSystem;
import org.epubby.files.Resource;
import org.epubby.files.ResourceClassifier;
import org.epubby.model.metainf.MetaInfContainer;
import org.epubby.model.metainf.MetaInfContainerXml;
import org.epubby.model.opf.ManifestItem;
import org.epubby.model.opf.PackageDocument;
import org.epubby.model.opf.PackageDocumentXml;
import org.epubby.model.opf.metadata.Opf3MetaConverters;
import org.epubby.model.toc.ManifestReferences;
import org.epubby.model.toc.NavigationDocument;
import org.epubby.model.toc.NavigationDocumentXhtml;
import org.epubby.model.toc.Ncx;
import org.epubby.model.toc.NcxXml;
import org.epubby.util.ArchiveUtils;
import org.epubby.util.HrefUtils;
import org.epubby.xml.XmlDocuments;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Opens EPUB files into {@link LoadedEpub}s. The file is checked with a plain zip reader first, then copied and
 * mounted as an {@link EpubFileSystem}. Failures of the bootstrap files, the container and the package document
 * abort; an unreadable NCX or navigation document is logged and left out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EpubReaderService {

    public static final String MIME_TYPE = "application/epub+zip";
    private static final String MIME_TYPE_ENTRY = "mimetype";

    private final EpubProperties properties;
    private final Opf3MetaConverters converters;

    public LoadedEpub open(Path file) throws EpubReaderException {
        if (!Files.isRegularFile(file)) {
            throw EpubReaderError.FAILED_TO_OPEN_FILE.createException(file, "not a regular file");
        }
        if (!ArchiveUtils.isZipArchive(file)) {
            throw EpubReaderError.NOT_A_ZIP_ARCHIVE.createException(file);
        }
        checkMimeType(file);

        EpubFileSystem fileSystem = mountWorkingCopy(file);
        try {
            LoadedEpub epub = load(file, fileSystem);
            log.info("Opened EPUB {} ({}) from '{}'", epub.getVersion(), epub.getFormat(), file);
            return epub;
        } catch (EpubReaderException | RuntimeException e) {
            IOUtils.closeQuietly(fileSystem, e::addSuppressed);
            throw e;
        }
    }

    /**
     * The {@code mimetype} entry has to exist and hold exactly {@value #MIME_TYPE}, a trailing line break is tolerated.
     */
    void checkMimeType(Path file) throws EpubReaderException {
        try (ZipFile zipFile = ZipFile.builder().setPath(file).get()) {
            ZipArchiveEntry entry = zipFile.getEntry(MIME_TYPE_ENTRY);
            if (entry == null) {
                throw EpubReaderError.MISSING_MIME_TYPE.createException(file);
            }
            if (entry.isDirectory()) {
                throw EpubReaderError.CORRUPT_MIME_TYPE.createException(file);
            }
            String content;
            try (InputStream stream = zipFile.getInputStream(entry)) {
                content = new String(stream.readAllBytes(), StandardCharsets.US_ASCII);
            }
            String trimmed = StringUtils.removeEnd(StringUtils.removeEnd(content, "\n"), "\r");
            if (!MIME_TYPE.equals(trimmed)) {
                throw EpubReaderError.MIME_TYPE_CONTENT_MISMATCH.createException(file, "'" + StringUtils.abbreviate(content, 64) + "'");
            }
        } catch (IOException e) {
            log.error("Failed to read the mimetype entry of '{}'", file, e);
            throw EpubReaderError.CORRUPT_MIME_TYPE.createException(file, e);
        }
    }

    private EpubFileSystem mountWorkingCopy(Path file) throws EpubReaderException {
        Path workingCopy = null;
        try {
            Files.createDirectories(properties.getWorkingDirectory());
            workingCopy = Files.createTempFile(properties.getWorkingDirectory(), "epubby-", ".epub");
            Files.copy(file, workingCopy, StandardCopyOption.REPLACE_EXISTING);
            return EpubFileSystem.mount(workingCopy, true);
        } catch (IOException e) {
            log.error("Failed to create a filesystem for '{}'", file, e);
            EpubReaderException failure = EpubReaderError.FAILED_TO_CREATE_FILE_SYSTEM.createException(file, e);
            if (workingCopy != null) {
                deleteWorkingCopy(workingCopy, failure);
            }
            throw failure;
        }
    }

    private static void deleteWorkingCopy(Path workingCopy, Exception failure) {
        try {
            Files.deleteIfExists(workingCopy);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private LoadedEpub load(Path file, EpubFileSystem fileSystem) throws EpubReaderException {
        try {
            Resource metaInf = fileSystem.resolve(ResourceClassifier.META_INF_PATH);
            if (!metaInf.isDirectory()) {
                throw EpubReaderError.MISSING_META_INF.createException(file);
            }
            Resource containerFile = fileSystem.resolve(MetaInfContainer.PATH);
            if (!containerFile.isFile()) {
                throw EpubReaderError.MISSING_META_INF_CONTAINER.createException(file);
            }
            MetaInfContainer container = readContainer(file, containerFile.asFile().readBytes());
            MetaInfContainer.RootFile rootFile = container.getOebpsRootFile();
            if (rootFile == null) {
                throw EpubReaderError.MISSING_OEBPS_ROOT_FILE_ELEMENT.createException(file);
            }

            String opfPath = HrefUtils.resolve("/", rootFile.getFullPath());
            Resource opfFile = opfPath == null ? null : fileSystem.resolve(opfPath);
            if (opfFile == null || !opfFile.isFile()) {
                throw EpubReaderError.MISSING_OPF_FILE.createException(file, rootFile.getFullPath());
            }
            PackageDocument packageDocument = readPackageDocument(file, opfPath, opfFile.asFile().readBytes());
            fileSystem.getClassifier().bind(opfPath, packageDocument.localResourceIndex(opfPath));

            String ncxPath = findNcxPath(packageDocument, opfPath);
            Ncx ncx = ncxPath == null ? null : readNcx(fileSystem, packageDocument, opfPath, ncxPath);
            String navigationPath = findNavigationDocumentPath(packageDocument, opfPath);
            NavigationDocument navigationDocument = navigationPath == null ? null
                    : readNavigationDocument(fileSystem, packageDocument, opfPath, navigationPath);
            return new LoadedEpub(file, fileSystem, container, packageDocument, opfPath,
                    ncx, ncx == null ? null : ncxPath,
                    navigationDocument, navigationDocument == null ? null : navigationPath);
        } catch (FileException e) {
            log.error("Failed to read '{}' inside '{}'", e.getPath(), file, e);
            throw EpubReaderError.FAILED_TO_OPEN_FILE.createException(file, e);
        }
    }

    private static MetaInfContainer readContainer(Path file, byte[] content) throws EpubReaderException {
        try {
            return MetaInfContainerXml.read(XmlDocuments.parse(content, MetaInfContainer.PATH));
        } catch (DocumentReadException e) {
            throw EpubReaderError.META_INF_ERROR.createException(file, e);
        }
    }

    private PackageDocument readPackageDocument(Path file, String opfPath, byte[] content) throws EpubReaderException {
        try {
            return PackageDocumentXml.read(XmlDocuments.parse(content, opfPath), converters);
        } catch (DocumentReadException e) {
            if (e.getError() == ReadError.INVALID_VERSION) {
                throw EpubReaderError.INVALID_VERSION.createException(file, e);
            }
            throw EpubReaderError.OPF_ERROR.createException(file, e);
        }
    }

    private static String findNcxPath(PackageDocument packageDocument, String opfPath) {
        String toc = packageDocument.getSpine().getToc();
        if (toc == null) {
            return null;
        }
        ManifestItem item = packageDocument.getManifest().getItem(toc);
        if (item == null) {
            log.warn("spine/@toc '{}' does not name a manifest item", toc);
            return null;
        }
        return HrefUtils.resolve(HrefUtils.directoryOf(opfPath), item.getHref());
    }

    private static String findNavigationDocumentPath(PackageDocument packageDocument, String opfPath) {
        if (!packageDocument.getFormat().isEpub3()) {
            return null;
        }
        List<ManifestItem> items = packageDocument.getManifest()
                .findItemsWithProperty("nav", packageDocument.getPropertyResolver());
        if (items.isEmpty()) {
            log.warn("EPUB 3 package has no manifest item with the 'nav' property");
            return null;
        }
        return HrefUtils.resolve(HrefUtils.directoryOf(opfPath), items.get(0).getHref());
    }

    private static Ncx readNcx(EpubFileSystem fileSystem, PackageDocument packageDocument, String opfPath, String ncxPath)
            throws FileException {
        Resource resource = fileSystem.resolve(ncxPath);
        if (!resource.isFile()) {
            log.warn("NCX file '{}' does not exist", ncxPath);
            return null;
        }
        try {
            ManifestReferences references = new ManifestReferences(packageDocument.getManifest(), opfPath, ncxPath);
            Ncx ncx = NcxXml.read(XmlDocuments.parse(resource.asFile().readBytes(), ncxPath), references);
            log.debug("Read NCX '{}' with {} top level entries", ncxPath, ncx.getNavMap().getNavPoints().size());
            return ncx;
        } catch (DocumentReadException e) {
            log.warn("Ignoring unreadable NCX '{}': {}", ncxPath, e.getMessage());
            return null;
        }
    }

    private static NavigationDocument readNavigationDocument(EpubFileSystem fileSystem, PackageDocument packageDocument,
                                                             String opfPath, String navigationPath) throws FileException {
        Resource resource = fileSystem.resolve(navigationPath);
        if (!resource.isFile()) {
            log.warn("Navigation document '{}' does not exist", navigationPath);
            return null;
        }
        try {
            ManifestReferences references = new ManifestReferences(packageDocument.getManifest(), opfPath, navigationPath);
            return NavigationDocumentXhtml.read(resource.asFile().readText(), references);
        } catch (DocumentReadException e) {
            log.warn("Ignoring unreadable navigation document '{}': {}", navigationPath, e.getMessage());
            return null;
        }
    }
}

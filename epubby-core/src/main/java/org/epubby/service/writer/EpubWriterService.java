package org.epubby.service.writer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.epubby.config.EpubProperties;
import org.epubby.exception.FileException;
import org.epubby.files.DirectoryResource;
import org.epubby.files.FileResource;
import org.epubby.files.ResourceClassifier;
import org.epubby.files.ResourceVisitor;
import org.epubby.model.metainf.MetaInfContainer;
import org.epubby.model.metainf.MetaInfContainerXml;
import org.epubby.model.opf.PackageDocumentXml;
import org.epubby.model.toc.NavigationDocumentXhtml;
import org.epubby.model.toc.NcxXml;
import org.epubby.service.reader.EpubReaderService;
import org.epubby.service.reader.LoadedEpub;
import org.epubby.xml.XmlDocuments;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;

/**
 * Saves {@link LoadedEpub}s as EPUB files. The container, package document, NCX and navigation document are
 * regenerated from their models, every other file is copied from the filesystem as is.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EpubWriterService {

    private static final String MIME_TYPE_ENTRY = "mimetype";

    private final EpubProperties properties;

    public void save(LoadedEpub epub, Path target) throws IOException, FileException {
        SortedMap<String, EntrySource> entries = collectEntries(epub);
        Path absoluteTarget = target.toAbsolutePath();
        Path directory = absoluteTarget.getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, ".epubby-", ".tmp");
        try {
            writeArchive(temp, entries);
            replaceFile(temp, absoluteTarget);
        } catch (IOException | FileException | RuntimeException e) {
            log.error("Failed to save EPUB to '{}'", target, e);
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        log.info("Saved EPUB {} to '{}' ({} entries)", epub.getVersion(), target, entries.size() + 1);
    }

    /**
     * Entries of the archive by name, without the {@code mimetype} entry.
     */
    SortedMap<String, EntrySource> collectEntries(LoadedEpub epub) throws FileException {
        Map<String, byte[]> documents = new LinkedHashMap<>();
        documents.put(MetaInfContainer.PATH, XmlDocuments.toBytes(MetaInfContainerXml.write(epub.getContainer())));
        documents.put(epub.getOpfPath(), XmlDocuments.toBytes(
                PackageDocumentXml.write(epub.getPackageDocument(), properties.isOmitLegacyFeatures())));
        if (epub.getNcx() != null) {
            documents.put(epub.getNcxPath(), XmlDocuments.toBytes(NcxXml.write(epub.getNcx())));
        }
        if (epub.getNavigationDocument() != null) {
            documents.put(epub.getNavigationDocumentPath(),
                    NavigationDocumentXhtml.write(epub.getNavigationDocument()).getBytes(StandardCharsets.UTF_8));
        }

        SortedMap<String, EntrySource> entries = new TreeMap<>();
        DirectoryResource root = epub.getFileSystem().getRootDirectory();
        root.walk(new ResourceVisitor() {
            @Override
            public FileVisitResult visitFile(FileResource file) {
                String path = file.getPath().toString();
                if (!path.equals(ResourceClassifier.MIME_TYPE_PATH)) {
                    entries.put(entryName(path), file::readBytes);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        documents.forEach((path, bytes) -> entries.put(entryName(path), () -> bytes));
        return entries;
    }

    private void writeArchive(Path archive, SortedMap<String, EntrySource> entries) throws IOException, FileException {
        try (ZipArchiveOutputStream output = new ZipArchiveOutputStream(archive)) {
            output.setLevel(properties.getCompressionLevel());
            writeMimeType(output);
            for (Map.Entry<String, EntrySource> entry : entries.entrySet()) {
                ZipArchiveEntry zipEntry = new ZipArchiveEntry(entry.getKey());
                zipEntry.setMethod(ZipEntry.DEFLATED);
                output.putArchiveEntry(zipEntry);
                output.write(entry.getValue().read());
                output.closeArchiveEntry();
            }
            output.finish();
        }
    }

    /**
     * The {@code mimetype} entry comes first and uncompressed, so readers can sniff the format at a fixed offset.
     */
    private static void writeMimeType(ZipArchiveOutputStream output) throws IOException {
        byte[] content = EpubReaderService.MIME_TYPE.getBytes(StandardCharsets.US_ASCII);
        CRC32 crc = new CRC32();
        crc.update(content);
        ZipArchiveEntry entry = new ZipArchiveEntry(MIME_TYPE_ENTRY);
        entry.setMethod(ZipEntry.STORED);
        entry.setSize(content.length);
        entry.setCompressedSize(content.length);
        entry.setCrc(crc.getValue());
        output.putArchiveEntry(entry);
        output.write(content);
        output.closeArchiveEntry();
    }

    private static String entryName(String absolutePath) {
        return absolutePath.startsWith("/") ? absolutePath.substring(1) : absolutePath;
    }

    private static void replaceFile(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move to '{}' not supported, falling back to a plain move", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @FunctionalInterface
    interface EntrySource {
        byte[] read() throws FileException;
    }
}

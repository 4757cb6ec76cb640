package org.epubby.service.reader;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.epubby.exception.FileException;
import org.epubby.files.EpubFileSystem;
import org.epubby.files.FileResource;
import org.epubby.model.metainf.MetaInfContainer;
import org.epubby.model.opf.PackageDocument;
import org.epubby.model.toc.NavigationDocument;
import org.epubby.model.toc.Ncx;
import org.epubby.version.EpubFormat;
import org.epubby.version.EpubVersion;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

/**
 * An opened EPUB: its models and the filesystem holding its resources. Closing releases the filesystem and its
 * working copy, the source file is never touched.
 */
@Slf4j
@Getter
public class LoadedEpub implements Closeable {

    private final Path source;
    private final EpubFileSystem fileSystem;
    private final MetaInfContainer container;
    private final PackageDocument packageDocument;
    /**
     * Absolute archive path of the package document.
     */
    private final String opfPath;
    private final Ncx ncx;
    private final String ncxPath;
    private final NavigationDocument navigationDocument;
    private final String navigationDocumentPath;

    LoadedEpub(Path source, EpubFileSystem fileSystem, MetaInfContainer container, PackageDocument packageDocument,
               String opfPath, Ncx ncx, String ncxPath, NavigationDocument navigationDocument, String navigationDocumentPath) {
        this.source = source;
        this.fileSystem = fileSystem;
        this.container = container;
        this.packageDocument = packageDocument;
        this.opfPath = opfPath;
        this.ncx = ncx;
        this.ncxPath = ncxPath;
        this.navigationDocument = navigationDocument;
        this.navigationDocumentPath = navigationDocumentPath;
    }

    public EpubVersion getVersion() {
        return packageDocument.getVersion();
    }

    public EpubFormat getFormat() {
        return packageDocument.getFormat();
    }

    public FileResource getOpfFile() throws FileException {
        return fileSystem.resolve(opfPath).asFile();
    }

    @Override
    public void close() throws IOException {
        log.debug("Closing EPUB loaded from '{}'", source);
        fileSystem.close();
    }
}

package org.epubby.files;

import lombok.extern.slf4j.Slf4j;
import org.epubby.exception.FileError;
import org.epubby.exception.FileException;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * The archive of one loaded EPUB, mounted as a zip filesystem over a working copy.
 * <p>
 * Closing is terminal: every {@link EpubPath} and {@link Resource} derived from this instance fails with
 * {@link FileError#FILESYSTEM_CLOSED} afterwards.
 */
@Slf4j
public class EpubFileSystem implements Closeable {

    private final FileSystem delegate;
    private final Path archive;
    private final boolean deleteArchiveOnClose;
    private final ResourceClassifier classifier = new ResourceClassifier();
    private final EpubPath root;

    EpubFileSystem(FileSystem delegate, Path archive, boolean deleteArchiveOnClose) {
        this.delegate = delegate;
        this.archive = archive;
        this.deleteArchiveOnClose = deleteArchiveOnClose;
        this.root = new EpubPath(delegate.getPath("/"), this);
    }

    /**
     * Mounts {@code archive}. Changes made through the returned filesystem are written into {@code archive}.
     *
     * @param deleteArchiveOnClose whether {@code archive} is a working copy owned by the filesystem
     */
    public static EpubFileSystem mount(Path archive, boolean deleteArchiveOnClose) throws IOException {
        FileSystem zip = FileSystems.newFileSystem(archive, Map.of());
        log.debug("Mounted '{}' as a zip filesystem", archive);
        return new EpubFileSystem(zip, archive, deleteArchiveOnClose);
    }

    /**
     * Mounts a new, empty archive at {@code archive}, which must not exist yet.
     */
    public static EpubFileSystem create(Path archive) throws IOException {
        if (Files.exists(archive)) {
            throw new FileAlreadyExistsException(archive.toString());
        }
        FileSystem zip = FileSystems.newFileSystem(archive, Map.of("create", "true"));
        return new EpubFileSystem(zip, archive, false);
    }

    public Path getArchive() {
        return archive;
    }

    public ResourceClassifier getClassifier() {
        return classifier;
    }

    public EpubPath getRoot() {
        return root;
    }

    public EpubPath getPath(String first, String... more) {
        return new EpubPath(delegate.getPath(first, more), this);
    }

    public Resource resolve(String first, String... more) throws FileException {
        return getPath(first, more).getResource();
    }

    public DirectoryResource getRootDirectory() throws FileException {
        return root.getResource().asDirectory();
    }

    /**
     * Copies a file of the host filesystem into {@code target}, keeping its name.
     */
    public FileResource importFile(Path hostFile, DirectoryResource target) throws FileException {
        EpubPath destination = importTarget(hostFile.getFileName().toString(), target);
        IoCalls.run(destination, () -> Files.copy(hostFile, destination.getDelegate()));
        log.debug("Imported '{}' as '{}'", hostFile, destination);
        return destination.getResource().asFile();
    }

    /**
     * Copies the remaining bytes of {@code stream} into a new file {@code fileName} inside {@code target}. The stream is
     * not closed.
     */
    public FileResource importStream(InputStream stream, String fileName, DirectoryResource target) throws FileException {
        EpubPath destination = importTarget(fileName, target);
        IoCalls.run(destination, () -> Files.copy(stream, destination.getDelegate()));
        log.debug("Imported stream as '{}'", destination);
        return destination.getResource().asFile();
    }

    private EpubPath importTarget(String fileName, DirectoryResource target) throws FileException {
        ensureOwned(target.getPath());
        Resource existing = target.resolve(fileName);
        if (!existing.isNil()) {
            throw FileError.RESOURCE_ALREADY_EXISTS.createException(existing.getPath().toString());
        }
        if (!existing.getPath().startsWith(target.getPath())) {
            throw FileError.PATH_OUTSIDE_ROOT.createException(existing.getPath().toString());
        }
        return existing.getPath();
    }

    public boolean isOpen() {
        return delegate.isOpen();
    }

    void ensureOpen(EpubPath path) throws FileException {
        if (!delegate.isOpen()) {
            throw FileError.FILESYSTEM_CLOSED.createException(path.toString());
        }
    }

    void ensureOwned(EpubPath path) {
        if (path.getFileSystem() != this) {
            throw new IllegalArgumentException("Path '" + path + "' belongs to a different EPUB filesystem");
        }
    }

    /**
     * Flushes pending changes into the archive by closing the zip filesystem, then removes a working copy.
     */
    @Override
    public void close() throws IOException {
        if (!delegate.isOpen()) {
            return;
        }
        delegate.close();
        log.debug("Unmounted '{}'", archive);
        if (deleteArchiveOnClose) {
            Files.deleteIfExists(archive);
        }
    }
}

package org.epubby.files;

import org.epubby.exception.FileError;
import org.epubby.exception.FileException;

import java.nio.file.ClosedFileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * Immutable path inside one {@link EpubFileSystem}. Paths of different filesystem instances never mix.
 */
public final class EpubPath implements Comparable<EpubPath>, Iterable<EpubPath> {

    private final Path delegate;
    private final EpubFileSystem fileSystem;

    EpubPath(Path delegate, EpubFileSystem fileSystem) {
        this.delegate = delegate;
        this.fileSystem = fileSystem;
    }

    Path getDelegate() {
        return delegate;
    }

    public EpubFileSystem getFileSystem() {
        return fileSystem;
    }

    /**
     * Returns the parent of this path, or {@code null} if it has none.
     */
    public EpubPath getParent() {
        Path parent = delegate.getParent();
        return parent == null ? null : wrap(parent);
    }

    /**
     * Name of the last segment, or an empty string for the root.
     */
    public String getName() {
        Path fileName = delegate.getFileName();
        return fileName == null ? "" : fileName.toString();
    }

    public EpubPath getFileName() {
        Path fileName = delegate.getFileName();
        return fileName == null ? null : wrap(fileName);
    }

    public int getNameCount() {
        return delegate.getNameCount();
    }

    public EpubPath getName(int index) {
        return wrap(delegate.getName(index));
    }

    public boolean isAbsolute() {
        return delegate.isAbsolute();
    }

    public EpubPath resolve(String other) {
        return wrap(delegate.resolve(other));
    }

    public EpubPath resolve(EpubPath other) {
        return wrap(delegate.resolve(ownDelegate(other)));
    }

    public EpubPath resolveSibling(String other) {
        return wrap(delegate.resolveSibling(other));
    }

    public EpubPath relativize(EpubPath other) {
        return wrap(delegate.relativize(ownDelegate(other)));
    }

    public boolean startsWith(EpubPath other) {
        return delegate.startsWith(ownDelegate(other));
    }

    public boolean endsWith(EpubPath other) {
        return delegate.endsWith(ownDelegate(other));
    }

    public EpubPath toAbsolutePath() {
        return isAbsolute() ? this : wrap(delegate.toAbsolutePath());
    }

    public EpubPath normalize() {
        return wrap(delegate.normalize());
    }

    /**
     * @throws FileException with {@link FileError#FILESYSTEM_CLOSED} once the filesystem is closed
     */
    public boolean exists() throws FileException {
        fileSystem.ensureOpen(this);
        try {
            return Files.exists(delegate, LinkOption.NOFOLLOW_LINKS);
        } catch (ClosedFileSystemException e) {
            throw FileError.fromClosedFileSystem(toString(), e);
        }
    }

    public boolean notExists() throws FileException {
        return !exists();
    }

    /**
     * Returns the absolute, normalized form of this path.
     *
     * @throws FileException with {@link FileError#PATH_OUTSIDE_ROOT} if a {@code ..} segment climbs above the root
     */
    public EpubPath toRealLocation() throws FileException {
        Path absolute = delegate.toAbsolutePath();
        int depth = 0;
        for (Path segment : absolute) {
            String name = segment.toString();
            if ("..".equals(name)) {
                depth--;
                if (depth < 0) {
                    throw FileError.PATH_OUTSIDE_ROOT.createException(toString());
                }
            } else if (!".".equals(name) && !name.isEmpty()) {
                depth++;
            }
        }
        return wrap(absolute.normalize());
    }

    /**
     * Resolves what currently exists at this path. Nothing is cached, every call looks at the archive again.
     *
     * @throws IllegalStateException if the archive contains a symbolic link or an unknown node type at this path
     */
    public Resource getResource() throws FileException {
        fileSystem.ensureOpen(this);
        EpubPath location = toRealLocation();
        Path path = location.delegate;
        try {
            if (Files.notExists(path, LinkOption.NOFOLLOW_LINKS)) {
                return new NilResource(location);
            }
            if (Files.isSymbolicLink(path)) {
                throw new IllegalStateException("Symbolic link encountered at '" + location
                        + "', symbolic links are not allowed in EPUB archives, the archive may be corrupt");
            }
            if (Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)) {
                return new FileResource(location, fileSystem.getClassifier().classifyFile(location));
            }
            if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
                return new DirectoryResource(location, fileSystem.getClassifier().classifyDirectory(location));
            }
        } catch (ClosedFileSystemException e) {
            throw FileError.fromClosedFileSystem(toString(), e);
        }
        throw new IllegalStateException("Entry at '" + location + "' exists but is neither a file nor a directory");
    }

    private Path ownDelegate(EpubPath other) {
        fileSystem.ensureOwned(other);
        return other.delegate;
    }

    private EpubPath wrap(Path path) {
        return new EpubPath(path, fileSystem);
    }

    @Override
    public Iterator<EpubPath> iterator() {
        Iterator<Path> iterator = delegate.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return iterator.hasNext();
            }

            @Override
            public EpubPath next() {
                return wrap(iterator.next());
            }
        };
    }

    @Override
    public int compareTo(EpubPath other) {
        return delegate.compareTo(ownDelegate(other));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EpubPath other)) {
            return false;
        }
        return fileSystem == other.fileSystem && delegate.equals(other.delegate);
    }

    @Override
    public int hashCode() {
        return delegate.hashCode();
    }

    @Override
    public String toString() {
        return delegate.toString();
    }
}

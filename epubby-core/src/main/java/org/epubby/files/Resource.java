package org.epubby.files;

import org.epubby.exception.FileError;
import org.epubby.exception.FileException;

/**
 * What exists at an {@link EpubPath} at the moment it was resolved: a {@link NilResource}, a {@link FileResource} or a
 * {@link DirectoryResource}.
 * <p>
 * Handles are snapshots. After a mutating operation elsewhere in the tree a handle may be stale, call
 * {@link #refresh()} to resolve the path again.
 */
public abstract class Resource {

    protected final EpubPath path;

    Resource(EpubPath path) {
        this.path = path;
    }

    public EpubPath getPath() {
        return path;
    }

    public EpubFileSystem getFileSystem() {
        return path.getFileSystem();
    }

    public String getName() {
        return path.getName();
    }

    public abstract ResourceKind getKind();

    public boolean isNil() {
        return getKind() == ResourceKind.NIL;
    }

    public boolean isFile() {
        return getKind() == ResourceKind.FILE;
    }

    public boolean isDirectory() {
        return getKind() == ResourceKind.DIRECTORY;
    }

    public FileResource asFile() throws FileException {
        if (this instanceof FileResource file) {
            return file;
        }
        throw (isNil() ? FileError.NO_SUCH_RESOURCE : FileError.NOT_FILE).createException(path.toString());
    }

    public DirectoryResource asDirectory() throws FileException {
        if (this instanceof DirectoryResource directory) {
            return directory;
        }
        throw (isNil() ? FileError.NO_SUCH_RESOURCE : FileError.NOT_DIRECTORY).createException(path.toString());
    }

    public Resource refresh() throws FileException {
        return path.getResource();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + path + ")";
    }
}

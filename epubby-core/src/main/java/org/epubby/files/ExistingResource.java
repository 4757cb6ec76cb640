package org.epubby.files;

import org.epubby.exception.FileError;
import org.epubby.exception.FileException;

import java.nio.file.Files;
import java.nio.file.attribute.FileTime;

/**
 * A file or directory that existed when it was resolved, tagged with the {@link ResourceAccess} its path is
 * classified as. Operations above the tier fail with {@link FileError#NOT_MODIFIABLE} or
 * {@link FileError#NOT_DELETABLE}.
 */
public abstract class ExistingResource extends Resource {

    protected final ResourceAccess access;

    ExistingResource(EpubPath path, ResourceAccess access) {
        super(path);
        this.access = access;
    }

    public ResourceAccess getAccess() {
        return access;
    }

    public boolean isDeletable() {
        return access.includes(ResourceAccess.DELETABLE);
    }

    public boolean isModifiable() {
        return access.includes(ResourceAccess.MODIFIABLE);
    }

    public boolean isUnprotected() {
        return access.includes(ResourceAccess.UNPROTECTED);
    }

    /**
     * Fails unless this resource grants {@code required}. Never widens the classified tier.
     */
    public void requireAccess(ResourceAccess required) throws FileException {
        if (access.includes(required)) {
            return;
        }
        FileError error = required == ResourceAccess.DELETABLE ? FileError.NOT_DELETABLE : FileError.NOT_MODIFIABLE;
        throw error.createException(path.toString());
    }

    public DirectoryResource getParent() throws FileException {
        EpubPath parent = path.getParent();
        if (parent == null) {
            throw FileError.NO_SUCH_RESOURCE.createException(path + "/..");
        }
        return parent.getResource().asDirectory();
    }

    public FileTime getLastModifiedTime() throws FileException {
        return IoCalls.call(path, () -> Files.getLastModifiedTime(path.getDelegate()));
    }

    public ExistingResource setLastModifiedTime(FileTime time) throws FileException {
        requireAccess(ResourceAccess.MODIFIABLE);
        IoCalls.run(path, () -> Files.setLastModifiedTime(path.getDelegate(), time));
        return this;
    }

    public boolean isSameAs(Resource other) throws FileException {
        if (other.getFileSystem() != getFileSystem()) {
            return false;
        }
        if (other.isNil()) {
            return false;
        }
        return IoCalls.call(path, () -> Files.isSameFile(path.getDelegate(), other.getPath().getDelegate()));
    }

    public abstract boolean isEmpty() throws FileException;

    /**
     * Deletes this node. A second delete of the same handle fails with {@link FileError#NO_SUCH_RESOURCE}.
     */
    public NilResource delete() throws FileException {
        requireAccess(ResourceAccess.DELETABLE);
        IoCalls.run(path, () -> Files.delete(path.getDelegate()));
        return new NilResource(path);
    }

    /**
     * Renames this node inside its current directory.
     */
    public abstract ExistingResource renameTo(String name, boolean overwrite) throws FileException;

    /**
     * Moves this node onto {@code target}. A {@link NilResource} target is created, a target of the other kind is a
     * structural mismatch.
     */
    public abstract ExistingResource moveTo(Resource target) throws FileException;

    /**
     * Checks that {@code target} may receive content before anything is written.
     */
    static void requireWritableTarget(Resource target) throws FileException {
        if (target instanceof ExistingResource existing) {
            existing.requireAccess(ResourceAccess.MODIFIABLE);
        }
    }
}

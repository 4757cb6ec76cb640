package org.epubby.files;

import org.epubby.exception.FileError;
import org.epubby.exception.FileException;

import java.math.BigInteger;
import java.nio.file.CopyOption;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;

public final class DirectoryResource extends ExistingResource {

    DirectoryResource(EpubPath path, ResourceAccess access) {
        super(path, access);
    }

    @Override
    public ResourceKind getKind() {
        return ResourceKind.DIRECTORY;
    }

    public Resource resolve(String name) throws FileException {
        return path.resolve(name).getResource();
    }

    public FileResource createFile(String name) throws FileException {
        Resource resource = resolve(name);
        if (!(resource instanceof NilResource nil)) {
            throw FileError.RESOURCE_ALREADY_EXISTS.createException(resource.getPath().toString());
        }
        return nil.createFile();
    }

    public DirectoryResource createDirectory(String name) throws FileException {
        Resource resource = resolve(name);
        if (!(resource instanceof NilResource nil)) {
            throw FileError.RESOURCE_ALREADY_EXISTS.createException(resource.getPath().toString());
        }
        return nil.createDirectory();
    }

    /**
     * Direct children in path order.
     */
    public List<EpubPath> listPaths() throws FileException {
        return IoCalls.call(path, () -> {
            List<EpubPath> children = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(path.getDelegate())) {
                for (Path child : stream) {
                    children.add(new EpubPath(child, getFileSystem()));
                }
            }
            children.sort(null);
            return children;
        });
    }

    public List<Resource> entries() throws FileException {
        List<Resource> entries = new ArrayList<>();
        for (EpubPath child : listPaths()) {
            entries.add(child.getResource());
        }
        return entries;
    }

    @Override
    public boolean isEmpty() throws FileException {
        return IoCalls.call(path, () -> {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(path.getDelegate())) {
                return !stream.iterator().hasNext();
            }
        });
    }

    public void walk(ResourceVisitor visitor) throws FileException {
        ResourceWalker.walk(this, visitor);
    }

    /**
     * Files below this directory whose path relative to it matches the glob {@code pattern}.
     */
    public List<FileResource> glob(String pattern) throws FileException {
        PathMatcher matcher;
        try {
            matcher = path.getDelegate().getFileSystem().getPathMatcher("glob:" + pattern);
        } catch (IllegalArgumentException e) {
            throw FileError.INVALID_GLOB_PATTERN.createException(pattern, e);
        }
        List<FileResource> matches = new ArrayList<>();
        walk(new ResourceVisitor() {
            @Override
            public FileVisitResult visitFile(FileResource file) {
                if (matcher.matches(path.getDelegate().relativize(file.getPath().getDelegate()))) {
                    matches.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        return matches;
    }

    /**
     * Sum of the sizes of all files below this directory.
     *
     * @throws ArithmeticException if the sum does not fit a {@code long}, use {@link #calculateLargeSize()} then
     */
    public long calculateSize() throws FileException {
        SizeCalculator calculator = new SizeCalculator();
        walk(calculator);
        return calculator.getTotal().longValueExact();
    }

    public BigInteger calculateLargeSize() throws FileException {
        SizeCalculator calculator = new SizeCalculator();
        walk(calculator);
        return calculator.getTotal();
    }

    /**
     * Copies everything below this directory into {@code target}, keeping the relative layout. A file where a directory
     * is needed, or the reverse, aborts the copy with the offending target path.
     */
    public DirectoryResource copyEntriesTo(DirectoryResource target, CopyOption... options) throws FileException {
        requireOutsideSubtree(target);
        walk(new EntriesCopier(this, target, options));
        return target;
    }

    /**
     * Moves this directory onto {@code target}: a {@link NilResource} is created, an existing directory is merged into.
     * Every node below this directory is checked to be deletable before anything is created or copied.
     */
    public DirectoryResource moveRecursivelyTo(Resource target, CopyOption... options) throws FileException {
        requireAccess(ResourceAccess.MODIFIABLE);
        requireOutsideSubtree(target);
        walk(new DeletionChecker());
        DirectoryResource destination = switch (target.getKind()) {
            case NIL -> ((NilResource) target).createDirectory();
            case DIRECTORY -> (DirectoryResource) target;
            case FILE -> throw FileError.NOT_DIRECTORY.createException(target.getPath().toString(), path.toString());
        };
        copyEntriesTo(destination, options);
        deleteRecursively();
        return destination;
    }

    @Override
    public DirectoryResource moveTo(Resource target) throws FileException {
        requireAccess(ResourceAccess.MODIFIABLE);
        if (target.isDirectory()) {
            throw FileError.RESOURCE_ALREADY_EXISTS.createException(target.getPath().toString(), path.toString());
        }
        return moveRecursivelyTo(target);
    }

    @Override
    public DirectoryResource renameTo(String name, boolean overwrite) throws FileException {
        requireAccess(ResourceAccess.MODIFIABLE);
        Resource target = path.resolveSibling(name).getResource();
        if (target.isDirectory() && overwrite) {
            return moveRecursivelyTo(target);
        }
        return moveTo(target);
    }

    /**
     * Deletes files before the directories containing them. Nothing is deleted if any node below this directory may
     * not be deleted, the error names the first such node.
     */
    public NilResource deleteRecursively() throws FileException {
        requireAccess(ResourceAccess.DELETABLE);
        walk(new DeletionChecker());
        walk(new ResourceDeleter());
        return new NilResource(path);
    }

    private void requireOutsideSubtree(Resource target) {
        getFileSystem().ensureOwned(target.getPath());
        if (target.getPath().startsWith(path)) {
            throw new IllegalArgumentException("'" + path + "' can not be copied into its own subtree '" + target.getPath() + "'");
        }
    }
}

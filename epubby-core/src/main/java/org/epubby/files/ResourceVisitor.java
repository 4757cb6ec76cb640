package org.epubby.files;

import org.epubby.exception.FileException;

import java.nio.file.FileVisitResult;

/**
 * Callbacks of {@link DirectoryResource#walk(ResourceVisitor)}. Every callback continues by default, throwing a
 * {@link FileException} stops the walk and surfaces that failure to the caller of {@code walk}.
 */
public interface ResourceVisitor {

    default FileVisitResult preVisitDirectory(DirectoryResource directory) throws FileException {
        return FileVisitResult.CONTINUE;
    }

    default FileVisitResult visitFile(FileResource file) throws FileException {
        return FileVisitResult.CONTINUE;
    }

    default FileVisitResult visitFileFailed(EpubPath path, FileException error) throws FileException {
        throw error;
    }

    /**
     * @param error failure while listing the directory, or {@code null}
     */
    default FileVisitResult postVisitDirectory(DirectoryResource directory, FileException error) throws FileException {
        if (error != null) {
            throw error;
        }
        return FileVisitResult.CONTINUE;
    }

    /**
     * Invoked for entries that vanished between being listed and being visited.
     */
    default FileVisitResult visitNil(NilResource nil, WalkStage stage) throws FileException {
        return FileVisitResult.CONTINUE;
    }
}

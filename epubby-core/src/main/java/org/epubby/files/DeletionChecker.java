package org.epubby.files;

import org.epubby.exception.FileException;

import java.nio.file.FileVisitResult;

/**
 * Read-only pass ahead of a recursive delete or move. Fails on the first node, in walk order, that is not deletable.
 */
class DeletionChecker implements ResourceVisitor {

    @Override
    public FileVisitResult preVisitDirectory(DirectoryResource directory) throws FileException {
        directory.requireAccess(ResourceAccess.DELETABLE);
        return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFile(FileResource file) throws FileException {
        file.requireAccess(ResourceAccess.DELETABLE);
        return FileVisitResult.CONTINUE;
    }
}

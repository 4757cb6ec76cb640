package org.epubby.files;

import org.epubby.exception.FileException;

import java.nio.file.FileVisitResult;

class ResourceDeleter implements ResourceVisitor {

    @Override
    public FileVisitResult visitFile(FileResource file) throws FileException {
        file.delete();
        return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult postVisitDirectory(DirectoryResource directory, FileException error) throws FileException {
        if (error != null) {
            throw error;
        }
        directory.delete();
        return FileVisitResult.CONTINUE;
    }
}

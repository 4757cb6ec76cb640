package org.epubby.files;

import org.epubby.exception.FileError;
import org.epubby.exception.FileException;

import java.nio.file.CopyOption;
import java.nio.file.FileVisitResult;

class EntriesCopier implements ResourceVisitor {

    private final DirectoryResource source;
    private final DirectoryResource target;
    private final CopyOption[] options;

    EntriesCopier(DirectoryResource source, DirectoryResource target, CopyOption[] options) {
        this.source = source;
        this.target = target;
        this.options = options;
    }

    @Override
    public FileVisitResult preVisitDirectory(DirectoryResource directory) throws FileException {
        Resource resource = counterpartOf(directory);
        if (resource.isFile()) {
            throw FileError.NOT_DIRECTORY.createException(resource.getPath().toString(), directory.getPath().toString());
        }
        if (resource instanceof NilResource nil) {
            nil.createDirectory();
        }
        return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFile(FileResource file) throws FileException {
        Resource resource = counterpartOf(file);
        if (resource.isDirectory()) {
            throw FileError.NOT_FILE.createException(resource.getPath().toString(), file.getPath().toString());
        }
        file.copyTo(resource, options);
        return FileVisitResult.CONTINUE;
    }

    private Resource counterpartOf(Resource resource) throws FileException {
        EpubPath relative = source.getPath().relativize(resource.getPath());
        return target.getPath().resolve(relative).getResource();
    }
}

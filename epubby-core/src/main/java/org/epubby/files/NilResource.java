package org.epubby.files;

import org.epubby.exception.FileException;

import java.nio.file.Files;
import java.nio.file.StandardOpenOption;

/**
 * Nothing exists at the path. Creating a node here is the only thing that can be done with it.
 */
public final class NilResource extends Resource {

    NilResource(EpubPath path) {
        super(path);
    }

    @Override
    public ResourceKind getKind() {
        return ResourceKind.NIL;
    }

    public FileResource createFile() throws FileException {
        IoCalls.run(path, () -> Files.createFile(path.getDelegate()));
        return path.getResource().asFile();
    }

    public FileResource createFile(byte[] content) throws FileException {
        IoCalls.run(path, () -> Files.write(path.getDelegate(), content, StandardOpenOption.CREATE_NEW));
        return path.getResource().asFile();
    }

    public DirectoryResource createDirectory() throws FileException {
        IoCalls.run(path, () -> Files.createDirectory(path.getDelegate()));
        return path.getResource().asDirectory();
    }

    public DirectoryResource createDirectories() throws FileException {
        IoCalls.run(path, () -> Files.createDirectories(path.getDelegate()));
        return path.getResource().asDirectory();
    }
}

package org.epubby.exception;

import lombok.Getter;

import java.io.IOException;
import java.nio.file.ClosedFileSystemException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;

@Getter
public enum FileError {
    NO_SUCH_RESOURCE("No resource exists at '%s'"),
    DIRECTORY_NOT_EMPTY("Directory '%s' is not empty"),
    RESOURCE_ALREADY_EXISTS("A resource already exists at '%s'"),
    NOT_FILE("Resource at '%s' is not a file"),
    NOT_DIRECTORY("Resource at '%s' is not a directory"),
    NOT_MODIFIABLE("Resource at '%s' is protected and can not be modified"),
    NOT_DELETABLE("Resource at '%s' is protected and can not be deleted"),
    INVALID_GLOB_PATTERN("Invalid glob pattern '%s'"),
    PATH_OUTSIDE_ROOT("Path '%s' points outside of the archive root"),
    FILESYSTEM_CLOSED("Filesystem backing '%s' has been closed"),
    UNKNOWN("I/O failure at '%s'");

    private final String template;

    FileError(String template) {
        this.template = template;
    }

    public FileException createException(String path) {
        return new FileException(this, path, null, String.format(template, path), null);
    }

    public FileException createException(String path, Throwable cause) {
        String message = String.format(template, path);
        if (cause != null && cause.getMessage() != null) {
            message = message + ": " + cause.getMessage();
        }
        return new FileException(this, path, null, message, cause);
    }

    public FileException createException(String path, String otherPath) {
        String message = String.format(template, path) + " (while processing '" + otherPath + "')";
        return new FileException(this, path, otherPath, message, null);
    }

    public static FileException fromIOException(String path, IOException e) {
        if (e instanceof NoSuchFileException) {
            return NO_SUCH_RESOURCE.createException(path, e);
        }
        if (e instanceof DirectoryNotEmptyException) {
            return DIRECTORY_NOT_EMPTY.createException(path, e);
        }
        if (e instanceof FileAlreadyExistsException existsException) {
            String other = existsException.getOtherFile();
            return other != null
                    ? new FileException(RESOURCE_ALREADY_EXISTS, existsException.getFile(), other,
                    String.format(RESOURCE_ALREADY_EXISTS.template, existsException.getFile()), e)
                    : RESOURCE_ALREADY_EXISTS.createException(path, e);
        }
        if (e instanceof NotDirectoryException) {
            return NOT_DIRECTORY.createException(path, e);
        }
        return UNKNOWN.createException(path, e);
    }

    public static FileException fromClosedFileSystem(String path, ClosedFileSystemException e) {
        return FILESYSTEM_CLOSED.createException(path, e);
    }
}

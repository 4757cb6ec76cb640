package org.epubby.exception;

import lombok.Getter;

/**
 * Failure of an operation on the virtual EPUB filesystem. Callers branch on {@link #getError()}.
 */
@Getter
public class FileException extends Exception {

    private final FileError error;
    private final String path;
    private final String otherPath;

    public FileException(FileError error, String path, String otherPath, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.path = path;
        this.otherPath = otherPath;
    }
}

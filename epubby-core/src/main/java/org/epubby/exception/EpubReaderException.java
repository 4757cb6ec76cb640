package org.epubby.exception;

import lombok.Getter;

@Getter
public class EpubReaderException extends Exception {

    private final EpubReaderError error;

    public EpubReaderException(EpubReaderError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }
}

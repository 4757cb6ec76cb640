package org.epubby.version;

import lombok.Getter;

@Getter
public class EpubVersionException extends Exception {

    public enum Reason {
        NO_VERSION,
        MISSING_SEPARATOR,
        TOO_MANY_SEPARATORS,
        INVALID_NUMBER,
        WITHDRAWN_VERSION
    }

    private final Reason reason;
    private final String input;

    public EpubVersionException(Reason reason, String input, String message) {
        super(message);
        this.reason = reason;
        this.input = input;
    }
}

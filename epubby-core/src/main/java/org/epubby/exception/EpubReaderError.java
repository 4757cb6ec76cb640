package org.epubby.exception;

import lombok.Getter;

@Getter
public enum EpubReaderError {
    FAILED_TO_OPEN_FILE("Failed to open file '%s'"),
    NOT_A_ZIP_ARCHIVE("File '%s' is not a zip archive"),
    MISSING_MIME_TYPE("Missing 'mimetype' file in '%s'"),
    CORRUPT_MIME_TYPE("The 'mimetype' entry of '%s' is not a readable file"),
    MIME_TYPE_CONTENT_MISMATCH("The 'mimetype' file of '%s' has unexpected content"),
    MISSING_META_INF("Missing 'META-INF' directory in '%s'"),
    MISSING_META_INF_CONTAINER("Missing 'META-INF/container.xml' in '%s'"),
    META_INF_ERROR("Malformed 'META-INF/container.xml' in '%s'"),
    MISSING_OEBPS_ROOT_FILE_ELEMENT("No OEBPS package root file is declared in '%s'"),
    MISSING_OPF_FILE("Package document declared by '%s' does not exist"),
    OPF_ERROR("Malformed package document in '%s'"),
    INVALID_VERSION("Unsupported or invalid EPUB version in '%s'"),
    FAILED_TO_CREATE_FILE_SYSTEM("Failed to create the virtual filesystem for '%s'");

    private final String template;

    EpubReaderError(String template) {
        this.template = template;
    }

    public EpubReaderException createException(Object source) {
        return new EpubReaderException(this, String.format(template, source), null);
    }

    public EpubReaderException createException(Object source, String detail) {
        return new EpubReaderException(this, String.format(template, source) + ": " + detail, null);
    }

    public EpubReaderException createException(Object source, Throwable cause) {
        String message = String.format(template, source);
        if (cause != null && cause.getMessage() != null) {
            message = message + ": " + cause.getMessage();
        }
        return new EpubReaderException(this, message, cause);
    }
}

package org.epubby.exception;

public enum ReadError {
    MISSING_ATTRIBUTE,
    MISSING_ELEMENT,
    MISSING_TEXT,
    UNKNOWN_READING_DIRECTION,
    INVALID_IRI,
    INVALID_MEDIA_TYPE,
    INVALID_PROPERTY,
    INVALID_META_VALUE,
    INVALID_PREFIX,
    INVALID_VERSION,
    INVALID_NUMBER,
    INVALID_LINEAR_VALUE,
    UNKNOWN_PAGE_TARGET_TYPE,
    MISSING_IDENTIFIER,
    MISSING_TITLE,
    MISSING_LANGUAGE,
    UNKNOWN_DUBLIN_CORE_ELEMENT,
    DUBLIN_CORE_ERROR,
    UNRESOLVED_REFERENCE,
    MALFORMED_XML
}

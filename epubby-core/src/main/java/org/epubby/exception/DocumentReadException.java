package org.epubby.exception;

import lombok.Getter;

/**
 * A structured failure while turning an XML or HTML document into its model.
 * <p>
 * {@code location} is an absolute, XPath-like path such as {@code /package/manifest}. {@code subject} is the missing
 * element or attribute name, or the offending value, depending on the {@link ReadError}.
 */
@Getter
public class DocumentReadException extends Exception {

    private final ReadError error;
    private final String location;
    private final String subject;

    public DocumentReadException(ReadError error, String location, String subject, String message) {
        this(error, location, subject, message, null);
    }

    public DocumentReadException(ReadError error, String location, String subject, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.location = location;
        this.subject = subject;
    }

    public static DocumentReadException missingAttribute(String name, String location) {
        return new DocumentReadException(ReadError.MISSING_ATTRIBUTE, location, name,
                "Missing attribute '" + name + "' at " + location);
    }

    public static DocumentReadException missingElement(String name, String location) {
        return new DocumentReadException(ReadError.MISSING_ELEMENT, location, name,
                "Missing element '" + name + "' at " + location);
    }

    public static DocumentReadException missingText(String location) {
        return new DocumentReadException(ReadError.MISSING_TEXT, location, null, "Missing text content at " + location);
    }

    public static DocumentReadException invalidValue(ReadError error, String value, String location) {
        return new DocumentReadException(error, location, value,
                "Invalid value '" + value + "' (" + error + ") at " + location);
    }

    public static DocumentReadException invalidValue(ReadError error, String value, String location, Throwable cause) {
        return new DocumentReadException(error, location, value,
                "Invalid value '" + value + "' (" + error + ") at " + location + ": " + cause.getMessage(), cause);
    }

    /**
     * Wraps {@code inner} under a document level kind, keeping the location of the inner failure.
     */
    public static DocumentReadException wrap(ReadError error, DocumentReadException inner) {
        return new DocumentReadException(error, inner.getLocation(), inner.getSubject(),
                error + ": " + inner.getMessage(), inner);
    }
}

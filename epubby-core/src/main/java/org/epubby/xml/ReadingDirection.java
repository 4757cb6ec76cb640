package org.epubby.xml;

import lombok.Getter;
import org.epubby.exception.DocumentReadException;
import org.epubby.exception.ReadError;

/**
 * Value of a {@code dir} attribute.
 */
@Getter
public enum ReadingDirection {
    LEFT_TO_RIGHT("ltr"),
    RIGHT_TO_LEFT("rtl");

    private final String value;

    ReadingDirection(String value) {
        this.value = value;
    }

    public static ReadingDirection fromValue(String value, String location) throws DocumentReadException {
        for (ReadingDirection direction : values()) {
            if (direction.value.equals(value)) {
                return direction;
            }
        }
        throw DocumentReadException.invalidValue(ReadError.UNKNOWN_READING_DIRECTION, value, location);
    }
}

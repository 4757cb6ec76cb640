package org.epubby.model.opf;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.epubby.exception.DocumentReadException;
import org.epubby.exception.ReadError;

@Getter
@RequiredArgsConstructor
public enum PageProgressionDirection {
    LEFT_TO_RIGHT("ltr"),
    RIGHT_TO_LEFT("rtl"),
    DEFAULT("default");

    private final String value;

    public static PageProgressionDirection fromValue(String value, String location) throws DocumentReadException {
        for (PageProgressionDirection direction : values()) {
            if (direction.value.equals(value)) {
                return direction;
            }
        }
        throw DocumentReadException.invalidValue(ReadError.UNKNOWN_READING_DIRECTION, value, location);
    }
}

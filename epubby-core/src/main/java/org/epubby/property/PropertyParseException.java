package org.epubby.property;

import lombok.Getter;

@Getter
public class PropertyParseException extends Exception {

    private final String input;
    private final int index;

    public PropertyParseException(String input, int index, String message) {
        super(message + " (at index " + index + " of '" + input + "')");
        this.input = input;
        this.index = index;
    }
}

package org.epubby.property;

import lombok.experimental.UtilityClass;

/**
 * XML non-colonized names, see https://www.w3.org/TR/xml-names/#NT-NCName.
 */
@UtilityClass
public class NcNames {

    public static boolean isNcName(String value) {
        if (value == null || value.isEmpty() || !isStartChar(value.charAt(0))) {
            return false;
        }
        for (int i = 1; i < value.length(); i++) {
            if (!isNameChar(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    static boolean isStartChar(char c) {
        return c == '_' || Character.isLetter(c);
    }

    static boolean isNameChar(char c) {
        return isStartChar(c) || Character.isDigit(c) || c == '-' || c == '.' || c == '·'
                || Character.getType(c) == Character.NON_SPACING_MARK
                || Character.getType(c) == Character.COMBINING_SPACING_MARK;
    }
}

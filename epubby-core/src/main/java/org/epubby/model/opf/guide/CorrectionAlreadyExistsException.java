package org.epubby.model.opf.guide;

import lombok.Getter;

@Getter
public class CorrectionAlreadyExistsException extends IllegalArgumentException {

    private final String customType;
    private final ReferenceType existing;

    public CorrectionAlreadyExistsException(String customType, ReferenceType existing) {
        super("Custom type '" + customType + "' is already corrected to " + existing);
        this.customType = customType;
        this.existing = existing;
    }
}

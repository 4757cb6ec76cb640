package org.epubby.model.opf.guide;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

/**
 * A guide reference with a type outside {@link ReferenceType}. {@link #getType()} has no {@code other.} prefix, it is
 * added back when writing.
 */
@Data
@AllArgsConstructor
public class CustomGuideReference {

    public static final String PREFIX = "other.";

    @NonNull
    private String type;
    @NonNull
    private String href;
    private String title;
}

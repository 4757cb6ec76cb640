package org.epubby.model.opf.guide;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

@Data
@AllArgsConstructor
public class GuideReference {

    @NonNull
    private ReferenceType type;
    @NonNull
    private String href;
    private String title;
}

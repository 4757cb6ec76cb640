package org.epubby.model.opf;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * EPUB 3 {@code bindings}, deprecated since 3.1. Maps foreign media types to scripted handler items.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Bindings {

    private List<MediaType> mediaTypes = new ArrayList<>();

    @Data
    @AllArgsConstructor
    public static class MediaType {
        private String mediaType;
        /**
         * Manifest id of the handler.
         */
        private String handler;
    }
}

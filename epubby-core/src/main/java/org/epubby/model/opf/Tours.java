package org.epubby.model.opf;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * EPUB 2 {@code tours}, deprecated. Each tour is a named walk through a set of sites.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Tours {

    private List<Tour> tours = new ArrayList<>();

    @Data
    @AllArgsConstructor
    public static class Tour {
        private String id;
        private String title;
        private List<Site> sites;
    }

    @Data
    @AllArgsConstructor
    public static class Site {
        private String href;
        private String title;
    }
}

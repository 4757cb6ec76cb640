package org.epubby.model.toc;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The EPUB 3 navigation document: the {@code nav} elements of an XHTML content document.
 */
@Data
@NoArgsConstructor
public class NavigationDocument {

    private String title;
    private String language;
    private List<Nav> navs = new ArrayList<>();

    public Nav getToc() {
        return firstOf(NavType.TOC);
    }

    public Nav getPageList() {
        return firstOf(NavType.PAGE_LIST);
    }

    public Nav getLandmarks() {
        return firstOf(NavType.LANDMARKS);
    }

    public List<Nav> getCustomNavs() {
        List<Nav> result = new ArrayList<>();
        for (Nav nav : navs) {
            if (nav.getType() == NavType.CUSTOM) {
                result.add(nav);
            }
        }
        return result;
    }

    private Nav firstOf(NavType type) {
        for (Nav nav : navs) {
            if (nav.getType() == type) {
                return nav;
            }
        }
        return null;
    }

    @Getter
    @RequiredArgsConstructor
    public enum NavType {
        TOC("toc"),
        PAGE_LIST("page-list"),
        LANDMARKS("landmarks"),
        CUSTOM(null);

        private final String epubType;

        /**
         * Classifies a {@code nav} by the tokens of its {@code epub:type}.
         */
        public static NavType fromEpubType(String epubType) {
            if (epubType != null) {
                for (String token : epubType.trim().split("\\s+")) {
                    for (NavType type : values()) {
                        if (token.equals(type.epubType)) {
                            return type;
                        }
                    }
                }
            }
            return CUSTOM;
        }
    }

    @Data
    @NoArgsConstructor
    public static class Nav {
        private NavType type;
        /**
         * {@code epub:type} as written, may hold more than the classifying token.
         */
        private String epubType;
        private String id;
        private boolean hidden;
        private Heading heading;
        private List<NavItem> items = new ArrayList<>();

        public Nav(NavType type) {
            this.type = type;
            this.epubType = type.getEpubType();
        }
    }

    @Data
    @AllArgsConstructor
    public static class Heading {
        /**
         * {@code h1} to {@code h6}.
         */
        private String tag;
        private String text;
    }

    /**
     * A list item: a link, or a {@code span} heading when {@link #getHref()} is {@code null}, with nested items.
     */
    @Data
    @NoArgsConstructor
    public static class NavItem {
        private String text;
        private String href;
        private String epubType;
        private List<NavItem> children = new ArrayList<>();

        public NavItem(String text, String href) {
            this.text = text;
            this.href = href;
        }

        public boolean isLink() {
            return href != null;
        }
    }
}

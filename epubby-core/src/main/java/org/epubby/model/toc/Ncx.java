package org.epubby.model.toc;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import org.epubby.xml.ReadingDirection;

import java.util.ArrayList;
import java.util.List;

/**
 * The NCX table of contents of EPUB 2 publications (DAISY Z39.86-2005).
 */
@Data
@NoArgsConstructor
public class Ncx {

    public static final String VERSION = "2005-1";
    public static final String MEDIA_TYPE = "application/x-dtbncx+xml";

    private String version = VERSION;
    private String language;
    private ReadingDirection direction;
    private List<HeadMeta> head = new ArrayList<>();
    private DocText docTitle;
    private List<DocText> docAuthors = new ArrayList<>();
    private NavMap navMap;
    private PageList pageList;
    private List<NavList> navLists = new ArrayList<>();

    /**
     * Every {@link NavPoint} of the nav map, depth first.
     */
    public List<NavPoint> flattenNavPoints() {
        List<NavPoint> result = new ArrayList<>();
        if (navMap != null) {
            collect(navMap.getNavPoints(), result);
        }
        return result;
    }

    private static void collect(List<NavPoint> points, List<NavPoint> result) {
        for (NavPoint point : points) {
            result.add(point);
            collect(point.getChildren(), result);
        }
    }

    @Data
    @AllArgsConstructor
    public static class HeadMeta {
        private String name;
        private String content;
        private String scheme;
    }

    @Data
    @AllArgsConstructor
    public static class Img {
        private String src;
        private String id;
        private String clazz;
    }

    /**
     * {@code docTitle} and {@code docAuthor}: a required {@code text} and an optional {@code img}.
     */
    @Data
    @AllArgsConstructor
    public static class DocText {
        private String id;
        private String text;
        private Img img;
    }

    /**
     * {@code navLabel} and {@code navInfo}.
     */
    @Data
    @AllArgsConstructor
    public static class Label {
        private String text;
        private Img img;
        private String language;
        private ReadingDirection direction;

        public Label(String text) {
            this(text, null, null, null);
        }
    }

    @Data
    @AllArgsConstructor
    public static class Content {
        private String id;
        private String src;

        public Content(String src) {
            this(null, src);
        }
    }

    @Data
    @NoArgsConstructor
    public static class NavMap {
        private String id;
        private List<Label> navInfo = new ArrayList<>();
        private List<Label> navLabels = new ArrayList<>();
        private List<NavPoint> navPoints = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class NavPoint {
        private String id;
        private String clazz;
        private Integer playOrder;
        private List<Label> navLabels = new ArrayList<>();
        private Content content;
        private List<NavPoint> children = new ArrayList<>();

        public NavPoint(String id, String label, String src) {
            this.id = id;
            this.navLabels.add(new Label(label));
            this.content = new Content(src);
        }
    }

    @Data
    @NoArgsConstructor
    public static class PageList {
        private String id;
        private String clazz;
        private List<Label> navInfo = new ArrayList<>();
        private List<Label> navLabels = new ArrayList<>();
        private List<PageTarget> pageTargets = new ArrayList<>();
    }

    @Getter
    @RequiredArgsConstructor
    public enum PageTargetType {
        FRONT("front"),
        NORMAL("normal"),
        SPECIAL("special");

        private final String value;

        public static PageTargetType fromValue(String value) {
            for (PageTargetType type : values()) {
                if (type.value.equals(value)) {
                    return type;
                }
            }
            return null;
        }
    }

    @Data
    @NoArgsConstructor
    public static class PageTarget {
        private String id;
        private String value;
        private PageTargetType type;
        private String clazz;
        private Integer playOrder;
        private List<Label> navLabels = new ArrayList<>();
        private Content content;
    }

    @Data
    @NoArgsConstructor
    public static class NavList {
        private String id;
        private String clazz;
        private List<Label> navInfo = new ArrayList<>();
        private List<Label> navLabels = new ArrayList<>();
        private List<NavTarget> navTargets = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class NavTarget {
        private String id;
        private String value;
        private String clazz;
        private Integer playOrder;
        private List<Label> navLabels = new ArrayList<>();
        private Content content;
    }
}

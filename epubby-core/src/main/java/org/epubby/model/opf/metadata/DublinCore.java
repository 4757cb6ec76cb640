package org.epubby.model.opf.metadata;

import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import org.epubby.xml.ReadingDirection;

/**
 * A Dublin Core element of the package metadata. The concrete subclass follows the element's local name, see
 * {@link #create(DublinCoreType, String)}.
 */
@Getter
@Setter
public abstract class DublinCore {

    private String id;
    @NonNull
    private String content;

    protected DublinCore(@NonNull String content) {
        this.content = content;
    }

    public abstract DublinCoreType getType();

    /**
     * New, empty-attributed element of the given type.
     */
    public static DublinCore create(DublinCoreType type, String content) {
        return switch (type) {
            case CONTRIBUTOR -> new Contributor(content);
            case COVERAGE -> new Coverage(content);
            case CREATOR -> new Creator(content);
            case DATE -> new Date(content);
            case DESCRIPTION -> new Description(content);
            case FORMAT -> new Format(content);
            case IDENTIFIER -> new Identifier(content);
            case LANGUAGE -> new Language(content);
            case PUBLISHER -> new Publisher(content);
            case RELATION -> new Relation(content);
            case RIGHTS -> new Rights(content);
            case SOURCE -> new Source(content);
            case SUBJECT -> new Subject(content);
            case TITLE -> new Title(content);
            case TYPE -> new Type(content);
        };
    }

    @Override
    public String toString() {
        return getType().getLocalName() + "[id=" + id + ", content=" + content + "]";
    }

    /**
     * Elements that carry a text direction and language.
     */
    @Getter
    @Setter
    public abstract static class Localized extends DublinCore {
        private ReadingDirection direction;
        private String language;

        protected Localized(String content) {
            super(content);
        }
    }

    /**
     * {@code creator} and {@code contributor}. The role and file-as attributes are EPUB 2 only, EPUB 3 expresses them
     * as refining {@code meta} elements.
     */
    @Getter
    @Setter
    public abstract static class Creative extends Localized {
        private CreativeRole role;
        private String fileAs;

        protected Creative(String content) {
            super(content);
        }
    }

    @Getter
    @Setter
    public static final class Identifier extends DublinCore {
        private String scheme;

        public Identifier(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.IDENTIFIER;
        }
    }

    @Getter
    @Setter
    public static final class Date extends DublinCore {
        private String event;

        public Date(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.DATE;
        }
    }

    public static final class Language extends DublinCore {
        public Language(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.LANGUAGE;
        }
    }

    public static final class Format extends DublinCore {
        public Format(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.FORMAT;
        }
    }

    public static final class Source extends DublinCore {
        public Source(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.SOURCE;
        }
    }

    public static final class Type extends DublinCore {
        public Type(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.TYPE;
        }
    }

    public static final class Title extends Localized {
        public Title(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.TITLE;
        }
    }

    public static final class Coverage extends Localized {
        public Coverage(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.COVERAGE;
        }
    }

    public static final class Description extends Localized {
        public Description(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.DESCRIPTION;
        }
    }

    public static final class Publisher extends Localized {
        public Publisher(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.PUBLISHER;
        }
    }

    public static final class Relation extends Localized {
        public Relation(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.RELATION;
        }
    }

    public static final class Rights extends Localized {
        public Rights(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.RIGHTS;
        }
    }

    public static final class Subject extends Localized {
        public Subject(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.SUBJECT;
        }
    }

    public static final class Creator extends Creative {
        public Creator(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.CREATOR;
        }
    }

    public static final class Contributor extends Creative {
        public Contributor(String content) {
            super(content);
        }

        @Override
        public DublinCoreType getType() {
            return DublinCoreType.CONTRIBUTOR;
        }
    }
}

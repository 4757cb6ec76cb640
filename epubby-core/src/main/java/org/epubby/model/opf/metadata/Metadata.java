package org.epubby.model.opf.metadata;

import lombok.Getter;
import org.epubby.property.Property;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The {@code metadata} of a package document.
 * <p>
 * A publication always has at least one identifier, one title and one language, so the last one of each can not be
 * removed. The remaining Dublin Core elements, the {@code meta} elements of both generations and the {@code link}s are
 * kept in document order.
 */
public class Metadata {

    private final List<DublinCore.Identifier> identifiers;
    private final List<DublinCore.Title> titles;
    private final List<DublinCore.Language> languages;
    @Getter
    private final List<DublinCore> dublinCoreElements = new ArrayList<>();
    @Getter
    private final List<Opf2Meta> opf2Metas = new ArrayList<>();
    @Getter
    private final List<Opf3Meta<?>> opf3Metas = new ArrayList<>();
    @Getter
    private final List<MetadataLink> links = new ArrayList<>();

    public Metadata(List<DublinCore.Identifier> identifiers, List<DublinCore.Title> titles,
                    List<DublinCore.Language> languages) {
        this.identifiers = requireNotEmpty(identifiers, "identifier");
        this.titles = requireNotEmpty(titles, "title");
        this.languages = requireNotEmpty(languages, "language");
    }

    public Metadata(DublinCore.Identifier identifier, DublinCore.Title title, DublinCore.Language language) {
        this(List.of(identifier), List.of(title), List.of(language));
    }

    private static <T> List<T> requireNotEmpty(List<T> elements, String name) {
        if (elements == null || elements.isEmpty()) {
            throw new IllegalArgumentException("Metadata needs at least one " + name);
        }
        return new ArrayList<>(elements);
    }

    public List<DublinCore.Identifier> getIdentifiers() {
        return Collections.unmodifiableList(identifiers);
    }

    public List<DublinCore.Title> getTitles() {
        return Collections.unmodifiableList(titles);
    }

    public List<DublinCore.Language> getLanguages() {
        return Collections.unmodifiableList(languages);
    }

    public DublinCore.Identifier getPrimaryIdentifier() {
        return identifiers.get(0);
    }

    public DublinCore.Title getPrimaryTitle() {
        return titles.get(0);
    }

    public DublinCore.Language getPrimaryLanguage() {
        return languages.get(0);
    }

    public void addIdentifier(DublinCore.Identifier identifier) {
        identifiers.add(Objects.requireNonNull(identifier));
    }

    public void addTitle(DublinCore.Title title) {
        titles.add(Objects.requireNonNull(title));
    }

    public void addLanguage(DublinCore.Language language) {
        languages.add(Objects.requireNonNull(language));
    }

    public boolean removeIdentifier(DublinCore.Identifier identifier) {
        return removeKeepingOne(identifiers, identifier, "identifier");
    }

    public boolean removeTitle(DublinCore.Title title) {
        return removeKeepingOne(titles, title, "title");
    }

    public boolean removeLanguage(DublinCore.Language language) {
        return removeKeepingOne(languages, language, "language");
    }

    private static <T> boolean removeKeepingOne(List<T> elements, T element, String name) {
        if (elements.size() == 1 && elements.contains(element)) {
            throw new IllegalStateException("Can not remove the last " + name);
        }
        return elements.remove(element);
    }

    /**
     * Identifiers, titles, languages and the remaining Dublin Core elements, in that order.
     */
    public List<DublinCore> getAllDublinCore() {
        List<DublinCore> all = new ArrayList<>(identifiers.size() + titles.size() + languages.size() + dublinCoreElements.size());
        all.addAll(identifiers);
        all.addAll(titles);
        all.addAll(languages);
        all.addAll(dublinCoreElements);
        return all;
    }

    /**
     * The identifier with the given {@code id}, used to resolve {@code package/@unique-identifier}.
     */
    public DublinCore.Identifier findIdentifier(String id) {
        for (DublinCore.Identifier identifier : identifiers) {
            if (Objects.equals(identifier.getId(), id)) {
                return identifier;
            }
        }
        return null;
    }

    /**
     * The EPUB 3 metas refining the element with the given {@code id}.
     */
    public List<Opf3Meta<?>> getRefinements(String id) {
        List<Opf3Meta<?>> refinements = new ArrayList<>();
        for (Opf3Meta<?> meta : opf3Metas) {
            if (id != null && id.equals(meta.getRefinedId())) {
                refinements.add(meta);
            }
        }
        return refinements;
    }

    public List<Opf3Meta<?>> findOpf3Metas(Property property) {
        List<Opf3Meta<?>> result = new ArrayList<>();
        for (Opf3Meta<?> meta : opf3Metas) {
            if (meta.getProperty().equals(property)) {
                result.add(meta);
            }
        }
        return result;
    }
}

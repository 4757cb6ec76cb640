package org.epubby.model.opf;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The default reading order. Always holds at least one reference.
 */
@Getter
@Setter
public class Spine {

    private String id;
    private PageProgressionDirection pageProgressionDirection;
    /**
     * Manifest id of the NCX document, EPUB 2 only.
     */
    private String toc;
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final List<SpineReference> references;

    public Spine(List<SpineReference> references) {
        if (references == null || references.isEmpty()) {
            throw new IllegalArgumentException("A spine needs at least one reference");
        }
        this.references = new ArrayList<>(references);
    }

    public List<SpineReference> getReferences() {
        return Collections.unmodifiableList(references);
    }

    public void addReference(SpineReference reference) {
        references.add(Objects.requireNonNull(reference));
    }

    public void addReference(int index, SpineReference reference) {
        references.add(index, Objects.requireNonNull(reference));
    }

    public boolean removeReference(SpineReference reference) {
        if (references.size() == 1 && references.contains(reference)) {
            throw new IllegalStateException("Can not remove the last spine reference");
        }
        return references.remove(reference);
    }

    public List<SpineReference> getReferencesTo(String idref) {
        List<SpineReference> result = new ArrayList<>();
        for (SpineReference reference : references) {
            if (Objects.equals(reference.getIdref(), idref)) {
                result.add(reference);
            }
        }
        return result;
    }
}

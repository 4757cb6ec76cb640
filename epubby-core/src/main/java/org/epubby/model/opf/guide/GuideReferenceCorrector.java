package org.epubby.model.opf.guide;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

/**
 * Maps custom guide types that are misspellings of a known type, e.g. {@code copyright}, to their {@link ReferenceType}.
 * Custom types match ignoring case. Corrections can only be added.
 */
@Slf4j
public class GuideReferenceCorrector {

    private final Map<String, ReferenceType> corrections = new LinkedHashMap<>();

    public GuideReferenceCorrector(Map<String, ReferenceType> initialCorrections,
                                   Collection<? extends GuideCorrectionSource> sources) {
        initialCorrections.forEach(this::addCorrection);
        for (GuideCorrectionSource source : sources) {
            source.getCorrections().forEach(this::addCorrection);
            log.debug("Added guide corrections of {}", source.getClass().getName());
        }
    }

    public GuideReferenceCorrector(Map<String, ReferenceType> initialCorrections) {
        this(initialCorrections, List.of());
    }

    /**
     * @throws CorrectionAlreadyExistsException if {@code customType} already has a correction
     */
    public void addCorrection(String customType, ReferenceType type) {
        String key = key(customType);
        ReferenceType existing = corrections.putIfAbsent(key, type);
        if (existing != null) {
            throw new CorrectionAlreadyExistsException(customType, existing);
        }
    }

    public boolean hasCorrection(String customType) {
        return corrections.containsKey(key(customType));
    }

    /**
     * @throws NoSuchElementException if there is no correction for {@code customType}
     */
    public ReferenceType getCorrection(String customType) {
        ReferenceType type = corrections.get(key(customType));
        if (type == null) {
            throw new NoSuchElementException("No correction for custom type '" + customType + "'");
        }
        return type;
    }

    public ReferenceType getCorrectionOrNull(String customType) {
        return corrections.get(key(customType));
    }

    /**
     * The custom types corrected to {@code type}.
     */
    public List<String> getCorrectionsFor(ReferenceType type) {
        return corrections.entrySet().stream()
                .filter(entry -> entry.getValue() == type)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public Map<String, ReferenceType> getCorrections() {
        return Map.copyOf(corrections);
    }

    private static String key(String customType) {
        return customType.toLowerCase(Locale.ROOT);
    }
}

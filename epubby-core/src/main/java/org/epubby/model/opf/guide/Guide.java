package org.epubby.model.opf.guide;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The EPUB 2 {@code guide}: at most one reference per known type, plus custom typed references.
 */
@Slf4j
public class Guide {

    private final Map<ReferenceType, GuideReference> references = new EnumMap<>(ReferenceType.class);
    private final Map<String, CustomGuideReference> customReferences = new LinkedHashMap<>();

    public Map<ReferenceType, GuideReference> getReferences() {
        return Collections.unmodifiableMap(references);
    }

    public Map<String, CustomGuideReference> getCustomReferences() {
        return Collections.unmodifiableMap(customReferences);
    }

    public GuideReference getReference(ReferenceType type) {
        return references.get(type);
    }

    public CustomGuideReference getCustomReference(String type) {
        return customReferences.get(withoutPrefix(type));
    }

    public boolean isEmpty() {
        return references.isEmpty() && customReferences.isEmpty();
    }

    /**
     * Adds a reference, replacing any reference of the same type.
     */
    public GuideReference addReference(ReferenceType type, String href, String title) {
        GuideReference reference = new GuideReference(type, href, title);
        references.put(type, reference);
        return reference;
    }

    /**
     * Adds a custom reference, replacing any custom reference of the same type. A leading {@code other.} is dropped.
     *
     * @throws IllegalArgumentException if {@code type} is one of the {@link ReferenceType}s
     */
    public CustomGuideReference addCustomReference(String type, String href, String title) {
        String customType = withoutPrefix(type);
        if (ReferenceType.fromType(customType) != null) {
            throw new IllegalArgumentException("'" + customType + "' is a known reference type, use addReference");
        }
        CustomGuideReference reference = new CustomGuideReference(customType, href, title);
        customReferences.put(customType, reference);
        return reference;
    }

    public GuideReference removeReference(ReferenceType type) {
        return references.remove(type);
    }

    public CustomGuideReference removeCustomReference(String type) {
        return customReferences.remove(withoutPrefix(type));
    }

    private static String withoutPrefix(String type) {
        return StringUtils.removeStart(type, CustomGuideReference.PREFIX);
    }

    /**
     * Turns every custom reference {@code corrector} knows a type for into a reference of that type. When that type
     * is already taken, {@code strategy} decides.
     */
    public void correctCustomTypes(GuideReferenceCorrector corrector, CorrectorDuplicationStrategy strategy) {
        for (CustomGuideReference custom : new ArrayList<>(customReferences.values())) {
            ReferenceType type = corrector.getCorrectionOrNull(custom.getType());
            if (type == null) {
                continue;
            }
            GuideReference existing = references.get(type);
            if (existing == null) {
                log.debug("Remapping custom guide reference '{}' to {}", custom.getType(), type);
                customReferences.remove(custom.getType());
                addReference(type, custom.getHref(), custom.getTitle());
                continue;
            }
            switch (strategy) {
                case REPLACE_EXISTING -> {
                    log.debug("Replacing {} with custom guide reference '{}'", existing, custom.getType());
                    customReferences.remove(custom.getType());
                    addReference(type, custom.getHref(), custom.getTitle());
                }
                case REMOVE_CUSTOM -> {
                    log.debug("Removing custom guide reference '{}' in favour of {}", custom.getType(), existing);
                    customReferences.remove(custom.getType());
                }
                case DO_NOTHING -> log.debug("Keeping both {} and custom guide reference '{}'", existing, custom.getType());
            }
        }
    }
}

package org.epubby.model.opf.guide;

/**
 * What {@link Guide#correctCustomTypes} does when a corrected custom reference meets an existing reference of the same
 * type.
 */
public enum CorrectorDuplicationStrategy {
    /**
     * The existing reference is replaced by one created from the custom reference.
     */
    REPLACE_EXISTING,
    /**
     * The custom reference is dropped, the existing one stays.
     */
    REMOVE_CUSTOM,
    /**
     * Both stay.
     */
    DO_NOTHING
}

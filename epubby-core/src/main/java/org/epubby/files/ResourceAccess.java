package org.epubby.files;

/**
 * Capability tiers of an existing resource. Every tier includes the ones before it.
 */
public enum ResourceAccess {
    READ_ONLY,
    DELETABLE,
    MODIFIABLE,
    UNPROTECTED;

    public boolean includes(ResourceAccess other) {
        return ordinal() >= other.ordinal();
    }
}

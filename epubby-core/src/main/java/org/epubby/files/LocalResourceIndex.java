package org.epubby.files;

/**
 * Lookup of the absolute archive paths that the package manifest registers as local resources.
 */
@FunctionalInterface
public interface LocalResourceIndex {

    LocalResourceIndex EMPTY = path -> false;

    boolean contains(String absolutePath);
}

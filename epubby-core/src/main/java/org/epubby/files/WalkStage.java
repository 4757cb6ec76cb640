package org.epubby.files;

/**
 * Callback of a tree walk during which a {@link NilResource} was encountered.
 */
public enum WalkStage {
    PRE_VISIT_DIRECTORY,
    VISIT_FILE,
    VISIT_FILE_FAILED,
    POST_VISIT_DIRECTORY
}

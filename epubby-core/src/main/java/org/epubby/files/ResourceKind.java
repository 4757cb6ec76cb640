package org.epubby.files;

public enum ResourceKind {
    NIL,
    FILE,
    DIRECTORY
}

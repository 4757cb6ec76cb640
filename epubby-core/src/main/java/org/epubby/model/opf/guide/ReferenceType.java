package org.epubby.model.opf.guide;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The {@code type} values OPF 2 defines for guide references.
 */
@Getter
@RequiredArgsConstructor
public enum ReferenceType {
    COVER("cover"),
    TITLE_PAGE("title-page"),
    TABLE_OF_CONTENTS("toc"),
    INDEX("index"),
    GLOSSARY("glossary"),
    ACKNOWLEDGEMENTS("acknowledgements"),
    BIBLIOGRAPHY("bibliography"),
    COLOPHON("colophon"),
    COPYRIGHT_PAGE("copyright-page"),
    DEDICATION("dedication"),
    EPIGRAPH("epigraph"),
    FOREWORD("foreword"),
    LIST_OF_ILLUSTRATIONS("loi"),
    LIST_OF_TABLES("lot"),
    NOTES("notes"),
    PREFACE("preface"),
    TEXT("text");

    private final String type;

    /**
     * The reference type whose value is {@code type}, ignoring case. {@code null} for custom types.
     */
    public static ReferenceType fromType(String type) {
        for (ReferenceType referenceType : values()) {
            if (referenceType.type.equalsIgnoreCase(type)) {
                return referenceType;
            }
        }
        return null;
    }
}

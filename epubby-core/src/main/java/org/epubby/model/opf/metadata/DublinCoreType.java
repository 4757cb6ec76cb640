package org.epubby.model.opf.metadata;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The fifteen Dublin Core elements allowed inside {@code metadata}, keyed by their local name.
 */
@Getter
@RequiredArgsConstructor
public enum DublinCoreType {
    CONTRIBUTOR("contributor"),
    COVERAGE("coverage"),
    CREATOR("creator"),
    DATE("date"),
    DESCRIPTION("description"),
    FORMAT("format"),
    IDENTIFIER("identifier"),
    LANGUAGE("language"),
    PUBLISHER("publisher"),
    RELATION("relation"),
    RIGHTS("rights"),
    SOURCE("source"),
    SUBJECT("subject"),
    TITLE("title"),
    TYPE("type");

    private static final Map<String, DublinCoreType> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(DublinCoreType::getLocalName, Function.identity()));

    private final String localName;

    public static DublinCoreType fromLocalName(String localName) {
        return BY_NAME.get(localName);
    }
}

package org.epubby.model.opf.metadata;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An EPUB 2 {@code meta} element. The value lives in attributes: {@code name}/{@code content}, {@code charset} or
 * {@code http-equiv}. Attributes outside that set are kept in {@link #attributes} so they survive a round trip.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Opf2Meta {

    private String charset;
    private String content;
    private String httpEquiv;
    private String name;
    private String scheme;
    private Map<String, String> attributes = new LinkedHashMap<>();

    public static Opf2Meta named(String name, String content) {
        Opf2Meta meta = new Opf2Meta();
        meta.setName(name);
        meta.setContent(content);
        return meta;
    }
}

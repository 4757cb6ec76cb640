package org.epubby.xml;

import lombok.experimental.UtilityClass;

@UtilityClass
public class Namespaces {

    public static final String CONTAINER_NS = "urn:oasis:names:tc:opendocument:xmlns:container";
    public static final String OPF_NS = "http://www.idpf.org/2007/opf";
    public static final String DC_NS = "http://purl.org/dc/elements/1.1/";
    public static final String NCX_NS = "http://www.daisy.org/z3986/2005/ncx/";
    public static final String XHTML_NS = "http://www.w3.org/1999/xhtml";
    public static final String EPUB_NS = "http://www.idpf.org/2007/ops";
    public static final String XML_NS = "http://www.w3.org/XML/1998/namespace";
    public static final String XMLNS_NS = "http://www.w3.org/2000/xmlns/";

    public static final String DC_PREFIX = "dc";
    public static final String OPF_PREFIX = "opf";
}

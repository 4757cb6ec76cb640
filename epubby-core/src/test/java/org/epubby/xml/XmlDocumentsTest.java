package org.epubby.xml;

import org.epubby.exception.DocumentReadException;
import org.epubby.exception.ReadError;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class XmlDocumentsTest {

    @Test
    void externalDtdIsNotFetched() throws DocumentReadException {
        String ncx = """
                <?xml version="1.0" encoding="UTF-8"?>
                <!DOCTYPE ncx PUBLIC "-//NISO//DTD ncx 2005-1//EN" "http://unreachable.invalid/ncx-2005-1.dtd">
                <ncx xmlns="http://www.daisy.org/z3986/2005/ncx/" version="2005-1"/>
                """;

        Document document = XmlDocuments.parse(ncx.getBytes(StandardCharsets.UTF_8), "/toc.ncx");

        assertEquals("ncx", document.getDocumentElement().getLocalName());
        assertEquals(Namespaces.NCX_NS, document.getDocumentElement().getNamespaceURI());
    }

    @Test
    void malformedContentIsReported() {
        byte[] content = "<package><metadata></package>".getBytes(StandardCharsets.UTF_8);

        DocumentReadException e = assertThrows(DocumentReadException.class,
                () -> XmlDocuments.parse(content, "/OEBPS/content.opf"));
        assertEquals(ReadError.MALFORMED_XML, e.getError());
        assertEquals("/OEBPS/content.opf", e.getLocation());
    }

    @Test
    void serializesWithDeclaration() {
        Document document = XmlDocuments.newDocument(Namespaces.CONTAINER_NS, "container");
        document.getDocumentElement().setAttribute("version", "1.0");

        String xml = new String(XmlDocuments.toBytes(document), StandardCharsets.UTF_8);

        assertTrue(xml.startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\""));
        assertTrue(xml.contains("xmlns=\"urn:oasis:names:tc:opendocument:xmlns:container\""));
    }
}

package org.epubby.xml;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.epubby.exception.DocumentReadException;
import org.epubby.exception.ReadError;
import org.epubby.util.SecureXmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

@Slf4j
@UtilityClass
public class XmlDocuments {

    /**
     * Parses {@code content} with a namespace aware, hardened parser.
     *
     * @param source name of the document used in error messages
     */
    public static Document parse(byte[] content, String source) throws DocumentReadException {
        try {
            DocumentBuilder builder = SecureXmlUtils.createSecureDocumentBuilder(true);
            Document document = builder.parse(new ByteArrayInputStream(content));
            document.setDocumentURI(source);
            return document;
        } catch (SAXException | IOException e) {
            throw DocumentReadException.invalidValue(ReadError.MALFORMED_XML, source, source, e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    /**
     * Creates a document whose root element is {@code rootName} in {@code namespace}.
     */
    public static Document newDocument(String namespace, String rootName) {
        try {
            Document document = SecureXmlUtils.createSecureDocumentBuilder(true).newDocument();
            Element root = document.createElementNS(namespace, rootName);
            document.appendChild(root);
            return document;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    public static byte[] toBytes(Document document) {
        try {
            Transformer transformer = SecureXmlUtils.createSecureTransformerFactory().newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            document.setXmlStandalone(true);
            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            transformer.transform(new DOMSource(document), new StreamResult(outputStream));
            return outputStream.toByteArray();
        } catch (TransformerException e) {
            throw new IllegalStateException("Failed to serialize XML document " + document.getDocumentURI(), e);
        }
    }
}

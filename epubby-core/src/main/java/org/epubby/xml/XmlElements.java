package org.epubby.xml;

import lombok.experimental.UtilityClass;
import org.epubby.exception.DocumentReadException;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * Locating and writing the children and attributes of DOM elements. Required lookups fail with a
 * {@link DocumentReadException} that carries the absolute location of the parent element.
 */
@UtilityClass
public class XmlElements {

    @FunctionalInterface
    public interface ElementParser<T> {
        T parse(Element element) throws DocumentReadException;
    }

    @FunctionalInterface
    public interface ElementFactory<T> {
        Element create(Document document, T value);
    }

    /**
     * XPath-like absolute location of {@code node}, e.g. {@code /package/metadata/dc:title[2]}. A positional predicate
     * is only added when siblings share the name.
     */
    public static String locate(Node node) {
        if (node == null || node.getNodeType() == Node.DOCUMENT_NODE) {
            return "";
        }
        if (node.getNodeType() == Node.ATTRIBUTE_NODE) {
            return locate(((Attr) node).getOwnerElement()) + "/@" + node.getNodeName();
        }
        StringBuilder segment = new StringBuilder("/").append(node.getNodeName());
        Node parent = node.getParentNode();
        if (parent != null && node.getNodeType() == Node.ELEMENT_NODE) {
            int position = 0;
            int total = 0;
            for (Node sibling = parent.getFirstChild(); sibling != null; sibling = sibling.getNextSibling()) {
                if (sibling.getNodeType() == Node.ELEMENT_NODE && sibling.getNodeName().equals(node.getNodeName())) {
                    total++;
                    if (sibling == node) {
                        position = total;
                    }
                }
            }
            if (total > 1) {
                segment.append('[').append(position).append(']');
            }
        }
        return locate(parent) + segment;
    }

    public static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    private static boolean matches(Node node, String name, String namespace) {
        if (node.getNodeType() != Node.ELEMENT_NODE || !name.equals(localName(node))) {
            return false;
        }
        return namespace == null || node.getNamespaceURI() == null || namespace.equals(node.getNamespaceURI());
    }

    /**
     * Direct element children, in document order.
     */
    public static List<Element> elements(Element parent) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element element) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * Direct children called {@code name}. Children without a namespace also match, real-world documents often omit it.
     */
    public static List<Element> children(Element parent, String name, String namespace) {
        List<Element> result = new ArrayList<>();
        for (Element element : elements(parent)) {
            if (matches(element, name, namespace)) {
                result.add(element);
            }
        }
        return result;
    }

    public static Element optionalChild(Element parent, String name, String namespace) {
        for (Element element : elements(parent)) {
            if (matches(element, name, namespace)) {
                return element;
            }
        }
        return null;
    }

    public static Element child(Element parent, String name, String namespace) throws DocumentReadException {
        Element child = optionalChild(parent, name, namespace);
        if (child == null) {
            throw DocumentReadException.missingElement(name, locate(parent));
        }
        return child;
    }

    /**
     * Like {@link #children} but at least one child is required.
     */
    public static List<Element> requiredChildren(Element parent, String name, String namespace) throws DocumentReadException {
        List<Element> result = children(parent, name, namespace);
        if (result.isEmpty()) {
            throw DocumentReadException.missingElement(name, locate(parent));
        }
        return result;
    }

    /**
     * Children of a required wrapper, e.g. the {@code rootfile}s of {@code rootfiles}. Both the wrapper and at least one
     * child are required.
     */
    public static List<Element> childrenWrapper(Element parent, String wrapper, String name, String namespace)
            throws DocumentReadException {
        return requiredChildren(child(parent, wrapper, namespace), name, namespace);
    }

    /**
     * Children of an optional wrapper. Returns {@code null} when the wrapper is absent, a present wrapper still needs at
     * least one child.
     */
    public static List<Element> optionalChildrenWrapper(Element parent, String wrapper, String name, String namespace)
            throws DocumentReadException {
        Element wrapperElement = optionalChild(parent, wrapper, namespace);
        return wrapperElement == null ? null : requiredChildren(wrapperElement, name, namespace);
    }

    public static <T> List<T> parseAll(List<Element> elements, ElementParser<T> parser) throws DocumentReadException {
        List<T> result = new ArrayList<>(elements.size());
        for (Element element : elements) {
            result.add(parser.parse(element));
        }
        return result;
    }

    public static String optionalAttr(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    public static String optionalAttr(Element element, String name, String namespace) {
        if (element.hasAttributeNS(namespace, name)) {
            return element.getAttributeNS(namespace, name);
        }
        return null;
    }

    /**
     * Namespaced attribute, falling back to the plain {@code prefix:name} form used by documents that forgot to
     * declare the namespace.
     */
    public static String optionalAttr(Element element, String name, String namespace, String prefix) {
        String value = optionalAttr(element, name, namespace);
        return value != null ? value : optionalAttr(element, prefix + ":" + name);
    }

    public static String attr(Element element, String name) throws DocumentReadException {
        String value = optionalAttr(element, name);
        if (value == null) {
            throw DocumentReadException.missingAttribute(name, locate(element));
        }
        return value;
    }

    /**
     * Text held directly by {@code element}, ignoring nested elements. {@code null} when there is none.
     */
    public static String ownText(Element element) {
        StringBuilder text = new StringBuilder();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(node.getNodeValue());
            }
        }
        String result = text.toString().trim();
        return result.isEmpty() ? null : result;
    }

    public static String text(Element element) throws DocumentReadException {
        String text = ownText(element);
        if (text == null) {
            throw DocumentReadException.missingText(locate(element));
        }
        return text;
    }

    public static boolean hasOwnText(Element element) {
        return ownText(element) != null;
    }

    public static ReadingDirection optionalDirection(Element element) throws DocumentReadException {
        String value = optionalAttr(element, "dir");
        return value == null ? null : ReadingDirection.fromValue(value, locate(element) + "/@dir");
    }

    public static String optionalLanguage(Element element) {
        return optionalAttr(element, "lang", Namespaces.XML_NS, "xml");
    }

    public static Element appendElement(Element parent, String namespace, String qualifiedName) {
        Element element = parent.getOwnerDocument().createElementNS(namespace, qualifiedName);
        parent.appendChild(element);
        return element;
    }

    public static Element appendTextElement(Element parent, String namespace, String qualifiedName, String text) {
        Element element = appendElement(parent, namespace, qualifiedName);
        element.setTextContent(text);
        return element;
    }

    /**
     * Sets {@code name} to {@code value}, or removes the attribute when {@code value} is {@code null}.
     */
    public static void setAttribute(Element element, String name, Object value) {
        if (value == null) {
            element.removeAttribute(name);
        } else {
            element.setAttribute(name, value.toString());
        }
    }

    public static void setAttribute(Element element, String namespace, String qualifiedName, Object value) {
        if (value == null) {
            String localName = qualifiedName.contains(":") ? qualifiedName.substring(qualifiedName.indexOf(':') + 1) : qualifiedName;
            element.removeAttributeNS(namespace, localName);
        } else {
            element.setAttributeNS(namespace, qualifiedName, value.toString());
        }
    }

    public static void setDirection(Element element, ReadingDirection direction) {
        setAttribute(element, "dir", direction == null ? null : direction.getValue());
    }

    public static void setLanguage(Element element, String language) {
        setAttribute(element, Namespaces.XML_NS, "xml:lang", language);
    }

    public static <T> void addChildren(Element parent, Iterable<T> values, ElementFactory<T> factory) {
        Document document = parent.getOwnerDocument();
        for (T value : values) {
            parent.appendChild(factory.create(document, value));
        }
    }

    /**
     * Writes {@code values} inside a new wrapper element. Nothing is written for a {@code null} or empty list.
     */
    public static <T> Element addChildrenWithWrapper(Element parent, String namespace, String wrapper,
                                                     List<T> values, ElementFactory<T> factory) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        Element wrapperElement = appendElement(parent, namespace, wrapper);
        addChildren(wrapperElement, values, factory);
        return wrapperElement;
    }
}

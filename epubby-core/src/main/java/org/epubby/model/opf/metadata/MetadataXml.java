package org.epubby.model.opf.metadata;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.epubby.exception.DocumentReadException;
import org.epubby.exception.ReadError;
import org.epubby.property.Properties;
import org.epubby.property.Property;
import org.epubby.property.PropertyParseException;
import org.epubby.property.PropertyResolver;
import org.epubby.version.EpubFormat;
import org.epubby.xml.XmlElements;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.epubby.xml.Namespaces.DC_NS;
import static org.epubby.xml.Namespaces.DC_PREFIX;
import static org.epubby.xml.Namespaces.OPF_NS;
import static org.epubby.xml.Namespaces.OPF_PREFIX;
import static org.epubby.xml.Namespaces.XMLNS_NS;

@Slf4j
@UtilityClass
public class MetadataXml {

    private static final Set<String> OPF2_META_ATTRIBUTES = Set.of("charset", "content", "http-equiv", "name", "scheme");

    public static Metadata read(Element metadataElement, Opf3MetaConverters converters) throws DocumentReadException {
        return read(metadataElement, converters, PropertyResolver.RESERVED);
    }

    /**
     * @param resolver resolves the prefixes of {@code meta/@scheme} values, built from the package's {@code prefix}
     */
    public static Metadata read(Element metadataElement, Opf3MetaConverters converters, PropertyResolver resolver)
            throws DocumentReadException {
        List<Element> dcElements = new ArrayList<>(dublinCoreChildren(metadataElement));
        List<Element> metaElements = new ArrayList<>(XmlElements.children(metadataElement, "meta", OPF_NS));
        List<Element> linkElements = new ArrayList<>(XmlElements.children(metadataElement, "link", OPF_NS));
        Element dcMetadata = XmlElements.optionalChild(metadataElement, "dc-metadata", OPF_NS);
        if (dcMetadata != null) {
            dcElements.addAll(dublinCoreChildren(dcMetadata));
        }
        Element xMetadata = XmlElements.optionalChild(metadataElement, "x-metadata", OPF_NS);
        if (xMetadata != null) {
            metaElements.addAll(XmlElements.children(xMetadata, "meta", OPF_NS));
            linkElements.addAll(XmlElements.children(xMetadata, "link", OPF_NS));
        }

        List<DublinCore.Identifier> identifiers = new ArrayList<>();
        List<DublinCore.Title> titles = new ArrayList<>();
        List<DublinCore.Language> languages = new ArrayList<>();
        List<DublinCore> others = new ArrayList<>();
        for (Element element : dcElements) {
            DublinCore dublinCore;
            try {
                dublinCore = readDublinCore(element);
            } catch (DocumentReadException e) {
                throw DocumentReadException.wrap(ReadError.DUBLIN_CORE_ERROR, e);
            }
            if (dublinCore instanceof DublinCore.Identifier identifier) {
                identifiers.add(identifier);
            } else if (dublinCore instanceof DublinCore.Title title) {
                titles.add(title);
            } else if (dublinCore instanceof DublinCore.Language language) {
                languages.add(language);
            } else {
                others.add(dublinCore);
            }
        }
        String location = XmlElements.locate(metadataElement);
        requirePresent(identifiers, ReadError.MISSING_IDENTIFIER, "identifier", location);
        requirePresent(titles, ReadError.MISSING_TITLE, "title", location);
        requirePresent(languages, ReadError.MISSING_LANGUAGE, "language", location);

        Metadata metadata = new Metadata(identifiers, titles, languages);
        metadata.getDublinCoreElements().addAll(others);
        for (Element element : metaElements) {
            if (isOpf3Meta(element)) {
                metadata.getOpf3Metas().add(readOpf3Meta(element, converters, resolver));
            } else {
                metadata.getOpf2Metas().add(readOpf2Meta(element));
            }
        }
        metadata.getLinks().addAll(XmlElements.parseAll(linkElements, MetadataXml::readLink));
        return metadata;
    }

    private static List<Element> dublinCoreChildren(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Element element : XmlElements.elements(parent)) {
            if (DC_NS.equals(element.getNamespaceURI())) {
                result.add(element);
            }
        }
        return result;
    }

    private static void requirePresent(List<?> elements, ReadError error, String name, String location)
            throws DocumentReadException {
        if (elements.isEmpty()) {
            throw new DocumentReadException(error, location, name, "No dc:" + name + " found at " + location);
        }
    }

    /**
     * A {@code meta} is read as EPUB 3 when it has a {@code property} attribute and text of its own, whatever the
     * package version says. Real files mix both shapes.
     */
    static boolean isOpf3Meta(Element element) {
        return element.hasAttribute("property") && XmlElements.hasOwnText(element);
    }

    static DublinCore readDublinCore(Element element) throws DocumentReadException {
        String localName = XmlElements.localName(element);
        DublinCoreType type = DublinCoreType.fromLocalName(localName);
        if (type == null) {
            throw DocumentReadException.invalidValue(ReadError.UNKNOWN_DUBLIN_CORE_ELEMENT, localName, XmlElements.locate(element));
        }
        DublinCore dublinCore = DublinCore.create(type, XmlElements.text(element));
        dublinCore.setId(XmlElements.optionalAttr(element, "id"));
        if (dublinCore instanceof DublinCore.Identifier identifier) {
            identifier.setScheme(XmlElements.optionalAttr(element, "scheme", OPF_NS, OPF_PREFIX));
        } else if (dublinCore instanceof DublinCore.Date date) {
            date.setEvent(XmlElements.optionalAttr(element, "event", OPF_NS, OPF_PREFIX));
        } else if (dublinCore instanceof DublinCore.Localized localized) {
            localized.setDirection(XmlElements.optionalDirection(element));
            localized.setLanguage(XmlElements.optionalLanguage(element));
            if (localized instanceof DublinCore.Creative creative) {
                String role = XmlElements.optionalAttr(element, "role", OPF_NS, OPF_PREFIX);
                creative.setRole(role == null || role.isBlank() ? null : CreativeRole.of(role.trim()));
                creative.setFileAs(XmlElements.optionalAttr(element, "file-as", OPF_NS, OPF_PREFIX));
            }
        }
        return dublinCore;
    }

    static Opf3Meta<?> readOpf3Meta(Element element, Opf3MetaConverters converters, PropertyResolver resolver)
            throws DocumentReadException {
        Property property = parseProperty(element, "property");
        Property scheme = XmlElements.optionalAttr(element, "scheme") == null ? null : parseProperty(element, "scheme");
        String value = XmlElements.text(element);
        Opf3Meta<?> meta;
        try {
            meta = converters.decode(property, value, scheme, resolver);
        } catch (IllegalArgumentException e) {
            throw DocumentReadException.invalidValue(ReadError.INVALID_META_VALUE, value, XmlElements.locate(element), e);
        }
        meta.setRefines(XmlElements.optionalAttr(element, "refines"));
        meta.setId(XmlElements.optionalAttr(element, "id"));
        meta.setDirection(XmlElements.optionalDirection(element));
        meta.setLanguage(XmlElements.optionalLanguage(element));
        log.debug("Read EPUB 3 meta '{}' at {}", property, XmlElements.locate(element));
        return meta;
    }

    static Opf2Meta readOpf2Meta(Element element) {
        Opf2Meta meta = new Opf2Meta();
        meta.setCharset(XmlElements.optionalAttr(element, "charset"));
        meta.setContent(XmlElements.optionalAttr(element, "content"));
        meta.setHttpEquiv(XmlElements.optionalAttr(element, "http-equiv"));
        meta.setName(XmlElements.optionalAttr(element, "name"));
        meta.setScheme(XmlElements.optionalAttr(element, "scheme"));
        Map<String, String> attributes = new LinkedHashMap<>();
        NamedNodeMap nodes = element.getAttributes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Attr attribute = (Attr) nodes.item(i);
            String name = attribute.getName();
            if (!OPF2_META_ATTRIBUTES.contains(name) && !XMLNS_NS.equals(attribute.getNamespaceURI())) {
                attributes.put(name, attribute.getValue());
            }
        }
        meta.setAttributes(attributes);
        log.debug("Read EPUB 2 meta '{}' at {}", meta.getName(), XmlElements.locate(element));
        return meta;
    }

    static MetadataLink readLink(Element element) throws DocumentReadException {
        MetadataLink link = new MetadataLink(XmlElements.attr(element, "href"));
        link.setRelation(parseOptionalProperties(element, "rel"));
        link.setMediaType(XmlElements.optionalAttr(element, "media-type"));
        link.setId(XmlElements.optionalAttr(element, "id"));
        link.setProperties(parseOptionalProperties(element, "properties"));
        link.setRefines(XmlElements.optionalAttr(element, "refines"));
        return link;
    }

    private static Property parseProperty(Element element, String attribute) throws DocumentReadException {
        String value = XmlElements.attr(element, attribute);
        try {
            return Property.parse(value.trim());
        } catch (PropertyParseException e) {
            throw DocumentReadException.invalidValue(ReadError.INVALID_PROPERTY, value, XmlElements.locate(element) + "/@" + attribute, e);
        }
    }

    /**
     * Parses a whitespace separated property list, {@code null} when the attribute is absent.
     */
    public static Properties parseOptionalProperties(Element element, String attribute) throws DocumentReadException {
        String value = XmlElements.optionalAttr(element, attribute);
        if (value == null) {
            return null;
        }
        try {
            return Properties.parse(value);
        } catch (PropertyParseException e) {
            throw DocumentReadException.invalidValue(ReadError.INVALID_PROPERTY, value, XmlElements.locate(element) + "/@" + attribute, e);
        }
    }

    /**
     * Appends a {@code metadata} element to {@code packageElement}. Every element is directly followed by the metas
     * refining it, depth first. Refinements whose target was not written go to the end.
     */
    public static Element write(Element packageElement, Metadata metadata, EpubFormat format, boolean omitLegacyFeatures) {
        Element metadataElement = XmlElements.appendElement(packageElement, OPF_NS, "metadata");
        metadataElement.setAttributeNS(XMLNS_NS, "xmlns:" + DC_PREFIX, DC_NS);
        metadataElement.setAttributeNS(XMLNS_NS, "xmlns:" + OPF_PREFIX, OPF_NS);

        RefinementWriter writer = new RefinementWriter(metadataElement, metadata.getOpf3Metas());
        for (DublinCore dublinCore : metadata.getAllDublinCore()) {
            writeDublinCore(metadataElement, dublinCore);
            writer.writeRefinementsOf(dublinCore.getId());
        }
        for (MetadataLink link : metadata.getLinks()) {
            writeLink(metadataElement, link);
            writer.writeRefinementsOf(link.getId());
        }
        for (Opf3Meta<?> meta : metadata.getOpf3Metas()) {
            if (!meta.isRefinement()) {
                writer.write(meta);
            }
        }
        for (Opf3Meta<?> meta : metadata.getOpf3Metas()) {
            if (!writer.isWritten(meta)) {
                log.debug("Writing meta '{}' without a target for refines '{}'", meta.getProperty(), meta.getRefines());
                writer.write(meta);
            }
        }
        if (omitLegacyFeatures && format.isEpub3()) {
            log.debug("Omitting {} EPUB 2 meta elements", metadata.getOpf2Metas().size());
        } else {
            for (Opf2Meta meta : metadata.getOpf2Metas()) {
                writeOpf2Meta(metadataElement, meta);
            }
        }
        return metadataElement;
    }

    private static void writeDublinCore(Element parent, DublinCore dublinCore) {
        Element element = XmlElements.appendTextElement(parent, DC_NS, DC_PREFIX + ":" + dublinCore.getType().getLocalName(),
                dublinCore.getContent());
        XmlElements.setAttribute(element, "id", dublinCore.getId());
        if (dublinCore instanceof DublinCore.Identifier identifier) {
            XmlElements.setAttribute(element, OPF_NS, OPF_PREFIX + ":scheme", identifier.getScheme());
        } else if (dublinCore instanceof DublinCore.Date date) {
            XmlElements.setAttribute(element, OPF_NS, OPF_PREFIX + ":event", date.getEvent());
        } else if (dublinCore instanceof DublinCore.Localized localized) {
            XmlElements.setDirection(element, localized.getDirection());
            XmlElements.setLanguage(element, localized.getLanguage());
            if (localized instanceof DublinCore.Creative creative) {
                XmlElements.setAttribute(element, OPF_NS, OPF_PREFIX + ":role",
                        creative.getRole() == null ? null : creative.getRole().getCode());
                XmlElements.setAttribute(element, OPF_NS, OPF_PREFIX + ":file-as", creative.getFileAs());
            }
        }
    }

    private static void writeLink(Element parent, MetadataLink link) {
        Element element = XmlElements.appendElement(parent, OPF_NS, "link");
        XmlElements.setAttribute(element, "href", link.getHref());
        XmlElements.setAttribute(element, "rel", emptyToNull(link.getRelation()));
        XmlElements.setAttribute(element, "media-type", link.getMediaType());
        XmlElements.setAttribute(element, "id", link.getId());
        XmlElements.setAttribute(element, "properties", emptyToNull(link.getProperties()));
        XmlElements.setAttribute(element, "refines", link.getRefines());
    }

    private static Properties emptyToNull(Properties properties) {
        return properties == null || properties.isEmpty() ? null : properties;
    }

    private static void writeOpf3Meta(Element parent, Opf3Meta<?> meta) {
        Element element = XmlElements.appendTextElement(parent, OPF_NS, "meta", meta.getEncodedValue());
        XmlElements.setAttribute(element, "property", meta.getProperty());
        XmlElements.setAttribute(element, "scheme", meta.getScheme());
        XmlElements.setAttribute(element, "refines", meta.getRefines());
        XmlElements.setAttribute(element, "id", meta.getId());
        XmlElements.setDirection(element, meta.getDirection());
        XmlElements.setLanguage(element, meta.getLanguage());
    }

    private static void writeOpf2Meta(Element parent, Opf2Meta meta) {
        Element element = XmlElements.appendElement(parent, OPF_NS, "meta");
        XmlElements.setAttribute(element, "name", meta.getName());
        XmlElements.setAttribute(element, "content", meta.getContent());
        XmlElements.setAttribute(element, "charset", meta.getCharset());
        XmlElements.setAttribute(element, "http-equiv", meta.getHttpEquiv());
        XmlElements.setAttribute(element, "scheme", meta.getScheme());
        if (meta.getAttributes() != null) {
            meta.getAttributes().forEach((name, value) -> XmlElements.setAttribute(element, name, value));
        }
    }

    /**
     * Writes metas and, right after each, the metas refining it. A target's refinements are handed out once, which
     * also stops refinement cycles.
     */
    private static final class RefinementWriter {

        private final Element parent;
        private final Map<String, List<Opf3Meta<?>>> refinementsByTarget = new LinkedHashMap<>();
        private final Set<Opf3Meta<?>> written = Collections.newSetFromMap(new IdentityHashMap<>());

        RefinementWriter(Element parent, List<Opf3Meta<?>> metas) {
            this.parent = parent;
            for (Opf3Meta<?> meta : metas) {
                if (meta.isRefinement()) {
                    refinementsByTarget.computeIfAbsent(meta.getRefinedId(), key -> new ArrayList<>()).add(meta);
                }
            }
        }

        boolean isWritten(Opf3Meta<?> meta) {
            return written.contains(meta);
        }

        void write(Opf3Meta<?> meta) {
            if (!written.add(meta)) {
                return;
            }
            writeOpf3Meta(parent, meta);
            writeRefinementsOf(meta.getId());
        }

        void writeRefinementsOf(String id) {
            if (id == null) {
                return;
            }
            List<Opf3Meta<?>> refinements = refinementsByTarget.remove(id);
            if (refinements != null) {
                refinements.forEach(this::write);
            }
        }
    }
}

package org.epubby.model.opf;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.epubby.exception.DocumentReadException;
import org.epubby.exception.ReadError;
import org.epubby.model.opf.guide.Guide;
import org.epubby.model.opf.guide.GuideXml;
import org.epubby.model.opf.metadata.Metadata;
import org.epubby.model.opf.metadata.MetadataXml;
import org.epubby.model.opf.metadata.Opf3MetaConverters;
import org.epubby.property.DefaultVocabulary;
import org.epubby.property.Prefixes;
import org.epubby.property.Properties;
import org.epubby.property.Property;
import org.epubby.property.PropertyParseException;
import org.epubby.property.PropertyResolver;
import org.epubby.version.EpubFormat;
import org.epubby.version.EpubVersion;
import org.epubby.version.EpubVersionException;
import org.epubby.xml.XmlDocuments;
import org.epubby.xml.XmlElements;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.epubby.xml.Namespaces.OPF_NS;

/**
 * Reads and writes package documents. {@code metadata}, {@code manifest} and {@code spine} must parse; a broken
 * {@code guide}, {@code bindings}, {@code tours} or {@code collection} is logged and left out.
 */
@Slf4j
@UtilityClass
public class PackageDocumentXml {

    private static final Pattern MEDIA_TYPE_PATTERN = Pattern.compile("[^/\\s]+/[^/\\s;]+(\\s*;.*)?");

    public static PackageDocument read(Document document, Opf3MetaConverters converters) throws DocumentReadException {
        Element root = document.getDocumentElement();
        EpubVersion version = readVersion(root);
        String uniqueIdentifier = XmlElements.attr(root, "unique-identifier");
        Prefixes prefixes = readPrefixes(root);
        PropertyResolver resolver = PropertyResolver.of(prefixes);
        Metadata metadata = MetadataXml.read(XmlElements.child(root, "metadata", OPF_NS), converters, resolver);
        Manifest manifest = readManifest(XmlElements.child(root, "manifest", OPF_NS), resolver);
        Spine spine = readSpine(XmlElements.child(root, "spine", OPF_NS), resolver);

        PackageDocument packageDocument = new PackageDocument(version, uniqueIdentifier, metadata, manifest, spine);
        packageDocument.setId(XmlElements.optionalAttr(root, "id"));
        packageDocument.setDirection(XmlElements.optionalDirection(root));
        packageDocument.setLanguage(XmlElements.optionalLanguage(root));
        packageDocument.setPrefixes(prefixes);
        if (metadata.findIdentifier(uniqueIdentifier) == null) {
            log.warn("unique-identifier '{}' does not match any dc:identifier", uniqueIdentifier);
        }

        Element guideElement = XmlElements.optionalChild(root, "guide", OPF_NS);
        if (guideElement != null) {
            packageDocument.setGuide(readOptional(guideElement, GuideXml::read));
        }
        Element bindingsElement = XmlElements.optionalChild(root, "bindings", OPF_NS);
        if (bindingsElement != null) {
            packageDocument.setBindings(readOptional(bindingsElement, PackageDocumentXml::readBindings));
        }
        Element toursElement = XmlElements.optionalChild(root, "tours", OPF_NS);
        if (toursElement != null) {
            packageDocument.setTours(readOptional(toursElement, PackageDocumentXml::readTours));
        }
        for (Element collection : XmlElements.children(root, "collection", OPF_NS)) {
            Element kept = readOptional(collection, PackageDocumentXml::readCollection);
            if (kept != null) {
                packageDocument.getCollections().add(kept);
            }
        }
        return packageDocument;
    }

    private static <T> T readOptional(Element element, XmlElements.ElementParser<T> parser) {
        try {
            return parser.parse(element);
        } catch (DocumentReadException e) {
            log.warn("Ignoring unreadable {}: {}", XmlElements.locate(element), e.getMessage());
            return null;
        }
    }

    private static EpubVersion readVersion(Element root) throws DocumentReadException {
        String value = XmlElements.attr(root, "version");
        String location = XmlElements.locate(root) + "/@version";
        try {
            EpubVersion version = EpubVersion.parse(value);
            EpubFormat format = EpubFormat.resolve(version);
            if (!format.isReadable()) {
                throw DocumentReadException.invalidValue(ReadError.INVALID_VERSION, value, location);
            }
            return version;
        } catch (EpubVersionException e) {
            throw DocumentReadException.invalidValue(ReadError.INVALID_VERSION, value, location, e);
        }
    }

    private static Prefixes readPrefixes(Element root) throws DocumentReadException {
        String value = XmlElements.optionalAttr(root, "prefix");
        if (value == null) {
            return Prefixes.empty();
        }
        try {
            return Prefixes.parse(value);
        } catch (PropertyParseException e) {
            throw DocumentReadException.invalidValue(ReadError.INVALID_PREFIX, value, XmlElements.locate(root) + "/@prefix", e);
        }
    }

    static Manifest readManifest(Element manifestElement, PropertyResolver resolver) throws DocumentReadException {
        Manifest manifest = new Manifest();
        manifest.setId(XmlElements.optionalAttr(manifestElement, "id"));
        for (Element element : XmlElements.requiredChildren(manifestElement, "item", OPF_NS)) {
            ManifestItem item = new ManifestItem(
                    XmlElements.attr(element, "id"),
                    XmlElements.attr(element, "href"),
                    readMediaType(element));
            item.setFallback(XmlElements.optionalAttr(element, "fallback"));
            item.setMediaOverlay(XmlElements.optionalAttr(element, "media-overlay"));
            item.setProperties(MetadataXml.parseOptionalProperties(element, "properties"));
            logUndefinedProperties(item.getProperties(), DefaultVocabulary.MANIFEST, resolver, element);
            if (manifest.hasItem(item.getId())) {
                log.warn("Skipping manifest item with duplicate id '{}' at {}", item.getId(), XmlElements.locate(element));
                continue;
            }
            manifest.addItem(item);
        }
        return manifest;
    }

    private static void logUndefinedProperties(Properties properties, DefaultVocabulary vocabulary,
                                               PropertyResolver resolver, Element element) {
        if (properties == null) {
            return;
        }
        for (Property property : properties) {
            if (resolver.isUndefinedIn(property, vocabulary)) {
                log.debug("Property '{}' at {} is not defined by its vocabulary", property, XmlElements.locate(element));
            }
        }
    }

    private static String readMediaType(Element element) throws DocumentReadException {
        String mediaType = XmlElements.attr(element, "media-type");
        if (!MEDIA_TYPE_PATTERN.matcher(mediaType.trim()).matches()) {
            throw DocumentReadException.invalidValue(ReadError.INVALID_MEDIA_TYPE, mediaType, XmlElements.locate(element) + "/@media-type");
        }
        return mediaType.trim();
    }

    static Spine readSpine(Element spineElement, PropertyResolver resolver) throws DocumentReadException {
        List<SpineReference> references = new ArrayList<>();
        for (Element element : XmlElements.requiredChildren(spineElement, "itemref", OPF_NS)) {
            SpineReference reference = new SpineReference(XmlElements.attr(element, "idref"));
            reference.setId(XmlElements.optionalAttr(element, "id"));
            reference.setLinear(readLinear(element));
            reference.setProperties(MetadataXml.parseOptionalProperties(element, "properties"));
            logUndefinedProperties(reference.getProperties(), DefaultVocabulary.SPINE, resolver, element);
            references.add(reference);
        }
        Spine spine = new Spine(references);
        spine.setId(XmlElements.optionalAttr(spineElement, "id"));
        spine.setToc(XmlElements.optionalAttr(spineElement, "toc"));
        String direction = XmlElements.optionalAttr(spineElement, "page-progression-direction");
        if (direction != null) {
            spine.setPageProgressionDirection(PageProgressionDirection.fromValue(direction,
                    XmlElements.locate(spineElement) + "/@page-progression-direction"));
        }
        return spine;
    }

    /**
     * {@code linear} is exactly {@code yes} or {@code no}, absent means linear.
     */
    static boolean readLinear(Element itemref) throws DocumentReadException {
        String value = XmlElements.optionalAttr(itemref, "linear");
        if (value == null || value.equals("yes")) {
            return true;
        }
        if (value.equals("no")) {
            return false;
        }
        throw DocumentReadException.invalidValue(ReadError.INVALID_LINEAR_VALUE, value, XmlElements.locate(itemref) + "/@linear");
    }

    static Bindings readBindings(Element bindingsElement) throws DocumentReadException {
        List<Bindings.MediaType> mediaTypes = XmlElements.parseAll(
                XmlElements.requiredChildren(bindingsElement, "mediaType", OPF_NS),
                element -> new Bindings.MediaType(readMediaType(element), XmlElements.attr(element, "handler")));
        return new Bindings(new ArrayList<>(mediaTypes));
    }

    static Tours readTours(Element toursElement) throws DocumentReadException {
        List<Tours.Tour> tours = XmlElements.parseAll(
                XmlElements.requiredChildren(toursElement, "tour", OPF_NS),
                element -> new Tours.Tour(
                        XmlElements.attr(element, "id"),
                        XmlElements.attr(element, "title"),
                        new ArrayList<>(XmlElements.parseAll(
                                XmlElements.requiredChildren(element, "site", OPF_NS),
                                site -> new Tours.Site(XmlElements.attr(site, "href"), XmlElements.attr(site, "title"))))));
        return new Tours(new ArrayList<>(tours));
    }

    private static Element readCollection(Element collection) throws DocumentReadException {
        XmlElements.attr(collection, "role");
        return collection;
    }

    public static Document write(PackageDocument packageDocument, boolean omitLegacyFeatures) {
        EpubFormat format = packageDocument.getFormat();
        boolean omitLegacy = omitLegacyFeatures && format.isEpub3();
        Document document = XmlDocuments.newDocument(OPF_NS, "package");
        Element root = document.getDocumentElement();
        XmlElements.setAttribute(root, "version", packageDocument.getVersion());
        XmlElements.setAttribute(root, "unique-identifier", packageDocument.getUniqueIdentifier());
        XmlElements.setAttribute(root, "id", packageDocument.getId());
        XmlElements.setDirection(root, packageDocument.getDirection());
        XmlElements.setLanguage(root, packageDocument.getLanguage());
        if (!packageDocument.getPrefixes().isEmpty()) {
            XmlElements.setAttribute(root, "prefix", packageDocument.getPrefixes());
        }

        MetadataXml.write(root, packageDocument.getMetadata(), format, omitLegacyFeatures);
        writeManifest(root, packageDocument.getManifest(), format);
        writeSpine(root, packageDocument.getSpine(), format);
        Guide guide = packageDocument.getGuide();
        if (guide != null && !omitLegacy) {
            GuideXml.write(root, guide);
        }
        if (packageDocument.getBindings() != null) {
            writeBindings(root, packageDocument.getBindings());
        }
        if (packageDocument.getTours() != null && !omitLegacy) {
            writeTours(root, packageDocument.getTours());
        }
        for (Element collection : packageDocument.getCollections()) {
            root.appendChild(document.importNode(collection, true));
        }
        return document;
    }

    private static void writeManifest(Element root, Manifest manifest, EpubFormat format) {
        Element manifestElement = XmlElements.appendElement(root, OPF_NS, "manifest");
        XmlElements.setAttribute(manifestElement, "id", manifest.getId());
        for (ManifestItem item : manifest.getItems()) {
            Element element = XmlElements.appendElement(manifestElement, OPF_NS, "item");
            XmlElements.setAttribute(element, "id", item.getId());
            XmlElements.setAttribute(element, "href", item.getHref());
            XmlElements.setAttribute(element, "media-type", item.getMediaType());
            XmlElements.setAttribute(element, "fallback", item.getFallback());
            XmlElements.setAttribute(element, "media-overlay", item.getMediaOverlay());
            if (format.isEpub3()) {
                XmlElements.setAttribute(element, "properties", nonEmpty(item.getProperties()));
            }
        }
    }

    private static void writeSpine(Element root, Spine spine, EpubFormat format) {
        Element spineElement = XmlElements.appendElement(root, OPF_NS, "spine");
        XmlElements.setAttribute(spineElement, "id", spine.getId());
        XmlElements.setAttribute(spineElement, "toc", spine.getToc());
        if (spine.getPageProgressionDirection() != null) {
            XmlElements.setAttribute(spineElement, "page-progression-direction", spine.getPageProgressionDirection().getValue());
        }
        for (SpineReference reference : spine.getReferences()) {
            Element element = XmlElements.appendElement(spineElement, OPF_NS, "itemref");
            XmlElements.setAttribute(element, "idref", reference.getIdref());
            XmlElements.setAttribute(element, "id", reference.getId());
            if (!reference.isLinear()) {
                XmlElements.setAttribute(element, "linear", "no");
            }
            if (format.isEpub3()) {
                XmlElements.setAttribute(element, "properties", nonEmpty(reference.getProperties()));
            }
        }
    }

    private static void writeBindings(Element root, Bindings bindings) {
        XmlElements.addChildrenWithWrapper(root, OPF_NS, "bindings", bindings.getMediaTypes(), (document, mediaType) -> {
            Element element = document.createElementNS(OPF_NS, "mediaType");
            XmlElements.setAttribute(element, "media-type", mediaType.getMediaType());
            XmlElements.setAttribute(element, "handler", mediaType.getHandler());
            return element;
        });
    }

    private static void writeTours(Element root, Tours tours) {
        XmlElements.addChildrenWithWrapper(root, OPF_NS, "tours", tours.getTours(), (document, tour) -> {
            Element element = document.createElementNS(OPF_NS, "tour");
            XmlElements.setAttribute(element, "id", tour.getId());
            XmlElements.setAttribute(element, "title", tour.getTitle());
            XmlElements.addChildren(element, tour.getSites(), (doc, site) -> {
                Element siteElement = doc.createElementNS(OPF_NS, "site");
                XmlElements.setAttribute(siteElement, "href", site.getHref());
                XmlElements.setAttribute(siteElement, "title", site.getTitle());
                return siteElement;
            });
            return element;
        });
    }

    private static Properties nonEmpty(Properties properties) {
        return properties == null || properties.isEmpty() ? null : properties;
    }
}

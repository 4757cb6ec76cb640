package org.epubby.model.metainf;

import lombok.experimental.UtilityClass;
import org.epubby.exception.DocumentReadException;
import org.epubby.xml.XmlDocuments;
import org.epubby.xml.XmlElements;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

import static org.epubby.xml.Namespaces.CONTAINER_NS;

@UtilityClass
public class MetaInfContainerXml {

    public static MetaInfContainer read(Document document) throws DocumentReadException {
        Element root = document.getDocumentElement();
        String version = XmlElements.attr(root, "version");
        List<MetaInfContainer.RootFile> rootFiles = XmlElements.parseAll(
                XmlElements.childrenWrapper(root, "rootfiles", "rootfile", CONTAINER_NS),
                element -> new MetaInfContainer.RootFile(
                        XmlElements.attr(element, "full-path"),
                        XmlElements.attr(element, "media-type")));
        List<Element> linkElements = XmlElements.optionalChildrenWrapper(root, "links", "link", CONTAINER_NS);
        List<MetaInfContainer.Link> links = linkElements == null ? new ArrayList<>() : XmlElements.parseAll(
                linkElements,
                element -> new MetaInfContainer.Link(
                        XmlElements.attr(element, "href"),
                        XmlElements.optionalAttr(element, "rel"),
                        XmlElements.optionalAttr(element, "mediaType")));
        return new MetaInfContainer(version, new ArrayList<>(rootFiles), new ArrayList<>(links));
    }

    public static Document write(MetaInfContainer container) {
        Document document = XmlDocuments.newDocument(CONTAINER_NS, "container");
        Element root = document.getDocumentElement();
        XmlElements.setAttribute(root, "version", container.getVersion());
        XmlElements.addChildrenWithWrapper(root, CONTAINER_NS, "rootfiles", container.getRootFiles(), (doc, rootFile) -> {
            Element element = doc.createElementNS(CONTAINER_NS, "rootfile");
            XmlElements.setAttribute(element, "full-path", rootFile.getFullPath());
            XmlElements.setAttribute(element, "media-type", rootFile.getMediaType());
            return element;
        });
        XmlElements.addChildrenWithWrapper(root, CONTAINER_NS, "links", container.getLinks(), (doc, link) -> {
            Element element = doc.createElementNS(CONTAINER_NS, "link");
            XmlElements.setAttribute(element, "href", link.getHref());
            XmlElements.setAttribute(element, "rel", link.getRelation());
            XmlElements.setAttribute(element, "mediaType", link.getMediaType());
            return element;
        });
        return document;
    }
}

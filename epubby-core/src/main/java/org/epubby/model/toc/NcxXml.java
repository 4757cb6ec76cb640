package org.epubby.model.toc;

import lombok.experimental.UtilityClass;
import org.epubby.exception.DocumentReadException;
import org.epubby.exception.ReadError;
import org.epubby.xml.XmlDocuments;
import org.epubby.xml.XmlElements;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

import static org.epubby.xml.Namespaces.NCX_NS;

@UtilityClass
public class NcxXml {

    /**
     * Reads an NCX document, every {@code content/@src} has to resolve through {@code references}.
     */
    public static Ncx read(Document document, ManifestReferences references) throws DocumentReadException {
        Element root = document.getDocumentElement();
        Ncx ncx = new Ncx();
        ncx.setVersion(XmlElements.attr(root, "version"));
        ncx.setLanguage(XmlElements.optionalLanguage(root));
        ncx.setDirection(XmlElements.optionalDirection(root));
        Element head = XmlElements.optionalChild(root, "head", NCX_NS);
        if (head != null) {
            ncx.setHead(new ArrayList<>(XmlElements.parseAll(XmlElements.children(head, "meta", NCX_NS),
                    element -> new Ncx.HeadMeta(
                            XmlElements.attr(element, "name"),
                            XmlElements.attr(element, "content"),
                            XmlElements.optionalAttr(element, "scheme")))));
        }
        ncx.setDocTitle(readDocText(XmlElements.child(root, "docTitle", NCX_NS)));
        ncx.setDocAuthors(new ArrayList<>(XmlElements.parseAll(XmlElements.children(root, "docAuthor", NCX_NS), NcxXml::readDocText)));
        ncx.setNavMap(readNavMap(XmlElements.child(root, "navMap", NCX_NS), references));
        Element pageList = XmlElements.optionalChild(root, "pageList", NCX_NS);
        if (pageList != null) {
            ncx.setPageList(readPageList(pageList, references));
        }
        for (Element navList : XmlElements.children(root, "navList", NCX_NS)) {
            ncx.getNavLists().add(readNavList(navList, references));
        }
        return ncx;
    }

    private static Ncx.DocText readDocText(Element element) throws DocumentReadException {
        return new Ncx.DocText(
                XmlElements.optionalAttr(element, "id"),
                XmlElements.text(XmlElements.child(element, "text", NCX_NS)),
                readOptionalImg(element));
    }

    private static Ncx.Img readOptionalImg(Element parent) throws DocumentReadException {
        Element img = XmlElements.optionalChild(parent, "img", NCX_NS);
        if (img == null) {
            return null;
        }
        return new Ncx.Img(XmlElements.attr(img, "src"), XmlElements.optionalAttr(img, "id"), XmlElements.optionalAttr(img, "class"));
    }

    private static Ncx.Label readLabel(Element element) throws DocumentReadException {
        return new Ncx.Label(
                XmlElements.text(XmlElements.child(element, "text", NCX_NS)),
                readOptionalImg(element),
                XmlElements.optionalLanguage(element),
                XmlElements.optionalDirection(element));
    }

    private static List<Ncx.Label> readLabels(Element parent, String name) throws DocumentReadException {
        return new ArrayList<>(XmlElements.parseAll(XmlElements.children(parent, name, NCX_NS), NcxXml::readLabel));
    }

    private static List<Ncx.Label> readRequiredLabels(Element parent) throws DocumentReadException {
        return new ArrayList<>(XmlElements.parseAll(XmlElements.requiredChildren(parent, "navLabel", NCX_NS), NcxXml::readLabel));
    }

    private static Ncx.Content readContent(Element parent, ManifestReferences references) throws DocumentReadException {
        Element content = XmlElements.child(parent, "content", NCX_NS);
        String src = XmlElements.attr(content, "src");
        references.require(src, XmlElements.locate(content) + "/@src");
        return new Ncx.Content(XmlElements.optionalAttr(content, "id"), src);
    }

    private static Integer readPlayOrder(Element element) throws DocumentReadException {
        String value = XmlElements.optionalAttr(element, "playOrder");
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw DocumentReadException.invalidValue(ReadError.INVALID_NUMBER, value, XmlElements.locate(element) + "/@playOrder", e);
        }
    }

    private static Ncx.NavMap readNavMap(Element element, ManifestReferences references) throws DocumentReadException {
        Ncx.NavMap navMap = new Ncx.NavMap();
        navMap.setId(XmlElements.optionalAttr(element, "id"));
        navMap.setNavInfo(readLabels(element, "navInfo"));
        navMap.setNavLabels(readLabels(element, "navLabel"));
        List<Ncx.NavPoint> points = new ArrayList<>();
        for (Element point : XmlElements.requiredChildren(element, "navPoint", NCX_NS)) {
            points.add(readNavPoint(point, references));
        }
        navMap.setNavPoints(points);
        return navMap;
    }

    private static Ncx.NavPoint readNavPoint(Element element, ManifestReferences references) throws DocumentReadException {
        Ncx.NavPoint point = new Ncx.NavPoint();
        point.setId(XmlElements.attr(element, "id"));
        point.setClazz(XmlElements.optionalAttr(element, "class"));
        point.setPlayOrder(readPlayOrder(element));
        point.setNavLabels(readRequiredLabels(element));
        point.setContent(readContent(element, references));
        for (Element child : XmlElements.children(element, "navPoint", NCX_NS)) {
            point.getChildren().add(readNavPoint(child, references));
        }
        return point;
    }

    private static Ncx.PageList readPageList(Element element, ManifestReferences references) throws DocumentReadException {
        Ncx.PageList pageList = new Ncx.PageList();
        pageList.setId(XmlElements.optionalAttr(element, "id"));
        pageList.setClazz(XmlElements.optionalAttr(element, "class"));
        pageList.setNavInfo(readLabels(element, "navInfo"));
        pageList.setNavLabels(readLabels(element, "navLabel"));
        for (Element targetElement : XmlElements.requiredChildren(element, "pageTarget", NCX_NS)) {
            Ncx.PageTarget target = new Ncx.PageTarget();
            target.setId(XmlElements.attr(targetElement, "id"));
            target.setValue(XmlElements.optionalAttr(targetElement, "value"));
            String type = XmlElements.attr(targetElement, "type");
            target.setType(Ncx.PageTargetType.fromValue(type));
            if (target.getType() == null) {
                throw DocumentReadException.invalidValue(ReadError.UNKNOWN_PAGE_TARGET_TYPE, type, XmlElements.locate(targetElement) + "/@type");
            }
            target.setClazz(XmlElements.optionalAttr(targetElement, "class"));
            target.setPlayOrder(readPlayOrder(targetElement));
            target.setNavLabels(readRequiredLabels(targetElement));
            target.setContent(readContent(targetElement, references));
            pageList.getPageTargets().add(target);
        }
        return pageList;
    }

    private static Ncx.NavList readNavList(Element element, ManifestReferences references) throws DocumentReadException {
        Ncx.NavList navList = new Ncx.NavList();
        navList.setId(XmlElements.optionalAttr(element, "id"));
        navList.setClazz(XmlElements.optionalAttr(element, "class"));
        navList.setNavInfo(readLabels(element, "navInfo"));
        navList.setNavLabels(readRequiredLabels(element));
        for (Element targetElement : XmlElements.requiredChildren(element, "navTarget", NCX_NS)) {
            Ncx.NavTarget target = new Ncx.NavTarget();
            target.setId(XmlElements.attr(targetElement, "id"));
            target.setValue(XmlElements.optionalAttr(targetElement, "value"));
            target.setClazz(XmlElements.optionalAttr(targetElement, "class"));
            target.setPlayOrder(readPlayOrder(targetElement));
            target.setNavLabels(readRequiredLabels(targetElement));
            target.setContent(readContent(targetElement, references));
            navList.getNavTargets().add(target);
        }
        return navList;
    }

    public static Document write(Ncx ncx) {
        Document document = XmlDocuments.newDocument(NCX_NS, "ncx");
        Element root = document.getDocumentElement();
        XmlElements.setAttribute(root, "version", ncx.getVersion());
        XmlElements.setLanguage(root, ncx.getLanguage());
        XmlElements.setDirection(root, ncx.getDirection());
        Element head = XmlElements.appendElement(root, NCX_NS, "head");
        for (Ncx.HeadMeta meta : ncx.getHead()) {
            Element element = XmlElements.appendElement(head, NCX_NS, "meta");
            XmlElements.setAttribute(element, "name", meta.getName());
            XmlElements.setAttribute(element, "content", meta.getContent());
            XmlElements.setAttribute(element, "scheme", meta.getScheme());
        }
        if (ncx.getDocTitle() != null) {
            writeDocText(root, "docTitle", ncx.getDocTitle());
        }
        for (Ncx.DocText author : ncx.getDocAuthors()) {
            writeDocText(root, "docAuthor", author);
        }
        if (ncx.getNavMap() != null) {
            Ncx.NavMap navMap = ncx.getNavMap();
            Element navMapElement = XmlElements.appendElement(root, NCX_NS, "navMap");
            XmlElements.setAttribute(navMapElement, "id", navMap.getId());
            writeLabels(navMapElement, "navInfo", navMap.getNavInfo());
            writeLabels(navMapElement, "navLabel", navMap.getNavLabels());
            for (Ncx.NavPoint point : navMap.getNavPoints()) {
                writeNavPoint(navMapElement, point);
            }
        }
        if (ncx.getPageList() != null) {
            writePageList(root, ncx.getPageList());
        }
        for (Ncx.NavList navList : ncx.getNavLists()) {
            writeNavList(root, navList);
        }
        return document;
    }

    private static void writeDocText(Element parent, String name, Ncx.DocText docText) {
        Element element = XmlElements.appendElement(parent, NCX_NS, name);
        XmlElements.setAttribute(element, "id", docText.getId());
        XmlElements.appendTextElement(element, NCX_NS, "text", docText.getText());
        writeImg(element, docText.getImg());
    }

    private static void writeImg(Element parent, Ncx.Img img) {
        if (img == null) {
            return;
        }
        Element element = XmlElements.appendElement(parent, NCX_NS, "img");
        XmlElements.setAttribute(element, "src", img.getSrc());
        XmlElements.setAttribute(element, "id", img.getId());
        XmlElements.setAttribute(element, "class", img.getClazz());
    }

    private static void writeLabels(Element parent, String name, List<Ncx.Label> labels) {
        for (Ncx.Label label : labels) {
            Element element = XmlElements.appendElement(parent, NCX_NS, name);
            XmlElements.setLanguage(element, label.getLanguage());
            XmlElements.setDirection(element, label.getDirection());
            XmlElements.appendTextElement(element, NCX_NS, "text", label.getText());
            writeImg(element, label.getImg());
        }
    }

    private static void writeContent(Element parent, Ncx.Content content) {
        Element element = XmlElements.appendElement(parent, NCX_NS, "content");
        XmlElements.setAttribute(element, "id", content.getId());
        XmlElements.setAttribute(element, "src", content.getSrc());
    }

    private static void writeNavPoint(Element parent, Ncx.NavPoint point) {
        Element element = XmlElements.appendElement(parent, NCX_NS, "navPoint");
        XmlElements.setAttribute(element, "id", point.getId());
        XmlElements.setAttribute(element, "class", point.getClazz());
        XmlElements.setAttribute(element, "playOrder", point.getPlayOrder());
        writeLabels(element, "navLabel", point.getNavLabels());
        writeContent(element, point.getContent());
        for (Ncx.NavPoint child : point.getChildren()) {
            writeNavPoint(element, child);
        }
    }

    private static void writePageList(Element root, Ncx.PageList pageList) {
        Element element = XmlElements.appendElement(root, NCX_NS, "pageList");
        XmlElements.setAttribute(element, "id", pageList.getId());
        XmlElements.setAttribute(element, "class", pageList.getClazz());
        writeLabels(element, "navInfo", pageList.getNavInfo());
        writeLabels(element, "navLabel", pageList.getNavLabels());
        for (Ncx.PageTarget target : pageList.getPageTargets()) {
            Element targetElement = XmlElements.appendElement(element, NCX_NS, "pageTarget");
            XmlElements.setAttribute(targetElement, "id", target.getId());
            XmlElements.setAttribute(targetElement, "value", target.getValue());
            XmlElements.setAttribute(targetElement, "type", target.getType() == null ? null : target.getType().getValue());
            XmlElements.setAttribute(targetElement, "class", target.getClazz());
            XmlElements.setAttribute(targetElement, "playOrder", target.getPlayOrder());
            writeLabels(targetElement, "navLabel", target.getNavLabels());
            writeContent(targetElement, target.getContent());
        }
    }

    private static void writeNavList(Element root, Ncx.NavList navList) {
        Element element = XmlElements.appendElement(root, NCX_NS, "navList");
        XmlElements.setAttribute(element, "id", navList.getId());
        XmlElements.setAttribute(element, "class", navList.getClazz());
        writeLabels(element, "navInfo", navList.getNavInfo());
        writeLabels(element, "navLabel", navList.getNavLabels());
        for (Ncx.NavTarget target : navList.getNavTargets()) {
            Element targetElement = XmlElements.appendElement(element, NCX_NS, "navTarget");
            XmlElements.setAttribute(targetElement, "id", target.getId());
            XmlElements.setAttribute(targetElement, "value", target.getValue());
            XmlElements.setAttribute(targetElement, "class", target.getClazz());
            XmlElements.setAttribute(targetElement, "playOrder", target.getPlayOrder());
            writeLabels(targetElement, "navLabel", target.getNavLabels());
            writeContent(targetElement, target.getContent());
        }
    }
}

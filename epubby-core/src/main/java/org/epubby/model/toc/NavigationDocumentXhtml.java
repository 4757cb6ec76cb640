package org.epubby.model.toc;

import lombok.experimental.UtilityClass;
import org.epubby.exception.DocumentReadException;
import org.epubby.util.HrefUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.DocumentType;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.XmlDeclaration;
import org.jsoup.parser.Parser;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Pattern;

import static org.epubby.xml.Namespaces.EPUB_NS;
import static org.epubby.xml.Namespaces.XHTML_NS;

/**
 * Reads and writes navigation documents with jsoup. The XML parser keeps prefixed attributes such as
 * {@code epub:type} intact.
 */
@UtilityClass
public class NavigationDocumentXhtml {

    private static final Pattern HEADING_TAG = Pattern.compile("h[1-6]");

    public static NavigationDocument read(String xhtml, ManifestReferences references) throws DocumentReadException {
        Document document = Jsoup.parse(xhtml, "", Parser.xmlParser());
        NavigationDocument navigationDocument = new NavigationDocument();
        Element title = document.selectFirst("title");
        navigationDocument.setTitle(title == null ? null : title.text());
        Element html = document.selectFirst("html");
        if (html != null) {
            String language = html.hasAttr("xml:lang") ? html.attr("xml:lang") : html.attr("lang");
            navigationDocument.setLanguage(language.isEmpty() ? null : language);
        }
        for (Element navElement : document.getElementsByTag("nav")) {
            navigationDocument.getNavs().add(readNav(navElement, references));
        }
        if (navigationDocument.getNavs().isEmpty()) {
            throw DocumentReadException.missingElement("nav", "/html/body");
        }
        return navigationDocument;
    }

    private static NavigationDocument.Nav readNav(Element navElement, ManifestReferences references) throws DocumentReadException {
        String epubType = navElement.hasAttr("epub:type") ? navElement.attr("epub:type") : null;
        NavigationDocument.Nav nav = new NavigationDocument.Nav();
        nav.setType(NavigationDocument.NavType.fromEpubType(epubType));
        nav.setEpubType(epubType);
        nav.setId(navElement.hasAttr("id") ? navElement.attr("id") : null);
        nav.setHidden(navElement.hasAttr("hidden"));
        for (Element child : navElement.children()) {
            if (HEADING_TAG.matcher(child.tagName()).matches()) {
                nav.setHeading(new NavigationDocument.Heading(child.tagName(), child.text()));
                break;
            }
        }
        Element list = requiredChild(navElement, "ol");
        readItems(list, nav.getItems(), references);
        return nav;
    }

    private static void readItems(Element list, List<NavigationDocument.NavItem> target, ManifestReferences references)
            throws DocumentReadException {
        List<Element> items = list.children().stream().filter(child -> child.tagName().equals("li")).toList();
        if (items.isEmpty()) {
            throw DocumentReadException.missingElement("li", locate(list));
        }
        for (Element li : items) {
            NavigationDocument.NavItem item = new NavigationDocument.NavItem();
            Element link = firstChild(li, "a");
            if (link != null) {
                if (!link.hasAttr("href")) {
                    throw DocumentReadException.missingAttribute("href", locate(link));
                }
                String href = link.attr("href");
                if (!HrefUtils.isRemote(href)) {
                    references.require(href, locate(link) + "/@href");
                }
                item.setHref(href);
                item.setText(link.text());
                item.setEpubType(link.hasAttr("epub:type") ? link.attr("epub:type") : null);
            } else {
                Element span = firstChild(li, "span");
                if (span == null) {
                    throw DocumentReadException.missingElement("a", locate(li));
                }
                item.setText(span.text());
            }
            Element nested = firstChild(li, "ol");
            if (nested != null) {
                readItems(nested, item.getChildren(), references);
            }
            target.add(item);
        }
    }

    private static Element firstChild(Element parent, String tag) {
        for (Element child : parent.children()) {
            if (child.tagName().equals(tag)) {
                return child;
            }
        }
        return null;
    }

    private static Element requiredChild(Element parent, String tag) throws DocumentReadException {
        Element child = firstChild(parent, tag);
        if (child == null) {
            throw DocumentReadException.missingElement(tag, locate(parent));
        }
        return child;
    }

    private static String locate(Element element) {
        return element.cssSelector();
    }

    /**
     * Renders {@code navigationDocument} as a standalone XHTML document.
     */
    public static String write(NavigationDocument navigationDocument) {
        Document document = new Document("");
        document.outputSettings()
                .syntax(Document.OutputSettings.Syntax.xml)
                .escapeMode(Entities.EscapeMode.xhtml)
                .charset(StandardCharsets.UTF_8)
                .prettyPrint(true);
        XmlDeclaration declaration = new XmlDeclaration("xml", false);
        declaration.attr("version", "1.0");
        declaration.attr("encoding", "UTF-8");
        document.appendChild(declaration);
        document.appendChild(new DocumentType("html", "", ""));

        Element html = document.appendElement("html");
        html.attr("xmlns", XHTML_NS);
        html.attr("xmlns:epub", EPUB_NS);
        if (navigationDocument.getLanguage() != null) {
            html.attr("lang", navigationDocument.getLanguage());
            html.attr("xml:lang", navigationDocument.getLanguage());
        }
        html.appendElement("head").appendElement("title")
                .text(navigationDocument.getTitle() == null ? "" : navigationDocument.getTitle());
        Element body = html.appendElement("body");
        for (NavigationDocument.Nav nav : navigationDocument.getNavs()) {
            Element navElement = body.appendElement("nav");
            if (nav.getEpubType() != null) {
                navElement.attr("epub:type", nav.getEpubType());
            }
            if (nav.getId() != null) {
                navElement.attr("id", nav.getId());
            }
            if (nav.isHidden()) {
                navElement.attr("hidden", "hidden");
            }
            if (nav.getHeading() != null) {
                navElement.appendElement(nav.getHeading().getTag()).text(nav.getHeading().getText());
            }
            writeItems(navElement.appendElement("ol"), nav.getItems());
        }
        return document.outerHtml();
    }

    private static void writeItems(Element list, List<NavigationDocument.NavItem> items) {
        for (NavigationDocument.NavItem item : items) {
            Element li = list.appendElement("li");
            if (item.isLink()) {
                Element link = li.appendElement("a").attr("href", item.getHref()).text(item.getText());
                if (item.getEpubType() != null) {
                    link.attr("epub:type", item.getEpubType());
                }
            } else {
                li.appendElement("span").text(item.getText());
            }
            if (!item.getChildren().isEmpty()) {
                writeItems(li.appendElement("ol"), item.getChildren());
            }
        }
    }
}

package org.epubby.model.opf.guide;

import lombok.experimental.UtilityClass;
import org.epubby.exception.DocumentReadException;
import org.epubby.xml.XmlElements;
import org.w3c.dom.Element;

import static org.epubby.xml.Namespaces.OPF_NS;

@UtilityClass
public class GuideXml {

    public static Guide read(Element guideElement) throws DocumentReadException {
        Guide guide = new Guide();
        for (Element element : XmlElements.requiredChildren(guideElement, "reference", OPF_NS)) {
            String type = XmlElements.attr(element, "type");
            String href = XmlElements.attr(element, "href");
            String title = XmlElements.optionalAttr(element, "title");
            ReferenceType referenceType = ReferenceType.fromType(type);
            if (referenceType != null) {
                guide.addReference(referenceType, href, title);
            } else {
                guide.addCustomReference(type, href, title);
            }
        }
        return guide;
    }

    /**
     * Appends a {@code guide} element, nothing when the guide is empty.
     */
    public static Element write(Element packageElement, Guide guide) {
        if (guide.isEmpty()) {
            return null;
        }
        Element guideElement = XmlElements.appendElement(packageElement, OPF_NS, "guide");
        for (GuideReference reference : guide.getReferences().values()) {
            writeReference(guideElement, reference.getType().getType(), reference.getHref(), reference.getTitle());
        }
        for (CustomGuideReference reference : guide.getCustomReferences().values()) {
            writeReference(guideElement, CustomGuideReference.PREFIX + reference.getType(), reference.getHref(), reference.getTitle());
        }
        return guideElement;
    }

    private static void writeReference(Element parent, String type, String href, String title) {
        Element element = XmlElements.appendElement(parent, OPF_NS, "reference");
        XmlElements.setAttribute(element, "type", type);
        XmlElements.setAttribute(element, "href", href);
        XmlElements.setAttribute(element, "title", title);
    }
}

package org.epubby.model.opf.guide;

import org.epubby.exception.DocumentReadException;
import org.epubby.xml.Namespaces;
import org.epubby.xml.XmlDocuments;
import org.epubby.xml.XmlElements;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GuideTest {

    private Guide guide;
    private GuideReferenceCorrector corrector;

    @BeforeEach
    void setUp() {
        guide = new Guide();
        corrector = new GuideReferenceCorrector(Map.of("copyright", ReferenceType.COPYRIGHT_PAGE));
    }

    @Nested
    class References {

        @Test
        void customTypesLoseTheirPrefix() {
            guide.addCustomReference("other.maps", "maps.xhtml", "Maps");

            assertEquals("maps.xhtml", guide.getCustomReference("maps").getHref());
        }

        @Test
        void knownTypeIsNotACustomType() {
            assertThrows(IllegalArgumentException.class, () -> guide.addCustomReference("other.TOC", "toc.xhtml", null));
        }

        @Test
        void sameTypeReplacesReference() {
            guide.addReference(ReferenceType.COVER, "cover1.xhtml", null);
            guide.addReference(ReferenceType.COVER, "cover2.xhtml", null);

            assertEquals(1, guide.getReferences().size());
            assertEquals("cover2.xhtml", guide.getReference(ReferenceType.COVER).getHref());
        }

        @Test
        void removesCustomReferenceWithOrWithoutPrefix() {
            guide.addCustomReference("maps", "maps.xhtml", null);
            guide.addCustomReference("charts", "charts.xhtml", null);

            assertEquals("maps.xhtml", guide.removeCustomReference("other.maps").getHref());
            assertNotNull(guide.removeCustomReference("charts"));
            assertNull(guide.removeCustomReference("maps"));
            assertTrue(guide.isEmpty());
        }
    }

    @Nested
    class Correction {

        @Test
        void remapsWhenTypeIsFree() {
            guide.addCustomReference("Copyright", "legal.xhtml", "Legal");

            guide.correctCustomTypes(corrector, CorrectorDuplicationStrategy.DO_NOTHING);

            assertTrue(guide.getCustomReferences().isEmpty());
            assertEquals("legal.xhtml", guide.getReference(ReferenceType.COPYRIGHT_PAGE).getHref());
        }

        @Test
        void replaceExistingPrefersCustom() {
            guide.addReference(ReferenceType.COPYRIGHT_PAGE, "old.xhtml", null);
            guide.addCustomReference("copyright", "new.xhtml", null);

            guide.correctCustomTypes(corrector, CorrectorDuplicationStrategy.REPLACE_EXISTING);

            assertEquals("new.xhtml", guide.getReference(ReferenceType.COPYRIGHT_PAGE).getHref());
            assertTrue(guide.getCustomReferences().isEmpty());
        }

        @Test
        void removeCustomKeepsExisting() {
            guide.addReference(ReferenceType.COPYRIGHT_PAGE, "old.xhtml", null);
            guide.addCustomReference("copyright", "new.xhtml", null);

            guide.correctCustomTypes(corrector, CorrectorDuplicationStrategy.REMOVE_CUSTOM);

            assertEquals("old.xhtml", guide.getReference(ReferenceType.COPYRIGHT_PAGE).getHref());
            assertTrue(guide.getCustomReferences().isEmpty());
        }

        @Test
        void doNothingKeepsBoth() {
            guide.addReference(ReferenceType.COPYRIGHT_PAGE, "old.xhtml", null);
            guide.addCustomReference("copyright", "new.xhtml", null);

            guide.correctCustomTypes(corrector, CorrectorDuplicationStrategy.DO_NOTHING);

            assertEquals("old.xhtml", guide.getReference(ReferenceType.COPYRIGHT_PAGE).getHref());
            assertEquals("new.xhtml", guide.getCustomReference("copyright").getHref());
        }

        @Test
        void unknownCustomTypesStay() {
            guide.addCustomReference("maps", "maps.xhtml", null);

            guide.correctCustomTypes(corrector, CorrectorDuplicationStrategy.REPLACE_EXISTING);

            assertNotNull(guide.getCustomReference("maps"));
        }
    }

    @Nested
    class Xml {

        private Element guideElement(String references) throws DocumentReadException {
            String opf = """
                    <package xmlns="http://www.idpf.org/2007/opf"><guide>%s</guide></package>
                    """.formatted(references);
            Document document = XmlDocuments.parse(opf.getBytes(StandardCharsets.UTF_8), "/content.opf");
            return XmlElements.child(document.getDocumentElement(), "guide", Namespaces.OPF_NS);
        }

        @Test
        void splitsKnownAndCustomTypes() throws DocumentReadException {
            Guide read = GuideXml.read(guideElement("""
                    <reference type="Cover" href="cover.xhtml"/>
                    <reference type="other.maps" href="maps.xhtml" title="Maps"/>
                    """));

            assertEquals("cover.xhtml", read.getReference(ReferenceType.COVER).getHref());
            assertEquals("Maps", read.getCustomReference("maps").getTitle());
        }

        @Test
        void emptyGuideIsRejected() {
            DocumentReadException e = assertThrows(DocumentReadException.class, () -> GuideXml.read(guideElement("")));
            assertEquals("reference", e.getSubject());
        }

        @Test
        void customTypesAreWrittenWithPrefix() {
            guide.addReference(ReferenceType.TEXT, "c1.xhtml", "Start");
            guide.addCustomReference("maps", "maps.xhtml", null);
            Document document = XmlDocuments.newDocument(Namespaces.OPF_NS, "package");

            Element written = GuideXml.write(document.getDocumentElement(), guide);

            List<String> types = XmlElements.elements(written).stream().map(element -> element.getAttribute("type")).toList();
            assertEquals(List.of("text", "other.maps"), types);
        }

        @Test
        void emptyGuideIsNotWritten() {
            Document document = XmlDocuments.newDocument(Namespaces.OPF_NS, "package");

            assertNull(GuideXml.write(document.getDocumentElement(), guide));
            assertFalse(document.getDocumentElement().hasChildNodes());
        }
    }
}

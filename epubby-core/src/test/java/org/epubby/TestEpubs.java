package org.epubby;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Fixture archives for tests. Entries are written in insertion order.
 */
public final class TestEpubs {

    public static final String CONTAINER_XML = """
            <?xml version="1.0" encoding="UTF-8"?>
            <container version="1.0" xmlns="urn:oasis:names:tc:opendocument:xmlns:container">
                <rootfiles>
                    <rootfile full-path="OEBPS/content.opf" media-type="application/oebps-package+xml"/>
                </rootfiles>
            </container>
            """;

    public static final String EPUB2_OPF = """
            <?xml version="1.0" encoding="UTF-8"?>
            <package xmlns="http://www.idpf.org/2007/opf" version="2.0" unique-identifier="book-id">
                <metadata xmlns:dc="http://purl.org/dc/elements/1.1/" xmlns:opf="http://www.idpf.org/2007/opf">
                    <dc:identifier id="book-id" opf:scheme="UUID">urn:uuid:0a1b2c3d</dc:identifier>
                    <dc:title>Test Book</dc:title>
                    <dc:language>en</dc:language>
                    <dc:creator opf:role="aut" opf:file-as="Author, Test">Test Author</dc:creator>
                    <meta name="cover" content="cover-image"/>
                </metadata>
                <manifest>
                    <item id="ncx" href="toc.ncx" media-type="application/x-dtbncx+xml"/>
                    <item id="chapter1" href="chapter1.xhtml" media-type="application/xhtml+xml"/>
                    <item id="chapter2" href="chapter2.xhtml" media-type="application/xhtml+xml"/>
                    <item id="chapter3" href="text/chapter3.xhtml" media-type="application/xhtml+xml"/>
                    <item id="style" href="styles/style.css" media-type="text/css"/>
                </manifest>
                <spine toc="ncx">
                    <itemref idref="chapter1"/>
                    <itemref idref="chapter2"/>
                    <itemref idref="chapter3" linear="no"/>
                </spine>
                <guide>
                    <reference type="toc" href="chapter1.xhtml" title="Contents"/>
                    <reference type="copyright" href="chapter3.xhtml#legal" title="Copyright"/>
                </guide>
            </package>
            """;

    public static final String EPUB2_NCX = """
            <?xml version="1.0" encoding="UTF-8"?>
            <!DOCTYPE ncx PUBLIC "-//NISO//DTD ncx 2005-1//EN" "http://www.daisy.org/z3986/2005/ncx-2005-1.dtd">
            <ncx xmlns="http://www.daisy.org/z3986/2005/ncx/" version="2005-1" xml:lang="en">
                <head>
                    <meta name="dtb:uid" content="urn:uuid:0a1b2c3d"/>
                    <meta name="dtb:depth" content="2"/>
                </head>
                <docTitle><text>Test Book</text></docTitle>
                <docAuthor><text>Test Author</text></docAuthor>
                <navMap>
                    <navPoint id="np1" playOrder="1">
                        <navLabel><text>Chapter 1</text></navLabel>
                        <content src="chapter1.xhtml"/>
                        <navPoint id="np1-1" playOrder="2">
                            <navLabel><text>Section 1.1</text></navLabel>
                            <content src="chapter1.xhtml#section1"/>
                        </navPoint>
                    </navPoint>
                    <navPoint id="np2" playOrder="3">
                        <navLabel><text>Chapter 2</text></navLabel>
                        <content src="chapter2.xhtml"/>
                    </navPoint>
                    <navPoint id="np3" playOrder="4">
                        <navLabel><text>Chapter 3</text></navLabel>
                        <content src="text/chapter3.xhtml"/>
                    </navPoint>
                </navMap>
            </ncx>
            """;

    public static final String EPUB3_OPF = """
            <?xml version="1.0" encoding="UTF-8"?>
            <package xmlns="http://www.idpf.org/2007/opf" version="3.0" unique-identifier="pub-id" xml:lang="en"
                     prefix="foaf: http://xmlns.com/foaf/spec/ dbp: http://dbpedia.org/ontology/">
                <metadata xmlns:dc="http://purl.org/dc/elements/1.1/">
                    <dc:identifier id="pub-id">urn:isbn:9780000000000</dc:identifier>
                    <dc:title id="title">Test Book</dc:title>
                    <dc:language>en</dc:language>
                    <dc:creator id="creator">Test Author</dc:creator>
                    <meta refines="#creator" property="role" scheme="marc:relators" id="role">aut</meta>
                    <meta refines="#role" property="alternate-script" xml:lang="ja">著者</meta>
                    <meta refines="#title" property="title-type">main</meta>
                    <meta property="dcterms:modified">2024-01-01T00:00:00Z</meta>
                    <meta name="cover" content="cover-image"/>
                </metadata>
                <manifest>
                    <item id="nav" href="nav.xhtml" media-type="application/xhtml+xml" properties="nav"/>
                    <item id="chapter1" href="chapter1.xhtml" media-type="application/xhtml+xml"/>
                    <item id="chapter2" href="chapter2.xhtml" media-type="application/xhtml+xml"/>
                    <item id="cover-image" href="images/cover.png" media-type="image/png" properties="cover-image"/>
                </manifest>
                <spine page-progression-direction="ltr">
                    <itemref idref="chapter1" properties="page-spread-right"/>
                    <itemref idref="chapter2"/>
                </spine>
            </package>
            """;

    public static final String EPUB3_NAV = """
            <?xml version="1.0" encoding="UTF-8"?>
            <!DOCTYPE html>
            <html xmlns="http://www.w3.org/1999/xhtml" xmlns:epub="http://www.idpf.org/2007/ops" lang="en" xml:lang="en">
            <head><title>Navigation</title></head>
            <body>
                <nav epub:type="toc" id="toc">
                    <h1>Contents</h1>
                    <ol>
                        <li><a href="chapter1.xhtml">Chapter 1</a>
                            <ol>
                                <li><a href="chapter1.xhtml#s1">Section 1.1</a></li>
                            </ol>
                        </li>
                        <li><a href="chapter2.xhtml">Chapter 2</a></li>
                    </ol>
                </nav>
                <nav epub:type="landmarks" hidden="">
                    <ol>
                        <li><a epub:type="bodymatter" href="chapter1.xhtml">Start</a></li>
                    </ol>
                </nav>
            </body>
            </html>
            """;

    private TestEpubs() {
    }

    public static String chapter(int number) {
        return """
                <?xml version="1.0" encoding="UTF-8"?>
                <!DOCTYPE html>
                <html xmlns="http://www.w3.org/1999/xhtml">
                <head><title>Chapter %d</title></head>
                <body><h1 id="section1">Chapter %d</h1><p>Content of chapter %d.</p></body>
                </html>
                """.formatted(number, number, number);
    }

    public static Map<String, String> epub2Entries() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("mimetype", "application/epub+zip");
        entries.put("META-INF/container.xml", CONTAINER_XML);
        entries.put("OEBPS/content.opf", EPUB2_OPF);
        entries.put("OEBPS/toc.ncx", EPUB2_NCX);
        entries.put("OEBPS/chapter1.xhtml", chapter(1));
        entries.put("OEBPS/chapter2.xhtml", chapter(2));
        entries.put("OEBPS/text/chapter3.xhtml", chapter(3));
        entries.put("OEBPS/styles/style.css", "body { margin: 0; }");
        return entries;
    }

    public static Map<String, String> epub3Entries() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("mimetype", "application/epub+zip");
        entries.put("META-INF/container.xml", CONTAINER_XML);
        entries.put("OEBPS/content.opf", EPUB3_OPF);
        entries.put("OEBPS/nav.xhtml", EPUB3_NAV);
        entries.put("OEBPS/chapter1.xhtml", chapter(1));
        entries.put("OEBPS/chapter2.xhtml", chapter(2));
        entries.put("OEBPS/images/cover.png", "not really a png");
        return entries;
    }

    public static Path writeEpub2(Path directory) throws IOException {
        return writeArchive(directory.resolve("epub2.epub"), epub2Entries());
    }

    public static Path writeEpub3(Path directory) throws IOException {
        return writeArchive(directory.resolve("epub3.epub"), epub3Entries());
    }

    public static Path writeArchive(Path file, Map<String, String> entries) throws IOException {
        try (OutputStream outputStream = Files.newOutputStream(file);
             ZipOutputStream zip = new ZipOutputStream(outputStream)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return file;
    }
}

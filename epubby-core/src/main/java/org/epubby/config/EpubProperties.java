package org.epubby.config;

import lombok.Getter;
import lombok.Setter;
import org.epubby.model.opf.guide.ReferenceType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "epubby")
@Getter
@Setter
public class EpubProperties {

    /**
     * Leave out EPUB 2 only constructs ({@code meta} name/content pairs, {@code guide}, {@code tours}) when saving an
     * EPUB 3 package.
     */
    private boolean omitLegacyFeatures = false;

    /**
     * Where working copies of opened archives are placed.
     */
    private Path workingDirectory = Path.of(System.getProperty("java.io.tmpdir"));

    /**
     * Deflate level of saved archive entries, -1 for the default level.
     */
    private int compressionLevel = -1;

    private Map<String, ReferenceType> defaultGuideCorrections = new LinkedHashMap<>(Map.of("copyright", ReferenceType.COPYRIGHT_PAGE));
}

package org.epubby.model.metainf;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Model of {@code META-INF/container.xml}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetaInfContainer {

    public static final String PATH = "/META-INF/container.xml";
    public static final String OEBPS_MEDIA_TYPE = "application/oebps-package+xml";

    private String version;
    private List<RootFile> rootFiles = new ArrayList<>();
    private List<Link> links = new ArrayList<>();

    /**
     * The first root file holding an OPF package document, or {@code null}.
     */
    public RootFile getOebpsRootFile() {
        return rootFiles.stream()
                .filter(rootFile -> OEBPS_MEDIA_TYPE.equalsIgnoreCase(rootFile.getMediaType()))
                .findFirst()
                .orElse(null);
    }

    @Data
    @AllArgsConstructor
    public static class RootFile {
        private String fullPath;
        private String mediaType;
    }

    @Data
    @AllArgsConstructor
    public static class Link {
        private String href;
        private String relation;
        private String mediaType;
    }
}

package org.epubby.files;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Set;

/**
 * Decides which {@link ResourceAccess} a path is granted. Checks, first match wins:
 * <ol>
 *     <li>the {@code mimetype} file,</li>
 *     <li>the package document,</li>
 *     <li>the control files directly inside {@code META-INF},</li>
 *     <li>a local resource registered in the manifest,</li>
 *     <li>anything else.</li>
 * </ol>
 * The first three compare absolute, normalized paths ignoring case. Nothing here mutates state.
 */
@Slf4j
public class ResourceClassifier {

    public static final String MIME_TYPE_PATH = "/mimetype";
    public static final String META_INF_PATH = "/META-INF";
    public static final Set<String> META_INF_FILES = Set.of(
            "container.xml",
            "encryption.xml",
            "manifest.xml",
            "metadata.xml",
            "rights.xml",
            "signatures.xml"
    );

    private volatile String packageDocumentPath;
    private volatile LocalResourceIndex localResources = LocalResourceIndex.EMPTY;

    /**
     * Registers the package document and the manifest lookup once they are known.
     */
    public void bind(String packageDocumentPath, LocalResourceIndex localResources) {
        this.packageDocumentPath = packageDocumentPath;
        this.localResources = localResources;
        log.debug("Classifier bound to package document '{}'", packageDocumentPath);
    }

    public String getPackageDocumentPath() {
        return packageDocumentPath;
    }

    public ResourceAccess classifyFile(EpubPath location) {
        if (isProtectedFile(location)) {
            return ResourceAccess.READ_ONLY;
        }
        if (localResources.contains(location.toString())) {
            return ResourceAccess.MODIFIABLE;
        }
        return ResourceAccess.UNPROTECTED;
    }

    public ResourceAccess classifyDirectory(EpubPath location) {
        return isProtectedDirectory(location) ? ResourceAccess.READ_ONLY : ResourceAccess.UNPROTECTED;
    }

    public boolean isProtectedFile(EpubPath location) {
        String path = key(location.toString());
        if (path.equals(key(MIME_TYPE_PATH))) {
            return true;
        }
        if (packageDocumentPath != null && path.equals(key(packageDocumentPath))) {
            return true;
        }
        EpubPath parent = location.getParent();
        return parent != null
                && key(parent.toString()).equals(key(META_INF_PATH))
                && META_INF_FILES.contains(key(location.getName()));
    }

    public boolean isProtectedDirectory(EpubPath location) {
        String path = key(location.toString());
        if (location.getNameCount() == 0 || path.equals(key(META_INF_PATH))) {
            return true;
        }
        return packageDocumentPath != null && path.equals(key(parentOf(packageDocumentPath)));
    }

    private static String parentOf(String path) {
        int index = path.lastIndexOf('/');
        return index <= 0 ? "/" : path.substring(0, index);
    }

    private static String key(String path) {
        return path.toLowerCase(Locale.ROOT);
    }
}

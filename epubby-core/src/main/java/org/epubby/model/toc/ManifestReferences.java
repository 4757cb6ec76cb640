package org.epubby.model.toc;

import org.epubby.exception.DocumentReadException;
import org.epubby.exception.ReadError;
import org.epubby.model.opf.Manifest;
import org.epubby.util.HrefUtils;

import java.util.Set;

/**
 * Checks that the links of a table of contents point at local manifest items.
 */
public class ManifestReferences {

    private final Set<String> localPaths;
    private final String documentDirectory;

    /**
     * @param documentPath absolute archive path of the document holding the links
     */
    public ManifestReferences(Manifest manifest, String opfPath, String documentPath) {
        this.localPaths = manifest.getLocalResourcePaths(HrefUtils.directoryOf(opfPath));
        this.documentDirectory = HrefUtils.directoryOf(documentPath);
    }

    public boolean resolves(String href) {
        String path = HrefUtils.resolve(documentDirectory, href);
        return path != null && localPaths.contains(path);
    }

    /**
     * @throws DocumentReadException with {@link ReadError#UNRESOLVED_REFERENCE} if {@code href} does not point at a
     *                               local manifest item
     */
    public void require(String href, String location) throws DocumentReadException {
        if (!resolves(href)) {
            throw DocumentReadException.invalidValue(ReadError.UNRESOLVED_REFERENCE, href, location);
        }
    }
}

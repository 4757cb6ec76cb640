package org.epubby.model.opf;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.Setter;
import org.epubby.files.LocalResourceIndex;
import org.epubby.model.opf.guide.Guide;
import org.epubby.model.opf.metadata.Metadata;
import org.epubby.property.Prefixes;
import org.epubby.property.PropertyResolver;
import org.epubby.util.HrefUtils;
import org.epubby.version.EpubFormat;
import org.epubby.version.EpubVersion;
import org.epubby.version.EpubVersionException;
import org.epubby.xml.ReadingDirection;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * The package document ({@code .opf} file). {@link #getFormat()} always matches {@link #getVersion()}.
 */
@Getter
@Setter
public class PackageDocument {

    @Setter(AccessLevel.NONE)
    private EpubVersion version;
    @Setter(AccessLevel.NONE)
    private EpubFormat format;
    /**
     * Id of the {@code dc:identifier} that identifies the publication.
     */
    @NonNull
    private String uniqueIdentifier;
    private String id;
    private ReadingDirection direction;
    private String language;
    @NonNull
    private Prefixes prefixes = Prefixes.empty();
    @NonNull
    private Metadata metadata;
    @Setter(AccessLevel.NONE)
    private Manifest manifest;
    @NonNull
    private Spine spine;
    private Guide guide;
    private Bindings bindings;
    private Tours tours;
    /**
     * {@code collection} elements, kept as read.
     */
    private List<Element> collections = new ArrayList<>();

    public PackageDocument(EpubVersion version, @NonNull String uniqueIdentifier, @NonNull Metadata metadata,
                           @NonNull Manifest manifest, @NonNull Spine spine) {
        setVersion(version);
        this.uniqueIdentifier = uniqueIdentifier;
        this.metadata = metadata;
        setManifest(manifest);
        this.spine = spine;
    }

    /**
     * @throws IllegalArgumentException if {@code manifest} has no items
     */
    public void setManifest(@NonNull Manifest manifest) {
        if (manifest.size() == 0) {
            throw new IllegalArgumentException("A package document needs a manifest with at least one item");
        }
        this.manifest = manifest;
    }

    /**
     * Changes the version and with it the format.
     *
     * @throws IllegalArgumentException if {@code version} belongs to the withdrawn 3.1 generation or to a format that
     *                                  can not be read
     */
    public void setVersion(@NonNull EpubVersion version) {
        EpubFormat resolved;
        try {
            resolved = EpubFormat.resolve(version);
        } catch (EpubVersionException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        if (!resolved.isReadable()) {
            throw new IllegalArgumentException("EPUB " + version + " (" + resolved + ") is not supported");
        }
        this.version = version;
        this.format = resolved;
    }

    /**
     * Resolves properties against {@link #getPrefixes()} and the reserved prefixes.
     */
    public PropertyResolver getPropertyResolver() {
        return PropertyResolver.of(prefixes);
    }

    /**
     * Lookup of the manifest's local resources, for a package document stored at {@code opfPath}. Reflects later
     * changes to the manifest.
     */
    public LocalResourceIndex localResourceIndex(String opfPath) {
        String opfDirectory = HrefUtils.directoryOf(opfPath);
        return path -> manifest.getLocalResourcePaths(opfDirectory).contains(path);
    }
}

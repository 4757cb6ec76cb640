package org.epubby.model.opf;

import lombok.Getter;
import lombok.Setter;
import org.epubby.property.PropertyResolver;
import org.epubby.util.HrefUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The resources of a publication keyed by item id, in document order. A new manifest starts empty, a
 * {@link PackageDocument} only accepts it once it holds an item.
 */
public class Manifest {

    @Getter
    @Setter
    private String id;
    private final Map<String, ManifestItem> items = new LinkedHashMap<>();

    public Collection<ManifestItem> getItems() {
        return Collections.unmodifiableCollection(items.values());
    }

    public ManifestItem getItem(String itemId) {
        return items.get(itemId);
    }

    public boolean hasItem(String itemId) {
        return items.containsKey(itemId);
    }

    public int size() {
        return items.size();
    }

    /**
     * @throws IllegalArgumentException if an item with the same id exists
     */
    public void addItem(ManifestItem item) {
        Objects.requireNonNull(item.getId(), "Manifest items need an id");
        if (items.putIfAbsent(item.getId(), item) != null) {
            throw new IllegalArgumentException("Manifest already has an item with id '" + item.getId() + "'");
        }
    }

    /**
     * @throws IllegalStateException if {@code itemId} is the only item, a package needs at least one
     */
    public ManifestItem removeItem(String itemId) {
        if (items.size() == 1 && items.containsKey(itemId)) {
            throw new IllegalStateException("Can not remove the last manifest item");
        }
        return items.remove(itemId);
    }

    public List<ManifestItem> findItemsWithProperty(String reference) {
        return findItemsWithProperty(reference, PropertyResolver.RESERVED);
    }

    /**
     * Items carrying {@code reference} of the manifest vocabulary, see
     * {@link ManifestItem#hasProperty(String, PropertyResolver)}.
     */
    public List<ManifestItem> findItemsWithProperty(String reference, PropertyResolver resolver) {
        List<ManifestItem> result = new ArrayList<>();
        for (ManifestItem item : items.values()) {
            if (item.hasProperty(reference, resolver)) {
                result.add(item);
            }
        }
        return result;
    }

    /**
     * The item whose href, resolved against {@code opfDirectory}, is {@code absolutePath}.
     */
    public ManifestItem findItemByPath(String opfDirectory, String absolutePath) {
        for (ManifestItem item : items.values()) {
            if (absolutePath.equals(HrefUtils.resolve(opfDirectory, item.getHref()))) {
                return item;
            }
        }
        return null;
    }

    /**
     * Absolute archive paths of the items stored inside the archive. Remote items are left out.
     */
    public Set<String> getLocalResourcePaths(String opfDirectory) {
        Set<String> paths = new LinkedHashSet<>();
        for (ManifestItem item : items.values()) {
            String path = HrefUtils.resolve(opfDirectory, item.getHref());
            if (path != null) {
                paths.add(path);
            }
        }
        return paths;
    }
}

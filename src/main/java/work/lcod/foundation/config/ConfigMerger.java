package work.lcod.foundation.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges source entries into a {@link ConfigTree}.
 *
 * <p>Tables merge key by key, recursively. Every other combination replaces: scalar over scalar,
 * scalar over table, table over scalar, and arrays, which are never concatenated.
 */
public final class ConfigMerger {
    private ConfigMerger() {}

    public static void merge(ConfigTree tree, ConfigEntry entry) {
        mergeAtPath(tree, entry.path(), entry.value());
    }

    /**
     * Merges {@code value} at {@code path}.
     *
     * <p>An empty path deep-merges a table into the root, or replaces the whole root when the
     * value is not a table. With a non-empty path, missing intermediate tables are created and
     * intermediate scalars are replaced by empty tables.
     */
    public static void mergeAtPath(ConfigTree tree, List<String> path, Object value) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(path, "path");
        Object incoming = ConfigValues.normalize(value);

        if (path.isEmpty()) {
            if (ConfigValues.isTable(incoming)) {
                deepMerge(tree.rootTable(), ConfigValues.asTable(incoming));
            } else {
                tree.replaceRoot(incoming);
            }
            return;
        }

        Map<String, Object> current = tree.rootTable();
        for (String segment : path.subList(0, path.size() - 1)) {
            Object child = current.get(segment);
            if (!ConfigValues.isTable(child)) {
                child = new LinkedHashMap<String, Object>();
                current.put(segment, child);
            }
            current = ConfigValues.asTable(child);
        }
        mergeValue(current, path.get(path.size() - 1), incoming);
    }

    /**
     * Merges every key of {@code overlay} into {@code base}. Values from {@code overlay} are moved,
     * not copied.
     */
    static void deepMerge(Map<String, Object> base, Map<String, Object> overlay) {
        for (var entry : overlay.entrySet()) {
            mergeValue(base, entry.getKey(), entry.getValue());
        }
    }

    private static void mergeValue(Map<String, Object> base, String key, Object value) {
        Object existing = base.get(key);
        if (ConfigValues.isTable(existing) && ConfigValues.isTable(value)) {
            deepMerge(ConfigValues.asTable(existing), ConfigValues.asTable(value));
        } else {
            base.put(key, value);
        }
    }
}

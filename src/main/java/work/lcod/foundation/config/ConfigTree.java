package work.lcod.foundation.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable configuration document built by {@link ConfigMerger} and rewritten by
 * {@link ReferenceResolver}.
 *
 * <p>The root starts as an empty table. It only stops being a table when a root-level entry
 * carries a scalar or an array, which replaces the whole document.
 */
public final class ConfigTree {
    private Object root;

    public ConfigTree() {
        this.root = new LinkedHashMap<String, Object>();
    }

    /**
     * Wraps a deep copy of {@code table}.
     */
    public static ConfigTree of(Map<String, ?> table) {
        var tree = new ConfigTree();
        tree.root = ConfigValues.normalize(table);
        return tree;
    }

    public Object root() {
        return root;
    }

    void replaceRoot(Object value) {
        this.root = value;
    }

    public boolean hasTableRoot() {
        return ConfigValues.isTable(root);
    }

    /**
     * Root table, turning a non-table root into an empty table first.
     */
    Map<String, Object> rootTable() {
        if (!ConfigValues.isTable(root)) {
            root = new LinkedHashMap<String, Object>();
        }
        return ConfigValues.asTable(root);
    }

    /**
     * Value at {@code dottedPath} without any validation of the path syntax.
     */
    public Optional<Object> find(String dottedPath) {
        Object current = root;
        for (String segment : dottedPath.split("\\.", -1)) {
            if (!ConfigValues.isTable(current)) {
                return Optional.empty();
            }
            current = ConfigValues.asTable(current).get(segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    public ConfigTree copy() {
        var copy = new ConfigTree();
        copy.root = ConfigValues.normalize(root);
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ConfigTree tree && root.equals(tree.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return String.valueOf(root);
    }
}

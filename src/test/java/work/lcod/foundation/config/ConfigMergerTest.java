package work.lcod.foundation.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {
    @Test
    void rootMergeKeepsUntouchedKeys() {
        var tree = ConfigTree.of(Map.of(
            "existing", "keep",
            "nested", Map.of("inner", 42L)
        ));

        ConfigMerger.mergeAtPath(tree, List.of(), Map.of(
            "new", "added",
            "nested", Map.of("another", true)
        ));

        assertEquals(
            Map.of(
                "existing", "keep",
                "new", "added",
                "nested", Map.of("inner", 42L, "another", true)
            ),
            tree.root()
        );
    }

    @Test
    void createsIntermediateTables() {
        var tree = new ConfigTree();

        ConfigMerger.mergeAtPath(tree, List.of("a", "b", "c"), 123);

        assertEquals(Map.of("a", Map.of("b", Map.of("c", 123L))), tree.root());
    }

    @Test
    void scalarReplacesLeaf() {
        var tree = ConfigTree.of(Map.of("key", "old"));

        ConfigMerger.mergeAtPath(tree, List.of("key"), "new");

        assertEquals(Map.of("key", "new"), tree.root());
    }

    @Test
    void tableAtLeafMergesWithExistingTable() {
        var tree = ConfigTree.of(Map.of("config", Map.of("a", 1L)));

        ConfigMerger.mergeAtPath(tree, List.of("config"), Map.of("b", 2L));

        assertEquals(Map.of("config", Map.of("a", 1L, "b", 2L)), tree.root());
    }

    @Test
    void scalarReplacesTableAndTableReplacesScalar() {
        var tree = ConfigTree.of(Map.of(
            "server", Map.of("host", "localhost"),
            "port", 8080L
        ));

        ConfigMerger.mergeAtPath(tree, List.of(), Map.of(
            "server", "disabled",
            "port", Map.of("http", 80L)
        ));

        assertEquals(Map.of("server", "disabled", "port", Map.of("http", 80L)), tree.root());
    }

    @Test
    void arraysAreReplacedWholesale() {
        var tree = ConfigTree.of(Map.of("hosts", List.of("a", "b", "c")));

        ConfigMerger.mergeAtPath(tree, List.of(), Map.of("hosts", List.of("d")));

        assertEquals(Map.of("hosts", List.of("d")), tree.root());
    }

    @Test
    void pathThroughScalarReplacesItWithTable() {
        var tree = ConfigTree.of(Map.of("database", "sqlite"));

        ConfigMerger.mergeAtPath(tree, List.of("database", "host"), "db.example.com");

        assertEquals(Map.of("database", Map.of("host", "db.example.com")), tree.root());
    }

    @Test
    void nestedTablesMergeAtEveryDepth() {
        var tree = ConfigTree.of(Map.of("a", Map.of("b", Map.of("c", 1L, "d", 2L))));

        ConfigMerger.mergeAtPath(tree, List.of("a"), Map.of("b", Map.of("d", 20L, "e", 30L)));

        assertEquals(Map.of("a", Map.of("b", Map.of("c", 1L, "d", 20L, "e", 30L))), tree.root());
    }

    @Test
    void scalarAtRootReplacesWholeDocument() {
        var tree = ConfigTree.of(Map.of("key", "value"));

        ConfigMerger.mergeAtPath(tree, List.of(), "standalone");

        assertFalse(tree.hasTableRoot());
        assertEquals("standalone", tree.root());

        ConfigMerger.mergeAtPath(tree, List.of("key"), "again");
        assertEquals(Map.of("key", "again"), tree.root());
    }

    @Test
    void applyingSameEntriesTwiceGivesEqualTrees() {
        var entries = List.of(
            ConfigEntry.root(Map.of("server", Map.of("host", "localhost", "port", 80L), "tags", List.of("a"))),
            ConfigEntry.atPath(List.of("server", "port"), 8080L),
            ConfigEntry.root(Map.of("server", Map.of("tls", Map.of("enabled", true)))),
            ConfigEntry.atPath(List.of("server", "tls"), Map.of("cert", "/etc/cert.pem"))
        );

        var first = new ConfigTree();
        var second = new ConfigTree();
        entries.forEach(entry -> ConfigMerger.merge(first, entry));
        entries.forEach(entry -> ConfigMerger.merge(second, entry));

        assertEquals(first, second);
        assertEquals(
            Map.of(
                "server", Map.of(
                    "host", "localhost",
                    "port", 8080L,
                    "tls", Map.of("enabled", true, "cert", "/etc/cert.pem")
                ),
                "tags", List.of("a")
            ),
            first.root()
        );
    }

    @Test
    void mergedValuesAreCopied() {
        var nested = new LinkedHashMap<String, Object>();
        nested.put("inner", 1L);
        var overlay = new LinkedHashMap<String, Object>();
        overlay.put("nested", nested);
        var tree = new ConfigTree();

        ConfigMerger.mergeAtPath(tree, List.of(), overlay);
        ConfigMerger.mergeAtPath(tree, List.of("nested", "other"), 2L);

        assertEquals(Map.of("inner", 1L), nested);
        assertNotSame(nested, ((Map<?, ?>) tree.root()).get("nested"));
    }

    @Test
    void laterEntriesWin() {
        var tree = new ConfigTree();
        ConfigMerger.mergeAtPath(tree, List.of(), Map.of("port", 80L));
        ConfigMerger.mergeAtPath(tree, List.of("port"), 8080L);
        ConfigMerger.mergeAtPath(tree, List.of(), Map.of("port", 9090L));

        assertEquals(Map.of("port", 9090L), tree.root());
    }

    @Test
    void preservesInsertionOrder() {
        var tree = new ConfigTree();
        ConfigMerger.mergeAtPath(tree, List.of("zeta"), 1L);
        ConfigMerger.mergeAtPath(tree, List.of("alpha"), 2L);
        ConfigMerger.mergeAtPath(tree, List.of("mid"), 3L);

        assertEquals(List.of("zeta", "alpha", "mid"), new ArrayList<>(((Map<?, ?>) tree.root()).keySet()));
    }

    @Test
    void rejectsValuesOutsideTheModel() {
        var tree = new ConfigTree();
        assertThrows(IllegalArgumentException.class, () -> ConfigMerger.mergeAtPath(tree, List.of("a"), new Object()));
        var withNull = new LinkedHashMap<String, Object>();
        withNull.put("a", null);
        assertThrows(IllegalArgumentException.class, () -> ConfigMerger.mergeAtPath(tree, List.of(), withNull));
        assertTrue(((Map<?, ?>) tree.root()).isEmpty());
    }
}

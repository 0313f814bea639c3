package work.lcod.foundation.config;

import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Substitutes {@code ${dotted.path}} references inside the string values of a {@link ConfigTree}.
 *
 * <p>Syntax embedded in string values:
 * <ul>
 *   <li>{@code ${a.b.c}} is replaced by the text of the scalar at {@code a.b.c};</li>
 *   <li>{@code $$} produces a literal {@code $}, so {@code $${a}} renders as {@code ${a}};</li>
 *   <li>a {@code $} followed by anything else is kept as is.</li>
 * </ul>
 *
 * <p>A reference may point at a value that holds references itself, so full passes over the tree
 * are repeated until one of them substitutes nothing. Lookups see values already rewritten
 * earlier in the same pass. A tree that still changes after {@value #MAX_PASSES} passes is
 * reported as circular, whether or not it holds an actual cycle.
 */
public final class ReferenceResolver {
    static final int MAX_PASSES = 100;

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceResolver.class);

    private ReferenceResolver() {}

    /**
     * Resolves every reference of {@code tree} in place.
     *
     * @throws ConfigException on the first circular, missing, invalid, non-scalar or unclosed
     *     reference; the tree is left partially rewritten
     */
    public static void resolveReferences(ConfigTree tree) {
        for (int pass = 1; pass <= MAX_PASSES; pass++) {
            int substitutions = resolvePass(tree);
            LOG.debug("Reference pass {} made {} substitution(s)", pass, substitutions);
            if (substitutions == 0) {
                tree.replaceRoot(rewriteStrings(tree.root(), ReferenceResolver::unescape));
                return;
            }
        }
        throw ConfigException.circularReference();
    }

    static int resolvePass(ConfigTree tree) {
        int[] substitutions = {0};
        tree.replaceRoot(rewriteStrings(tree.root(), text -> {
            var scan = resolveString(tree, text);
            substitutions[0] += scan.substitutions();
            return scan.text();
        }));
        return substitutions[0];
    }

    /**
     * Scans {@code text} once, substituting its references against the current state of
     * {@code tree}. Escapes ({@code $$}) are carried through untouched so that a later pass does
     * not read the text they stand for as a reference.
     */
    static Scan resolveString(ConfigTree tree, String text) {
        if (text.indexOf('$') < 0) {
            return new Scan(text, 0);
        }
        var out = new StringBuilder(text.length());
        int substitutions = 0;
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : 0;
            if (ch == '$' && next == '$') {
                out.append("$$");
                i += 2;
            } else if (ch == '$' && next == '{') {
                int close = text.indexOf('}', i + 2);
                if (close < 0) {
                    throw ConfigException.unclosedReference(text.substring(i));
                }
                String body = text.substring(i + 2, close);
                out.append(scalarText(tree, body));
                substitutions++;
                i = close + 1;
            } else {
                out.append(ch);
                i++;
            }
        }
        return new Scan(out.toString(), substitutions);
    }

    /**
     * Value at {@code dottedPath}, which may be a table or an array.
     *
     * @throws ConfigException when the path is empty, has an empty segment, or does not exist
     */
    public static Object lookupPath(ConfigTree tree, String dottedPath) {
        String[] segments = dottedPath.split("\\.", -1);
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw ConfigException.invalidReferencePath(dottedPath);
            }
        }
        Object current = tree.root();
        for (String segment : segments) {
            if (!ConfigValues.isTable(current)) {
                throw ConfigException.referenceNotFound(dottedPath);
            }
            current = ConfigValues.asTable(current).get(segment);
            if (current == null) {
                throw ConfigException.referenceNotFound(dottedPath);
            }
        }
        return current;
    }

    private static String scalarText(ConfigTree tree, String dottedPath) {
        Object value = lookupPath(tree, dottedPath);
        if (ConfigValues.isTable(value) || ConfigValues.isArray(value)) {
            throw ConfigException.nonScalarReference(dottedPath);
        }
        return ConfigValues.toDisplayString(value);
    }

    static String unescape(String text) {
        int at = text.indexOf("$$");
        if (at < 0) {
            return text;
        }
        var out = new StringBuilder(text.length());
        out.append(text, 0, at);
        for (int i = at; i < text.length(); i++) {
            char ch = text.charAt(i);
            out.append(ch);
            if (ch == '$' && i + 1 < text.length() && text.charAt(i + 1) == '$') {
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Applies {@code rewrite} to every string reachable from {@code value}, updating tables and
     * arrays in place, and returns the (possibly new) value.
     */
    private static Object rewriteStrings(Object value, UnaryOperator<String> rewrite) {
        if (value instanceof String text) {
            return rewrite.apply(text);
        }
        if (value instanceof Map<?, ?> map) {
            for (var entry : ConfigValues.asTable(map).entrySet()) {
                entry.setValue(rewriteStrings(entry.getValue(), rewrite));
            }
        } else if (value instanceof List<?> list) {
            List<Object> array = ConfigValues.asArray(list);
            for (int i = 0; i < array.size(); i++) {
                array.set(i, rewriteStrings(array.get(i), rewrite));
            }
        }
        return value;
    }

    record Scan(String text, int substitutions) {}
}

package octave.java17.schema;

import octave.java17.core.OctaveAst.Assignment;
import octave.java17.core.OctaveAst.Block;
import octave.java17.core.OctaveAst.Document;
import octave.java17.core.OctaveAst.Node;
import octave.java17.core.OctaveAst.Section;
import octave.java17.core.OctaveAst.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Dotted-path view of the fields of a document.
///
/// META assignments resolve as `META.KEY`. Body assignments resolve by key, nested blocks
/// extend the path, and `§` sections are transparent. When a path occurs twice the first
/// occurrence in document order is the one that resolves.
final class DocumentPaths {

    static final String META_PREFIX = "META.";

    private DocumentPaths() {
    }

    /// Every assignment in the document by path, in document order.
    static Map<String, Value> fields(Document document) {
        final var out = new LinkedHashMap<String, Value>();
        document.meta().ifPresent(meta -> collect(meta.children(), META_PREFIX, out));
        collect(document.sections(), "", out);
        return out;
    }

    static Optional<Value> resolve(Document document, String path) {
        return Optional.ofNullable(fields(document).get(path));
    }

    /// Returns a copy with the values at the given paths replaced. Paths that do not
    /// resolve are ignored; nothing is ever added.
    static Document replace(Document document, Map<String, Value> replacements) {
        if (replacements.isEmpty()) {
            return document;
        }
        final var pending = new LinkedHashMap<>(replacements);
        final Document withMeta = document.meta()
            .map(meta -> document.withMeta(Optional.of(meta.withChildren(rewrite(meta.children(), META_PREFIX, pending)))))
            .orElse(document);
        return withMeta.withSections(rewrite(withMeta.sections(), "", pending));
    }

    private static void collect(List<Node> nodes, String prefix, Map<String, Value> out) {
        for (Node node : nodes) {
            if (node instanceof Assignment a) {
                out.putIfAbsent(prefix + a.key(), a.value());
            } else if (node instanceof Block b) {
                collect(b.children(), prefix + b.key() + ".", out);
            } else if (node instanceof Section s) {
                collect(s.children(), prefix, out);
            }
        }
    }

    // each replacement is consumed on first use so only the first occurrence changes
    private static List<Node> rewrite(List<Node> nodes, String prefix, Map<String, Value> pending) {
        final var out = new ArrayList<Node>(nodes.size());
        for (Node node : nodes) {
            if (node instanceof Assignment a && pending.containsKey(prefix + a.key())) {
                out.add(a.withValue(pending.remove(prefix + a.key())));
            } else if (node instanceof Block b) {
                out.add(b.withChildren(rewrite(b.children(), prefix + b.key() + ".", pending)));
            } else if (node instanceof Section s) {
                out.add(s.withChildren(rewrite(s.children(), prefix, pending)));
            } else {
                out.add(node);
            }
        }
        return out;
    }
}

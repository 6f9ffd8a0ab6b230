package octave.java17.schema;

import octave.java17.core.Octave;
import octave.java17.core.OctaveAst.Assignment;
import octave.java17.core.OctaveAst.Block;
import octave.java17.core.OctaveAst.Comment;
import octave.java17.core.OctaveAst.Document;
import octave.java17.core.OctaveAst.ListValue;
import octave.java17.core.OctaveAst.Node;
import octave.java17.core.OctaveAst.Section;
import octave.java17.core.OctaveAst.SectionTarget;
import octave.java17.core.OctaveAst.Value;
import octave.java17.core.OctaveError;
import octave.java17.core.ParseOptions;
import octave.java17.core.StructuredLog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static octave.java17.schema.SchemaLogging.LOG;

/// Builds a [Schema] from a schema document.
///
/// ```
/// ===PROJECT_SCHEMA===
/// META:
///   VERSION::"1.0"
/// POLICY:
///   UNKNOWN_FIELDS::REJECT
///   TARGETS::[§INDEXER]
/// FIELDS:
///   NAME::["example"∧REQ→§SELF]
///   CONFIG[→§INDEXER]:
///     DEPTH::[3∧TYPE[NUMBER]]
/// ===END===
/// ```
///
/// Nested blocks extend the dotted path (`CONFIG.DEPTH`). A block target is inherited by
/// every field below it that names no target of its own.
public final class SchemaExtractor {

    private static final String POLICY = "POLICY";
    private static final String FIELDS = "FIELDS";

    private final String name;
    private final Map<String, FieldSchema> fields = new LinkedHashMap<>();

    private SchemaExtractor(String name) {
        this.name = name;
    }

    /// Parses and extracts a schema document.
    /// @throws octave.java17.core.OctaveSyntaxException if the text does not parse
    /// @throws SchemaLoadException if the document is not a well-formed schema
    public static Schema load(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return extract(Octave.parse(text, ParseOptions.STRICT).document());
    }

    /// Extracts the schema declared by an already parsed document.
    /// @throws SchemaLoadException if the document is not a well-formed schema
    public static Schema extract(Document document) {
        Objects.requireNonNull(document, "document must not be null");
        final var extractor = new SchemaExtractor(document.name());
        final String version = document.metaValue("VERSION").flatMap(Values::textOf)
            .orElseThrow(() -> extractor.malformed("META.VERSION is missing"));
        final Policy policy = extractor.findBlock(document.sections(), POLICY)
            .map(extractor::policy)
            .orElse(Policy.DEFAULT);
        final Block fieldsBlock = extractor.findBlock(document.sections(), FIELDS)
            .orElseThrow(() -> extractor.malformed("no FIELDS block"));
        extractor.walk(fieldsBlock.children(), "", fieldsBlock.target().map(SectionTarget::name));
        final var schema = new Schema(document.name(), version, policy, extractor.fields);
        StructuredLog.fine(LOG, "schema.load", "name", schema.name(), "version", version,
            "fields", schema.fields().size(), "targets", schema.targets().size());
        return schema;
    }

    private Policy policy(Block block) {
        String version = "";
        Policy.UnknownFields unknown = Policy.DEFAULT.unknownFields();
        List<String> targets = List.of();
        for (Node node : block.children()) {
            if (node instanceof Comment) {
                continue;
            }
            if (!(node instanceof Assignment a)) {
                throw malformed("POLICY holds assignments only");
            }
            switch (a.key()) {
                case "VERSION" -> version = Values.textOf(a.value())
                    .orElseThrow(() -> malformed("POLICY.VERSION must be a scalar"));
                case "UNKNOWN_FIELDS" -> unknown = unknownFields(a.value());
                case "TARGETS" -> targets = targets(a.value());
                default -> throw malformed("unknown POLICY key " + a.key());
            }
        }
        return new Policy(version, unknown, targets);
    }

    private Policy.UnknownFields unknownFields(Value value) {
        final String text = Values.textOf(value).orElse("");
        for (Policy.UnknownFields option : Policy.UnknownFields.values()) {
            if (option.name().equals(text)) {
                return option;
            }
        }
        throw malformed("POLICY.UNKNOWN_FIELDS must be REJECT, IGNORE or WARN, found " + Values.show(value));
    }

    private List<String> targets(Value value) {
        if (!(value instanceof ListValue list)) {
            throw malformed("POLICY.TARGETS must be a list of §TARGET");
        }
        final var names = new ArrayList<String>();
        for (Value item : list.items()) {
            if (!(item instanceof SectionTarget t)) {
                throw malformed("POLICY.TARGETS entry " + Values.show(item) + " is not a §TARGET");
            }
            names.add(t.name());
        }
        return names;
    }

    private void walk(List<Node> nodes, String prefix, Optional<String> inherited) {
        for (Node node : nodes) {
            if (node instanceof Comment) {
                continue;
            }
            if (node instanceof Block b) {
                final Optional<String> target = b.target().map(SectionTarget::name).or(() -> inherited);
                walk(b.children(), prefix + b.key() + ".", target);
                continue;
            }
            if (node instanceof Section s) {
                throw malformed("section §" + s.id() + " inside FIELDS");
            }
            final var assignment = (Assignment) node;
            final String path = prefix + assignment.key();
            if (!(assignment.value() instanceof ListValue list)) {
                throw new SchemaLoadException(OctaveError.MALFORMED_PATTERN,
                    OctaveError.MALFORMED_PATTERN.message(path, "a field is declared as [example∧CONSTRAINT→§TARGET]"),
                    path);
            }
            final HolographicPattern pattern = HolographicInterpreter.interpret(path, list);
            final boolean inheritedTarget = pattern.target().isEmpty() && inherited.isPresent();
            final Optional<String> target = pattern.target().or(() -> inherited);
            fields.put(path, new FieldSchema(path, pattern.example(), pattern.constraints(), target, inheritedTarget));
        }
    }

    // a top-level block, or one directly inside a top-level section
    private Optional<Block> findBlock(List<Node> nodes, String key) {
        for (Node node : nodes) {
            if (node instanceof Block b && b.key().equals(key)) {
                return Optional.of(b);
            }
            if (node instanceof Section s) {
                final Optional<Block> inside = findBlock(s.children(), key);
                if (inside.isPresent()) {
                    return inside;
                }
            }
        }
        return Optional.empty();
    }

    private SchemaLoadException malformed(String detail) {
        return new SchemaLoadException(OctaveError.MALFORMED_SCHEMA, OctaveError.MALFORMED_SCHEMA.message(name, detail), "");
    }
}

package octave.java17.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import octave.java17.core.CanonicalEmitter;
import octave.java17.core.Octave;
import octave.java17.core.OctaveAst.Assignment;
import octave.java17.core.OctaveAst.Block;
import octave.java17.core.OctaveAst.Comment;
import octave.java17.core.OctaveAst.Document;
import octave.java17.core.OctaveAst.Node;
import octave.java17.core.OctaveAst.Section;
import octave.java17.core.OctaveAst.StringLiteral;
import octave.java17.core.OctaveError;
import octave.java17.core.OctaveSyntaxException;
import octave.java17.core.ParseOptions;
import octave.java17.core.StructuredLog;
import octave.java17.schema.FieldSchema;
import octave.java17.schema.RepairOptions;
import octave.java17.schema.Schema;
import octave.java17.schema.SchemaValidator;
import octave.java17.schema.ValidationResult;
import octave.java17.schema.ValidationStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static octave.java17.tools.ToolsLogging.LOG;

/// Projects a document, or a template generated from a schema, into a view.
///
/// CANONICAL and AUTHORING keep everything. EXECUTIVE and DEVELOPER keep META and a fixed set of
/// top-level keys, and list every other top-level key they drop. The source document is validated
/// (report only) when its schema is registered; validation failures do not prevent the projection.
public final class EjectOperation {

    private final SchemaRegistry registry;

    public EjectOperation(SchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /// Reads mode and format by name, then ejects; an unknown name is refused with E070.
    public EjectResponse eject(String content, String schemaName, String mode, String format) {
        final EjectOptions options;
        try {
            options = EjectOptions.parse(mode, format);
        } catch (IllegalArgumentException e) {
            return EjectResponse.failure(invalid(e.getMessage()));
        }
        return eject(content, schemaName, options);
    }

    /// Ejects `content`, or with null content a template built from the named schema.
    public EjectResponse eject(String content, String schemaName, EjectOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        final Document source;
        final Optional<Schema> schema;
        if (content == null) {
            schema = schemaName == null ? Optional.empty() : registry.lookup(schemaName);
            if (schema.isEmpty()) {
                return EjectResponse.failure(invalid(schemaName == null
                    ? "content or schema is required"
                    : "no schema named '" + schemaName + "'"));
            }
            source = template(schema.get());
        } else {
            try {
                source = Octave.parse(content, ParseOptions.DEFAULT).document();
            } catch (OctaveSyntaxException e) {
                StructuredLog.syntaxError(LOG, "eject.syntax", e);
                return EjectResponse.failure(OperationError.from(e));
            }
            final String selector = schemaName != null ? schemaName
                : source.envelopeInferred() ? null : source.name();
            schema = selector == null ? Optional.empty() : registry.lookup(selector);
        }

        ValidationStatus status = ValidationStatus.UNVALIDATED;
        final var errors = new ArrayList<OperationError>();
        if (schema.isPresent()) {
            final ValidationResult result = SchemaValidator.validate(source, schema.get(), RepairOptions.DEFAULT);
            status = result.status();
            result.errors().forEach(e -> errors.add(OperationError.from(e)));
        }

        final EjectOptions.Mode mode = options.mode();
        final var omitted = new ArrayList<String>();
        final Document projected = mode.lossy() ? keep(source, mode, omitted) : source;
        final String output = render(projected, mode, options.format());
        StructuredLog.fine(LOG, "eject", "document", source.name(), "mode", mode, "format", options.format(),
            "omitted", omitted.size(), "status", status);
        return new EjectResponse(output, mode.lossy(), omitted, status, errors);
    }

    private static String render(Document document, EjectOptions.Mode mode, EjectOptions.Format format) {
        return switch (format) {
            case JSON -> TreeProjection.json(document);
            case YAML -> TreeProjection.yaml(document);
            case MARKDOWN -> MarkdownRenderer.render(document);
            case NATIVE -> {
                final String canonical = CanonicalEmitter.emit(document);
                yield mode == EjectOptions.Mode.AUTHORING ? AuthoringRenderer.render(canonical) : canonical;
            }
        };
    }

    // comments go with the keys they annotate
    private static Document keep(Document document, EjectOptions.Mode mode, List<String> omitted) {
        final var kept = new ArrayList<Node>();
        for (Node node : document.sections()) {
            if (node instanceof Comment) {
                continue;
            }
            final String key = keyOf(node);
            if (mode.kept().contains(key)) {
                kept.add(node);
            } else {
                omitted.add(key);
            }
        }
        return document.withSections(kept);
    }

    private static String keyOf(Node node) {
        if (node instanceof Assignment a) {
            return a.key();
        }
        if (node instanceof Block b) {
            return b.key();
        }
        return ((Section) node).key();
    }

    /// Builds a document holding every field's example at its dotted path.
    static Document template(Schema schema) {
        final Block meta = new Block("META", Optional.empty(), List.of(
            new Assignment("TYPE", StringLiteral.of(schema.name())),
            new Assignment("VERSION", new StringLiteral(schema.version(), true))));
        // leaves hold the field path; inner objects become blocks
        final ObjectNode tree = JsonNodeFactory.instance.objectNode();
        for (String path : schema.fields().keySet()) {
            final String[] segments = path.split("\\.");
            ObjectNode level = tree;
            for (int i = 0; i < segments.length - 1; i++) {
                final JsonNode child = level.get(segments[i]);
                level = child instanceof ObjectNode o ? o : level.putObject(segments[i]);
            }
            level.put(segments[segments.length - 1], path);
        }
        return new Document(schema.name(), false, Optional.of(meta), false, nodes(tree, schema));
    }

    private static List<Node> nodes(ObjectNode tree, Schema schema) {
        final var out = new ArrayList<Node>(tree.size());
        tree.fields().forEachRemaining(entry -> {
            final JsonNode child = entry.getValue();
            if (child instanceof ObjectNode o) {
                out.add(new Block(entry.getKey(), Optional.empty(), nodes(o, schema)));
            } else {
                final FieldSchema field = schema.field(child.asText()).orElseThrow();
                out.add(new Assignment(entry.getKey(), field.example()));
            }
        });
        return out;
    }

    private static OperationError invalid(String detail) {
        return OperationError.of(OctaveError.INVALID_INPUT, OctaveError.INVALID_INPUT.message(detail));
    }
}

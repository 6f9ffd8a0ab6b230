package octave.java17.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import octave.java17.core.CanonicalEmitter;
import octave.java17.core.OctaveAst;
import octave.java17.core.OctaveAst.Assignment;
import octave.java17.core.OctaveAst.Block;
import octave.java17.core.OctaveAst.BooleanLiteral;
import octave.java17.core.OctaveAst.Comment;
import octave.java17.core.OctaveAst.Constructor;
import octave.java17.core.OctaveAst.Document;
import octave.java17.core.OctaveAst.FlowExpression;
import octave.java17.core.OctaveAst.InlineMap;
import octave.java17.core.OctaveAst.ListValue;
import octave.java17.core.OctaveAst.LiteralZone;
import octave.java17.core.OctaveAst.Node;
import octave.java17.core.OctaveAst.NullLiteral;
import octave.java17.core.OctaveAst.NumberLiteral;
import octave.java17.core.OctaveAst.Section;
import octave.java17.core.OctaveAst.SectionTarget;
import octave.java17.core.OctaveAst.StringLiteral;

import java.math.BigDecimal;
import java.util.List;

/// Projects a document onto a Jackson tree and prints it as JSON or YAML.
///
/// The envelope becomes one object keyed by the document name. Blocks become nested objects,
/// sections become objects keyed `§id::NAME`, comments are dropped. Flow expressions, targets
/// and constructors have no JSON counterpart and are kept as their canonical text.
final class TreeProjection {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private TreeProjection() {
    }

    static String json(Document document) {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(tree(document)) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON projection of " + document.name() + " failed", e);
        }
    }

    static String yaml(Document document) {
        try {
            return YAML.writeValueAsString(tree(document));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("YAML projection of " + document.name() + " failed", e);
        }
    }

    static ObjectNode tree(Document document) {
        final ObjectNode body = NODES.objectNode();
        document.meta().ifPresent(meta -> body.set(meta.key(), object(meta.children())));
        fill(body, document.sections());
        final ObjectNode root = NODES.objectNode();
        root.set(document.name(), body);
        return root;
    }

    private static ObjectNode object(List<Node> children) {
        final ObjectNode out = NODES.objectNode();
        fill(out, children);
        return out;
    }

    private static void fill(ObjectNode out, List<Node> nodes) {
        final var writer = new NodeWriter(out);
        nodes.forEach(n -> n.accept(writer));
    }

    static JsonNode value(OctaveAst.Value value) {
        return value.accept(VALUES);
    }

    private record NodeWriter(ObjectNode out) implements OctaveAst.NodeVisitor<Void> {
        @Override
        public Void visitSection(Section section) {
            out.set("§" + section.id() + "::" + section.key(), object(section.children()));
            return null;
        }

        @Override
        public Void visitBlock(Block block) {
            out.set(block.key(), object(block.children()));
            return null;
        }

        @Override
        public Void visitAssignment(Assignment assignment) {
            out.set(assignment.key(), value(assignment.value()));
            return null;
        }

        @Override
        public Void visitComment(Comment comment) {
            return null;
        }
    }

    private static final OctaveAst.ValueVisitor<JsonNode> VALUES = new OctaveAst.ValueVisitor<>() {
        @Override
        public JsonNode visitString(StringLiteral value) {
            return NODES.textNode(value.value());
        }

        @Override
        public JsonNode visitNumber(NumberLiteral value) {
            return NODES.numberNode(new BigDecimal(value.lexeme()));
        }

        @Override
        public JsonNode visitBoolean(BooleanLiteral value) {
            return NODES.booleanNode(value.value());
        }

        @Override
        public JsonNode visitNull(NullLiteral value) {
            return NODES.nullNode();
        }

        @Override
        public JsonNode visitList(ListValue value) {
            final ArrayNode array = NODES.arrayNode();
            value.items().forEach(item -> array.add(item.accept(this)));
            return array;
        }

        @Override
        public JsonNode visitInlineMap(InlineMap value) {
            final ObjectNode object = NODES.objectNode();
            value.pairs().forEach((k, v) -> object.set(k, v.accept(this)));
            return object;
        }

        @Override
        public JsonNode visitFlow(FlowExpression value) {
            return NODES.textNode(CanonicalEmitter.emitValue(value));
        }

        @Override
        public JsonNode visitSectionTarget(SectionTarget value) {
            return NODES.textNode(value.canonical());
        }

        @Override
        public JsonNode visitConstructor(Constructor value) {
            return NODES.textNode(CanonicalEmitter.emitValue(value));
        }

        @Override
        public JsonNode visitLiteralZone(LiteralZone value) {
            return NODES.textNode(value.content());
        }
    };
}

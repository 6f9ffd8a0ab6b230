package octave.java17.schema;

import octave.java17.core.OctaveAst;
import octave.java17.core.OctaveAst.BooleanLiteral;
import octave.java17.core.OctaveAst.Constructor;
import octave.java17.core.OctaveAst.FlowExpression;
import octave.java17.core.OctaveAst.InlineMap;
import octave.java17.core.OctaveAst.ListValue;
import octave.java17.core.OctaveAst.LiteralZone;
import octave.java17.core.OctaveAst.NullLiteral;
import octave.java17.core.OctaveAst.NumberLiteral;
import octave.java17.core.OctaveAst.SectionTarget;
import octave.java17.core.OctaveAst.StringLiteral;
import octave.java17.core.OctaveAst.Value;

import java.util.Optional;

/// The types a `TYPE[...]` constraint can declare.
public enum ValueType {
    STRING,
    NUMBER,
    BOOLEAN,
    LIST;

    public static Optional<ValueType> parse(String name) {
        for (ValueType type : values()) {
            if (type.name().equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public boolean accepts(Value value) {
        return name().equals(nameOf(value));
    }

    /// Type name of a value as reported in TYPE_MISMATCH messages.
    public static String nameOf(Value value) {
        return value.accept(NAMES);
    }

    private static final OctaveAst.ValueVisitor<String> NAMES = new OctaveAst.ValueVisitor<>() {
        @Override
        public String visitString(StringLiteral value) {
            return "STRING";
        }

        @Override
        public String visitNumber(NumberLiteral value) {
            return "NUMBER";
        }

        @Override
        public String visitBoolean(BooleanLiteral value) {
            return "BOOLEAN";
        }

        @Override
        public String visitNull(NullLiteral value) {
            return "NULL";
        }

        @Override
        public String visitList(ListValue value) {
            return "LIST";
        }

        @Override
        public String visitInlineMap(InlineMap value) {
            return "MAP";
        }

        @Override
        public String visitFlow(FlowExpression value) {
            return "FLOW";
        }

        @Override
        public String visitSectionTarget(SectionTarget value) {
            return "TARGET";
        }

        @Override
        public String visitConstructor(Constructor value) {
            return "CONSTRUCTOR";
        }

        @Override
        public String visitLiteralZone(LiteralZone value) {
            return "STRING";
        }
    };
}

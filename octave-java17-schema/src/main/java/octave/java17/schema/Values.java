package octave.java17.schema;

import octave.java17.core.CanonicalEmitter;
import octave.java17.core.OctaveAst.BooleanLiteral;
import octave.java17.core.OctaveAst.LiteralZone;
import octave.java17.core.OctaveAst.NumberLiteral;
import octave.java17.core.OctaveAst.SectionTarget;
import octave.java17.core.OctaveAst.StringLiteral;
import octave.java17.core.OctaveAst.Value;

import java.util.Optional;

/// Scalar views of AST values used by constraint checks and repairs.
final class Values {

    private Values() {
    }

    /// The text of a scalar value, empty for composite values and null.
    static Optional<String> textOf(Value value) {
        if (value instanceof StringLiteral s) {
            return Optional.of(s.value());
        }
        if (value instanceof NumberLiteral n) {
            return Optional.of(n.lexeme());
        }
        if (value instanceof BooleanLiteral b) {
            return Optional.of(Boolean.toString(b.value()));
        }
        if (value instanceof SectionTarget t) {
            return Optional.of(t.canonical());
        }
        if (value instanceof LiteralZone z) {
            return Optional.of(z.content());
        }
        return Optional.empty();
    }

    /// The value as written in canonical form, for messages and hashes.
    static String show(Value value) {
        return CanonicalEmitter.emitValue(value);
    }
}

package octave.java17.schema;

import octave.java17.core.OctaveAst.BooleanLiteral;
import octave.java17.core.OctaveAst.NumberLiteral;
import octave.java17.core.OctaveAst.StringLiteral;
import octave.java17.core.OctaveAst.Value;
import octave.java17.core.OctaveLexer;
import octave.java17.core.RepairEntry;
import octave.java17.core.RepairLog;
import octave.java17.core.StructuredLog;

import java.util.List;
import java.util.Objects;

import static octave.java17.schema.SchemaLogging.LOG;

/// REPAIR-tier value corrections driven by a field declaration.
///
/// Only the value already present is ever changed, and only when exactly one reading of it
/// satisfies the declaration. Every change is appended to the log as a REPAIR entry.
public final class RepairEngine {

    public static final String ENUM_CASE_FOLD = "ENUM_CASE_FOLD";
    public static final String TYPE_COERCION = "TYPE_COERCION";

    private RepairEngine() {
    }

    /// What [#repair] did with a value.
    public sealed interface RepairOutcome permits Kept, Repaired, Ambiguous {
    }

    /// The value needed no repair, or no repair applies.
    public record Kept() implements RepairOutcome {
    }

    /// The value was corrected.
    public record Repaired(Value value) implements RepairOutcome {
        public Repaired {
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /// More than one enum member matches ignoring case; nothing was changed.
    public record Ambiguous(List<String> candidates) implements RepairOutcome {
        public Ambiguous {
            candidates = List.copyOf(Objects.requireNonNull(candidates, "candidates must not be null"));
        }
    }

    /// Changes the repair engine refuses to make.
    public enum ForbiddenAction {
        INSERT_MISSING_FIELD("required values are reported, never invented"),
        INFER_ROUTING_TARGET("routing targets must be declared, they are never inferred"),
        RESTRUCTURE_BLOCK("block structure belongs to the author"),
        REWRITE_VALUE_MEANING("a value is corrected only when exactly one reading exists");

        private final String reason;

        ForbiddenAction(String reason) {
            this.reason = reason;
        }

        public String reason() {
            return reason;
        }
    }

    /// Applies the corrections the field's constraints allow, in constraint order.
    /// @param path the field path, recorded in the log
    /// @param value the value in the document
    /// @param field the declaration
    /// @param log receives one REPAIR entry per correction
    public static RepairOutcome repair(String path, Value value, FieldSchema field, RepairLog log) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(log, "log must not be null");
        Value current = value;
        for (Constraint constraint : field.constraints()) {
            if (constraint instanceof Constraint.Type t) {
                final Value coerced = coerce(current, t.type());
                if (coerced != current) {
                    logRepair(log, TYPE_COERCION, path, current, coerced);
                    current = coerced;
                }
            } else if (constraint instanceof Constraint.Enum e) {
                final var text = Values.textOf(current);
                if (text.isEmpty() || e.members().contains(text.get())) {
                    continue;
                }
                final List<String> candidates = e.members().stream()
                    .filter(m -> m.equalsIgnoreCase(text.get()))
                    .toList();
                if (candidates.size() > 1) {
                    StructuredLog.fine(LOG, "repair.ambiguous", "path", path, "value", text.get(),
                        "candidates", candidates);
                    return new Ambiguous(candidates);
                }
                if (candidates.size() == 1) {
                    final Value folded = StringLiteral.of(candidates.get(0));
                    logRepair(log, ENUM_CASE_FOLD, path, current, folded);
                    current = folded;
                }
            }
        }
        return current == value ? new Kept() : new Repaired(current);
    }

    /// Records a refused change and raises it.
    /// @throws ForbiddenRepairException always
    public static void request(ForbiddenAction action, String path, RepairLog log) {
        Objects.requireNonNull(action, "action must not be null");
        log.append(RepairEntry.forbidden(action.name(), "", path));
        StructuredLog.fine(LOG, "repair.forbidden", "action", action, "path", path);
        throw new ForbiddenRepairException(action, path);
    }

    // returns the same instance when no coercion applies
    private static Value coerce(Value value, ValueType type) {
        switch (type) {
            case NUMBER:
                if (value instanceof StringLiteral s && OctaveLexer.isNumber(s.value())) {
                    return new NumberLiteral(s.value());
                }
                return value;
            case BOOLEAN:
                if (value instanceof StringLiteral s && ("true".equals(s.value()) || "false".equals(s.value()))) {
                    return new BooleanLiteral(Boolean.parseBoolean(s.value()));
                }
                return value;
            case STRING:
                if (value instanceof NumberLiteral n) {
                    return new StringLiteral(n.lexeme(), true);
                }
                return value;
            default:
                return value;
        }
    }

    private static void logRepair(RepairLog log, String rule, String path, Value before, Value after) {
        log.append(RepairEntry.repair(rule, path + "::" + Values.show(before), path + "::" + Values.show(after)));
    }
}

package octave.java17.schema;

import octave.java17.core.OctaveAst.BooleanLiteral;
import octave.java17.core.OctaveAst.ListValue;
import octave.java17.core.OctaveAst.NumberLiteral;
import octave.java17.core.OctaveAst.StringLiteral;
import octave.java17.core.OctaveAst.Value;
import octave.java17.core.OctaveError;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/// The closed set of field constraints a holographic pattern can declare.
///
/// A chain is evaluated left to right and stops at the first failure. Presence is the
/// validator's concern: `REQ` and `OPT` always pass [#check] on a present value.
public sealed interface Constraint permits Constraint.Required, Constraint.Optional, Constraint.ConstEquals,
    Constraint.Regex, Constraint.Enum, Constraint.Type, Constraint.Directory, Constraint.AppendOnly,
    Constraint.Range, Constraint.MaxLength, Constraint.MinLength, Constraint.Date, Constraint.Iso8601 {

    /// The constraint as written in a pattern, for example `ENUM[A,B]`.
    String render();

    /// Checks a present value.
    /// @param path the field path, for messages
    /// @param value the value in the document
    /// @param previous the value in the previous version of the document, or null
    /// @return the failure, or empty when the value satisfies the constraint
    java.util.Optional<ValidationError> check(String path, Value value, Value previous);

    /// `REQ`
    record Required() implements Constraint {
        @Override
        public String render() {
            return "REQ";
        }

        @Override
        public java.util.Optional<ValidationError> check(String path, Value value, Value previous) {
            return java.util.Optional.empty();
        }
    }

    /// `OPT`
    record Optional() implements Constraint {
        @Override
        public String render() {
            return "OPT";
        }

        @Override
        public java.util.Optional<ValidationError> check(String path, Value value, Value previous) {
            return java.util.Optional.empty();
        }
    }

    /// `CONST[value]`: the value must equal the given scalar.
    record ConstEquals(Value expected) implements Constraint {
        public ConstEquals {
            Objects.requireNonNull(expected, "expected must not be null");
        }

        @Override
        public String render() {
            return "CONST[" + Values.show(expected) + "]";
        }

        @Override
        public java.util.Optional<ValidationError> check(String path, Value value, Value previous) {
            final var want = Values.textOf(expected);
            // a typed scalar only matches a value of the same kind
            final boolean typed = expected instanceof NumberLiteral || expected instanceof BooleanLiteral;
            final boolean sameKind = !typed || expected.getClass() == value.getClass();
            final boolean same = sameKind
                && (want.isPresent() ? want.equals(Values.textOf(value)) : expected.equals(value));
            return same ? java.util.Optional.empty()
                : java.util.Optional.of(ValidationError.of(path, this, OctaveError.CONST_MISMATCH,
                    path, Values.show(expected), Values.show(value)));
        }
    }

    /// `REGEX["pattern"]`: the pattern must be found in the scalar text.
    record Regex(String pattern) implements Constraint {
        public Regex {
            Objects.requireNonNull(pattern, "pattern must not be null");
            Pattern.compile(pattern);
        }

        @Override
        public String render() {
            return "REGEX[" + octave.java17.core.CanonicalEmitter.quote(pattern) + "]";
        }

        @Override
        public java.util.Optional<ValidationError> check(String path, Value value, Value previous) {
            final var text = Values.textOf(value);
            if (text.isEmpty()) {
                return java.util.Optional.of(ValidationError.of(path, this, OctaveError.TYPE_MISMATCH,
                    path, "STRING", ValueType.nameOf(value)));
            }
            if (Pattern.compile(pattern).matcher(text.get()).find()) {
                return java.util.Optional.empty();
            }
            return java.util.Optional.of(ValidationError.of(path, this, OctaveError.PATTERN_MISMATCH,
                path, text.get(), pattern));
        }
    }

    /// `ENUM[A,B,...]`: the scalar text must equal one member exactly.
    record Enum(List<String> members) implements Constraint {
        public Enum {
            members = List.copyOf(Objects.requireNonNull(members, "members must not be null"));
            if (members.isEmpty()) {
                throw new IllegalArgumentException("ENUM needs at least one member");
            }
        }

        @Override
        public String render() {
            return "ENUM" + renderMembers();
        }

        String renderMembers() {
            final var items = members.stream().map(StringLiteral::of).map(Value.class::cast).toList();
            return Values.show(ListValue.of(items));
        }

        @Override
        public java.util.Optional<ValidationError> check(String path, Value value, Value previous) {
            final var text = Values.textOf(value);
            if (text.isEmpty()) {
                return java.util.Optional.of(ValidationError.of(path, this, OctaveError.TYPE_MISMATCH,
                    path, "STRING", ValueType.nameOf(value)));
            }
            return members.contains(text.get()) ? java.util.Optional.empty()
                : java.util.Optional.of(ValidationError.of(path, this, OctaveError.ENUM_MISMATCH,
                    path, text.get(), renderMembers()));
        }
    }

    /// `TYPE[STRING|NUMBER|BOOLEAN|LIST]`
    record Type(ValueType type) implements Constraint {
        public Type {
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public String render() {
            return "TYPE[" + type + "]";
        }

        @Override
        public java.util.Optional<ValidationError> check(String path, Value value, Value previous) {
            return type.accepts(value) ? java.util.Optional.empty()
                : java.util.Optional.of(ValidationError.of(path, this, OctaveError.TYPE_MISMATCH,
                    path, type, ValueType.nameOf(value)));
        }
    }

    /// `DIR`: a directory path without whitespace or shell metacharacters.
    record Directory() implements Constraint {
        private static final Pattern DIRECTORY = Pattern.compile("(?:[A-Za-z]:)?[^\\s<>\"|?*:]+");

        @Override
        public String render() {
            return "DIR";
        }

        @Override
        public java.util.Optional<ValidationError> check(String path, Value value, Value previous) {
            if (value instanceof StringLiteral s && DIRECTORY.matcher(s.value()).matches()) {
                return java.util.Optional.empty();
            }
            return java.util.Optional.of(ValidationError.of(path, this, OctaveError.NOT_A_DIRECTORY,
                path, Values.show(value)));
        }
    }

    /// `APPEND_ONLY`: a list whose previous items are kept, in order, as its prefix.
    record AppendOnly() implements Constraint {
        @Override
        public String render() {
            return "APPEND_ONLY";
        }

        @Override
        public java.util.Optional<ValidationError> check(String path, Value value, Value previous) {
            if (!(value instanceof ListValue list)) {
                return java.util.Optional.of(ValidationError.of(path, this, OctaveError.TYPE_MISMATCH,
                    path, "LIST", ValueType.nameOf(value)));
            }
            if (previous instanceof ListValue before) {
                final int n = before.items().size();
                if (list.items().size() < n || !list.items().subList(0, n).equals(before.items())) {
                    return java.util.Optional.of(ValidationError.of(path, this, OctaveError.APPEND_ONLY_VIOLATION, path));
                }
            }
            return java.util.Optional.empty();
        }
    }

    /// `RANGE[min,max]`, inclusive.
    record Range(BigDecimal min, BigDecimal max) implements Constraint {
        public Range {
            Objects.requireNonNull(min, "min must not be null");
            Objects.requireNonNull(max, "max must not be null");
            if (min.compareTo(max) > 0) {
                throw new IllegalArgumentException("RANGE min " + min + " exceeds max " + max);
            }
        }

        @Override
        public String render() {
            return "RANGE[" + min.toPlainString() + "," + max.toPlainString() + "]";
        }

        @Override
        public java.util.Optional<ValidationError> check(String path, Value value, Value previous) {
            if (!(value instanceof NumberLiteral number)) {
                return java.util.Optional.of(ValidationError.of(path, this, OctaveError.TYPE_MISMATCH,
                    path, "NUMBER", ValueType.nameOf(value)));
            }
            final BigDecimal v = number.toBigDecimal();
            if (v.compareTo(min) < 0 || v.compareTo(max) > 0) {
                return java.util.Optional.of(ValidationError.of(path, this, OctaveError.OUT_OF_RANGE,
                    path, number.lexeme(), min.toPlainString(), max.toPlainString()));
            }
            return java.util.Optional.empty();
        }
    }

    /// `MAX_LENGTH[n]` over code points of a scalar or items of a list.
    record MaxLength(int max) implements Constraint {
        public MaxLength {
            if (max < 0) {
                throw new IllegalArgumentException("MAX_LENGTH must not be negative: " + max);
            }
        }

        @Override
        public String render() {
            return "MAX_LENGTH[" + max + "]";
        }

        @Override
        public java.util.Optional<ValidationError> check(String path, Value value, Value previous) {
            final int length = Constraint.lengthOf(value);
            if (length < 0) {
                return java.util.Optional.of(ValidationError.of(path, this, OctaveError.TYPE_MISMATCH,
                    path, "STRING", ValueType.nameOf(value)));
            }
            return length <= max ? java.util.Optional.empty()
                : java.util.Optional.of(ValidationError.of(path, this, OctaveError.TOO_LONG, path, length, max));
        }
    }

    /// `MIN_LENGTH[n]` over code points of a scalar or items of a list.
    record MinLength(int min) implements Constraint {
        public MinLength {
            if (min < 0) {
                throw new IllegalArgumentException("MIN_LENGTH must not be negative: " + min);
            }
        }

        @Override
        public String render() {
            return "MIN_LENGTH[" + min + "]";
        }

        @Override
        public java.util.Optional<ValidationError> check(String path, Value value, Value previous) {
            final int length = Constraint.lengthOf(value);
            if (length < 0) {
                return java.util.Optional.of(ValidationError.of(path, this, OctaveError.TYPE_MISMATCH,
                    path, "STRING", ValueType.nameOf(value)));
            }
            return length >= min ? java.util.Optional.empty()
                : java.util.Optional.of(ValidationError.of(path, this, OctaveError.TOO_SHORT, path, length, min));
        }
    }

    /// `DATE`: a calendar date written `YYYY-MM-DD`.
    record Date() implements Constraint {
        private static final Pattern SHAPE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

        @Override
        public String render() {
            return "DATE";
        }

        @Override
        public java.util.Optional<ValidationError> check(String path, Value value, Value previous) {
            final var text = Values.textOf(value).orElse("");
            if (SHAPE.matcher(text).matches()) {
                try {
                    LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
                    return java.util.Optional.empty();
                } catch (DateTimeParseException e) {
                    SchemaLogging.LOG.finest(() -> "DATE rejects " + text + ": " + e.getMessage());
                }
            }
            return java.util.Optional.of(ValidationError.of(path, this, OctaveError.INVALID_DATE, path, Values.show(value)));
        }
    }

    /// `ISO8601`: a date-time with optional offset, for example `2024-05-01T10:15:30Z`.
    record Iso8601() implements Constraint {
        @Override
        public String render() {
            return "ISO8601";
        }

        @Override
        public java.util.Optional<ValidationError> check(String path, Value value, Value previous) {
            final var text = Values.textOf(value).orElse("");
            try {
                DateTimeFormatter.ISO_DATE_TIME.parse(text);
                return java.util.Optional.empty();
            } catch (DateTimeParseException e) {
                SchemaLogging.LOG.finest(() -> "ISO8601 rejects " + text + ": " + e.getMessage());
                return java.util.Optional.of(ValidationError.of(path, this, OctaveError.INVALID_ISO8601,
                    path, Values.show(value)));
            }
        }
    }

    // code points of a scalar, items of a list, -1 for anything else
    private static int lengthOf(Value value) {
        if (value instanceof ListValue list) {
            return list.items().size();
        }
        final java.util.Optional<String> text = Values.textOf(value);
        return text.map(s -> s.codePointCount(0, s.length())).orElse(-1);
    }
}

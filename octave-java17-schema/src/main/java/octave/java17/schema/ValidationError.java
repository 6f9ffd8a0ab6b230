package octave.java17.schema;

import octave.java17.core.OctaveError;

import java.util.Objects;

/// One failed check.
/// @param path the dotted field path, `META.KEY` for META fields
/// @param error the numbered error
/// @param message the formatted message
/// @param constraint the failing constraint as written in the schema, empty when none applies
public record ValidationError(String path, OctaveError error, String message, String constraint) {

    public ValidationError {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(error, "error must not be null");
        Objects.requireNonNull(constraint, "constraint must not be null");
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("Error message cannot be null or empty");
        }
    }

    static ValidationError of(String path, Constraint constraint, OctaveError error, Object... args) {
        return new ValidationError(path, error, error.message(args), constraint.render());
    }

    static ValidationError of(String path, OctaveError error, Object... args) {
        return new ValidationError(path, error, error.message(args), "");
    }

    public String code() {
        return error.code();
    }

    public String rationale() {
        return error.rationale();
    }
}

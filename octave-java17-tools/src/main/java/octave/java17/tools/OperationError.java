package octave.java17.tools;

import octave.java17.core.OctaveError;
import octave.java17.core.OctaveSyntaxException;
import octave.java17.schema.SchemaLoadException;
import octave.java17.schema.ValidationError;

import java.util.Objects;

/// One failure as reported by a boundary operation, never a stack trace.
/// @param code the numbered code, for example `E001`
/// @param message what went wrong
/// @param field the field path, empty when the failure is not tied to a field
/// @param line 1-based line, 0 when the failure has no source position
/// @param column 1-based column, 0 when the failure has no source position
/// @param snippet the triggering source text, empty when none applies
/// @param rationale why the input is refused rather than guessed at
public record OperationError(String code, String message, String field, int line, int column, String snippet,
                             String rationale) {

    public OperationError {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(field, "field must not be null");
        Objects.requireNonNull(snippet, "snippet must not be null");
        Objects.requireNonNull(rationale, "rationale must not be null");
    }

    public static OperationError of(OctaveError error, String message) {
        return new OperationError(error.code(), message, "", 0, 0, "", error.rationale());
    }

    public static OperationError from(OctaveSyntaxException e) {
        return new OperationError(e.error().code(), e.detail(), "", Math.max(0, e.line()), Math.max(0, e.column()),
            e.snippet(), e.error().rationale());
    }

    public static OperationError from(SchemaLoadException e) {
        return new OperationError(e.error().code(), e.detail(), e.field(), 0, 0, "", e.error().rationale());
    }

    public static OperationError from(ValidationError e) {
        return new OperationError(e.code(), e.message(), e.path(), 0, 0, e.constraint(), e.rationale());
    }
}

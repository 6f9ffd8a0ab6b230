package octave.java17.schema;

import octave.java17.core.OctaveError;

import java.util.Objects;

/// Thrown when a schema document or a holographic pattern cannot be read exactly.
public class SchemaLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final OctaveError error;
    private final String detail;
    private final String field;

    public SchemaLoadException(OctaveError error, String detail, String field) {
        super(error.code() + " " + detail + ": " + error.rationale());
        this.error = Objects.requireNonNull(error, "error must not be null");
        this.detail = detail;
        this.field = field == null ? "" : field;
    }

    public SchemaLoadException(OctaveError error, String detail, String field, Throwable cause) {
        this(error, detail, field);
        initCause(cause);
    }

    public OctaveError error() {
        return error;
    }

    /// The formatted message without code and rationale.
    public String detail() {
        return detail;
    }

    /// The field path being read, empty when the failure is not tied to a field.
    public String field() {
        return field;
    }
}

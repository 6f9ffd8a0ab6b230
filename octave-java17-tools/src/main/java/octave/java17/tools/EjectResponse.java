package octave.java17.tools;

import octave.java17.schema.ValidationStatus;

import java.util.List;
import java.util.Objects;

/// Result of [EjectOperation].
/// @param output the projected document, empty on failure
/// @param lossy true when the mode dropped content
/// @param fieldsOmitted every top-level key the mode dropped, in document order
/// @param status the schema validation status of the source document, UNVALIDATED without a registered schema
/// @param errors failures, including validation errors of a document that was still projected
public record EjectResponse(String output, boolean lossy, List<String> fieldsOmitted, ValidationStatus status,
                            List<OperationError> errors) {

    public EjectResponse {
        Objects.requireNonNull(output, "output must not be null");
        Objects.requireNonNull(status, "status must not be null");
        fieldsOmitted = List.copyOf(Objects.requireNonNull(fieldsOmitted, "fieldsOmitted must not be null"));
        errors = List.copyOf(Objects.requireNonNull(errors, "errors must not be null"));
    }

    static EjectResponse failure(OperationError error) {
        return new EjectResponse("", false, List.of(), ValidationStatus.UNVALIDATED, List.of(error));
    }
}

package octave.java17.schema;

import octave.java17.core.OctaveAst.Document;
import octave.java17.core.RepairEntry;

import java.util.List;
import java.util.Objects;

/// The outcome of validating one document.
/// @param status UNVALIDATED when no schema was bound
/// @param errors every failed check, in field order
/// @param repairs the full audit log, parse normalizations first
/// @param document the document after REPAIR-tier corrections, the input document otherwise
/// @param routing one entry per routed field
/// @param warnings undeclared fields reported under the WARN policy
public record ValidationResult(ValidationStatus status, List<ValidationError> errors, List<RepairEntry> repairs,
                               Document document, List<RoutingEntry> routing, List<String> warnings) {

    public ValidationResult {
        Objects.requireNonNull(status, "status must not be null");
        errors = List.copyOf(Objects.requireNonNull(errors, "errors must not be null"));
        repairs = List.copyOf(Objects.requireNonNull(repairs, "repairs must not be null"));
        Objects.requireNonNull(document, "document must not be null");
        routing = List.copyOf(Objects.requireNonNull(routing, "routing must not be null"));
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings must not be null"));
    }

    /// A document that was parsed but checked against no schema.
    public static ValidationResult unvalidated(Document document, List<RepairEntry> repairs) {
        return new ValidationResult(ValidationStatus.UNVALIDATED, List.of(), repairs, document, List.of(), List.of());
    }

    /// True unless a schema was bound and reported errors.
    public boolean valid() {
        return status != ValidationStatus.INVALID;
    }
}

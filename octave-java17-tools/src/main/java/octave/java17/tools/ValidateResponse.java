package octave.java17.tools;

import octave.java17.core.RepairEntry;
import octave.java17.schema.RoutingEntry;
import octave.java17.schema.ValidationStatus;

import java.util.List;
import java.util.Objects;

/// Result of [ValidateOperation]. The lists are always present, empty when there is nothing to report.
/// @param canonical the canonical text, repaired when `fix` was set; the input text when it did not parse
/// @param valid true when no error was reported
/// @param status UNVALIDATED unless a schema was bound
/// @param errors every failure, in the order found
/// @param repairs the audit log, normalizations first
/// @param routing one entry per routed field
/// @param warnings undeclared fields reported under the WARN policy
public record ValidateResponse(String canonical, boolean valid, ValidationStatus status, List<OperationError> errors,
                               List<RepairEntry> repairs, List<RoutingEntry> routing, List<String> warnings) {

    public ValidateResponse {
        Objects.requireNonNull(canonical, "canonical must not be null");
        Objects.requireNonNull(status, "status must not be null");
        errors = List.copyOf(Objects.requireNonNull(errors, "errors must not be null"));
        repairs = List.copyOf(Objects.requireNonNull(repairs, "repairs must not be null"));
        routing = List.copyOf(Objects.requireNonNull(routing, "routing must not be null"));
        warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings must not be null"));
    }

    static ValidateResponse failure(String canonical, OperationError error) {
        return new ValidateResponse(canonical, false, ValidationStatus.UNVALIDATED, List.of(error), List.of(),
            List.of(), List.of());
    }
}

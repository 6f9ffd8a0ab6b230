package octave.java17.tools;

import octave.java17.core.RepairEntry;
import octave.java17.schema.ValidationStatus;

import java.util.List;
import java.util.Objects;

/// Result of [WriteOperation].
/// @param success true when the file now holds `canonical`
/// @param path the absolute target path
/// @param diff `No changes`, or the size change followed by structural warnings
/// @param canonical the text written, empty on failure
/// @param hash SHA-256 of `canonical`, empty on failure
/// @param status UNVALIDATED unless a schema was given
/// @param errors failures, including validation errors of a document that was still written
/// @param repairs normalizations applied to the new content
public record WriteResponse(boolean success, String path, String diff, String canonical, String hash,
                            ValidationStatus status, List<OperationError> errors, List<RepairEntry> repairs) {

    public WriteResponse {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(diff, "diff must not be null");
        Objects.requireNonNull(canonical, "canonical must not be null");
        Objects.requireNonNull(hash, "hash must not be null");
        Objects.requireNonNull(status, "status must not be null");
        errors = List.copyOf(Objects.requireNonNull(errors, "errors must not be null"));
        repairs = List.copyOf(Objects.requireNonNull(repairs, "repairs must not be null"));
    }

    static WriteResponse failure(String path, OperationError error) {
        return new WriteResponse(false, path, "", "", "", ValidationStatus.UNVALIDATED, List.of(error), List.of());
    }
}

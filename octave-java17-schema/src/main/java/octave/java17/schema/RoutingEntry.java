package octave.java17.schema;

import java.util.Objects;

/// Audit record of one routed field.
/// @param sourcePath the field path
/// @param target the canonical target, for example `§INDEXER`
/// @param valueHash SHA-256 of the canonical value text
/// @param passed whether the field passed its constraints
public record RoutingEntry(String sourcePath, String target, String valueHash, boolean passed) {
    public RoutingEntry {
        Objects.requireNonNull(sourcePath, "sourcePath must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(valueHash, "valueHash must not be null");
    }
}

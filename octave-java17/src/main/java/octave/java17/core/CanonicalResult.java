package octave.java17.core;

import java.util.List;
import java.util.Objects;

/// Outcome of canonicalizing one text.
/// @param canonical the canonical rendering
/// @param document the parsed document
/// @param repairs every normalization applied, lexical entries first
/// @param receipts one receipt per literal zone
public record CanonicalResult(String canonical, OctaveAst.Document document, List<RepairEntry> repairs,
                              List<LiteralZoneReceipt> receipts) {
    public CanonicalResult {
        Objects.requireNonNull(canonical, "canonical must not be null");
        Objects.requireNonNull(document, "document must not be null");
        repairs = List.copyOf(Objects.requireNonNull(repairs, "repairs must not be null"));
        receipts = List.copyOf(Objects.requireNonNull(receipts, "receipts must not be null"));
    }
}

package octave.java17.core;

import java.util.List;
import java.util.Objects;

/// The documents of a multi-envelope stream, in source order.
public record StreamParseResult(List<OctaveAst.Document> documents, List<RepairEntry> repairs) {
    public StreamParseResult {
        documents = List.copyOf(Objects.requireNonNull(documents, "documents must not be null"));
        repairs = List.copyOf(Objects.requireNonNull(repairs, "repairs must not be null"));
    }
}

package octave.java17.core;

import java.util.List;
import java.util.Objects;

/// A parsed document together with the normalizations applied while parsing it.
public record ParseResult(OctaveAst.Document document, List<RepairEntry> repairs) {
    public ParseResult {
        Objects.requireNonNull(document, "document must not be null");
        repairs = List.copyOf(Objects.requireNonNull(repairs, "repairs must not be null"));
    }
}

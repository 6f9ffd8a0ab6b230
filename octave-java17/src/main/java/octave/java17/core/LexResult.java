package octave.java17.core;

import java.util.List;
import java.util.Objects;

/// Tokens produced from a source text together with the lexical normalizations applied.
public record LexResult(List<Token> tokens, List<RepairEntry> repairs) {
    public LexResult {
        tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens must not be null"));
        repairs = List.copyOf(Objects.requireNonNull(repairs, "repairs must not be null"));
    }
}

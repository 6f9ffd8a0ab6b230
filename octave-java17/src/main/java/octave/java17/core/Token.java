package octave.java17.core;

import java.util.Objects;

/// An immutable lexical token.
///
/// `raw` is the exact source text, `normalized` the canonical spelling or decoded value:
/// `->` has raw `->` and normalized `→`, the string `"a\"b"` has normalized `a"b`.
/// Lines and columns are 1-based.
public record Token(TokenKind kind, String raw, String normalized, int line, int column) {

    public Token {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(raw, "raw must not be null");
        Objects.requireNonNull(normalized, "normalized must not be null");
    }

    /// Column just past the raw text, used to detect adjacency on a line.
    public int endColumn() {
        return column + raw.length();
    }

    /// True when `next` starts on the same line exactly where this token ends.
    public boolean isAdjacentTo(Token next) {
        return next.line == line && next.column == endColumn();
    }

    @Override
    public String toString() {
        return kind + "('" + raw + "')@" + line + ":" + column;
    }
}

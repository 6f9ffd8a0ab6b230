package octave.java17.core;

import java.util.Objects;

/// Base class of the fatal lexing and parsing failures.
/// Carries the numbered error, the position and the triggering snippet so the
/// caller can report all three without a stack trace.
public class OctaveSyntaxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final OctaveError error;
    private final String detail;
    private final int line;
    private final int column;
    private final String snippet;

    public OctaveSyntaxException(OctaveError error, String detail, int line, int column, String snippet) {
        super(formatMessage(error, detail, line, column, snippet));
        this.error = Objects.requireNonNull(error, "error must not be null");
        this.detail = detail;
        this.line = line;
        this.column = column;
        this.snippet = snippet == null ? "" : snippet;
    }

    public OctaveError error() {
        return error;
    }

    /// The formatted message without code, position and rationale.
    public String detail() {
        return detail;
    }

    /// 1-based line, or -1 when unknown.
    public int line() {
        return line;
    }

    /// 1-based column, or -1 when unknown.
    public int column() {
        return column;
    }

    public String snippet() {
        return snippet;
    }

    private static String formatMessage(OctaveError error, String detail, int line, int column, String snippet) {
        final var sb = new StringBuilder();
        sb.append(error.code()).append(' ').append(detail);
        if (line > 0) {
            sb.append(" at line ").append(line).append(", column ").append(column);
        }
        if (snippet != null && !snippet.isEmpty()) {
            sb.append(" near '").append(snippet).append('\'');
        }
        sb.append(": ").append(error.rationale());
        return sb.toString();
    }
}

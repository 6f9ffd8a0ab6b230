package octave.java17.core;

/// The closed set of lexical kinds.
public enum TokenKind {
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    IDENTIFIER,
    /// `$NAME` or `$1:hint` placeholder, kept verbatim
    VARIABLE,
    /// `OCTAVE::5` ahead of the first envelope; the normalized value is the grammar version
    GRAMMAR_SENTINEL,
    /// `::`
    ASSIGN,
    /// `:` at the end of a block header
    BLOCK,
    /// `§`, ASCII alias `#`
    SECTION_MARKER,
    LIST_START,
    LIST_END,
    COMMA,
    /// `→`, ASCII alias `->`
    FLOW,
    /// `∧`, ASCII alias `&`
    CONSTRAINT,
    /// `∨`, ASCII alias `|`
    ALTERNATIVE,
    /// `⊕`, ASCII alias `+`
    SYNTHESIS,
    /// `⧺`, ASCII alias `~`
    CONCAT,
    /// `⇌`, ASCII aliases `<->` and `vs`
    TENSION,
    /// `@`, location or context
    AT,
    ENVELOPE_START,
    ENVELOPE_END,
    /// `---`
    SEPARATOR,
    COMMENT,
    /// A fenced verbatim span; the normalized value is its content.
    LITERAL_ZONE,
    /// Leading spaces of a line; the raw text is the spaces.
    INDENT,
    NEWLINE,
    EOF;

    /// True for the binary operators that chain values into a flow expression.
    public boolean isOperator() {
        return switch (this) {
            case FLOW, CONSTRAINT, ALTERNATIVE, SYNTHESIS, CONCAT, TENSION, AT -> true;
            default -> false;
        };
    }
}

package octave.java17.core;

/// Raised when a token stream does not form a document.
public class OctaveParseException extends OctaveSyntaxException {

    private static final long serialVersionUID = 1L;

    public OctaveParseException(OctaveError error, String detail, int line, int column, String snippet) {
        super(error, detail, line, column, snippet);
    }

    /// Creates an exception positioned at the given token.
    public OctaveParseException(OctaveError error, String detail, Token at) {
        super(error, detail, at.line(), at.column(), at.raw());
    }
}

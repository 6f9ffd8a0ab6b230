package octave.java17.core;

/// Raised when raw text cannot be turned into tokens.
public class OctaveLexException extends OctaveSyntaxException {

    private static final long serialVersionUID = 1L;

    public OctaveLexException(OctaveError error, String detail, int line, int column, String snippet) {
        super(error, detail, line, column, snippet);
    }
}

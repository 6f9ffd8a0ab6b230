package octave.java17.tools;

import octave.java17.core.OctaveError;

/// Thrown when the file no longer has the content hash the caller based its write on.
public class WriteConflictException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String actual;

    public WriteConflictException(String expected, String actual) {
        super(OctaveError.HASH_MISMATCH.code() + " " + OctaveError.HASH_MISMATCH.message(expected, actual)
            + ": " + OctaveError.HASH_MISMATCH.rationale());
        this.expected = expected;
        this.actual = actual;
    }

    /// The base hash the caller supplied.
    public String expected() {
        return expected;
    }

    /// The hash of the file content found under the lock.
    public String actual() {
        return actual;
    }

    OperationError toError() {
        return OperationError.of(OctaveError.HASH_MISMATCH, OctaveError.HASH_MISMATCH.message(expected, actual));
    }
}

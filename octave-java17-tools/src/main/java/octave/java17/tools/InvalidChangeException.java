package octave.java17.tools;

/// A write request whose changes cannot be applied as written.
final class InvalidChangeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    InvalidChangeException(String message) {
        super(message);
    }
}

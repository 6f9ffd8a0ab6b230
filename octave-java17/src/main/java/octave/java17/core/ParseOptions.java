package octave.java17.core;

/// Options for turning text into a document.
/// @param lenient synthesize a missing envelope or `===END===` instead of failing
public record ParseOptions(boolean lenient) {
    /// Lenient parsing; every synthesis is recorded in the repair log.
    public static final ParseOptions DEFAULT = new ParseOptions(true);
    public static final ParseOptions STRICT = new ParseOptions(false);
}

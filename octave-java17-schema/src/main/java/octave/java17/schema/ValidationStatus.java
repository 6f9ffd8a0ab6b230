package octave.java17.schema;

/// Validation state of a document. Every result carries one; a document is never
/// treated as validated without a bound schema.
public enum ValidationStatus {
    /// No schema was bound.
    UNVALIDATED,
    /// A schema was bound and every constraint passed.
    VALIDATED,
    /// A schema was bound and at least one constraint failed.
    INVALID
}

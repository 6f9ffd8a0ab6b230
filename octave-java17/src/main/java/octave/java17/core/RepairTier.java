package octave.java17.core;

/// Classification of a transformation.
public enum RepairTier {
    /// Meaning-preserving lexical or syntactic rewrite, always applied.
    NORMALIZATION,
    /// Bounded value-level correction, applied only when fixing against a schema.
    REPAIR,
    /// A change that would require inference; recorded and refused.
    FORBIDDEN_ATTEMPT
}

package octave.java17.schema;

import java.util.List;
import java.util.Objects;

/// Schema-wide rules read from the `POLICY:` block.
/// @param version the policy version, empty when not declared
/// @param unknownFields what to do with document fields the schema does not declare
/// @param targets routing targets declared in addition to the built-in `SELF`, without `§`
public record Policy(String version, UnknownFields unknownFields, List<String> targets) {

    /// A schema without a POLICY block ignores unknown fields and declares no extra targets.
    public static final Policy DEFAULT = new Policy("", UnknownFields.IGNORE, List.of());

    public Policy {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(unknownFields, "unknownFields must not be null");
        targets = List.copyOf(Objects.requireNonNull(targets, "targets must not be null"));
    }

    public enum UnknownFields {
        /// An undeclared field is a validation error.
        REJECT,
        /// Undeclared fields are accepted silently.
        IGNORE,
        /// Undeclared fields are accepted and reported as warnings.
        WARN
    }
}

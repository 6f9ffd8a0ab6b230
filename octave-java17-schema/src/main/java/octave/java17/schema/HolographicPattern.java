package octave.java17.schema;

import octave.java17.core.OctaveAst.Value;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A decoded `[example ∧CONSTRAINT… →§TARGET]` pattern.
/// @param example the example value
/// @param constraints the constraint chain in evaluation order
/// @param target the routing target name without `§`, if any
public record HolographicPattern(Value example, List<Constraint> constraints, Optional<String> target) {

    public HolographicPattern {
        Objects.requireNonNull(example, "example must not be null");
        constraints = List.copyOf(Objects.requireNonNull(constraints, "constraints must not be null"));
        Objects.requireNonNull(target, "target must not be null");
    }

    public boolean isRequired() {
        return constraints.stream().anyMatch(Constraint.Required.class::isInstance);
    }
}

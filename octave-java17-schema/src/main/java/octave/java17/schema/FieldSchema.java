package octave.java17.schema;

import octave.java17.core.OctaveAst.Value;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// The declaration of one field.
/// @param path the dotted field path
/// @param example the example value from the pattern
/// @param constraints the constraint chain in evaluation order
/// @param target the routing target without `§`, from the pattern or the enclosing block
/// @param targetInherited true when the target comes from an enclosing block
public record FieldSchema(String path, Value example, List<Constraint> constraints, Optional<String> target,
                          boolean targetInherited) {

    public FieldSchema {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(example, "example must not be null");
        constraints = List.copyOf(Objects.requireNonNull(constraints, "constraints must not be null"));
        Objects.requireNonNull(target, "target must not be null");
        if (targetInherited && target.isEmpty()) {
            throw new IllegalArgumentException("An inherited target must be present for " + path);
        }
    }

    public boolean isRequired() {
        return constraints.stream().anyMatch(Constraint.Required.class::isInstance);
    }
}

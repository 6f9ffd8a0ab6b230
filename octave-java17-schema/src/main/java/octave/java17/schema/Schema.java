package octave.java17.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// An immutable schema, safe to share between threads.
/// @param name the schema name, taken from the envelope of the schema document
/// @param version `META.VERSION` of the schema document
/// @param policy the schema-wide rules
/// @param fields field declarations by dotted path, in declaration order
public record Schema(String name, String version, Policy policy, Map<String, FieldSchema> fields) {

    /// The target every schema accepts.
    public static final String SELF = "SELF";

    public Schema {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields must not be null")));
    }

    public Optional<FieldSchema> field(String path) {
        return Optional.ofNullable(fields.get(path));
    }

    /// `SELF` followed by the policy targets.
    public Set<String> targets() {
        final var all = new LinkedHashSet<String>();
        all.add(SELF);
        all.addAll(policy.targets());
        return Collections.unmodifiableSet(all);
    }
}

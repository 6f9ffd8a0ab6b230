package octave.java17.tools;

import octave.java17.core.StructuredLog;
import octave.java17.schema.Schema;
import octave.java17.schema.SchemaExtractor;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import static octave.java17.tools.ToolsLogging.LOG;

/// Schemas by name, shared read-only by concurrent operations.
public final class SchemaRegistry {

    private final Map<String, Schema> schemas = new ConcurrentHashMap<>();

    public static SchemaRegistry of(Schema... schemas) {
        final var registry = new SchemaRegistry();
        for (Schema schema : schemas) {
            registry.register(schema);
        }
        return registry;
    }

    /// Adds or replaces the schema registered under its name.
    public Schema register(Schema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        schemas.put(schema.name(), schema);
        StructuredLog.fine(LOG, "schema.register", "name", schema.name(), "version", schema.version());
        return schema;
    }

    /// Loads a schema document and registers it.
    /// @throws octave.java17.schema.SchemaLoadException if the document is not a well-formed schema
    /// @throws octave.java17.core.OctaveSyntaxException if the text does not parse
    public Schema register(String schemaText) {
        return register(SchemaExtractor.load(schemaText));
    }

    public Optional<Schema> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(schemas.get(name));
    }

    /// Registered names in sorted order.
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(schemas.keySet()));
    }
}

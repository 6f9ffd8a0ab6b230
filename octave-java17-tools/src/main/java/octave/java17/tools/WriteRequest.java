package octave.java17.tools;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Input of [WriteOperation]. Exactly one of `content` and `changes` is set.
/// @param path the target file
/// @param content the full new document text, or null
/// @param changes updates by `KEY` or `META.KEY`, or null; a [#DELETE] value removes the key and
///                a null value sets it to `null`
/// @param schemaName the schema to validate against, or null
/// @param baseHash SHA-256 of the file content the caller last read, or null
public record WriteRequest(Path path, String content, Map<String, Object> changes, String schemaName,
                           String baseHash) {

    /// Removes the key it is assigned to.
    public static final Map<String, String> DELETE = Map.of("$op", "DELETE");

    public WriteRequest {
        Objects.requireNonNull(path, "path must not be null");
        if (changes != null) {
            changes = Collections.unmodifiableMap(new LinkedHashMap<>(changes));
        }
    }

    public static WriteRequest ofContent(Path path, String content) {
        return new WriteRequest(path, content, null, null, null);
    }

    public static WriteRequest ofChanges(Path path, Map<String, Object> changes) {
        return new WriteRequest(path, null, changes, null, null);
    }

    public WriteRequest withSchema(String name) {
        return new WriteRequest(path, content, changes, name, baseHash);
    }

    public WriteRequest withBaseHash(String hash) {
        return new WriteRequest(path, content, changes, schemaName, hash);
    }

    static boolean isDelete(Object value) {
        return value instanceof Map<?, ?> m && m.size() == 1 && "DELETE".equals(m.get("$op"));
    }
}

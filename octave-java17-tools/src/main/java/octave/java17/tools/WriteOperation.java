package octave.java17.tools;

import octave.java17.core.CanonicalEmitter;
import octave.java17.core.Hashes;
import octave.java17.core.Octave;
import octave.java17.core.OctaveAst.Assignment;
import octave.java17.core.OctaveAst.Block;
import octave.java17.core.OctaveAst.Document;
import octave.java17.core.OctaveAst.Node;
import octave.java17.core.OctaveError;
import octave.java17.core.OctaveSyntaxException;
import octave.java17.core.ParseOptions;
import octave.java17.core.ParseResult;
import octave.java17.core.RepairEntry;
import octave.java17.core.StructuredLog;
import octave.java17.schema.RepairOptions;
import octave.java17.schema.Schema;
import octave.java17.schema.SchemaValidator;
import octave.java17.schema.ValidationResult;
import octave.java17.schema.ValidationStatus;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import static octave.java17.tools.ToolsLogging.LOG;

/// Writes a document to disk in canonical form.
///
/// A write is a compare-and-swap on the file content. When a base hash is given it is
/// compared with the SHA-256 of the current file content once up front and again under a
/// per-path lock, and the new content replaces the file by an atomic move of a temporary
/// file from the same directory. Writers to one path in this process are serialized by
/// the lock; the hash re-check guards against other writers.
public final class WriteOperation {

    private static final String META = "META";
    private static final String META_PREFIX = "META.";

    private final SchemaRegistry registry;
    private final Map<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

    public WriteOperation(SchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public WriteResponse write(WriteRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        final Path path = request.path().toAbsolutePath().normalize();
        final String shown = path.toString();
        if ((request.content() == null) == (request.changes() == null)) {
            return WriteResponse.failure(shown, OperationError.of(OctaveError.INVALID_INPUT,
                OctaveError.INVALID_INPUT.message("exactly one of content and changes must be given")));
        }
        if (Files.isSymbolicLink(path)) {
            return WriteResponse.failure(shown, OperationError.of(OctaveError.INVALID_INPUT,
                OctaveError.INVALID_INPUT.message("'" + shown + "' is a symbolic link")));
        }
        try {
            checkBaseHash(path, request.baseHash());
            final ReentrantLock lock = locks.computeIfAbsent(path, p -> new ReentrantLock());
            lock.lock();
            try {
                return writeLocked(path, request);
            } finally {
                lock.unlock();
            }
        } catch (WriteConflictException e) {
            StructuredLog.fine(LOG, "write.conflict", "path", shown, "expected", e.expected(), "actual", e.actual());
            return WriteResponse.failure(shown, e.toError());
        } catch (OctaveSyntaxException e) {
            return WriteResponse.failure(shown, OperationError.from(e));
        } catch (InvalidChangeException e) {
            return WriteResponse.failure(shown, OperationError.of(OctaveError.INVALID_INPUT,
                OctaveError.INVALID_INPUT.message(e.getMessage())));
        } catch (IOException e) {
            StructuredLog.warning(LOG, "write.io_failure", "path", shown, "error", e.toString());
            return WriteResponse.failure(shown, OperationError.of(OctaveError.IO_FAILURE,
                OctaveError.IO_FAILURE.message(shown, e.getMessage())));
        }
    }

    private WriteResponse writeLocked(Path path, WriteRequest request) throws IOException {
        final boolean exists = Files.exists(path);
        final String original = exists ? Files.readString(path, StandardCharsets.UTF_8) : "";
        checkHash(original, exists, request.baseHash());

        final ParseResult parsed;
        if (request.content() != null) {
            parsed = Octave.parse(request.content(), ParseOptions.DEFAULT);
        } else {
            if (!exists) {
                throw new InvalidChangeException("changes need an existing file, '" + path + "' does not exist");
            }
            final ParseResult current = Octave.parse(original, ParseOptions.DEFAULT);
            parsed = new ParseResult(applyChanges(current.document(), request.changes()), current.repairs());
        }
        final Document document = parsed.document();

        ValidationStatus status = ValidationStatus.UNVALIDATED;
        final var errors = new ArrayList<OperationError>();
        if (request.schemaName() != null) {
            final Optional<Schema> schema = registry.lookup(request.schemaName());
            if (schema.isEmpty()) {
                throw new InvalidChangeException("no schema named '" + request.schemaName() + "'");
            }
            final ValidationResult result = SchemaValidator.validate(document, schema.get(), RepairOptions.DEFAULT);
            status = result.status();
            result.errors().forEach(e -> errors.add(OperationError.from(e)));
        }

        final String canonical = CanonicalEmitter.emit(document);
        final String diff = StructuralMetrics.diff(original, canonical, metricsOf(original, exists),
            StructuralMetrics.of(document));
        if (!original.equals(canonical) || !exists) {
            replace(path, canonical, exists, request.baseHash());
        }
        final String hash = Hashes.sha256(canonical);
        StructuredLog.fine(LOG, "write", "path", path, "bytes", canonical.length(), "status", status,
            "diff", diff, "hash", hash);
        return new WriteResponse(true, path.toString(), diff, canonical, hash, status, errors,
            repairsOf(request, parsed));
    }

    // temp file in the target directory, re-check, then an atomic rename over the target
    private static void replace(Path path, String canonical, boolean existed, String baseHash) throws IOException {
        final Path dir = path.getParent();
        Files.createDirectories(dir);
        final Path temp = Files.createTempFile(dir, "." + path.getFileName(), ".tmp");
        try {
            Files.writeString(temp, canonical, StandardCharsets.UTF_8);
            if (existed && baseHash != null) {
                checkHash(Files.readString(path, StandardCharsets.UTF_8), true, baseHash);
            }
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static void checkBaseHash(Path path, String baseHash) throws IOException {
        if (baseHash != null && Files.exists(path)) {
            checkHash(Files.readString(path, StandardCharsets.UTF_8), true, baseHash);
        }
    }

    private static void checkHash(String content, boolean exists, String baseHash) {
        if (baseHash == null || !exists) {
            return;
        }
        final String actual = Hashes.sha256(content);
        if (!actual.equals(baseHash)) {
            throw new WriteConflictException(baseHash, actual);
        }
    }

    private static StructuralMetrics metricsOf(String original, boolean exists) {
        if (!exists) {
            return null;
        }
        try {
            return StructuralMetrics.of(Octave.parse(original, ParseOptions.DEFAULT).document());
        } catch (OctaveSyntaxException e) {
            StructuredLog.finer(LOG, "write.unparsed_original", "code", e.error().code());
            return null;
        }
    }

    // the parse normalizations of new content; changes are explicit, not repairs
    private static List<RepairEntry> repairsOf(WriteRequest request, ParseResult parsed) {
        return request.content() != null ? parsed.repairs() : List.of();
    }

    static Document applyChanges(Document document, Map<String, Object> changes) {
        Document out = document;
        for (Map.Entry<String, Object> change : changes.entrySet()) {
            final String key = change.getKey();
            final Object value = change.getValue();
            if (key.equals(META)) {
                out = replaceMeta(out, value);
            } else if (key.startsWith(META_PREFIX)) {
                out = changeMeta(out, key.substring(META_PREFIX.length()), value);
            } else if (key.contains(".")) {
                throw new InvalidChangeException("'" + key + "' is neither KEY nor META.KEY");
            } else {
                out = out.withSections(change(out.sections(), key, value));
            }
        }
        return out;
    }

    private static Document replaceMeta(Document document, Object value) {
        if (WriteRequest.isDelete(value)) {
            return document.withMeta(Optional.empty());
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new InvalidChangeException("'META' takes a map of fields");
        }
        final var children = new ArrayList<Node>();
        map.forEach((k, v) -> children.add(new Assignment(String.valueOf(k), ChangeValues.toValue(META_PREFIX + k, v))));
        return withMetaChildren(document, children);
    }

    private static Document changeMeta(Document document, String field, Object value) {
        final List<Node> children = document.meta().map(Block::children).orElse(List.of());
        return withMetaChildren(document, change(children, field, value));
    }

    private static Document withMetaChildren(Document document, List<Node> children) {
        return document.withMeta(children.isEmpty()
            ? Optional.empty()
            : Optional.of(new Block(META, Optional.empty(), children)));
    }

    // replaces the first assignment with the key, appends when there is none
    private static List<Node> change(List<Node> nodes, String key, Object value) {
        final boolean delete = WriteRequest.isDelete(value);
        final var out = new ArrayList<Node>(nodes.size() + 1);
        boolean found = false;
        for (Node node : nodes) {
            if (node instanceof Block b && b.key().equals(key)) {
                throw new InvalidChangeException("'" + key + "' is a block, changes address assignments");
            }
            if (!found && node instanceof Assignment a && a.key().equals(key)) {
                found = true;
                if (!delete) {
                    out.add(a.withValue(ChangeValues.toValue(key, value)));
                }
                continue;
            }
            out.add(node);
        }
        if (!found && !delete) {
            out.add(new Assignment(key, ChangeValues.toValue(key, value)));
        }
        return out;
    }
}

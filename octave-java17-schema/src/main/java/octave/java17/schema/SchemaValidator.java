package octave.java17.schema;

import octave.java17.core.Hashes;
import octave.java17.core.OctaveAst.Document;
import octave.java17.core.OctaveAst.Value;
import octave.java17.core.OctaveError;
import octave.java17.core.RepairEntry;
import octave.java17.core.RepairLog;
import octave.java17.core.StructuredLog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static octave.java17.schema.SchemaLogging.LOG;

/// Checks a document against a [Schema].
///
/// Declared fields are visited in declaration order. Each constraint chain stops at its
/// first failure, while errors from different fields are all collected. Missing required
/// values are reported and never filled, even when `fix` is set.
public final class SchemaValidator {

    private SchemaValidator() {
    }

    public static ValidationResult validate(Document document, Schema schema, RepairOptions options) {
        return validate(document, schema, options, null, List.of());
    }

    /// Validates against a schema, continuing an existing audit log.
    /// @param previous the previous version of the document for APPEND_ONLY checks, or null
    /// @param earlier entries already recorded for this document, normally the parse normalizations
    public static ValidationResult validate(Document document, Schema schema, RepairOptions options,
                                            Document previous, List<RepairEntry> earlier) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(options, "options must not be null");
        final var log = new RepairLog(earlier);
        final Map<String, Value> present = DocumentPaths.fields(document);
        final Map<String, Value> before = previous == null ? Map.of() : DocumentPaths.fields(previous);
        final var replacements = new LinkedHashMap<String, Value>();
        final var errors = new ArrayList<ValidationError>();
        final var routing = new ArrayList<RoutingEntry>();
        final var warnings = new ArrayList<String>();

        for (FieldSchema field : schema.fields().values()) {
            final String path = field.path();
            Value value = present.get(path);
            if (value == null) {
                if (field.isRequired()) {
                    if (options.fix()) {
                        refuse(RepairEngine.ForbiddenAction.INSERT_MISSING_FIELD, path, log);
                        errors.add(ValidationError.of(path, OctaveError.FORBIDDEN_REPAIR,
                            RepairEngine.ForbiddenAction.INSERT_MISSING_FIELD, path));
                    } else {
                        errors.add(ValidationError.of(path, OctaveError.REQUIRED_FIELD_MISSING, path));
                    }
                }
                continue;
            }
            boolean passed;
            if (options.fix() && isAmbiguous(path, value, field, log, errors, replacements)) {
                passed = false;
            } else {
                value = replacements.getOrDefault(path, value);
                final Optional<ValidationError> failure = check(path, value, field, before.get(path));
                failure.ifPresent(errors::add);
                passed = failure.isEmpty();
            }
            route(field, value, passed, schema, options, log, errors, routing);
        }

        for (String path : present.keySet()) {
            if (path.startsWith(DocumentPaths.META_PREFIX) || schema.fields().containsKey(path)) {
                continue;
            }
            switch (schema.policy().unknownFields()) {
                case REJECT -> errors.add(ValidationError.of(path, OctaveError.UNKNOWN_FIELD, path, schema.name()));
                case WARN -> warnings.add(path);
                case IGNORE -> {
                }
            }
        }

        final ValidationStatus status = errors.isEmpty() ? ValidationStatus.VALIDATED : ValidationStatus.INVALID;
        final var result = new ValidationResult(status, errors, log.entries(),
            DocumentPaths.replace(document, replacements), routing, warnings);
        StructuredLog.fine(LOG, "validate.done", "schema", schema.name(), "status", status,
            "errors", errors.size(), "repairs", result.repairs().size() - earlier.size(),
            "routed", routing.size(), "warnings", warnings.size());
        return result;
    }

    // runs the repair engine; true when the value is an ambiguous enum match
    private static boolean isAmbiguous(String path, Value value, FieldSchema field, RepairLog log,
                                       List<ValidationError> errors, Map<String, Value> replacements) {
        final RepairEngine.RepairOutcome outcome = RepairEngine.repair(path, value, field, log);
        if (outcome instanceof RepairEngine.Ambiguous a) {
            errors.add(ValidationError.of(path, OctaveError.AMBIGUOUS_ENUM_REPAIR,
                path, Values.show(value), a.candidates()));
            return true;
        }
        if (outcome instanceof RepairEngine.Repaired r) {
            replacements.put(path, r.value());
        }
        return false;
    }

    private static Optional<ValidationError> check(String path, Value value, FieldSchema field, Value previous) {
        for (Constraint constraint : field.constraints()) {
            final Optional<ValidationError> failure = constraint.check(path, value, previous);
            if (failure.isPresent()) {
                StructuredLog.fine(LOG, "validate.failed", "path", path, "constraint", constraint.render(),
                    "code", failure.get().code());
                return failure;
            }
        }
        return Optional.empty();
    }

    private static void route(FieldSchema field, Value value, boolean passed, Schema schema, RepairOptions options,
                              RepairLog log, List<ValidationError> errors, List<RoutingEntry> routing) {
        if (field.target().isEmpty()) {
            return;
        }
        final String target = field.target().get();
        if (!schema.targets().contains(target)) {
            if (options.fix()) {
                refuse(RepairEngine.ForbiddenAction.INFER_ROUTING_TARGET, field.path(), log);
            }
            errors.add(ValidationError.of(field.path(), OctaveError.INVALID_TARGET, field.path(), target));
            return;
        }
        final var entry = new RoutingEntry(field.path(), "§" + target, Hashes.sha256(Values.show(value)), passed);
        routing.add(entry);
        StructuredLog.route(LOG, entry.sourcePath(), entry.target(), entry.valueHash(), passed);
    }

    // the attempt is recorded in the log; the caller reports it as a validation error
    private static void refuse(RepairEngine.ForbiddenAction action, String path, RepairLog log) {
        try {
            RepairEngine.request(action, path, log);
        } catch (ForbiddenRepairException e) {
            StructuredLog.finer(LOG, "validate.refused", "message", e.getMessage());
        }
    }
}

package octave.java17.tools;

import octave.java17.core.CanonicalEmitter;
import octave.java17.core.Octave;
import octave.java17.core.OctaveAst.Document;
import octave.java17.core.OctaveError;
import octave.java17.core.OctaveSyntaxException;
import octave.java17.core.ParseOptions;
import octave.java17.core.ParseResult;
import octave.java17.core.StructuredLog;
import octave.java17.schema.RepairOptions;
import octave.java17.schema.Schema;
import octave.java17.schema.SchemaValidator;
import octave.java17.schema.ValidationResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static octave.java17.tools.ToolsLogging.LOG;

/// Parses, optionally validates and repairs, and canonicalizes one document.
///
/// The schema is chosen by name. Without a name the envelope name selects it; a document
/// whose envelope was synthesized has no name to select by and is refused with E025.
/// A document whose schema is not registered is reported UNVALIDATED.
public final class ValidateOperation {

    private final SchemaRegistry registry;

    public ValidateOperation(SchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public ValidateResponse validate(String content, String schemaName, boolean fix) {
        if (content == null) {
            return ValidateResponse.failure("", OperationError.of(OctaveError.INVALID_INPUT,
                OctaveError.INVALID_INPUT.message("content or path is required")));
        }
        final ParseResult parsed;
        try {
            parsed = Octave.parse(content, ParseOptions.DEFAULT);
        } catch (OctaveSyntaxException e) {
            StructuredLog.syntaxError(LOG, "validate.syntax", e);
            return ValidateResponse.failure(content, OperationError.from(e));
        }
        final Document document = parsed.document();
        final var errors = new ArrayList<OperationError>();

        final boolean named = schemaName != null && !schemaName.isBlank();
        if (!named && document.envelopeInferred()) {
            errors.add(OperationError.of(OctaveError.MISSING_SCHEMA_SELECTOR, OctaveError.MISSING_SCHEMA_SELECTOR.message()));
            return unvalidated(document, parsed, errors);
        }
        final String selector = named ? schemaName : document.name();
        final Optional<Schema> schema = registry.lookup(selector);
        if (schema.isEmpty()) {
            if (named) {
                errors.add(OperationError.of(OctaveError.INVALID_INPUT,
                    OctaveError.INVALID_INPUT.message("no schema named '" + selector + "'")));
            }
            return unvalidated(document, parsed, errors);
        }

        final ValidationResult result = SchemaValidator.validate(document, schema.get(),
            fix ? RepairOptions.FIX : RepairOptions.DEFAULT, null, parsed.repairs());
        result.errors().forEach(e -> errors.add(OperationError.from(e)));
        final var response = new ValidateResponse(CanonicalEmitter.emit(result.document()), errors.isEmpty(),
            result.status(), errors, result.repairs(), result.routing(), result.warnings());
        StructuredLog.fine(LOG, "validate", "schema", selector, "status", response.status(),
            "errors", errors.size(), "repairs", response.repairs().size());
        return response;
    }

    /// Reads the file as UTF-8 and validates its content.
    public ValidateResponse validateFile(Path path, String schemaName, boolean fix) {
        Objects.requireNonNull(path, "path must not be null");
        final String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            StructuredLog.warning(LOG, "validate.read_failed", "path", path, "error", e.toString());
            return ValidateResponse.failure("", OperationError.of(OctaveError.IO_FAILURE,
                OctaveError.IO_FAILURE.message(path, e.getMessage())));
        }
        return validate(content, schemaName, fix);
    }

    private static ValidateResponse unvalidated(Document document, ParseResult parsed, List<OperationError> errors) {
        final ValidationResult result = ValidationResult.unvalidated(document, parsed.repairs());
        return new ValidateResponse(CanonicalEmitter.emit(document), errors.isEmpty(), result.status(), errors,
            result.repairs(), List.of(), List.of());
    }
}

package octave.java17.schema;

import java.util.logging.Logger;

/// Centralized logger for the schema engine.
/// Classes in this package use it via:
///   import static octave.java17.schema.SchemaLogging.LOG;
final class SchemaLogging {
    public static final Logger LOG = Logger.getLogger("octave.java17.schema");
    private SchemaLogging() {}
}

package octave.java17.tools;

import java.util.logging.Logger;

/// Centralized logger for the boundary operations.
/// Classes in this package use it via:
///   import static octave.java17.tools.ToolsLogging.LOG;
final class ToolsLogging {
    public static final Logger LOG = Logger.getLogger("octave.java17.tools");
    private ToolsLogging() {}
}

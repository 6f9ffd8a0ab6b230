package octave.java17.core;

import java.util.logging.Logger;

/// Centralized logger for the OCTAVE core.
/// Classes in this package use it via:
///   import static octave.java17.core.OctaveLogging.LOG;
final class OctaveLogging {
    public static final Logger LOG = Logger.getLogger("octave.java17.core");
    private OctaveLogging() {}
}

package octave.java17.core;

import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Structured JUL events shared by every OCTAVE module.
///
/// Each record is one line, `event=NAME key=value ...`. Values are flattened to a single line,
/// capped in length, and quoted when they contain whitespace or quotes, so repair entries
/// holding raw source text stay greppable.
public final class StructuredLog {

    static final int MAX_VALUE = 256;

    private StructuredLog() {}

    public static void warning(Logger log, String event, Object... kv) {
        emit(log, Level.WARNING, event, kv);
    }

    public static void fine(Logger log, String event, Object... kv) {
        emit(log, Level.FINE, event, kv);
    }

    public static void finer(Logger log, String event, Object... kv) {
        emit(log, Level.FINER, event, kv);
    }

    public static void finest(Logger log, String event, Object... kv) {
        emit(log, Level.FINEST, event, kv);
    }

    /// Logs an audit entry. Layout normalizations are FINER; repairs and refused attempts are FINE.
    public static void repair(Logger log, RepairEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        final Level level = entry.tier() == RepairTier.NORMALIZATION ? Level.FINER : Level.FINE;
        emit(log, level, "repair." + entry.tier().name().toLowerCase(Locale.ROOT),
            "rule", entry.ruleId(), "before", entry.before(), "after", entry.after(),
            "line", entry.line(), "column", entry.column(), "semantics", entry.semanticsChanged());
    }

    /// Logs one routing decision of a validated field.
    public static void route(Logger log, String sourcePath, String target, String valueHash, boolean passed) {
        emit(log, Level.FINER, "route", "path", sourcePath, "target", target,
            "hash", valueHash.length() > 12 ? valueHash.substring(0, 12) : valueHash, "passed", passed);
    }

    /// Logs a lexical or parse failure that a boundary operation turns into data.
    public static void syntaxError(Logger log, String event, OctaveSyntaxException error) {
        emit(log, Level.FINE, event, "code", error.error().code(), "line", error.line(), "column", error.column());
    }

    private static void emit(Logger log, Level level, String event, Object... kv) {
        if (log.isLoggable(level)) {
            log.log(level, () -> format(event, kv));
        }
    }

    static String format(String event, Object... kv) {
        final var sb = new StringBuilder(64).append("event=").append(flatten(event));
        for (int i = 0; i + 1 < kv.length; i += 2) {
            if (kv[i] == null) {
                continue;
            }
            final String value = kv[i + 1] == null ? "null" : flatten(kv[i + 1].toString());
            sb.append(' ').append(kv[i]).append('=');
            if (value.isEmpty() || value.chars().anyMatch(c -> Character.isWhitespace(c) || c == '"')) {
                sb.append('"').append(value.replace("\"", "\\\"")).append('"');
            } else {
                sb.append(value);
            }
        }
        return sb.toString();
    }

    private static String flatten(String s) {
        final String capped = s.length() > MAX_VALUE ? s.substring(0, MAX_VALUE) + "..." : s;
        return capped.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
    }
}

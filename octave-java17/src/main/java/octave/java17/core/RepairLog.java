package octave.java17.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static octave.java17.core.OctaveLogging.LOG;

/// Append-only ledger of the transformations applied during one pipeline call.
/// Entries keep the order in which they were appended. A log is owned by a single call
/// and is not shared between threads.
public final class RepairLog {

    private final List<RepairEntry> entries = new ArrayList<>();

    public RepairLog() {
    }

    /// Starts a log that continues after the given entries.
    public RepairLog(List<RepairEntry> earlier) {
        entries.addAll(Objects.requireNonNull(earlier, "earlier must not be null"));
    }

    public void append(RepairEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");
        entries.add(entry);
        StructuredLog.repair(LOG, entry);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /// Immutable snapshot of the entries so far.
    public List<RepairEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }
}

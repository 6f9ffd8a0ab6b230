package octave.java17.schema;

/// Options for schema validation.
/// @param fix apply REPAIR-tier value corrections
public record RepairOptions(boolean fix) {
    /// Report only; nothing in the document changes.
    public static final RepairOptions DEFAULT = new RepairOptions(false);
    public static final RepairOptions FIX = new RepairOptions(true);
}

package octave.java17.core;

import java.util.Objects;

/// One audited transformation.
/// @param ruleId stable rule identifier such as `ASCII_ALIAS` or `ENUM_CASE_FOLD`
/// @param before the source snippet or value before the change
/// @param after the snippet or value after the change
/// @param tier the repair tier
/// @param semanticsChanged whether the value of the document changed
/// @param line 1-based source line, or 0 when the change is not tied to a source position
/// @param column 1-based source column, or 0
public record RepairEntry(String ruleId, String before, String after, RepairTier tier,
                          boolean semanticsChanged, int line, int column) {

    public RepairEntry {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(before, "before must not be null");
        Objects.requireNonNull(after, "after must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
        if (ruleId.isEmpty()) {
            throw new IllegalArgumentException("ruleId must not be empty");
        }
    }

    /// A meaning-preserving rewrite at a source position.
    public static RepairEntry normalization(String ruleId, String before, String after, int line, int column) {
        return new RepairEntry(ruleId, before, after, RepairTier.NORMALIZATION, false, line, column);
    }

    /// A schema-driven value correction.
    public static RepairEntry repair(String ruleId, String before, String after) {
        return new RepairEntry(ruleId, before, after, RepairTier.REPAIR, true, 0, 0);
    }

    /// A refused change; nothing in the document is altered.
    public static RepairEntry forbidden(String ruleId, String before, String after) {
        return new RepairEntry(ruleId, before, after, RepairTier.FORBIDDEN_ATTEMPT, false, 0, 0);
    }
}

package octave.java17.schema;

import octave.java17.core.OctaveError;

import java.util.Objects;

/// Thrown when a repair would add or restructure content. The attempt is logged as a
/// FORBIDDEN_ATTEMPT entry before this is raised.
public class ForbiddenRepairException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final RepairEngine.ForbiddenAction action;
    private final String path;

    public ForbiddenRepairException(RepairEngine.ForbiddenAction action, String path) {
        super(OctaveError.FORBIDDEN_REPAIR.code() + " " + OctaveError.FORBIDDEN_REPAIR.message(action, path)
            + ": " + action.reason());
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    public RepairEngine.ForbiddenAction action() {
        return action;
    }

    public String path() {
        return path;
    }

    public OctaveError error() {
        return OctaveError.FORBIDDEN_REPAIR;
    }
}

package octave.java17.tools;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/// How a document is projected by [EjectOperation].
/// @param mode which part of the document is kept and how it is spelled
/// @param format the output notation
public record EjectOptions(Mode mode, Format format) {

    public static final EjectOptions DEFAULT = new EjectOptions(Mode.CANONICAL, Format.NATIVE);

    public EjectOptions {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(format, "format must not be null");
    }

    /// Reads mode and format names case-insensitively; a null name selects the default.
    /// @throws IllegalArgumentException when a name is unknown
    public static EjectOptions parse(String mode, String format) {
        return new EjectOptions(
            mode == null ? DEFAULT.mode : lookup(Mode.class, mode),
            format == null ? DEFAULT.format : lookup(Format.class, format));
    }

    private static <E extends Enum<E>> E lookup(Class<E> type, String name) {
        try {
            return Enum.valueOf(type, name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + type.getSimpleName().toLowerCase(Locale.ROOT)
                + " '" + name + "'", e);
        }
    }

    public enum Mode {
        /// The whole document as canonical text.
        CANONICAL(false),
        /// The whole document with ASCII operator aliases, easier to type.
        AUTHORING(false),
        /// STATUS, RISKS and DECISIONS only.
        EXECUTIVE(true, "STATUS", "RISKS", "DECISIONS"),
        /// TESTS, CI and DEPS only.
        DEVELOPER(true, "TESTS", "CI", "DEPS");

        private final boolean lossy;
        private final Set<String> kept;

        Mode(boolean lossy, String... kept) {
            this.lossy = lossy;
            this.kept = Set.of(kept);
        }

        public boolean lossy() {
            return lossy;
        }

        /// Top-level keys a lossy mode keeps; META is always kept.
        public Set<String> kept() {
            return kept;
        }
    }

    public enum Format {
        NATIVE,
        JSON,
        YAML,
        MARKDOWN
    }
}

package octave.java17.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static octave.java17.core.OctaveLogging.LOG;

/// Entry points from text: tokenize, parse and canonicalize.
/// Every call is a pure function of its arguments and safe to run concurrently.
public final class Octave {

    private Octave() {
    }

    public static LexResult tokenize(String text) {
        return OctaveLexer.tokenize(text);
    }

    /// Lexes and parses one document. Lexical repairs precede parse repairs in the result.
    /// @throws OctaveSyntaxException if the text cannot be lexed or parsed
    public static ParseResult parse(String text, ParseOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        final LexResult lexed = OctaveLexer.tokenize(text);
        final ParseResult parsed = options.lenient()
            ? OctaveParser.parseWithWarnings(lexed.tokens())
            : OctaveParser.parse(lexed.tokens());
        return new ParseResult(parsed.document(), concat(lexed.repairs(), parsed.repairs()));
    }

    /// Lexes and parses a stream of enveloped documents.
    public static StreamParseResult parseAll(String text) {
        final LexResult lexed = OctaveLexer.tokenize(text);
        final StreamParseResult parsed = OctaveParser.parseAll(lexed.tokens());
        return new StreamParseResult(parsed.documents(), concat(lexed.repairs(), parsed.repairs()));
    }

    /// Rewrites the text to canonical form, logging every normalization.
    /// Canonicalizing the result again yields the same text and no repairs.
    public static CanonicalResult canonicalize(String text, ParseOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        final LexResult lexed = OctaveLexer.tokenize(text);
        final ParseResult parsed = options.lenient()
            ? OctaveParser.parseWithWarnings(lexed.tokens())
            : OctaveParser.parse(lexed.tokens());
        final String canonical = CanonicalEmitter.emit(parsed.document());
        List<LiteralZoneReceipt> receipts = List.of();
        if (lexed.tokens().stream().anyMatch(t -> t.kind() == TokenKind.LITERAL_ZONE)) {
            receipts = LiteralZoneReceipt.audit(lexed.tokens(), OctaveLexer.tokenize(canonical).tokens());
        }
        final List<RepairEntry> repairs = concat(lexed.repairs(), parsed.repairs());
        StructuredLog.fine(LOG, "canonicalize", "name", parsed.document().name(), "repairs", repairs.size(),
            "zones", receipts.size());
        return new CanonicalResult(canonical, parsed.document(), repairs, receipts);
    }

    private static List<RepairEntry> concat(List<RepairEntry> first, List<RepairEntry> second) {
        final var all = new ArrayList<RepairEntry>(first.size() + second.size());
        all.addAll(first);
        all.addAll(second);
        return all;
    }
}

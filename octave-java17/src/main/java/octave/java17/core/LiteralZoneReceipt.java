package octave.java17.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Evidence that the content of one literal zone passed through canonicalization unchanged.
/// @param key the assignment key holding the zone
/// @param line the source line of the opening fence
/// @param preHash SHA-256 of the content as read from the source
/// @param postHash SHA-256 of the content as read back from the canonical output
public record LiteralZoneReceipt(String key, int line, String preHash, String postHash) {

    public LiteralZoneReceipt {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(preHash, "preHash must not be null");
        Objects.requireNonNull(postHash, "postHash must not be null");
    }

    public boolean unchanged() {
        return preHash.equals(postHash);
    }

    /// Pairs the literal zones of the source tokens with those of the canonical tokens, in order.
    static List<LiteralZoneReceipt> audit(List<Token> source, List<Token> canonical) {
        final List<Integer> before = zones(source);
        final List<Integer> after = zones(canonical);
        if (before.size() != after.size()) {
            throw new IllegalStateException("Canonical output has " + after.size()
                + " literal zones, source has " + before.size());
        }
        final var receipts = new ArrayList<LiteralZoneReceipt>(before.size());
        for (int i = 0; i < before.size(); i++) {
            final Token zone = source.get(before.get(i));
            receipts.add(new LiteralZoneReceipt(keyOf(source, before.get(i)), zone.line(),
                Hashes.sha256(zone.normalized()), Hashes.sha256(canonical.get(after.get(i)).normalized())));
        }
        return receipts;
    }

    private static List<Integer> zones(List<Token> tokens) {
        final var indexes = new ArrayList<Integer>();
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).kind() == TokenKind.LITERAL_ZONE) {
                indexes.add(i);
            }
        }
        return indexes;
    }

    // KEY :: NEWLINE [INDENT] ZONE
    private static String keyOf(List<Token> tokens, int zone) {
        int i = zone - 1;
        while (i >= 0 && (tokens.get(i).kind() == TokenKind.INDENT || tokens.get(i).kind() == TokenKind.NEWLINE)) {
            i--;
        }
        if (i >= 1 && tokens.get(i).kind() == TokenKind.ASSIGN) {
            return tokens.get(i - 1).normalized();
        }
        return "";
    }
}

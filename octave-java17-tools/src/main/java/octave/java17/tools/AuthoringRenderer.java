package octave.java17.tools;

import octave.java17.core.Octave;
import octave.java17.core.Token;
import octave.java17.core.TokenKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/// Re-spells the operators of a canonical text with their ASCII aliases.
/// Every alias lexes back to the same symbol, so parsing the output yields the same document.
/// Strings, comments and literal zones are single tokens and keep their symbols.
final class AuthoringRenderer {

    private static final Map<TokenKind, String> ALIASES = Map.of(
        TokenKind.FLOW, "->",
        TokenKind.CONSTRAINT, "&",
        TokenKind.ALTERNATIVE, "|",
        TokenKind.SYNTHESIS, "+",
        TokenKind.CONCAT, "~",
        TokenKind.TENSION, "<->");

    private AuthoringRenderer() {
    }

    static String render(String canonical) {
        final String[] lines = canonical.split("\n", -1);
        final List<Token> operators = new ArrayList<>();
        for (Token token : Octave.tokenize(canonical).tokens()) {
            if (ALIASES.containsKey(token.kind()) && !token.raw().equals(ALIASES.get(token.kind()))) {
                operators.add(token);
            }
        }
        // right to left so earlier columns stay valid
        operators.sort(Comparator.comparingInt(Token::line).thenComparing(Token::column, Comparator.reverseOrder()));
        for (Token token : operators) {
            final int index = token.line() - 1;
            final String line = lines[index];
            final int at = token.column() - 1;
            lines[index] = line.substring(0, at) + ALIASES.get(token.kind()) + line.substring(at + token.raw().length());
        }
        return String.join("\n", lines);
    }
}

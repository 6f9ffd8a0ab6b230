package octave.java17.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static octave.java17.core.OctaveLogging.LOG;

/// Converts raw OCTAVE text into a flat, position-tagged token stream.
///
/// The lexer performs lexical normalization only. ASCII aliases become canonical symbols
/// and layout noise is dropped; each such change is appended to the repair log as a
/// NORMALIZATION entry. Tabs, single-colon assignments, illegal characters and broken
/// literal zones are fatal.
///
/// Inside brackets, newlines and indentation carry no meaning and produce no tokens.
/// A `//` always opens a comment, even inside a bare word such as `docs/a//b`.
public final class OctaveLexer {

    static final Pattern NUMBER = Pattern.compile("-?\\d+(?:\\.\\d+)?(?:[eE][+-]?\\d+)?");
    private static final Pattern ENVELOPE = Pattern.compile("===(.*)===");
    private static final Pattern ENVELOPE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern GRAMMAR_SENTINEL = Pattern.compile("OCTAVE::(\\d+(?:\\.\\d+)*(?:-[A-Za-z0-9.-]+)?)");
    private static final String OPERATOR_CHARS = "→∧∨⊕⧺⇌§";

    private final String text;
    private final List<Token> tokens = new ArrayList<>();
    private final RepairLog log = new RepairLog();
    private final Deque<Token> brackets = new ArrayDeque<>();
    private int pos;
    private int line = 1;
    private int lineStart;
    private boolean atLineStart = true;
    private boolean inBlankRun;

    private OctaveLexer(String text) {
        this.text = text;
    }

    /// Tokenizes the given text.
    /// @param text the source text
    /// @return the tokens, always ending with EOF, and the lexical normalizations applied
    /// @throws OctaveLexException if the text cannot be tokenized
    public static LexResult tokenize(String text) {
        Objects.requireNonNull(text, "text must not be null");
        LOG.fine(() -> "Tokenizing " + text.length() + " chars");
        final var lexer = new OctaveLexer(text.replace("\r\n", "\n"));
        if (text.contains("\r\n")) {
            lexer.log.append(RepairEntry.normalization("LINE_ENDINGS", "\\r\\n", "\\n", 0, 0));
        }
        lexer.run();
        StructuredLog.fine(LOG, "lex.done", "tokens", lexer.tokens.size(), "repairs", lexer.log.size());
        return new LexResult(lexer.tokens, lexer.log.entries());
    }

    /// True when the text is a number lexeme.
    public static boolean isNumber(String value) {
        return NUMBER.matcher(value).matches();
    }

    /// True when the value would be read back as exactly one IDENTIFIER token,
    /// so it can be written without quotes.
    public static boolean isBareWord(String value) {
        if (value.isEmpty() || value.startsWith("//")) {
            return false;
        }
        final int first = value.codePointAt(0);
        final boolean negative = first == '-' && value.length() > 1 && Character.isDigit(value.charAt(1));
        if (!negative && !Character.isDigit(first) && !isWordStart(first)) {
            return false;
        }
        if (scanVariableHints(value, scanWord(value, negative ? 1 : 0), 0) != value.length()) {
            return false;
        }
        final TokenKind kind = wordKind(value);
        return kind == TokenKind.IDENTIFIER || kind == TokenKind.VARIABLE;
    }

    private void run() {
        while (pos < text.length()) {
            if (atLineStart) {
                lineStart();
                continue;
            }
            final char c = text.charAt(pos);
            switch (c) {
                case ' ' -> spaces();
                case '\t' -> throw error(OctaveError.TAB_CHARACTER, OctaveError.TAB_CHARACTER.message(), column());
                case '\n' -> newline();
                case '"' -> string();
                case '[' -> {
                    final var open = symbol(TokenKind.LIST_START, "[");
                    brackets.push(open);
                }
                case ']' -> {
                    if (brackets.isEmpty()) {
                        throw error(OctaveError.UNBALANCED_BRACKET, OctaveError.UNBALANCED_BRACKET.message("]"), column());
                    }
                    brackets.pop();
                    symbol(TokenKind.LIST_END, "]");
                }
                case ',' -> symbol(TokenKind.COMMA, ",");
                case ':' -> colon();
                case '→' -> symbol(TokenKind.FLOW, "→");
                case '∧' -> symbol(TokenKind.CONSTRAINT, "∧");
                case '∨' -> symbol(TokenKind.ALTERNATIVE, "∨");
                case '⊕' -> symbol(TokenKind.SYNTHESIS, "⊕");
                case '⧺' -> symbol(TokenKind.CONCAT, "⧺");
                case '⇌' -> symbol(TokenKind.TENSION, "⇌");
                case '§' -> symbol(TokenKind.SECTION_MARKER, "§");
                case '@' -> symbol(TokenKind.AT, "@");
                case '+' -> alias(TokenKind.SYNTHESIS, "+", "⊕");
                case '~' -> alias(TokenKind.CONCAT, "~", "⧺");
                case '&' -> alias(TokenKind.CONSTRAINT, "&", "∧");
                case '|' -> alias(TokenKind.ALTERNATIVE, "|", "∨");
                case '#' -> hash();
                case '<' -> {
                    if (!text.startsWith("<->", pos)) {
                        throw illegal();
                    }
                    alias(TokenKind.TENSION, "<->", "⇌");
                }
                case '-' -> {
                    if (text.startsWith("->", pos)) {
                        alias(TokenKind.FLOW, "->", "→");
                    } else if (pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1))) {
                        word();
                    } else {
                        throw illegal();
                    }
                }
                case '/' -> {
                    if (text.startsWith("//", pos)) {
                        comment();
                    } else {
                        word();
                    }
                }
                default -> {
                    final int cp = text.codePointAt(pos);
                    if (Character.isDigit(cp) || isWordStart(cp)) {
                        word();
                    } else {
                        throw illegal();
                    }
                }
            }
        }
        if (!brackets.isEmpty()) {
            final var open = brackets.peek();
            throw new OctaveLexException(OctaveError.UNBALANCED_BRACKET, OctaveError.UNBALANCED_BRACKET.message("["),
                open.line(), open.column(), lineAt(open.line()));
        }
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).kind() != TokenKind.NEWLINE) {
            log.append(RepairEntry.normalization("FINAL_NEWLINE", "", "\\n", line, column()));
            tokens.add(new Token(TokenKind.NEWLINE, "", "\n", line, column()));
        }
        tokens.add(new Token(TokenKind.EOF, "", "", line, column()));
    }

    // at the first character of a line: blank lines, fences, envelopes, separators, indentation
    private void lineStart() {
        atLineStart = false;
        int spaces = 0;
        while (pos + spaces < text.length() && text.charAt(pos + spaces) == ' ') {
            spaces++;
        }
        if (!brackets.isEmpty()) {
            pos += spaces;
            return;
        }
        final int eol = endOfLine(pos);
        final String rest = text.substring(pos + spaces, eol);
        if (rest.isEmpty()) {
            if (eol == text.length() && spaces == 0) {
                pos = eol;
                return;
            }
            if (!inBlankRun) {
                log.append(RepairEntry.normalization("BLANK_LINE", " ".repeat(spaces) + "\\n", "", line, 1));
            }
            inBlankRun = true;
            pos = eol;
            if (pos < text.length()) {
                pos++;
                line++;
                lineStart = pos;
                atLineStart = true;
            }
            return;
        }
        inBlankRun = false;
        if (rest.startsWith("```")) {
            fence(spaces, eol);
            return;
        }
        if (spaces == 0 && tokens.isEmpty() && rest.startsWith("OCTAVE::")) {
            final Matcher m = GRAMMAR_SENTINEL.matcher(rest.stripTrailing());
            if (m.matches()) {
                sentinel(m.group(1), rest, eol);
                return;
            }
        }
        if (spaces == 0 && rest.startsWith("===")) {
            envelope(rest, eol);
            return;
        }
        if (spaces == 0 && rest.stripTrailing().equals("---")) {
            symbol(TokenKind.SEPARATOR, "---");
            return;
        }
        if (spaces > 0) {
            tokens.add(new Token(TokenKind.INDENT, " ".repeat(spaces), " ".repeat(spaces), line, 1));
            pos += spaces;
        }
    }

    private void spaces() {
        int end = pos;
        while (end < text.length() && text.charAt(end) == ' ') {
            end++;
        }
        if (brackets.isEmpty() && (end == text.length() || text.charAt(end) == '\n')) {
            log.append(RepairEntry.normalization("TRAILING_WHITESPACE", " ".repeat(end - pos), "", line, column()));
        }
        pos = end;
    }

    private void newline() {
        if (brackets.isEmpty()) {
            tokens.add(new Token(TokenKind.NEWLINE, "\n", "\n", line, column()));
        } else {
            log.append(RepairEntry.normalization("LIST_NEWLINE", "\\n", "", line, column()));
        }
        pos++;
        line++;
        lineStart = pos;
        atLineStart = true;
    }

    private void colon() {
        if (text.startsWith("::", pos)) {
            symbol(TokenKind.ASSIGN, "::");
            return;
        }
        int j = pos + 1;
        while (j < text.length() && text.charAt(j) == ' ') {
            j++;
        }
        if (j < text.length() && text.charAt(j) != '\n' && !text.startsWith("//", j)) {
            final String offending = text.substring(lineStart, endOfLine(lineStart)).strip();
            throw new OctaveLexException(OctaveError.SINGLE_COLON_ASSIGNMENT,
                OctaveError.SINGLE_COLON_ASSIGNMENT.message(offending), line, column(), offending);
        }
        symbol(TokenKind.BLOCK, ":");
    }

    private void hash() {
        final int next = pos + 1 < text.length() ? text.codePointAt(pos + 1) : ' ';
        if (next == ' ' || next == '\n' || Character.isDigit(next) || isWordStart(next)) {
            alias(TokenKind.SECTION_MARKER, "#", "§");
        } else {
            throw illegal();
        }
    }

    private void comment() {
        final int eol = endOfLine(pos);
        final String raw = text.substring(pos, eol);
        final String body = raw.substring(2).stripTrailing();
        if (!brackets.isEmpty()) {
            log.append(RepairEntry.normalization("LIST_COMMENT", raw, "", line, column()));
            pos = eol;
            return;
        }
        if (body.length() + 2 < raw.length()) {
            log.append(RepairEntry.normalization("TRAILING_WHITESPACE",
                " ".repeat(raw.length() - body.length() - 2), "", line, column() + body.length() + 2));
        }
        tokens.add(new Token(TokenKind.COMMENT, "//" + body, body, line, column()));
        pos = eol;
    }

    private void string() {
        final int startLine = line;
        final int col = column();
        if (text.startsWith("\"\"\"", pos)) {
            final int close = text.indexOf("\"\"\"", pos + 3);
            if (close < 0) {
                throw error(OctaveError.UNTERMINATED_STRING, OctaveError.UNTERMINATED_STRING.message(), col);
            }
            final String content = text.substring(pos + 3, close);
            final int tab = content.indexOf('\t');
            if (tab >= 0) {
                advanceTo(pos + 3 + tab);
                throw error(OctaveError.TAB_CHARACTER, OctaveError.TAB_CHARACTER.message(), column());
            }
            final String raw = text.substring(pos, close + 3);
            advanceTo(close + 3);
            tokens.add(new Token(TokenKind.STRING, raw, content, startLine, col));
            log.append(RepairEntry.normalization("TRIPLE_QUOTE", raw, CanonicalEmitter.quote(content), startLine, col));
            return;
        }
        final var sb = new StringBuilder();
        int i = pos + 1;
        while (true) {
            if (i >= text.length() || text.charAt(i) == '\n') {
                throw error(OctaveError.UNTERMINATED_STRING, OctaveError.UNTERMINATED_STRING.message(), col);
            }
            final char c = text.charAt(i);
            if (c == '\t') {
                pos = i;
                throw error(OctaveError.TAB_CHARACTER, OctaveError.TAB_CHARACTER.message(), column());
            }
            if (c == '"') {
                break;
            }
            if (c == '\\' && i + 1 < text.length()) {
                final char escaped = text.charAt(i + 1);
                switch (escaped) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> {
                        // unknown escapes stay literal so regex classes like \d survive
                        sb.append('\\');
                        i++;
                        continue;
                    }
                }
                i += 2;
                continue;
            }
            sb.append(c);
            i++;
        }
        final String raw = text.substring(pos, i + 1);
        final String value = sb.toString();
        tokens.add(new Token(TokenKind.STRING, raw, value, line, col));
        pos = i + 1;
        final String canonical = CanonicalEmitter.quote(value);
        if (!canonical.equals(raw)) {
            log.append(RepairEntry.normalization("STRING_ESCAPE", raw, canonical, line, col));
        }
    }

    private void word() {
        final int col = column();
        final int start = pos;
        final int end = scanVariableHints(text, scanWord(text, text.charAt(pos) == '-' ? pos + 1 : pos), start);
        final String word = text.substring(start, end);
        final TokenKind kind = wordKind(word);
        if (kind == TokenKind.TENSION) {
            alias(TokenKind.TENSION, word, "⇌");
            return;
        }
        if (kind == TokenKind.IDENTIFIER) {
            final String lower = word.toLowerCase(Locale.ROOT);
            if (lower.equals("true") || lower.equals("false") || lower.equals("null")) {
                StructuredLog.fine(LOG, "lex.literal_case", "word", word, "line", line, "column", col);
            }
        }
        tokens.add(new Token(kind, word, word, line, col));
        pos = end;
    }

    private void fence(int indent, int eol) {
        final int openLine = line;
        final int fenceStart = pos + indent;
        int ticks = 0;
        while (fenceStart + ticks < eol && text.charAt(fenceStart + ticks) == '`') {
            ticks++;
        }
        final String opening = text.substring(fenceStart, eol);
        if (!opening.equals(opening.stripTrailing())) {
            log.append(RepairEntry.normalization("TRAILING_WHITESPACE", opening, opening.stripTrailing(), line, indent + 1));
        }
        final var content = new StringBuilder();
        int cursor = eol + 1;
        int closeLine = openLine;
        while (true) {
            closeLine++;
            if (cursor >= text.length()) {
                throw new OctaveLexException(OctaveError.UNTERMINATED_LITERAL_ZONE,
                    OctaveError.UNTERMINATED_LITERAL_ZONE.message("`".repeat(ticks)), openLine, indent + 1, opening);
            }
            final int lineEnd = endOfLine(cursor);
            final String candidate = text.substring(cursor, lineEnd);
            final String stripped = candidate.stripLeading();
            if (stripped.startsWith("```")) {
                int n = 0;
                while (n < stripped.length() && stripped.charAt(n) == '`') {
                    n++;
                }
                final String after = stripped.substring(n);
                if (n == ticks && after.isBlank()) {
                    final int closeIndent = candidate.length() - stripped.length();
                    if (closeIndent != indent) {
                        log.append(RepairEntry.normalization("INDENTATION", " ".repeat(closeIndent) + "`".repeat(n),
                            " ".repeat(indent) + "`".repeat(n), closeLine, 1));
                    }
                    if (!after.isEmpty()) {
                        log.append(RepairEntry.normalization("TRAILING_WHITESPACE", after, "", closeLine, closeIndent + n + 1));
                    }
                    if (indent > 0) {
                        tokens.add(new Token(TokenKind.INDENT, " ".repeat(indent), " ".repeat(indent), openLine, 1));
                    }
                    final String raw = text.substring(fenceStart, lineEnd);
                    tokens.add(new Token(TokenKind.LITERAL_ZONE, raw, content.toString(), openLine, indent + 1));
                    StructuredLog.finer(LOG, "lex.literal_zone", "line", openLine, "fence", ticks, "chars", content.length());
                    advanceTo(lineEnd);
                    return;
                }
                if (n >= ticks) {
                    throw new OctaveLexException(OctaveError.NESTED_LITERAL_ZONE,
                        OctaveError.NESTED_LITERAL_ZONE.message("`".repeat(n), "`".repeat(ticks)),
                        closeLine, candidate.length() - stripped.length() + 1, stripped);
                }
            }
            content.append(candidate).append('\n');
            cursor = lineEnd + 1;
        }
    }

    private void envelope(String rest, int eol) {
        final String trimmed = rest.stripTrailing();
        final Matcher m = ENVELOPE.matcher(trimmed);
        if (!m.matches()) {
            throw new OctaveLexException(OctaveError.INVALID_ENVELOPE_NAME,
                OctaveError.INVALID_ENVELOPE_NAME.message(trimmed), line, 1, trimmed);
        }
        final String name = m.group(1);
        if (!ENVELOPE_NAME.matcher(name).matches()) {
            throw new OctaveLexException(OctaveError.INVALID_ENVELOPE_NAME,
                OctaveError.INVALID_ENVELOPE_NAME.message(name), line, 4, trimmed);
        }
        final TokenKind kind = name.equals("END") ? TokenKind.ENVELOPE_END : TokenKind.ENVELOPE_START;
        tokens.add(new Token(kind, trimmed, name, line, 1));
        if (trimmed.length() < rest.length()) {
            log.append(RepairEntry.normalization("TRAILING_WHITESPACE",
                rest.substring(trimmed.length()), "", line, trimmed.length() + 1));
        }
        pos = eol;
    }

    private void sentinel(String version, String rest, int eol) {
        final String trimmed = rest.stripTrailing();
        tokens.add(new Token(TokenKind.GRAMMAR_SENTINEL, trimmed, version, line, 1));
        if (trimmed.length() < rest.length()) {
            log.append(RepairEntry.normalization("TRAILING_WHITESPACE",
                rest.substring(trimmed.length()), "", line, trimmed.length() + 1));
        }
        StructuredLog.finer(LOG, "lex.grammar_sentinel", "version", version);
        pos = eol;
    }

    private Token symbol(TokenKind kind, String symbol) {
        final var token = new Token(kind, symbol, symbol, line, column());
        tokens.add(token);
        pos += symbol.length();
        return token;
    }

    private void alias(TokenKind kind, String raw, String canonical) {
        final int col = column();
        tokens.add(new Token(kind, raw, canonical, line, col));
        log.append(RepairEntry.normalization("ASCII_ALIAS", raw, canonical, line, col));
        pos += raw.length();
    }

    private void advanceTo(int target) {
        while (pos < target) {
            if (text.charAt(pos) == '\n') {
                line++;
                lineStart = pos + 1;
            }
            pos++;
        }
    }

    private int column() {
        return pos - lineStart + 1;
    }

    private int endOfLine(int from) {
        final int eol = text.indexOf('\n', from);
        return eol < 0 ? text.length() : eol;
    }

    private String lineAt(int number) {
        final String[] lines = text.split("\n", -1);
        return number - 1 < lines.length ? lines[number - 1].strip() : "";
    }

    private OctaveLexException illegal() {
        final String ch = new String(Character.toChars(text.codePointAt(pos)));
        return error(OctaveError.ILLEGAL_CHARACTER, OctaveError.ILLEGAL_CHARACTER.message(ch), column());
    }

    private OctaveLexException error(OctaveError error, String detail, int col) {
        return new OctaveLexException(error, detail, line, col, text.substring(lineStart, endOfLine(lineStart)).strip());
    }

    private static TokenKind wordKind(String word) {
        if (NUMBER.matcher(word).matches()) {
            return TokenKind.NUMBER;
        }
        if (word.length() > 1 && word.charAt(0) == '$') {
            return TokenKind.VARIABLE;
        }
        return switch (word) {
            case "true", "false" -> TokenKind.BOOLEAN;
            case "null" -> TokenKind.NULL;
            case "vs" -> TokenKind.TENSION;
            default -> TokenKind.IDENTIFIER;
        };
    }

    static boolean isWordStart(int cp) {
        if (cp < 128) {
            return Character.isLetter(cp) || cp == '_' || cp == '.' || cp == '/' || cp == '$';
        }
        if (OPERATOR_CHARS.indexOf(cp) >= 0) {
            return false;
        }
        return Character.isLetter(cp) || Character.getType(cp) == Character.OTHER_SYMBOL;
    }

    private static boolean isWordPart(int cp) {
        return isWordStart(cp) || Character.isDigit(cp) || cp == '%';
    }

    // a variable such as `$1:name` keeps its single-colon type hints
    private static int scanVariableHints(String s, int end, int start) {
        if (s.charAt(start) != '$' || end - start < 2) {
            return end;
        }
        int i = end;
        while (i + 1 < s.length() && s.charAt(i) == ':' && isHintChar(s.charAt(i + 1))) {
            i++;
            while (i < s.length() && isHintChar(s.charAt(i))) {
                i++;
            }
        }
        return i;
    }

    private static boolean isHintChar(char c) {
        return c < 128 && (Character.isLetterOrDigit(c) || c == '_');
    }

    // returns the index just past the word that continues at `from`
    private static int scanWord(String s, int from) {
        int i = from;
        while (i < s.length()) {
            final int cp = s.codePointAt(i);
            if (cp == '/' && s.startsWith("//", i)) {
                break;
            }
            if (isWordPart(cp)) {
                i += Character.charCount(cp);
                continue;
            }
            // a hyphen belongs to the word only when another word character follows it
            if (cp == '-' && i + 1 < s.length() && isWordPart(s.codePointAt(i + 1)) && !s.startsWith("//", i + 1)) {
                i++;
                continue;
            }
            break;
        }
        return i;
    }
}

package octave.java17.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for OctaveLexer - raw text to tokens plus lexical normalizations.
class OctaveLexerTest extends OctaveTestBase {

    // ========== Basic tokens ==========

    @Test
    void testAssignmentTokens() {
        final var result = OctaveLexer.tokenize("KEY::value\n");
        assertThat(kinds(result.tokens())).containsExactly(
            TokenKind.IDENTIFIER, TokenKind.ASSIGN, TokenKind.IDENTIFIER, TokenKind.NEWLINE, TokenKind.EOF);
        assertThat(result.repairs()).isEmpty();
    }

    @Test
    void testTokenPositionsAreOneBased() {
        final var tokens = OctaveLexer.tokenize("K::v\n  X::1\n").tokens();
        assertThat(tokens.get(0)).extracting(Token::line, Token::column).containsExactly(1, 1);
        assertThat(tokens.get(1)).extracting(Token::line, Token::column).containsExactly(1, 2);
        assertThat(tokens.get(2)).extracting(Token::line, Token::column).containsExactly(1, 4);
        final Token indent = tokens.get(4);
        assertThat(indent.kind()).isEqualTo(TokenKind.INDENT);
        assertThat(indent.raw()).isEqualTo("  ");
        assertThat(tokens.get(5)).extracting(Token::line, Token::column).containsExactly(2, 3);
    }

    @Test
    void testLiteralKinds() {
        final var tokens = OctaveLexer.tokenize("A::[42,-3.5e2,true,false,null,True,1.2.3]\n").tokens();
        assertThat(kinds(tokens.subList(3, 16))).containsExactly(
            TokenKind.NUMBER, TokenKind.COMMA, TokenKind.NUMBER, TokenKind.COMMA,
            TokenKind.BOOLEAN, TokenKind.COMMA, TokenKind.BOOLEAN, TokenKind.COMMA,
            TokenKind.NULL, TokenKind.COMMA, TokenKind.IDENTIFIER, TokenKind.COMMA, TokenKind.IDENTIFIER);
        assertThat(tokens.get(5).raw()).isEqualTo("-3.5e2");
    }

    @Test
    void testHyphenatedAndUnicodeWords() {
        final var tokens = OctaveLexer.tokenize("K::[foo-bar,🚀,docs/api.md,50%]\n").tokens();
        assertThat(tokens.get(3).raw()).isEqualTo("foo-bar");
        assertThat(tokens.get(5).raw()).isEqualTo("🚀");
        assertThat(tokens.get(7).raw()).isEqualTo("docs/api.md");
        assertThat(tokens.get(9).raw()).isEqualTo("50%");
        assertThat(List.of(tokens.get(3), tokens.get(5), tokens.get(7), tokens.get(9)))
            .allMatch(t -> t.kind() == TokenKind.IDENTIFIER);
    }

    @Test
    void testBlockColonAtEndOfLine() {
        final var tokens = OctaveLexer.tokenize("BLOCK:\n").tokens();
        assertThat(kinds(tokens)).containsExactly(TokenKind.IDENTIFIER, TokenKind.BLOCK, TokenKind.NEWLINE, TokenKind.EOF);
    }

    @Test
    void testBlockColonBeforeComment() {
        final var tokens = OctaveLexer.tokenize("BLOCK: // note\n").tokens();
        assertThat(kinds(tokens)).containsExactly(
            TokenKind.IDENTIFIER, TokenKind.BLOCK, TokenKind.COMMENT, TokenKind.NEWLINE, TokenKind.EOF);
        assertThat(tokens.get(2).normalized()).isEqualTo(" note");
    }

    @Test
    void testDoubleSlashInsideWordOpensComment() {
        final var tokens = OctaveLexer.tokenize("X::docs/a//b\n").tokens();
        assertThat(kinds(tokens)).containsExactly(TokenKind.IDENTIFIER, TokenKind.ASSIGN, TokenKind.IDENTIFIER,
            TokenKind.COMMENT, TokenKind.NEWLINE, TokenKind.EOF);
        assertThat(tokens.get(2).raw()).isEqualTo("docs/a");
        assertThat(tokens.get(3).raw()).isEqualTo("//b");
        assertThat(tokens.get(3).normalized()).isEqualTo("b");
    }

    @Test
    void testAtIsLocationOperator() {
        final var result = OctaveLexer.tokenize("ROLE::agent@host\n");
        final var tokens = result.tokens();
        assertThat(kinds(tokens)).containsExactly(TokenKind.IDENTIFIER, TokenKind.ASSIGN, TokenKind.IDENTIFIER,
            TokenKind.AT, TokenKind.IDENTIFIER, TokenKind.NEWLINE, TokenKind.EOF);
        assertThat(tokens.get(3).kind().isOperator()).isTrue();
        assertThat(tokens.get(3)).extracting(Token::line, Token::column).containsExactly(1, 12);
        assertThat(result.repairs()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"$VAR", "$1", "$1:name", "$2:path:dir"})
    void testVariableIsOneToken(String variable) {
        final var result = OctaveLexer.tokenize("K::" + variable + "\n");
        final Token token = result.tokens().get(2);
        assertThat(token.kind()).isEqualTo(TokenKind.VARIABLE);
        assertThat(token.raw()).isEqualTo(variable);
        assertThat(result.tokens().get(3).kind()).isEqualTo(TokenKind.NEWLINE);
        assertThat(result.repairs()).isEmpty();
    }

    @Test
    void testVariableStopsBeforeAssign() {
        final var tokens = OctaveLexer.tokenize("K::[$X,$1:n]\n").tokens();
        assertThat(kinds(tokens.subList(3, 6))).containsExactly(TokenKind.VARIABLE, TokenKind.COMMA, TokenKind.VARIABLE);
        assertThat(tokens.get(5).raw()).isEqualTo("$1:n");
    }

    @Test
    void testGrammarSentinel() {
        final var tokens = OctaveLexer.tokenize("OCTAVE::5.1\n===DOC===\n===END===\n").tokens();
        assertThat(tokens.get(0).kind()).isEqualTo(TokenKind.GRAMMAR_SENTINEL);
        assertThat(tokens.get(0).raw()).isEqualTo("OCTAVE::5.1");
        assertThat(tokens.get(0).normalized()).isEqualTo("5.1");
        assertThat(tokens.get(2).kind()).isEqualTo(TokenKind.ENVELOPE_START);
    }

    @Test
    void testGrammarSentinelOnlyAtDocumentStart() {
        final var tokens = OctaveLexer.tokenize("===DOC===\nOCTAVE::5\n===END===\n").tokens();
        assertThat(kinds(tokens.subList(2, 5))).containsExactly(TokenKind.IDENTIFIER, TokenKind.ASSIGN, TokenKind.NUMBER);
    }

    // ========== ASCII aliases ==========

    @Test
    void testFlowAliasIsNormalizedAndLogged() {
        final var result = OctaveLexer.tokenize("K::a->b\n");
        final Token flow = result.tokens().get(3);
        assertThat(flow.kind()).isEqualTo(TokenKind.FLOW);
        assertThat(flow.raw()).isEqualTo("->");
        assertThat(flow.normalized()).isEqualTo("→");
        assertThat(result.repairs()).singleElement().satisfies(entry -> {
            assertThat(entry.ruleId()).isEqualTo("ASCII_ALIAS");
            assertThat(entry.before()).isEqualTo("->");
            assertThat(entry.after()).isEqualTo("→");
            assertThat(entry.tier()).isEqualTo(RepairTier.NORMALIZATION);
            assertThat(entry.semanticsChanged()).isFalse();
            assertThat(entry.line()).isEqualTo(1);
            assertThat(entry.column()).isEqualTo(5);
        });
    }

    @Test
    void testEveryOperatorAlias() {
        final var result = OctaveLexer.tokenize("V::a + b ~ c & d | e <-> f vs g\n");
        assertThat(result.tokens().stream().filter(t -> t.kind().isOperator()).map(Token::normalized))
            .containsExactly("⊕", "⧺", "∧", "∨", "⇌", "⇌");
        assertThat(rules(result.repairs())).containsOnly("ASCII_ALIAS").hasSize(6);
    }

    @Test
    void testHashIsSectionMarker() {
        final var result = OctaveLexer.tokenize("T::#INDEXER\n");
        final Token marker = result.tokens().get(2);
        assertThat(marker.kind()).isEqualTo(TokenKind.SECTION_MARKER);
        assertThat(marker.normalized()).isEqualTo("§");
        assertThat(rules(result.repairs())).containsExactly("ASCII_ALIAS");
    }

    @Test
    void testCanonicalSymbolsProduceNoRepairs() {
        final var result = OctaveLexer.tokenize("V::a→b∧c∨d⊕e⧺f⇌§g\n");
        assertThat(result.repairs()).isEmpty();
        assertThat(result.tokens().stream().filter(t -> t.kind().isOperator())).hasSize(6);
    }

    // ========== Layout normalization ==========

    @Test
    void testMissingFinalNewlineIsSynthesized() {
        final var result = OctaveLexer.tokenize("K::v");
        assertThat(kinds(result.tokens())).endsWith(TokenKind.NEWLINE, TokenKind.EOF);
        assertThat(rules(result.repairs())).containsExactly("FINAL_NEWLINE");
    }

    @Test
    void testCrLfLineEndings() {
        final var result = OctaveLexer.tokenize("K::v\r\nL::w\r\n");
        assertThat(rules(result.repairs())).containsExactly("LINE_ENDINGS");
        assertThat(result.tokens().get(4).line()).isEqualTo(2);
    }

    @Test
    void testBlankLineRunIsOneEntry() {
        final var result = OctaveLexer.tokenize("===D===\n\n\n\nK::v\n===END===\n");
        assertThat(rules(result.repairs())).containsExactly("BLANK_LINE");
        assertThat(result.tokens().stream().filter(t -> t.kind() == TokenKind.NEWLINE)).hasSize(3);
    }

    @Test
    void testTrailingWhitespace() {
        final var result = OctaveLexer.tokenize("K::v   \n");
        assertThat(rules(result.repairs())).containsExactly("TRAILING_WHITESPACE");
    }

    @Test
    void testListSpansLinesWithoutNewlineTokens() {
        final var result = OctaveLexer.tokenize("K::[a,\n    b, // note\n  c]\n");
        assertThat(kinds(result.tokens())).containsExactly(
            TokenKind.IDENTIFIER, TokenKind.ASSIGN, TokenKind.LIST_START, TokenKind.IDENTIFIER, TokenKind.COMMA,
            TokenKind.IDENTIFIER, TokenKind.COMMA, TokenKind.IDENTIFIER, TokenKind.LIST_END,
            TokenKind.NEWLINE, TokenKind.EOF);
        assertThat(rules(result.repairs())).containsExactly("LIST_NEWLINE", "LIST_COMMENT", "LIST_NEWLINE");
    }

    @Test
    void testCommentTrailingSpacesAreStripped() {
        final var result = OctaveLexer.tokenize("// hello  \n");
        final Token comment = result.tokens().get(0);
        assertThat(comment.raw()).isEqualTo("// hello");
        assertThat(comment.normalized()).isEqualTo(" hello");
        assertThat(rules(result.repairs())).containsExactly("TRAILING_WHITESPACE");
    }

    // ========== Strings ==========

    @Test
    void testStringEscapes() {
        final var result = OctaveLexer.tokenize("K::\"a\\\"b\\\\nc\\td\"\n");
        assertThat(result.tokens().get(2).normalized()).isEqualTo("a\"b\\nc\td");
        assertThat(result.repairs()).isEmpty();
    }

    @Test
    void testUnknownEscapeStaysLiteral() {
        final var result = OctaveLexer.tokenize("K::\"^\\d+$\"\n");
        assertThat(result.tokens().get(2).normalized()).isEqualTo("^\\d+$");
        assertThat(result.repairs()).isEmpty();
    }

    @Test
    void testRedundantEscapeIsNormalized() {
        final var result = OctaveLexer.tokenize("K::\"a\\\\b\"\n");
        assertThat(result.tokens().get(2).normalized()).isEqualTo("a\\b");
        assertThat(result.repairs()).singleElement().satisfies(entry -> {
            assertThat(entry.ruleId()).isEqualTo("STRING_ESCAPE");
            assertThat(entry.after()).isEqualTo("\"a\\b\"");
        });
    }

    @Test
    void testTripleQuotedString() {
        final var result = OctaveLexer.tokenize("K::\"\"\"two\nlines\"\"\"\nL::x\n");
        final Token string = result.tokens().get(2);
        assertThat(string.kind()).isEqualTo(TokenKind.STRING);
        assertThat(string.normalized()).isEqualTo("two\nlines");
        assertThat(rules(result.repairs())).containsExactly("TRIPLE_QUOTE");
        assertThat(result.tokens().get(4).line()).isEqualTo(3);
    }

    // ========== Literal zones ==========

    @Test
    void testLiteralZoneKeepsContentVerbatim() {
        final var text = "CODE::\n```python\n  x = 1 -> 2  \n\n\ty\n```\n";
        final var result = OctaveLexer.tokenize(text);
        assertThat(kinds(result.tokens())).containsExactly(
            TokenKind.IDENTIFIER, TokenKind.ASSIGN, TokenKind.NEWLINE, TokenKind.LITERAL_ZONE, TokenKind.NEWLINE,
            TokenKind.EOF);
        final Token zone = result.tokens().get(3);
        assertThat(zone.normalized()).isEqualTo("  x = 1 -> 2  \n\n\ty\n");
        assertThat(zone.raw()).startsWith("```python\n").endsWith("```");
        assertThat(result.repairs()).isEmpty();
    }

    @Test
    void testLongerFenceAllowsShorterFencesInside() {
        final var text = "CODE::\n````\n```\ninner\n```\n````\n";
        final Token zone = OctaveLexer.tokenize(text).tokens().get(3);
        assertThat(zone.normalized()).isEqualTo("```\ninner\n```\n");
    }

    @Test
    void testEmptyLiteralZone() {
        final Token zone = OctaveLexer.tokenize("CODE::\n```\n```\n").tokens().get(3);
        assertThat(zone.kind()).isEqualTo(TokenKind.LITERAL_ZONE);
        assertThat(zone.normalized()).isEmpty();
    }

    @Test
    void testNestedFenceIsRejected() {
        assertThatThrownBy(() -> OctaveLexer.tokenize("CODE::\n```\n```js\nx\n```\n"))
            .isInstanceOf(OctaveLexException.class)
            .satisfies(e -> {
                final var ex = (OctaveLexException) e;
                assertThat(ex.error()).isEqualTo(OctaveError.NESTED_LITERAL_ZONE);
                assertThat(ex.line()).isEqualTo(3);
            });
    }

    @Test
    void testUnterminatedLiteralZone() {
        assertThatThrownBy(() -> OctaveLexer.tokenize("CODE::\n```\nx\n"))
            .isInstanceOf(OctaveLexException.class)
            .satisfies(e -> assertThat(((OctaveLexException) e).error()).isEqualTo(OctaveError.UNTERMINATED_LITERAL_ZONE));
    }

    // ========== Fatal errors ==========

    @Test
    void testSingleColonAssignmentIsFatal() {
        assertThatThrownBy(() -> OctaveLexer.tokenize("KEY: value\n"))
            .isInstanceOf(OctaveLexException.class)
            .satisfies(e -> {
                final var ex = (OctaveLexException) e;
                assertThat(ex.error()).isEqualTo(OctaveError.SINGLE_COLON_ASSIGNMENT);
                assertThat(ex.getMessage()).startsWith("E001");
                assertThat(ex.line()).isEqualTo(1);
                assertThat(ex.column()).isEqualTo(4);
            });
    }

    @Test
    void testTabIsFatal() {
        assertThatThrownBy(() -> OctaveLexer.tokenize("BLOCK:\n\tKEY::v\n"))
            .isInstanceOf(OctaveLexException.class)
            .satisfies(e -> {
                final var ex = (OctaveLexException) e;
                assertThat(ex.error()).isEqualTo(OctaveError.TAB_CHARACTER);
                assertThat(ex.line()).isEqualTo(2);
                assertThat(ex.column()).isEqualTo(1);
            });
    }

    @ParameterizedTest
    @ValueSource(strings = {"K::a^b\n", "K::a - b\n", "K::<b\n", "K::#!\n"})
    void testIllegalCharacters(String text) {
        assertThatThrownBy(() -> OctaveLexer.tokenize(text))
            .isInstanceOf(OctaveLexException.class)
            .satisfies(e -> assertThat(((OctaveLexException) e).error()).isEqualTo(OctaveError.ILLEGAL_CHARACTER));
    }

    @ParameterizedTest
    @ValueSource(strings = {"K::\"abc\n", "K::\"abc", "K::\"\"\"abc\n"})
    void testUnterminatedStrings(String text) {
        assertThatThrownBy(() -> OctaveLexer.tokenize(text))
            .isInstanceOf(OctaveLexException.class)
            .satisfies(e -> assertThat(((OctaveLexException) e).error()).isEqualTo(OctaveError.UNTERMINATED_STRING));
    }

    @ParameterizedTest
    @ValueSource(strings = {"K::[a,b\n", "K::a]\n", "K::[[a]\n"})
    void testUnbalancedBrackets(String text) {
        assertThatThrownBy(() -> OctaveLexer.tokenize(text))
            .isInstanceOf(OctaveLexException.class)
            .satisfies(e -> assertThat(((OctaveLexException) e).error()).isEqualTo(OctaveError.UNBALANCED_BRACKET));
    }

    @ParameterizedTest
    @ValueSource(strings = {"===bad name===\n", "===1ST===\n", "=== ===\n", "===open\n"})
    void testInvalidEnvelopeNames(String text) {
        assertThatThrownBy(() -> OctaveLexer.tokenize(text))
            .isInstanceOf(OctaveLexException.class)
            .satisfies(e -> assertThat(((OctaveLexException) e).error()).isEqualTo(OctaveError.INVALID_ENVELOPE_NAME));
    }

    // ========== Bare words ==========

    @Test
    void testIsBareWord() {
        assertThat(OctaveLexer.isBareWord("ACTIVE")).isTrue();
        assertThat(OctaveLexer.isBareWord("docs/api.md")).isTrue();
        assertThat(OctaveLexer.isBareWord("foo-bar")).isTrue();
        assertThat(OctaveLexer.isBareWord("")).isFalse();
        assertThat(OctaveLexer.isBareWord("two words")).isFalse();
        assertThat(OctaveLexer.isBareWord("42")).isFalse();
        assertThat(OctaveLexer.isBareWord("true")).isFalse();
        assertThat(OctaveLexer.isBareWord("vs")).isFalse();
        assertThat(OctaveLexer.isBareWord("a→b")).isFalse();
        assertThat(OctaveLexer.isBareWord("//x")).isFalse();
        assertThat(OctaveLexer.isBareWord("-x")).isFalse();
        assertThat(OctaveLexer.isBareWord("$1:name")).isTrue();
        assertThat(OctaveLexer.isBareWord("a@b")).isFalse();
        assertThat(OctaveLexer.isBareWord("$1:")).isFalse();
    }
}

package octave.java17.core;

import octave.java17.core.OctaveAst.Assignment;
import octave.java17.core.OctaveAst.Block;
import octave.java17.core.OctaveAst.BooleanLiteral;
import octave.java17.core.OctaveAst.Comment;
import octave.java17.core.OctaveAst.Constructor;
import octave.java17.core.OctaveAst.Document;
import octave.java17.core.OctaveAst.FlowExpression;
import octave.java17.core.OctaveAst.InlineMap;
import octave.java17.core.OctaveAst.ListValue;
import octave.java17.core.OctaveAst.LiteralZone;
import octave.java17.core.OctaveAst.NullLiteral;
import octave.java17.core.OctaveAst.NumberLiteral;
import octave.java17.core.OctaveAst.Operator;
import octave.java17.core.OctaveAst.Section;
import octave.java17.core.OctaveAst.SectionTarget;
import octave.java17.core.OctaveAst.StringLiteral;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for OctaveParser - tokens to AST.
class OctaveParserTest extends OctaveTestBase {

    // ========== Document structure ==========

    @Test
    void testFullDocument() {
        final var text = """
            ===PROJECT===
            META:
              TYPE::SPEC
              VERSION::"1.0"
            ---
            // overview
            §1::OVERVIEW
              GOAL::ship
            CONFIG[→§INDEXER]:
              DEPTH::3
            ===END===
            """;
        final Document doc = parseStrict(text);
        assertThat(doc.name()).isEqualTo("PROJECT");
        assertThat(doc.envelopeInferred()).isFalse();
        assertThat(doc.separator()).isTrue();
        assertThat(doc.metaValue("TYPE")).contains(new StringLiteral("SPEC", false));
        assertThat(doc.metaValue("VERSION")).contains(new StringLiteral("1.0", true));
        assertThat(doc.sections()).hasSize(3);
        assertThat(doc.sections().get(0)).isEqualTo(new Comment(" overview"));

        final var section = (Section) doc.sections().get(1);
        assertThat(section.id()).isEqualTo("1");
        assertThat(section.key()).isEqualTo("OVERVIEW");
        assertThat(section.annotation()).isEmpty();
        assertThat(section.children()).containsExactly(new Assignment("GOAL", new StringLiteral("ship", false)));

        final var block = (Block) doc.sections().get(2);
        assertThat(block.key()).isEqualTo("CONFIG");
        assertThat(block.target()).contains(new SectionTarget("INDEXER"));
        assertThat(block.assignment("DEPTH").map(Assignment::value)).contains(new NumberLiteral("3"));
    }

    @Test
    void testNestedBlocks() {
        final Document doc = parseStrict(doc("OUTER:\n  INNER:\n    LEAF::1\n  NEXT::2\nAFTER::3\n"));
        final var outer = (Block) doc.sections().get(0);
        final Block inner = outer.block("INNER").orElseThrow();
        assertThat(inner.assignment("LEAF")).isPresent();
        assertThat(outer.assignment("NEXT")).isPresent();
        assertThat(doc.sections().get(1)).isEqualTo(new Assignment("AFTER", new NumberLiteral("3")));
    }

    @Test
    void testSectionWithAnnotation() {
        final var section = (Section) parseStrict(doc("§2::DESIGN[draft,v2]\n  X::1\n")).sections().get(0);
        assertThat(section.annotation()).contains(ListValue.of(List.of(
            new StringLiteral("draft", false), new StringLiteral("v2", false))));
    }

    @Test
    void testBlockCommentMovesToFirstChild() {
        final var result = Octave.parse(doc("B: // note\n  X::1\n"), ParseOptions.STRICT);
        final var block = (Block) result.document().sections().get(0);
        assertThat(block.children()).containsExactly(new Comment(" note"), new Assignment("X", new NumberLiteral("1")));
        assertThat(rules(result.repairs())).contains("COMMENT_MOVED");
    }

    @Test
    void testCommentBeforeMeta() {
        final var result = Octave.parse("===X===\n// note\nMETA:\n  TYPE::T\n===END===", ParseOptions.STRICT);
        final Document doc = result.document();
        assertThat(doc.metaValue("TYPE")).contains(new StringLiteral("T", false));
        assertThat(doc.sections()).containsExactly(new Comment(" note"));
        assertThat(rules(result.repairs())).contains("COMMENT_MOVED");

        final String canonical = Octave.canonicalize("===X===\n// note\nMETA:\n  TYPE::T\n===END===",
            ParseOptions.STRICT).canonical();
        assertThat(canonical).isEqualTo("===X===\nMETA:\n  TYPE::T\n// note\n===END===\n");
        assertThat(Octave.canonicalize(canonical, ParseOptions.STRICT).canonical()).isEqualTo(canonical);
    }

    @Test
    void testCommentBeforeMetaAndSeparator() {
        final Document doc = parseStrict("===X===\n// head\nMETA:\n  TYPE::T\n---\nK::v\n===END===\n");
        assertThat(doc.separator()).isTrue();
        assertThat(doc.meta()).isPresent();
        assertThat(doc.sections()).containsExactly(new Comment(" head"),
            new Assignment("K", new StringLiteral("v", false)));
    }

    @Test
    void testTrailingComment() {
        final var assignment = (Assignment) parseStrict(doc("K::v // why\n")).sections().get(0);
        assertThat(assignment.comment()).contains(" why");
    }

    // ========== Values ==========

    @Test
    void testScalars() {
        final var text = doc("S::\"text\"\nB::word\nN::-2.5\nT::true\nZ::null\n");
        assertThat(valueOf("S", text)).isEqualTo(new StringLiteral("text", true));
        assertThat(valueOf("B", text)).isEqualTo(new StringLiteral("word", false));
        assertThat(((NumberLiteral) valueOf("N", text)).toBigDecimal()).isEqualByComparingTo(new BigDecimal("-2.5"));
        assertThat(valueOf("T", text)).isEqualTo(new BooleanLiteral(true));
        assertThat(valueOf("Z", text)).isEqualTo(NullLiteral.INSTANCE);
    }

    @Test
    void testMultiWordValueIsJoinedAndQuoted() {
        final var result = Octave.parse(doc("K::hello big world\n"), ParseOptions.STRICT);
        final var assignment = (Assignment) result.document().sections().get(0);
        assertThat(assignment.value()).isEqualTo(new StringLiteral("hello big world", true));
        assertThat(result.repairs()).singleElement().satisfies(entry -> {
            assertThat(entry.ruleId()).isEqualTo("MULTIWORD_QUOTE");
            assertThat(entry.after()).isEqualTo("\"hello big world\"");
            assertThat(entry.tier()).isEqualTo(RepairTier.NORMALIZATION);
        });
    }

    @Test
    void testFlowExpressionGroupsRight() {
        final var flow = (FlowExpression) valueOf("R", doc("R::A→B→C\n"));
        assertThat(flow.steps()).hasSize(3);
        assertThat(flow.operators()).containsExactly(Operator.FLOW, Operator.FLOW);
        assertThat(flow.head()).isEqualTo(new StringLiteral("A", false));
        assertThat(flow.tail()).isInstanceOf(FlowExpression.class);
        assertThat(((FlowExpression) flow.tail()).head()).isEqualTo(new StringLiteral("B", false));
    }

    @Test
    void testMixedOperators() {
        final var flow = (FlowExpression) valueOf("R", doc("R::A⊕B⇌C∨D\n"));
        assertThat(flow.operators()).containsExactly(Operator.SYNTHESIS, Operator.TENSION, Operator.ALTERNATIVE);
    }

    @Test
    void testAtJoinsLocation() {
        final var flow = (FlowExpression) valueOf("ROLE", doc("ROLE::agent@host\n"));
        assertThat(flow.steps()).containsExactly(new StringLiteral("agent", false), new StringLiteral("host", false));
        assertThat(flow.operators()).containsExactly(Operator.AT);

        final var chain = (FlowExpression) valueOf("R", doc("R::build@ci→deploy\n"));
        assertThat(chain.operators()).containsExactly(Operator.AT, Operator.FLOW);
    }

    @Test
    void testVariableIsBareValue() {
        assertThat(valueOf("ARG", doc("ARG::$1:name\n"))).isEqualTo(new StringLiteral("$1:name", false));
        final var list = (ListValue) valueOf("L", doc("L::[$SRC,$2:path]\n"));
        assertThat(list.items()).containsExactly(
            new StringLiteral("$SRC", false), new StringLiteral("$2:path", false));
    }

    @Test
    void testGrammarSentinelIsKeptOnDocument() {
        final Document doc = parseStrict("OCTAVE::5\n===X===\nK::v\n===END===\n");
        assertThat(doc.grammarVersion()).contains("5");
        assertThat(doc.name()).isEqualTo("X");
        assertThat(doc.sections()).containsExactly(new Assignment("K", new StringLiteral("v", false)));
        assertThat(parseStrict(doc("K::v\n")).grammarVersion()).isEmpty();
    }

    @Test
    void testListKeepsSourceTokens() {
        final var list = (ListValue) valueOf("L", doc("L::[a, b]\n"));
        assertThat(list.items()).containsExactly(new StringLiteral("a", false), new StringLiteral("b", false));
        assertThat(kinds(list.sourceTokens())).containsExactly(
            TokenKind.LIST_START, TokenKind.IDENTIFIER, TokenKind.COMMA, TokenKind.IDENTIFIER, TokenKind.LIST_END);
    }

    @Test
    void testEmptyAndNestedLists() {
        assertThat(valueOf("L", doc("L::[]\n"))).isEqualTo(ListValue.of(List.of()));
        final var nested = (ListValue) valueOf("L", doc("L::[[a],[]]\n"));
        assertThat(nested.items()).hasSize(2).allMatch(ListValue.class::isInstance);
    }

    @Test
    void testInlineMap() {
        final var map = (InlineMap) valueOf("M", doc("M::[name::x, count::2, on::true]\n"));
        assertThat(map.pairs()).containsOnlyKeys("name", "count", "on");
        assertThat(map.pairs().keySet()).containsExactly("name", "count", "on");
        assertThat(map.pairs().get("count")).isEqualTo(new NumberLiteral("2"));
    }

    @Test
    void testConstructorNeedsAdjacentBracket() {
        final var ctor = (Constructor) valueOf("C", doc("C::ENUM[a,b]\n"));
        assertThat(ctor.name()).isEqualTo("ENUM");
        assertThat(ctor.args().items()).hasSize(2);

        assertThatThrownBy(() -> parseStrict(doc("C::ENUM [a,b]\n")))
            .isInstanceOf(OctaveParseException.class)
            .satisfies(e -> assertThat(((OctaveParseException) e).error()).isEqualTo(OctaveError.AMBIGUOUS_VALUE));
    }

    @Test
    void testOperatorInsideStringIsData() {
        final var list = (ListValue) valueOf("FIELD", doc("FIELD::[\"∧\"∧REQ→§SELF]\n"));
        final var flow = (FlowExpression) list.items().get(0);
        assertThat(flow.steps()).containsExactly(
            new StringLiteral("∧", true), new StringLiteral("REQ", false), new SectionTarget("SELF"));
        assertThat(flow.operators()).containsExactly(Operator.CONSTRAINT, Operator.FLOW);
    }

    @Test
    void testLiteralZoneAssignment() {
        final var text = doc("CODE::\n```python\nprint(1)\n```\nNEXT::x\n");
        final var zone = (LiteralZone) valueOf("CODE", text);
        assertThat(zone.fence()).isEqualTo("```");
        assertThat(zone.info()).isEqualTo("python");
        assertThat(zone.content()).isEqualTo("print(1)\n");
        assertThat(valueOf("NEXT", text)).isEqualTo(new StringLiteral("x", false));
    }

    // ========== Section markers in every position ==========

    @Test
    void testSectionMarkerInEveryValuePosition() {
        final var text = doc("""
            A::#ONE
            L::[#TWO,§THREE]
            F::X->#FOUR
            M::[to::#FIVE]
            C::ROUTE[#SIX]
            B[→#SEVEN]:
              K::v
            """);
        final Document d = Octave.parse(text, ParseOptions.STRICT).document();
        final String canonical = CanonicalEmitter.emit(d);
        assertThat(canonical).doesNotContain("#");
        assertThat(valueOf("A", text)).isEqualTo(new SectionTarget("ONE"));
        assertThat(((ListValue) valueOf("L", text)).items())
            .containsExactly(new SectionTarget("TWO"), new SectionTarget("THREE"));
        assertThat(((FlowExpression) valueOf("F", text)).steps()).endsWith(new SectionTarget("FOUR"));
        assertThat(((InlineMap) valueOf("M", text)).pairs().get("to")).isEqualTo(new SectionTarget("FIVE"));
        assertThat(((Constructor) valueOf("C", text)).args().items()).containsExactly(new SectionTarget("SIX"));
        assertThat(((Block) d.sections().get(5)).target()).contains(new SectionTarget("SEVEN"));
        for (String name : List.of("ONE", "TWO", "THREE", "FOUR", "FIVE", "SIX", "SEVEN")) {
            assertThat(canonical).contains("§" + name);
        }
    }

    // ========== Envelope handling ==========

    @Test
    void testStrictRequiresEnvelope() {
        assertThatThrownBy(() -> parseStrict("K::v\n"))
            .isInstanceOf(OctaveParseException.class)
            .satisfies(e -> assertThat(((OctaveParseException) e).error()).isEqualTo(OctaveError.MISSING_ENVELOPE));
    }

    @Test
    void testLenientSynthesizesEnvelope() {
        final var result = Octave.parse("K::v\n", ParseOptions.DEFAULT);
        assertThat(result.document().name()).isEqualTo("INFERRED");
        assertThat(result.document().envelopeInferred()).isTrue();
        assertThat(rules(result.repairs())).containsExactly("ENVELOPE_SYNTHESIS");
    }

    @Test
    void testStrictRequiresEnd() {
        assertThatThrownBy(() -> parseStrict("===DOC===\nK::v\n"))
            .isInstanceOf(OctaveParseException.class)
            .satisfies(e -> assertThat(((OctaveParseException) e).error()).isEqualTo(OctaveError.UNTERMINATED_ENVELOPE));
    }

    @Test
    void testLenientSynthesizesEnd() {
        final var result = Octave.parse("===DOC===\nK::v\n", ParseOptions.DEFAULT);
        assertThat(result.document().name()).isEqualTo("DOC");
        assertThat(rules(result.repairs())).containsExactly("ENVELOPE_END_SYNTHESIS");
    }

    @Test
    void testStreamOfDocuments() {
        final var result = Octave.parseAll("===A===\nX::1\n===END===\n===B===\nY::2\n===END===\n");
        assertThat(result.documents()).extracting(Document::name).containsExactly("A", "B");
    }

    @Test
    void testContentBetweenStreamDocuments() {
        assertThatThrownBy(() -> Octave.parseAll("===A===\nX::1\n===END===\nY::2\n"))
            .isInstanceOf(OctaveParseException.class)
            .satisfies(e -> assertThat(((OctaveParseException) e).error()).isEqualTo(OctaveError.CONTENT_OUTSIDE_ENVELOPE));
    }

    @Test
    void testContentAfterEndOfSingleDocument() {
        assertThatThrownBy(() -> Octave.parse("===A===\nX::1\n===END===\nY::2\n", ParseOptions.DEFAULT))
            .isInstanceOf(OctaveParseException.class)
            .satisfies(e -> assertThat(((OctaveParseException) e).error()).isEqualTo(OctaveError.TRAILING_CONTENT));
    }

    // ========== Structural errors ==========

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "X::1\\nMETA:\\n  TYPE::A\\n|META_NOT_FIRST",
        "JUST_WORDS\\n|BARE_LINE",
        "K::§\\n|ORPHAN_SECTION_MARKER",
        "B:\\n    X::1\\n  Y::2\\n|INCONSISTENT_INDENTATION",
        "K::1\\nK::2\\n|DUPLICATE_KEY",
        "L::[a, k::v]\\n|MIXED_LIST",
        "M::[k::[a]]\\n|NESTED_INLINE_MAP",
        "K::\\nX::1\\n|MISSING_VALUE",
        "K::// nothing\\n|MISSING_VALUE",
        "K::\"a\" b\\n|AMBIGUOUS_VALUE",
        "B[x]:\\n  K::v\\n|MALFORMED_BLOCK_TARGET",
        "K::a→\\n|UNEXPECTED_TOKEN",
        "::v\\n|UNEXPECTED_TOKEN",
    })
    void testStructuralErrors(String body, OctaveError expected) {
        final String text = doc(body.replace("\\n", "\n"));
        assertThatThrownBy(() -> parseStrict(text))
            .isInstanceOf(OctaveParseException.class)
            .satisfies(e -> {
                final var ex = (OctaveParseException) e;
                assertThat(ex.error()).isEqualTo(expected);
                assertThat(ex.getMessage()).startsWith(expected.code() + " ");
                assertThat(ex.line()).isPositive();
            });
    }

    @Test
    void testErrorCarriesPosition() {
        assertThatThrownBy(() -> parseStrict(doc("A::1\nB::1\nA::2\n")))
            .isInstanceOf(OctaveParseException.class)
            .satisfies(e -> {
                final var ex = (OctaveParseException) e;
                assertThat(ex.error()).isEqualTo(OctaveError.DUPLICATE_KEY);
                assertThat(ex.line()).isEqualTo(4);
                assertThat(ex.column()).isEqualTo(1);
                assertThat(ex.getMessage()).contains("at line 4, column 1").contains("near 'A'");
            });
    }

    // ========== Normalizations ==========

    @Test
    void testIndentationIsNormalized() {
        final var result = Octave.parse(doc("B:\n    X::1\n    Y::2\n"), ParseOptions.STRICT);
        assertThat(rules(result.repairs())).containsExactly("INDENTATION", "INDENTATION");
        final var block = (Block) result.document().sections().get(0);
        assertThat(block.children()).hasSize(2);
    }

    @Test
    void testAssignmentSpacing() {
        final var result = Octave.parse(doc("K :: v\n"), ParseOptions.STRICT);
        assertThat(rules(result.repairs())).containsExactly("ASSIGN_SPACING", "ASSIGN_SPACING");
        assertThat(valueOf("K", doc("K :: v\n"))).isEqualTo(new StringLiteral("v", false));
    }

    @Test
    void testTrailingCommaInList() {
        final var result = Octave.parse(doc("L::[a,b,]\n"), ParseOptions.STRICT);
        assertThat(rules(result.repairs())).containsExactly("TRAILING_COMMA");
    }

    @Test
    void testLexicalRepairsPrecedeParseRepairs() {
        final var result = Octave.parse("K :: a->b\n", ParseOptions.DEFAULT);
        assertThat(rules(result.repairs()))
            .containsExactly("ASCII_ALIAS", "ENVELOPE_SYNTHESIS", "ASSIGN_SPACING", "ASSIGN_SPACING");
    }
}

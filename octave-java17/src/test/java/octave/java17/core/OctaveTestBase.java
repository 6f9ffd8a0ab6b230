package octave.java17.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Base class for core tests.
/// - Emits an INFO banner per test.
/// - Small helpers over the repair log.
public class OctaveTestBase extends OctaveLoggingConfig {

    static final Logger LOG = Logger.getLogger("octave.java17.core");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    static List<String> rules(List<RepairEntry> repairs) {
        return repairs.stream().map(RepairEntry::ruleId).collect(Collectors.toList());
    }

    static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::kind).collect(Collectors.toList());
    }

    static OctaveAst.Document parseStrict(String text) {
        return Octave.parse(text, ParseOptions.STRICT).document();
    }

    static OctaveAst.Value valueOf(String key, String text) {
        return parseStrict(text).sections().stream()
            .filter(OctaveAst.Assignment.class::isInstance)
            .map(OctaveAst.Assignment.class::cast)
            .filter(a -> a.key().equals(key))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no assignment " + key))
            .value();
    }

    static String doc(String body) {
        return "===DOC===\n" + body + "===END===\n";
    }
}

package octave.java17.schema;

import octave.java17.core.Octave;
import octave.java17.core.OctaveAst.Assignment;
import octave.java17.core.OctaveAst.Document;
import octave.java17.core.OctaveAst.ListValue;
import octave.java17.core.ParseOptions;
import octave.java17.core.RepairEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Base class for schema tests.
/// - Emits an INFO banner per test.
/// - Builds schemas and documents from short bodies.
public class SchemaTestBase extends SchemaLoggingConfig {

    static final Logger LOG = Logger.getLogger("octave.java17.schema");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String cls = testInfo.getTestClass().map(Class::getSimpleName).orElse("UnknownTest");
        final String name = testInfo.getTestMethod().map(java.lang.reflect.Method::getName)
                .orElseGet(testInfo::getDisplayName);
        LOG.info(() -> "TEST: " + cls + "#" + name);
    }

    /// A TASK schema with version 1.0 and the given top-level blocks after META.
    static Schema schema(String body) {
        return SchemaExtractor.load("===TASK===\nMETA:\n  VERSION::\"1.0\"\n" + body + "===END===\n");
    }

    static Document document(String body) {
        return Octave.parse("===TASK===\n" + body + "===END===\n", ParseOptions.STRICT).document();
    }

    /// The pattern list of `F::text`, with its source tokens.
    static ListValue patternList(String text) {
        final var assignment = (Assignment) document("F::" + text + "\n").sections().get(0);
        return (ListValue) assignment.value();
    }

    static List<String> codes(ValidationResult result) {
        return result.errors().stream().map(ValidationError::code).collect(Collectors.toList());
    }

    static List<String> rules(List<RepairEntry> repairs) {
        return repairs.stream().map(RepairEntry::ruleId).collect(Collectors.toList());
    }
}

package octave.java17.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

/// Unit tests for StructuredLog - one-line `event=` records.
class StructuredLogTest extends OctaveTestBase {

    private final Logger logger = Logger.getLogger("octave.java17.core.StructuredLogTest");
    private final List<LogRecord> records = new ArrayList<>();
    private final Handler capture = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    void attach() {
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.ALL);
        logger.addHandler(capture);
    }

    @AfterEach
    void detach() {
        logger.removeHandler(capture);
    }

    @Test
    void testFormatQuotesAndFlattens() {
        assertThat(StructuredLog.format("lex.done", "tokens", 4, "text", "a b\nc", "empty", "", "none", null))
            .isEqualTo("event=lex.done tokens=4 text=\"a b c\" empty=\"\" none=null");
        assertThat(StructuredLog.format("x", "q", "say \"hi\"")).isEqualTo("event=x q=\"say \\\"hi\\\"\"");
        assertThat(StructuredLog.format("x", "v", "y".repeat(300))).endsWith("...");
    }

    @Test
    void testRepairLevelFollowsTier() {
        StructuredLog.repair(logger, RepairEntry.normalization("ASCII_ALIAS", "->", "→", 2, 5));
        StructuredLog.repair(logger, RepairEntry.repair("ENUM_CASE_FOLD", "S::active", "S::ACTIVE"));
        assertThat(records).extracting(LogRecord::getLevel).containsExactly(Level.FINER, Level.FINE);
        assertThat(records.get(0).getMessage())
            .isEqualTo("event=repair.normalization rule=ASCII_ALIAS before=-> after=→ line=2 column=5 semantics=false");
        assertThat(records.get(1).getMessage()).startsWith("event=repair.repair rule=ENUM_CASE_FOLD");
    }

    @Test
    void testSyntaxErrorCarriesCodeAndPosition() {
        final var error = new OctaveLexException(OctaveError.TAB_CHARACTER, OctaveError.TAB_CHARACTER.message(),
            3, 1, "\tK::v");
        StructuredLog.syntaxError(logger, "validate.syntax", error);
        assertThat(records).singleElement().satisfies(r -> assertThat(r.getMessage())
            .isEqualTo("event=validate.syntax code=" + OctaveError.TAB_CHARACTER.code() + " line=3 column=1"));
    }

    @Test
    void testDisabledLevelBuildsNothing() {
        logger.setLevel(Level.INFO);
        StructuredLog.route(logger, "TITLE", "§INDEXER", "abc", true);
        StructuredLog.warning(logger, "write.io_failure", "path", "a.oct");
        assertThat(records).extracting(LogRecord::getLevel).containsExactly(Level.WARNING);
    }
}

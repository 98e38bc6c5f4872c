package irforge.config;

import irforge.utils.Logging;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TranslateOptionsTest {

    @BeforeEach
    public void setUp() {
        Logging.init();
    }

    @Test
    public void testDefaults() {
        var options = TranslateOptions.fromArgs();
        assertFalse(options.continueOnFailure);
        assertFalse(options.noMergeGotoChains);
        assertTrue(options.errorOnImplExprError);
        assertTrue(options.disabledPasses.isEmpty());
        assertTrue(options.threads >= 1);
        assertNull(options.diagnosticsReport);
    }

    @Test
    public void testParseArgs() {
        var options = TranslateOptions.fromArgs("continue_on_failure", "error_on_impl_expr_error=false",
                "disabled_passes=remove_nops, reorder_decls,", "threads=3", "diagnostics_report=out/report.json");
        assertTrue(options.continueOnFailure);
        assertFalse(options.errorOnImplExprError);
        assertEquals(Set.of("remove_nops", "reorder_decls"), options.disabledPasses);
        assertEquals(3, options.threads);
        assertEquals("out/report.json", options.diagnosticsReport);
        assertFalse(options.isPassEnabled("remove_nops"));
        assertTrue(options.isPassEnabled("remove_unused_locals"));
    }

    @Test
    public void testMergeGotoChainsSwitch() {
        assertTrue(TranslateOptions.fromArgs().isPassEnabled("merge_goto_chains"));
        assertFalse(TranslateOptions.fromArgs("no_merge_goto_chains=true").isPassEnabled("merge_goto_chains"));
    }

    @Test
    public void testInvalidArgs() {
        assertThrows(IllegalArgumentException.class, () -> TranslateOptions.fromArgs("no_such_option=1"));
        assertThrows(IllegalArgumentException.class, () -> TranslateOptions.fromArgs("threads=0"));
        assertThrows(IllegalArgumentException.class, () -> TranslateOptions.fromArgs("threads=many"));
        assertThrows(IllegalArgumentException.class, () -> TranslateOptions.fromArgs("continue_on_failure=maybe"));
        assertThrows(IllegalArgumentException.class, () -> TranslateOptions.fromArgs("disabled_passes"));
    }

    @Test
    public void testFromJson(@TempDir Path tmp) throws Exception {
        File file = tmp.resolve("options.json").toFile();
        Files.writeString(file.toPath(), "{\"continue_on_failure\": true, \"threads\": 2, "
                + "\"disabled_passes\": [\"recover_body_comments\"]}", StandardCharsets.UTF_8);

        var options = TranslateOptions.fromJson(file);
        assertTrue(options.continueOnFailure);
        assertEquals(2, options.threads);
        assertFalse(options.isPassEnabled("recover_body_comments"));
        assertTrue(options.errorOnImplExprError);
    }
}

package irforge.driver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import irforge.base.items.TranslatedCrate;
import irforge.config.TranslateOptions;
import irforge.errors.Diagnostic;
import irforge.errors.ErrorCtx;
import irforge.frontend.FrontendOracle;
import irforge.transform.TransformCtx;
import irforge.transform.TransformPipeline;
import irforge.translate.CrateTranslator;
import irforge.translate.TranslateCtx;
import irforge.utils.Logging;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point: translates the crate exposed by a front end, then runs the transformation
 * pipeline on it.
 */
public class Translator {

    public static TranslationResult translate(FrontendOracle oracle, TranslateOptions options) {
        Logging.info("Translator", "Options: " + options);
        ErrorCtx errorCtx = new ErrorCtx(options.continueOnFailure);

        long begin = System.currentTimeMillis();
        TranslatedCrate crate = new CrateTranslator(new TranslateCtx(oracle, options, errorCtx)).translate();
        long translated = System.currentTimeMillis();

        new TransformPipeline(new TransformCtx(crate, options, errorCtx)).run();
        long end = System.currentTimeMillis();

        Logging.info("Translator", "Translation time: " + (translated - begin) / 1000.00 + "s");
        Logging.info("Translator", "Transformation time: " + (end - translated) / 1000.00 + "s");
        Logging.info("Translator", String.format("%d items, %d errors", crate.itemCount(), errorCtx.errorCount()));

        TranslationResult result = new TranslationResult(crate, errorCtx.getDiagnostics());
        if (options.diagnosticsReport != null) {
            try {
                writeReport(result, new File(options.diagnosticsReport));
            } catch (IOException e) {
                Logging.error("Translator", "Cannot write diagnostics report: " + e.getMessage());
            }
        }
        return result;
    }

    /**
     * Dump the diagnostics of a run as JSON.
     * @throws IOException if the report file cannot be written
     */
    public static void writeReport(TranslationResult result, File reportFile) throws IOException {
        FileUtils.forceMkdirParent(reportFile);

        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);

        Map<String, Object> report = new HashMap<>();
        report.put("crate", result.crate.name);
        report.put("items", result.crate.itemCount());
        List<Diagnostic> diagnostics = new ArrayList<>(result.diagnostics);
        report.put("errorCount", diagnostics.size());
        report.put("diagnostics", diagnostics);
        mapper.writeValue(reportFile, report);
        Logging.debug("Translator", "Wrote diagnostics report to " + reportFile);
    }
}

package irforge.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import irforge.utils.Logging;

import java.io.File;
import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Options of a translation run.
 * Built from {@code key=value} arguments or read from a JSON file with the same keys.
 */
public class TranslateOptions {

    /** Do not run the goto-chain contraction pass. */
    @JsonProperty("no_merge_goto_chains")
    public boolean noMergeGotoChains = false;

    /** Downgrade recoverable errors to diagnostics plus placeholders instead of aborting. */
    @JsonProperty("continue_on_failure")
    public boolean continueOnFailure = false;

    /** Treat an error witness coming from the front end as a hard error. */
    @JsonProperty("error_on_impl_expr_error")
    public boolean errorOnImplExprError = true;

    /** Names of micro-passes to skip, e.g. {@code remove_unused_locals}. */
    @JsonProperty("disabled_passes")
    public Set<String> disabledPasses = new LinkedHashSet<>();

    /** Worker threads for per-item passes. */
    @JsonProperty("threads")
    public int threads = Runtime.getRuntime().availableProcessors();

    /** Where to write the diagnostics report, or null for no report. */
    @JsonProperty("diagnostics_report")
    public String diagnosticsReport = null;

    public boolean isPassEnabled(String passName) {
        if (passName.equals("merge_goto_chains") && noMergeGotoChains) {
            return false;
        }
        return !disabledPasses.contains(passName);
    }

    /**
     * Parse {@code key=value} arguments. Boolean keys also accept the bare key.
     * @throws IllegalArgumentException on unknown keys or malformed values
     */
    public static TranslateOptions fromArgs(String... args) {
        TranslateOptions options = new TranslateOptions();
        for (String arg : args) {
            Logging.debug("TranslateOptions", "Arg: " + arg);
            String[] argParts = arg.split("=", 2);
            String key = argParts[0].trim();
            String value = argParts.length == 2 ? argParts[1].trim() : null;

            switch (key) {
                case "no_merge_goto_chains" -> options.noMergeGotoChains = parseBool(key, value);
                case "continue_on_failure" -> options.continueOnFailure = parseBool(key, value);
                case "error_on_impl_expr_error" -> options.errorOnImplExprError = parseBool(key, value);
                case "disabled_passes" -> {
                    for (String pass : requireValue(key, value).split(",")) {
                        if (!pass.isBlank()) {
                            options.disabledPasses.add(pass.trim());
                        }
                    }
                }
                case "threads" -> {
                    try {
                        options.threads = Integer.parseInt(requireValue(key, value));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid thread count: " + value, e);
                    }
                    if (options.threads < 1) {
                        throw new IllegalArgumentException("Thread count must be positive: " + value);
                    }
                }
                case "diagnostics_report" -> options.diagnosticsReport = requireValue(key, value);
                default -> throw new IllegalArgumentException("Invalid argument: " + arg);
            }
        }
        return options;
    }

    public static TranslateOptions fromJson(File file) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        TranslateOptions options = mapper.readValue(file, TranslateOptions.class);
        Logging.info("TranslateOptions", "Loaded options from " + file.getPath());
        return options;
    }

    private static boolean parseBool(String key, String value) {
        if (value == null || value.equalsIgnoreCase("true")) {
            return true;
        }
        if (value.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException(String.format("Invalid boolean for %s: %s", key, value));
    }

    private static String requireValue(String key, String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("Missing value for " + key);
        }
        return value;
    }

    @Override
    public String toString() {
        return String.format("TranslateOptions{noMergeGotoChains=%b, continueOnFailure=%b, errorOnImplExprError=%b, "
                        + "disabledPasses=%s, threads=%d}", noMergeGotoChains, continueOnFailure, errorOnImplExprError,
                disabledPasses, threads);
    }
}

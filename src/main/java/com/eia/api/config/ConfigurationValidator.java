package com.eia.api.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates an {@link EiaClientConfig} and prints setup guidance.
 */
public class ConfigurationValidator {

    /** Rows per request the API serves at most. */
    static final int API_ROW_CAP = 5000;

    public static ValidationResult validate(EiaClientConfig config) {
        ValidationResult result = new ValidationResult();

        if (!config.hasApiKey()) {
            result.addError("EIA API key is missing");
            result.addSuggestion("Set apiKey in " + EiaClientConfig.DEFAULT_PROPERTIES_FILE
                    + " or export " + EiaClientConfig.ENV_API_KEY);
            result.addSuggestion("Register for a free key at https://www.eia.gov/opendata/register.php");
        } else {
            result.addSuccess("EIA API key is configured");
        }

        if (config.getMaxRowsPerRequest() > API_ROW_CAP) {
            result.addWarning("maxRowsPerRequest " + config.getMaxRowsPerRequest()
                    + " exceeds the API cap of " + API_ROW_CAP + "; responses will be truncated");
        }

        int processors = Runtime.getRuntime().availableProcessors();
        if (config.getConcurrency() > processors * 4) {
            result.addWarning("concurrency " + config.getConcurrency()
                    + " is high for " + processors + " processors and may trigger server throttling");
        }

        if (config.getRetryMaxAttempts() == 1) {
            result.addInfo("Retries disabled: a single transport failure aborts the whole query");
            result.addSuggestion("Set retryMaxAttempts=3 to retry transient failures per chunk");
        } else {
            result.addInfo("Retry policy: " + config.getRetryPolicy());
        }

        result.addInfo("Base URL: " + config.getBaseUrl());
        result.addInfo("Max rows per request: " + config.getMaxRowsPerRequest());
        result.addInfo("Concurrency: " + config.getConcurrency());
        return result;
    }

    public static void printValidationReport(EiaClientConfig config) {
        ValidationResult result = validate(config);

        System.out.println();
        System.out.println("=================================================");
        System.out.println("         EIA Configuration Validation");
        System.out.println("=================================================");

        printSection("ERRORS:", result.getErrors());
        printSection("WARNINGS:", result.getWarnings());
        printSection("SUCCESS:", result.getSuccesses());
        printSection("INFORMATION:", result.getInfo());
        printSection("SUGGESTIONS:", result.getSuggestions());

        System.out.println();
        System.out.println("=================================================");
        System.out.println(result.isValid() ? "Configuration is valid" : "Configuration needs attention");
        System.out.println("=================================================");
        System.out.println();
    }

    private static void printSection(String title, List<String> lines) {
        if (lines.isEmpty()) {
            return;
        }
        System.out.println();
        System.out.println(title);
        lines.forEach(line -> System.out.println("   * " + line));
    }

    public static class ValidationResult {
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<String> successes = new ArrayList<>();
        private final List<String> info = new ArrayList<>();
        private final List<String> suggestions = new ArrayList<>();

        void addError(String error) {
            errors.add(error);
        }

        void addWarning(String warning) {
            warnings.add(warning);
        }

        void addSuccess(String success) {
            successes.add(success);
        }

        void addInfo(String information) {
            info.add(information);
        }

        void addSuggestion(String suggestion) {
            suggestions.add(suggestion);
        }

        public boolean isValid() {
            return errors.isEmpty();
        }

        public List<String> getErrors() {
            return errors;
        }

        public List<String> getWarnings() {
            return warnings;
        }

        public List<String> getSuccesses() {
            return successes;
        }

        public List<String> getInfo() {
            return info;
        }

        public List<String> getSuggestions() {
            return suggestions;
        }
    }
}

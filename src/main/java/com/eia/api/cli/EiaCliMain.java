package com.eia.api.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.slf4j.LoggerFactory;

import com.eia.api.cli.commands.ConfigCommand;
import com.eia.api.cli.commands.FetchCommand;
import com.eia.api.config.EiaClientConfig;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command line front end for the EIA API client.
 *
 * Usage:
 *   eia-cli fetch electricity/rto/region-sub-ba-data/data/ --facet parent=CISO \
 *       --start 2024-01-01T00 --end 2024-01-31T23 --frequency hourly --csv ciso.csv
 *   eia-cli config                      # Validate configuration
 */
@Command(
    name = "eia-cli",
    description = "EIA open data client - chunked time-series backfill",
    mixinStandardHelpOptions = true,
    version = "EIA CLI 1.0.0",
    subcommands = {
        FetchCommand.class,
        ConfigCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class EiaCliMain implements Callable<Integer> {

    public static final String BASE_LOGGER = "com.eia.api";
    public static final String REQUEST_LOGGER = "EiaRequestLogger";

    @Option(names = {"-c", "--config"},
            description = "Configuration file",
            defaultValue = EiaClientConfig.DEFAULT_PROPERTIES_FILE)
    private File configFile;

    @Option(names = {"--debug"},
            description = "Enable debug logging (shows API calls and chunk progress)")
    private boolean debug;

    @Option(names = {"--apiKey"},
            description = "EIA API key (overrides config)")
    private String apiKey;

    @Option(names = {"--format"},
            description = "Output format: ${COMPLETION-CANDIDATES} (default: TABLE)",
            defaultValue = "TABLE")
    private OutputFormat format;

    public static void main(String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new EiaCliMain());
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            commandLine.getErr().println("Error: " + ex.getMessage());
            return 1;
        });
        return cmd;
    }

    @Override
    public Integer call() throws Exception {
        CommandLine.usage(this, System.out);
        return 0;
    }

    /**
     * Resolve configuration for a subcommand: the config file layered over the
     * defaults, then the command line key. Also applies the log level.
     */
    public EiaClientConfig loadConfig() {
        configureLogging();
        EiaClientConfig config = EiaClientConfig.load(configFile);
        EiaClientConfig.Builder builder = config.toBuilder();
        if (apiKey != null && !apiKey.trim().isEmpty()) {
            builder.apiKey(apiKey.trim());
        }
        if (debug && config.getDebugLevel() == 0) {
            builder.debugLevel(1);
        }
        return builder.build();
    }

    private void configureLogging() {
        if (debug) {
            setLogLevel(BASE_LOGGER, "DEBUG");
            setLogLevel(REQUEST_LOGGER, "DEBUG");
        } else {
            setLogLevel(BASE_LOGGER, "WARN");
        }
    }

    private static void setLogLevel(String loggerName, String levelStr) {
        Logger logger = (Logger) LoggerFactory.getLogger(loggerName);
        Level level = Level.toLevel(levelStr, Level.INFO);
        logger.setLevel(level);
    }

    public OutputFormat getFormat() {
        return format;
    }

    public boolean isDebug() {
        return debug;
    }

    public enum OutputFormat {
        TABLE, JSON, CSV
    }
}

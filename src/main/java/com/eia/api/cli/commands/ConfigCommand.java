package com.eia.api.cli.commands;

import java.util.concurrent.Callable;

import com.eia.api.cli.EiaCliMain;
import com.eia.api.config.ConfigurationValidator;
import com.eia.api.config.EiaClientConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

/**
 * Validates the resolved configuration and prints a report
 */
@Command(
    name = "config",
    description = "Validate EIA client configuration",
    mixinStandardHelpOptions = true
)
public class ConfigCommand implements Callable<Integer> {

    @ParentCommand
    private EiaCliMain parent;

    @Override
    public Integer call() throws Exception {
        EiaClientConfig config = parent.loadConfig();
        ConfigurationValidator.printValidationReport(config);
        return ConfigurationValidator.validate(config).isValid() ? 0 : 1;
    }
}

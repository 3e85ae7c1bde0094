package com.keystone.dispatch.cli;

import com.keystone.core.KeystoneException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Keystone.
 * Routes to subcommands: new, update-guide, validate, packs.
 */
@Command(
        name = "keystone",
        mixinStandardHelpOptions = true,
        version = "Keystone 0.1.0",
        description = "Generates a validated project blueprint and agent guidance document from a template pack",
        subcommands = {
                NewCommand.class,
                UpdateGuideCommand.class,
                ValidateCommand.class,
                PacksCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class KeystoneCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(KeystoneCommand.class);

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }

    /**
     * Command line wired with the exception handler that turns failures into
     * {@link ExitCodes}.
     */
    public static CommandLine commandLine(KeystoneCommand command, CommandLine.IFactory factory) {
        return new CommandLine(command, factory)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    if (ex instanceof KeystoneException) {
                        log.debug("Command '{}' failed", cmd.getCommandName(), ex);
                        ConsoleOutput.error(ex.getMessage());
                    } else {
                        log.error("Command '{}' failed unexpectedly", cmd.getCommandName(), ex);
                        ConsoleOutput.error("Unexpected failure: " + ex.getMessage());
                    }
                    return ExitCodes.forException(ex);
                });
    }
}

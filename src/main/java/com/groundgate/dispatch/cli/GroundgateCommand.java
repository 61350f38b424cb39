package com.groundgate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: verify, chunk-id.
 */
@Command(
        name = "groundgate",
        mixinStandardHelpOptions = true,
        version = "Groundgate 0.1.0",
        description = "Citation grounding and quality gate for agent answers",
        subcommands = {
                VerifyCommand.class,
                ChunkIdCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class GroundgateCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // No subcommand given: show usage
        spec.commandLine().usage(System.out);
    }
}

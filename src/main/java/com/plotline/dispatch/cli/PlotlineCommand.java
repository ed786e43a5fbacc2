package com.plotline.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Plotline.
 * Routes to subcommands: analyze, serve.
 */
@Command(
        name = "plotline",
        mixinStandardHelpOptions = true,
        version = "Plotline 0.1.0",
        description = "Global coherence analysis for reordered manuscripts",
        subcommands = {
                AnalyzeCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PlotlineCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}

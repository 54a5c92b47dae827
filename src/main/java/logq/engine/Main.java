package logq.engine;

import java.util.concurrent.Callable;

import logq.engine.cli.SelectCommand;
import picocli.CommandLine;

/**
 * Command line entry point: {@code logq select <query> [file]}.
 */
@CommandLine.Command(
    name = "logq",
    mixinStandardHelpOptions = true,
    version = "logq 0.1.0",
    description = "Query AWS ELB/ALB, S3 and Squid access logs with SQL",
    subcommands = {SelectCommand.class})
public class Main implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    /** Invoked without a subcommand: print usage and fail. */
    @Override
    public Integer call() {
        spec.commandLine().getErr().println("Missing subcommand");
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }

    public static CommandLine commandLine() {
        return new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }
}

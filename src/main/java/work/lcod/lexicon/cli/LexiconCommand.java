package work.lcod.lexicon.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "lexicon",
    description = "Validate atproto lexicon schema documents.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = { CheckCommand.class, CommandLine.HelpCommand.class }
)
final class LexiconCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return CommandLine.ExitCode.USAGE;
    }
}

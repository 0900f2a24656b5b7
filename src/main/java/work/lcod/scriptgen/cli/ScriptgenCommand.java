package work.lcod.scriptgen.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "scriptgen",
    description = "Generate preprocessing scripts from pipelines and read pipelines back from scripts.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {
        GenerateCommand.class,
        ParseCommand.class,
        SchemaCommand.class,
        AdvancedCommand.class
    }
)
final class ScriptgenCommand implements Runnable {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand.");
    }
}

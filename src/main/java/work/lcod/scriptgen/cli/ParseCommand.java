package work.lcod.scriptgen.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import work.lcod.scriptgen.codegen.PipelineJson;

@CommandLine.Command(
    name = "parse",
    description = "Read a script back into a pipeline (JSON array of actions).",
    mixinStandardHelpOptions = true
)
final class ParseCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    EngineOptions options = new EngineOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "SCRIPT|-", description = "Script file; '-' reads stdin.")
    String script;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Pipeline file to write (default: stdout).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path output;

    @Override
    public Integer call() {
        var actions = options.engine().parse(EngineOptions.readInput(script));
        EngineOptions.writeOutput(spec, output, PipelineJson.write(actions));
        return 0;
    }
}

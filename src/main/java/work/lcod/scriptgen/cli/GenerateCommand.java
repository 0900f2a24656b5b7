package work.lcod.scriptgen.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import work.lcod.scriptgen.codegen.PipelineJson;

@CommandLine.Command(
    name = "generate",
    description = "Render a pipeline (JSON array of actions) as a script.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class GenerateCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    EngineOptions options = new EngineOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "PIPELINE|-", description = "Pipeline JSON file; '-' reads stdin.")
    String pipeline;

    @CommandLine.Option(
        names = {"-d", "--data"},
        description = "Recording loaded by the script (default: commented placeholder).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    String dataPath;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Script file to write (default: stdout).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    Path output;

    @Override
    public Integer call() {
        var actions = PipelineJson.read(EngineOptions.readInput(pipeline));
        String script = options.engine().generate(dataPath, actions);
        EngineOptions.writeOutput(spec, output, script);
        return 0;
    }
}

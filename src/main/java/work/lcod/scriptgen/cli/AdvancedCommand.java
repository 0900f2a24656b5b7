package work.lcod.scriptgen.cli;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import picocli.CommandLine;

@CommandLine.Command(
    name = "advanced",
    description = "List the advanced keyword arguments of an action's calls or of one dotted call path.",
    mixinStandardHelpOptions = true
)
final class AdvancedCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    EngineOptions options = new EngineOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "ACTION_ID|PATH", description = "Action id, or a dotted call path such as raw.filter.")
    String target;

    @CommandLine.Option(
        names = "--exclude",
        split = ",",
        description = "Parameter names to leave out when a dotted path is given."
    )
    List<String> exclude = List.of();

    @Override
    public Integer call() throws Exception {
        var engine = options.engine();
        var definition = engine.registry().byId(target);
        Object payload;
        if (definition.isPresent()) {
            var schemas = new LinkedHashMap<String, Object>();
            engine.advancedParams(definition.get()).forEach((path, schema) -> schemas.put(path, schema.toWireMap()));
            payload = schemas;
        } else {
            payload = engine.advancedParams(target, new LinkedHashSet<>(exclude)).toWireMap();
        }
        EngineOptions.writeOutput(spec, null, JSON_WRITER.writeValueAsString(payload));
        return 0;
    }
}

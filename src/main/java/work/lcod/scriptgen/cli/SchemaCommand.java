package work.lcod.scriptgen.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import picocli.CommandLine;
import work.lcod.scriptgen.action.ActionDefinition;
import work.lcod.scriptgen.action.Prerequisite;
import work.lcod.scriptgen.action.StepDefinition;

@CommandLine.Command(
    name = "schema",
    description = "Describe one action, or list all actions when no id is given.",
    mixinStandardHelpOptions = true
)
final class SchemaCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    EngineOptions options = new EngineOptions();

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "ACTION_ID", description = "Action id.")
    String actionId;

    @Override
    public Integer call() throws Exception {
        var registry = options.engine().registry();
        Object payload;
        if (actionId == null) {
            var summaries = new ArrayList<Map<String, Object>>();
            for (ActionDefinition definition : registry.list()) {
                var summary = new LinkedHashMap<String, Object>();
                summary.put("id", definition.id());
                summary.put("title", definition.title());
                summary.put("doc", definition.doc());
                summary.put("steps", definition.steps().size());
                summaries.add(summary);
            }
            payload = summaries;
        } else {
            ActionDefinition definition = registry.byId(actionId)
                .orElseThrow(() -> new CommandLine.ParameterException(spec.commandLine(), "Unknown action: " + actionId));
            payload = describe(definition);
        }
        EngineOptions.writeOutput(spec, null, JSON_WRITER.writeValueAsString(payload));
        return 0;
    }

    static Map<String, Object> describe(ActionDefinition definition) {
        var out = new LinkedHashMap<String, Object>();
        out.put("id", definition.id());
        out.put("title", definition.title());
        out.put("doc", definition.doc());
        out.put("doc_urls", definition.docUrls());
        out.put("params", definition.paramsSchema().toWireMap());
        var steps = new ArrayList<Map<String, Object>>();
        for (StepDefinition step : definition.steps()) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("id", step.id());
            entry.put("title", step.title());
            entry.put("interactive", step.interactive());
            steps.add(entry);
        }
        out.put("steps", steps);
        var prerequisites = new ArrayList<Map<String, Object>>();
        for (Prerequisite prerequisite : definition.prerequisites()) {
            prerequisites.add(Map.of("action_id", prerequisite.actionId(), "message", prerequisite.message()));
        }
        out.put("prerequisites", prerequisites);
        return out;
    }
}

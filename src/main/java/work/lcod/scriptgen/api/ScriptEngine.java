package work.lcod.scriptgen.api;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import work.lcod.scriptgen.action.ActionDefinition;
import work.lcod.scriptgen.action.ActionRegistry;
import work.lcod.scriptgen.action.FunctionGroup;
import work.lcod.scriptgen.actions.BuiltinActions;
import work.lcod.scriptgen.codegen.ActionConfig;
import work.lcod.scriptgen.codegen.ScriptGenerator;
import work.lcod.scriptgen.codegen.ScriptSettings;
import work.lcod.scriptgen.introspect.ApiCatalog;
import work.lcod.scriptgen.introspect.FunctionIntrospector;
import work.lcod.scriptgen.roundtrip.ScriptParser;
import work.lcod.scriptgen.schema.ParamsSchema;

/**
 * Entry point for embedding applications and the CLI: one registry, generator, parser and introspector sharing
 * the same configuration.
 */
public final class ScriptEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ScriptEngine.class);

    private final ActionRegistry registry;
    private final ScriptGenerator generator;
    private final ScriptParser parser;
    private final FunctionIntrospector introspector;

    public ScriptEngine(ActionRegistry registry, ScriptSettings settings, ApiCatalog catalog) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.generator = new ScriptGenerator(registry, settings);
        this.parser = new ScriptParser(registry);
        this.introspector = new FunctionIntrospector(catalog);
    }

    /** Engine over the built-in actions. */
    public static ScriptEngine create(EngineConfiguration configuration) {
        configuration.logLevel().ifPresent(LogLevel::apply);
        ScriptSettings settings = configuration.settingsFile()
            .map(ScriptSettings::load)
            .orElseGet(ScriptSettings::defaults);
        ApiCatalog catalog = configuration.apiCatalog()
            .map(ApiCatalog::load)
            .orElseGet(ApiCatalog::bundled);
        LOG.debug("Engine settings: {}", settings);
        return new ScriptEngine(BuiltinActions.registry(), settings, catalog);
    }

    public ActionRegistry registry() {
        return registry;
    }

    public String generate(String dataPath, List<ActionConfig> actions) {
        return generator.generate(dataPath, actions);
    }

    public String generateActionCode(ActionConfig action) {
        return generator.generateActionCode(action);
    }

    public List<ActionConfig> parse(String script) {
        return parser.parse(script);
    }

    public ParamsSchema advancedParams(String dottedPath, Set<String> owned) {
        return introspector.advancedParams(dottedPath, owned);
    }

    /**
     * Advanced parameters of every function group of an action; the action's own parameters and each group's
     * owned keywords are left out.
     */
    public Map<String, ParamsSchema> advancedParams(ActionDefinition definition) {
        var out = new LinkedHashMap<String, ParamsSchema>();
        for (FunctionGroup group : groupsOf(definition)) {
            var primary = new LinkedHashSet<String>(group.ownedParams());
            primary.addAll(definition.paramsSchema().names());
            out.put(group.dottedPath(), introspector.advancedParams(group.dottedPath(), primary));
        }
        return out;
    }

    private static List<FunctionGroup> groupsOf(ActionDefinition definition) {
        return definition.singleStep()
            .map(step -> step.templateSchema().groups())
            .filter(groups -> !groups.isEmpty())
            .orElse(definition.templateSchema().groups());
    }
}

package work.lcod.scriptgen.roundtrip;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import work.lcod.scriptgen.action.ActionDefinition;
import work.lcod.scriptgen.action.ActionRegistry;
import work.lcod.scriptgen.action.StepDefinition;
import work.lcod.scriptgen.action.TemplateSchema;
import work.lcod.scriptgen.actions.CustomCode;
import work.lcod.scriptgen.codegen.ActionConfig;

/**
 * Rebuilds action configs from a generated, possibly hand-edited, script.
 * <p>
 * Each {@code # In[n] title} block is matched to an action by title. Unknown titles become custom actions
 * holding the block verbatim. Known ones get their parameters and advanced keywords recovered; when the
 * definition would not render the block's structure from them, the block is kept verbatim as custom code.
 */
public final class ScriptParser {
    private static final Logger LOG = LoggerFactory.getLogger(ScriptParser.class);

    private final ActionRegistry registry;

    public ScriptParser(ActionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public List<ActionConfig> parse(String script) {
        var actions = new ArrayList<ActionConfig>();
        for (CodeBlock block : MarkerScanner.extractBlocks(script, MarkerGrammar.ACTION)) {
            var definition = registry.byTitle(block.label());
            if (definition.isEmpty()) {
                Map<String, Object> defaults = registry.byId(CustomCode.ID)
                    .map(ActionDefinition::defaultParams)
                    .orElseGet(LinkedHashMap::new);
                var config = ActionConfig.custom(CustomCode.ID, defaults, block.code());
                config.setTitleOverride(block.label());
                actions.add(config);
                continue;
            }
            actions.add(recover(definition.get(), block));
        }
        LOG.debug("Parsed {} actions from script", actions.size());
        return actions;
    }

    ActionConfig recover(ActionDefinition definition, CodeBlock block) {
        Recovered recovered = definition.hasSteps()
            ? recoverSteps(definition, block.code())
            : recoverSingle(definition, block.code());
        var config = new ActionConfig(definition.id(), recovered.params());
        config.setAdvancedParams(recovered.advanced());
        config.setTitleOverride(block.label());
        if (DriftDetector.isDrifted(definition, block.code(), recovered.params(), recovered.advanced())) {
            LOG.debug("Block {} '{}' was edited by hand, keeping it as custom code", block.id(), block.label());
            config.setCustomCode(block.code());
            config.setCustom(true);
        }
        return config;
    }

    private Recovered recoverSingle(ActionDefinition definition, String code) {
        TemplateSchema schema = definition.singleStep()
            .map(StepDefinition::templateSchema)
            .orElse(definition.templateSchema());
        var params = ParamRecovery.recoverParams(schema, code, definition.defaultParams());
        var advanced = ParamRecovery.recoverAdvanced(schema, code);
        var probed = ProbeRecovery.recover(definition.paramsSchema(), schema.allPrimaryParams(), params, code,
            values -> definition.buildCode(values, advanced.isEmpty() ? null : advanced));
        return new Recovered(probed, advanced);
    }

    private Recovered recoverSteps(ActionDefinition definition, String code) {
        Map<String, Object> params = definition.defaultParams();
        var advanced = new LinkedHashMap<String, Map<String, Object>>();
        for (CodeBlock block : MarkerScanner.extractBlocks(code, MarkerGrammar.STEP)) {
            var step = definition.step(block.id());
            if (step.isEmpty() || !step.get().hasCode()) {
                continue;
            }
            TemplateSchema schema = step.get().templateSchema();
            params.putAll(ParamRecovery.recoverParams(schema, block.code(), Map.of()));
            ParamRecovery.recoverAdvanced(schema, block.code())
                .forEach((path, kwargs) -> advanced.computeIfAbsent(path, p -> new LinkedHashMap<>()).putAll(kwargs));
            params = ProbeRecovery.recover(schema.virtualParams(), schema.allPrimaryParams(), params, block.code(),
                step.get()::buildCode);
        }
        return new Recovered(params, advanced);
    }

    private record Recovered(Map<String, Object> params, Map<String, Map<String, Object>> advanced) {}
}

package work.lcod.scriptgen.codegen;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import work.lcod.scriptgen.action.ActionDefinition;
import work.lcod.scriptgen.action.ActionRegistry;
import work.lcod.scriptgen.ir.CodeParseException;
import work.lcod.scriptgen.ir.Expr.BoolLiteral;
import work.lcod.scriptgen.ir.Expr.Call;
import work.lcod.scriptgen.ir.Expr.Keyword;
import work.lcod.scriptgen.ir.Expr.Name;
import work.lcod.scriptgen.ir.Expr.StringLiteral;
import work.lcod.scriptgen.ir.SourceParser;
import work.lcod.scriptgen.ir.SourcePrinter;
import work.lcod.scriptgen.ir.Stmt;
import work.lcod.scriptgen.ir.Stmt.Assign;
import work.lcod.scriptgen.roundtrip.MarkerGrammar;

/**
 * Renders action configs into code, one action at a time or as a complete script laid out by the settings'
 * layout file.
 */
public final class ScriptGenerator {
    static final String IMPORTS = "# IMPORTS";
    static final String LOAD_DATA = "# LOAD_DATA";
    static final String ACTIONS_START = "# ACTIONS_START";
    static final String ACTIONS_END = "# ACTIONS_END";

    private static final Logger LOG = LoggerFactory.getLogger(ScriptGenerator.class);

    private final ActionRegistry registry;
    private final ScriptSettings settings;

    public ScriptGenerator(ActionRegistry registry, ScriptSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Code of one action: edited code verbatim, nothing for a custom action without code or an unknown id,
     * otherwise the definition's code for its defaults overlaid with the config's parameters.
     */
    public String generateActionCode(ActionConfig action) {
        if (!action.customCode().isEmpty()) {
            return action.customCode();
        }
        if (action.isCustom()) {
            return "";
        }
        var definition = registry.byId(action.actionId());
        if (definition.isEmpty()) {
            LOG.debug("No action '{}' registered, emitting no code", action.actionId());
            return "";
        }
        var params = new LinkedHashMap<String, Object>(definition.get().defaultParams());
        params.putAll(action.params());
        return definition.get().buildCode(params, action.advancedParams().isEmpty() ? null : action.advancedParams());
    }

    /**
     * A complete script. Imports of single-step actions are hoisted into the merged import block; multistep
     * actions keep their code intact so that step markers and in-step imports survive a reload.
     *
     * @param dataPath recording to load, or {@code null} for the commented placeholder
     */
    public String generate(String dataPath, List<ActionConfig> actions) {
        LOG.debug("Generating script for {} actions", actions.size());
        List<String> layout = List.of(settings.readLayout().split("\n", -1));

        var imports = new ArrayList<Stmt>(baseImports());
        var actionLines = new ArrayList<String>();
        int number = 1;
        for (ActionConfig action : actions) {
            String code = generateActionCode(action);
            boolean multistep = registry.byId(action.actionId()).map(ActionDefinition::hasSteps).orElse(false);
            if (!multistep) {
                var extraction = ImportMerger.extract(code);
                imports.addAll(extraction.imports());
                code = extraction.code();
            }
            String id = Integer.toString(number++);
            actionLines.add(MarkerGrammar.ACTION.beginMarker(id, registry.titleFor(action.actionId(), action.titleOverride())));
            actionLines.add(code);
            actionLines.add(MarkerGrammar.ACTION.endMarker(id));
            actionLines.add("");
        }

        var output = new ArrayList<String>();
        for (int i = 0; i < layout.size(); i++) {
            String line = layout.get(i);
            String marker = line.strip();
            if (marker.equals(IMPORTS)) {
                output.add(ImportMerger.merge(imports));
            } else if (marker.equals(LOAD_DATA)) {
                output.add(loadLine(dataPath));
            } else if (marker.equals(ACTIONS_START)) {
                output.add(line);
                output.addAll(actionLines);
                while (i + 1 < layout.size() && !layout.get(i + 1).strip().equals(ACTIONS_END)) {
                    i++;
                }
                if (i + 1 < layout.size()) {
                    output.add(layout.get(++i));
                }
            } else {
                output.add(line);
            }
        }
        return String.join("\n", output);
    }

    String loadLine(String dataPath) {
        if (dataPath == null || dataPath.isEmpty()) {
            return settings.loadPlaceholder();
        }
        var call = new Call(new Name(settings.loadFunction()), List.of(new StringLiteral(dataPath)),
            List.of(new Keyword("preload", BoolLiteral.of(true))));
        return SourcePrinter.print(new Assign(List.of(new Name(settings.loadTarget())), call));
    }

    private List<Stmt> baseImports() {
        var statements = new ArrayList<Stmt>();
        for (String line : settings.baseImports()) {
            try {
                statements.addAll(SourceParser.parseStatements(line));
            } catch (CodeParseException e) {
                throw new IllegalStateException("Invalid base import '" + line + "': " + e.getMessage(), e);
            }
        }
        return statements;
    }
}

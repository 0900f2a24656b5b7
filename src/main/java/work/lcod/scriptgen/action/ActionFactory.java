package work.lcod.scriptgen.action;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import work.lcod.scriptgen.schema.ParamSpec;
import work.lcod.scriptgen.schema.ParamsSchema;
import work.lcod.scriptgen.schema.SchemaExtractor;

/**
 * Builds {@link ActionDefinition}s from a {@link TemplateProvider}.
 * <p>
 * One builder gives a single-step action whose schema comes from the builder's parameters and whose template
 * schema lists the provider's function groups. Several builders give a multistep action: the schema is the union
 * of the step schemas (a name declared by two steps is rejected) and each step carries its own virtual schema.
 */
public final class ActionFactory {
    private final String id;
    private String title;
    private String doc = "";
    private final List<String> docUrls = new ArrayList<>();
    private final List<Prerequisite> prerequisites = new ArrayList<>();

    private ActionFactory(String id) {
        this.id = Objects.requireNonNull(id, "id");
    }

    public static ActionFactory define(String id) {
        return new ActionFactory(id);
    }

    public ActionFactory title(String title) {
        this.title = title;
        return this;
    }

    public ActionFactory doc(String doc) {
        this.doc = doc;
        return this;
    }

    public ActionFactory docUrl(String url) {
        this.docUrls.add(url);
        return this;
    }

    public ActionFactory prerequisite(String actionId, String message) {
        this.prerequisites.add(new Prerequisite(actionId, message));
        return this;
    }

    public ActionDefinition from(TemplateProvider provider) {
        Objects.requireNonNull(provider, "provider");
        List<StepBuilder> builders = provider.provideBuilders();
        if (builders == null || builders.isEmpty()) {
            throw new IllegalArgumentException("Action '" + id + "' provides no step builders");
        }
        var action = ActionDefinition.builder(id)
            .doc(doc)
            .docUrls(docUrls)
            .prerequisites(prerequisites);
        if (builders.size() == 1) {
            return singleStep(action, builders.get(0), provider.primaryParams());
        }
        return multiStep(action, builders);
    }

    private ActionDefinition singleStep(ActionDefinition.Builder action, StepBuilder step, Map<String, List<String>> seeds) {
        var groups = new ArrayList<FunctionGroup>();
        if (seeds != null) {
            seeds.forEach((path, owned) -> groups.add(new FunctionGroup(path, owned == null ? Set.of() : new LinkedHashSet<>(owned))));
        }
        return action
            .title(title != null ? title : step.title())
            .paramsSchema(SchemaExtractor.extract(step.params()))
            .templateSchema(TemplateSchema.ofGroups(groups))
            .codeBuilder((params, advanced) -> {
                String code = step.render(params);
                return advanced == null || advanced.isEmpty() ? code : AdvancedParamInjector.inject(code, advanced);
            })
            .build();
    }

    private ActionDefinition multiStep(ActionDefinition.Builder action, List<StepBuilder> builders) {
        var union = ParamsSchema.builder();
        var owners = new HashMap<String, String>();
        for (StepBuilder step : builders) {
            ParamsSchema stepSchema = SchemaExtractor.extract(step.params());
            for (Map.Entry<String, ParamSpec> entry : stepSchema.asMap().entrySet()) {
                String previous = owners.putIfAbsent(entry.getKey(), step.id());
                if (previous != null) {
                    throw new IllegalArgumentException("Action '" + id + "': parameter '" + entry.getKey()
                        + "' is declared by steps '" + previous + "' and '" + step.id() + "'");
                }
                union.put(entry.getKey(), entry.getValue());
            }
            CodeBuilder code = step.hasCode() ? step::render : null;
            action.step(new StepDefinition(step.id(), step.title(), code, step.interactive(), TemplateSchema.virtual(stepSchema)));
        }
        return action
            .title(title != null ? title : id)
            .paramsSchema(union.build())
            .build();
    }
}

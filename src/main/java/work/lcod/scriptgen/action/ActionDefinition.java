package work.lcod.scriptgen.action;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import work.lcod.scriptgen.roundtrip.MarkerGrammar;
import work.lcod.scriptgen.schema.ParamsSchema;

/**
 * Immutable description of a pipeline action. An action renders its code either through a single code builder
 * or through an ordered list of steps; exactly one of the two is present.
 */
public final class ActionDefinition {
    private final String id;
    private final String title;
    private final ParamsSchema paramsSchema;
    private final String doc;
    private final List<String> docUrls;
    private final ActionCodeBuilder codeBuilder;
    private final List<StepDefinition> steps;
    private final TemplateSchema templateSchema;
    private final List<Prerequisite> prerequisites;

    private ActionDefinition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Action id must not be blank");
        }
        this.title = builder.title != null ? builder.title : id;
        this.paramsSchema = builder.paramsSchema == null ? ParamsSchema.empty() : builder.paramsSchema;
        this.doc = builder.doc == null ? "" : builder.doc;
        this.docUrls = List.copyOf(builder.docUrls);
        this.codeBuilder = builder.codeBuilder;
        this.steps = List.copyOf(builder.steps);
        this.templateSchema = builder.templateSchema == null ? TemplateSchema.empty() : builder.templateSchema;
        this.prerequisites = List.copyOf(builder.prerequisites);
        if ((codeBuilder == null) == steps.isEmpty()) {
            throw new IllegalArgumentException("Action '" + id + "' needs exactly one of a code builder or steps");
        }
        var stepIds = new HashSet<String>();
        for (StepDefinition step : steps) {
            if (!stepIds.add(step.id())) {
                throw new IllegalArgumentException("Action '" + id + "' declares step '" + step.id() + "' twice");
            }
        }
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public ParamsSchema paramsSchema() {
        return paramsSchema;
    }

    public String doc() {
        return doc;
    }

    public List<String> docUrls() {
        return docUrls;
    }

    public List<StepDefinition> steps() {
        return steps;
    }

    public TemplateSchema templateSchema() {
        return templateSchema;
    }

    public List<Prerequisite> prerequisites() {
        return prerequisites;
    }

    public Map<String, Object> defaultParams() {
        return paramsSchema.defaults();
    }

    /** True only for actions with more than one step; a single step behaves like a single-step action. */
    public boolean hasSteps() {
        return steps.size() > 1;
    }

    /** The sole step of a one-step action. */
    public Optional<StepDefinition> singleStep() {
        return steps.size() == 1 ? Optional.of(steps.get(0)) : Optional.empty();
    }

    public Optional<StepDefinition> step(String stepId) {
        return steps.stream().filter(step -> step.id().equals(stepId)).findFirst();
    }

    /**
     * Renders the action. Steps of a multistep action are wrapped in step markers and separated by blank lines;
     * steps without a code builder contribute nothing. Advanced keyword arguments are injected into single-step
     * code only.
     */
    public String buildCode(Map<String, ?> params, Map<String, ? extends Map<String, ?>> advanced) {
        Map<String, ?> values = params == null ? Map.of() : params;
        if (codeBuilder != null) {
            return codeBuilder.build(values, advanced == null ? Map.of() : advanced);
        }
        var only = singleStep();
        if (only.isPresent()) {
            String code = only.get().buildCode(values);
            return advanced == null || advanced.isEmpty() ? code : AdvancedParamInjector.inject(code, advanced);
        }
        var parts = new ArrayList<String>();
        for (StepDefinition step : steps) {
            if (!step.hasCode()) {
                continue;
            }
            parts.add(MarkerGrammar.STEP.beginMarker(step.id(), step.title()) + "\n"
                + step.buildCode(values) + "\n"
                + MarkerGrammar.STEP.endMarker(step.id()));
        }
        return String.join("\n\n", parts);
    }

    public String buildCode(Map<String, ?> params) {
        return buildCode(params, null);
    }

    @Override
    public String toString() {
        return "ActionDefinition[" + id + "]";
    }

    public static final class Builder {
        private final String id;
        private String title;
        private ParamsSchema paramsSchema;
        private String doc;
        private final List<String> docUrls = new ArrayList<>();
        private ActionCodeBuilder codeBuilder;
        private final List<StepDefinition> steps = new ArrayList<>();
        private TemplateSchema templateSchema;
        private final List<Prerequisite> prerequisites = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder paramsSchema(ParamsSchema paramsSchema) {
            this.paramsSchema = paramsSchema;
            return this;
        }

        public Builder doc(String doc) {
            this.doc = doc;
            return this;
        }

        public Builder docUrls(List<String> urls) {
            this.docUrls.addAll(urls);
            return this;
        }

        public Builder codeBuilder(ActionCodeBuilder codeBuilder) {
            this.codeBuilder = codeBuilder;
            return this;
        }

        public Builder step(StepDefinition step) {
            this.steps.add(step);
            return this;
        }

        public Builder templateSchema(TemplateSchema templateSchema) {
            this.templateSchema = templateSchema;
            return this;
        }

        public Builder prerequisites(List<Prerequisite> prerequisites) {
            this.prerequisites.addAll(prerequisites);
            return this;
        }

        public ActionDefinition build() {
            return new ActionDefinition(this);
        }
    }
}

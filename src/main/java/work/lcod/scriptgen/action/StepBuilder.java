package work.lcod.scriptgen.action;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import work.lcod.scriptgen.schema.BuilderParam;
import work.lcod.scriptgen.schema.Labels;
import work.lcod.scriptgen.schema.ParamSpec;
import work.lcod.scriptgen.schema.SchemaExtractor;

/**
 * Registration descriptor of one step: its id, title, interactive flag, declared parameters and the builder
 * that renders its code. Every step implicitly receives the data context parameter first.
 */
public final class StepBuilder {
    private final String id;
    private final String title;
    private final boolean interactive;
    private final List<BuilderParam> params;
    private final TemplateBuilder builder;

    private StepBuilder(String id, String title, boolean interactive, List<BuilderParam> params, TemplateBuilder builder) {
        this.id = id;
        this.title = title;
        this.interactive = interactive;
        this.params = List.copyOf(params);
        this.builder = builder;
    }

    public static Builder step(String id) {
        return new Builder(id);
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public boolean interactive() {
        return interactive;
    }

    /** Declared parameters, the data context included. */
    public List<BuilderParam> params() {
        return params;
    }

    public boolean hasCode() {
        return builder != null;
    }

    /** Renders the step's code; parameters not supplied fall back to their declared defaults. */
    public String render(Map<String, ?> values) {
        if (builder == null) {
            return "";
        }
        return builder.build(BuilderArgs.bind(params, values));
    }

    public static final class Builder {
        private final String id;
        private String title;
        private boolean interactive;
        private final List<BuilderParam> params = new ArrayList<>();

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id");
            if (id.isBlank()) {
                throw new IllegalArgumentException("Step id must not be blank");
            }
            params.add(BuilderParam.of(SchemaExtractor.CONTEXT_PARAM, Object.class, null));
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder interactive() {
            this.interactive = true;
            return this;
        }

        public Builder param(String name, Type type, Object defaultValue) {
            return add(BuilderParam.of(name, type, defaultValue));
        }

        public Builder param(String name, Type type, Object defaultValue, ParamSpec.Builder meta) {
            return add(BuilderParam.of(name, type, defaultValue).withMeta(meta.toWireMap()));
        }

        /** Declares a parameter whose type is known only by name and resolved when the schema is extracted. */
        public Builder param(String name, String typeName, Object defaultValue) {
            return add(BuilderParam.ofTypeName(name, typeName, defaultValue));
        }

        public Builder param(BuilderParam param) {
            return add(param);
        }

        private Builder add(BuilderParam param) {
            for (BuilderParam existing : params) {
                if (existing.name().equals(param.name())) {
                    throw new IllegalArgumentException("Step '" + id + "' declares parameter '" + param.name() + "' twice");
                }
            }
            params.add(param);
            return this;
        }

        public StepBuilder build(TemplateBuilder builder) {
            return new StepBuilder(id, resolvedTitle(), interactive, params, Objects.requireNonNull(builder, "builder"));
        }

        /** A step that only exists for user interaction and produces no code. */
        public StepBuilder buildWithoutCode() {
            return new StepBuilder(id, resolvedTitle(), interactive, params, null);
        }

        private String resolvedTitle() {
            return title != null ? title : Labels.fromIdentifier(id);
        }
    }
}

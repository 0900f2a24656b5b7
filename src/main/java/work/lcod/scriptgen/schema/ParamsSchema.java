package work.lcod.scriptgen.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered, key-unique map of parameter name to {@link ParamSpec}.
 */
public final class ParamsSchema {
    private static final ParamsSchema EMPTY = new ParamsSchema(Map.of());

    private final Map<String, ParamSpec> specs;

    private ParamsSchema(Map<String, ParamSpec> specs) {
        this.specs = Collections.unmodifiableMap(new LinkedHashMap<>(specs));
    }

    public static ParamsSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ParamsSchema fromWireMap(Map<String, ? extends Map<String, ?>> wire) {
        var builder = builder();
        wire.forEach((name, spec) -> builder.put(name, ParamSpec.fromWireMap(spec)));
        return builder.build();
    }

    public Optional<ParamSpec> get(String name) {
        return Optional.ofNullable(specs.get(name));
    }

    public boolean contains(String name) {
        return specs.containsKey(name);
    }

    public Set<String> names() {
        return specs.keySet();
    }

    public Map<String, ParamSpec> asMap() {
        return specs;
    }

    public int size() {
        return specs.size();
    }

    public boolean isEmpty() {
        return specs.isEmpty();
    }

    /** Name to default value, in declaration order; defaults may be {@code null}. */
    public Map<String, Object> defaults() {
        var out = new LinkedHashMap<String, Object>();
        specs.forEach((name, spec) -> out.put(name, spec.defaultValue()));
        return out;
    }

    public Map<String, Map<String, Object>> toWireMap() {
        var out = new LinkedHashMap<String, Map<String, Object>>();
        specs.forEach((name, spec) -> out.put(name, spec.toWireMap()));
        return out;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ParamsSchema schema && List.copyOf(specs.entrySet()).equals(List.copyOf(schema.specs.entrySet()));
    }

    @Override
    public int hashCode() {
        return specs.hashCode();
    }

    @Override
    public String toString() {
        return "ParamsSchema" + specs;
    }

    public static final class Builder {
        private final Map<String, ParamSpec> specs = new LinkedHashMap<>();

        private Builder() {}

        /** Adds a parameter; names must be unique. */
        public Builder put(String name, ParamSpec spec) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(spec, "spec");
            if (specs.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate parameter '" + name + "'");
            }
            specs.put(name, spec);
            return this;
        }

        public boolean contains(String name) {
            return specs.containsKey(name);
        }

        public ParamsSchema build() {
            return specs.isEmpty() ? EMPTY : new ParamsSchema(specs);
        }
    }
}

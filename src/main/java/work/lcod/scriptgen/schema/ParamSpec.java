package work.lcod.scriptgen.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Widget description of one parameter. {@code type} is one of text/int/float/bool/choice or a custom widget
 * name; optional attributes are {@code null} when absent.
 */
public record ParamSpec(
    String type,
    Object defaultValue,
    String label,
    String description,
    Number min,
    Number max,
    Integer decimals,
    List<Object> choices,
    Boolean nullable,
    Map<String, Object> extras
) {
    private static final Set<String> KNOWN_KEYS = Set.of(
        "type", "default", "label", "description", "min", "max", "decimals", "choices", "nullable"
    );

    public ParamSpec {
        Objects.requireNonNull(type, "type");
        choices = choices == null ? null : Collections.unmodifiableList(new ArrayList<>(choices));
        extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    public static Builder builder(String type) {
        return new Builder().type(type);
    }

    /** Builder without a type, for partial metadata completed by {@link SchemaExtractor}. */
    public static Builder meta() {
        return new Builder();
    }

    public WidgetKind kind() {
        return WidgetKind.of(type);
    }

    public boolean isNullable() {
        return Boolean.TRUE.equals(nullable);
    }

    /** Ordered wire shape: {@code type}, {@code default}, then the optional attributes that are set. */
    public Map<String, Object> toWireMap() {
        var out = new LinkedHashMap<String, Object>();
        out.put("type", type);
        out.put("default", defaultValue);
        putIfSet(out, "label", label);
        putIfSet(out, "description", description);
        putIfSet(out, "min", min);
        putIfSet(out, "max", max);
        putIfSet(out, "decimals", decimals);
        putIfSet(out, "choices", choices);
        putIfSet(out, "nullable", nullable);
        extras.forEach(out::putIfAbsent);
        return out;
    }

    public static ParamSpec fromWireMap(Map<String, ?> wire) {
        Objects.requireNonNull(wire, "wire");
        Object type = wire.get("type");
        if (!(type instanceof String typeName) || typeName.isBlank()) {
            throw new IllegalArgumentException("Parameter spec needs a 'type': " + wire);
        }
        var extras = new LinkedHashMap<String, Object>();
        wire.forEach((key, value) -> {
            if (!KNOWN_KEYS.contains(key)) {
                extras.put(key, value);
            }
        });
        return new ParamSpec(
            typeName,
            wire.get("default"),
            text(wire, "label"),
            text(wire, "description"),
            number(wire, "min"),
            number(wire, "max"),
            wire.get("decimals") instanceof Number n ? n.intValue() : null,
            wire.get("choices") instanceof List<?> list ? new ArrayList<>(list) : null,
            wire.get("nullable") instanceof Boolean b ? b : null,
            extras
        );
    }

    private static String text(Map<String, ?> wire, String key) {
        Object value = wire.get(key);
        return value == null ? null : value.toString();
    }

    private static Number number(Map<String, ?> wire, String key) {
        Object value = wire.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n;
        }
        throw new IllegalArgumentException("'" + key + "' must be a number, got " + value);
    }

    private static void putIfSet(Map<String, Object> out, String key, Object value) {
        if (value != null) {
            out.put(key, value);
        }
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {}

        public Builder type(String type) {
            values.put("type", type);
            return this;
        }

        public Builder defaultValue(Object defaultValue) {
            values.put("default", defaultValue);
            return this;
        }

        public Builder label(String label) {
            values.put("label", label);
            return this;
        }

        public Builder description(String description) {
            values.put("description", description);
            return this;
        }

        public Builder min(Number min) {
            values.put("min", min);
            return this;
        }

        public Builder max(Number max) {
            values.put("max", max);
            return this;
        }

        public Builder decimals(int decimals) {
            values.put("decimals", decimals);
            return this;
        }

        public Builder choices(Object... choices) {
            values.put("choices", Arrays.asList(choices));
            return this;
        }

        public Builder nullable(boolean nullable) {
            values.put("nullable", nullable);
            return this;
        }

        /** The attributes set so far, in wire shape; keys never set are absent. */
        public Map<String, Object> toWireMap() {
            return Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        public ParamSpec build() {
            return fromWireMap(values);
        }
    }
}

package work.lcod.scriptgen.action;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import work.lcod.scriptgen.schema.BuilderParam;
import work.lcod.scriptgen.schema.SchemaExtractor;

/**
 * Arguments handed to a {@link TemplateBuilder}: the supplied values of its declared parameters, with each
 * missing one replaced by the parameter's own default. Coercions follow the script language's {@code float()},
 * {@code int()} and truthiness rules.
 */
public final class BuilderArgs {
    private final Map<String, Object> values;

    private BuilderArgs(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /** Keeps only declared parameters; undeclared entries of {@code params} are dropped. */
    public static BuilderArgs bind(List<BuilderParam> declared, Map<String, ?> params) {
        var values = new LinkedHashMap<String, Object>();
        for (BuilderParam param : declared) {
            if (SchemaExtractor.CONTEXT_PARAM.equals(param.name())) {
                continue;
            }
            if (params != null && params.containsKey(param.name())) {
                values.put(param.name(), params.get(param.name()));
            } else {
                values.put(param.name(), param.defaultValue());
            }
        }
        return new BuilderArgs(values);
    }

    public Map<String, Object> values() {
        return values;
    }

    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("Undeclared builder parameter '" + name + "'");
        }
        return values.get(name);
    }

    public boolean isNull(String name) {
        return get(name) == null;
    }

    public double asDouble(String name) {
        return toDouble(get(name));
    }

    public long asLong(String name) {
        return toLong(get(name));
    }

    public boolean asBool(String name) {
        return truthy(get(name));
    }

    public String asString(String name) {
        Object value = get(name);
        return value == null ? null : value.toString();
    }

    public static double toDouble(Object value) {
        Objects.requireNonNull(value, "Cannot convert None to float");
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: '" + value + "'", e);
        }
    }

    public static long toLong(Object value) {
        Objects.requireNonNull(value, "Cannot convert None to int");
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(value.toString().strip());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: '" + value + "'", e);
        }
    }

    public static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }
}

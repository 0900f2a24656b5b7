package work.lcod.scriptgen.schema;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives a {@link ParamsSchema} from a code builder's declared parameters.
 */
public final class SchemaExtractor {
    /** The data object every builder receives; it never appears in a schema. */
    public static final String CONTEXT_PARAM = "raw";

    private static final Logger LOG = LoggerFactory.getLogger(SchemaExtractor.class);
    private static final Pattern OPTIONAL_NAME = Pattern.compile("(?:java\\.util\\.)?Optional\\s*[\\[<]\\s*(.+?)\\s*[\\]>]");
    private static final Map<String, Class<?>> TYPE_ALIASES = Map.ofEntries(
        Map.entry("float", Double.class),
        Map.entry("double", Double.class),
        Map.entry("int", Long.class),
        Map.entry("long", Long.class),
        Map.entry("short", Long.class),
        Map.entry("byte", Long.class),
        Map.entry("bool", Boolean.class),
        Map.entry("boolean", Boolean.class),
        Map.entry("str", String.class),
        Map.entry("string", String.class)
    );

    private SchemaExtractor() {}

    public static ParamsSchema extract(List<BuilderParam> params) {
        var schema = ParamsSchema.builder();
        for (BuilderParam param : params) {
            if (CONTEXT_PARAM.equals(param.name())) {
                continue;
            }
            Object defaultValue = normalizeDefault(param.defaultValue());
            ParamSpec spec;
            if (param.hasMeta()) {
                var wire = new LinkedHashMap<String, Object>(param.meta());
                if (!wire.containsKey("type")) {
                    wire.put("type", inferType(param));
                }
                if (!param.meta().containsKey("default")) {
                    wire.put("default", defaultValue);
                }
                spec = ParamSpec.fromWireMap(wire);
            } else {
                spec = ParamSpec.builder(inferType(param)).defaultValue(defaultValue).build();
            }
            schema.put(param.name(), spec);
        }
        return schema.build();
    }

    /** Container defaults are dropped so that schemas never share mutable values. */
    static Object normalizeDefault(Object value) {
        if (value instanceof Collection || value instanceof Map || (value != null && value.getClass().isArray())) {
            return null;
        }
        return value;
    }

    static String inferType(BuilderParam param) {
        if (param.type() != null) {
            return widgetFor(unwrapOptional(param.type()));
        }
        if (param.typeName() == null || param.typeName().isBlank()) {
            return "text";
        }
        return resolve(param.name(), param.typeName().strip()).map(SchemaExtractor::widgetFor).orElse("text");
    }

    private static Optional<Type> resolve(String paramName, String typeName) {
        var optional = OPTIONAL_NAME.matcher(typeName);
        String inner = optional.matches() ? optional.group(1) : typeName;
        Class<?> alias = TYPE_ALIASES.get(inner);
        if (alias != null) {
            return Optional.of(alias);
        }
        try {
            return Optional.of(Class.forName(inner));
        } catch (ClassNotFoundException | LinkageError e) {
            LOG.warn("Cannot resolve type '{}' of parameter '{}'; falling back to text", typeName, paramName);
            return Optional.empty();
        }
    }

    private static Type unwrapOptional(Type type) {
        if (type instanceof ParameterizedType parameterized && parameterized.getRawType() == Optional.class) {
            return parameterized.getActualTypeArguments()[0];
        }
        if (type == OptionalDouble.class) {
            return Double.class;
        }
        if (type == OptionalInt.class || type == OptionalLong.class) {
            return Long.class;
        }
        return type;
    }

    private static String widgetFor(Type type) {
        if (!(type instanceof Class<?> cls)) {
            return "text";
        }
        if (cls == Double.class || cls == double.class || cls == Float.class || cls == float.class || cls == BigDecimal.class) {
            return "float";
        }
        if (cls == Long.class || cls == long.class || cls == Integer.class || cls == int.class || cls == Short.class
            || cls == short.class || cls == Byte.class || cls == byte.class || cls == BigInteger.class) {
            return "int";
        }
        if (cls == Boolean.class || cls == boolean.class) {
            return "bool";
        }
        return "text";
    }
}

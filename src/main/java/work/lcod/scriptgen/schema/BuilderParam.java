package work.lcod.scriptgen.schema;

import java.lang.reflect.Type;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One declared parameter of a code builder: its name, a declared type (a reflective {@link Type} or a type name
 * resolved lazily), an optional default and optional explicit widget metadata in wire shape.
 */
public record BuilderParam(String name, Type type, String typeName, Object defaultValue, Map<String, Object> meta) {
    public BuilderParam {
        Objects.requireNonNull(name, "name");
        meta = meta == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
    }

    public static BuilderParam of(String name, Type type, Object defaultValue) {
        return new BuilderParam(name, type, null, defaultValue, null);
    }

    public static BuilderParam ofTypeName(String name, String typeName, Object defaultValue) {
        return new BuilderParam(name, null, typeName, defaultValue, null);
    }

    public BuilderParam withMeta(Map<String, Object> metadata) {
        return new BuilderParam(name, type, typeName, defaultValue, metadata);
    }

    public boolean hasMeta() {
        return meta != null;
    }
}

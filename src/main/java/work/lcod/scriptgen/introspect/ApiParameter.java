package work.lcod.scriptgen.introspect;

import java.util.Objects;

/**
 * One parameter of a catalogued callable. {@code hasDefault} separates "no default" from an explicit
 * {@code null} default.
 */
public record ApiParameter(String name, Kind kind, boolean hasDefault, Object defaultValue) {
    public ApiParameter {
        Objects.requireNonNull(name, "name");
        kind = kind == null ? Kind.POSITIONAL : kind;
    }

    public boolean isVariadic() {
        return kind == Kind.VAR_POSITIONAL || kind == Kind.VAR_KEYWORD;
    }

    public enum Kind {
        POSITIONAL,
        KEYWORD_ONLY,
        VAR_POSITIONAL,
        VAR_KEYWORD
    }
}

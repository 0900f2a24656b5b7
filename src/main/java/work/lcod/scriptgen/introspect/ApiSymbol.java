package work.lcod.scriptgen.introspect;

import java.util.List;
import java.util.Objects;

/** A module, class or function of the external API; a class's parameters are those of its constructor. */
public record ApiSymbol(String path, Kind kind, List<ApiParameter> parameters) {
    public ApiSymbol {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public boolean isCallable() {
        return kind != Kind.MODULE;
    }

    public enum Kind {
        MODULE,
        CLASS,
        FUNCTION
    }
}

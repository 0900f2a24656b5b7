package work.lcod.scriptgen.ir;

import java.util.List;
import java.util.Objects;

/**
 * A parsed {@code def name(params): body} definition. Parameter names are kept in declaration order, without
 * annotations, defaults or star markers.
 */
public record FunctionDef(String name, List<String> params, List<Stmt> body) {
    public FunctionDef {
        Objects.requireNonNull(name, "name");
        params = List.copyOf(params);
        body = List.copyOf(body);
    }
}

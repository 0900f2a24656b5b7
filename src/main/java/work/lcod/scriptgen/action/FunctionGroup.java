package work.lcod.scriptgen.action;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * An external call, identified by its dotted path, with the keyword arguments the primary schema owns.
 */
public record FunctionGroup(String dottedPath, Set<String> ownedParams) {
    public FunctionGroup {
        Objects.requireNonNull(dottedPath, "dottedPath");
        if (dottedPath.isBlank()) {
            throw new IllegalArgumentException("Function group needs a dotted path");
        }
        ownedParams = ownedParams == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(ownedParams));
    }

    public boolean owns(String param) {
        return ownedParams.contains(param);
    }
}

package work.lcod.scriptgen.action;

import java.util.Map;

/**
 * Produces code for a single-step action from its parameters and advanced keyword arguments.
 */
@FunctionalInterface
public interface ActionCodeBuilder {
    String build(Map<String, ?> params, Map<String, ? extends Map<String, ?>> advanced);
}

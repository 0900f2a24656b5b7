package work.lcod.scriptgen.action;

import java.util.Map;

/**
 * Produces code for a single step from a parameter map.
 */
@FunctionalInterface
public interface CodeBuilder {
    String build(Map<String, ?> params);
}

package work.lcod.scriptgen.action;

import java.util.List;
import java.util.Map;

/**
 * Supplies an action's step builders and, for single-step actions, the external calls whose keyword arguments
 * the schema owns.
 */
public interface TemplateProvider {

    List<StepBuilder> provideBuilders();

    /** Dotted call path to owned parameter names, in declaration order. */
    default Map<String, List<String>> primaryParams() {
        return Map.of();
    }
}

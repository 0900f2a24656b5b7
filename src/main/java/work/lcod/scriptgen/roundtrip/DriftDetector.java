package work.lcod.scriptgen.roundtrip;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import work.lcod.scriptgen.action.ActionDefinition;

/**
 * Decides whether a block was edited by hand: it has drifted when its structure differs from the code the
 * definition renders for the parameters recovered from it.
 */
public final class DriftDetector {
    private static final Logger LOG = LoggerFactory.getLogger(DriftDetector.class);

    private DriftDetector() {}

    public static boolean isDrifted(ActionDefinition definition, String block, Map<String, ?> params,
                                    Map<String, ? extends Map<String, ?>> advanced) {
        String regenerated;
        try {
            regenerated = definition.buildCode(params, advanced == null || advanced.isEmpty() ? null : advanced);
        } catch (RuntimeException e) {
            LOG.warn("Cannot regenerate '{}' from recovered parameters, keeping the block as written: {}",
                definition.id(), e.getMessage());
            return true;
        }
        return !StructureSignature.of(block).equals(StructureSignature.of(regenerated));
    }
}

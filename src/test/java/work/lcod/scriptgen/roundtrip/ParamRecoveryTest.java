package work.lcod.scriptgen.roundtrip;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.scriptgen.action.FunctionGroup;
import work.lcod.scriptgen.action.TemplateSchema;

class ParamRecoveryTest {
    private static final TemplateSchema FILTER = TemplateSchema.ofGroups(List.of(
        new FunctionGroup("raw.filter", Set.of("l_freq", "h_freq"))));

    @Test
    void readsOwnedLiteralKeywords() {
        var params = ParamRecovery.recoverParams(FILTER, "raw.filter(l_freq=2.0, h_freq=None, method='iir')",
            Map.of("l_freq", 0.5, "h_freq", 45.0, "other", 1));
        assertEquals(2.0, params.get("l_freq"));
        assertTrue(params.containsKey("h_freq"));
        assertEquals(null, params.get("h_freq"));
        assertEquals(1, params.get("other"));
    }

    @Test
    void keepsDefaultsForNonLiterals() {
        var params = ParamRecovery.recoverParams(FILTER, "raw.filter(l_freq=low, h_freq=-3)", Map.of("l_freq", 0.5));
        assertEquals(0.5, params.get("l_freq"));
        assertEquals(-3L, params.get("h_freq"));
    }

    @Test
    void consultsOnlyTheFirstMatchingCall() {
        String code = "raw.filter(l_freq=1.0)\nraw.filter(l_freq=9.0, h_freq=99.0, pad='edge')";
        var params = ParamRecovery.recoverParams(FILTER, code, Map.of());
        assertEquals(Map.of("l_freq", 1.0), params);
        assertEquals(Map.of(), ParamRecovery.recoverAdvanced(FILTER, code));
    }

    @Test
    void collectsAdvancedKeywords() {
        var advanced = ParamRecovery.recoverAdvanced(FILTER, "x = raw.filter(l_freq=1.0, method='iir', picks=sel, **extra)");
        assertEquals(Map.of("raw.filter", Map.of("method", "iir")), advanced);
    }

    @Test
    void unparsableCodeYieldsDefaults() {
        assertEquals(Map.of("l_freq", 0.5), ParamRecovery.recoverParams(FILTER, "raw.filter(l_freq=", Map.of("l_freq", 0.5)));
        assertTrue(ParamRecovery.recoverAdvanced(FILTER, "raw.filter(l_freq=").isEmpty());
    }

    @Test
    void recoveringRenderedCodeIsIdempotent() {
        String code = "raw.filter(l_freq=1.5, h_freq=35.0)";
        var once = ParamRecovery.recoverParams(FILTER, code, Map.of());
        var twice = ParamRecovery.recoverParams(FILTER, code, once);
        assertEquals(once, twice);
    }
}

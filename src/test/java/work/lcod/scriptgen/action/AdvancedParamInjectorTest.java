package work.lcod.scriptgen.action;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;
import work.lcod.scriptgen.support.LogCapture;

class AdvancedParamInjectorTest {
    @Test
    void appendsAbsentKeywordsOnly() {
        var extra = new LinkedHashMap<String, Object>();
        extra.put("l_freq", 3.0);
        extra.put("method", "iir");
        String code = AdvancedParamInjector.inject("raw.filter(l_freq=1.0, h_freq=40.0)", Map.of("raw.filter", extra));
        assertEquals("raw.filter(l_freq=1.0, h_freq=40.0, method='iir')", code);
    }

    @Test
    void matchesDottedPathsExactly() {
        String code = "raw.filter(1.0)\nother.raw.filter(2.0)\nfilter(3.0)";
        String injected = AdvancedParamInjector.inject(code, Map.of("raw.filter", Map.of("pad", "edge")));
        assertEquals("raw.filter(1.0, pad='edge')\nother.raw.filter(2.0)\nfilter(3.0)", injected);
    }

    @Test
    void reachesNestedCalls() {
        String code = "ica = mne.preprocessing.ICA(n_components=5)";
        String injected = AdvancedParamInjector.inject(code, Map.of("mne.preprocessing.ICA", Map.of("max_iter", 500)));
        assertEquals("ica = mne.preprocessing.ICA(n_components=5, max_iter=500)", injected);
    }

    @Test
    void leavesUnparsableCodeAlone() {
        try (var logs = LogCapture.of(AdvancedParamInjector.class)) {
            String code = "raw.filter(1.0";
            assertEquals(code, AdvancedParamInjector.inject(code, Map.of("raw.filter", Map.of("pad", "edge"))));
            assertTrue(logs.hasEvent(Level.WARN, "does not parse"));
        }
    }

    @Test
    void returnsCodeUntouchedWhenNothingMatches() {
        String code = "raw.filter(l_freq = 1.0)";
        assertEquals(code, AdvancedParamInjector.inject(code, Map.of("raw.resample", Map.of("npad", "auto"))));
    }
}

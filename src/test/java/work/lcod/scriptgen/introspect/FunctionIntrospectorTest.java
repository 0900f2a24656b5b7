package work.lcod.scriptgen.introspect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;

import work.lcod.scriptgen.schema.ParamSpec;
import work.lcod.scriptgen.schema.ParamsSchema;
import work.lcod.scriptgen.support.LogCapture;

class FunctionIntrospectorTest {
    private final FunctionIntrospector introspector = new FunctionIntrospector(ApiCatalog.bundled());

    @Test
    void listsKeywordsNotOwnedByTheAction() {
        ParamsSchema schema = introspector.advancedParams("raw.filter", Set.of("l_freq", "h_freq"));

        assertFalse(schema.contains("self"));
        assertFalse(schema.contains("l_freq"));
        assertFalse(schema.contains("h_freq"));
        assertFalse(schema.contains("n_jobs"));
        assertFalse(schema.contains("verbose"));

        ParamSpec picks = schema.get("picks").orElseThrow();
        assertEquals("text", picks.type());
        assertNull(picks.defaultValue());
        assertTrue(picks.isNullable());

        ParamSpec method = schema.get("method").orElseThrow();
        assertEquals("text", method.type());
        assertEquals("fir", method.defaultValue());
        assertEquals("Method", method.label());

        assertEquals("['edge', 'bad_acq_skip']", schema.get("skip_by_annotation").orElseThrow().defaultValue());
        assertEquals(List.of("picks", "filter_length"), List.copyOf(schema.names()).subList(0, 2));
    }

    @Test
    void resolvesClassConstructors() {
        ParamsSchema schema = introspector.advancedParams("ica", Set.of("n_components"));

        assertEquals("fastica", schema.get("method").orElseThrow().defaultValue());
        assertEquals("bool", schema.get("allow_ref_meg").orElseThrow().type());
        assertFalse(schema.contains("n_components"));
    }

    @Test
    void skipsVariadicParameters() {
        ParamsSchema schema = introspector.advancedParams("ica.plot_components", Set.of());

        assertFalse(schema.contains("args"));
        assertFalse(schema.contains("kwargs"));
        assertTrue(schema.contains("show"));
    }

    @Test
    void unresolvedPathsGiveAnEmptySchema() {
        try (var logs = LogCapture.of(FunctionIntrospector.class)) {
            assertTrue(introspector.advancedParams("raw.no_such", Set.of()).isEmpty());
            assertTrue(logs.hasEvent(Level.WARN, "raw.no_such"));
        }
        assertTrue(introspector.advancedParams("numpy.mean", Set.of()).isEmpty());
        assertTrue(introspector.advancedParams("", Set.of()).isEmpty());
    }

    @Test
    void modulesAreNotCallable() {
        assertTrue(introspector.advancedParams("mne", Set.of()).isEmpty());
    }

    @Test
    void infersWidgetsFromDefaults() {
        ParamSpec required = FunctionIntrospector.inferSpec(new ApiParameter("sfreq", ApiParameter.Kind.POSITIONAL, false, null));
        assertEquals("text", required.type());
        assertEquals("", required.defaultValue());
        assertTrue(required.isNullable());
        assertEquals("Sfreq", required.label());

        ParamSpec flag = FunctionIntrospector.inferSpec(new ApiParameter("reset_bads", ApiParameter.Kind.POSITIONAL, true, true));
        assertEquals("bool", flag.type());
        assertEquals(true, flag.defaultValue());

        ParamSpec count = FunctionIntrospector.inferSpec(new ApiParameter("l_freq", ApiParameter.Kind.POSITIONAL, true, 7));
        assertEquals("int", count.type());
        assertEquals(-999999, count.min().intValue());
        assertEquals(999999, count.max().intValue());
        assertEquals("L Freq", count.label());

        ParamSpec ratio = FunctionIntrospector.inferSpec(new ApiParameter("threshold", ApiParameter.Kind.POSITIONAL, true, 0.5));
        assertEquals("float", ratio.type());
        assertEquals(0.5, ratio.defaultValue());

        ParamSpec list = FunctionIntrospector.inferSpec(new ApiParameter("exclude", ApiParameter.Kind.POSITIONAL, true, List.of()));
        assertEquals("text", list.type());
        assertEquals("[]", list.defaultValue());
    }
}

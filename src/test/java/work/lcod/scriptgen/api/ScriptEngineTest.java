package work.lcod.scriptgen.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import work.lcod.scriptgen.codegen.ActionConfig;
import work.lcod.scriptgen.schema.ParamsSchema;

class ScriptEngineTest {
    private final ScriptEngine engine = ScriptEngine.create(EngineConfiguration.defaults());

    @Test
    void generatesAndParsesWithBuiltinActions() {
        String script = engine.generate("rest.fif", List.of(
            new ActionConfig("filter", Map.of("l_freq", 1.0, "h_freq", 30.0)),
            new ActionConfig("resample", Map.of("sfreq", 128.0))
        ));

        assertTrue(script.contains("raw = load_raw_data('rest.fif', preload=True)"));
        var actions = engine.parse(script);
        assertEquals(List.of("filter", "resample"), actions.stream().map(ActionConfig::actionId).toList());
        assertEquals(30.0, actions.get(0).params().get("h_freq"));
        assertEquals(128.0, actions.get(1).params().get("sfreq"));
    }

    @Test
    void advancedParamsOfAnActionLeaveOutItsOwnParameters() {
        var definition = engine.registry().byId("filter").orElseThrow();

        Map<String, ParamsSchema> groups = engine.advancedParams(definition);

        assertEquals(Set.of("raw.filter"), groups.keySet());
        ParamsSchema schema = groups.get("raw.filter");
        assertFalse(schema.contains("l_freq"));
        assertFalse(schema.contains("h_freq"));
        assertTrue(schema.contains("method"));
    }

    @Test
    void advancedParamsOfAPath() {
        ParamsSchema schema = engine.advancedParams("raw.resample", Set.of("sfreq"));

        assertEquals("auto", schema.get("npad").orElseThrow().defaultValue());
        assertFalse(schema.contains("sfreq"));
    }

    @Test
    void parsesLogLevels() {
        assertEquals(LogLevel.DEBUG, LogLevel.from(" debug "));
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals(LogLevel.FATAL, LogLevel.from("FATAL"));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
    }

    @Test
    void configurationDefaultsToBundledFiles() {
        var configuration = EngineConfiguration.builder().logLevel(null).build();

        assertTrue(configuration.settingsFile().isEmpty());
        assertTrue(configuration.apiCatalog().isEmpty());
        assertTrue(configuration.logLevel().isEmpty());
    }
}

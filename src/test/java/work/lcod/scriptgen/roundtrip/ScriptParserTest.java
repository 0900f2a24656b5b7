package work.lcod.scriptgen.roundtrip;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.scriptgen.action.ActionRegistry;
import work.lcod.scriptgen.actions.BuiltinActions;
import work.lcod.scriptgen.codegen.ActionConfig;
import work.lcod.scriptgen.codegen.ScriptGenerator;
import work.lcod.scriptgen.codegen.ScriptSettings;

class ScriptParserTest {
    private final ActionRegistry registry = BuiltinActions.registry();
    private final ScriptGenerator generator = new ScriptGenerator(registry, ScriptSettings.defaults());
    private final ScriptParser parser = new ScriptParser(registry);

    @Test
    void readsBackGeneratedPipeline() {
        var filter = new ActionConfig("filter", Map.of("l_freq", 1.0, "h_freq", 40.0));
        filter.setAdvancedParams(Map.of("raw.filter", Map.of("method", "iir")));
        String script = generator.generate("sub-01.fif", List.of(
            new ActionConfig("notch"),
            filter,
            new ActionConfig("reference", Map.of("ref_channels", "REST")),
            new ActionConfig("set_channel_types", Map.of("channel_mapping", "Fp1:eog")),
            new ActionConfig("drop_channels", Map.of("channels", List.of("T7"), "mode", "drop"))
        ));

        var actions = parser.parse(script);

        assertEquals(List.of("notch", "filter", "reference", "set_channel_types", "drop_channels"),
            actions.stream().map(ActionConfig::actionId).toList());
        actions.forEach(action -> assertFalse(action.isCustom(), action.actionId()));

        assertEquals(List.of(50.0, 100.0, 150.0), actions.get(0).params().get("freqs"));
        assertEquals(3, actions.get(0).params().get("harmonics"));
        assertEquals(1.0, actions.get(1).params().get("l_freq"));
        assertEquals(40.0, actions.get(1).params().get("h_freq"));
        assertEquals(Map.of("raw.filter", Map.of("method", "iir")), actions.get(1).advancedParams());
        assertEquals("REST", actions.get(2).params().get("ref_channels"));
        assertEquals(false, actions.get(2).params().get("projection"));
        assertEquals(Map.of("Fp1", "eog"), actions.get(3).params().get("channel_mapping"));
        assertEquals(List.of("T7"), actions.get(4).params().get("channels"));
        assertEquals("drop", actions.get(4).params().get("mode"));
    }

    @Test
    void regeneratesTheSameScript() {
        String script = generator.generate("sub-01.fif", List.of(
            new ActionConfig("notch", Map.of("freqs", 60.0, "harmonics", 2)),
            new ActionConfig("resample", Map.of("sfreq", 200.0)),
            new ActionConfig("interpolate")
        ));
        assertEquals(script, generator.generate("sub-01.fif", parser.parse(script)));
    }

    @Test
    void readsEditedValues() {
        String script = "# In[1] Bandpass Filter\nraw.filter(l_freq=0.1, h_freq=None)\n# End[1]\n";
        var action = parser.parse(script).get(0);
        assertFalse(action.isCustom());
        assertEquals(0.1, action.params().get("l_freq"));
        assertTrue(action.params().containsKey("h_freq"));
        assertEquals(null, action.params().get("h_freq"));
    }

    @Test
    void keepsHandEditedBlocksAsCustomCode() {
        String block = "raw.filter(l_freq=1.0, h_freq=40.0)\nraw.pick('eeg')";
        var action = parser.parse("# In[1] Bandpass Filter\n" + block + "\n# End[1]").get(0);
        assertEquals("filter", action.actionId());
        assertTrue(action.isCustom());
        assertEquals(block, action.customCode());
        assertEquals(block, generator.generateActionCode(action));
    }

    @Test
    void unknownTitlesBecomeCustomActions() {
        var action = parser.parse("# In[1] My analysis\nx = compute(raw)\n# End[1]").get(0);
        assertEquals("custom", action.actionId());
        assertTrue(action.isCustom());
        assertEquals("My analysis", action.titleOverride());
        assertEquals("x = compute(raw)", action.customCode());
    }

    @Test
    void readsMultistepActionsStepByStep() {
        var ica = registry.byId("ica").orElseThrow();
        var params = new HashMap<String, Object>(ica.defaultParams());
        params.put("n_components", 15);
        params.put("method", "fastica");
        params.put("enable_eog", false);
        params.put("ecg_threshold", 0.3);
        String script = generator.generate(null, List.of(new ActionConfig("ica", params)));

        var action = parser.parse(script).get(0);

        assertEquals("ica", action.actionId());
        assertFalse(action.isCustom());
        assertEquals(15L, action.params().get("n_components"));
        assertEquals("fastica", action.params().get("method"));
        assertEquals(false, action.params().get("enable_eog"));
        assertEquals(true, action.params().get("enable_ecg"));
        assertEquals(0.3, action.params().get("ecg_threshold"));
        assertEquals(0.9, action.params().get("muscle_threshold"));
    }

    @Test
    void editedMultistepBlockIsKeptVerbatim() {
        String script = generator.generate(null, List.of(new ActionConfig("ica")))
            .replace("ica.fit(raw)", "ica.fit(raw)\nica.save('ica.fif')");
        var action = parser.parse(script).get(0);
        assertTrue(action.isCustom());
        assertTrue(action.customCode().contains("ica.save('ica.fif')"));
    }
}

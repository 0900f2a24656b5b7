package work.lcod.scriptgen.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.scriptgen.actions.BuiltinActions;

class ScriptGeneratorTest {
    private final ScriptGenerator generator = new ScriptGenerator(BuiltinActions.registry(), ScriptSettings.defaults());

    @Test
    void rendersActionFromDefaultsAndParams() {
        assertEquals("raw.filter(l_freq=1.0, h_freq=45.0)",
            generator.generateActionCode(new ActionConfig("filter", Map.of("l_freq", 1.0))));
    }

    @Test
    void injectsAdvancedParams() {
        var config = new ActionConfig("resample", Map.of("sfreq", 200.0));
        config.setAdvancedParams(Map.of("raw.resample", Map.of("npad", "auto")));
        assertEquals("raw.resample(sfreq=200.0, npad='auto')", generator.generateActionCode(config));
    }

    @Test
    void emitsCustomCodeVerbatim() {
        var config = new ActionConfig("filter");
        config.setCustomCode("raw.filter(1, 30)  # tuned by hand");
        assertEquals("raw.filter(1, 30)  # tuned by hand", generator.generateActionCode(config));

        var flagged = new ActionConfig("filter");
        flagged.setCustom(true);
        assertEquals("", generator.generateActionCode(flagged));
        assertEquals("", generator.generateActionCode(new ActionConfig("no_such_action")));
    }

    @Test
    void generatesCompleteScript() {
        var custom = ActionConfig.custom("custom", Map.of(), "import scipy.signal\nfrom mne import pick_types\npicks = pick_types(raw.info)");
        custom.setTitleOverride("Pick EEG");
        String script = generator.generate("data/sub-01.fif", List.of(
            new ActionConfig("notch"),
            new ActionConfig("filter", Map.of("l_freq", 1.0, "h_freq", 40.0)),
            custom
        ));

        assertTrue(script.startsWith("\"\"\"EEG preprocessing pipeline.\"\"\"\n\n"
            + "import mne\nimport numpy as np\nimport scipy.signal\n"
            + "from mne import pick_types\nfrom pipeline_runtime.io import load_raw_data\n\n"
            + "raw = load_raw_data('data/sub-01.fif', preload=True)\n\n"), script);
        assertTrue(script.contains(String.join("\n",
            "# ACTIONS_START",
            "# In[1] Notch Filter",
            "raw.notch_filter(freqs=[50.0, 100.0, 150.0])",
            "# End[1]",
            "",
            "# In[2] Bandpass Filter",
            "raw.filter(l_freq=1.0, h_freq=40.0)",
            "# End[2]",
            "",
            "# In[3] Pick EEG",
            "picks = pick_types(raw.info)",
            "# End[3]",
            "",
            "# ACTIONS_END",
            "",
            "# Save result")), script);
    }

    @Test
    void keepsMultistepCodeIntact() {
        String script = generator.generate(null, List.of(new ActionConfig("ica")));
        assertTrue(script.contains("# raw = load_raw_data('your_file.fif', preload=True)"));
        assertTrue(script.contains("# In[1] ICA\n# Step[fit] Fit ICA\n"));
        assertTrue(script.contains("# Step[classify] Classify Components\nfrom pipeline_runtime.ica import channel_meta, iclabel_exclusions, run_detector"));
        assertTrue(script.indexOf("from pipeline_runtime.ica") > script.indexOf("# ACTIONS_START"));
    }

    @Test
    void rejectsInvalidBaseImports() {
        var settings = new ScriptSettings(List.of("import ("), "work/lcod/scriptgen/codegen/default_script.py",
            "load_raw_data", "raw", "# raw = ...", null);
        var broken = new ScriptGenerator(BuiltinActions.registry(), settings);
        assertThrows(IllegalStateException.class, () -> broken.generate(null, List.of()));
    }

    @Test
    void failsOnMissingLayout() {
        var settings = new ScriptSettings(List.of("import mne"), "no/such/layout.py", "load_raw_data", "raw", "#", null);
        var broken = new ScriptGenerator(BuiltinActions.registry(), settings);
        var error = assertThrows(IllegalStateException.class, () -> broken.generate(null, List.of()));
        assertTrue(error.getMessage().contains("no/such/layout.py"));
    }
}

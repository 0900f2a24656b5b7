package work.lcod.scriptgen.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScriptSettingsTest {
    @Test
    void loadsBundledDefaults() {
        var settings = ScriptSettings.defaults();
        assertEquals(List.of("import mne", "import numpy as np", "from pipeline_runtime.io import load_raw_data"),
            settings.baseImports());
        assertEquals("load_raw_data", settings.loadFunction());
        assertEquals("raw", settings.loadTarget());
        assertTrue(settings.readLayout().contains("# ACTIONS_START"));
    }

    @Test
    void layersUserFileOverDefaults(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("layout.py"), "# IMPORTS\n# LOAD_DATA\n# ACTIONS_START\n# ACTIONS_END\n");
        Path file = dir.resolve("scriptgen.toml");
        Files.writeString(file, """
            [script]
            base_imports = ["import mne"]
            layout = "layout.py"
            load_target = "recording"
            """);

        var settings = ScriptSettings.load(file);
        assertEquals(List.of("import mne"), settings.baseImports());
        assertEquals("recording", settings.loadTarget());
        assertEquals("load_raw_data", settings.loadFunction());
        assertTrue(settings.readLayout().startsWith("# IMPORTS"));

        var generator = new ScriptGenerator(work.lcod.scriptgen.actions.BuiltinActions.registry(), settings);
        assertEquals("import mne\nrecording = load_raw_data('a.fif', preload=True)\n# ACTIONS_START\n# ACTIONS_END\n",
            generator.generate("a.fif", List.of()));
    }

    @Test
    void rejectsMalformedToml(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("bad.toml");
        Files.writeString(file, "[script\nlayout = ");
        assertThrows(IllegalArgumentException.class, () -> ScriptSettings.load(file));
    }
}

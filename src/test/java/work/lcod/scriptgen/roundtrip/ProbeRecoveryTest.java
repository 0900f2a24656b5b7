package work.lcod.scriptgen.roundtrip;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import work.lcod.scriptgen.action.BuilderArgs;
import work.lcod.scriptgen.ir.SourceParser;
import work.lcod.scriptgen.schema.ParamSpec;
import work.lcod.scriptgen.schema.ParamsSchema;
import work.lcod.scriptgen.template.Template;

class ProbeRecoveryTest {
    private static final Template EPOCHS = Template.extract("""
        def _epochs(raw, tmin=-0.2, baseline=True, label='stim'):
            events = mne.find_events(raw, stim_channel=label)
            epochs = mne.Epochs(raw, events, tmin=tmin, baseline=None)
            if baseline:
                epochs.apply_baseline((None, 0))
        """);

    private static final ParamsSchema SCHEMA = ParamsSchema.builder()
        .put("tmin", ParamSpec.builder("float").defaultValue(-0.2).build())
        .put("baseline", ParamSpec.builder("bool").defaultValue(true).build())
        .put("label", ParamSpec.builder("text").defaultValue("stim").build())
        .build();

    private static final Function<Map<String, Object>, String> RENDER = values -> {
        var substitutions = new LinkedHashMap<String, Object>();
        substitutions.put("tmin", BuilderArgs.toDouble(values.get("tmin")));
        substitutions.put("baseline", BuilderArgs.truthy(values.get("baseline")));
        substitutions.put("label", values.get("label"));
        return EPOCHS.inline(substitutions);
    };

    @Test
    void recoversValuesNoGroupOwns() {
        String block = "events = mne.find_events(raw, stim_channel='STI 014')\n"
            + "epochs = mne.Epochs(raw, events, tmin=-0.5, baseline=None)";
        var values = ProbeRecovery.recover(SCHEMA, Set.of(), SCHEMA.defaults(), block, RENDER);
        assertEquals(false, values.get("baseline"));
        assertEquals(-0.5, values.get("tmin"));
        assertEquals("STI 014", values.get("label"));
    }

    @Test
    void leavesSkippedNamesAlone() {
        String block = "events = mne.find_events(raw, stim_channel='STI 014')\n"
            + "epochs = mne.Epochs(raw, events, tmin=-0.5, baseline=None)\n"
            + "epochs.apply_baseline((None, 0))";
        var values = ProbeRecovery.recover(SCHEMA, Set.of("tmin"), SCHEMA.defaults(), block, RENDER);
        assertEquals(-0.2, values.get("tmin"));
        assertEquals(true, values.get("baseline"));
        assertEquals("STI 014", values.get("label"));
    }

    @Test
    void keepsCurrentValuesWhenTheBlockHasAnotherShape() {
        var values = ProbeRecovery.recover(SCHEMA, Set.of(), SCHEMA.defaults(), "print('edited')", RENDER);
        assertEquals(SCHEMA.defaults(), values);
    }

    @Test
    void rejectsValuesOfTheWrongKind() {
        var choice = ParamSpec.builder("choice").choices("average", "REST").build();
        assertTrue(ProbeRecovery.accepts(choice, "REST"));
        assertFalse(ProbeRecovery.accepts(choice, "other"));
        assertFalse(ProbeRecovery.accepts(ParamSpec.builder("int").build(), "3"));
        assertFalse(ProbeRecovery.accepts(ParamSpec.builder("float").build(), null));
        assertTrue(ProbeRecovery.accepts(ParamSpec.builder("float").nullable(true).build(), null));
    }

    @Test
    void reportsOutermostDifferences() {
        var a = SourceParser.parseStatements("f(x=1, y=[1, 2])");
        var b = SourceParser.parseStatements("f(x=1, y=[1, 3])");
        assertEquals(1, ProbeRecovery.differences(a, b).size());
        assertEquals(List.of(), ProbeRecovery.differences(a, a));
    }
}

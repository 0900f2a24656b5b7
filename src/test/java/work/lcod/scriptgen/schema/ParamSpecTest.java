package work.lcod.scriptgen.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ParamSpecTest {
    @Test
    void writesWireKeysInOrder() {
        var spec = ParamSpec.builder("float").defaultValue(50).label("Frequency (Hz)").min(1).max(500).build();
        assertEquals(List.of("type", "default", "label", "min", "max"), List.copyOf(spec.toWireMap().keySet()));
    }

    @Test
    void keepsUnknownWireKeysAsExtras() {
        var wire = new LinkedHashMap<String, Object>();
        wire.put("type", "choice");
        wire.put("default", "average");
        wire.put("choices", List.of("average", "REST"));
        wire.put("group", "advanced");
        var spec = ParamSpec.fromWireMap(wire);
        assertEquals(WidgetKind.CHOICE, spec.kind());
        assertEquals(Map.of("group", "advanced"), spec.extras());
        assertEquals(wire, spec.toWireMap());
    }

    @Test
    void requiresAType() {
        assertThrows(IllegalArgumentException.class, () -> ParamSpec.fromWireMap(Map.of("default", 1)));
    }

    @Test
    void rejectsDuplicateNames() {
        var builder = ParamsSchema.builder().put("a", ParamSpec.builder("int").build());
        assertThrows(IllegalArgumentException.class, () -> builder.put("a", ParamSpec.builder("text").build()));
    }

    @Test
    void derivesLabelsFromIdentifiers() {
        assertEquals("L Freq", Labels.fromIdentifier("l_freq"));
        assertEquals("Fit", Labels.fromIdentifier("fit"));
    }
}

package work.lcod.scriptgen.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;
import work.lcod.scriptgen.support.LogCapture;

class SchemaExtractorTest {
    @Test
    void infersWidgetsFromDeclaredTypes() {
        var schema = SchemaExtractor.extract(List.of(
            BuilderParam.of("raw", Object.class, null),
            BuilderParam.of("sfreq", Double.class, 250.0),
            BuilderParam.of("n", int.class, 3),
            BuilderParam.of("projection", Boolean.class, false),
            BuilderParam.of("name", String.class, "x"),
            BuilderParam.ofTypeName("l_freq", "Optional[float]", 0.5),
            BuilderParam.ofTypeName("limit", "Optional<int>", null)
        ));
        assertFalse(schema.contains("raw"));
        assertEquals(List.of("sfreq", "n", "projection", "name", "l_freq", "limit"), List.copyOf(schema.names()));
        assertEquals("float", schema.get("sfreq").orElseThrow().type());
        assertEquals("int", schema.get("n").orElseThrow().type());
        assertEquals("bool", schema.get("projection").orElseThrow().type());
        assertEquals("text", schema.get("name").orElseThrow().type());
        assertEquals("float", schema.get("l_freq").orElseThrow().type());
        assertEquals("int", schema.get("limit").orElseThrow().type());
        assertEquals(250.0, schema.get("sfreq").orElseThrow().defaultValue());
    }

    @Test
    void dropsContainerDefaults() {
        var schema = SchemaExtractor.extract(List.of(
            BuilderParam.of("channels", List.class, List.of("Fp1")),
            BuilderParam.of("mapping", Map.class, Map.of("a", "b"))
        ));
        assertNull(schema.get("channels").orElseThrow().defaultValue());
        assertNull(schema.get("mapping").orElseThrow().defaultValue());
        assertEquals("text", schema.get("channels").orElseThrow().type());
    }

    @Test
    void usesExplicitMetadataAndFillsMissingKeys() {
        var meta = ParamSpec.meta().label("Highpass (Hz)").min(0.0).nullable(true).toWireMap();
        var schema = SchemaExtractor.extract(List.of(BuilderParam.ofTypeName("l_freq", "Optional[float]", 0.5).withMeta(meta)));
        var spec = schema.get("l_freq").orElseThrow();
        assertEquals("float", spec.type());
        assertEquals(0.5, spec.defaultValue());
        assertEquals("Highpass (Hz)", spec.label());
        assertTrue(spec.isNullable());
    }

    @Test
    void keepsExplicitTypeAndDefault() {
        var meta = ParamSpec.builder("channels").defaultValue("Fp1").toWireMap();
        var schema = SchemaExtractor.extract(List.of(BuilderParam.of("channels", List.class, null).withMeta(meta)));
        assertEquals("channels", schema.get("channels").orElseThrow().type());
        assertEquals(WidgetKind.CUSTOM, schema.get("channels").orElseThrow().kind());
        assertEquals("Fp1", schema.get("channels").orElseThrow().defaultValue());
    }

    @Test
    void logsUnresolvableTypeNames() {
        try (var logs = LogCapture.of(SchemaExtractor.class)) {
            var schema = SchemaExtractor.extract(List.of(BuilderParam.ofTypeName("data", "numpy.ndarray", null)));
            assertEquals("text", schema.get("data").orElseThrow().type());
            assertTrue(logs.hasEvent(Level.WARN, "numpy.ndarray"));
        }
    }
}

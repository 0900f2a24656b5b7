package work.lcod.scriptgen.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateTest {
    private static final Template FILTER = Template.extract("""
        def _filter(raw, freq=1.0, enabled=True, label=None):
            \"""Filter, then optionally notch.\"""
            raw.filter(l_freq=freq)
            if enabled:
                raw.notch_filter(freqs=[50.0])
            else:
                pass
        """);

    @Test
    void recordsParametersInOrder() {
        assertEquals("_filter", FILTER.name());
        assertEquals(List.of("raw", "freq", "enabled", "label"), FILTER.params());
    }

    @Test
    void substitutesValuesAndPrunesDeadBranches() {
        assertEquals("raw.filter(l_freq=2.5)\npass", FILTER.inline(Map.of("freq", 2.5, "enabled", false)));
        assertEquals(
            "raw.filter(l_freq=2.5)\nraw.notch_filter(freqs=[50.0])",
            FILTER.inline(Map.of("freq", 2.5, "enabled", true)));
    }

    @Test
    void rendersBodyUnchangedWithoutSubstitutions() {
        String rendered = FILTER.inline(Map.of());
        assertTrue(rendered.startsWith("raw.filter(l_freq=freq)\nif enabled:"));
        assertEquals(rendered, FILTER.inline(Map.of("unrelated", 1)));
    }

    @Test
    void neverSubstitutesScopeNames() {
        var values = new HashMap<String, Object>();
        values.put("raw", 5);
        assertEquals(FILTER.inline(Map.of()), FILTER.inline(values));
    }

    @Test
    void prunesOnlyConstantTests() {
        var template = Template.extract("""
            def _t(raw, picks=None):
                if picks:
                    raw.pick(picks)
            """);
        var values = new HashMap<String, Object>();
        values.put("picks", null);
        assertEquals("", template.inline(values));
        assertEquals("if ['Cz']:\n    raw.pick(['Cz'])", template.inline(Map.of("picks", List.of("Cz"))));
    }

    @Test
    void rejectsDefinitionsInsideCompoundStatements() {
        var loop = assertThrows(TemplateException.class, () -> Template.extract("""
            def _t(raw, n=1):
                for i in range(3):
                    def inner():
                        return i
            """));
        assertTrue(loop.getMessage().contains("nested definition"));
        var with = assertThrows(TemplateException.class, () -> Template.extract("""
            def _t(raw):
                with open('log.txt') as log:
                    class Holder:
                        pass
            """));
        assertTrue(with.getMessage().contains("nested definition"));
        var decorated = assertThrows(TemplateException.class, () -> Template.extract("""
            def _t(raw):
                try:
                    @staticmethod
                    async def fetch():
                        pass
                except ValueError:
                    pass
            """));
        assertTrue(decorated.getMessage().contains("nested definition"));
    }

    @Test
    void rejectsNestedDefinitions() {
        assertThrows(TemplateException.class, () -> Template.extract("""
            def _t(raw):
                def inner():
                    return 1
            """));
    }

    @Test
    void rejectsParametersHiddenInOpaqueStatements() {
        assertThrows(TemplateException.class, () -> Template.extract("""
            def _t(raw, channels=None):
                for ch in channels:
                    print(ch)
            """));
    }

    @Test
    void rejectsSourceThatIsNotAFunction() {
        assertThrows(TemplateException.class, () -> Template.extract("x = 1"));
    }

    @Test
    void cannotBeCalled() {
        assertThrows(UnsupportedOperationException.class, () -> FILTER.call(1, 2));
    }
}

package work.lcod.scriptgen.action;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lcod.scriptgen.template.Template;

class ActionFactoryTest {
    private static final Template RESAMPLE = Template.extract("""
        def _resample(raw, sfreq=250.0):
            raw.resample(sfreq=sfreq)
        """);

    private static TemplateProvider provider(List<StepBuilder> builders, Map<String, List<String>> primary) {
        return new TemplateProvider() {
            @Override
            public List<StepBuilder> provideBuilders() {
                return builders;
            }

            @Override
            public Map<String, List<String>> primaryParams() {
                return primary;
            }
        };
    }

    private static StepBuilder resampleStep() {
        return StepBuilder.step("apply")
            .title("Resample")
            .param("sfreq", Double.class, 250.0)
            .build(args -> RESAMPLE.inline(Map.of("sfreq", args.asDouble("sfreq"))));
    }

    @Test
    void buildsSingleStepAction() {
        var definition = ActionFactory.define("resample")
            .doc("Resample data.")
            .from(provider(List.of(resampleStep()), Map.of("raw.resample", List.of("sfreq"))));

        assertEquals("Resample", definition.title());
        assertFalse(definition.hasSteps());
        assertEquals(Map.of("sfreq", 250.0), definition.defaultParams());
        assertEquals(Set.of("sfreq"), definition.templateSchema().allPrimaryParams());
        assertEquals("raw.resample(sfreq=250.0)", definition.buildCode(Map.of()));
        assertEquals("raw.resample(sfreq=100.0)", definition.buildCode(Map.of("sfreq", 100, "ignored", 1)));
    }

    @Test
    void injectsAdvancedParamsIntoSingleStepCode() {
        var definition = ActionFactory.define("resample")
            .from(provider(List.of(resampleStep()), Map.of()));
        String code = definition.buildCode(Map.of(), Map.of("raw.resample", Map.of("npad", "auto")));
        assertEquals("raw.resample(sfreq=250.0, npad='auto')", code);
    }

    @Test
    void wrapsStepsInMarkers() {
        var fit = StepBuilder.step("fit").param("n", Integer.class, 2).build(args -> "x = " + args.asLong("n"));
        var look = StepBuilder.step("look").interactive().buildWithoutCode();
        var apply = StepBuilder.step("apply_it").title("Apply").build(args -> "y = x");
        var definition = ActionFactory.define("demo").from(provider(List.of(fit, look, apply), Map.of()));

        assertTrue(definition.hasSteps());
        assertEquals("demo", definition.title());
        assertEquals(List.of("n"), List.copyOf(definition.paramsSchema().names()));
        assertEquals(
            "# Step[fit] Fit\nx = 3\n# EndStep[fit]\n\n# Step[apply_it] Apply\ny = x\n# EndStep[apply_it]",
            definition.buildCode(Map.of("n", 3)));
        assertTrue(definition.step("look").orElseThrow().interactive());
        assertEquals(Set.of("n"), definition.step("fit").orElseThrow().templateSchema().virtualParams().names());
    }

    @Test
    void rejectsParameterDeclaredByTwoSteps() {
        var first = StepBuilder.step("a").param("n", Integer.class, 1).build(args -> "");
        var second = StepBuilder.step("b").param("n", Integer.class, 2).build(args -> "");
        var error = assertThrows(IllegalArgumentException.class,
            () -> ActionFactory.define("clash").from(provider(List.of(first, second), Map.of())));
        assertTrue(error.getMessage().contains("'n'"));
    }

    @Test
    void rejectsProviderWithoutBuilders() {
        assertThrows(IllegalArgumentException.class, () -> ActionFactory.define("empty").from(provider(List.of(), Map.of())));
    }

    @Test
    void singleStepListRendersWithoutMarkers() {
        var step = new StepDefinition("only", "Only", params -> "z = 1", false, null);
        var definition = ActionDefinition.builder("one").step(step).build();
        assertFalse(definition.hasSteps());
        assertEquals("z = 1", definition.buildCode(Map.of()));
    }

    @Test
    void requiresExactlyOneCodeSource() {
        assertThrows(IllegalArgumentException.class, () -> ActionDefinition.builder("none").build());
    }
}

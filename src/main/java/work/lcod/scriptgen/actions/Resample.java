package work.lcod.scriptgen.actions;

import java.util.List;
import java.util.Map;

import work.lcod.scriptgen.action.ActionDefinition;
import work.lcod.scriptgen.action.ActionFactory;
import work.lcod.scriptgen.action.StepBuilder;
import work.lcod.scriptgen.action.TemplateProvider;
import work.lcod.scriptgen.schema.ParamSpec;
import work.lcod.scriptgen.template.Template;

public final class Resample implements TemplateProvider {
    private static final Template DO_RESAMPLE = Template.extract("""
        def _do_resample(raw, sfreq=250.0):
            raw.resample(sfreq=sfreq)
        """);

    public static ActionDefinition definition() {
        return ActionFactory.define("resample")
            .title("Resample")
            .doc("Resample data to target frequency.")
            .docUrl("https://mne.tools/stable/generated/mne.io.Raw.html#mne.io.Raw.resample")
            .from(new Resample());
    }

    @Override
    public List<StepBuilder> provideBuilders() {
        return List.of(StepBuilder.step("apply")
            .title("Resample")
            .param("sfreq", Double.class, 250.0, ParamSpec.builder("float")
                .label("Target frequency (Hz)")
                .description("New sample rate in Hz.")
                .defaultValue(250)
                .min(1)
                .max(10000))
            .build(args -> DO_RESAMPLE.inline(Map.of("sfreq", args.asDouble("sfreq")))));
    }

    @Override
    public Map<String, List<String>> primaryParams() {
        return Map.of("raw.resample", List.of("sfreq"));
    }
}

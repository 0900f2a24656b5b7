package work.lcod.scriptgen.actions;

import java.util.List;
import java.util.Map;

import work.lcod.scriptgen.action.ActionDefinition;
import work.lcod.scriptgen.action.ActionFactory;
import work.lcod.scriptgen.action.StepBuilder;
import work.lcod.scriptgen.action.TemplateProvider;
import work.lcod.scriptgen.schema.ParamSpec;
import work.lcod.scriptgen.template.Template;

public final class Rereference implements TemplateProvider {
    private static final Template DO_REFERENCE = Template.extract("""
        def _do_reference(raw, ref_channels='average', projection=False):
            raw.set_eeg_reference(ref_channels=ref_channels, projection=projection)
        """);

    public static ActionDefinition definition() {
        return ActionFactory.define("reference")
            .title("Re-reference")
            .doc("Re-reference to average or REST.")
            .docUrl("https://mne.tools/stable/generated/mne.io.Raw.html#mne.io.Raw.set_eeg_reference")
            .from(new Rereference());
    }

    @Override
    public List<StepBuilder> provideBuilders() {
        return List.of(StepBuilder.step("apply")
            .title("Re-reference")
            .param("ref_channels", String.class, "average", ParamSpec.builder("choice")
                .label("Reference type")
                .description("Re-reference method.")
                .defaultValue("average")
                .choices("average", "REST"))
            .param("projection", Boolean.class, false, ParamSpec.builder("bool")
                .label("Apply as projection")
                .description("If true, add an SSP projector instead of applying the reference directly.")
                .defaultValue(false))
            .build(args -> DO_REFERENCE.inline(args.values())));
    }

    @Override
    public Map<String, List<String>> primaryParams() {
        return Map.of("raw.set_eeg_reference", List.of("ref_channels", "projection"));
    }
}

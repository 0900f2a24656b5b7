package work.lcod.scriptgen.actions;

import java.util.List;
import java.util.Map;

import work.lcod.scriptgen.action.ActionDefinition;
import work.lcod.scriptgen.action.ActionFactory;
import work.lcod.scriptgen.action.StepBuilder;
import work.lcod.scriptgen.action.TemplateProvider;
import work.lcod.scriptgen.template.Template;

public final class InterpolateBads implements TemplateProvider {
    private static final Template DO_INTERPOLATE = Template.extract("""
        def _do_interpolate(raw):
            raw.interpolate_bads(reset_bads=True)
        """);

    public static ActionDefinition definition() {
        return ActionFactory.define("interpolate")
            .title("Interpolate Bad Channels")
            .doc("Interpolate channels marked as bad using spherical splines.")
            .docUrl("https://mne.tools/stable/generated/mne.io.Raw.html#mne.io.Raw.interpolate_bads")
            .from(new InterpolateBads());
    }

    @Override
    public List<StepBuilder> provideBuilders() {
        return List.of(StepBuilder.step("apply")
            .title("Interpolate Bad Channels")
            .build(args -> DO_INTERPOLATE.inline(Map.of())));
    }

    @Override
    public Map<String, List<String>> primaryParams() {
        return Map.of("raw.interpolate_bads", List.of("reset_bads"));
    }
}

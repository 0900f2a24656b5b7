package work.lcod.scriptgen.actions;

import java.util.List;
import java.util.Map;

import work.lcod.scriptgen.action.ActionDefinition;
import work.lcod.scriptgen.action.ActionFactory;
import work.lcod.scriptgen.action.StepBuilder;
import work.lcod.scriptgen.action.TemplateProvider;
import work.lcod.scriptgen.schema.BuilderParam;
import work.lcod.scriptgen.schema.ParamSpec;
import work.lcod.scriptgen.template.Template;

/** High/low cutoff filtering; either edge may be left open. */
public final class BandpassFilter implements TemplateProvider {
    private static final Template DO_FILTER = Template.extract("""
        def _do_filter(raw, l_freq=None, h_freq=None):
            raw.filter(l_freq=l_freq, h_freq=h_freq)
        """);

    public static ActionDefinition definition() {
        return ActionFactory.define("filter")
            .title("Bandpass Filter")
            .doc("Bandpass filter to remove slow drifts and high-frequency noise.")
            .docUrl("https://mne.tools/stable/generated/mne.io.Raw.html#mne.io.Raw.filter")
            .from(new BandpassFilter());
    }

    @Override
    public List<StepBuilder> provideBuilders() {
        return List.of(StepBuilder.step("apply")
            .title("Bandpass Filter")
            .param(BuilderParam.ofTypeName("l_freq", "Optional[float]", 0.5).withMeta(ParamSpec.meta()
                .label("Highpass (Hz)")
                .description("Low cutoff frequency in Hz. Set to 0 for no highpass.")
                .min(0.0)
                .max(50.0)
                .nullable(true)
                .toWireMap()))
            .param(BuilderParam.ofTypeName("h_freq", "Optional[float]", 45.0).withMeta(ParamSpec.meta()
                .label("Lowpass (Hz)")
                .description("High cutoff frequency in Hz.")
                .min(1.0)
                .max(500.0)
                .nullable(true)
                .toWireMap()))
            .build(args -> DO_FILTER.inline(args.values())));
    }

    @Override
    public Map<String, List<String>> primaryParams() {
        return Map.of("raw.filter", List.of("l_freq", "h_freq"));
    }
}

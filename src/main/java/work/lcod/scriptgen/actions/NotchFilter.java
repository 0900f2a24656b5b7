package work.lcod.scriptgen.actions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import work.lcod.scriptgen.action.ActionDefinition;
import work.lcod.scriptgen.action.ActionFactory;
import work.lcod.scriptgen.action.BuilderArgs;
import work.lcod.scriptgen.action.StepBuilder;
import work.lcod.scriptgen.action.TemplateProvider;
import work.lcod.scriptgen.schema.ParamSpec;
import work.lcod.scriptgen.template.Template;

/** Line-noise removal at a base frequency and its harmonics. */
public final class NotchFilter implements TemplateProvider {
    private static final Template DO_NOTCH = Template.extract("""
        def _do_notch(raw, freqs=None):
            raw.notch_filter(freqs=freqs)
        """);

    public static ActionDefinition definition() {
        return ActionFactory.define("notch")
            .title("Notch Filter")
            .doc("Remove line noise at specified frequency and harmonics.")
            .docUrl("https://mne.tools/stable/generated/mne.io.Raw.html#mne.io.Raw.notch_filter")
            .from(new NotchFilter());
    }

    @Override
    public List<StepBuilder> provideBuilders() {
        return List.of(StepBuilder.step("apply")
            .title("Notch Filter")
            .param("freqs", Double.class, 50.0, ParamSpec.builder("float")
                .label("Frequency (Hz)")
                .description("Base frequency of the line noise.")
                .defaultValue(50)
                .min(1)
                .max(500))
            .param("harmonics", Integer.class, 3, ParamSpec.builder("int")
                .label("Harmonics")
                .description("Number of harmonics to include.")
                .defaultValue(3)
                .min(1)
                .max(10))
            .build(NotchFilter::render));
    }

    @Override
    public Map<String, List<String>> primaryParams() {
        return Map.of("raw.notch_filter", List.of("freqs"));
    }

    /** A list of frequencies is used as given; a single base frequency expands to its harmonics. */
    static String render(BuilderArgs args) {
        var freqs = new ArrayList<Double>();
        if (args.get("freqs") instanceof List<?> given) {
            for (Object item : given) {
                if (item instanceof Number number) {
                    freqs.add(number.doubleValue());
                }
            }
            if (freqs.isEmpty()) {
                freqs.add(50.0);
            }
        } else {
            double base = args.asDouble("freqs");
            long harmonics = Math.max(1, args.asLong("harmonics"));
            for (long i = 0; i < harmonics; i++) {
                freqs.add(base * (i + 1));
            }
        }
        var values = new LinkedHashMap<String, Object>();
        values.put("freqs", freqs);
        return DO_NOTCH.inline(values);
    }
}

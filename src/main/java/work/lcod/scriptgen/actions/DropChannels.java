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

/**
 * Removes channels from the recording or flags them as bad. Flagged channels stay in the data and are
 * skipped by most analyses.
 */
public final class DropChannels implements TemplateProvider {
    private static final Template DROP = Template.extract("""
        def _drop(raw, channels=None):
            raw.drop_channels(ch_names=channels)
        """);
    private static final Template MARK_BAD = Template.extract("""
        def _mark_bad(raw, channels=None):
            raw.info["bads"] = sorted(set(raw.info["bads"]) | set(channels))
        """);

    public static ActionDefinition definition() {
        return ActionFactory.define("drop_channels")
            .title("Drop Channels")
            .doc("Remove specified channels from the data.\n\n"
                + "mark_bad keeps channels in the data structure but flags them as bad, which excludes them from "
                + "most analysis. drop removes them entirely and cannot be undone.")
            .docUrl("https://mne.tools/stable/generated/mne.io.Raw.html#mne.io.Raw.drop_channels")
            .from(new DropChannels());
    }

    @Override
    public List<StepBuilder> provideBuilders() {
        return List.of(StepBuilder.step("apply")
            .title("Drop Channels")
            .param("channels", List.class, null, ParamSpec.builder("channels")
                .label("Channels")
                .description("Channels to drop or mark as bad."))
            .param("mode", String.class, "mark_bad", ParamSpec.builder("choice")
                .label("Channel handling")
                .description("drop: remove channels entirely.  mark_bad: keep but flag as bad.")
                .defaultValue("mark_bad")
                .choices("drop", "mark_bad"))
            .build(DropChannels::render));
    }

    @Override
    public Map<String, List<String>> primaryParams() {
        return Map.of("raw.drop_channels", List.of("ch_names"));
    }

    static String render(BuilderArgs args) {
        var values = new LinkedHashMap<String, Object>();
        values.put("channels", parseChannels(args.get("channels")));
        return "mark_bad".equals(args.asString("mode")) ? MARK_BAD.inline(values) : DROP.inline(values);
    }

    /** Channel names from a list or a comma-separated string; blanks are skipped. */
    static List<String> parseChannels(Object value) {
        var channels = new ArrayList<String>();
        if (value == null) {
            return channels;
        }
        if (value instanceof List<?> given) {
            for (Object item : given) {
                String name = String.valueOf(item).strip();
                if (!name.isEmpty()) {
                    channels.add(name);
                }
            }
            return channels;
        }
        for (String part : value.toString().split(",")) {
            if (!part.isBlank()) {
                channels.add(part.strip());
            }
        }
        return channels;
    }
}

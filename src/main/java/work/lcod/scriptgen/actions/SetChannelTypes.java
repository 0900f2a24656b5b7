package work.lcod.scriptgen.actions;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import work.lcod.scriptgen.action.ActionDefinition;
import work.lcod.scriptgen.action.ActionFactory;
import work.lcod.scriptgen.action.BuilderArgs;
import work.lcod.scriptgen.action.StepBuilder;
import work.lcod.scriptgen.action.TemplateProvider;
import work.lcod.scriptgen.schema.ParamSpec;
import work.lcod.scriptgen.template.Template;

/** Assigns channel types from a mapping given as a map, a JSON object or {@code ch:type} pairs. */
public final class SetChannelTypes implements TemplateProvider {
    private static final Logger LOG = LoggerFactory.getLogger(SetChannelTypes.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Template DO_SET_CHANNEL_TYPES = Template.extract("""
        def _do_set_channel_types(raw, channel_mapping=None):
            raw.set_channel_types(mapping=channel_mapping)
        """);

    public static ActionDefinition definition() {
        return ActionFactory.define("set_channel_types")
            .title("Set Channel Types")
            .doc("Set channel types for specified channels.")
            .docUrl("https://mne.tools/stable/generated/mne.io.Raw.html#mne.io.Raw.set_channel_types")
            .from(new SetChannelTypes());
    }

    @Override
    public List<StepBuilder> provideBuilders() {
        return List.of(StepBuilder.step("apply")
            .title("Set Channel Types")
            .param("channel_mapping", Map.class, null, ParamSpec.builder("channel_types")
                .label("Channel type mapping")
                .description("Channel-to-type mapping (JSON dict or comma-separated ch:type pairs).")
                .defaultValue(null))
            .build(SetChannelTypes::render));
    }

    @Override
    public Map<String, List<String>> primaryParams() {
        return Map.of("raw.set_channel_types", List.of("mapping"));
    }

    static String render(BuilderArgs args) {
        var values = new LinkedHashMap<String, Object>();
        values.put("channel_mapping", parseMapping(args.get("channel_mapping")));
        return DO_SET_CHANNEL_TYPES.inline(values);
    }

    /** Channel name to type; entries with an empty name or type are dropped. */
    static Map<String, String> parseMapping(Object value) {
        var mapping = new LinkedHashMap<String, String>();
        if (value instanceof Map<?, ?> given) {
            given.forEach((channel, type) -> {
                if (BuilderArgs.truthy(channel) && BuilderArgs.truthy(type)) {
                    mapping.put(channel.toString(), type.toString());
                }
            });
            return mapping;
        }
        String text = value == null ? "" : value.toString().strip();
        if (text.isEmpty()) {
            return mapping;
        }
        try {
            return parseMapping(JSON.readValue(text, Map.class));
        } catch (JsonProcessingException e) {
            LOG.debug("Channel mapping is not a JSON object, reading it as ch:type pairs: {}", e.getOriginalMessage());
        }
        for (String pair : text.split(",")) {
            int colon = pair.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String channel = pair.substring(0, colon).strip();
            String type = pair.substring(colon + 1).strip();
            if (!channel.isEmpty() && !type.isEmpty()) {
                mapping.put(channel, type);
            }
        }
        return mapping;
    }
}

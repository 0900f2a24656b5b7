package work.lcod.scriptgen.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON form of a pipeline: an array of action entries in the shape of {@link ActionConfig#toSerializableMap()}.
 */
public final class PipelineJson {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<List<Map<String, Object>>> ENTRIES = new TypeReference<>() {};

    private PipelineJson() {}

    public static List<ActionConfig> read(String json) {
        List<Map<String, Object>> entries;
        try {
            entries = JSON.readValue(json, ENTRIES);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid pipeline JSON: " + e.getOriginalMessage(), e);
        }
        var actions = new ArrayList<ActionConfig>();
        if (entries != null) {
            entries.forEach(entry -> actions.add(ActionConfig.fromMap(entry)));
        }
        return actions;
    }

    public static String write(List<ActionConfig> actions) {
        try {
            return JSON.writerWithDefaultPrettyPrinter()
                .writeValueAsString(actions.stream().map(ActionConfig::toSerializableMap).toList());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize pipeline: " + e.getOriginalMessage(), e);
        }
    }
}

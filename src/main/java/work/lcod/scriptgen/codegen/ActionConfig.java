package work.lcod.scriptgen.codegen;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable runtime configuration of one pipeline action: which action runs, its parameter values, its execution
 * status and, once the user edited the generated code, the edited text.
 * <p>
 * {@code stepState} carries data between the steps of a running multistep action and is never serialized.
 */
public final class ActionConfig {
    private final String actionId;
    private final Map<String, Object> params;
    private ActionStatus status = ActionStatus.PENDING;
    private String errorMessage = "";
    private String customCode = "";
    private boolean custom;
    private String titleOverride = "";
    private final Map<String, Map<String, Object>> advancedParams = new LinkedHashMap<>();
    private int completedSteps;
    private Map<String, Object> stepState = new LinkedHashMap<>();

    public ActionConfig(String actionId) {
        this(actionId, Map.of());
    }

    public ActionConfig(String actionId, Map<String, ?> params) {
        this.actionId = Objects.requireNonNull(actionId, "actionId");
        this.params = new LinkedHashMap<>(params == null ? Map.of() : params);
    }

    /** A hand-written block that is emitted verbatim. */
    public static ActionConfig custom(String actionId, Map<String, ?> params, String code) {
        var config = new ActionConfig(actionId, params);
        config.setCustomCode(code);
        config.setCustom(true);
        return config;
    }

    public String actionId() {
        return actionId;
    }

    public Map<String, Object> params() {
        return params;
    }

    public ActionStatus status() {
        return status;
    }

    public void setStatus(ActionStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    public String errorMessage() {
        return errorMessage;
    }

    public void markFailed(String message) {
        this.status = ActionStatus.ERROR;
        this.errorMessage = message == null ? "" : message;
    }

    public String customCode() {
        return customCode;
    }

    public void setCustomCode(String customCode) {
        this.customCode = customCode == null ? "" : customCode;
    }

    public boolean isCustom() {
        return custom;
    }

    public void setCustom(boolean custom) {
        this.custom = custom;
    }

    public String titleOverride() {
        return titleOverride;
    }

    public void setTitleOverride(String titleOverride) {
        this.titleOverride = titleOverride == null ? "" : titleOverride;
    }

    /** Non-primary keyword arguments grouped by dotted function path. */
    public Map<String, Map<String, Object>> advancedParams() {
        return advancedParams;
    }

    public void setAdvancedParams(Map<String, ? extends Map<String, ?>> advanced) {
        advancedParams.clear();
        if (advanced != null) {
            advanced.forEach((path, kwargs) -> advancedParams.put(path, new LinkedHashMap<>(kwargs)));
        }
    }

    public int completedSteps() {
        return completedSteps;
    }

    public void setCompletedSteps(int completedSteps) {
        this.completedSteps = completedSteps;
    }

    public Map<String, Object> stepState() {
        return stepState;
    }

    /** Back to pending; step progress and transient state are cleared, code and parameters are kept. */
    public void reset() {
        status = ActionStatus.PENDING;
        errorMessage = "";
        completedSteps = 0;
        stepState = new LinkedHashMap<>();
    }

    public Map<String, Object> toSerializableMap() {
        var out = new LinkedHashMap<String, Object>();
        out.put("action_id", actionId);
        out.put("params", params);
        out.put("status", status.wireName());
        out.put("error_msg", errorMessage);
        out.put("custom_code", customCode);
        out.put("is_custom", custom);
        out.put("title_override", titleOverride);
        out.put("advanced_params", advancedParams);
        out.put("completed_steps", completedSteps);
        return out;
    }

    public static ActionConfig fromMap(Map<String, ?> map) {
        Object id = map.get("action_id");
        if (!(id instanceof String actionId) || actionId.isBlank()) {
            throw new IllegalArgumentException("Action entry needs an 'action_id': " + map);
        }
        var config = new ActionConfig(actionId, map.get("params") instanceof Map<?, ?> p ? stringKeys(p) : Map.of());
        config.setStatus(ActionStatus.fromWireName(map.get("status") instanceof String s ? s : null));
        if (map.get("error_msg") instanceof String message) {
            config.errorMessage = message;
        }
        config.setCustomCode(map.get("custom_code") instanceof String code ? code : "");
        config.setCustom(Boolean.TRUE.equals(map.get("is_custom")));
        config.setTitleOverride(map.get("title_override") instanceof String title ? title : "");
        if (map.get("advanced_params") instanceof Map<?, ?> advanced) {
            advanced.forEach((path, kwargs) -> {
                if (kwargs instanceof Map<?, ?> values) {
                    config.advancedParams.put(String.valueOf(path), stringKeys(values));
                }
            });
        }
        if (map.get("completed_steps") instanceof Number steps) {
            config.completedSteps = steps.intValue();
        }
        return config;
    }

    private static Map<String, Object> stringKeys(Map<?, ?> values) {
        var out = new LinkedHashMap<String, Object>();
        values.forEach((key, value) -> out.put(String.valueOf(key), value));
        return out;
    }

    @Override
    public String toString() {
        return "ActionConfig[" + actionId + ", params=" + params + ", status=" + status + ", custom=" + custom + "]";
    }
}

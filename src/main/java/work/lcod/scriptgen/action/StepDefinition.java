package work.lcod.scriptgen.action;

import java.util.Map;
import java.util.Objects;

/**
 * One step of a multistep action. Steps without a code builder exist for interaction only.
 */
public record StepDefinition(String id, String title, CodeBuilder codeBuilder, boolean interactive, TemplateSchema templateSchema) {
    public StepDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(title, "title");
        templateSchema = templateSchema == null ? TemplateSchema.empty() : templateSchema;
    }

    public boolean hasCode() {
        return codeBuilder != null;
    }

    public String buildCode(Map<String, ?> params) {
        return codeBuilder == null ? "" : codeBuilder.build(params);
    }
}

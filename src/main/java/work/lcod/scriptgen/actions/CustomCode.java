package work.lcod.scriptgen.actions;

import java.util.List;

import work.lcod.scriptgen.action.ActionDefinition;
import work.lcod.scriptgen.action.ActionFactory;
import work.lcod.scriptgen.action.StepBuilder;
import work.lcod.scriptgen.action.TemplateProvider;

/**
 * Placeholder for hand-written blocks. Its own code is always empty; the text lives on the action config.
 */
public final class CustomCode implements TemplateProvider {
    public static final String ID = "custom";

    public static ActionDefinition definition() {
        return ActionFactory.define(ID)
            .title("Custom Action")
            .doc("Custom code block.")
            .from(new CustomCode());
    }

    @Override
    public List<StepBuilder> provideBuilders() {
        return List.of(StepBuilder.step("apply").title("Custom Action").build(args -> ""));
    }
}

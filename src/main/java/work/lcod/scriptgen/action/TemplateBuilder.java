package work.lcod.scriptgen.action;

/**
 * Renders a step's code from its arguments.
 */
@FunctionalInterface
public interface TemplateBuilder {
    String build(BuilderArgs args);
}

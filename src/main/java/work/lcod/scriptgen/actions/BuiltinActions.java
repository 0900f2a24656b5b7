package work.lcod.scriptgen.actions;

import java.util.List;
import java.util.function.Supplier;

import work.lcod.scriptgen.action.ActionDefinition;
import work.lcod.scriptgen.action.ActionRegistry;

/** The preprocessing actions shipped with the engine, in pipeline order. */
public final class BuiltinActions {
    private BuiltinActions() {}

    public static List<Supplier<ActionDefinition>> definitions() {
        return List.of(
            SetChannelTypes::definition,
            DropChannels::definition,
            BandpassFilter::definition,
            NotchFilter::definition,
            Resample::definition,
            Rereference::definition,
            InterpolateBads::definition,
            IndependentComponents::definition,
            CustomCode::definition
        );
    }

    public static ActionRegistry registry() {
        return new ActionRegistry(definitions());
    }
}

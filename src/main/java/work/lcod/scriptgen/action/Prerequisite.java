package work.lcod.scriptgen.action;

import java.util.Objects;

/**
 * Another action that should run before this one, with the reason shown to the user.
 */
public record Prerequisite(String actionId, String message) {
    public Prerequisite {
        Objects.requireNonNull(actionId, "actionId");
        message = message == null ? "" : message;
    }
}

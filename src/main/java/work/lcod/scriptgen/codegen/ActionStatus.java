package work.lcod.scriptgen.codegen;

import java.util.Locale;

/** Execution state of one pipeline action. */
public enum ActionStatus {
    PENDING,
    COMPLETE,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ActionStatus fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}

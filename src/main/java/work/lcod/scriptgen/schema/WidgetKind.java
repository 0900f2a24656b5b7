package work.lcod.scriptgen.schema;

import java.util.Locale;

/**
 * Editor widget a parameter is shown with. Any type name outside the fixed set (for example {@code channels})
 * names a custom widget.
 */
public enum WidgetKind {
    TEXT,
    INT,
    FLOAT,
    BOOL,
    CHOICE,
    CUSTOM;

    public static WidgetKind of(String type) {
        if (type == null) {
            return TEXT;
        }
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "text" -> TEXT;
            case "int" -> INT;
            case "float" -> FLOAT;
            case "bool" -> BOOL;
            case "choice" -> CHOICE;
            default -> CUSTOM;
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

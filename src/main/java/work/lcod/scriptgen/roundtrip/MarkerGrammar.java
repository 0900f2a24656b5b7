package work.lcod.scriptgen.roundtrip;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Comment markers that delimit blocks in generated text. Begin markers carry an id and a label, end markers the
 * id alone; the optional sentinel ends a block early without being consumed.
 */
public record MarkerGrammar(String name, Pattern begin, Pattern end, String sentinel, String beginFormat, String endFormat) {
    /** Whole-action blocks: {@code # In[n] title} ... {@code # End[n]}. */
    public static final MarkerGrammar ACTION = new MarkerGrammar(
        "action",
        Pattern.compile("^#\\s*In\\[(\\d+)]\\s*(.*?)\\s*$"),
        Pattern.compile("^#\\s*End\\[(\\d+)]\\s*$"),
        "# Save result",
        "# In[%s] %s",
        "# End[%s]"
    );

    /** Step blocks inside a multistep action: {@code # Step[id] title} ... {@code # EndStep[id]}. */
    public static final MarkerGrammar STEP = new MarkerGrammar(
        "step",
        Pattern.compile("^#\\s*Step\\[(.+?)]\\s*(.*?)\\s*$"),
        Pattern.compile("^#\\s*EndStep\\[(.+?)]\\s*$"),
        null,
        "# Step[%s] %s",
        "# EndStep[%s]"
    );

    public MarkerGrammar {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(begin, "begin");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(beginFormat, "beginFormat");
        Objects.requireNonNull(endFormat, "endFormat");
    }

    public String beginMarker(Object id, String label) {
        return String.format(beginFormat, id, label == null ? "" : label).stripTrailing();
    }

    public String endMarker(Object id) {
        return String.format(endFormat, id);
    }

    Matcher matchBegin(String line) {
        return begin.matcher(line.strip());
    }

    Matcher matchEnd(String line) {
        return end.matcher(line.strip());
    }

    boolean isSentinel(String line) {
        return sentinel != null && line.strip().startsWith(sentinel);
    }
}

package work.lcod.scriptgen.roundtrip;

import java.util.Objects;

/** Text between a begin marker and its end; {@code label} is the begin marker's trailing text. */
public record CodeBlock(String id, String label, String code) {
    public CodeBlock {
        Objects.requireNonNull(id, "id");
        label = label == null ? "" : label;
        code = code == null ? "" : code;
    }
}

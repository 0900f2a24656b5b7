package work.lcod.scriptgen.roundtrip;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Splits marker-delimited text into {@link CodeBlock}s.
 * <p>
 * A block runs from its begin marker to the first of: the next begin marker (left for the next block), an end
 * marker with the same id (consumed), the grammar's sentinel line (not consumed) or the end of the text.
 * Trailing blank lines are dropped. Text outside blocks is ignored.
 */
public final class MarkerScanner {
    private MarkerScanner() {}

    public static List<CodeBlock> extractBlocks(String text, MarkerGrammar grammar) {
        var blocks = new ArrayList<CodeBlock>();
        if (text == null || text.isEmpty()) {
            return blocks;
        }
        String[] lines = text.split("\n", -1);
        int i = 0;
        while (i < lines.length) {
            Matcher begin = grammar.matchBegin(lines[i]);
            if (!begin.matches()) {
                i++;
                continue;
            }
            String id = begin.group(1).strip();
            String label = begin.group(2).strip();
            var body = new ArrayList<String>();
            i++;
            while (i < lines.length) {
                String line = lines[i];
                if (grammar.matchBegin(line).matches()) {
                    break;
                }
                Matcher end = grammar.matchEnd(line);
                if (end.matches() && sameId(end.group(1).strip(), id)) {
                    i++;
                    break;
                }
                if (grammar.isSentinel(line)) {
                    break;
                }
                body.add(line);
                i++;
            }
            while (!body.isEmpty() && body.get(body.size() - 1).isBlank()) {
                body.remove(body.size() - 1);
            }
            blocks.add(new CodeBlock(id, label, String.join("\n", body)));
        }
        return blocks;
    }

    /** Numeric ids compare by value, so {@code 01} closes {@code 1}. */
    static boolean sameId(String a, String b) {
        if (isDigits(a) && isDigits(b)) {
            return new BigInteger(a).equals(new BigInteger(b));
        }
        return a.equals(b);
    }

    private static boolean isDigits(String s) {
        return !s.isEmpty() && s.chars().allMatch(c -> c >= '0' && c <= '9');
    }
}

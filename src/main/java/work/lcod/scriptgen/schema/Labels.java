package work.lcod.scriptgen.schema;

/**
 * Display labels derived from identifiers.
 */
public final class Labels {
    private Labels() {}

    /** {@code l_freq} becomes {@code L Freq}: underscores turn into spaces and each word is title-cased. */
    public static String fromIdentifier(String identifier) {
        String spaced = identifier.replace('_', ' ');
        var out = new StringBuilder(spaced.length());
        boolean previousLetter = false;
        for (int i = 0; i < spaced.length(); i++) {
            char c = spaced.charAt(i);
            if (Character.isLetter(c)) {
                out.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousLetter = true;
            } else {
                out.append(c);
                previousLetter = false;
            }
        }
        return out.toString();
    }
}

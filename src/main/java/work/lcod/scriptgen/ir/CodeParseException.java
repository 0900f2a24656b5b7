package work.lcod.scriptgen.ir;

/**
 * Raised when script text does not parse as the supported source subset.
 */
public final class CodeParseException extends RuntimeException {
    private final int line;

    public CodeParseException(String message, int line) {
        super(line > 0 ? message + " (line " + line + ")" : message);
        this.line = line;
    }

    /** 1-based line number, or 0 when unknown. */
    public int line() {
        return line;
    }
}

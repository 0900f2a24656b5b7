package work.lcod.scriptgen.ir;

/**
 * Outcome of evaluating an expression as a literal. A successful evaluation may hold {@code null}
 * (the {@code None} literal), so success is tracked separately from the value.
 */
public final class LiteralEvaluation {
    private static final LiteralEvaluation NOT_LITERAL = new LiteralEvaluation(false, null);

    private final boolean literal;
    private final Object value;

    private LiteralEvaluation(boolean literal, Object value) {
        this.literal = literal;
        this.value = value;
    }

    public static LiteralEvaluation of(Object value) {
        return new LiteralEvaluation(true, value);
    }

    public static LiteralEvaluation notLiteral() {
        return NOT_LITERAL;
    }

    public boolean isLiteral() {
        return literal;
    }

    public Object value() {
        if (!literal) {
            throw new IllegalStateException("Expression is not a literal");
        }
        return value;
    }

    @Override
    public String toString() {
        return literal ? "LiteralEvaluation[" + value + "]" : "LiteralEvaluation[not literal]";
    }
}

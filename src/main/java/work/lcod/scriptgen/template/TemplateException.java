package work.lcod.scriptgen.template;

/**
 * Raised when template source is malformed or uses constructs that cannot be rendered.
 */
public final class TemplateException extends RuntimeException {
    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}

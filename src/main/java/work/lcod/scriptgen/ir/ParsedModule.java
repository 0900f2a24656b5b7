package work.lcod.scriptgen.ir;

import java.util.List;

/**
 * Result of {@link SourceParser#parse(String)}: the top-level statements and, index for index, the
 * 1-based physical line span each of them was read from.
 */
public record ParsedModule(List<Stmt> body, List<LineSpan> spans) {
    public ParsedModule {
        body = List.copyOf(body);
        spans = List.copyOf(spans);
        if (body.size() != spans.size()) {
            throw new IllegalArgumentException("every statement needs a line span");
        }
    }

    public record LineSpan(int firstLine, int lastLine) {
        public boolean contains(int line) {
            return line >= firstLine && line <= lastLine;
        }
    }
}

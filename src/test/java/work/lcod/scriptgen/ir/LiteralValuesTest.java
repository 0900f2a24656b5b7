package work.lcod.scriptgen.ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import org.junit.jupiter.api.Test;

class LiteralValuesTest {
    @Test
    void serializesScalarsAndContainers() {
        assertSame(Expr.BoolLiteral.TRUE, LiteralValues.toNode(true));
        assertSame(Expr.NoneLiteral.INSTANCE, LiteralValues.toNode(null));
        assertEquals("[50.0, 100.0]", SourcePrinter.print(LiteralValues.toNode(List.of(50.0, 100.0))));
        var map = new LinkedHashMap<String, Object>();
        map.put("Fp1", "eog");
        map.put("n", 3);
        assertEquals("{'Fp1': 'eog', 'n': 3}", SourcePrinter.print(LiteralValues.toNode(map)));
        assertEquals("[1, 2]", SourcePrinter.print(LiteralValues.toNode(new int[] {1, 2})));
    }

    @Test
    void fallsBackToDisplayString() {
        var node = LiteralValues.toNode(Path.of("data.fif"));
        assertEquals(new Expr.StringLiteral("data.fif"), node);
    }

    @Test
    void evaluatesLiteralSyntax() {
        assertEquals(-3L, LiteralValues.evaluate(SourceParser.parseExpression("-3")).value());
        assertEquals(List.of(1L, 2L), LiteralValues.evaluate(SourceParser.parseExpression("(1, 2)")).value());
        assertNull(LiteralValues.evaluate(SourceParser.parseExpression("None")).value());
        var dict = (java.util.Map<?, ?>) LiteralValues.evaluate(SourceParser.parseExpression("{'a': 0.5}")).value();
        assertEquals(0.5, dict.get("a"));
    }

    @Test
    void rejectsNonLiterals() {
        assertFalse(LiteralValues.evaluate(SourceParser.parseExpression("np.arange(3)")).isLiteral());
        assertFalse(LiteralValues.evaluate(SourceParser.parseExpression("[x, 1]")).isLiteral());
    }

    @Test
    void followsTruthiness() {
        assertFalse(LiteralValues.truthiness(LiteralValues.toNode(0)));
        assertFalse(LiteralValues.truthiness(LiteralValues.toNode("")));
        assertFalse(LiteralValues.truthiness(LiteralValues.toNode(0.0)));
        assertTrue(LiteralValues.truthiness(LiteralValues.toNode("x")));
        assertNull(LiteralValues.truthiness(new Expr.Name("x")));
    }
}

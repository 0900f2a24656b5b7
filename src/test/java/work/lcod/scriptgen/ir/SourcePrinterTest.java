package work.lcod.scriptgen.ir;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class SourcePrinterTest {
    @Test
    void printsFloatsLikeRepr() {
        assertEquals("50.0", SourcePrinter.number(50.0));
        assertEquals("0.5", SourcePrinter.number(0.5));
        assertEquals("1e-05", SourcePrinter.number(1e-5));
        assertEquals("1e+16", SourcePrinter.number(1e16));
        assertEquals("0.0001", SourcePrinter.number(1e-4));
        assertEquals("3", SourcePrinter.number(3L));
    }

    @Test
    void printsShortestDigitsThatReadBack() {
        assertEquals("1e+23", SourcePrinter.number(1e23));
        assertEquals("5e-324", SourcePrinter.number(Double.MIN_VALUE));
        assertEquals("0.30000000000000004", SourcePrinter.number(0.1 + 0.2));
        assertEquals("-2.5e-07", SourcePrinter.number(-2.5e-7));
        assertEquals("123456789.0", SourcePrinter.number(123456789.0));
    }

    @Test
    void quotesStringsLikeRepr() {
        assertEquals("'average'", SourcePrinter.repr("average"));
        assertEquals("\"it's\"", SourcePrinter.repr("it's"));
        assertEquals("'a\\nb'", SourcePrinter.repr("a\nb"));
    }

    @Test
    void reprintsParsedSourceUnchanged() {
        String source = String.join("\n",
            "raw.filter(l_freq=1.0, h_freq=None)",
            "x = (a + b) * c",
            "if enabled:",
            "    y = x[1:2]",
            "elif other:",
            "    pass",
            "else:",
            "    z = {'a': [1, 2], 'b': (3,)}");
        assertEquals(source, SourcePrinter.print(SourceParser.parseStatements(source)));
    }

    @Test
    void printsEmptyBlocksAsPass() {
        var node = new Stmt.If(new Expr.Name("flag"), java.util.List.of(), java.util.List.of());
        assertEquals("if flag:\n    pass", SourcePrinter.print(node));
    }
}

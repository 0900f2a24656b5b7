package work.lcod.scriptgen.ir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.scriptgen.ir.Expr.Attribute;
import work.lcod.scriptgen.ir.Expr.Call;
import work.lcod.scriptgen.ir.Expr.Keyword;
import work.lcod.scriptgen.ir.Expr.Name;
import work.lcod.scriptgen.ir.Expr.NoneLiteral;
import work.lcod.scriptgen.ir.Expr.NumberLiteral;
import work.lcod.scriptgen.ir.Stmt.ExprStatement;
import work.lcod.scriptgen.ir.Stmt.FromImport;
import work.lcod.scriptgen.ir.Stmt.If;
import work.lcod.scriptgen.ir.Stmt.Import;
import work.lcod.scriptgen.ir.Stmt.RawStatement;

class SourceParserTest {
    @Test
    void parsesKeywordCall() {
        var body = SourceParser.parseStatements("raw.filter(l_freq=1.0, h_freq=None)");
        assertEquals(1, body.size());
        var call = (Call) ((ExprStatement) body.get(0)).value();
        assertEquals(new Attribute(new Name("raw"), "filter"), call.func());
        assertEquals(List.of(
            new Keyword("l_freq", new NumberLiteral(1.0)),
            new Keyword("h_freq", NoneLiteral.INSTANCE)
        ), call.keywords());
    }

    @Test
    void recordsLineSpansOfTopLevelStatements() {
        var module = SourceParser.parse("import mne\n\nraw.filter(\n    1, 2)\n");
        assertEquals(2, module.body().size());
        assertEquals(new ParsedModule.LineSpan(1, 1), module.spans().get(0));
        assertEquals(new ParsedModule.LineSpan(3, 4), module.spans().get(1));
    }

    @Test
    void parsesImports() {
        var body = SourceParser.parseStatements("import numpy as np\nfrom mne.preprocessing import ICA, read_ica");
        var plain = assertInstanceOf(Import.class, body.get(0));
        assertEquals("np", plain.names().get(0).asName());
        var from = assertInstanceOf(FromImport.class, body.get(1));
        assertEquals("mne.preprocessing", from.module());
        assertEquals(2, from.names().size());
    }

    @Test
    void keepsLoopsAsRawStatements() {
        var body = SourceParser.parseStatements("for ch in chans:\n    print(ch)\nx = 1\n");
        var loop = assertInstanceOf(RawStatement.class, body.get(0));
        assertEquals("for", loop.keyword());
        assertTrue(loop.text().contains("print(ch)"));
        assertEquals(2, body.size());
    }

    @Test
    void nestsElifChains() {
        var body = SourceParser.parseStatements("if a:\n    x = 1\nelif b:\n    x = 2\nelse:\n    x = 3\n");
        var outer = assertInstanceOf(If.class, body.get(0));
        var nested = assertInstanceOf(If.class, outer.orElse().get(0));
        assertEquals(1, nested.orElse().size());
    }

    @Test
    void readsFunctionParameters() {
        var definition = SourceParser.parseFunction("def build(raw, freqs=50.0, *, n: int = 3):\n    return freqs\n");
        assertEquals("build", definition.name());
        assertEquals(List.of("raw", "freqs", "n"), definition.params());
    }

    @Test
    void rejectsUnbalancedBrackets() {
        assertThrows(CodeParseException.class, () -> SourceParser.parse("raw.filter(1, 2"));
    }

    @Test
    void rejectsUnterminatedString() {
        var error = assertThrows(CodeParseException.class, () -> SourceParser.parse("x = 1\ny = 'abc\n"));
        assertEquals(2, error.line());
    }

    @Test
    void rejectsUnexpectedIndent() {
        assertThrows(CodeParseException.class, () -> SourceParser.parse("x = 1\n    y = 2\n"));
    }
}

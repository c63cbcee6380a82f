package com.pytaintscanner.syntax;

import com.pytaintscanner.syntax.PyAst.*;
import com.pytaintscanner.syntax.PyAst.Module;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    @Test
    void functionWithDecoratorsAndArguments() throws ParseException {
        Module m = Parser.parse("@app.route('/x')\ndef view(a, b=1, *args, c, **kw):\n    return a\n");
        FunctionDef f = assertInstanceOf(FunctionDef.class, m.body.get(0));
        assertEquals("view", f.name);
        assertEquals(1, f.decorators.size());
        assertEquals(5, f.params.size());
        assertEquals(ArgKind.POSITIONAL, f.params.get(1).kind);
        assertNotNull(f.params.get(1).defaultValue);
        assertEquals(ArgKind.VARARG, f.params.get(2).kind);
        assertEquals(ArgKind.KWONLY, f.params.get(3).kind);
        assertEquals(ArgKind.KWARG, f.params.get(4).kind);
        assertInstanceOf(Return.class, f.body.get(0));
    }

    @Test
    void callWithStarredAndKeywordArguments() throws ParseException {
        Module m = Parser.parse("f(a, *rest, key=1, **extra)\n");
        Call call = assertInstanceOf(Call.class, ((ExprStmt) m.body.get(0)).value);
        assertEquals(2, call.args.size());
        assertInstanceOf(Starred.class, call.args.get(1));
        assertEquals(2, call.keywords.size());
    }

    @Test
    void tryWithHandlersElseAndFinally() throws ParseException {
        Module m = Parser.parse("try:\n    a()\nexcept ValueError as e:\n    b()\nelse:\n    c()\nfinally:\n    d()\n");
        Try t = assertInstanceOf(Try.class, m.body.get(0));
        assertEquals(1, t.handlers.size());
        assertEquals("e", t.handlers.get(0).name);
        assertEquals(1, t.orelse.size());
        assertEquals(1, t.finalbody.size());
    }

    @Test
    void relativeImportKeepsLevel() throws ParseException {
        Module m = Parser.parse("from ..pkg import mod as m\n");
        ImportFrom imp = assertInstanceOf(ImportFrom.class, m.body.get(0));
        assertEquals(2, imp.level);
        assertEquals("pkg", imp.module);
        assertEquals("m", imp.names.get(0).asname);
    }

    @Test
    void matchStatementBecomesUnsupportedNode() throws ParseException {
        Module m = Parser.parse("match cmd:\n    case 'go':\n        run()\n    case _:\n        pass\nafter = 1\n");
        assertEquals(2, m.body.size());
        UnsupportedStmt u = assertInstanceOf(UnsupportedStmt.class, m.body.get(0));
        assertEquals("match", u.construct);
        assertInstanceOf(Assign.class, m.body.get(1));
    }

    @Test
    void matchAsPlainNameStillParses() throws ParseException {
        Module m = Parser.parse("match = 3\n");
        assertInstanceOf(Assign.class, m.body.get(0));
    }

    @Test
    void syntaxErrorCarriesPosition() {
        ParseException e = assertThrows(ParseException.class, () -> Parser.parse("x = (1,\ny = 2\n"));
        assertTrue(e.getLine() >= 1);
    }

    @Test
    void docstringsAreStripped() throws ParseException {
        Module m = DocstringStripper.strip(Parser.parse("\"\"\"module doc\"\"\"\ndef f():\n    \"\"\"doc\"\"\"\n    return 1\n"));
        assertEquals(1, m.body.size());
        FunctionDef f = (FunctionDef) m.body.get(0);
        assertEquals(1, f.body.size());
        assertInstanceOf(Return.class, f.body.get(0));
    }

    private static String nestedParens(int depth) {
        StringBuilder sb = new StringBuilder("x = ");
        for (int i = 0; i < depth; i++) {
            sb.append('(');
        }
        sb.append('1');
        for (int i = 0; i < depth; i++) {
            sb.append(')');
        }
        return sb.append('\n').toString();
    }

    @Test
    void deepNestingIsAParseError() {
        ParseException e = assertThrows(ParseException.class, () -> Parser.parse(nestedParens(300)));
        assertEquals(1, e.getLine());
        assertTrue(e.getMessage().contains("Nesting"));

        StringBuilder negations = new StringBuilder("y = ");
        for (int i = 0; i < 500; i++) {
            negations.append('-');
        }
        assertThrows(ParseException.class, () -> Parser.parse(negations.append("1\n").toString()));
    }

    @Test
    void moderateNestingStillParses() throws Exception {
        Module module = Parser.parse(nestedParens(50));
        assertEquals(1, module.body.size());
    }
}

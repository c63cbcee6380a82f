package com.pytaintscanner.syntax;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static List<TokenType> types(String source) throws ParseException {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(source).tokenize()) {
            out.add(t.getType());
        }
        return out;
    }

    @Test
    void indentAndDedentAroundBlock() throws ParseException {
        List<TokenType> types = types("if x:\n    y = 1\nz = 2\n");
        assertTrue(types.contains(TokenType.INDENT));
        assertTrue(types.contains(TokenType.DEDENT));
        assertEquals(TokenType.ENDMARKER, types.get(types.size() - 1));
        assertTrue(types.indexOf(TokenType.INDENT) < types.indexOf(TokenType.DEDENT));
    }

    @Test
    void commentsAreDropped() throws ParseException {
        for (Token t : new Lexer("x = 1  # secret comment\n").tokenize()) {
            assertFalse(t.getText().contains("secret"));
        }
    }

    @Test
    void positionsAreOneBasedLinesZeroBasedColumns() throws ParseException {
        List<Token> tokens = new Lexer("a = 1\nbb = 2\n").tokenize();
        Token bb = null;
        for (Token t : tokens) {
            if (t.isKeyword("bb")) {
                bb = t;
            }
        }
        assertNotNull(bb);
        assertEquals(2, bb.getLine());
        assertEquals(0, bb.getCol());
    }

    @Test
    void bracketsJoinLines() throws ParseException {
        List<TokenType> types = types("f(1,\n  2)\n");
        assertEquals(1, types.stream().filter(t -> t == TokenType.NEWLINE).count());
        assertFalse(types.contains(TokenType.INDENT));
    }

    @Test
    void tripleQuotedStringSpansLines() throws ParseException {
        List<Token> tokens = new Lexer("s = '''a\nb'''\n").tokenize();
        Token s = tokens.stream().filter(t -> t.getType() == TokenType.STRING).findFirst().orElseThrow();
        assertEquals("a\nb", s.getText());
        assertEquals(1, s.getLine());
        assertEquals(2, s.getEndLine());
    }

    @Test
    void unterminatedStringFails() {
        ParseException e = assertThrows(ParseException.class, () -> new Lexer("s = 'abc\n").tokenize());
        assertEquals(1, e.getLine());
    }

    @Test
    void inconsistentDedentFails() {
        assertThrows(ParseException.class, () -> new Lexer("if x:\n        y = 1\n    z = 2\n").tokenize());
    }
}

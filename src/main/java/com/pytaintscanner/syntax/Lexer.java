package com.pytaintscanner.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Indentation-aware tokenizer for the supported Python subset.
 * Comments are dropped here, so nothing downstream ever sees them.
 */
public class Lexer {
    private static final String[] OPERATORS = {
        "**=", "//=", ">>=", "<<=", "...",
        "->", ":=", "**", "//", ">>", "<<", "<=", ">=", "==", "!=",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
        "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
        "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "="
    };
    private static final int TAB_SIZE = 8;

    private final String src;
    private final int lineOffset;
    private final int colOffset;
    private final boolean trackIndentation;

    private int pos;
    private int line = 1;
    private int col;
    private int parenDepth;
    private boolean atLineStart = true;
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final List<Token> tokens = new ArrayList<>();

    public Lexer(String source) {
        this(source, 0, 0, true);
    }

    /**
     * Lexer over an embedded fragment (an f-string replacement field). Positions are shifted
     * so tokens point back into the enclosing file; indentation is not tracked.
     */
    Lexer(String source, int lineOffset, int colOffset, boolean trackIndentation) {
        this.src = source;
        this.lineOffset = lineOffset;
        this.colOffset = colOffset;
        this.trackIndentation = trackIndentation;
        this.indents.push(0);
    }

    public List<Token> tokenize() throws ParseException {
        while (pos < src.length()) {
            if (atLineStart && trackIndentation && parenDepth == 0) {
                if (handleIndentation()) {
                    continue;
                }
            }
            char c = src.charAt(pos);
            if (c == '\n' || c == '\r') {
                consumeNewline();
                continue;
            }
            if (c == ' ' || c == '\t' || c == '\f') {
                advance();
                continue;
            }
            if (c == '#') {
                while (pos < src.length() && src.charAt(pos) != '\n' && src.charAt(pos) != '\r') {
                    advance();
                }
                continue;
            }
            if (c == '\\' && pos + 1 < src.length() && (src.charAt(pos + 1) == '\n' || src.charAt(pos + 1) == '\r')) {
                advance();
                skipLineBreak();
                continue;
            }
            if (isStringStart()) {
                readString();
            } else if (Character.isDigit(c) || (c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1)))) {
                readNumber();
            } else if (isIdentStart(c)) {
                readName();
            } else {
                readOperator();
            }
        }
        finish();
        return tokens;
    }

    private boolean handleIndentation() throws ParseException {
        int width = 0;
        int p = pos;
        while (p < src.length()) {
            char c = src.charAt(p);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            p++;
        }
        if (p >= src.length()) {
            while (pos < p) {
                advance();
            }
            return true;
        }
        char first = src.charAt(p);
        if (first == '\n' || first == '\r' || first == '#') {
            while (pos < p) {
                advance();
            }
            while (pos < src.length() && src.charAt(pos) != '\n' && src.charAt(pos) != '\r') {
                advance();
            }
            if (pos < src.length()) {
                skipLineBreak();
            }
            return true;
        }
        while (pos < p) {
            advance();
        }
        atLineStart = false;
        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            add(TokenType.INDENT, "", line, 0, line, col);
        } else if (width < current) {
            while (width < indents.peek()) {
                indents.pop();
                add(TokenType.DEDENT, "", line, col, line, col);
            }
            if (width != indents.peek()) {
                throw new ParseException("Unindent does not match any outer indentation level", lineOffset + line, col);
            }
        }
        return false;
    }

    private void consumeNewline() {
        int l = line;
        int c = col;
        skipLineBreak();
        if (parenDepth == 0 && trackIndentation) {
            if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).getType() != TokenType.NEWLINE) {
                add(TokenType.NEWLINE, "\n", l, c, l, c + 1);
            }
            atLineStart = true;
        }
    }

    private void skipLineBreak() {
        if (src.charAt(pos) == '\r') {
            pos++;
            if (pos < src.length() && src.charAt(pos) == '\n') {
                pos++;
            }
        } else {
            pos++;
        }
        line++;
        col = 0;
    }

    private void finish() throws ParseException {
        if (parenDepth > 0 && trackIndentation) {
            throw new ParseException("Unexpected end of file inside brackets", lineOffset + line, col);
        }
        if (trackIndentation) {
            if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).getType() != TokenType.NEWLINE) {
                add(TokenType.NEWLINE, "\n", line, col, line, col);
            }
            while (indents.size() > 1) {
                indents.pop();
                add(TokenType.DEDENT, "", line, col, line, col);
            }
        }
        add(TokenType.ENDMARKER, "", line, col, line, col);
    }

    private boolean isStringStart() {
        int p = pos;
        int prefix = 0;
        while (p < src.length() && prefix < 2 && "rRbBuUfF".indexOf(src.charAt(p)) >= 0) {
            p++;
            prefix++;
        }
        return p < src.length() && (src.charAt(p) == '\'' || src.charAt(p) == '"');
    }

    private void readString() throws ParseException {
        int startLine = line;
        int startCol = col;
        int startPos = pos;
        StringBuilder prefix = new StringBuilder();
        while ("rRbBuUfF".indexOf(src.charAt(pos)) >= 0) {
            prefix.append(Character.toLowerCase(src.charAt(pos)));
            advance();
        }
        boolean raw = prefix.indexOf("r") >= 0;
        boolean formatted = prefix.indexOf("f") >= 0;
        char quote = src.charAt(pos);
        boolean triple = src.startsWith(String.valueOf(quote).repeat(3), pos);
        int quoteLen = triple ? 3 : 1;
        for (int i = 0; i < quoteLen; i++) {
            advance();
        }
        int bodyLine = line;
        int bodyCol = col;
        StringBuilder body = new StringBuilder();
        StringBuilder rawBody = new StringBuilder();
        while (true) {
            if (pos >= src.length()) {
                throw new ParseException("Unterminated string literal", lineOffset + startLine, startCol);
            }
            char c = src.charAt(pos);
            if (triple) {
                if (src.startsWith(String.valueOf(quote).repeat(3), pos)) {
                    advance();
                    advance();
                    advance();
                    break;
                }
            } else if (c == quote) {
                advance();
                break;
            } else if (c == '\n' || c == '\r') {
                throw new ParseException("End of line while scanning string literal", lineOffset + startLine, startCol);
            }
            if (c == '\\' && pos + 1 < src.length()) {
                char next = src.charAt(pos + 1);
                rawBody.append(c).append(next);
                if (raw || formatted) {
                    body.append(c).append(next);
                } else if (next != '\n' && next != '\r') {
                    body.append(decodeEscape());
                    continue;
                }
                advance();
                if (next == '\n' || next == '\r') {
                    skipLineBreak();
                } else {
                    advance();
                }
                continue;
            }
            body.append(c);
            rawBody.append(c);
            if (c == '\n' || c == '\r') {
                skipLineBreak();
            } else {
                advance();
            }
        }
        String rawText = src.substring(startPos, pos);
        if (formatted) {
            tokens.add(new FStringToken(rawBody.toString(), rawText, lineOffset + startLine, shiftCol(startLine, startCol),
                lineOffset + line, shiftCol(line, col), lineOffset + bodyLine, shiftCol(bodyLine, bodyCol), raw));
        } else {
            add(TokenType.STRING, body.toString(), rawText, startLine, startCol, line, col);
        }
    }

    private String decodeEscape() {
        advance();
        char e = src.charAt(pos);
        advance();
        switch (e) {
            case 'n': return "\n";
            case 't': return "\t";
            case 'r': return "\r";
            case '0': return "\0";
            case 'a': return "\u0007";
            case 'b': return "\b";
            case 'f': return "\f";
            case 'v': return "\u000b";
            case '\\': return "\\";
            case '\'': return "'";
            case '"': return "\"";
            case 'x': return hexEscape(2, "\\x");
            case 'u': return hexEscape(4, "\\u");
            case 'U': return hexEscape(8, "\\U");
            default: return "\\" + e;
        }
    }

    private String hexEscape(int digits, String fallback) {
        if (pos + digits > src.length()) {
            return fallback;
        }
        String hex = src.substring(pos, pos + digits);
        try {
            int cp = Integer.parseInt(hex, 16);
            for (int i = 0; i < digits; i++) {
                advance();
            }
            return new String(Character.toChars(cp));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }

    private void readNumber() {
        int startLine = line;
        int startCol = col;
        int start = pos;
        if (src.charAt(pos) == '0' && pos + 1 < src.length() && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
            advance();
            advance();
            while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                advance();
            }
        } else {
            while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                advance();
            }
            if (pos < src.length() && src.charAt(pos) == '.') {
                advance();
                while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
                    advance();
                }
            }
            if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
                int save = pos;
                int saveCol = col;
                advance();
                if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                    advance();
                }
                if (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                    while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                        advance();
                    }
                } else {
                    pos = save;
                    col = saveCol;
                }
            }
            if (pos < src.length() && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) {
                advance();
            }
        }
        String text = src.substring(start, pos);
        add(TokenType.NUMBER, text, text, startLine, startCol, line, col);
    }

    private void readName() {
        int startLine = line;
        int startCol = col;
        int start = pos;
        while (pos < src.length() && isIdentPart(src.charAt(pos))) {
            advance();
        }
        String text = src.substring(start, pos);
        add(TokenType.NAME, text, text, startLine, startCol, line, col);
    }

    private void readOperator() throws ParseException {
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                int startCol = col;
                for (int i = 0; i < op.length(); i++) {
                    advance();
                }
                if (op.equals("(") || op.equals("[") || op.equals("{")) {
                    parenDepth++;
                } else if (op.equals(")") || op.equals("]") || op.equals("}")) {
                    if (parenDepth > 0) {
                        parenDepth--;
                    }
                }
                add(TokenType.OP, op, op, line, startCol, line, col);
                return;
            }
        }
        throw new ParseException("Unexpected character '" + src.charAt(pos) + "'", lineOffset + line, shiftCol(line, col));
    }

    private void advance() {
        pos++;
        col++;
    }

    private void add(TokenType type, String text, int l, int c, int el, int ec) {
        add(type, text, text, l, c, el, ec);
    }

    private void add(TokenType type, String text, String raw, int l, int c, int el, int ec) {
        tokens.add(new Token(type, text, raw, lineOffset + l, shiftCol(l, c), lineOffset + el, shiftCol(el, ec)));
    }

    private int shiftCol(int l, int c) {
        return l == 1 ? c + colOffset : c;
    }

    private static boolean isIdentStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }

    /**
     * Token for an f-string; keeps the undecoded body and where it starts so that replacement
     * fields can be lexed with correct positions.
     */
    @lombok.Getter
    public static class FStringToken extends Token {
        private final int bodyLine;
        private final int bodyCol;
        private final boolean rawString;

        FStringToken(String body, String raw, int line, int col, int endLine, int endCol,
                     int bodyLine, int bodyCol, boolean rawString) {
            super(TokenType.FSTRING, body, raw, line, col, endLine, endCol);
            this.bodyLine = bodyLine;
            this.bodyCol = bodyCol;
            this.rawString = rawString;
        }
    }
}

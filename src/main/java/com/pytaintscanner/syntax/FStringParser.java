package com.pytaintscanner.syntax;

import com.pytaintscanner.syntax.PyAst.Constant;
import com.pytaintscanner.syntax.PyAst.Expr;
import com.pytaintscanner.syntax.PyAst.FormattedValue;
import com.pytaintscanner.syntax.PyAst.JoinedStr;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the body of an f-string token into literal pieces and replacement fields.
 * Field expressions are lexed and parsed in place so their positions point into the file.
 */
class FStringParser {
    private final Lexer.FStringToken token;
    private final String body;
    private final int[] lineAt;
    private final int[] colAt;

    FStringParser(Lexer.FStringToken token) {
        this.token = token;
        this.body = token.getText();
        this.lineAt = new int[body.length() + 1];
        this.colAt = new int[body.length() + 1];
        int line = token.getBodyLine();
        int col = token.getBodyCol();
        for (int i = 0; i <= body.length(); i++) {
            lineAt[i] = line;
            colAt[i] = col;
            if (i < body.length()) {
                if (body.charAt(i) == '\n') {
                    line++;
                    col = 0;
                } else {
                    col++;
                }
            }
        }
    }

    List<Expr> parse() throws ParseException {
        return segment(0, body.length());
    }

    private List<Expr> segment(int from, int to) throws ParseException {
        List<Expr> parts = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int literalStart = from;
        int i = from;
        while (i < to) {
            char c = body.charAt(i);
            if (c == '{') {
                if (i + 1 < to && body.charAt(i + 1) == '{') {
                    literal.append('{');
                    i += 2;
                    continue;
                }
                flush(parts, literal, literalStart, i);
                int close = fieldEnd(i + 1, to);
                field(parts, i, close);
                i = close + 1;
                literalStart = i;
            } else if (c == '}') {
                if (i + 1 < to && body.charAt(i + 1) == '}') {
                    literal.append('}');
                    i += 2;
                    continue;
                }
                throw new ParseException("Single '}' is not allowed in f-string", lineAt[i], colAt[i]);
            } else {
                literal.append(c);
                i++;
            }
        }
        flush(parts, literal, literalStart, to);
        return parts;
    }

    private void flush(List<Expr> parts, StringBuilder literal, int start, int end) {
        if (literal.length() == 0) {
            return;
        }
        String text = token.isRawString() ? literal.toString() : unescape(literal.toString());
        Constant c = new Constant(text, "str");
        c.line = lineAt[start];
        c.col = colAt[start];
        c.endLine = lineAt[end];
        c.endCol = colAt[end];
        parts.add(c);
        literal.setLength(0);
    }

    private int fieldEnd(int from, int to) throws ParseException {
        int depth = 0;
        char quote = 0;
        for (int i = from; i < to; i++) {
            char c = body.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        throw new ParseException("Expecting '}' in f-string", lineAt[from - 1], colAt[from - 1]);
    }

    private void field(List<Expr> parts, int open, int close) throws ParseException {
        int exprStart = open + 1;
        int exprEnd = close;
        int depth = 0;
        char quote = 0;
        for (int i = exprStart; i < close; i++) {
            char c = body.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (depth == 0 && c == '!' && (i + 1 >= close || body.charAt(i + 1) != '=')) {
                exprEnd = i;
                break;
            } else if (depth == 0 && c == ':') {
                exprEnd = i;
                break;
            }
        }

        String exprText = body.substring(exprStart, exprEnd);
        String conversion = null;
        String trimmed = exprText.stripTrailing();
        boolean debug = trimmed.endsWith("=") && trimmed.length() > 1
            && "=!<>".indexOf(trimmed.charAt(trimmed.length() - 2)) < 0;
        if (debug) {
            Constant label = new Constant(exprText, "str");
            label.line = lineAt[exprStart];
            label.col = colAt[exprStart];
            label.endLine = lineAt[exprEnd];
            label.endCol = colAt[exprEnd];
            parts.add(label);
            exprText = trimmed.substring(0, trimmed.length() - 1);
            conversion = "r";
        }
        if (exprText.isBlank()) {
            throw new ParseException("f-string: empty expression not allowed", lineAt[open], colAt[open]);
        }

        Expr value = new Parser(new Lexer(exprText, lineAt[exprStart] - 1, colAt[exprStart], false).tokenize())
            .parseStandaloneExpression();

        int rest = exprEnd;
        if (rest < close && body.charAt(rest) == '!') {
            if (rest + 1 >= close) {
                throw new ParseException("f-string: missing conversion character", lineAt[rest], colAt[rest]);
            }
            conversion = String.valueOf(body.charAt(rest + 1));
            rest += 2;
        }
        Expr formatSpec = null;
        if (rest < close && body.charAt(rest) == ':') {
            JoinedStr spec = new JoinedStr(segment(rest + 1, close));
            spec.line = lineAt[rest + 1];
            spec.col = colAt[rest + 1];
            spec.endLine = lineAt[close];
            spec.endCol = colAt[close];
            formatSpec = spec;
        }

        FormattedValue fv = new FormattedValue(value, conversion, formatSpec);
        fv.line = lineAt[open];
        fv.col = colAt[open];
        fv.endLine = lineAt[close];
        fv.endCol = colAt[close] + 1;
        parts.add(fv);
    }

    private static String unescape(String s) {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\' || i + 1 >= s.length()) {
                sb.append(c);
                continue;
            }
            char e = s.charAt(++i);
            switch (e) {
                case 'n': sb.append('\n'); break;
                case 't': sb.append('\t'); break;
                case 'r': sb.append('\r'); break;
                case '0': sb.append('\0'); break;
                case '\\': sb.append('\\'); break;
                case '\'': sb.append('\''); break;
                case '"': sb.append('"'); break;
                case '\n': break;
                default: sb.append('\\').append(e); break;
            }
        }
        return sb.toString();
    }
}

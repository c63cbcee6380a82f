package com.pytaintscanner.syntax;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A lexical token. Lines are 1-based, columns 0-based; the end position is exclusive.
 * For string tokens {@code text} holds the decoded value and {@code raw} the source slice.
 */
@Getter
@AllArgsConstructor
public class Token {
    private final TokenType type;
    private final String text;
    private final String raw;
    private final int line;
    private final int col;
    private final int endLine;
    private final int endCol;

    public boolean is(TokenType t, String value) {
        return type == t && text.equals(value);
    }

    public boolean isOp(String value) {
        return type == TokenType.OP && text.equals(value);
    }

    public boolean isKeyword(String value) {
        return type == TokenType.NAME && text.equals(value);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + col;
    }
}

package com.pytaintscanner.syntax;

public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    FSTRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    ENDMARKER
}

package com.pytaintscanner.syntax;

import lombok.Getter;

/**
 * Raised when a file cannot be tokenized or parsed. The scan engine treats it as a
 * per-file failure: the file is skipped and every other file continues.
 */
@Getter
public class ParseException extends Exception {
    private final int line;
    private final int col;

    public ParseException(String message, int line, int col) {
        super(message + " at line " + line + ", column " + col);
        this.line = line;
        this.col = col;
    }
}

package com.pytaintscanner.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public final class NodeKind {
    public static final String MODULE = "Module";
    public static final String FUNCTION = "Function";
    public static final String CLASS = "Class";
    public static final String PARAM = "Param";
    public static final String BLOCK = "Block";
    public static final String ASSIGN = "Assign";
    public static final String AUG_ASSIGN = "AugAssign";
    public static final String RETURN = "Return";
    public static final String IF = "If";
    public static final String WHILE = "While";
    public static final String FOR = "For";
    public static final String TRY = "Try";
    public static final String EXCEPT_HANDLER = "ExceptHandler";
    public static final String WITH = "With";
    public static final String RAISE = "Raise";
    public static final String ASSERT = "Assert";
    public static final String DELETE = "Delete";
    public static final String IMPORT = "Import";
    public static final String GLOBAL = "Global";
    public static final String PASS = "Pass";
    public static final String BREAK = "Break";
    public static final String CONTINUE = "Continue";
    public static final String EXPR = "Expr";
    public static final String NAME = "Name";
    public static final String LITERAL = "Literal";
    public static final String ATTRIBUTE = "Attribute";
    public static final String SUBSCRIPT = "Subscript";
    public static final String SLICE = "Slice";
    public static final String CALL = "Call";
    public static final String KEYWORD = "Keyword";
    public static final String BIN_OP = "BinOp";
    public static final String BOOL_OP = "BoolOp";
    public static final String UNARY_OP = "UnaryOp";
    public static final String COMPARE = "Compare";
    public static final String IF_EXP = "IfExp";
    public static final String LAMBDA = "Lambda";
    public static final String NAMED_EXPR = "NamedExpr";
    public static final String AWAIT = "Await";
    public static final String YIELD = "Yield";
    public static final String STARRED = "Starred";
    public static final String COMPREHENSION = "Comprehension";
    public static final String FORMATTED_VALUE = "FormattedValue";

    public static final Set<String> ALL = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
        MODULE, FUNCTION, CLASS, PARAM, BLOCK, ASSIGN, AUG_ASSIGN, RETURN, IF, WHILE, FOR, TRY,
        EXCEPT_HANDLER, WITH, RAISE, ASSERT, DELETE, IMPORT, GLOBAL, PASS, BREAK, CONTINUE, EXPR,
        NAME, LITERAL, ATTRIBUTE, SUBSCRIPT, SLICE, CALL, KEYWORD, BIN_OP, BOOL_OP, UNARY_OP,
        COMPARE, IF_EXP, LAMBDA, NAMED_EXPR, AWAIT, YIELD, STARRED, COMPREHENSION, FORMATTED_VALUE)));

    private NodeKind() {}

    public static boolean isUnit(String kind) {
        return MODULE.equals(kind) || FUNCTION.equals(kind) || CLASS.equals(kind);
    }
}

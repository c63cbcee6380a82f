package com.pytaintscanner.syntax;

import com.pytaintscanner.syntax.PyAst.*;
import com.pytaintscanner.syntax.PyAst.Module;

import java.util.List;

/**
 * Removes docstrings (a leading string-expression statement) from module, class and
 * function bodies, in place. Runs before lowering so literal hashing never sees them.
 */
public final class DocstringStripper {

    private DocstringStripper() {}

    public static Module strip(Module module) {
        stripBody(module.body);
        return module;
    }

    private static void stripBody(List<Stmt> body) {
        if (!body.isEmpty() && isDocstring(body.get(0))) {
            body.remove(0);
        }
        visit(body);
    }

    private static boolean isDocstring(Stmt stmt) {
        if (!(stmt instanceof ExprStmt)) {
            return false;
        }
        Expr value = ((ExprStmt) stmt).value;
        return value instanceof Constant && "str".equals(((Constant) value).valueType);
    }

    private static void visit(List<Stmt> stmts) {
        for (Stmt s : stmts) {
            if (s instanceof FunctionDef) {
                stripBody(((FunctionDef) s).body);
            } else if (s instanceof ClassDef) {
                stripBody(((ClassDef) s).body);
            } else if (s instanceof If) {
                visit(((If) s).body);
                visit(((If) s).orelse);
            } else if (s instanceof While) {
                visit(((While) s).body);
                visit(((While) s).orelse);
            } else if (s instanceof For) {
                visit(((For) s).body);
                visit(((For) s).orelse);
            } else if (s instanceof With) {
                visit(((With) s).body);
            } else if (s instanceof Try) {
                Try t = (Try) s;
                visit(t.body);
                for (ExceptHandler h : t.handlers) {
                    visit(h.body);
                }
                visit(t.orelse);
                visit(t.finalbody);
            }
        }
    }
}

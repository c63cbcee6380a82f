package com.pytaintscanner.syntax;

import java.util.List;

/**
 * Syntax tree produced by {@link Parser}. Node classes mirror the shape of the language grammar;
 * positions follow the lexer convention (1-based lines, 0-based columns, exclusive end).
 */
public final class PyAst {

    private PyAst() {}

    public enum Ctx { LOAD, STORE, DEL }

    public abstract static class Node {
        public int line = -1;
        public int col = -1;
        public int endLine = -1;
        public int endCol = -1;

        public String typeName() {
            return getClass().getSimpleName();
        }
    }

    public abstract static class Stmt extends Node {}

    public abstract static class Expr extends Node {}

    // ---- statements ----

    public static class Module extends Node {
        public final List<Stmt> body;
        public Module(List<Stmt> body) { this.body = body; }
    }

    public static class FunctionDef extends Stmt {
        public final String name;
        public final List<Arg> params;
        public final List<Stmt> body;
        public final List<Expr> decorators;
        public final Expr returns;
        public final boolean isAsync;

        public FunctionDef(String name, List<Arg> params, List<Stmt> body, List<Expr> decorators,
                           Expr returns, boolean isAsync) {
            this.name = name;
            this.params = params;
            this.body = body;
            this.decorators = decorators;
            this.returns = returns;
            this.isAsync = isAsync;
        }
    }

    public enum ArgKind { POSITIONAL, VARARG, KWONLY, KWARG }

    public static class Arg extends Node {
        public final String name;
        public final Expr annotation;
        public final Expr defaultValue;
        public final ArgKind kind;

        public Arg(String name, Expr annotation, Expr defaultValue, ArgKind kind) {
            this.name = name;
            this.annotation = annotation;
            this.defaultValue = defaultValue;
            this.kind = kind;
        }
    }

    public static class ClassDef extends Stmt {
        public final String name;
        public final List<Expr> bases;
        public final List<Keyword> keywords;
        public final List<Stmt> body;
        public final List<Expr> decorators;

        public ClassDef(String name, List<Expr> bases, List<Keyword> keywords, List<Stmt> body, List<Expr> decorators) {
            this.name = name;
            this.bases = bases;
            this.keywords = keywords;
            this.body = body;
            this.decorators = decorators;
        }
    }

    public static class If extends Stmt {
        public final Expr test;
        public final List<Stmt> body;
        public final List<Stmt> orelse;
        public If(Expr test, List<Stmt> body, List<Stmt> orelse) {
            this.test = test;
            this.body = body;
            this.orelse = orelse;
        }
    }

    public static class While extends Stmt {
        public final Expr test;
        public final List<Stmt> body;
        public final List<Stmt> orelse;
        public While(Expr test, List<Stmt> body, List<Stmt> orelse) {
            this.test = test;
            this.body = body;
            this.orelse = orelse;
        }
    }

    public static class For extends Stmt {
        public final Expr target;
        public final Expr iter;
        public final List<Stmt> body;
        public final List<Stmt> orelse;
        public final boolean isAsync;
        public For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse, boolean isAsync) {
            this.target = target;
            this.iter = iter;
            this.body = body;
            this.orelse = orelse;
            this.isAsync = isAsync;
        }
    }

    public static class Try extends Stmt {
        public final List<Stmt> body;
        public final List<ExceptHandler> handlers;
        public final List<Stmt> orelse;
        public final List<Stmt> finalbody;
        public Try(List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orelse, List<Stmt> finalbody) {
            this.body = body;
            this.handlers = handlers;
            this.orelse = orelse;
            this.finalbody = finalbody;
        }
    }

    public static class ExceptHandler extends Node {
        public final Expr type;
        public final String name;
        public final List<Stmt> body;
        public ExceptHandler(Expr type, String name, List<Stmt> body) {
            this.type = type;
            this.name = name;
            this.body = body;
        }
    }

    public static class With extends Stmt {
        public final List<WithItem> items;
        public final List<Stmt> body;
        public final boolean isAsync;
        public With(List<WithItem> items, List<Stmt> body, boolean isAsync) {
            this.items = items;
            this.body = body;
            this.isAsync = isAsync;
        }
    }

    public static class WithItem {
        public final Expr contextExpr;
        public final Expr optionalVars;
        public WithItem(Expr contextExpr, Expr optionalVars) {
            this.contextExpr = contextExpr;
            this.optionalVars = optionalVars;
        }
    }

    public static class Return extends Stmt {
        public final Expr value;
        public Return(Expr value) { this.value = value; }
    }

    public static class Raise extends Stmt {
        public final Expr exc;
        public final Expr cause;
        public Raise(Expr exc, Expr cause) {
            this.exc = exc;
            this.cause = cause;
        }
    }

    public static class Assert extends Stmt {
        public final Expr test;
        public final Expr msg;
        public Assert(Expr test, Expr msg) {
            this.test = test;
            this.msg = msg;
        }
    }

    public static class Delete extends Stmt {
        public final List<Expr> targets;
        public Delete(List<Expr> targets) { this.targets = targets; }
    }

    public static class Pass extends Stmt {}

    public static class Break extends Stmt {}

    public static class Continue extends Stmt {}

    public static class Alias {
        public final String name;
        public final String asname;
        public Alias(String name, String asname) {
            this.name = name;
            this.asname = asname;
        }
    }

    public static class Import extends Stmt {
        public final List<Alias> names;
        public Import(List<Alias> names) { this.names = names; }
    }

    public static class ImportFrom extends Stmt {
        public final String module;
        public final List<Alias> names;
        public final int level;
        public ImportFrom(String module, List<Alias> names, int level) {
            this.module = module;
            this.names = names;
            this.level = level;
        }
    }

    public static class Global extends Stmt {
        public final List<String> names;
        public final boolean nonlocal;
        public Global(List<String> names, boolean nonlocal) {
            this.names = names;
            this.nonlocal = nonlocal;
        }
    }

    public static class Assign extends Stmt {
        public final List<Expr> targets;
        public final Expr value;
        public Assign(List<Expr> targets, Expr value) {
            this.targets = targets;
            this.value = value;
        }
    }

    public static class AugAssign extends Stmt {
        public final Expr target;
        public final String op;
        public final Expr value;
        public AugAssign(Expr target, String op, Expr value) {
            this.target = target;
            this.op = op;
            this.value = value;
        }
    }

    public static class AnnAssign extends Stmt {
        public final Expr target;
        public final Expr annotation;
        public final Expr value;
        public AnnAssign(Expr target, Expr annotation, Expr value) {
            this.target = target;
            this.annotation = annotation;
            this.value = value;
        }
    }

    public static class ExprStmt extends Stmt {
        public final Expr value;
        public ExprStmt(Expr value) { this.value = value; }
    }

    public static class UnsupportedStmt extends Stmt {
        public final String construct;
        public UnsupportedStmt(String construct) { this.construct = construct; }
    }

    // ---- expressions ----

    public static class Name extends Expr {
        public final String id;
        public Ctx ctx = Ctx.LOAD;
        public Name(String id) { this.id = id; }
    }

    public static class Constant extends Expr {
        public final Object value;
        public final String valueType;
        public Constant(Object value, String valueType) {
            this.value = value;
            this.valueType = valueType;
        }
    }

    public static class JoinedStr extends Expr {
        public final List<Expr> values;
        public JoinedStr(List<Expr> values) { this.values = values; }
    }

    public static class FormattedValue extends Expr {
        public final Expr value;
        public final String conversion;
        public final Expr formatSpec;
        public FormattedValue(Expr value, String conversion, Expr formatSpec) {
            this.value = value;
            this.conversion = conversion;
            this.formatSpec = formatSpec;
        }
    }

    public static class Attribute extends Expr {
        public final Expr value;
        public final String attr;
        public Ctx ctx = Ctx.LOAD;
        public Attribute(Expr value, String attr) {
            this.value = value;
            this.attr = attr;
        }
    }

    public static class Subscript extends Expr {
        public final Expr value;
        public final Expr slice;
        public Ctx ctx = Ctx.LOAD;
        public Subscript(Expr value, Expr slice) {
            this.value = value;
            this.slice = slice;
        }
    }

    public static class Slice extends Expr {
        public final Expr lower;
        public final Expr upper;
        public final Expr step;
        public Slice(Expr lower, Expr upper, Expr step) {
            this.lower = lower;
            this.upper = upper;
            this.step = step;
        }
    }

    public static class Keyword extends Node {
        public final String arg;
        public final Expr value;
        public Keyword(String arg, Expr value) {
            this.arg = arg;
            this.value = value;
        }
    }

    public static class Call extends Expr {
        public final Expr func;
        public final List<Expr> args;
        public final List<Keyword> keywords;
        public Call(Expr func, List<Expr> args, List<Keyword> keywords) {
            this.func = func;
            this.args = args;
            this.keywords = keywords;
        }
    }

    public static class Starred extends Expr {
        public final Expr value;
        public Ctx ctx = Ctx.LOAD;
        public Starred(Expr value) { this.value = value; }
    }

    public static class BinOp extends Expr {
        public final Expr left;
        public final String op;
        public final Expr right;
        public BinOp(Expr left, String op, Expr right) {
            this.left = left;
            this.op = op;
            this.right = right;
        }
    }

    public static class UnaryOp extends Expr {
        public final String op;
        public final Expr operand;
        public UnaryOp(String op, Expr operand) {
            this.op = op;
            this.operand = operand;
        }
    }

    public static class BoolOp extends Expr {
        public final String op;
        public final List<Expr> values;
        public BoolOp(String op, List<Expr> values) {
            this.op = op;
            this.values = values;
        }
    }

    public static class Compare extends Expr {
        public final Expr left;
        public final List<String> ops;
        public final List<Expr> comparators;
        public Compare(Expr left, List<String> ops, List<Expr> comparators) {
            this.left = left;
            this.ops = ops;
            this.comparators = comparators;
        }
    }

    public static class IfExp extends Expr {
        public final Expr test;
        public final Expr body;
        public final Expr orelse;
        public IfExp(Expr test, Expr body, Expr orelse) {
            this.test = test;
            this.body = body;
            this.orelse = orelse;
        }
    }

    public static class Lambda extends Expr {
        public final List<Arg> params;
        public final Expr body;
        public Lambda(List<Arg> params, Expr body) {
            this.params = params;
            this.body = body;
        }
    }

    public static class NamedExpr extends Expr {
        public final Name target;
        public final Expr value;
        public NamedExpr(Name target, Expr value) {
            this.target = target;
            this.value = value;
        }
    }

    public enum CollectionKind { LIST, TUPLE, SET }

    public static class Collection extends Expr {
        public final CollectionKind kind;
        public final List<Expr> elts;
        public Ctx ctx = Ctx.LOAD;
        public Collection(CollectionKind kind, List<Expr> elts) {
            this.kind = kind;
            this.elts = elts;
        }
    }

    public static class DictExpr extends Expr {
        /** A null key marks {@code **mapping} unpacking. */
        public final List<Expr> keys;
        public final List<Expr> values;
        public DictExpr(List<Expr> keys, List<Expr> values) {
            this.keys = keys;
            this.values = values;
        }
    }

    public enum ComprehensionKind { LIST, SET, DICT, GENERATOR }

    public static class Comprehension extends Expr {
        public final ComprehensionKind kind;
        public final Expr elt;
        public final Expr value;
        public final List<ComprehensionFor> generators;
        public Comprehension(ComprehensionKind kind, Expr elt, Expr value, List<ComprehensionFor> generators) {
            this.kind = kind;
            this.elt = elt;
            this.value = value;
            this.generators = generators;
        }
    }

    public static class ComprehensionFor extends Node {
        public final Expr target;
        public final Expr iter;
        public final List<Expr> ifs;
        public final boolean isAsync;
        public ComprehensionFor(Expr target, Expr iter, List<Expr> ifs, boolean isAsync) {
            this.target = target;
            this.iter = iter;
            this.ifs = ifs;
            this.isAsync = isAsync;
        }
    }

    public static class Await extends Expr {
        public final Expr value;
        public Await(Expr value) { this.value = value; }
    }

    public static class Yield extends Expr {
        public final Expr value;
        public final boolean isFrom;
        public Yield(Expr value, boolean isFrom) {
            this.value = value;
            this.isFrom = isFrom;
        }
    }
}

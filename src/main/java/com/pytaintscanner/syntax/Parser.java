package com.pytaintscanner.syntax;

import com.pytaintscanner.syntax.PyAst.*;
import com.pytaintscanner.syntax.PyAst.Module;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for the supported Python subset.
 * {@code match} statements and {@code type} aliases are consumed whole and returned as
 * {@link UnsupportedStmt}; anything else outside the grammar is a {@link ParseException}.
 */
public class Parser {
    private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
        "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
        "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
        "return", "try", "while", "with", "yield"));
    private static final Set<String> AUG_OPS = new HashSet<>(Arrays.asList(
        "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@="));
    private static final Set<String> COMPARE_OPS = new HashSet<>(Arrays.asList(
        "<", ">", "==", ">=", "<=", "!="));

    // nested expressions and blocks; deeper input is rejected rather than overflowing the stack
    static final int MAX_NESTING = 100;

    private final List<Token> tokens;
    private int pos;
    private int nesting;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Module parse(String source) throws ParseException {
        return new Parser(new Lexer(source).tokenize()).parseModule();
    }

    public Module parseModule() throws ParseException {
        List<Stmt> body = new ArrayList<>();
        while (!at(TokenType.ENDMARKER)) {
            if (at(TokenType.NEWLINE)) {
                next();
                continue;
            }
            body.addAll(statement());
        }
        Module module = new Module(body);
        if (!body.isEmpty()) {
            module.line = body.get(0).line;
            module.col = 0;
            Stmt last = body.get(body.size() - 1);
            module.endLine = last.endLine;
            module.endCol = last.endCol;
        } else {
            module.line = 1;
            module.col = 0;
            module.endLine = 1;
            module.endCol = 0;
        }
        return module;
    }

    Expr parseStandaloneExpression() throws ParseException {
        Expr e = testListStarExpr();
        if (!at(TokenType.ENDMARKER)) {
            throw error("Unexpected token in embedded expression");
        }
        return e;
    }

    // ---------------------------------------------------------------- statements

    private List<Stmt> statement() throws ParseException {
        Token t = peek();
        if (t.getType() == TokenType.NAME) {
            switch (t.getText()) {
                case "if": return single(ifStmt());
                case "while": return single(whileStmt());
                case "for": return single(forStmt(t, false));
                case "try": return single(tryStmt());
                case "with": return single(withStmt(t, false));
                case "def": return single(funcDef(t, Collections.emptyList(), false));
                case "class": return single(classDef(t, Collections.emptyList()));
                case "async": return single(asyncStmt(t, Collections.emptyList()));
                case "match":
                    if (looksLikeMatchStatement()) {
                        return single(unsupportedBlock("match"));
                    }
                    break;
                case "type":
                    if (peekAt(1).getType() == TokenType.NAME && (peekAt(2).isOp("=") || peekAt(2).isOp("["))) {
                        return single(unsupportedLine("type_alias"));
                    }
                    break;
                default:
                    break;
            }
        } else if (t.isOp("@")) {
            return single(decorated());
        }
        return simpleStatements();
    }

    private static List<Stmt> single(Stmt s) {
        List<Stmt> list = new ArrayList<>(1);
        list.add(s);
        return list;
    }

    private List<Stmt> simpleStatements() throws ParseException {
        List<Stmt> stmts = new ArrayList<>();
        stmts.add(smallStatement());
        while (acceptOp(";")) {
            if (at(TokenType.NEWLINE) || at(TokenType.ENDMARKER)) {
                break;
            }
            stmts.add(smallStatement());
        }
        if (!accept(TokenType.NEWLINE) && !at(TokenType.ENDMARKER)) {
            throw error("Expected end of statement");
        }
        return stmts;
    }

    private Stmt smallStatement() throws ParseException {
        Token start = peek();
        if (start.getType() == TokenType.NAME) {
            switch (start.getText()) {
                case "pass":
                    next();
                    return finish(new Pass(), start);
                case "break":
                    next();
                    return finish(new Break(), start);
                case "continue":
                    next();
                    return finish(new Continue(), start);
                case "return": {
                    next();
                    Expr value = atStatementEnd() ? null : testListStarExpr();
                    return finish(new Return(value), start);
                }
                case "raise": {
                    next();
                    Expr exc = null;
                    Expr cause = null;
                    if (!atStatementEnd()) {
                        exc = test();
                        if (acceptKeyword("from")) {
                            cause = test();
                        }
                    }
                    return finish(new Raise(exc, cause), start);
                }
                case "global":
                case "nonlocal": {
                    next();
                    List<String> names = new ArrayList<>();
                    names.add(expectName());
                    while (acceptOp(",")) {
                        names.add(expectName());
                    }
                    return finish(new Global(names, start.getText().equals("nonlocal")), start);
                }
                case "del": {
                    next();
                    List<Expr> targets = new ArrayList<>();
                    targets.add(setContext(bitOr(), Ctx.DEL));
                    while (acceptOp(",")) {
                        if (atStatementEnd()) {
                            break;
                        }
                        targets.add(setContext(bitOr(), Ctx.DEL));
                    }
                    return finish(new Delete(targets), start);
                }
                case "assert": {
                    next();
                    Expr test = test();
                    Expr msg = acceptOp(",") ? test() : null;
                    return finish(new Assert(test, msg), start);
                }
                case "import":
                    return importStmt(start);
                case "from":
                    return importFrom(start);
                default:
                    break;
            }
        }
        return exprStatement(start);
    }

    private Stmt exprStatement(Token start) throws ParseException {
        Expr first = at(TokenType.NAME) && peek().isKeyword("yield") ? yieldExpr() : testListStarExpr();
        if (peek().isOp("=")) {
            List<Expr> items = new ArrayList<>();
            items.add(first);
            while (acceptOp("=")) {
                items.add(peek().isKeyword("yield") ? yieldExpr() : testListStarExpr());
            }
            Expr value = items.remove(items.size() - 1);
            for (Expr target : items) {
                setContext(target, Ctx.STORE);
            }
            return finish(new Assign(items, value), start);
        }
        if (peek().getType() == TokenType.OP && AUG_OPS.contains(peek().getText())) {
            String op = next().getText();
            checkSingleTarget(first);
            setContext(first, Ctx.STORE);
            Expr value = peek().isKeyword("yield") ? yieldExpr() : testListStarExpr();
            return finish(new AugAssign(first, op.substring(0, op.length() - 1), value), start);
        }
        if (peek().isOp(":")) {
            next();
            checkSingleTarget(first);
            setContext(first, Ctx.STORE);
            Expr annotation = test();
            Expr value = null;
            if (acceptOp("=")) {
                value = peek().isKeyword("yield") ? yieldExpr() : testListStarExpr();
            }
            return finish(new AnnAssign(first, annotation, value), start);
        }
        return finish(new ExprStmt(first), start);
    }

    private void checkSingleTarget(Expr target) throws ParseException {
        if (!(target instanceof Name || target instanceof Attribute || target instanceof Subscript)) {
            throw new ParseException("Illegal target for augmented or annotated assignment", target.line, target.col);
        }
    }

    private Stmt importStmt(Token start) throws ParseException {
        next();
        List<Alias> names = new ArrayList<>();
        do {
            String name = dottedName();
            String asname = acceptKeyword("as") ? expectName() : null;
            names.add(new Alias(name, asname));
        } while (acceptOp(","));
        return finish(new Import(names), start);
    }

    private Stmt importFrom(Token start) throws ParseException {
        next();
        int level = 0;
        while (peek().isOp(".") || peek().isOp("...")) {
            level += next().getText().length();
        }
        String module = null;
        if (!peek().isKeyword("import")) {
            module = dottedName();
        }
        expectKeyword("import");
        List<Alias> names = new ArrayList<>();
        if (acceptOp("*")) {
            names.add(new Alias("*", null));
        } else {
            boolean paren = acceptOp("(");
            do {
                if (paren && peek().isOp(")")) {
                    break;
                }
                String name = expectName();
                String asname = acceptKeyword("as") ? expectName() : null;
                names.add(new Alias(name, asname));
            } while (acceptOp(","));
            if (paren) {
                expectOp(")");
            }
        }
        return finish(new ImportFrom(module, names, level), start);
    }

    private String dottedName() throws ParseException {
        StringBuilder sb = new StringBuilder(expectName());
        while (acceptOp(".")) {
            sb.append('.').append(expectName());
        }
        return sb.toString();
    }

    private Stmt ifStmt() throws ParseException {
        Token start = next();
        Expr test = namedExprTest();
        List<Stmt> body = block();
        List<Stmt> orelse = new ArrayList<>();
        Token elif = peek();
        if (elif.isKeyword("elif")) {
            orelse.add(ifStmt());
        } else if (acceptKeyword("else")) {
            orelse = block();
        }
        return finishAt(new If(test, body, orelse), start, lastLine(body, orelse));
    }

    private Stmt whileStmt() throws ParseException {
        Token start = next();
        Expr test = namedExprTest();
        List<Stmt> body = block();
        List<Stmt> orelse = acceptKeyword("else") ? block() : new ArrayList<>();
        return finishAt(new While(test, body, orelse), start, lastLine(body, orelse));
    }

    private Stmt forStmt(Token start, boolean isAsync) throws ParseException {
        expectKeyword("for");
        Expr target = targetList();
        expectKeyword("in");
        Expr iter = testListStarExpr();
        List<Stmt> body = block();
        List<Stmt> orelse = acceptKeyword("else") ? block() : new ArrayList<>();
        return finishAt(new For(target, iter, body, orelse, isAsync), start, lastLine(body, orelse));
    }

    private Stmt tryStmt() throws ParseException {
        Token start = next();
        List<Stmt> body = block();
        List<ExceptHandler> handlers = new ArrayList<>();
        List<Stmt> orelse = new ArrayList<>();
        List<Stmt> finalbody = new ArrayList<>();
        while (peek().isKeyword("except")) {
            Token hStart = next();
            acceptOp("*");
            Expr type = null;
            String name = null;
            if (!peek().isOp(":")) {
                type = test();
                if (acceptOp(",")) {
                    List<Expr> elts = new ArrayList<>();
                    elts.add(type);
                    do {
                        elts.add(test());
                    } while (acceptOp(","));
                    type = finish(new Collection(CollectionKind.TUPLE, elts), type);
                }
                if (acceptKeyword("as")) {
                    name = expectName();
                }
            }
            List<Stmt> hBody = block();
            handlers.add(finishAt(new ExceptHandler(type, name, hBody), hStart, hBody.get(hBody.size() - 1)));
        }
        if (acceptKeyword("else")) {
            orelse = block();
        }
        if (acceptKeyword("finally")) {
            finalbody = block();
        }
        if (handlers.isEmpty() && finalbody.isEmpty()) {
            throw error("Expected 'except' or 'finally' block");
        }
        Node last = !finalbody.isEmpty() ? finalbody.get(finalbody.size() - 1)
            : !orelse.isEmpty() ? orelse.get(orelse.size() - 1)
            : handlers.get(handlers.size() - 1);
        return finishAt(new Try(body, handlers, orelse, finalbody), start, last);
    }

    private Stmt withStmt(Token start, boolean isAsync) throws ParseException {
        expectKeyword("with");
        List<WithItem> items = new ArrayList<>();
        boolean paren = false;
        if (peek().isOp("(") && parenthesizedWithItems()) {
            next();
            paren = true;
        }
        do {
            if (paren && peek().isOp(")")) {
                break;
            }
            Expr ctx = test();
            Expr vars = null;
            if (acceptKeyword("as")) {
                vars = setContext(bitOrOrStar(), Ctx.STORE);
            }
            items.add(new WithItem(ctx, vars));
        } while (acceptOp(","));
        if (paren) {
            expectOp(")");
        }
        List<Stmt> body = block();
        return finishAt(new With(items, body, isAsync), start, body.get(body.size() - 1));
    }

    private boolean parenthesizedWithItems() {
        int depth = 0;
        for (int i = pos; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isOp("(") || t.isOp("[") || t.isOp("{")) {
                depth++;
            } else if (t.isOp(")") || t.isOp("]") || t.isOp("}")) {
                depth--;
                if (depth == 0) {
                    return i + 1 < tokens.size() && tokens.get(i + 1).isOp(":") && containsAsAtDepthOne(pos, i);
                }
            } else if (t.getType() == TokenType.NEWLINE) {
                return false;
            }
        }
        return false;
    }

    private boolean containsAsAtDepthOne(int from, int to) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            Token t = tokens.get(i);
            if (t.isOp("(") || t.isOp("[") || t.isOp("{")) {
                depth++;
            } else if (t.isOp(")") || t.isOp("]") || t.isOp("}")) {
                depth--;
            } else if (depth == 1 && t.isKeyword("as")) {
                return true;
            }
        }
        return false;
    }

    private Stmt asyncStmt(Token start, List<Expr> decorators) throws ParseException {
        next();
        Token t = peek();
        if (t.isKeyword("def")) {
            return funcDef(start, decorators, true);
        }
        if (!decorators.isEmpty()) {
            throw error("Expected 'def' after decorators");
        }
        if (t.isKeyword("for")) {
            return forStmt(start, true);
        }
        if (t.isKeyword("with")) {
            return withStmt(start, true);
        }
        throw error("Expected 'def', 'for' or 'with' after 'async'");
    }

    private Stmt decorated() throws ParseException {
        Token start = peek();
        List<Expr> decorators = new ArrayList<>();
        while (acceptOp("@")) {
            decorators.add(namedExprTest());
            expect(TokenType.NEWLINE);
        }
        Token t = peek();
        if (t.isKeyword("def")) {
            return funcDef(start, decorators, false);
        }
        if (t.isKeyword("class")) {
            return classDef(start, decorators);
        }
        if (t.isKeyword("async")) {
            return asyncStmt(start, decorators);
        }
        throw error("Expected function or class definition after decorator");
    }

    private Stmt funcDef(Token start, List<Expr> decorators, boolean isAsync) throws ParseException {
        expectKeyword("def");
        String name = expectName();
        expectOp("(");
        List<Arg> params = parameters(")", true);
        expectOp(")");
        Expr returns = acceptOp("->") ? test() : null;
        List<Stmt> body = block();
        return finishAt(new FunctionDef(name, params, body, decorators, returns, isAsync), start, body.get(body.size() - 1));
    }

    private List<Arg> parameters(String closer, boolean annotations) throws ParseException {
        List<Arg> params = new ArrayList<>();
        ArgKind kind = ArgKind.POSITIONAL;
        while (!peek().isOp(closer)) {
            Token pStart = peek();
            if (acceptOp("/")) {
                // positional-only marker
            } else if (acceptOp("**")) {
                params.add(param(pStart, ArgKind.KWARG, annotations));
            } else if (acceptOp("*")) {
                if (peek().getType() == TokenType.NAME) {
                    params.add(param(pStart, ArgKind.VARARG, annotations));
                }
                kind = ArgKind.KWONLY;
            } else {
                params.add(param(pStart, kind, annotations));
            }
            if (!acceptOp(",")) {
                break;
            }
        }
        return params;
    }

    private Arg param(Token start, ArgKind kind, boolean annotations) throws ParseException {
        String name = expectName();
        Expr annotation = null;
        if (annotations && acceptOp(":")) {
            annotation = test();
        }
        Expr defaultValue = acceptOp("=") ? test() : null;
        return finish(new Arg(name, annotation, defaultValue, kind), start);
    }

    private Stmt classDef(Token start, List<Expr> decorators) throws ParseException {
        expectKeyword("class");
        String name = expectName();
        List<Expr> bases = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        if (acceptOp("(")) {
            callArguments(bases, keywords);
            expectOp(")");
        }
        List<Stmt> body = block();
        return finishAt(new ClassDef(name, bases, keywords, body, decorators), start, body.get(body.size() - 1));
    }

    private List<Stmt> block() throws ParseException {
        descend();
        try {
            return blockBody();
        } finally {
            nesting--;
        }
    }

    private List<Stmt> blockBody() throws ParseException {
        expectOp(":");
        if (accept(TokenType.NEWLINE)) {
            expect(TokenType.INDENT);
            List<Stmt> body = new ArrayList<>();
            while (!at(TokenType.DEDENT) && !at(TokenType.ENDMARKER)) {
                if (accept(TokenType.NEWLINE)) {
                    continue;
                }
                body.addAll(statement());
            }
            accept(TokenType.DEDENT);
            if (body.isEmpty()) {
                throw error("Expected an indented block");
            }
            return body;
        }
        return simpleStatements();
    }

    private boolean looksLikeMatchStatement() {
        int depth = 0;
        int i = pos + 1;
        Token first = peekAt(1);
        if (first.getType() == TokenType.NEWLINE || first.isOp("=") || first.isOp(".") || first.isOp(":")
            || (first.getType() == TokenType.OP && AUG_OPS.contains(first.getText()))) {
            return false;
        }
        for (; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isOp("(") || t.isOp("[") || t.isOp("{")) {
                depth++;
            } else if (t.isOp(")") || t.isOp("]") || t.isOp("}")) {
                depth--;
            } else if (t.getType() == TokenType.NEWLINE && depth == 0) {
                break;
            }
        }
        return i + 2 < tokens.size()
            && tokens.get(i - 1).isOp(":")
            && tokens.get(i + 1).getType() == TokenType.INDENT
            && tokens.get(i + 2).isKeyword("case");
    }

    private Stmt unsupportedBlock(String construct) throws ParseException {
        Token start = next();
        while (!at(TokenType.NEWLINE)) {
            next();
        }
        next();
        expect(TokenType.INDENT);
        int depth = 1;
        while (depth > 0) {
            Token t = next();
            if (t.getType() == TokenType.INDENT) {
                depth++;
            } else if (t.getType() == TokenType.DEDENT) {
                depth--;
            } else if (t.getType() == TokenType.ENDMARKER) {
                throw error("Unexpected end of file");
            }
        }
        UnsupportedStmt stmt = new UnsupportedStmt(construct);
        stmt.line = start.getLine();
        stmt.col = start.getCol();
        Token last = lastNonLayout();
        stmt.endLine = last.getEndLine();
        stmt.endCol = last.getEndCol();
        return stmt;
    }

    private Stmt unsupportedLine(String construct) throws ParseException {
        Token start = next();
        while (!at(TokenType.NEWLINE) && !at(TokenType.ENDMARKER)) {
            next();
        }
        UnsupportedStmt stmt = finish(new UnsupportedStmt(construct), start);
        accept(TokenType.NEWLINE);
        return stmt;
    }

    private Token lastNonLayout() {
        for (int i = pos - 1; i >= 0; i--) {
            TokenType type = tokens.get(i).getType();
            if (type != TokenType.DEDENT && type != TokenType.INDENT && type != TokenType.NEWLINE) {
                return tokens.get(i);
            }
        }
        return tokens.get(0);
    }

    // ---------------------------------------------------------------- expressions

    private Expr testListStarExpr() throws ParseException {
        Token start = peek();
        Expr first = namedExprOrStar();
        if (!peek().isOp(",")) {
            return first;
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (atExpressionEnd()) {
                break;
            }
            elts.add(namedExprOrStar());
        }
        return finish(new Collection(CollectionKind.TUPLE, elts), start);
    }

    private Expr targetList() throws ParseException {
        Token start = peek();
        Expr first = bitOrOrStar();
        if (!peek().isOp(",")) {
            return setContext(first, Ctx.STORE);
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (peek().isKeyword("in")) {
                break;
            }
            elts.add(bitOrOrStar());
        }
        return setContext(finish(new Collection(CollectionKind.TUPLE, elts), start), Ctx.STORE);
    }

    private Expr bitOrOrStar() throws ParseException {
        Token start = peek();
        if (acceptOp("*")) {
            return finish(new Starred(bitOr()), start);
        }
        return bitOr();
    }

    private Expr namedExprOrStar() throws ParseException {
        Token start = peek();
        if (acceptOp("*")) {
            return finish(new Starred(bitOr()), start);
        }
        return namedExprTest();
    }

    private Expr namedExprTest() throws ParseException {
        Token start = peek();
        if (start.getType() == TokenType.NAME && peekAt(1).isOp(":=") && !KEYWORDS.contains(start.getText())) {
            next();
            next();
            Name target = finish(new Name(start.getText()), start);
            target.ctx = Ctx.STORE;
            Expr value = test();
            return finish(new NamedExpr(target, value), start);
        }
        return test();
    }

    private Expr test() throws ParseException {
        descend();
        try {
            return conditional();
        } finally {
            nesting--;
        }
    }

    private Expr conditional() throws ParseException {
        Token start = peek();
        if (start.isKeyword("lambda")) {
            return lambda();
        }
        Expr body = orTest();
        if (peek().isKeyword("if")) {
            next();
            Expr cond = orTest();
            expectKeyword("else");
            Expr orelse = test();
            return finish(new IfExp(cond, body, orelse), start);
        }
        return body;
    }

    private Expr testNoCond() throws ParseException {
        if (peek().isKeyword("lambda")) {
            return lambda();
        }
        return orTest();
    }

    private Expr lambda() throws ParseException {
        Token start = next();
        List<Arg> params = parameters(":", false);
        expectOp(":");
        Expr body = test();
        return finish(new Lambda(params, body), start);
    }

    private Expr orTest() throws ParseException {
        Token start = peek();
        Expr first = andTest();
        if (!peek().isKeyword("or")) {
            return first;
        }
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (acceptKeyword("or")) {
            values.add(andTest());
        }
        return finish(new BoolOp("Or", values), start);
    }

    private Expr andTest() throws ParseException {
        Token start = peek();
        Expr first = notTest();
        if (!peek().isKeyword("and")) {
            return first;
        }
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (acceptKeyword("and")) {
            values.add(notTest());
        }
        return finish(new BoolOp("And", values), start);
    }

    private Expr notTest() throws ParseException {
        Token start = peek();
        if (acceptKeyword("not")) {
            descend();
            try {
                return finish(new UnaryOp("Not", notTest()), start);
            } finally {
                nesting--;
            }
        }
        return comparison();
    }

    private Expr comparison() throws ParseException {
        Token start = peek();
        Expr left = bitOr();
        List<String> ops = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        while (true) {
            Token t = peek();
            String op = null;
            if (t.getType() == TokenType.OP && COMPARE_OPS.contains(t.getText())) {
                next();
                op = t.getText();
            } else if (t.isKeyword("in")) {
                next();
                op = "in";
            } else if (t.isKeyword("not") && peekAt(1).isKeyword("in")) {
                next();
                next();
                op = "not in";
            } else if (t.isKeyword("is")) {
                next();
                op = acceptKeyword("not") ? "is not" : "is";
            }
            if (op == null) {
                break;
            }
            ops.add(op);
            comparators.add(bitOr());
        }
        if (ops.isEmpty()) {
            return left;
        }
        return finish(new Compare(left, ops, comparators), start);
    }

    private Expr bitOr() throws ParseException {
        return binary(0);
    }

    private static final String[][] BINARY_LEVELS = {
        {"|"}, {"^"}, {"&"}, {"<<", ">>"}, {"+", "-"}, {"*", "/", "%", "//", "@"}
    };

    private Expr binary(int level) throws ParseException {
        if (level == BINARY_LEVELS.length) {
            return factor();
        }
        Token start = peek();
        Expr left = binary(level + 1);
        while (peek().getType() == TokenType.OP && Arrays.asList(BINARY_LEVELS[level]).contains(peek().getText())) {
            String op = next().getText();
            Expr right = binary(level + 1);
            left = finish(new BinOp(left, op, right), start);
        }
        return left;
    }

    private Expr factor() throws ParseException {
        Token start = peek();
        if (start.isOp("-") || start.isOp("+") || start.isOp("~")) {
            next();
            descend();
            try {
                return finish(new UnaryOp(start.getText(), factor()), start);
            } finally {
                nesting--;
            }
        }
        return power();
    }

    private Expr power() throws ParseException {
        Token start = peek();
        Expr base;
        if (start.isKeyword("await")) {
            next();
            base = finish(new Await(primary()), start);
        } else {
            base = primary();
        }
        if (acceptOp("**")) {
            Expr exp = factor();
            return finish(new BinOp(base, "**", exp), start);
        }
        return base;
    }

    private Expr primary() throws ParseException {
        Token start = peek();
        Expr e = atom();
        while (true) {
            if (acceptOp(".")) {
                e = finish(new Attribute(e, expectName()), start);
            } else if (acceptOp("(")) {
                List<Expr> args = new ArrayList<>();
                List<Keyword> keywords = new ArrayList<>();
                callArguments(args, keywords);
                expectOp(")");
                e = finish(new Call(e, args, keywords), start);
            } else if (acceptOp("[")) {
                Expr slice = subscriptList();
                expectOp("]");
                e = finish(new Subscript(e, slice), start);
            } else {
                return e;
            }
        }
    }

    private void callArguments(List<Expr> args, List<Keyword> keywords) throws ParseException {
        while (!peek().isOp(")")) {
            Token aStart = peek();
            if (acceptOp("**")) {
                keywords.add(finish(new Keyword(null, test()), aStart));
            } else if (acceptOp("*")) {
                args.add(finish(new Starred(test()), aStart));
            } else if (aStart.getType() == TokenType.NAME && peekAt(1).isOp("=") && !KEYWORDS.contains(aStart.getText())) {
                next();
                next();
                keywords.add(finish(new Keyword(aStart.getText(), test()), aStart));
            } else {
                Expr arg = namedExprTest();
                if (peek().isKeyword("for") || (peek().isKeyword("async") && peekAt(1).isKeyword("for"))) {
                    arg = finish(new Comprehension(ComprehensionKind.GENERATOR, arg, null, compFor()), aStart);
                }
                args.add(arg);
            }
            if (!acceptOp(",")) {
                break;
            }
        }
    }

    private Expr subscriptList() throws ParseException {
        Token start = peek();
        Expr first = subscript();
        if (!peek().isOp(",")) {
            return first;
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (peek().isOp("]")) {
                break;
            }
            elts.add(subscript());
        }
        return finish(new Collection(CollectionKind.TUPLE, elts), start);
    }

    private Expr subscript() throws ParseException {
        Token start = peek();
        Expr lower = null;
        if (!peek().isOp(":")) {
            lower = namedExprOrStar();
            if (!peek().isOp(":")) {
                return lower;
            }
        }
        expectOp(":");
        Expr upper = null;
        Expr step = null;
        if (!peek().isOp("]") && !peek().isOp(",") && !peek().isOp(":")) {
            upper = test();
        }
        if (acceptOp(":")) {
            if (!peek().isOp("]") && !peek().isOp(",")) {
                step = test();
            }
        }
        return finish(new Slice(lower, upper, step), start);
    }

    private Expr atom() throws ParseException {
        Token t = peek();
        switch (t.getType()) {
            case NAME: {
                String text = t.getText();
                if (text.equals("None")) {
                    next();
                    return finish(new Constant(null, "NoneType"), t);
                }
                if (text.equals("True") || text.equals("False")) {
                    next();
                    return finish(new Constant(Boolean.valueOf(text), "bool"), t);
                }
                if (KEYWORDS.contains(text)) {
                    throw error("Unexpected keyword '" + text + "'");
                }
                next();
                return finish(new Name(text), t);
            }
            case NUMBER:
                next();
                return finish(numberConstant(t.getText()), t);
            case STRING:
            case FSTRING:
                return strings();
            case OP:
                if (t.isOp("(")) {
                    return parenthesized();
                }
                if (t.isOp("[")) {
                    return listDisplay();
                }
                if (t.isOp("{")) {
                    return dictOrSetDisplay();
                }
                if (t.isOp("...")) {
                    next();
                    return finish(new Constant("...", "ellipsis"), t);
                }
                throw error("Unexpected '" + t.getText() + "'");
            default:
                throw error("Unexpected " + t.getType());
        }
    }

    private static Constant numberConstant(String text) {
        String clean = text.replace("_", "");
        String lower = clean.toLowerCase();
        try {
            if (lower.endsWith("j")) {
                return new Constant(clean, "complex");
            }
            if (lower.startsWith("0x")) {
                return new Constant(Long.parseLong(clean.substring(2), 16), "int");
            }
            if (lower.startsWith("0o")) {
                return new Constant(Long.parseLong(clean.substring(2), 8), "int");
            }
            if (lower.startsWith("0b")) {
                return new Constant(Long.parseLong(clean.substring(2), 2), "int");
            }
            if (lower.contains(".") || lower.contains("e")) {
                return new Constant(Double.parseDouble(clean), "float");
            }
            return new Constant(Long.parseLong(clean), "int");
        } catch (NumberFormatException e) {
            // beyond long range; the literal text is kept
            return new Constant(clean, "int");
        }
    }

    private Expr strings() throws ParseException {
        Token start = peek();
        List<Token> parts = new ArrayList<>();
        while (at(TokenType.STRING) || at(TokenType.FSTRING)) {
            parts.add(next());
        }
        boolean formatted = parts.stream().anyMatch(p -> p.getType() == TokenType.FSTRING);
        if (!formatted) {
            StringBuilder sb = new StringBuilder();
            for (Token p : parts) {
                sb.append(p.getText());
            }
            boolean bytes = prefixOf(parts.get(0).getRaw()).contains("b");
            return finish(new Constant(sb.toString(), bytes ? "bytes" : "str"), start);
        }
        List<Expr> values = new ArrayList<>();
        for (Token p : parts) {
            if (p instanceof Lexer.FStringToken) {
                values.addAll(new FStringParser((Lexer.FStringToken) p).parse());
            } else {
                Constant c = new Constant(p.getText(), "str");
                c.line = p.getLine();
                c.col = p.getCol();
                c.endLine = p.getEndLine();
                c.endCol = p.getEndCol();
                values.add(c);
            }
        }
        return finish(new JoinedStr(values), start);
    }

    private static String prefixOf(String raw) {
        StringBuilder sb = new StringBuilder();
        for (char c : raw.toCharArray()) {
            if (c == '\'' || c == '"') {
                break;
            }
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString();
    }

    private Expr parenthesized() throws ParseException {
        Token start = next();
        if (acceptOp(")")) {
            return finish(new Collection(CollectionKind.TUPLE, new ArrayList<>()), start);
        }
        if (peek().isKeyword("yield")) {
            Expr y = yieldExpr();
            expectOp(")");
            return y;
        }
        Expr first = namedExprOrStar();
        if (peek().isKeyword("for") || (peek().isKeyword("async") && peekAt(1).isKeyword("for"))) {
            List<ComprehensionFor> gens = compFor();
            expectOp(")");
            return finish(new Comprehension(ComprehensionKind.GENERATOR, first, null, gens), start);
        }
        if (acceptOp(")")) {
            return first;
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (peek().isOp(")")) {
                break;
            }
            elts.add(namedExprOrStar());
        }
        expectOp(")");
        return finish(new Collection(CollectionKind.TUPLE, elts), start);
    }

    private Expr listDisplay() throws ParseException {
        Token start = next();
        List<Expr> elts = new ArrayList<>();
        if (acceptOp("]")) {
            return finish(new Collection(CollectionKind.LIST, elts), start);
        }
        Expr first = namedExprOrStar();
        if (peek().isKeyword("for") || (peek().isKeyword("async") && peekAt(1).isKeyword("for"))) {
            List<ComprehensionFor> gens = compFor();
            expectOp("]");
            return finish(new Comprehension(ComprehensionKind.LIST, first, null, gens), start);
        }
        elts.add(first);
        while (acceptOp(",")) {
            if (peek().isOp("]")) {
                break;
            }
            elts.add(namedExprOrStar());
        }
        expectOp("]");
        return finish(new Collection(CollectionKind.LIST, elts), start);
    }

    private Expr dictOrSetDisplay() throws ParseException {
        Token start = next();
        if (acceptOp("}")) {
            return finish(new DictExpr(new ArrayList<>(), new ArrayList<>()), start);
        }
        if (acceptOp("**")) {
            List<Expr> keys = new ArrayList<>();
            List<Expr> values = new ArrayList<>();
            keys.add(null);
            values.add(bitOr());
            return dictRest(start, keys, values);
        }
        Expr first = namedExprOrStar();
        if (acceptOp(":")) {
            Expr value = test();
            if (peek().isKeyword("for") || (peek().isKeyword("async") && peekAt(1).isKeyword("for"))) {
                List<ComprehensionFor> gens = compFor();
                expectOp("}");
                return finish(new Comprehension(ComprehensionKind.DICT, first, value, gens), start);
            }
            List<Expr> keys = new ArrayList<>();
            List<Expr> values = new ArrayList<>();
            keys.add(first);
            values.add(value);
            return dictRest(start, keys, values);
        }
        if (peek().isKeyword("for") || (peek().isKeyword("async") && peekAt(1).isKeyword("for"))) {
            List<ComprehensionFor> gens = compFor();
            expectOp("}");
            return finish(new Comprehension(ComprehensionKind.SET, first, null, gens), start);
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (acceptOp(",")) {
            if (peek().isOp("}")) {
                break;
            }
            elts.add(namedExprOrStar());
        }
        expectOp("}");
        return finish(new Collection(CollectionKind.SET, elts), start);
    }

    private Expr dictRest(Token start, List<Expr> keys, List<Expr> values) throws ParseException {
        while (acceptOp(",")) {
            if (peek().isOp("}")) {
                break;
            }
            if (acceptOp("**")) {
                keys.add(null);
                values.add(bitOr());
            } else {
                keys.add(test());
                expectOp(":");
                values.add(test());
            }
        }
        expectOp("}");
        return finish(new DictExpr(keys, values), start);
    }

    private List<ComprehensionFor> compFor() throws ParseException {
        List<ComprehensionFor> gens = new ArrayList<>();
        while (peek().isKeyword("for") || (peek().isKeyword("async") && peekAt(1).isKeyword("for"))) {
            Token start = peek();
            boolean isAsync = acceptKeyword("async");
            expectKeyword("for");
            Expr target = targetList();
            expectKeyword("in");
            Expr iter = orTest();
            List<Expr> ifs = new ArrayList<>();
            while (acceptKeyword("if")) {
                ifs.add(testNoCond());
            }
            gens.add(finish(new ComprehensionFor(target, iter, ifs, isAsync), start));
        }
        return gens;
    }

    private Expr yieldExpr() throws ParseException {
        Token start = next();
        if (acceptKeyword("from")) {
            return finish(new Yield(test(), true), start);
        }
        Expr value = atExpressionEnd() ? null : testListStarExpr();
        return finish(new Yield(value, false), start);
    }

    // ---------------------------------------------------------------- targets

    private Expr setContext(Expr e, Ctx ctx) throws ParseException {
        if (e instanceof Name) {
            ((Name) e).ctx = ctx;
        } else if (e instanceof Attribute) {
            ((Attribute) e).ctx = ctx;
        } else if (e instanceof Subscript) {
            ((Subscript) e).ctx = ctx;
        } else if (e instanceof Starred) {
            ((Starred) e).ctx = ctx;
            setContext(((Starred) e).value, ctx);
        } else if (e instanceof Collection && ((Collection) e).kind != CollectionKind.SET) {
            ((Collection) e).ctx = ctx;
            for (Expr elt : ((Collection) e).elts) {
                setContext(elt, ctx);
            }
        } else {
            throw new ParseException("Cannot assign to " + e.typeName(), e.line, e.col);
        }
        return e;
    }

    // ---------------------------------------------------------------- token helpers

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int offset) {
        int i = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(i);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (pos < tokens.size() - 1) {
            pos++;
        }
        return t;
    }

    private Token previous() {
        return tokens.get(Math.max(0, pos - 1));
    }

    private boolean at(TokenType type) {
        return peek().getType() == type;
    }

    private boolean accept(TokenType type) {
        if (at(type)) {
            next();
            return true;
        }
        return false;
    }

    private boolean acceptOp(String op) {
        if (peek().isOp(op)) {
            next();
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String kw) {
        if (peek().isKeyword(kw)) {
            next();
            return true;
        }
        return false;
    }

    private void expect(TokenType type) throws ParseException {
        if (!accept(type)) {
            throw error("Expected " + type);
        }
    }

    private void expectOp(String op) throws ParseException {
        if (!acceptOp(op)) {
            throw error("Expected '" + op + "'");
        }
    }

    private void expectKeyword(String kw) throws ParseException {
        if (!acceptKeyword(kw)) {
            throw error("Expected '" + kw + "'");
        }
    }

    private String expectName() throws ParseException {
        Token t = peek();
        if (t.getType() != TokenType.NAME || (KEYWORDS.contains(t.getText()) && !t.getText().equals("await"))) {
            throw error("Expected a name");
        }
        next();
        return t.getText();
    }

    private boolean atStatementEnd() {
        Token t = peek();
        return t.getType() == TokenType.NEWLINE || t.getType() == TokenType.ENDMARKER || t.isOp(";");
    }

    private boolean atExpressionEnd() {
        Token t = peek();
        return atStatementEnd() || t.isOp("=") || t.isOp(")") || t.isOp("]") || t.isOp("}")
            || t.isOp(":") || (t.getType() == TokenType.OP && AUG_OPS.contains(t.getText()));
    }

    private void descend() throws ParseException {
        if (++nesting > MAX_NESTING) {
            throw error("Nesting deeper than " + MAX_NESTING + " levels");
        }
    }

    private ParseException error(String message) {
        Token t = peek();
        return new ParseException(message + " (found " + (t.getText().isEmpty() ? t.getType() : t.getText()) + ")",
            t.getLine(), t.getCol());
    }

    private <T extends Node> T finish(T node, Token start) {
        node.line = start.getLine();
        node.col = start.getCol();
        Token end = previous();
        node.endLine = end.getEndLine();
        node.endCol = end.getEndCol();
        return node;
    }

    private <T extends Node> T finish(T node, Node start) {
        node.line = start.line;
        node.col = start.col;
        Token end = previous();
        node.endLine = end.getEndLine();
        node.endCol = end.getEndCol();
        return node;
    }

    private static <T extends Node> T finishAt(T node, Token start, Node last) {
        node.line = start.getLine();
        node.col = start.getCol();
        node.endLine = last.endLine;
        node.endCol = last.endCol;
        return node;
    }

    private static Node lastLine(List<Stmt> body, List<Stmt> orelse) {
        return !orelse.isEmpty() ? orelse.get(orelse.size() - 1) : body.get(body.size() - 1);
    }
}

package simgo.parser;

import simgo.ast.Program;
import simgo.ast.decl.*;
import simgo.ast.expr.*;
import simgo.ast.stmt.AssignStmt;
import simgo.ast.stmt.BlockStmt;
import simgo.ast.stmt.DeclStmt;
import simgo.ast.stmt.ExprStmt;
import simgo.ast.stmt.ForStmt;
import simgo.ast.stmt.GoStmt;
import simgo.ast.stmt.IfStmt;
import simgo.ast.stmt.IncDecStmt;
import simgo.ast.stmt.RangeStmt;
import simgo.ast.stmt.ReturnStmt;
import simgo.ast.stmt.SendStmt;
import simgo.ast.stmt.Stmt;
import simgo.ast.type.*;
import simgo.lexer.Token;
import simgo.lexer.TokenType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for the Go subset. It accepts more than the
 * translator supports (loops, maps, channels, goroutines, interfaces) so
 * that the validator can report those constructs by name instead of the
 * parser failing on them.
 */
public final class Parser {
    private final List<Token> tokens;
    private int pos = 0;

    // < 0 inside if/for headers, where "name {" opens the block rather than a composite literal
    private int exprLev = 0;

    private static final Set<TokenType> typeStart = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.LBRACKET, TokenType.STAR, TokenType.MAP,
            TokenType.CHAN, TokenType.ARROW, TokenType.STRUCT, TokenType.INTERFACE,
            TokenType.FUNC, TokenType.LPAREN
    );

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    // ---------- entry ----------
    public Program parseProgram() {
        skipSemicolons();
        consume(TokenType.PACKAGE, "Expected 'package' clause");
        String packageName = consume(TokenType.IDENTIFIER, "Expected package name").lexeme();
        endOfDecl();

        List<String> imports = new ArrayList<>();
        while (match(TokenType.IMPORT)) {
            if (match(TokenType.LPAREN)) {
                while (!check(TokenType.RPAREN) && !check(TokenType.EOF)) {
                    imports.add(parseImportSpec());
                    if (!check(TokenType.RPAREN)) consume(TokenType.SEMICOLON, "Expected ';' after import");
                }
                consume(TokenType.RPAREN, "Expected ')' after imports");
            } else {
                imports.add(parseImportSpec());
            }
            endOfDecl();
        }

        List<Decl> decls = new ArrayList<>();
        while (!check(TokenType.EOF)) {
            if (match(TokenType.FUNC)) decls.add(parseFuncDecl());
            else if (match(TokenType.VAR)) decls.add(new VarDecl(parseGroup(() -> parseValueSpec(false))));
            else if (match(TokenType.CONST)) decls.add(new ConstDecl(parseGroup(() -> parseValueSpec(true))));
            else if (match(TokenType.TYPE)) decls.add(new TypeDecl(parseGroup(this::parseTypeSpec)));
            else if (check(TokenType.IMPORT)) throw error(peek(), "Imports must appear before other declarations");
            else throw error(peek(), "Expected 'func', 'var', 'const' or 'type' at top-level");
            endOfDecl();
        }
        consume(TokenType.EOF, "Expected EOF");
        return new Program(packageName, imports, decls);
    }

    private String parseImportSpec() {
        if (check(TokenType.IDENTIFIER) || check(TokenType.DOT)) advance(); // alias
        String path = consume(TokenType.STRING_LITERAL, "Expected import path").lexeme();
        return path.substring(1, path.length() - 1);
    }

    private void endOfDecl() {
        if (check(TokenType.EOF)) return;
        consume(TokenType.SEMICOLON, "Expected ';' after declaration");
        skipSemicolons();
    }

    private void skipSemicolons() {
        while (match(TokenType.SEMICOLON)) {
            // empty declarations
        }
    }

    // ---------- declarations ----------
    private FuncDecl parseFuncDecl() {
        Field receiver = null;
        if (check(TokenType.LPAREN)) {
            List<Field> recv = parseParameters();
            if (recv.size() != 1) throw error(previous(), "Method receiver must be a single parameter");
            receiver = recv.get(0);
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected function name");
        List<Field> params = parseParameters();
        List<Field> results = parseResults();

        BlockStmt body = check(TokenType.LBRACE) ? parseBlock() : null;
        return new FuncDecl(receiver, name.lexeme(), params, results, body);
    }

    private <T> List<T> parseGroup(Supplier<T> spec) {
        List<T> specs = new ArrayList<>();
        if (match(TokenType.LPAREN)) {
            skipSemicolons();
            while (!check(TokenType.RPAREN) && !check(TokenType.EOF)) {
                specs.add(spec.get());
                if (!check(TokenType.RPAREN)) consume(TokenType.SEMICOLON, "Expected ';' in declaration group");
                skipSemicolons();
            }
            consume(TokenType.RPAREN, "Expected ')' after declaration group");
        } else {
            specs.add(spec.get());
        }
        return specs;
    }

    private ValueSpec parseValueSpec(boolean isConst) {
        List<String> names = parseIdentList();
        TypeRef type = null;
        if (!check(TokenType.ASSIGN) && !check(TokenType.SEMICOLON) && !check(TokenType.RPAREN)) {
            type = parseType();
        }
        List<Expr> values = List.of();
        if (match(TokenType.ASSIGN)) {
            values = parseExprList();
        } else if (type == null && !isConst) {
            throw error(peek(), "Expected type or initializer in var declaration");
        }
        return new ValueSpec(names, type, values);
    }

    private TypeSpec parseTypeSpec() {
        Token name = consume(TokenType.IDENTIFIER, "Expected type name");
        boolean alias = match(TokenType.ASSIGN);
        return new TypeSpec(name.lexeme(), parseType(), alias);
    }

    private List<String> parseIdentList() {
        List<String> names = new ArrayList<>();
        do {
            names.add(consume(TokenType.IDENTIFIER, "Expected identifier").lexeme());
        } while (match(TokenType.COMMA));
        return names;
    }

    // ---------- parameters ----------

    // one comma-separated entry before names and types are told apart
    private record ParamEntry(String name, TypeRef type) {}

    private List<Field> parseParameters() {
        consume(TokenType.LPAREN, "Expected '('");
        List<ParamEntry> entries = new ArrayList<>();
        while (!check(TokenType.RPAREN) && !check(TokenType.EOF)) {
            entries.add(parseParamEntry());
            if (!match(TokenType.COMMA)) break;
            skipSemicolons();
        }
        consume(TokenType.RPAREN, "Expected ')' after parameters");
        return groupParams(entries);
    }

    private ParamEntry parseParamEntry() {
        if (check(TokenType.IDENTIFIER)) {
            if (checkNext(TokenType.COMMA) || checkNext(TokenType.RPAREN)) {
                return new ParamEntry(advance().lexeme(), null);
            }
            if (!checkNext(TokenType.DOT)) {
                String name = advance().lexeme();
                return new ParamEntry(name, parseParamType());
            }
        }
        return new ParamEntry(null, parseParamType());
    }

    // variadic "...T" is modelled as a slice of T
    private TypeRef parseParamType() {
        if (match(TokenType.ELLIPSIS)) return new ArrayTypeRef(null, parseType());
        return parseType();
    }

    private List<Field> groupParams(List<ParamEntry> entries) {
        boolean named = entries.stream().anyMatch(e -> e.name() != null && e.type() != null);
        List<Field> fields = new ArrayList<>();
        if (!named) {
            for (ParamEntry e : entries) {
                TypeRef t = e.type() != null ? e.type() : new NamedTypeRef(e.name());
                fields.add(new Field(List.of(), t));
            }
            return fields;
        }

        List<String> pending = new ArrayList<>();
        for (ParamEntry e : entries) {
            if (e.name() == null) throw error(previous(), "Mixed named and unnamed parameters");
            pending.add(e.name());
            if (e.type() != null) {
                fields.add(new Field(List.copyOf(pending), e.type()));
                pending.clear();
            }
        }
        if (!pending.isEmpty()) throw error(previous(), "Mixed named and unnamed parameters");
        return fields;
    }

    private List<Field> parseResults() {
        if (check(TokenType.LPAREN)) return parseParameters();
        if (check(TokenType.LBRACE) || check(TokenType.SEMICOLON) || !typeStart.contains(peek().type())) {
            return List.of();
        }
        return List.of(new Field(List.of(), parseType()));
    }

    // ---------- types ----------
    private TypeRef parseType() {
        if (match(TokenType.IDENTIFIER)) {
            String name = previous().lexeme();
            if (match(TokenType.DOT)) {
                Token sel = consume(TokenType.IDENTIFIER, "Expected type name after '.'");
                return new QualifiedTypeRef(name, sel.lexeme());
            }
            return new NamedTypeRef(name);
        }
        if (match(TokenType.LBRACKET)) {
            if (match(TokenType.RBRACKET)) return new ArrayTypeRef(null, parseType());
            if (check(TokenType.ELLIPSIS)) throw error(peek(), "Array length '...' is not supported");
            Expr length = nested(this::parseExpr);
            consume(TokenType.RBRACKET, "Expected ']'");
            return new ArrayTypeRef(length, parseType());
        }
        if (match(TokenType.STAR)) return new PointerTypeRef(parseType());
        if (match(TokenType.MAP)) {
            consume(TokenType.LBRACKET, "Expected '[' after map");
            TypeRef key = parseType();
            consume(TokenType.RBRACKET, "Expected ']'");
            return new MapTypeRef(key, parseType());
        }
        if (match(TokenType.CHAN)) {
            if (match(TokenType.ARROW)) return new ChanTypeRef(ChanTypeRef.Direction.SEND, parseType());
            return new ChanTypeRef(ChanTypeRef.Direction.BOTH, parseType());
        }
        if (match(TokenType.ARROW)) {
            consume(TokenType.CHAN, "Expected 'chan' after '<-'");
            return new ChanTypeRef(ChanTypeRef.Direction.RECEIVE, parseType());
        }
        if (match(TokenType.STRUCT)) return parseStructType();
        if (match(TokenType.INTERFACE)) return parseInterfaceType();
        if (match(TokenType.FUNC)) return parseSignature();
        if (match(TokenType.LPAREN)) {
            TypeRef t = parseType();
            consume(TokenType.RPAREN, "Expected ')' after type");
            return t;
        }
        throw error(peek(), "Expected type");
    }

    private FuncTypeRef parseSignature() {
        List<Field> params = parseParameters();
        return new FuncTypeRef(params, parseResults());
    }

    private StructTypeRef parseStructType() {
        consume(TokenType.LBRACE, "Expected '{' after struct");
        List<Field> fields = new ArrayList<>();
        skipSemicolons();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            if (check(TokenType.IDENTIFIER) && !checkNext(TokenType.DOT)
                    && !checkNext(TokenType.SEMICOLON) && !checkNext(TokenType.RBRACE)
                    && !checkNext(TokenType.STRING_LITERAL)) {
                List<String> names = parseIdentList();
                fields.add(new Field(names, parseType()));
            } else {
                fields.add(new Field(List.of(), parseType())); // embedded
            }
            match(TokenType.STRING_LITERAL); // tag
            if (!check(TokenType.RBRACE)) consume(TokenType.SEMICOLON, "Expected ';' after struct field");
            skipSemicolons();
        }
        consume(TokenType.RBRACE, "Expected '}' after struct fields");
        return new StructTypeRef(fields);
    }

    private InterfaceTypeRef parseInterfaceType() {
        consume(TokenType.LBRACE, "Expected '{' after interface");
        List<Field> methods = new ArrayList<>();
        skipSemicolons();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LPAREN)) {
                String name = advance().lexeme();
                methods.add(new Field(List.of(name), parseSignature()));
            } else {
                methods.add(new Field(List.of(), parseType()));
            }
            if (!check(TokenType.RBRACE)) consume(TokenType.SEMICOLON, "Expected ';' after interface method");
            skipSemicolons();
        }
        consume(TokenType.RBRACE, "Expected '}' after interface methods");
        return new InterfaceTypeRef(methods);
    }

    // ---------- block / statements ----------
    private BlockStmt parseBlock() {
        consume(TokenType.LBRACE, "Expected '{'");
        int savedLev = exprLev;
        exprLev = 0;
        List<Stmt> stmts = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            if (match(TokenType.SEMICOLON)) continue;
            stmts.add(parseStmt());
            if (!check(TokenType.RBRACE)) consume(TokenType.SEMICOLON, "Expected ';' or newline after statement");
        }
        consume(TokenType.RBRACE, "Expected '}'");
        exprLev = savedLev;
        return new BlockStmt(stmts);
    }

    private Stmt parseStmt() {
        if (check(TokenType.LBRACE)) return parseBlock();

        if (match(TokenType.VAR)) return new DeclStmt(new VarDecl(parseGroup(() -> parseValueSpec(false))));
        if (match(TokenType.CONST)) return new DeclStmt(new ConstDecl(parseGroup(() -> parseValueSpec(true))));
        if (match(TokenType.TYPE)) return new DeclStmt(new TypeDecl(parseGroup(this::parseTypeSpec)));
        if (match(TokenType.IF)) return parseIf();
        if (match(TokenType.FOR)) return parseFor();
        if (match(TokenType.RETURN)) return parseReturn();
        if (match(TokenType.GO)) return parseGo();

        return parseSimpleStmt();
    }

    private Stmt parseSimpleStmt() {
        return finishSimpleStmt(parseExprList());
    }

    private Stmt finishSimpleStmt(List<Expr> lhs) {
        Token op = peek();
        AssignStmt.Operator assign = switch (op.type()) {
            case DEFINE -> AssignStmt.Operator.DEFINE;
            case ASSIGN -> AssignStmt.Operator.ASSIGN;
            case ADD_ASSIGN -> AssignStmt.Operator.ADD_ASSIGN;
            case SUB_ASSIGN -> AssignStmt.Operator.SUB_ASSIGN;
            case MUL_ASSIGN -> AssignStmt.Operator.MUL_ASSIGN;
            case DIV_ASSIGN -> AssignStmt.Operator.DIV_ASSIGN;
            case MOD_ASSIGN -> AssignStmt.Operator.MOD_ASSIGN;
            default -> null;
        };
        if (assign != null) {
            advance();
            if (assign == AssignStmt.Operator.DEFINE) {
                for (Expr e : lhs) {
                    if (!(e instanceof Ident)) throw error(op, "Non-name on left side of ':='");
                }
            }
            return new AssignStmt(lhs, assign, parseExprList());
        }

        if (lhs.size() > 1) throw error(op, "Expected ':=' or '=' after expression list");
        Expr x = lhs.get(0);

        if (match(TokenType.INC)) return new IncDecStmt(x, true);
        if (match(TokenType.DEC)) return new IncDecStmt(x, false);
        if (match(TokenType.ARROW)) return new SendStmt(x, parseExpr());
        return new ExprStmt(x);
    }

    private IfStmt parseIf() {
        int savedLev = exprLev;
        exprLev = -1;
        Stmt init = null;
        Expr cond;
        Stmt s = parseSimpleStmt();
        if (match(TokenType.SEMICOLON)) {
            init = s;
            cond = parseExpr();
        } else if (s instanceof ExprStmt es) {
            cond = es.expr();
        } else {
            throw error(peek(), "Expected condition in if statement");
        }
        exprLev = savedLev;

        BlockStmt thenB = parseBlock();

        BlockStmt elseB = null;
        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                elseB = new BlockStmt(List.of(parseIf()));
            } else {
                elseB = parseBlock();
            }
        }
        return new IfStmt(init, cond, thenB, elseB);
    }

    private Stmt parseFor() {
        int savedLev = exprLev;
        exprLev = -1;
        try {
            if (check(TokenType.LBRACE)) return new ForStmt(null, null, null, parseBlock());

            // for range x { ... }
            if (match(TokenType.RANGE)) {
                Expr range = parseExpr();
                return new RangeStmt(null, null, false, range, parseBlock());
            }

            Stmt init = null;
            if (!check(TokenType.SEMICOLON)) {
                List<Expr> lhs = parseExprList();
                if ((check(TokenType.DEFINE) || check(TokenType.ASSIGN)) && checkNext(TokenType.RANGE)) {
                    boolean define = advance().type() == TokenType.DEFINE;
                    advance(); // range
                    if (lhs.size() > 2) throw error(previous(), "Range permits at most two iteration variables");
                    Expr range = parseExpr();
                    Expr value = lhs.size() > 1 ? lhs.get(1) : null;
                    return new RangeStmt(lhs.get(0), value, define, range, parseBlock());
                }
                init = finishSimpleStmt(lhs);
            }

            // for cond { ... }
            if (!check(TokenType.SEMICOLON)) {
                if (!(init instanceof ExprStmt es)) throw error(peek(), "Expected for loop condition");
                return new ForStmt(null, es.expr(), null, parseBlock());
            }

            consume(TokenType.SEMICOLON, "Expected ';' after for-init");
            Expr cond = check(TokenType.SEMICOLON) ? null : parseExpr();
            consume(TokenType.SEMICOLON, "Expected ';' after for-condition");
            Stmt post = check(TokenType.LBRACE) ? null : parseSimpleStmt();
            return new ForStmt(init, cond, post, parseBlock());
        } finally {
            exprLev = savedLev;
        }
    }

    private ReturnStmt parseReturn() {
        if (check(TokenType.SEMICOLON) || check(TokenType.RBRACE)) {
            return new ReturnStmt(List.of());
        }
        return new ReturnStmt(parseExprList());
    }

    private GoStmt parseGo() {
        Token at = peek();
        Expr e = parseExpr();
        if (!(e instanceof CallExpr call)) throw error(at, "Expression in go must be function call");
        return new GoStmt(call);
    }

    // ---------- expressions (precedence climbing) ----------
    private List<Expr> parseExprList() {
        List<Expr> exprs = new ArrayList<>();
        do {
            exprs.add(parseExpr());
        } while (match(TokenType.COMMA));
        return exprs;
    }

    private Expr parseExpr() { return parseOr(); }

    private Expr parseOr() {
        Expr e = parseAnd();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr r = parseAnd();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseAnd() {
        Expr e = parseCompare();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr r = parseCompare();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseCompare() {
        Expr e = parseAdd();
        while (match(TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE, TokenType.EQ, TokenType.NEQ)) {
            Token op = previous();
            Expr r = parseAdd();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseAdd() {
        Expr e = parseMul();
        while (match(TokenType.PLUS, TokenType.MINUS, TokenType.PIPE, TokenType.CARET)) {
            Token op = previous();
            Expr r = parseMul();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseMul() {
        Expr e = parseUnary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT,
                TokenType.SHL, TokenType.SHR, TokenType.AMP, TokenType.AND_NOT)) {
            Token op = previous();
            Expr r = parseUnary();
            e = new BinaryExpr(e, toBinOp(op.type()), r);
        }
        return e;
    }

    private Expr parseUnary() {
        if (match(TokenType.NOT)) return new UnaryExpr(UnaryExpr.Operator.NOT, parseUnary());
        if (match(TokenType.MINUS)) return new UnaryExpr(UnaryExpr.Operator.NEG, parseUnary());
        if (match(TokenType.PLUS)) return new UnaryExpr(UnaryExpr.Operator.PLUS, parseUnary());
        if (match(TokenType.CARET)) return new UnaryExpr(UnaryExpr.Operator.COMPLEMENT, parseUnary());
        if (match(TokenType.AMP)) return new UnaryExpr(UnaryExpr.Operator.ADDRESS, parseUnary());
        if (match(TokenType.STAR)) return new UnaryExpr(UnaryExpr.Operator.DEREF, parseUnary());
        if (check(TokenType.ARROW) && !checkNext(TokenType.CHAN)) {
            advance();
            return new UnaryExpr(UnaryExpr.Operator.RECEIVE, parseUnary());
        }
        return parsePostfix();
    }

    private Expr parsePostfix() {
        Expr e = parsePrimary();
        while (true) {
            if (match(TokenType.LPAREN)) {
                List<Expr> args = nested(this::parseCallArgs);
                consume(TokenType.RPAREN, "Expected ')'");
                e = new CallExpr(e, args);
                continue;
            }
            if (match(TokenType.LBRACKET)) {
                Expr idx = nested(this::parseExpr);
                consume(TokenType.RBRACKET, "Expected ']'");
                e = new IndexExpr(e, idx);
                continue;
            }
            if (match(TokenType.DOT)) {
                Token name = consume(TokenType.IDENTIFIER, "Expected selector after '.'");
                e = new SelectorExpr(e, name.lexeme());
                continue;
            }
            if (check(TokenType.LBRACE) && isLiteralType(e)) {
                e = new CompositeLit(toTypeRef(e), parseLiteralElements());
                continue;
            }
            break;
        }
        return e;
    }

    private List<Expr> parseCallArgs() {
        List<Expr> args = new ArrayList<>();
        while (!check(TokenType.RPAREN) && !check(TokenType.EOF)) {
            args.add(parseExpr());
            match(TokenType.ELLIPSIS);
            if (!match(TokenType.COMMA)) break;
            skipSemicolons();
        }
        return args;
    }

    private boolean isLiteralType(Expr e) {
        if (e instanceof TypeExpr t) {
            return t.type() instanceof ArrayTypeRef
                    || t.type() instanceof MapTypeRef
                    || t.type() instanceof StructTypeRef;
        }
        if (exprLev < 0) return false;
        return e instanceof Ident
                || (e instanceof SelectorExpr s && s.target() instanceof Ident);
    }

    private static TypeRef toTypeRef(Expr e) {
        if (e instanceof TypeExpr t) return t.type();
        if (e instanceof Ident id) return new NamedTypeRef(id.name());
        SelectorExpr s = (SelectorExpr) e;
        return new QualifiedTypeRef(((Ident) s.target()).name(), s.name());
    }

    private List<CompositeLit.Element> parseLiteralElements() {
        consume(TokenType.LBRACE, "Expected '{'");
        List<CompositeLit.Element> elements = nested(() -> {
            List<CompositeLit.Element> els = new ArrayList<>();
            skipSemicolons();
            while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
                Expr first = parseElementValue();
                if (match(TokenType.COLON)) {
                    els.add(new CompositeLit.Element(first, parseElementValue()));
                } else {
                    els.add(new CompositeLit.Element(null, first));
                }
                if (!match(TokenType.COMMA)) break;
                skipSemicolons();
            }
            skipSemicolons();
            return els;
        });
        consume(TokenType.RBRACE, "Expected '}' after composite literal");
        return elements;
    }

    private Expr parseElementValue() {
        if (check(TokenType.LBRACE)) return new CompositeLit(null, parseLiteralElements());
        return parseExpr();
    }

    private Expr parsePrimary() {
        if (match(TokenType.INT_LITERAL)) return new BasicLit(BasicLit.Kind.INT, previous().lexeme());
        if (match(TokenType.FLOAT_LITERAL)) return new BasicLit(BasicLit.Kind.FLOAT, previous().lexeme());
        if (match(TokenType.STRING_LITERAL)) return new BasicLit(BasicLit.Kind.STRING, previous().lexeme());
        if (match(TokenType.CHAR_LITERAL)) return new BasicLit(BasicLit.Kind.CHAR, previous().lexeme());
        if (match(TokenType.BOOL_LITERAL)) return new BoolLiteral("true".equals(previous().lexeme()));
        if (match(TokenType.IDENTIFIER)) return new Ident(previous().lexeme());
        if (match(TokenType.LPAREN)) {
            Expr e = nested(this::parseExpr);
            consume(TokenType.RPAREN, "Expected ')'");
            return e;
        }
        if (match(TokenType.FUNC)) {
            FuncTypeRef sig = parseSignature();
            if (check(TokenType.LBRACE)) return new FuncLit(sig, parseBlock());
            return new TypeExpr(sig);
        }
        if (check(TokenType.LBRACKET) || check(TokenType.MAP) || check(TokenType.CHAN)
                || check(TokenType.STRUCT) || check(TokenType.INTERFACE)
                || (check(TokenType.ARROW) && checkNext(TokenType.CHAN))) {
            return new TypeExpr(parseType());
        }
        throw error(peek(), "Expected expression");
    }

    // ---------- helpers ----------
    private <T> T nested(Supplier<T> body) {
        exprLev++;
        try {
            return body.get();
        } finally {
            exprLev--;
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        if (pos + 1 >= tokens.size()) return false;
        return tokens.get(pos + 1).type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(Math.max(pos - 1, 0)); }

    private ParseException error(Token at, String msg) {
        String got = "\n".equals(at.lexeme()) ? "newline" : "'" + at.lexeme() + "'";
        return new ParseException("[" + at.line() + ":" + at.column() + "] " + msg + " (got " + at.type() + " " + got + ")");
    }

    private static BinaryExpr.Operator toBinOp(TokenType t) {
        return switch (t) {
            case PLUS    -> BinaryExpr.Operator.ADD;
            case MINUS   -> BinaryExpr.Operator.SUB;
            case STAR    -> BinaryExpr.Operator.MUL;
            case SLASH   -> BinaryExpr.Operator.DIV;
            case PERCENT -> BinaryExpr.Operator.MOD;

            case AMP     -> BinaryExpr.Operator.BIT_AND;
            case PIPE    -> BinaryExpr.Operator.BIT_OR;
            case CARET   -> BinaryExpr.Operator.BIT_XOR;
            case AND_NOT -> BinaryExpr.Operator.AND_NOT;
            case SHL     -> BinaryExpr.Operator.SHL;
            case SHR     -> BinaryExpr.Operator.SHR;

            case EQ  -> BinaryExpr.Operator.EQ;
            case NEQ -> BinaryExpr.Operator.NE;
            case LT  -> BinaryExpr.Operator.LT;
            case GT  -> BinaryExpr.Operator.GT;
            case LE  -> BinaryExpr.Operator.LE;
            case GE  -> BinaryExpr.Operator.GE;

            case AND -> BinaryExpr.Operator.AND;
            case OR  -> BinaryExpr.Operator.OR;

            default -> throw new IllegalArgumentException("Not a binary operator token: " + t);
        };
    }

}

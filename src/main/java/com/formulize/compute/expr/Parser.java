package com.formulize.compute.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive descent parser for the expression language.
 *
 * <p>
 * Precedence, lowest first:
 * <ol>
 * <li>conditional {@code c ? a : b} (right associative)</li>
 * <li>{@code or} / {@code ||}</li>
 * <li>{@code xor}</li>
 * <li>{@code and} / {@code &&}</li>
 * <li>comparison {@code == != < <= > >=} (script: also {@code === !==})</li>
 * <li>{@code + -}</li>
 * <li>{@code * / % mod .* ./}</li>
 * <li>unary {@code - + not !}</li>
 * <li>power {@code ^} / {@code **} (right associative)</li>
 * <li>indexing {@code v[i]}</li>
 * </ol>
 *
 * <p>
 * Function calls are resolved against {@link FunctionTable} while parsing, so an
 * unknown function is a parse error rather than an evaluation error.
 *
 * <p>
 * The token-level methods ({@link #peek()}, {@link #accept(String)},
 * {@link #expect(String)}) are public so statement parsers can embed
 * expressions.
 */
public final class Parser {
    /** Words that can never name a variable in the formula notation. */
    public static final Set<String> RESERVED = Set.of("mod", "to", "in", "and", "xor", "or", "not", "end");

    private final List<Token> tokens;
    private final Dialect dialect;
    private int pos;

    public Parser(List<Token> tokens, Dialect dialect) {
        this.tokens = tokens;
        this.dialect = dialect;
    }

    /**
     * Parses a complete expression.
     *
     * @throws EvalException on any syntax error or trailing input.
     */
    public static ExprNode parse(String source, Dialect dialect) {
        Parser parser = new Parser(Lexer.tokenize(source, dialect), dialect);
        ExprNode node = parser.parseExpression();
        if (!parser.atEnd())
            throw parser.err("Unexpected " + parser.peek());
        return node;
    }

    public ExprNode parseExpression() {
        return conditional();
    }

    // ── Token access ─────────────────────────────────────────────

    public Token peek() {
        return tokens.get(pos);
    }

    public Token peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    public Token next() {
        Token t = tokens.get(pos);
        if (t.kind() != Token.Kind.EOF)
            pos++;
        return t;
    }

    public boolean atEnd() {
        return peek().kind() == Token.Kind.EOF;
    }

    /** Consumes the token if it is the given symbol or word. */
    public boolean accept(String symbol) {
        if (peek().is(symbol)) {
            pos++;
            return true;
        }
        return false;
    }

    public void expect(String symbol) {
        if (!accept(symbol))
            throw err("Expected '" + symbol + "' but found " + peek());
    }

    public String expectIdent() {
        Token t = next();
        if (t.kind() != Token.Kind.IDENT)
            throw err("Expected identifier but found " + t);
        return t.text();
    }

    public EvalException err(String msg) {
        return new EvalException(msg + " at position " + peek().pos());
    }

    // ── Grammar ──────────────────────────────────────────────────

    private ExprNode conditional() {
        ExprNode cond = or();
        if (accept("?")) {
            ExprNode whenTrue = conditional();
            expect(":");
            ExprNode whenFalse = conditional();
            return new Ast.Conditional(cond, whenTrue, whenFalse);
        }
        return cond;
    }

    private ExprNode or() {
        ExprNode left = xor();
        while (accept(script() ? "||" : "or"))
            left = new Ast.Binary(Ast.BinaryOp.OR, left, xor());
        return left;
    }

    private ExprNode xor() {
        ExprNode left = and();
        while (!script() && accept("xor"))
            left = new Ast.Binary(Ast.BinaryOp.XOR, left, and());
        return left;
    }

    private ExprNode and() {
        ExprNode left = comparison();
        while (accept(script() ? "&&" : "and"))
            left = new Ast.Binary(Ast.BinaryOp.AND, left, comparison());
        return left;
    }

    private ExprNode comparison() {
        ExprNode left = additive();
        while (true) {
            Ast.BinaryOp op = comparisonOp(peek());
            if (op == null)
                return left;
            next();
            left = new Ast.Binary(op, left, additive());
        }
    }

    private Ast.BinaryOp comparisonOp(Token t) {
        if (t.kind() != Token.Kind.SYMBOL)
            return null;
        return switch (t.text()) {
            case "==" -> Ast.BinaryOp.EQ;
            case "!=" -> Ast.BinaryOp.NE;
            case "===" -> Ast.BinaryOp.EQ;
            case "!==" -> Ast.BinaryOp.NE;
            case "<" -> Ast.BinaryOp.LT;
            case "<=" -> Ast.BinaryOp.LE;
            case ">" -> Ast.BinaryOp.GT;
            case ">=" -> Ast.BinaryOp.GE;
            default -> null;
        };
    }

    private ExprNode additive() {
        ExprNode left = multiplicative();
        while (true) {
            if (accept("+"))
                left = new Ast.Binary(Ast.BinaryOp.ADD, left, multiplicative());
            else if (accept("-"))
                left = new Ast.Binary(Ast.BinaryOp.SUB, left, multiplicative());
            else
                return left;
        }
    }

    private ExprNode multiplicative() {
        ExprNode left = unary();
        while (true) {
            Ast.BinaryOp op = multiplicativeOp(peek());
            if (op == null)
                return left;
            next();
            left = new Ast.Binary(op, left, unary());
        }
    }

    private Ast.BinaryOp multiplicativeOp(Token t) {
        if (t.is("*"))
            return Ast.BinaryOp.MUL;
        if (t.is("/"))
            return Ast.BinaryOp.DIV;
        if (t.is("%"))
            return script() ? Ast.BinaryOp.REM : Ast.BinaryOp.MOD;
        if (script())
            return null;
        if (t.is("mod"))
            return Ast.BinaryOp.MOD;
        if (t.is(".*"))
            return Ast.BinaryOp.EMUL;
        if (t.is("./"))
            return Ast.BinaryOp.EDIV;
        return null;
    }

    private ExprNode unary() {
        if (accept("-"))
            return new Ast.Unary(Ast.UnaryOp.NEG, unary());
        if (accept("+"))
            return new Ast.Unary(Ast.UnaryOp.PLUS, unary());
        if (accept(script() ? "!" : "not"))
            return new Ast.Unary(Ast.UnaryOp.NOT, unary());
        return power();
    }

    private ExprNode power() {
        ExprNode base = postfix();
        if (accept(script() ? "**" : "^"))
            return new Ast.Binary(Ast.BinaryOp.POW, base, unary());
        return base;
    }

    private ExprNode postfix() {
        ExprNode node = primary();
        while (peek().is("[")) {
            next();
            ExprNode index = parseExpression();
            expect("]");
            node = new Ast.Index(node, index, dialect.indexBase());
        }
        return node;
    }

    private ExprNode primary() {
        Token t = next();
        switch (t.kind()) {
            case NUMBER:
                return new Ast.Num(t.number());
            case IDENT:
                return identifier(t);
            case SYMBOL:
                if (t.is("(")) {
                    ExprNode inner = parseExpression();
                    expect(")");
                    return inner;
                }
                if (t.is("["))
                    return new Ast.VectorLit(list("]"));
                break;
            default:
                break;
        }
        pos--;
        throw err("Unexpected " + t);
    }

    private ExprNode identifier(Token t) {
        String name = t.text();
        if (!script() && RESERVED.contains(name)) {
            pos--;
            throw err("Unexpected keyword '" + name + "'");
        }
        if (script()) {
            if (name.equals("Math") && accept("."))
                return mathMember(expectIdent());
            if (peek().is(".")) {
                next();
                return new Ast.Sym(name + "." + expectIdent());
            }
            if (peek().is("[") && peek(1).kind() == Token.Kind.STRING && peek(2).is("]")) {
                next();
                String member = next().text();
                next();
                return new Ast.Sym(name + "." + member);
            }
            if (name.equals("true"))
                return new Ast.Num(1);
            if (name.equals("false"))
                return new Ast.Num(0);
        }
        if (peek().is("("))
            return call(name);
        return new Ast.Sym(name);
    }

    private ExprNode mathMember(String member) {
        if (peek().is("("))
            return call(member);
        Double constant = FunctionTable.constant(member);
        if (constant == null)
            throw err("Unsupported member Math." + member);
        return new Ast.Num(constant);
    }

    private ExprNode call(String name) {
        FunctionTable.Fn fn = FunctionTable.lookup(name);
        if (fn == null)
            throw err("Unknown function '" + name + "'");
        expect("(");
        List<ExprNode> args = list(")");
        if (args.size() < fn.minArgs() || (fn.maxArgs() >= 0 && args.size() > fn.maxArgs()))
            throw err("Wrong number of arguments for " + name + ": " + args.size());
        return new Ast.Call(name, fn, args);
    }

    private List<ExprNode> list(String close) {
        List<ExprNode> items = new ArrayList<>();
        if (accept(close))
            return items;
        do {
            items.add(parseExpression());
        } while (accept(","));
        expect(close);
        return items;
    }

    private boolean script() {
        return dialect == Dialect.SCRIPT;
    }
}

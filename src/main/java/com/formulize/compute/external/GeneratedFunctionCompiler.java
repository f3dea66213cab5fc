package com.formulize.compute.external;

import com.formulize.compute.expr.Ast;
import com.formulize.compute.expr.Dialect;
import com.formulize.compute.expr.EvalException;
import com.formulize.compute.expr.ExprNode;
import com.formulize.compute.expr.Lexer;
import com.formulize.compute.expr.Parser;
import com.formulize.compute.expr.Token;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles generated {@code function evaluate(param) { ... }} text into a
 * {@link GeneratedFunction}. The text is parsed, never executed.
 *
 * <p>
 * Accepted statements:
 * <ul>
 * <li>{@code const|let|var x = expr;}, several declarators allowed</li>
 * <li>{@code const { a, b: alias } = param;}</li>
 * <li>{@code const result = { k: expr };} and {@code result.k = expr;}</li>
 * <li>{@code x = expr;} and the compound forms {@code += -= *= /=}</li>
 * <li>{@code if / else if / else}</li>
 * <li>{@code try { } catch (e) { }}</li>
 * <li>{@code throw new Error("...");}</li>
 * <li>{@code return { k: expr, ... };}, {@code return result;} and, for a
 * single target, {@code return expr;}</li>
 * </ul>
 * Expressions use the script dialect. Anything else is rejected with
 * {@link GeneratedCodeInvalidException}.
 */
public final class GeneratedFunctionCompiler {
    private static final String ENTRY = "function evaluate";

    private GeneratedFunctionCompiler() {
    }

    /**
     * @param text    The generated text, optionally wrapped in a markdown fence
     *                or preceded by prose.
     * @param targets Target ids, used for bare return values.
     * @throws GeneratedCodeInvalidException if the text is outside the accepted
     *                                       subset.
     */
    public static GeneratedFunction compile(String text, List<String> targets) {
        String code = stripFences(text);
        int start = code.indexOf(ENTRY);
        if (start < 0)
            throw new GeneratedCodeInvalidException("Generated code does not contain evaluate function");
        try {
            Parser p = new Parser(Lexer.tokenize(code.substring(start), Dialect.SCRIPT), Dialect.SCRIPT);
            p.expect("function");
            p.expect("evaluate");
            p.expect("(");
            String parameter = p.expectIdent();
            p.expect(")");
            List<GeneratedFunction.Stmt> body = block(p);
            p.accept(";");
            if (!p.atEnd())
                throw p.err("Unexpected " + p.peek() + " after function body");
            return new GeneratedFunction(text, parameter, body, targets);
        } catch (EvalException e) {
            throw new GeneratedCodeInvalidException("Cannot compile generated code: " + e.getMessage(), e);
        }
    }

    static String stripFences(String text) {
        StringBuilder sb = new StringBuilder();
        for (String line : text.split("\n", -1)) {
            if (!line.trim().startsWith("```"))
                sb.append(line).append('\n');
        }
        return sb.toString();
    }

    private static List<GeneratedFunction.Stmt> block(Parser p) {
        p.expect("{");
        List<GeneratedFunction.Stmt> out = new ArrayList<>();
        while (!p.accept("}")) {
            if (p.atEnd())
                throw p.err("Missing '}'");
            statement(p, out);
        }
        return out;
    }

    /** A braced block or a single statement. */
    private static List<GeneratedFunction.Stmt> body(Parser p) {
        if (p.peek().is("{"))
            return block(p);
        List<GeneratedFunction.Stmt> out = new ArrayList<>();
        statement(p, out);
        return out;
    }

    private static void statement(Parser p, List<GeneratedFunction.Stmt> out) {
        Token t = p.peek();
        if (p.accept(";"))
            return;
        if (t.kind() == Token.Kind.STRING) {
            // directive such as "use strict"
            p.next();
            p.accept(";");
            return;
        }
        if (t.is("const") || t.is("let") || t.is("var")) {
            p.next();
            declaration(p, out);
        } else if (t.is("if")) {
            p.next();
            p.expect("(");
            ExprNode condition = p.parseExpression();
            p.expect(")");
            List<GeneratedFunction.Stmt> then = body(p);
            List<GeneratedFunction.Stmt> otherwise = p.accept("else") ? body(p) : List.of();
            out.add(new GeneratedFunction.If(condition, then, otherwise));
            return;
        } else if (t.is("try")) {
            p.next();
            List<GeneratedFunction.Stmt> tryBody = block(p);
            p.expect("catch");
            if (p.accept("(")) {
                p.expectIdent();
                p.expect(")");
            }
            List<GeneratedFunction.Stmt> handler = block(p);
            if (p.peek().is("finally"))
                throw p.err("'finally' is not supported");
            out.add(new GeneratedFunction.Try(tryBody, handler));
            return;
        } else if (t.is("return")) {
            p.next();
            if (p.peek().is("{")) {
                out.add(new GeneratedFunction.ReturnObject(objectLiteral(p)));
            } else {
                ExprNode value = p.parseExpression();
                String objectName = value instanceof Ast.Sym s ? s.name() : null;
                out.add(new GeneratedFunction.ReturnExpr(value, objectName));
            }
        } else if (t.is("throw")) {
            p.next();
            p.accept("new");
            p.expectIdent();
            p.expect("(");
            String message = p.peek().kind() == Token.Kind.STRING ? p.next().text() : "Error";
            p.expect(")");
            out.add(new GeneratedFunction.Throw(message));
        } else if (t.kind() == Token.Kind.IDENT) {
            out.add(assignment(p));
        } else {
            throw p.err("Unsupported statement starting with " + t);
        }
        p.accept(";");
    }

    private static void declaration(Parser p, List<GeneratedFunction.Stmt> out) {
        if (p.peek().is("{")) {
            Map<String, String> aliases = new LinkedHashMap<>();
            p.next();
            while (!p.accept("}")) {
                String key = key(p);
                aliases.put(key, p.accept(":") ? p.expectIdent() : key);
                if (!p.accept(",")) {
                    p.expect("}");
                    break;
                }
            }
            p.expect("=");
            out.add(new GeneratedFunction.Destructure(aliases, p.expectIdent()));
            return;
        }
        do {
            String name = p.expectIdent();
            if (!p.accept("=")) {
                out.add(new GeneratedFunction.Declare(name, null));
            } else if (p.peek().is("{")) {
                out.add(new GeneratedFunction.DeclareObject(name, objectLiteral(p)));
            } else {
                out.add(new GeneratedFunction.Declare(name, p.parseExpression()));
            }
        } while (p.accept(","));
    }

    private static GeneratedFunction.Stmt assignment(Parser p) {
        String target = p.expectIdent();
        if (p.accept(".")) {
            target = target + "." + p.expectIdent();
        } else if (p.peek().is("[") && p.peek(1).kind() == Token.Kind.STRING) {
            p.next();
            target = target + "." + p.next().text();
            p.expect("]");
        }
        Token op = p.next();
        if (!(op.is("=") || op.is("+=") || op.is("-=") || op.is("*=") || op.is("/=")))
            throw p.err("Expected assignment but found " + op);
        return new GeneratedFunction.Assign(target, op.text(), p.parseExpression());
    }

    private static Map<String, ExprNode> objectLiteral(Parser p) {
        p.expect("{");
        Map<String, ExprNode> fields = new LinkedHashMap<>();
        while (!p.accept("}")) {
            String key = key(p);
            fields.put(key, p.accept(":") ? p.parseExpression() : new Ast.Sym(key));
            if (!p.accept(",")) {
                p.expect("}");
                break;
            }
        }
        return fields;
    }

    private static String key(Parser p) {
        Token t = p.next();
        if (t.kind() == Token.Kind.IDENT || t.kind() == Token.Kind.STRING)
            return t.text();
        throw p.err("Expected property name but found " + t);
    }
}

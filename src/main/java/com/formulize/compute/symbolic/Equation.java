package com.formulize.compute.symbolic;

import com.formulize.compute.expr.Ast;
import com.formulize.compute.expr.Dialect;
import com.formulize.compute.expr.EvalException;
import com.formulize.compute.expr.ExprNode;
import com.formulize.compute.expr.Parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One preprocessed equation line, split into its two sides.
 *
 * A line has one of three shapes: {@code v = expr}, {@code expr = v} or
 * {@code [v1, v2, ...] = expr}. Which shape applies is decided per target at
 * resolution time, since {@code a = b} can define either side.
 */
public final class Equation {
    private final String source;
    private final ExprNode left;
    private final ExprNode right;
    private final List<String> vectorTargets;

    private Equation(String source, ExprNode left, ExprNode right, List<String> vectorTargets) {
        this.source = source;
        this.left = left;
        this.right = right;
        this.vectorTargets = vectorTargets;
    }

    /**
     * @param source A preprocessed line, symbols already translated.
     * @throws EvalException if the line has no single top-level {@code =} or a
     *                       side does not parse.
     */
    public static Equation parse(String source) {
        int split = splitIndex(source);
        String lhs = source.substring(0, split).trim();
        String rhs = source.substring(split + 1).trim();
        if (lhs.isEmpty() || rhs.isEmpty())
            throw new EvalException("Empty side in equation: " + source);
        ExprNode left = Parser.parse(lhs, Dialect.MATH);
        ExprNode right = Parser.parse(rhs, Dialect.MATH);
        return new Equation(source, left, right, vectorTargets(left));
    }

    /** Position of the only top-level assignment sign. */
    private static int splitIndex(String s) {
        int depth = 0;
        int found = -1;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            } else if (c == '=' && depth == 0) {
                char prev = i > 0 ? s.charAt(i - 1) : ' ';
                char next = i + 1 < s.length() ? s.charAt(i + 1) : ' ';
                if (next == '=') {
                    i++;
                    continue;
                }
                if (prev == '<' || prev == '>' || prev == '!')
                    continue;
                if (found >= 0)
                    throw new EvalException("More than one '=' in equation: " + s);
                found = i;
            }
        }
        if (found < 0)
            throw new EvalException("Not an equation: " + s);
        return found;
    }

    private static List<String> vectorTargets(ExprNode left) {
        if (!(left instanceof Ast.VectorLit vector))
            return null;
        List<String> names = new ArrayList<>();
        for (ExprNode e : vector.elements()) {
            if (!(e instanceof Ast.Sym sym))
                return null;
            names.add(sym.name());
        }
        return Collections.unmodifiableList(names);
    }

    public String source() {
        return source;
    }

    public ExprNode left() {
        return left;
    }

    public ExprNode right() {
        return right;
    }

    public boolean isVectorForm() {
        return vectorTargets != null;
    }

    /** Left-hand symbols of the vector form, empty otherwise. */
    public List<String> vectorTargets() {
        return vectorTargets != null ? vectorTargets : List.of();
    }

    /** True if {@code symbol} stands alone on the left. */
    public boolean definesOnLeft(String symbol) {
        return left instanceof Ast.Sym s && s.name().equals(symbol);
    }

    /** True if {@code symbol} stands alone on the right. */
    public boolean definesOnRight(String symbol) {
        return right instanceof Ast.Sym s && s.name().equals(symbol);
    }

    @Override
    public String toString() {
        return source;
    }
}

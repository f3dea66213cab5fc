package com.formulize.compute.expr;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The expression AST. Every node kind is a record implementing
 * {@link ExprNode}.
 */
public final class Ast {
    private Ast() {
    }

    public record Num(double value) implements ExprNode {
        @Override
        public EvalValue eval(Map<String, EvalValue> scope) {
            return EvalValue.of(value);
        }

        @Override
        public void collectSymbols(Set<String> out) {
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /** Variable reference. Falls back to the named constants when unbound. */
    public record Sym(String name) implements ExprNode {
        @Override
        public EvalValue eval(Map<String, EvalValue> scope) {
            EvalValue v = scope.get(name);
            if (v != null)
                return v;
            Double constant = FunctionTable.constant(name);
            if (constant != null)
                return EvalValue.of(constant);
            throw new EvalException("Undefined symbol: " + name);
        }

        @Override
        public void collectSymbols(Set<String> out) {
            out.add(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public enum UnaryOp {
        NEG, PLUS, NOT
    }

    public record Unary(UnaryOp op, ExprNode operand) implements ExprNode {
        @Override
        public EvalValue eval(Map<String, EvalValue> scope) {
            EvalValue v = operand.eval(scope);
            return switch (op) {
                case NEG -> v.map(d -> -d);
                case PLUS -> v;
                case NOT -> EvalValue.of(!v.truthy());
            };
        }

        @Override
        public void collectSymbols(Set<String> out) {
            operand.collectSymbols(out);
        }

        @Override
        public String toString() {
            return switch (op) {
                case NEG -> "(-" + operand + ")";
                case PLUS -> operand.toString();
                case NOT -> "(not " + operand + ")";
            };
        }
    }

    public enum BinaryOp {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("mod"), REM("%"), POW("^"),
        EMUL(".*"), EDIV("./"),
        EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">="),
        AND("and"), OR("or"), XOR("xor");

        private final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    public record Binary(BinaryOp op, ExprNode left, ExprNode right) implements ExprNode {
        @Override
        public EvalValue eval(Map<String, EvalValue> scope) {
            // short-circuit forms first
            if (op == BinaryOp.AND) {
                return EvalValue.of(left.eval(scope).truthy() && right.eval(scope).truthy());
            }
            if (op == BinaryOp.OR) {
                return EvalValue.of(left.eval(scope).truthy() || right.eval(scope).truthy());
            }
            EvalValue a = left.eval(scope);
            EvalValue b = right.eval(scope);
            return switch (op) {
                case ADD -> EvalValue.elementWise(a, b, Double::sum);
                case SUB -> EvalValue.elementWise(a, b, (x, y) -> x - y);
                case MUL -> a.isVector() && b.isVector()
                        ? EvalValue.of(EvalValue.dot(a.vector(), b.vector()))
                        : EvalValue.elementWise(a, b, (x, y) -> x * y);
                case DIV -> {
                    if (b.isVector())
                        throw new EvalException("Cannot divide by a vector");
                    yield EvalValue.elementWise(a, b, (x, y) -> x / y);
                }
                case EMUL -> EvalValue.elementWise(a, b, (x, y) -> x * y);
                case EDIV -> EvalValue.elementWise(a, b, (x, y) -> x / y);
                case MOD -> EvalValue.elementWise(a, b, Ast::mod);
                case REM -> EvalValue.elementWise(a, b, (x, y) -> x % y);
                case POW -> EvalValue.elementWise(a, b, Math::pow);
                case EQ -> EvalValue.of(a.sameAs(b));
                case NE -> EvalValue.of(!a.sameAs(b));
                case LT -> EvalValue.of(a.scalar() < b.scalar());
                case LE -> EvalValue.of(a.scalar() <= b.scalar());
                case GT -> EvalValue.of(a.scalar() > b.scalar());
                case GE -> EvalValue.of(a.scalar() >= b.scalar());
                case XOR -> EvalValue.of(a.truthy() ^ b.truthy());
                case AND, OR -> throw new IllegalStateException();
            };
        }

        @Override
        public void collectSymbols(Set<String> out) {
            left.collectSymbols(out);
            right.collectSymbols(out);
        }

        @Override
        public String toString() {
            return "(" + left + " " + op.symbol() + " " + right + ")";
        }
    }

    /** Floored modulo: the result takes the sign of the divisor. x mod 0 is x. */
    static double mod(double x, double y) {
        if (y == 0)
            return x;
        return x - y * Math.floor(x / y);
    }

    public record Conditional(ExprNode condition, ExprNode whenTrue, ExprNode whenFalse) implements ExprNode {
        @Override
        public EvalValue eval(Map<String, EvalValue> scope) {
            return condition.eval(scope).truthy() ? whenTrue.eval(scope) : whenFalse.eval(scope);
        }

        @Override
        public void collectSymbols(Set<String> out) {
            condition.collectSymbols(out);
            whenTrue.collectSymbols(out);
            whenFalse.collectSymbols(out);
        }

        @Override
        public String toString() {
            return "(" + condition + " ? " + whenTrue + " : " + whenFalse + ")";
        }
    }

    /** Call of a function from the {@link FunctionTable}, resolved at parse time. */
    public record Call(String name, FunctionTable.Fn fn, List<ExprNode> args) implements ExprNode {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public EvalValue eval(Map<String, EvalValue> scope) {
            EvalValue[] values = new EvalValue[args.size()];
            for (int i = 0; i < values.length; i++)
                values[i] = args.get(i).eval(scope);
            return fn.apply(values);
        }

        @Override
        public void collectSymbols(Set<String> out) {
            for (ExprNode a : args)
                a.collectSymbols(out);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(name).append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0)
                    sb.append(", ");
                sb.append(args.get(i));
            }
            return sb.append(')').toString();
        }
    }

    /** {@code [a, b, c]}. Elements must evaluate to scalars. */
    public record VectorLit(List<ExprNode> elements) implements ExprNode {
        public VectorLit {
            elements = List.copyOf(elements);
        }

        @Override
        public EvalValue eval(Map<String, EvalValue> scope) {
            double[] out = new double[elements.size()];
            for (int i = 0; i < out.length; i++)
                out[i] = elements.get(i).eval(scope).scalar();
            return EvalValue.ofVector(out);
        }

        @Override
        public void collectSymbols(Set<String> out) {
            for (ExprNode e : elements)
                e.collectSymbols(out);
        }

        @Override
        public String toString() {
            return elements.toString();
        }
    }

    /** {@code target[index]} with the dialect's index base. */
    public record Index(ExprNode target, ExprNode index, int base) implements ExprNode {
        @Override
        public EvalValue eval(Map<String, EvalValue> scope) {
            double[] v = target.eval(scope).vector();
            double raw = index.eval(scope).scalar();
            if (raw != Math.rint(raw))
                throw new EvalException("Index must be an integer: " + raw);
            int i = (int) raw - base;
            if (i < 0 || i >= v.length)
                throw new EvalException("Index " + (long) raw + " out of range for length " + v.length);
            return EvalValue.of(v[i]);
        }

        @Override
        public void collectSymbols(Set<String> out) {
            target.collectSymbols(out);
            index.collectSymbols(out);
        }

        @Override
        public String toString() {
            return target + "[" + index + "]";
        }
    }
}

package com.formulize.compute.external;

import com.formulize.compute.api.Evaluator;
import com.formulize.compute.api.Value;
import com.formulize.compute.expr.EvalException;
import com.formulize.compute.expr.EvalValue;
import com.formulize.compute.expr.ExprNode;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A generated {@code evaluate} function compiled to an interpreted statement
 * tree. It can only do arithmetic on numbers; no host code is reachable from
 * it.
 *
 * Variable values are exposed under {@code <parameter>.<id>}, which is how
 * both {@code variables.x} and {@code variables["x"]} parse.
 */
public final class GeneratedFunction implements Evaluator {
    private final String source;
    private final String parameter;
    private final List<Stmt> body;
    private final List<String> targets;

    GeneratedFunction(String source, String parameter, List<Stmt> body, List<String> targets) {
        this.source = source;
        this.parameter = parameter;
        this.body = List.copyOf(body);
        this.targets = List.copyOf(targets);
    }

    @Override
    public Map<String, Value> evaluate(Map<String, Value> variables) {
        Frame frame = new Frame(targets);
        for (Map.Entry<String, Value> e : variables.entrySet()) {
            Value v = e.getValue();
            // non-numeric sets are not visible to generated code
            if (v == null || (v.isSet() && !v.isNumericSet()))
                continue;
            frame.scope.put(parameter + "." + e.getKey(), EvalValue.from(v));
        }
        Map<String, EvalValue> returned = run(body, frame);
        if (returned == null)
            throw new EvalException("Generated function returned nothing");
        Map<String, Value> out = new LinkedHashMap<>();
        returned.forEach((k, v) -> out.put(k, v.toValue()));
        return out;
    }

    public String source() {
        return source;
    }

    public String parameter() {
        return parameter;
    }

    static Map<String, EvalValue> run(List<Stmt> statements, Frame frame) {
        for (Stmt s : statements) {
            Map<String, EvalValue> result = s.exec(frame);
            if (result != null)
                return result;
        }
        return null;
    }

    // ── Statement model ──────────────────────────────────────────

    /** Mutable state of one call. */
    static final class Frame {
        final Map<String, EvalValue> scope = new HashMap<>();
        final Map<String, Map<String, EvalValue>> objects = new HashMap<>();
        final List<String> targets;

        Frame(List<String> targets) {
            this.targets = targets;
        }
    }

    /** A statement; returns the returned object, or null to continue. */
    interface Stmt {
        Map<String, EvalValue> exec(Frame frame);
    }

    record Declare(String name, ExprNode init) implements Stmt {
        @Override
        public Map<String, EvalValue> exec(Frame frame) {
            frame.scope.put(name, init != null ? init.eval(frame.scope) : EvalValue.of(Double.NaN));
            return null;
        }
    }

    record DeclareObject(String name, Map<String, ExprNode> fields) implements Stmt {
        @Override
        public Map<String, EvalValue> exec(Frame frame) {
            Map<String, EvalValue> object = new LinkedHashMap<>();
            for (Map.Entry<String, ExprNode> f : fields.entrySet()) {
                EvalValue v = f.getValue().eval(frame.scope);
                object.put(f.getKey(), v);
                frame.scope.put(name + "." + f.getKey(), v);
            }
            frame.objects.put(name, object);
            return null;
        }
    }

    record Destructure(Map<String, String> aliases, String source) implements Stmt {
        @Override
        public Map<String, EvalValue> exec(Frame frame) {
            for (Map.Entry<String, String> a : aliases.entrySet()) {
                EvalValue v = frame.scope.get(source + "." + a.getKey());
                if (v == null)
                    throw new EvalException("Undefined property: " + source + "." + a.getKey());
                frame.scope.put(a.getValue(), v);
            }
            return null;
        }
    }

    /** {@code x = e}, {@code x += e}, {@code obj.k = e}. */
    record Assign(String target, String op, ExprNode value) implements Stmt {
        @Override
        public Map<String, EvalValue> exec(Frame frame) {
            EvalValue v = value.eval(frame.scope);
            if (!op.equals("=")) {
                EvalValue current = frame.scope.get(target);
                if (current == null)
                    throw new EvalException("Undefined symbol: " + target);
                v = EvalValue.elementWise(current, v, switch (op) {
                    case "+=" -> Double::sum;
                    case "-=" -> (x, y) -> x - y;
                    case "*=" -> (x, y) -> x * y;
                    default -> (x, y) -> x / y;
                });
            }
            frame.scope.put(target, v);
            int dot = target.indexOf('.');
            if (dot > 0) {
                Map<String, EvalValue> object = frame.objects.get(target.substring(0, dot));
                if (object == null)
                    throw new EvalException("Assignment to property of unknown object: " + target);
                object.put(target.substring(dot + 1), v);
            }
            return null;
        }
    }

    record If(ExprNode condition, List<Stmt> then, List<Stmt> otherwise) implements Stmt {
        @Override
        public Map<String, EvalValue> exec(Frame frame) {
            return run(condition.eval(frame.scope).truthy() ? then : otherwise, frame);
        }
    }

    record Try(List<Stmt> body, List<Stmt> handler) implements Stmt {
        @Override
        public Map<String, EvalValue> exec(Frame frame) {
            try {
                return run(body, frame);
            } catch (EvalException e) {
                return run(handler, frame);
            }
        }
    }

    record Throw(String message) implements Stmt {
        @Override
        public Map<String, EvalValue> exec(Frame frame) {
            throw new EvalException(message);
        }
    }

    /** {@code return {k: e, ...}}. */
    record ReturnObject(Map<String, ExprNode> fields) implements Stmt {
        @Override
        public Map<String, EvalValue> exec(Frame frame) {
            Map<String, EvalValue> out = new LinkedHashMap<>();
            for (Map.Entry<String, ExprNode> f : fields.entrySet())
                out.put(f.getKey(), f.getValue().eval(frame.scope));
            return out;
        }
    }

    /** {@code return name} where name is a local object, or a bare value for a single target. */
    record ReturnExpr(ExprNode value, String objectName) implements Stmt {
        @Override
        public Map<String, EvalValue> exec(Frame frame) {
            if (objectName != null && frame.objects.containsKey(objectName))
                return new LinkedHashMap<>(frame.objects.get(objectName));
            if (frame.targets.size() != 1)
                throw new EvalException("A bare return value needs exactly one target");
            Map<String, EvalValue> out = new LinkedHashMap<>();
            out.put(frame.targets.get(0), value.eval(frame.scope));
            return out;
        }
    }
}

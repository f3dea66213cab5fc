package com.formulize.compute.symbolic;

import com.formulize.compute.api.Evaluator;
import com.formulize.compute.api.Value;
import com.formulize.compute.api.VariableMapping;
import com.formulize.compute.expr.EvalException;
import com.formulize.compute.expr.EvalValue;
import com.formulize.compute.expr.ExprNode;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluator for the symbolic strategy: derives target variables from a list of
 * equations by repeated pattern matching until a fixed point.
 *
 * <p>
 * Each pass first invokes the explicit {@link VariableMapping}s of unresolved
 * targets, then walks the equations in order. An equation resolves a target
 * when the target stands alone on one side and the other side evaluates in the
 * current scope; a vector equation {@code [a, b] = rhs} resolves all its
 * left-hand targets at once. Every resolved value enters the scope, so later
 * equations may build on it.
 *
 * <p>
 * Passes repeat while at least one target got resolved. Targets left over when
 * a pass makes no progress are reported as {@link Value#NaN}; a circular or
 * underspecified system degrades instead of failing.
 *
 * <p>
 * A target defined by several equations takes the first one that evaluates, in
 * equation order.
 */
public final class ExpressionResolver implements Evaluator {
    private static final Logger log = LogManager.getLogger(ExpressionResolver.class);

    private final NameTranslator translator;
    private final List<Equation> equations;
    private final List<String> targets;
    private final Map<String, VariableMapping> mappings;

    /**
     * @param expressions Equation lines, possibly with {@code {id}} markup.
     * @param targets     Ids of the computed variables, in resolution order.
     * @param ids         Ids of every defined variable.
     * @param mappings    Per-target overrides, may be empty.
     */
    public ExpressionResolver(List<String> expressions, Collection<String> targets, Collection<String> ids,
            Map<String, VariableMapping> mappings) {
        Set<String> allIds = new LinkedHashSet<>(ids);
        allIds.addAll(targets);
        this.translator = new NameTranslator(allIds);
        this.targets = List.copyOf(new LinkedHashSet<>(targets));
        this.mappings = mappings != null ? Map.copyOf(mappings) : Map.of();

        List<Equation> parsed = new ArrayList<>(expressions.size());
        for (String expression : expressions) {
            String line = translator.preprocess(expression);
            try {
                parsed.add(Equation.parse(line));
            } catch (EvalException e) {
                log.warn("Skipping expression '{}': {}", expression, e.getMessage());
            }
        }
        this.equations = Collections.unmodifiableList(parsed);
        reportShadowedDefinitions();
    }

    private void reportShadowedDefinitions() {
        for (String target : targets) {
            String symbol = translator.symbol(target);
            Equation first = null;
            for (Equation eq : equations) {
                if (!defines(eq, symbol))
                    continue;
                if (first == null)
                    first = eq;
                else
                    log.debug("'{}' also defines {}; '{}' is tried first", eq, target, first);
            }
        }
    }

    private static boolean defines(Equation eq, String symbol) {
        return eq.vectorTargets().contains(symbol) || eq.definesOnLeft(symbol) || eq.definesOnRight(symbol);
    }

    @Override
    public Map<String, Value> evaluate(Map<String, Value> variables) {
        return resolve(variables).values();
    }

    /**
     * Runs the fixed-point loop against a snapshot of variable values. Values
     * of target variables in the snapshot are ignored.
     */
    public Resolution resolve(Map<String, Value> variables) {
        Map<String, EvalValue> scope = new HashMap<>();
        Map<String, Value> byId = new LinkedHashMap<>();
        for (Map.Entry<String, Value> e : variables.entrySet()) {
            if (targets.contains(e.getKey()) || e.getValue() == null)
                continue;
            byId.put(e.getKey(), e.getValue());
            String symbol = translator.symbol(e.getKey());
            if (symbol == null)
                continue;
            try {
                scope.put(symbol, EvalValue.from(e.getValue()));
            } catch (EvalException ex) {
                log.debug("Variable {} is not usable in expressions: {}", e.getKey(), ex.getMessage());
            }
        }

        Map<String, Value> results = new LinkedHashMap<>();
        Set<String> unresolved = new LinkedHashSet<>(targets);
        int passes = 0;
        boolean progress = true;
        while (!unresolved.isEmpty() && progress) {
            passes++;
            int before = unresolved.size();
            applyMappings(unresolved, byId, scope, results);
            for (Equation eq : equations) {
                if (unresolved.isEmpty())
                    break;
                if (eq.isVectorForm())
                    applyVector(eq, unresolved, byId, scope, results);
                else
                    applyScalar(eq, unresolved, byId, scope, results);
            }
            progress = unresolved.size() < before;
        }

        if (!unresolved.isEmpty()) {
            log.warn("No equation resolves {} after {} pass(es); reporting NaN", unresolved, passes);
            for (String id : unresolved)
                results.put(id, Value.NaN);
        }
        return new Resolution(results, unresolved, passes);
    }

    private void applyMappings(Set<String> unresolved, Map<String, Value> byId, Map<String, EvalValue> scope,
            Map<String, Value> results) {
        for (String target : new ArrayList<>(unresolved)) {
            VariableMapping mapping = mappings.get(target);
            if (mapping == null)
                continue;
            try {
                Value value = mapping.apply(Collections.unmodifiableMap(byId));
                if (value != null)
                    accept(target, value, unresolved, byId, scope, results);
            } catch (RuntimeException e) {
                log.debug("Mapping for {} failed, retrying next pass: {}", target, e.getMessage());
            }
        }
    }

    private void applyVector(Equation eq, Set<String> unresolved, Map<String, Value> byId,
            Map<String, EvalValue> scope, Map<String, Value> results) {
        List<String> symbols = eq.vectorTargets();
        boolean wanted = false;
        for (String symbol : symbols) {
            String id = translator.id(symbol);
            if (id != null && unresolved.contains(id) && !mappings.containsKey(id))
                wanted = true;
        }
        if (!wanted)
            return;
        try {
            double[] values = evalResolved(eq.right(), unresolved, scope).vector();
            if (values.length != symbols.size()) {
                log.debug("'{}' yields {} values for {} targets", eq, values.length, symbols.size());
                return;
            }
            for (int i = 0; i < values.length; i++) {
                String id = translator.id(symbols.get(i));
                if (id != null && unresolved.contains(id) && !mappings.containsKey(id))
                    accept(id, Value.of(values[i]), unresolved, byId, scope, results);
            }
        } catch (EvalException e) {
            log.debug("'{}' not evaluable yet: {}", eq, e.getMessage());
        }
    }

    private void applyScalar(Equation eq, Set<String> unresolved, Map<String, Value> byId,
            Map<String, EvalValue> scope, Map<String, Value> results) {
        for (String target : new ArrayList<>(unresolved)) {
            if (mappings.containsKey(target))
                continue;
            String symbol = translator.symbol(target);
            try {
                EvalValue value;
                if (eq.definesOnLeft(symbol))
                    value = evalResolved(eq.right(), unresolved, scope);
                else if (eq.definesOnRight(symbol))
                    value = evalResolved(eq.left(), unresolved, scope);
                else
                    continue;
                accept(target, value.toValue(), unresolved, byId, scope, results);
                return;
            } catch (EvalException e) {
                log.debug("'{}' not evaluable for {} yet: {}", eq, target, e.getMessage());
            }
        }
    }

    /**
     * Evaluates one side of an equation. A reference to a target that is not
     * resolved yet fails, so it never falls back to a named constant.
     */
    private EvalValue evalResolved(ExprNode node, Set<String> unresolved, Map<String, EvalValue> scope) {
        Set<String> symbols = new HashSet<>();
        node.collectSymbols(symbols);
        for (String symbol : symbols) {
            String id = translator.id(symbol);
            if (id != null && unresolved.contains(id))
                throw new EvalException("Symbol " + symbol + " is not resolved yet");
        }
        return node.eval(scope);
    }

    private void accept(String id, Value value, Set<String> unresolved, Map<String, Value> byId,
            Map<String, EvalValue> scope, Map<String, Value> results) {
        unresolved.remove(id);
        results.put(id, value);
        byId.put(id, value);
        try {
            scope.put(translator.symbol(id), EvalValue.from(value));
        } catch (EvalException e) {
            log.debug("Resolved value of {} is not usable in expressions: {}", id, e.getMessage());
        }
    }

    public NameTranslator translator() {
        return translator;
    }

    public List<Equation> equations() {
        return equations;
    }

    public List<String> targets() {
        return targets;
    }
}

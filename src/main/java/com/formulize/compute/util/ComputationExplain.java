package com.formulize.compute.util;

import com.formulize.compute.api.Role;
import com.formulize.compute.expr.Ast;
import com.formulize.compute.expr.ExprNode;
import com.formulize.compute.external.GeneratedFunction;
import com.formulize.compute.registry.Variable;
import com.formulize.compute.registry.VariableRegistry;
import com.formulize.compute.symbolic.Equation;
import com.formulize.compute.symbolic.ExpressionResolver;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Diagnostic text for the active computation: the display code shown next to
 * a formula, per-variable dumps and a Mermaid dependency diagram.
 *
 * <p>
 * Not for the recompute path: every call allocates strings.
 */
public final class ComputationExplain {
    private ComputationExplain() {
    }

    /** Display code for the symbolic strategy. */
    public static String describe(ExpressionResolver resolver) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("// Symbolic algebra evaluation\n");
        sb.append("// Computed: ").append(String.join(", ", resolver.targets())).append('\n');
        for (Map.Entry<String, String> e : resolver.translator().symbols().entrySet()) {
            if (!e.getKey().equals(e.getValue()))
                sb.append("// ").append(e.getKey()).append(" -> ").append(e.getValue()).append('\n');
        }
        for (Equation eq : resolver.equations())
            sb.append(eq.source()).append('\n');
        return sb.toString();
    }

    public static String describeManual(int functionCount, List<String> computed) {
        return "// Manual computation: " + functionCount + " function(s)\n"
                + "// Computed: " + String.join(", ", computed) + "\n";
    }

    public static String describeGenerated(GeneratedFunction fn, List<String> expressions) {
        return "// Generated evaluation function\n"
                + "// Based on expressions: " + String.join(", ", expressions) + "\n"
                + fn.source();
    }

    /**
     * Dumps the state of a single variable.
     */
    public static String explainVariable(VariableRegistry registry, String id) {
        Variable v = registry.require(id);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Variable: ").append(id).append('\n')
                .append("  Role: ").append(v.role().label()).append('\n')
                .append("  Value: ").append(v.value()).append('\n');
        if (v.set() != null)
            sb.append("  Set: ").append(v.set()).append('\n');
        if (v.key() != null)
            sb.append("  Key: ").append(v.key()).append('\n');
        if (v.memberOf() != null)
            sb.append("  Member of: ").append(v.memberOf()).append('\n');
        if (v.range() != null)
            sb.append("  Range: [").append(v.range()[0]).append(", ").append(v.range()[1]).append("]\n");
        if (v.errored())
            sb.append("  ERRORED\n");
        return sb.toString();
    }

    /** One-line summary of the last pass. */
    public static String explainLastRecompute(long epoch, int updated, VariableRegistry registry) {
        return "Epoch: " + epoch + ", Computed: " + updated + "/" + registry.idsWithRole(Role.COMPUTED).size();
    }

    /**
     * Mermaid diagram: one node per variable, one edge from every symbol an
     * equation reads to every variable it can define.
     */
    public static String toMermaid(ExpressionResolver resolver, VariableRegistry registry) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph TD;\n");
        for (String id : registry.ids()) {
            Variable v = registry.require(id);
            String shape = v.role() == Role.COMPUTED ? "([\"" : "[\"";
            String close = v.role() == Role.COMPUTED ? "\"])" : "\"]";
            sb.append("  ").append(nodeId(id)).append(shape).append(id).append("<br/>")
                    .append(v.value()).append(close).append(";\n");
        }
        Set<String> edges = new LinkedHashSet<>();
        for (Equation eq : resolver.equations()) {
            Set<String> defined = new LinkedHashSet<>(eq.vectorTargets());
            collectDefined(eq.left(), defined);
            collectDefined(eq.right(), defined);
            Set<String> read = new LinkedHashSet<>();
            eq.left().collectSymbols(read);
            eq.right().collectSymbols(read);
            for (String target : defined) {
                String targetId = resolver.translator().id(target);
                if (targetId == null || !resolver.targets().contains(targetId))
                    continue;
                for (String symbol : read) {
                    String sourceId = resolver.translator().id(symbol);
                    if (sourceId != null && !sourceId.equals(targetId))
                        edges.add("  " + nodeId(sourceId) + " --> " + nodeId(targetId) + ";\n");
                }
            }
        }
        edges.forEach(sb::append);
        return sb.toString();
    }

    private static void collectDefined(ExprNode side, Set<String> out) {
        if (side instanceof Ast.Sym sym)
            out.add(sym.name());
    }

    private static String nodeId(String id) {
        return "v_" + id.replaceAll("[^A-Za-z0-9_]", "_");
    }
}

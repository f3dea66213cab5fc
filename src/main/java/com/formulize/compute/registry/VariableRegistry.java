package com.formulize.compute.registry;

import com.formulize.compute.api.Role;
import com.formulize.compute.api.Value;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical store of variable definitions, values and cross-references.
 *
 * <h2>Lifecycle</h2>
 * Variables are created once with {@link #addVariable} (idempotent), their
 * {@code key} and {@code memberOf} references are resolved in a dedicated pass
 * after the whole batch is registered (a variable may reference one added
 * later), and they are mutated through {@link #setValue} and
 * {@link #setSetValue} afterwards. Only {@link #reset()} removes them.
 *
 * <h2>Positional join</h2>
 * A variable with {@code key=K} and its own set takes the element of its set at
 * the index where K's current value sits inside K's set. The join runs in both
 * directions on every {@link #setValue}; a value absent from the relevant set
 * does not propagate.
 *
 * <h2>Notification</h2>
 * Unless the registry is in bulk mode, a successful user write notifies the
 * {@link RegistryObserver}, which recomputes. Strategy-side writes go through
 * {@link #write} and never notify.
 *
 * Not thread-safe. All access must happen on the engine thread.
 */
public final class VariableRegistry {
    private static final Logger log = LogManager.getLogger(VariableRegistry.class);

    public static final double DEFAULT_INPUT_MIN = -10;
    public static final double DEFAULT_INPUT_MAX = 10;
    public static final double DEFAULT_INPUT_STEP = 0.5;
    // 1 rather than 0: safer for division and log
    public static final double DEFAULT_INPUT_VALUE = 1;

    private final Map<String, Variable> variables = new LinkedHashMap<>();
    private final Map<String, Integer> activeIndices = new HashMap<>();
    private final Map<String, Set<Integer>> processedIndices = new HashMap<>();

    private RegistryObserver observer;
    private boolean bulk;
    private boolean stepMode;

    public void setObserver(RegistryObserver observer) {
        this.observer = observer;
    }

    // ── Definition ───────────────────────────────────────────────

    /**
     * Registers a variable if the id is not taken yet. A second add for the
     * same id is a no-op.
     *
     * @return true if the variable was inserted.
     */
    public boolean addVariable(String id, VariableDefinition definition) {
        if (id == null || variables.containsKey(id))
            return false;
        VariableDefinition def = definition != null ? definition : new VariableDefinition();
        Variable variable = new Variable(id, def);
        if (variable.role() == Role.INPUT)
            applyInputDefaults(variable, def);
        variables.put(id, variable);

        // Key already known: join now rather than waiting for the batch pass.
        if (variable.key() != null && variable.set() != null)
            joinFromKey(variable);
        return true;
    }

    private void applyInputDefaults(Variable variable, VariableDefinition def) {
        if (variable.range() == null)
            variable.range(new double[] { DEFAULT_INPUT_MIN, DEFAULT_INPUT_MAX });
        if (variable.value() == null && def.getSet() == null && def.getKey() == null && def.getMemberOf() == null)
            variable.value(Value.of(DEFAULT_INPUT_VALUE));
    }

    /**
     * Applies every {@code key} join once. Call after a batch of
     * {@link #addVariable} calls.
     */
    public void resolveKeyRelationships() {
        for (Variable variable : variables.values()) {
            if (variable.key() != null && variable.set() != null)
                joinFromKey(variable);
        }
    }

    /**
     * Copies the parent's set into every {@code memberOf} child. A child with
     * no explicit value or index takes the parent's value when it is a member
     * of the set, otherwise the first element. In step mode no default is
     * assigned: values are staged by the step driver.
     */
    public void resolveMemberOfRelationships() {
        for (Variable variable : variables.values()) {
            if (variable.memberOf() == null)
                continue;
            Variable parent = variables.get(variable.memberOf());
            if (parent == null) {
                log.warn("Variable {} is a member of unknown variable {}", variable.id(), variable.memberOf());
                continue;
            }
            List<Object> parentSet = parent.set();
            if (parentSet == null)
                continue;
            variable.inheritSet(parentSet);

            if (variable.value() != null && variable.value().isScalar())
                continue;
            Integer index = variable.index();
            if (index != null) {
                if (index >= 0 && index < parentSet.size())
                    variable.value(Value.fromElement(parentSet.get(index)));
                continue;
            }
            Value parentValue = parent.value();
            if (parentValue != null && parentValue.isScalar() && indexIn(parentSet, parentValue) >= 0) {
                variable.value(parentValue);
            } else if (!parentSet.isEmpty() && !stepMode) {
                variable.value(Value.fromElement(parentSet.get(0)));
            }
        }
    }

    // ── User mutation ────────────────────────────────────────────

    /**
     * Sets a scalar value and triggers a recompute.
     *
     * @return false if the variable is unknown or owned by the engine.
     */
    public boolean setValue(String id, double value) {
        return setValue(id, Value.of(value));
    }

    /**
     * Sets a value, propagates positional joins and, unless in bulk mode or
     * already recomputing, triggers a recompute.
     *
     * @return false if the variable is unknown or owned by the engine.
     */
    public boolean setValue(String id, Value value) {
        Variable variable = variables.get(id);
        if (variable == null) {
            log.warn("setValue ignored: {}", new UnknownVariableException(id).getMessage());
            return false;
        }
        if (variable.role() == Role.COMPUTED && !recomputing()) {
            log.warn("setValue ignored: computed variable {} is written only by the active strategy", id);
            return false;
        }
        variable.value(value);
        if (value != null && value.isScalar())
            propagateJoins(variable, value);
        notifyChanged(id);
        return true;
    }

    /**
     * Sets a set-valued variable and triggers a recompute.
     *
     * @return false if the variable is unknown or owned by the engine.
     */
    public boolean setSetValue(String id, List<?> elements) {
        return setValue(id, Value.ofSet(elements));
    }

    /**
     * Changes a variable's role. Inputs without a range get the default range.
     * The observer re-derives the evaluator.
     *
     * @return false if the variable is unknown.
     */
    public boolean setRole(String id, Role role) {
        Variable variable = variables.get(id);
        if (variable == null) {
            log.warn("setRole ignored: {}", new UnknownVariableException(id).getMessage());
            return false;
        }
        variable.role(role);
        if (role == Role.INPUT && variable.range() == null)
            variable.range(new double[] { DEFAULT_INPUT_MIN, DEFAULT_INPUT_MAX });
        if (observer != null)
            observer.onRoleChanged(id, role);
        return true;
    }

    /**
     * Stages a value in step mode: written as-is, no joins, no recompute.
     * Computed variables may be staged.
     *
     * @return false if the variable is unknown.
     */
    public boolean stageValue(String id, Value value) {
        Variable variable = variables.get(id);
        if (variable == null) {
            log.warn("stageValue ignored: {}", new UnknownVariableException(id).getMessage());
            return false;
        }
        variable.value(value);
        return true;
    }

    // ── Strategy-side access ─────────────────────────────────────

    /**
     * Writes a value without any side effect: no joins, no notification. Used
     * by strategies during a recompute pass.
     *
     * @throws UnknownVariableException if the id is not registered.
     */
    public void write(String id, Value value) {
        require(id).value(value);
    }

    /**
     * Sets or clears the errored flag of a computed variable.
     */
    public void markErrored(String id, boolean errored) {
        Variable variable = variables.get(id);
        if (variable != null)
            variable.errored(errored);
    }

    // ── Positional join ──────────────────────────────────────────

    private void joinFromKey(Variable variable) {
        Variable keyVariable = variables.get(variable.key());
        if (keyVariable == null || keyVariable.set() == null || keyVariable.value() == null)
            return;
        int keyIndex = indexIn(keyVariable.set(), keyVariable.value());
        List<Object> ownSet = variable.set();
        if (keyIndex >= 0 && keyIndex < ownSet.size())
            variable.value(Value.fromElement(ownSet.get(keyIndex)));
    }

    private void propagateJoins(Variable changed, Value newValue) {
        List<Object> changedSet = changed.set();
        if (changedSet == null)
            return;
        int changedIndex = indexIn(changedSet, newValue);
        if (changedIndex < 0)
            return;

        // The changed variable follows a key: move the key to the same index,
        // then let the key's other dependents follow.
        if (changed.key() != null) {
            Variable keyVariable = variables.get(changed.key());
            if (keyVariable != null && keyVariable.set() != null && changedIndex < keyVariable.set().size()) {
                keyVariable.value(Value.fromElement(keyVariable.set().get(changedIndex)));
                updateDependents(keyVariable, changedIndex, changed.id());
            }
        }

        // The changed variable is itself a key.
        updateDependents(changed, changedIndex, null);
    }

    private void updateDependents(Variable key, int index, String skipId) {
        for (Variable dependent : variables.values()) {
            if (!key.id().equals(dependent.key()) || dependent.id().equals(key.id()) || dependent.id().equals(skipId))
                continue;
            List<Object> set = dependent.set();
            if (set != null && index < set.size())
                dependent.value(Value.fromElement(set.get(index)));
        }
    }

    private static int indexIn(List<Object> set, Value value) {
        return Value.ofSet(set).indexOf(value);
    }

    // ── Bulk and step mode ───────────────────────────────────────

    /** Suppresses recompute notifications until {@link #endBulk()}. */
    public void beginBulk() {
        bulk = true;
    }

    public void endBulk() {
        bulk = false;
    }

    public boolean isBulk() {
        return bulk;
    }

    public void setStepMode(boolean stepMode) {
        this.stepMode = stepMode;
    }

    public boolean isStepMode() {
        return stepMode;
    }

    private boolean recomputing() {
        return observer != null && observer.isRecomputing();
    }

    private void notifyChanged(String id) {
        if (!bulk && observer != null && !observer.isRecomputing())
            observer.onValueChanged(id);
    }

    // ── Set control bookkeeping ──────────────────────────────────

    public void setActiveIndex(String id, int index) {
        activeIndices.put(id, index);
    }

    public Optional<Integer> activeIndex(String id) {
        return Optional.ofNullable(activeIndices.get(id));
    }

    public void clearActiveIndices() {
        activeIndices.clear();
    }

    public void addProcessedIndex(String id, int index) {
        processedIndices.computeIfAbsent(id, k -> new LinkedHashSet<>()).add(index);
    }

    public Set<Integer> processedIndices(String id) {
        Set<Integer> indices = processedIndices.get(id);
        return indices == null ? Collections.emptySet() : Collections.unmodifiableSet(indices);
    }

    public void clearProcessedIndices() {
        processedIndices.clear();
    }

    public void clearProcessedIndices(String id) {
        processedIndices.remove(id);
    }

    // ── Queries ──────────────────────────────────────────────────

    /**
     * @throws UnknownVariableException if the id is not registered.
     */
    public Variable require(String id) {
        Variable variable = variables.get(id);
        if (variable == null)
            throw new UnknownVariableException(id);
        return variable;
    }

    public Optional<Variable> find(String id) {
        return Optional.ofNullable(variables.get(id));
    }

    public boolean contains(String id) {
        return variables.containsKey(id);
    }

    public int size() {
        return variables.size();
    }

    /** Ids of every variable with the given role, in registration order. */
    public List<String> idsWithRole(Role role) {
        List<String> ids = new ArrayList<>();
        for (Variable v : variables.values()) {
            if (v.role() == role)
                ids.add(v.id());
        }
        return ids;
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(variables.keySet());
    }

    /**
     * Snapshot of every variable that has a value.
     */
    public Map<String, Value> values() {
        Map<String, Value> snapshot = new LinkedHashMap<>();
        for (Variable v : variables.values()) {
            if (v.value() != null)
                snapshot.put(v.id(), v.value());
        }
        return snapshot;
    }

    /**
     * Detached copies of all variables, keyed by id.
     */
    public Map<String, Variable> getVariables() {
        Map<String, Variable> snapshot = new LinkedHashMap<>();
        for (Variable v : variables.values())
            snapshot.put(v.id(), v.copy());
        return snapshot;
    }

    /** Removes every variable and all index bookkeeping. */
    public void reset() {
        variables.clear();
        activeIndices.clear();
        processedIndices.clear();
        bulk = false;
    }
}

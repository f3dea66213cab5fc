package com.formulize.compute.registry;

import com.formulize.compute.api.Role;
import com.formulize.compute.api.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A registered variable and its live state.
 *
 * Instances handed out by {@link VariableRegistry#getVariables()} are detached
 * copies; the registry owns the live ones.
 */
public final class Variable {
    private final String id;
    private Role role;
    private Value value;
    private List<Object> set;
    private final String key;
    private final String memberOf;
    private final Integer index;
    private double[] range;
    private final Double step;
    private final Integer precision;
    private final List<String> options;
    private final String description;
    private final String units;
    private boolean errored;

    Variable(String id, VariableDefinition def) {
        this.id = id;
        this.role = def.getRole() != null ? def.getRole() : Role.CONSTANT;
        this.value = def.getValue();
        this.set = def.getSet() != null ? normalize(def.getSet()) : null;
        this.key = def.getKey();
        this.memberOf = def.getMemberOf();
        this.index = def.getIndex();
        this.range = def.getRange() != null ? def.getRange().clone() : null;
        this.step = def.getStep();
        this.precision = def.getPrecision();
        this.options = def.getOptions() != null ? List.copyOf(def.getOptions()) : null;
        this.description = def.getDescription();
        this.units = def.getUnits();
    }

    private Variable(Variable other) {
        this.id = other.id;
        this.role = other.role;
        this.value = other.value;
        this.set = other.set;
        this.key = other.key;
        this.memberOf = other.memberOf;
        this.index = other.index;
        this.range = other.range != null ? other.range.clone() : null;
        this.step = other.step;
        this.precision = other.precision;
        this.options = other.options;
        this.description = other.description;
        this.units = other.units;
        this.errored = other.errored;
    }

    private static List<Object> normalize(List<?> raw) {
        return Value.ofSet(raw).elements();
    }

    Variable copy() {
        return new Variable(this);
    }

    public String id() {
        return id;
    }

    public Role role() {
        return role;
    }

    public Value value() {
        return value;
    }

    /**
     * The permissible discrete values: the explicit set if one was given or
     * inherited, otherwise the elements of a set-valued value.
     *
     * @return The set, or null if the variable has none.
     */
    public List<Object> set() {
        if (set != null)
            return set;
        return value != null && value.isSet() ? value.elements() : null;
    }

    public String key() {
        return key;
    }

    public String memberOf() {
        return memberOf;
    }

    public Integer index() {
        return index;
    }

    public double[] range() {
        return range != null ? range.clone() : null;
    }

    public Double step() {
        return step;
    }

    public Integer precision() {
        return precision;
    }

    public List<String> options() {
        return options;
    }

    public String description() {
        return description;
    }

    public String units() {
        return units;
    }

    /** True when the last recompute could not derive this variable. */
    public boolean errored() {
        return errored;
    }

    /** The value as a double, NaN when unset or set-valued. */
    public double doubleValue() {
        return value != null && value.isScalar() ? value.doubleValue() : Double.NaN;
    }

    void value(Value value) {
        this.value = value;
    }

    void role(Role role) {
        this.role = role;
    }

    void range(double[] range) {
        this.range = range;
    }

    void inheritSet(List<Object> parentSet) {
        this.set = Collections.unmodifiableList(new ArrayList<>(parentSet));
    }

    void errored(boolean errored) {
        this.errored = errored;
    }

    @Override
    public String toString() {
        return "Variable{" + id + ", " + role.label() + ", value=" + value + (errored ? ", errored" : "") + "}";
    }
}

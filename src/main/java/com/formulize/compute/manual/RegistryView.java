package com.formulize.compute.manual;

import com.formulize.compute.api.Value;
import com.formulize.compute.api.VariableAccessor;
import com.formulize.compute.registry.Variable;
import com.formulize.compute.registry.VariableRegistry;

import java.util.Set;

/**
 * {@link VariableAccessor} over the live registry. Writes land on the variable
 * immediately, without positional joins and without triggering a recompute.
 */
final class RegistryView implements VariableAccessor {
    private final VariableRegistry registry;

    RegistryView(VariableRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Value get(String id) {
        return registry.find(id).map(Variable::value).orElse(null);
    }

    @Override
    public boolean set(String id, Value value) {
        if (!registry.contains(id))
            return false;
        registry.write(id, value);
        return true;
    }

    @Override
    public Set<String> ids() {
        return registry.ids();
    }
}

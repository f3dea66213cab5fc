package com.formulize.compute.expr;

/**
 * Surface syntax accepted by the {@link Parser}. Both dialects produce the same
 * AST and share the {@link FunctionTable}.
 */
public enum Dialect {
    /**
     * Formula notation: {@code ^} for powers, {@code and/or/xor/not},
     * {@code mod}, element-wise {@code .*} and {@code ./}, 1-based indexing.
     */
    MATH(1),
    /**
     * Script notation used by generated evaluators: {@code **}, {@code &&},
     * {@code ||}, {@code !}, strict equality, {@code Math.*} members, property
     * access on the parameter object, 0-based indexing.
     */
    SCRIPT(0);

    private final int indexBase;

    Dialect(int indexBase) {
        this.indexBase = indexBase;
    }

    public int indexBase() {
        return indexBase;
    }
}

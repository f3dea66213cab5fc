package com.formulize.compute.api;

/**
 * User code for the manual strategy. Instead of returning values it writes
 * them through {@link ManualContext#vars()}.
 */
@FunctionalInterface
public interface ManualFunction {

    void apply(ManualContext context) throws Exception;
}

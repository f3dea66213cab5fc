package com.formulize.compute.util;

import com.formulize.compute.api.ComputationListener;
import com.formulize.compute.api.Value;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Fans recompute callbacks out to several {@link ComputationListener}s.
 * Listeners are called in registration order; one that throws does not stop
 * the others from being called.
 */
public class CompositeComputationListener implements ComputationListener {
    private static final Logger log = LogManager.getLogger(CompositeComputationListener.class);

    private final ErrorRateLimiter errors = new ErrorRateLimiter(log, 1000);
    private volatile ComputationListener[] listeners = new ComputationListener[0];

    public synchronized void add(ComputationListener listener) {
        ComputationListener[] old = listeners;
        ComputationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public synchronized boolean remove(ComputationListener listener) {
        ComputationListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                ComputationListener[] next = new ComputationListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onRecomputeStart(long epoch) {
        for (ComputationListener l : listeners) {
            try {
                l.onRecomputeStart(epoch);
            } catch (RuntimeException e) {
                errors.log("Listener " + l.getClass().getName() + " failed", e);
            }
        }
    }

    @Override
    public void onVariableComputed(long epoch, String variableId, Value value, boolean changed) {
        for (ComputationListener l : listeners) {
            try {
                l.onVariableComputed(epoch, variableId, value, changed);
            } catch (RuntimeException e) {
                errors.log("Listener " + l.getClass().getName() + " failed", e);
            }
        }
    }

    @Override
    public void onVariableError(long epoch, String variableId, Throwable error) {
        for (ComputationListener l : listeners) {
            try {
                l.onVariableError(epoch, variableId, error);
            } catch (RuntimeException e) {
                errors.log("Listener " + l.getClass().getName() + " failed", e);
            }
        }
    }

    @Override
    public void onRecomputeEnd(long epoch, int variablesUpdated) {
        for (ComputationListener l : listeners) {
            try {
                l.onRecomputeEnd(epoch, variablesUpdated);
            } catch (RuntimeException e) {
                errors.log("Listener " + l.getClass().getName() + " failed", e);
            }
        }
    }
}

package io.github.eutro.qtx2qasm.core.qasm;

import io.github.eutro.qtx2qasm.core.ssa.Var;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Names for values produced by one operation, to be merged into the active {@link Scope}
 * once the operation's text has been emitted.
 */
public final class Bindings {
    private final Map<Var, String> bound = new LinkedHashMap<>();

    /**
     * Bind a value to a symbol.
     *
     * @param var  The value.
     * @param name The symbol, e.g. {@code q0} or {@code q0[1]}.
     * @return This, for convenience.
     */
    public Bindings bind(Var var, String name) {
        bound.put(var, name);
        return this;
    }

    /**
     * Bind each new value to the symbol of the value it replaces.
     *
     * @param emitter The emitter, whose active scope holds the old names.
     * @param from    The consumed values.
     * @param to      The values replacing them, in the same order.
     * @return This, for convenience.
     */
    public Bindings forward(QasmEmitter emitter, List<Var> from, List<Var> to) {
        if (from.size() != to.size()) {
            throw new IllegalStateException("cannot forward " + from.size() + " values to " + to.size());
        }
        for (int i = 0; i < from.size(); i++) {
            bind(to.get(i), emitter.getName(from.get(i)));
        }
        return this;
    }

    public Map<Var, String> asMap() {
        return Collections.unmodifiableMap(bound);
    }

    @Override
    public String toString() {
        return bound.toString();
    }
}

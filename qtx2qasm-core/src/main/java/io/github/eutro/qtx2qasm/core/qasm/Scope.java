package io.github.eutro.qtx2qasm.core.qasm;

import io.github.eutro.qtx2qasm.core.ssa.Circuit;
import io.github.eutro.qtx2qasm.core.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The symbol table for one circuit body.
 * <p>
 * A scope is opened by {@link QasmEmitter#openScope(Circuit)}, and closing it
 * discards every name it holds. Bindings are only ever added: a consumed value keeps
 * its symbol, and the value that replaces it is bound to the same symbol.
 */
public final class Scope implements AutoCloseable {
    private final QasmEmitter emitter;
    private final Circuit circuit;
    private final Map<Var, String> names = new HashMap<>();
    private final Set<String> taken = new HashSet<>();
    private final Map<String, Integer> counters = new HashMap<>();

    Scope(QasmEmitter emitter, Circuit circuit) {
        this.emitter = emitter;
        this.circuit = circuit;
        taken.addAll(emitter.reservedNames);
    }

    /**
     * Get the circuit whose body this scope names the values of.
     *
     * @return The circuit.
     */
    public Circuit getCircuit() {
        return circuit;
    }

    public boolean isEntryPoint() {
        return circuit.isEntryPoint();
    }

    String createName(String prefix) {
        String name;
        do {
            int n = counters.merge(prefix, 1, Integer::sum) - 1;
            name = prefix + n;
        } while (!taken.add(name));
        return name;
    }

    @Nullable
    String lookup(Var var) {
        return names.get(var);
    }

    void bind(Var var, String name) {
        String old = names.putIfAbsent(var, name);
        if (old != null) {
            throw new IllegalStateException("value " + var + " is already bound to " + old
                    + " in scope of @" + circuit.name);
        }
        int bracket = name.indexOf('[');
        taken.add(bracket == -1 ? name : name.substring(0, bracket));
    }

    @Override
    public void close() {
        emitter.closeScope(this);
    }
}

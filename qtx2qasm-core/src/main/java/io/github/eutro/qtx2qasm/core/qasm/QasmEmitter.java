package io.github.eutro.qtx2qasm.core.qasm;

import io.github.eutro.qtx2qasm.core.ext.QtxExts;
import io.github.eutro.qtx2qasm.core.ssa.Circuit;
import io.github.eutro.qtx2qasm.core.ssa.QType;
import io.github.eutro.qtx2qasm.core.ssa.Var;
import org.intellij.lang.annotations.PrintFormat;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Accumulates OpenQASM text, and tracks which symbol names which IR value.
 * <p>
 * Text is written a line at a time, so a statement is either emitted completely or not at all.
 * Names are held by the innermost open {@link Scope}; an emitter is used for one translation only.
 */
public class QasmEmitter {
    private final QasmConventions conventions;
    private final StringBuilder out = new StringBuilder();
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final Map<String, Circuit> declaredGates = new HashMap<>();
    final Set<String> reservedNames = new HashSet<>();
    private int indentLevel = 0;

    public QasmEmitter(QasmConventions conventions) {
        this.conventions = conventions;
    }

    public QasmConventions getConventions() {
        return conventions;
    }

    /**
     * Open a fresh scope for the body of a circuit. Close it when done with the body.
     *
     * @param circuit The circuit.
     * @return The scope.
     */
    public Scope openScope(Circuit circuit) {
        Scope scope = new Scope(this, circuit);
        scopes.push(scope);
        return scope;
    }

    void closeScope(Scope scope) {
        if (scopes.peek() != scope) {
            throw new IllegalStateException("scopes closed out of order");
        }
        scopes.pop();
    }

    /**
     * Get the innermost open scope.
     *
     * @return The scope.
     */
    public Scope scope() {
        Scope scope = scopes.peek();
        if (scope == null) throw new IllegalStateException("no scope is open");
        return scope;
    }

    /**
     * Create a fresh symbol in the active scope.
     *
     * @param prefix The prefix of the symbol.
     * @return The prefix followed by the first free counter value.
     */
    public String createName(String prefix) {
        return scope().createName(prefix);
    }

    /**
     * Get the symbol of a value in the active scope.
     *
     * @param var The value.
     * @return The symbol.
     * @throws IllegalStateException If the value is not bound, which means it was used before being defined.
     */
    public String getName(Var var) {
        String name = scope().lookup(var);
        if (name == null) {
            throw new IllegalStateException("value " + var + " has no name in scope of @" + scope().getCircuit().name);
        }
        return name;
    }

    public Optional<String> findName(Var var) {
        return Optional.ofNullable(scope().lookup(var));
    }

    /**
     * Get the symbol of a value, or bind it to a fresh symbol if it has none.
     * <p>
     * Fresh symbols use the register prefix appropriate for the value's type.
     *
     * @param var The value.
     * @return The symbol.
     */
    public String getOrAssignName(Var var) {
        String name = scope().lookup(var);
        if (name != null) return name;
        QType type = var.getNullable(QtxExts.TYPE);
        name = createName(type != null && type.isQuantum() ? conventions.qregPrefix : conventions.cregPrefix);
        scope().bind(var, name);
        return name;
    }

    /**
     * Get the symbol of a value, or bind it to the given one if it has none.
     *
     * @param var  The value.
     * @param name The symbol to bind it to.
     * @return The symbol of the value.
     */
    public String getOrAssignName(Var var, String name) {
        String existing = scope().lookup(var);
        if (existing != null) return existing;
        scope().bind(var, name);
        return name;
    }

    /**
     * Bind each new value to the symbol of the corresponding old value.
     *
     * @param oldValues The old values.
     * @param newValues The new values.
     */
    public void mapValuesName(List<Var> oldValues, List<Var> newValues) {
        merge(new Bindings().forward(this, oldValues, newValues));
    }

    /**
     * Add bindings to the active scope.
     *
     * @param bindings The bindings.
     */
    public void merge(Bindings bindings) {
        Scope scope = scope();
        for (Map.Entry<Var, String> entry : bindings.asMap().entrySet()) {
            scope.bind(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Keep a symbol out of every scope opened after this, so fresh names never shadow it.
     *
     * @param name The symbol, usually the name of a gate.
     */
    public void reserveName(String name) {
        reservedNames.add(name);
    }

    public void declareGate(Circuit circuit) {
        declaredGates.put(circuit.name, circuit);
    }

    /**
     * Find a gate emitted earlier in the output.
     *
     * @param name The name of the gate.
     * @return The circuit it was defined from, if it has been emitted.
     */
    public Optional<Circuit> findGate(String name) {
        return Optional.ofNullable(declaredGates.get(name));
    }

    public void indent() {
        indentLevel++;
    }

    public void unindent() {
        if (indentLevel == 0) throw new IllegalStateException("not indented");
        indentLevel--;
    }

    /**
     * Write a full line at the current indentation. Empty lines are not indented.
     *
     * @param line The line, without a line terminator.
     */
    public void println(String line) {
        if (!line.isEmpty()) {
            for (int i = 0; i < indentLevel; i++) {
                out.append(conventions.indent);
            }
            out.append(line);
        }
        out.append('\n');
    }

    public void printf(@PrintFormat String fmt, Object... args) {
        println(String.format(Locale.ROOT, fmt, args));
    }

    /**
     * Get all text written so far.
     *
     * @return The text.
     */
    public String getOutput() {
        return out.toString();
    }
}

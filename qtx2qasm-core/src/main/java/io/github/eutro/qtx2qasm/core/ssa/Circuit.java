package io.github.eutro.qtx2qasm.core.ssa;

import io.github.eutro.qtx2qasm.core.ext.CommonExts;
import io.github.eutro.qtx2qasm.core.ext.ExtHolder;
import io.github.eutro.qtx2qasm.core.ext.QtxExts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A circuit definition: a named, parameterised sequence of operations on its targets.
 * <p>
 * Every circuit but the module's {@link QtxExts#ENTRY_POINT entry point} is a reusable gate.
 * The body is a single {@link BasicBlock}, ended by a {@link Control#ret(Var...) return}
 * of the new target values followed by any classical results.
 */
public final class Circuit extends ExtHolder {
    /**
     * The name of the circuit, by which {@link io.github.eutro.qtx2qasm.core.ops.QtxOps#APPLY apply}
     * operations refer to it.
     */
    public final String name;
    private final List<Var> parameters = new ArrayList<>();
    private final List<Var> targets = new ArrayList<>();
    private final List<QType> classicalResultTypes = new ArrayList<>();
    private final BasicBlock body = new BasicBlock();
    private final Map<String, Integer> varNames = new HashMap<>();

    Circuit(String name) {
        this.name = name;
        body.attachExt(CommonExts.OWNING_CIRCUIT, this);
    }

    /**
     * Create a new variable of the given type, owned by this circuit.
     *
     * @param name The display name.
     * @param type The type.
     * @return The variable.
     */
    public Var newVar(String name, QType type) {
        int index = varNames.merge(name, 1, Integer::sum) - 1;
        Var var = new Var(name, index);
        var.attachExt(QtxExts.TYPE, type);
        return var;
    }

    /**
     * Add a formal (real-valued) parameter.
     *
     * @param name The display name.
     * @return The parameter variable.
     */
    public Var addParameter(String name) {
        Var param = newVar(name, QType.REAL);
        parameters.add(param);
        return param;
    }

    /**
     * Add a formal target.
     *
     * @param name The display name.
     * @param type The type, a wire or an array of wires.
     * @return The target variable.
     */
    public Var addTarget(String name, QType type) {
        Var target = newVar(name, type);
        targets.add(target);
        return target;
    }

    /**
     * Declare that this circuit returns a classical value of the given type.
     *
     * @param type The type.
     */
    public void addClassicalResult(QType type) {
        classicalResultTypes.add(type);
    }

    public List<Var> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public List<Var> getTargets() {
        return Collections.unmodifiableList(targets);
    }

    public List<QType> getClassicalResultTypes() {
        return Collections.unmodifiableList(classicalResultTypes);
    }

    public BasicBlock getBody() {
        return body;
    }

    public boolean isEntryPoint() {
        return getExt(QtxExts.ENTRY_POINT).orElse(false);
    }

    /**
     * Mark this circuit as the entry point of its module.
     *
     * @return This, for convenience.
     */
    public Circuit markEntryPoint() {
        attachExt(QtxExts.ENTRY_POINT, true);
        return this;
    }

    @Override
    public String toString() {
        return "circuit @" + name
                + parameters.stream().map(Var::toString).collect(Collectors.joining(", ", "(", ")"))
                + (targets.isEmpty() ? "" : targets.stream().map(Var::toString).collect(Collectors.joining(", ", " ", "")))
                + (isEntryPoint() ? " entrypoint" : "");
    }

    /**
     * Format this circuit with its body, for debugging.
     *
     * @return The full listing.
     */
    public String toListing() {
        return this + " " + body;
    }
}

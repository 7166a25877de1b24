package io.github.eutro.qtx2qasm.core.ssa;

import io.github.eutro.qtx2qasm.core.ops.CommonOps;
import io.github.eutro.qtx2qasm.core.ops.QtxOps;
import io.github.eutro.qtx2qasm.core.ops.UnaryOpKey;
import io.github.eutro.qtx2qasm.core.ext.QtxExts;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A helper for appending effects to the body of a {@link Circuit}.
 * <p>
 * Each method creates the result variables, typed according to the operation,
 * and returns them in result order.
 */
public class IRBuilder {
    private final Circuit circuit;
    private final BasicBlock block;

    public IRBuilder(Circuit circuit) {
        this.circuit = circuit;
        this.block = circuit.getBody();
    }

    public Circuit getCircuit() {
        return circuit;
    }

    /**
     * Append an effect, assigning the instruction's results to fresh variables.
     *
     * @param insn  The instruction.
     * @param types The types of the results.
     * @return The result variables.
     */
    public List<Var> insert(Insn insn, List<QType> types) {
        List<Var> vars = new ArrayList<>(types.size());
        for (QType type : types) {
            vars.add(circuit.newVar(type.isQuantum() ? "q" : "v", type));
        }
        block.addEffect(insn.assignTo(vars));
        return vars;
    }

    /**
     * Append an effect with a single result.
     *
     * @param insn The instruction.
     * @param type The type of the result.
     * @return The result variable.
     */
    public Var insert(Insn insn, QType type) {
        return insert(insn, Collections.singletonList(type)).get(0);
    }

    /**
     * Append an effect with no results.
     *
     * @param insn The instruction.
     */
    public void insert(Insn insn) {
        insert(insn, Collections.emptyList());
    }

    public Var alloca(QType type) {
        if (!type.isQuantum()) {
            throw new IllegalArgumentException("cannot allocate " + type);
        }
        return insert(QtxOps.ALLOCA.create(type).insn(), type);
    }

    public Var constant(Object value, QType type) {
        return insert(CommonOps.constant(value), type);
    }

    public Var real(double value) {
        return constant(value, QType.REAL);
    }

    public Var index(long value) {
        return constant(value, QType.INDEX);
    }

    /**
     * Apply a gate.
     *
     * @param key      The gate.
     * @param params   The parameters.
     * @param controls The controls.
     * @param targets  The targets.
     * @return The new targets.
     */
    public List<Var> operator(UnaryOpKey<QtxOps.OperatorType> key,
                              List<Var> params,
                              List<Var> controls,
                              List<Var> targets) {
        return operator(key, false, params, controls, targets);
    }

    public List<Var> operator(UnaryOpKey<QtxOps.OperatorType> key,
                              boolean adjoint,
                              List<Var> params,
                              List<Var> controls,
                              List<Var> targets) {
        if (!key.getExt(QtxExts.OPERATOR_INTERFACE).orElse(false)) {
            throw new IllegalArgumentException(key + " is not an operator");
        }
        List<Var> args = new ArrayList<>(params);
        args.addAll(controls);
        args.addAll(targets);
        QtxOps.OperatorType type = new QtxOps.OperatorType(adjoint, params.size(), controls.size(), targets.size());
        return insert(key.create(type).insn(args), typesOf(targets));
    }

    /**
     * Apply a gate with no parameters or controls to one target.
     *
     * @param key    The gate.
     * @param target The target.
     * @return The new target.
     */
    public Var gate(UnaryOpKey<QtxOps.OperatorType> key, Var target) {
        return operator(key,
                Collections.emptyList(),
                Collections.emptyList(),
                Collections.singletonList(target)).get(0);
    }

    /**
     * Apply another circuit.
     *
     * @param callee  The circuit.
     * @param params  The parameters.
     * @param targets The targets.
     * @return The classical results, then the new targets.
     */
    public List<Var> apply(Circuit callee, List<Var> params, List<Var> targets) {
        return apply(callee.name, false, params, targets, callee.getClassicalResultTypes());
    }

    public List<Var> apply(String callee,
                           boolean adjoint,
                           List<Var> params,
                           List<Var> targets,
                           List<QType> classicalResults) {
        List<Var> args = new ArrayList<>(params);
        args.addAll(targets);
        QtxOps.ApplyType type = new QtxOps.ApplyType(callee, params.size(), targets.size(), classicalResults, adjoint);
        List<QType> types = new ArrayList<>(classicalResults);
        types.addAll(typesOf(targets));
        return insert(QtxOps.APPLY.create(type).insn(args), types);
    }

    /**
     * Measure targets.
     *
     * @param bitsType The type of the measured bits.
     * @param targets  The targets.
     * @return The bits, then the new targets.
     */
    public List<Var> measure(QType bitsType, Var... targets) {
        List<QType> types = new ArrayList<>();
        types.add(bitsType);
        types.addAll(typesOf(Arrays.asList(targets)));
        return insert(QtxOps.MZ.create(bitsType).insn(targets), types);
    }

    public List<Var> reset(Var... targets) {
        return insert(QtxOps.RESET.insn(targets), typesOf(Arrays.asList(targets)));
    }

    /**
     * Split an array into its wires.
     *
     * @param array The array.
     * @return The wires.
     */
    public List<Var> split(Var array) {
        QType type = array.getExtOrThrow(QtxExts.TYPE);
        return insert(QtxOps.ARRAY_SPLIT.insn(array), Collections.nCopies(type.size, QType.WIRE));
    }

    /**
     * Borrow wires out of an array.
     *
     * @param array   The array.
     * @param indices The indices to borrow.
     * @return The wires, then the new array.
     */
    public List<Var> borrow(Var array, Var... indices) {
        List<Var> args = new ArrayList<>();
        args.add(array);
        args.addAll(Arrays.asList(indices));
        List<QType> types = new ArrayList<>(Collections.nCopies(indices.length, QType.WIRE));
        types.add(array.getExtOrThrow(QtxExts.TYPE));
        return insert(QtxOps.ARRAY_BORROW.insn(args), types);
    }

    /**
     * Return borrowed wires to an array.
     *
     * @param array The array.
     * @param wires The wires.
     * @return The new array.
     */
    public Var yieldWires(Var array, Var... wires) {
        List<Var> args = new ArrayList<>(Arrays.asList(wires));
        args.add(array);
        return insert(QtxOps.ARRAY_YIELD.insn(args), array.getExtOrThrow(QtxExts.TYPE));
    }

    public void dealloc(Var... values) {
        insert(QtxOps.DEALLOC.insn(values));
    }

    /**
     * End the body, returning the given values.
     *
     * @param values The new targets, then any classical results.
     */
    public void ret(Var... values) {
        block.setControl(Control.ret(values));
    }

    private static List<QType> typesOf(List<Var> vars) {
        List<QType> types = new ArrayList<>(vars.size());
        for (Var var : vars) {
            types.add(var.getExtOrThrow(QtxExts.TYPE));
        }
        return types;
    }
}

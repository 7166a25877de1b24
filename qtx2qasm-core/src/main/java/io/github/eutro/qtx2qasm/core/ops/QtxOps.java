package io.github.eutro.qtx2qasm.core.ops;

import io.github.eutro.qtx2qasm.core.ext.QtxExts;
import io.github.eutro.qtx2qasm.core.ssa.Insn;
import io.github.eutro.qtx2qasm.core.ssa.QType;
import io.github.eutro.qtx2qasm.core.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operations of the QTX dialect.
 * <p>
 * Wires and arrays are linear: every operation taking them as arguments
 * produces new values that replace them, in the same order.
 */
public class QtxOps {
    // alloca: -> wire | array
    public static final UnaryOpKey<QType> ALLOCA = new UnaryOpKey<>("qtx", "alloca");
    // dealloc: wires/arrays ->
    public static final Op DEALLOC = new SimpleOpKey("qtx", "dealloc").create();
    // mz: targets -> bits, new targets
    public static final UnaryOpKey<QType> MZ = new UnaryOpKey<>("qtx", "mz");
    // reset: targets -> new targets
    public static final Op RESET = new SimpleOpKey("qtx", "reset").create();
    // array_split: array -> wires
    public static final Op ARRAY_SPLIT = new SimpleOpKey("qtx", "array_split").create();
    // array_borrow: array, indices -> wires, new array
    public static final Op ARRAY_BORROW = new SimpleOpKey("qtx", "array_borrow").create();
    // array_yield: wires, array -> new array
    public static final Op ARRAY_YIELD = new SimpleOpKey("qtx", "array_yield").create();
    // apply: params, targets -> classical results, new targets
    public static final UnaryOpKey<ApplyType> APPLY = new UnaryOpKey<>("qtx", "apply");

    private static final Map<String, UnaryOpKey<OperatorType>> OPERATORS = new LinkedHashMap<>();

    public static final UnaryOpKey<OperatorType> H = operator("h");
    public static final UnaryOpKey<OperatorType> X = operator("x");
    public static final UnaryOpKey<OperatorType> Y = operator("y");
    public static final UnaryOpKey<OperatorType> Z = operator("z");
    public static final UnaryOpKey<OperatorType> S = operator("s");
    public static final UnaryOpKey<OperatorType> T = operator("t");
    public static final UnaryOpKey<OperatorType> R1 = operator("r1");
    public static final UnaryOpKey<OperatorType> RX = operator("rx");
    public static final UnaryOpKey<OperatorType> RY = operator("ry");
    public static final UnaryOpKey<OperatorType> RZ = operator("rz");
    public static final UnaryOpKey<OperatorType> SWAP = operator("swap");
    public static final UnaryOpKey<OperatorType> U2 = operator("u2");
    public static final UnaryOpKey<OperatorType> U3 = operator("u3");

    static {
        QtxExts.mark(DEALLOC.key, QtxExts.NO_RUNTIME_EFFECT);
    }

    /**
     * Get the operator key for a gate, creating it if this is the first time it is asked for.
     * <p>
     * Created keys carry {@link QtxExts#OPERATOR_INTERFACE}, so backends can treat
     * operators they have no dedicated handling for uniformly.
     *
     * @param name The gate identifier.
     * @return The key.
     */
    public static synchronized UnaryOpKey<OperatorType> operator(String name) {
        return OPERATORS.computeIfAbsent(name, n ->
                QtxExts.mark(new UnaryOpKey<OperatorType>("qtx", n), QtxExts.OPERATOR_INTERFACE));
    }

    /**
     * Get every operator key created so far.
     *
     * @return The keys, in creation order.
     */
    public static synchronized List<UnaryOpKey<OperatorType>> operators() {
        return Collections.unmodifiableList(new ArrayList<>(OPERATORS.values()));
    }

    /**
     * Get the payload of an operator.
     *
     * @param op The operation.
     * @return The payload, or null if the operation is not an operator.
     */
    @Nullable
    public static OperatorType operatorType(Op op) {
        if (!op.getExt(QtxExts.OPERATOR_INTERFACE).orElse(false)) return null;
        if (op instanceof UnaryOpKey.UnaryOp) {
            Object arg = ((UnaryOpKey<?>.UnaryOp) op).arg;
            if (arg instanceof OperatorType) return (OperatorType) arg;
        }
        return null;
    }

    /**
     * Get every key of this dialect that is not an operator.
     *
     * @return The keys.
     */
    public static List<OpKey> structuralKeys() {
        List<OpKey> keys = new ArrayList<>();
        Collections.addAll(keys,
                ALLOCA,
                DEALLOC.key,
                MZ,
                RESET.key,
                ARRAY_SPLIT.key,
                ARRAY_BORROW.key,
                ARRAY_YIELD.key,
                APPLY);
        return keys;
    }

    /**
     * The payload of an operator (gate application).
     * <p>
     * Arguments are the parameters, then controls, then targets.
     * Results are the new targets, in order; controls are not consumed.
     */
    public static class OperatorType {
        public final boolean adjoint;
        public final int parameters;
        public final int controls;
        public final int targets;

        public OperatorType(boolean adjoint, int parameters, int controls, int targets) {
            this.adjoint = adjoint;
            this.parameters = parameters;
            this.controls = controls;
            this.targets = targets;
        }

        public List<Var> parameters(Insn insn) {
            return insn.args().subList(0, parameters);
        }

        public List<Var> controls(Insn insn) {
            return insn.args().subList(parameters, parameters + controls);
        }

        public List<Var> targets(Insn insn) {
            return insn.args().subList(parameters + controls, parameters + controls + targets);
        }

        @Override
        public String toString() {
            return (adjoint ? "adj " : "")
                    + "params=" + parameters
                    + " controls=" + controls
                    + " targets=" + targets;
        }
    }

    /**
     * The payload of a circuit application.
     * <p>
     * Arguments are the parameters, then targets.
     * Results are the classical results, then the new targets.
     */
    public static class ApplyType {
        public final String callee;
        public final int parameters;
        public final int targets;
        public final List<QType> classicalResults;
        public final boolean adjoint;

        public ApplyType(String callee, int parameters, int targets, List<QType> classicalResults, boolean adjoint) {
            this.callee = callee;
            this.parameters = parameters;
            this.targets = targets;
            this.classicalResults = Collections.unmodifiableList(new ArrayList<>(classicalResults));
            this.adjoint = adjoint;
        }

        public List<Var> parameters(Insn insn) {
            return insn.args().subList(0, parameters);
        }

        public List<Var> targets(Insn insn) {
            return insn.args().subList(parameters, parameters + targets);
        }

        @Override
        public String toString() {
            return (adjoint ? "adj " : "") + "@" + callee;
        }
    }
}

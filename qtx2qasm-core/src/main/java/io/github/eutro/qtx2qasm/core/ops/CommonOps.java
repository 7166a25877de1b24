package io.github.eutro.qtx2qasm.core.ops;

import io.github.eutro.qtx2qasm.core.ext.QtxExts;
import io.github.eutro.qtx2qasm.core.ssa.Insn;

/**
 * Operations that are not specific to quantum code.
 */
public class CommonOps {
    /**
     * Control: returns from the circuit. Arguments are the new targets, then classical results.
     */
    public static final Op RETURN = new SimpleOpKey("func", "return").create();

    /**
     * Effect: returns the constant. Integers serve as indices, other numbers as angles.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("arith", "constant").allowNull();

    static {
        QtxExts.mark(RETURN.key, QtxExts.NO_RUNTIME_EFFECT);
        QtxExts.mark(CONST, QtxExts.NO_RUNTIME_EFFECT);
    }

    /**
     * Return a constant instruction which returns {@code k}.
     *
     * @param k The constant.
     * @return The instruction.
     */
    public static Insn constant(Object k) {
        return CONST.create(k).insn();
    }
}

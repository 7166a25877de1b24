package io.github.eutro.qtx2qasm.core.ops;

import io.github.eutro.qtx2qasm.core.ext.DelegatingExtHolder;
import io.github.eutro.qtx2qasm.core.ext.ExtContainer;
import io.github.eutro.qtx2qasm.core.ssa.Insn;
import io.github.eutro.qtx2qasm.core.ssa.Var;

import java.util.List;

/**
 * An operation, encapsulating an {@link OpKey operation key} and any payload.
 */
public /* virtual */ class Op extends DelegatingExtHolder {
    /**
     * The key of the operation.
     */
    public final OpKey key;

    protected Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    /**
     * Construct an instruction applying this operation to the given arguments.
     *
     * @param vars The arguments.
     * @return The instruction.
     */
    public Insn insn(Var... vars) {
        return new Insn(this, vars);
    }

    /**
     * Construct an instruction applying this operation to the given arguments.
     *
     * @param vars The arguments.
     * @return The instruction.
     */
    public Insn insn(List<Var> vars) {
        return new Insn(this, vars);
    }
}

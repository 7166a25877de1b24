package io.github.eutro.qtx2qasm.core.passes.meta;

import io.github.eutro.qtx2qasm.core.ext.CommonExts;
import io.github.eutro.qtx2qasm.core.ext.QtxExts;
import io.github.eutro.qtx2qasm.core.ops.QtxOps;
import io.github.eutro.qtx2qasm.core.passes.InPlaceIRPass;
import io.github.eutro.qtx2qasm.core.ssa.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Check that every quantum value in a circuit is consumed at most once.
 * <p>
 * Controls of an operator are not consumed, since the operator does not replace them,
 * but a wire cannot be passed to the same operator twice.
 * <p>
 * This runs {@link ComputeUses} first, and throws an {@link IllegalStateException}
 * naming the value and its uses if the check fails.
 */
public class CheckLinearity implements InPlaceIRPass<Circuit> {
    public static final CheckLinearity INSTANCE = new CheckLinearity();

    @Override
    public void runInPlace(Circuit circuit) {
        ComputeUses.INSTANCE.runInPlace(circuit);

        List<Var> values = new ArrayList<>(circuit.getTargets());
        for (Effect effect : circuit.getBody().getEffects()) {
            values.addAll(effect.getAssignsTo());
        }
        for (Var value : values) {
            QType type = value.getNullable(QtxExts.TYPE);
            if (type == null || !type.isQuantum()) continue;
            List<Insn> uses = value.getExtOrThrow(CommonExts.USED_AT);
            int consumed = 0;
            for (Insn use : new LinkedHashSet<>(uses)) {
                consumed += consumingUses(use, value);
            }
            if (consumed > 1) {
                throw new IllegalStateException("quantum value " + value
                        + " in circuit @" + circuit.name
                        + " is consumed " + consumed + " times: " + uses);
            }
        }
    }

    private static int consumingUses(Insn insn, Var value) {
        QtxOps.OperatorType type = QtxOps.operatorType(insn.op);
        if (type == null) {
            return Collections.frequency(insn.args(), value);
        }
        int asTarget = Collections.frequency(type.targets(insn), value);
        int asControl = Collections.frequency(type.controls(insn), value);
        return asTarget + asControl > 1 ? asTarget + asControl : asTarget;
    }
}

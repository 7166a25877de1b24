package io.github.eutro.qtx2qasm.core.passes.meta;

import io.github.eutro.qtx2qasm.core.ext.CommonExts;
import io.github.eutro.qtx2qasm.core.passes.InPlaceIRPass;
import io.github.eutro.qtx2qasm.core.ssa.*;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Compute the {@link CommonExts#USED_AT uses} of every {@link Var} in a circuit.
 * <p>
 * Uses are recorded in program order, with the terminator last.
 * An instruction that takes the same variable twice appears twice.
 */
public class ComputeUses implements InPlaceIRPass<Circuit> {
    /**
     * A singleton instance of this pass.
     */
    public static final ComputeUses INSTANCE = new ComputeUses();

    @Override
    public void runInPlace(Circuit circuit) {
        BasicBlock body = circuit.getBody();
        for (Var var : circuit.getParameters()) {
            resetUses(var);
        }
        for (Var var : circuit.getTargets()) {
            resetUses(var);
        }
        for (Effect effect : body.getEffects()) {
            for (Var var : effect.getAssignsTo()) {
                resetUses(var);
            }
        }
        for (Effect effect : body.getEffects()) {
            for (Var arg : effect.insn().args()) {
                getOrCreateUses(arg).add(effect.insn());
            }
        }
        Control ctrl = body.getControl();
        if (ctrl != null) {
            for (Var arg : ctrl.insn().args()) {
                getOrCreateUses(arg).add(ctrl.insn());
            }
        }
    }

    private static void resetUses(Var var) {
        var.attachExt(CommonExts.USED_AT, new ArrayList<>());
    }

    @NotNull
    private static List<Insn> getOrCreateUses(Var arg) {
        return arg.getExt(CommonExts.USED_AT).orElseGet(() -> {
            List<Insn> list = new ArrayList<>();
            arg.attachExt(CommonExts.USED_AT, list);
            return list;
        });
    }
}

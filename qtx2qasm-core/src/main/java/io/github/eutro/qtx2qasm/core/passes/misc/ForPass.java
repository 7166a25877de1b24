package io.github.eutro.qtx2qasm.core.passes.misc;

import io.github.eutro.qtx2qasm.core.passes.IRPass;
import io.github.eutro.qtx2qasm.core.passes.InPlaceIRPass;
import io.github.eutro.qtx2qasm.core.ssa.Circuit;
import io.github.eutro.qtx2qasm.core.ssa.Module;

/**
 * Lifts passes which operate on smaller IR parts into ones that operate on bigger parts.
 */
public class ForPass {
    /**
     * Lift a circuit pass to operate on every circuit of a module, in order.
     *
     * @param pass The circuit pass. It must be in-place.
     * @return The module pass.
     */
    public static Circuits liftCircuits(IRPass<Circuit, Circuit> pass) {
        if (!pass.isInPlace()) {
            throw new IllegalArgumentException("circuit pass must be in-place");
        }
        return new Circuits(pass);
    }

    /**
     * A circuit pass lifted to operate on a full module.
     */
    public static class Circuits implements InPlaceIRPass<Module> {
        private final IRPass<Circuit, Circuit> pass;

        private Circuits(IRPass<Circuit, Circuit> pass) {
            this.pass = pass;
        }

        @Override
        public void runInPlace(Module module) {
            for (Circuit circuit : module.circuits) {
                try {
                    pass.run(circuit);
                } catch (RuntimeException | Error e) {
                    e.addSuppressed(new RuntimeException("in circuit @" + circuit.name));
                    throw e;
                }
            }
        }
    }
}

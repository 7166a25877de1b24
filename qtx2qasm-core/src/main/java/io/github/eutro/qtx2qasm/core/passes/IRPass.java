package io.github.eutro.qtx2qasm.core.passes;

import io.github.eutro.qtx2qasm.core.passes.convert.QtxToQasm;
import io.github.eutro.qtx2qasm.core.passes.misc.ChainedPass;
import io.github.eutro.qtx2qasm.core.ssa.Circuit;
import io.github.eutro.qtx2qasm.core.ssa.Module;

/**
 * A step over QTX IR: a {@link Module}, a {@link Circuit}, or anything derived from them.
 * <p>
 * Analyses and checks return their input unchanged and report {@link #isInPlace()};
 * translations such as {@link QtxToQasm} produce something else entirely.
 *
 * @param <A> What the pass consumes.
 * @param <B> What the pass produces.
 * @see Passes
 */
public interface IRPass<A, B> {
    /**
     * Apply the pass.
     *
     * @param a The input.
     * @return The output, which is {@code a} itself for in-place passes.
     */
    B run(A a);

    /**
     * Whether {@link #run(Object)} hands back its own argument.
     *
     * @return True for passes that only inspect or mutate their input.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Feed the output of this pass into {@code next}.
     * <p>
     * A failure in either pass is tagged with its position in the chain.
     *
     * @param next The following pass.
     * @param <C>  What {@code next} produces.
     * @return A pass running both.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}

package io.github.eutro.qtx2qasm.core.passes.misc;

import io.github.eutro.qtx2qasm.core.passes.IRPass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;

/**
 * A pass which composes two others, executing the first, and giving its result to the second.
 * <p>
 * Nested chains are flattened when run, and a failing pass has its position
 * in the flattened chain attached to the exception.
 *
 * @param <A> The input type.
 * @param <B> The intermediate type.
 * @param <C> The output type.
 */
public class ChainedPass<A, B, C> implements IRPass<A, C> {
    private final IRPass<A, B> firstPass;
    private final IRPass<B, C> nextPass;
    private final boolean isInPlace;

    public ChainedPass(IRPass<A, B> firstPass, IRPass<B, C> nextPass) {
        this.firstPass = firstPass;
        this.nextPass = nextPass;
        isInPlace = firstPass.isInPlace() && nextPass.isInPlace();
    }

    @SuppressWarnings("unchecked")
    private List<IRPass<Object, Object>> flatten() {
        List<IRPass<?, ?>> passes = new ArrayList<>();
        IRPass<?, ?> pass = this;
        while (pass instanceof ChainedPass) {
            ChainedPass<?, ?, ?> chained = (ChainedPass<?, ?, ?>) pass;
            passes.add(chained.nextPass);
            pass = chained.firstPass;
        }
        passes.add(pass);
        Collections.reverse(passes);
        return (List<IRPass<Object, Object>>) (Object) passes;
    }

    @Override
    public boolean isInPlace() {
        return isInPlace;
    }

    @SuppressWarnings("unchecked")
    @Override
    public C run(A a) {
        ListIterator<IRPass<Object, Object>> li = flatten().listIterator();
        Object acc = a;
        while (li.hasNext()) {
            IRPass<Object, Object> pass = li.next();
            try {
                acc = pass.run(acc);
            } catch (RuntimeException | Error e) {
                e.addSuppressed(new RuntimeException("running pass " + li.previousIndex()
                        + " (" + pass.getClass().getSimpleName() + ") in chain"));
                throw e;
            }
        }
        return (C) acc;
    }
}

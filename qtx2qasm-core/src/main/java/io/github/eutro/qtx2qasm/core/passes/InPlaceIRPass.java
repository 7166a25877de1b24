package io.github.eutro.qtx2qasm.core.passes;

/**
 * A pass that works by side effect on its input, such as computing exts or
 * throwing on malformed IR.
 *
 * @param <T> The IR it runs over.
 */
public interface InPlaceIRPass<T> extends IRPass<T, T> {
    /**
     * Inspect or update {@code t}.
     *
     * @param t The IR.
     */
    void runInPlace(T t);

    @Override
    default T run(T t) {
        runInPlace(t);
        return t;
    }

    @Override
    default boolean isInPlace() {
        return true;
    }
}

package io.github.eutro.qtx2qasm.core.ops;

import io.github.eutro.qtx2qasm.core.ext.ExtHolder;

/**
 * An operation key, representing a kind of operation, without its payload.
 * <p>
 * Keys compare by identity. The dialect groups keys by their origin
 * ({@code qtx}, {@code arith}, {@code llvm}...), and backends may treat whole dialects alike.
 */
public abstract class OpKey extends ExtHolder {
    public final String dialect;
    public final String mnemonic;

    public OpKey(String dialect, String mnemonic) {
        this.dialect = dialect;
        this.mnemonic = mnemonic;
    }

    @Override
    public String toString() {
        return dialect + "." + mnemonic;
    }
}

package io.github.eutro.qtx2qasm.core.ops;

/**
 * A key for operations without a payload, which all share one {@link Op}.
 */
public class SimpleOpKey extends OpKey {
    private final Op op = new Op(this);

    public SimpleOpKey(String dialect, String mnemonic) {
        super(dialect, mnemonic);
    }

    public Op create() {
        return op;
    }
}

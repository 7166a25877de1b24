package io.github.eutro.qtx2qasm.core.ops;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A key for operations with a single payload of type {@code T}.
 *
 * @param <T> The type of the payload.
 */
public class UnaryOpKey<T> extends OpKey {
    private final Function<T, String> printer;
    private boolean allowNull = false;

    public UnaryOpKey(String dialect, String mnemonic, Function<T, String> printer) {
        super(dialect, mnemonic);
        this.printer = printer;
    }

    public UnaryOpKey(String dialect, String mnemonic) {
        this(dialect, mnemonic, Objects::toString);
    }

    public UnaryOpKey<T> allowNull() {
        allowNull = true;
        return this;
    }

    /**
     * An operation of this key, with its payload.
     */
    public class UnaryOp extends Op {
        public final T arg;

        UnaryOp(T arg) {
            super(UnaryOpKey.this);
            this.arg = arg;
        }

        @Override
        public String toString() {
            return key + " " + printer.apply(arg);
        }
    }

    @Nullable
    public UnaryOp checkNullable(Op val) {
        if (val.key == this) {
            @SuppressWarnings("unchecked")
            UnaryOp ret = (UnaryOp) val;
            return ret;
        }
        return null;
    }

    /**
     * Get the payload of an operation, if it is of this key.
     *
     * @param val The operation.
     * @return The payload, or null if the key differs.
     */
    @Nullable
    public T argNullable(Op val) {
        UnaryOp op = checkNullable(val);
        return op == null ? null : op.arg;
    }

    public Optional<UnaryOp> check(Op val) {
        return Optional.ofNullable(checkNullable(val));
    }

    public UnaryOp cast(Op val) {
        return check(val).orElseThrow(() -> new ClassCastException(val.key + " is not " + this));
    }

    public UnaryOp create(T arg) {
        if (!allowNull && arg == null) {
            throw new IllegalArgumentException("Argument is null");
        }
        return new UnaryOp(arg);
    }
}

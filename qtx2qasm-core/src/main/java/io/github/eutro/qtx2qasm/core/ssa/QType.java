package io.github.eutro.qtx2qasm.core.ssa;

import java.util.Objects;

/**
 * The type of a value in QTX IR.
 * <p>
 * Quantum values ({@link #WIRE wires} and {@link #wireArray(int) wire arrays}) are linear;
 * classical values are ordinary SSA values.
 */
public final class QType {
    /**
     * The kind of a type.
     */
    public enum Kind {
        WIRE("wire", true),
        WIRE_ARRAY("array", true),
        BIT("i1", false),
        BIT_VECTOR("vector<i1>", false),
        REAL("f64", false),
        INDEX("index", false),
        ;

        final String mnemonic;
        final boolean quantum;

        Kind(String mnemonic, boolean quantum) {
            this.mnemonic = mnemonic;
            this.quantum = quantum;
        }
    }

    public static final QType WIRE = new QType(Kind.WIRE, 1);
    public static final QType BIT = new QType(Kind.BIT, 1);
    public static final QType REAL = new QType(Kind.REAL, 1);
    public static final QType INDEX = new QType(Kind.INDEX, 1);

    public final Kind kind;
    /**
     * The number of elements, 1 for scalar types.
     */
    public final int size;

    private QType(Kind kind, int size) {
        this.kind = kind;
        this.size = size;
    }

    /**
     * An array of {@code size} wires.
     *
     * @param size The number of wires.
     * @return The type.
     */
    public static QType wireArray(int size) {
        if (size <= 0) throw new IllegalArgumentException("wire array size must be positive, got " + size);
        return new QType(Kind.WIRE_ARRAY, size);
    }

    /**
     * A vector of {@code size} measured bits.
     *
     * @param size The number of bits.
     * @return The type.
     */
    public static QType bitVector(int size) {
        if (size <= 0) throw new IllegalArgumentException("bit vector size must be positive, got " + size);
        return new QType(Kind.BIT_VECTOR, size);
    }

    public boolean isQuantum() {
        return kind.quantum;
    }

    public boolean isArray() {
        return kind == Kind.WIRE_ARRAY;
    }

    public boolean isVector() {
        return kind == Kind.BIT_VECTOR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QType qType = (QType) o;
        return size == qType.size && kind == qType.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, size);
    }

    @Override
    public String toString() {
        switch (kind) {
            case WIRE_ARRAY:
                return "array<" + size + ">";
            case BIT_VECTOR:
                return "vector<" + size + "xi1>";
            default:
                return kind.mnemonic;
        }
    }
}

package io.github.eutro.qtx2qasm.core.util;

import io.github.eutro.qtx2qasm.core.ext.CommonExts;
import io.github.eutro.qtx2qasm.core.ops.CommonOps;
import io.github.eutro.qtx2qasm.core.ssa.Effect;
import io.github.eutro.qtx2qasm.core.ssa.Var;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Utilities for inspecting the IR.
 */
public class IRUtils {
    /**
     * Find the compile-time value of a variable.
     * <p>
     * This is either a folded {@link CommonExts#CONSTANT_VALUE} attached to the variable,
     * or the payload of the {@link CommonOps#CONST constant} that assigns it.
     * Variables assigned by anything else have no known value.
     *
     * @param var The variable.
     * @return The value, if known. A known {@code null} is {@link CommonExts#CONSTANT_NULL_SENTINEL}.
     */
    public static Optional<Object> constantValue(Var var) {
        Object folded = var.getNullable(CommonExts.CONSTANT_VALUE);
        if (folded != null) return Optional.of(folded);
        Effect assignedAt = var.getNullable(CommonExts.ASSIGNED_AT);
        if (assignedAt == null || assignedAt.getAssignsTo().size() != 1) return Optional.empty();
        return CommonOps.CONST.check(assignedAt.insn().op)
                .map(op -> CommonExts.fillNull(op.arg));
    }

    /**
     * Find the value of a variable as a finite real literal.
     *
     * @param var The variable.
     * @return The value, if it is a known finite number.
     */
    public static OptionalDouble realLiteral(Var var) {
        Optional<Object> value = constantValue(var);
        if (value.isPresent() && value.get() instanceof Number) {
            double d = ((Number) value.get()).doubleValue();
            if (Double.isFinite(d)) return OptionalDouble.of(d);
        }
        return OptionalDouble.empty();
    }

    /**
     * Find the value of a variable as an index literal.
     *
     * @param var The variable.
     * @return The value, if it is a known non-negative integer.
     */
    public static OptionalLong indexLiteral(Var var) {
        Optional<Object> value = constantValue(var);
        if (value.isPresent()) {
            Object v = value.get();
            if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
                long l = ((Number) v).longValue();
                if (l >= 0) return OptionalLong.of(l);
            }
        }
        return OptionalLong.empty();
    }
}

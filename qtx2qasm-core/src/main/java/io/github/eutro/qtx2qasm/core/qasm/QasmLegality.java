package io.github.eutro.qtx2qasm.core.qasm;

import io.github.eutro.qtx2qasm.core.ext.CommonExts;
import io.github.eutro.qtx2qasm.core.ext.QtxExts;
import io.github.eutro.qtx2qasm.core.ops.CommonOps;
import io.github.eutro.qtx2qasm.core.ops.OpKey;
import io.github.eutro.qtx2qasm.core.ops.QtxOps;
import io.github.eutro.qtx2qasm.core.ssa.Circuit;
import io.github.eutro.qtx2qasm.core.ssa.Control;
import io.github.eutro.qtx2qasm.core.ssa.Effect;
import io.github.eutro.qtx2qasm.core.ssa.Module;
import io.github.eutro.qtx2qasm.core.ssa.QType;
import io.github.eutro.qtx2qasm.core.ssa.Var;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static io.github.eutro.qtx2qasm.core.qasm.QasmTranslationException.Kind.MODULE_SHAPE;
import static io.github.eutro.qtx2qasm.core.qasm.QasmTranslationException.Kind.UNSUPPORTED_CONSTRUCT;

/**
 * Checks for what OpenQASM 2.0 can express. Each check throws a {@link QasmTranslationException}
 * naming the offending element if it fails.
 */
public final class QasmLegality {
    private static final Pattern IDENTIFIER = Pattern.compile("[a-z][A-Za-z0-9_]*");

    // keywords, and the gates qelib1.inc defines
    private static final Set<String> RESERVED = new HashSet<>(Arrays.asList(
            "barrier", "creg", "gate", "if", "include", "measure", "opaque", "qreg", "reset",
            "pi", "sin", "cos", "tan", "exp", "ln", "sqrt",
            "u3", "u2", "u1", "u0", "u", "p", "cx", "id", "x", "y", "z", "h", "s", "sdg", "t", "tdg",
            "sx", "sxdg", "rx", "ry", "rz", "cz", "cy", "swap", "ch", "ccx", "cswap",
            "crx", "cry", "crz", "cu1", "cp", "cu3", "csx", "cu", "rxx", "rzz",
            "rccx", "rc3x", "c3x", "c3sqrtx", "c4x"));

    private QasmLegality() {
    }

    /**
     * Find the entry point of a module, checking that there is exactly one.
     *
     * @param module The module.
     * @return The entry point.
     */
    public static Circuit checkModuleShape(Module module) {
        List<Circuit> entryPoints = module.getEntryPoints();
        if (entryPoints.isEmpty()) {
            throw new QasmTranslationException(MODULE_SHAPE, module, "module does not contain an entrypoint");
        }
        if (entryPoints.size() > 1) {
            throw new QasmTranslationException(MODULE_SHAPE, module, "module has multiple entrypoints");
        }
        return entryPoints.get(0);
    }

    /**
     * Check that every circuit has a distinct name, and that every gate can be named
     * in OpenQASM 2.0 without redefining a keyword or a gate of {@code qelib1.inc}.
     * The entry point is never named in the output.
     *
     * @param module The module.
     */
    public static void checkCircuitNames(Module module) {
        Set<String> seen = new HashSet<>();
        for (Circuit circuit : module.circuits) {
            if (!seen.add(circuit.name)) {
                throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, circuit,
                        "module has multiple circuits named @" + circuit.name);
            }
            if (circuit.isEntryPoint()) continue;
            if (!IDENTIFIER.matcher(circuit.name).matches()) {
                throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, circuit,
                        "cannot translate gate name @" + circuit.name + " into OpenQASM 2.0");
            }
            if (RESERVED.contains(circuit.name)) {
                throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, circuit,
                        "gate name @" + circuit.name + " is reserved in OpenQASM 2.0");
            }
        }
    }

    /**
     * Check the signature and terminator of a circuit.
     *
     * @param circuit The circuit.
     */
    public static void checkCircuit(Circuit circuit) {
        if (!circuit.getClassicalResultTypes().isEmpty()) {
            throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, circuit, "cannot return classical results");
        }
        if (circuit.isEntryPoint()) {
            if (!circuit.getParameters().isEmpty() || !circuit.getTargets().isEmpty()) {
                throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, circuit,
                        "cannot translate entrypoint with parameters or targets into OpenQASM 2.0");
            }
        } else {
            for (Var target : circuit.getTargets()) {
                if (target.getExtOrThrow(QtxExts.TYPE).isArray()) {
                    throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, circuit,
                            "cannot translate array arguments into OpenQASM 2.0");
                }
            }
            if (circuit.getTargets().isEmpty()) {
                throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, circuit,
                        "cannot translate gate without targets into OpenQASM 2.0");
            }
        }
        Control control = circuit.getBody().getControl();
        if (control == null || control.insn().op.key != CommonOps.RETURN.key) {
            throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, circuit,
                    "cannot translate control flow into OpenQASM 2.0");
        }
    }

    public static void checkOperator(Effect effect, QtxOps.OperatorType type) {
        if (type.adjoint) {
            throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, effect,
                    "cannot convert adjoint operations to OpenQASM 2.0");
        }
    }

    /**
     * Check a circuit application.
     *
     * @param emitter The emitter, which knows which gates have been declared.
     * @param effect  The application.
     * @param type    Its payload.
     */
    public static void checkApply(QasmEmitter emitter, Effect effect, QtxOps.ApplyType type) {
        if (type.adjoint) {
            throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, effect,
                    "cannot convert adjoint operations to OpenQASM 2.0");
        }
        if (!type.classicalResults.isEmpty()) {
            throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, effect, "cannot return classical results");
        }
        Circuit callee = emitter.findGate(type.callee)
                .orElseThrow(() -> new QasmTranslationException(UNSUPPORTED_CONSTRUCT, effect,
                        "cannot apply @" + type.callee + " before its gate definition"));
        if (type.parameters != callee.getParameters().size() || type.targets != callee.getTargets().size()) {
            throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, effect,
                    "wrong number of arguments to @" + type.callee);
        }
    }

    /**
     * Check that no quantum operand of an operation comes from an operation that was skipped,
     * and so has no symbol.
     *
     * @param emitter The emitter.
     * @param effect  The operation.
     */
    public static void checkOperands(QasmEmitter emitter, Effect effect) {
        for (Var arg : effect.insn().args()) {
            QType type = arg.getNullable(QtxExts.TYPE);
            if (type == null || !type.isQuantum() || emitter.findName(arg).isPresent()) continue;
            Effect assignedAt = arg.getNullable(CommonExts.ASSIGNED_AT);
            if (assignedAt != null && isIgnorable(assignedAt.insn().op.key)) {
                throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, effect,
                        "cannot translate value produced by an untranslated op");
            }
        }
    }

    /**
     * Check a measurement.
     *
     * @param emitter The emitter.
     * @param effect  The measurement.
     */
    public static void checkMeasure(QasmEmitter emitter, Effect effect) {
        checkTopLevel(emitter, effect);
        if (effect.insn().args().size() > 1) {
            throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, effect,
                    "cannot translate measurements with more than one target");
        }
    }

    /**
     * Check that a non-unitary operation is not inside a gate definition,
     * where OpenQASM 2.0 only allows gate applications.
     *
     * @param emitter The emitter.
     * @param effect  The operation.
     */
    public static void checkTopLevel(QasmEmitter emitter, Effect effect) {
        if (!emitter.scope().isEntryPoint()) {
            throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, effect,
                    "cannot translate non-unitary operation inside a gate definition");
        }
    }

    /**
     * Check that an operation with no translation can be dropped.
     *
     * @param effect The operation.
     */
    public static void checkIgnorable(Effect effect) {
        if (!isIgnorable(effect.insn().op.key)) {
            throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, effect,
                    "unable to translate op to OpenQASM 2.0");
        }
    }

    /**
     * Whether operations of a key have nothing to emit: they are marked
     * {@link QtxExts#NO_RUNTIME_EFFECT} or belong to the {@code llvm} dialect.
     *
     * @param key The key.
     * @return Whether it can be skipped.
     */
    public static boolean isIgnorable(OpKey key) {
        return key.getExt(QtxExts.NO_RUNTIME_EFFECT).orElse(false) || "llvm".equals(key.dialect);
    }
}

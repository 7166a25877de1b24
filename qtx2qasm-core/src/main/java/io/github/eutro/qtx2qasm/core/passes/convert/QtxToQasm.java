package io.github.eutro.qtx2qasm.core.passes.convert;

import io.github.eutro.qtx2qasm.core.ext.QtxExts;
import io.github.eutro.qtx2qasm.core.ops.Op;
import io.github.eutro.qtx2qasm.core.ops.OpKey;
import io.github.eutro.qtx2qasm.core.ops.QtxOps;
import io.github.eutro.qtx2qasm.core.passes.IRPass;
import io.github.eutro.qtx2qasm.core.qasm.*;
import io.github.eutro.qtx2qasm.core.ssa.*;
import io.github.eutro.qtx2qasm.core.ssa.Module;
import io.github.eutro.qtx2qasm.core.util.IRUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.StringJoiner;

import static io.github.eutro.qtx2qasm.core.qasm.QasmTranslationException.Kind.*;

/**
 * A pass which translates a QTX module into OpenQASM 2.0 source.
 * <p>
 * Every circuit other than the entry point becomes a {@code gate} definition, in module order,
 * and the body of the entry point becomes the top-level program. Operations are translated
 * one at a time in program order; the first one that cannot be expressed aborts the
 * whole translation with a {@link QasmTranslationException}.
 */
public class QtxToQasm implements IRPass<Module, String> {
    private static final Logger LOGGER = LogManager.getLogger();

    /**
     * An instance of this pass with the default conventions.
     */
    public static final QtxToQasm INSTANCE = new QtxToQasm(QasmConventions.DEFAULT);

    private final QasmConventions conventions;

    public QtxToQasm(QasmConventions conventions) {
        this.conventions = conventions;
    }

    @Override
    public String run(Module module) {
        Circuit entryPoint = QasmLegality.checkModuleShape(module);
        for (Circuit circuit : module.circuits) {
            QasmLegality.checkCircuit(circuit);
        }
        QasmLegality.checkCircuitNames(module);

        QasmEmitter emitter = new QasmEmitter(conventions);
        for (Circuit circuit : module.circuits) {
            if (circuit != entryPoint) emitter.reserveName(circuit.name);
        }
        emitter.println("// Code generated by " + conventions.compilerName + " compiler");
        emitter.println("OPENQASM 2.0;");
        emitter.println("");
        emitter.printf("include \"%s\";", conventions.include);
        emitter.println("");
        for (Circuit circuit : module.circuits) {
            if (circuit == entryPoint) continue;
            emitGate(emitter, circuit);
            emitter.println("");
        }
        try (Scope ignored = emitter.openScope(entryPoint)) {
            emitBody(emitter, entryPoint);
        }
        LOGGER.debug("translated module @{} with entrypoint @{}", module.name, entryPoint.name);
        return emitter.getOutput();
    }

    private void emitGate(QasmEmitter emitter, Circuit circuit) {
        StringBuilder sb = new StringBuilder("gate ").append(circuit.name);
        try (Scope ignored = emitter.openScope(circuit)) {
            if (!circuit.getParameters().isEmpty()) {
                StringJoiner params = new StringJoiner(",", "(", ")");
                for (Var param : circuit.getParameters()) {
                    params.add(emitter.getOrAssignName(param, emitter.createName(conventions.paramPrefix)));
                }
                sb.append(params);
            }
            StringJoiner qubits = new StringJoiner(",", " ", " {");
            for (Var target : circuit.getTargets()) {
                qubits.add(emitter.getOrAssignName(target, emitter.createName(conventions.qubitPrefix)));
            }
            emitter.println(sb.append(qubits).toString());
            emitter.indent();
            emitBody(emitter, circuit);
            emitter.unindent();
            emitter.println("}");
        }
        emitter.declareGate(circuit);
        LOGGER.debug("emitted gate {}", circuit.name);
    }

    private static void emitBody(QasmEmitter emitter, Circuit circuit) {
        int i = 0;
        try {
            for (Effect effect : circuit.getBody().getEffects()) {
                OpKey key = effect.insn().op.key;
                Handler handler = FX_HANDLERS.get(key);
                if (handler == null && isOperator(key)) {
                    handler = QtxToQasm::emitOperator;
                }
                if (handler == null) {
                    QasmLegality.checkIgnorable(effect);
                } else {
                    QasmLegality.checkOperands(emitter, effect);
                    emitter.merge(handler.emit(emitter, effect));
                }
                i++;
            }
        } catch (RuntimeException e) {
            e.addSuppressed(new RuntimeException("in effect " + i + " of circuit @" + circuit.name));
            throw e;
        }
    }

    /**
     * Whether this pass has a translation for operations of the given key.
     * Operations of other keys must be {@link QasmLegality#isIgnorable(OpKey) ignorable}.
     *
     * @param key The key.
     * @return Whether it is handled.
     */
    public static boolean handles(OpKey key) {
        return FX_HANDLERS.containsKey(key) || isOperator(key);
    }

    private static boolean isOperator(OpKey key) {
        return key.getExt(QtxExts.OPERATOR_INTERFACE).orElse(false);
    }

    private interface Handler {
        Bindings emit(QasmEmitter emitter, Effect effect);
    }

    private static final Map<OpKey, Handler> FX_HANDLERS = new HashMap<>();

    static {
        FX_HANDLERS.put(QtxOps.ALLOCA, (emitter, fx) -> {
            QasmLegality.checkTopLevel(emitter, fx);
            QType type = QtxOps.ALLOCA.cast(fx.insn().op).arg;
            String name = emitter.createName(emitter.getConventions().qregPrefix);
            emitter.printf("qreg %s[%d];", name, type.isArray() ? type.size : 1);
            return new Bindings().bind(fx.getAssignsTo().get(0), type.isArray() ? name : name + "[0]");
        });
        FX_HANDLERS.put(QtxOps.APPLY, (emitter, fx) -> {
            QtxOps.ApplyType type = QtxOps.APPLY.cast(fx.insn().op).arg;
            QasmLegality.checkApply(emitter, fx, type);
            StringBuilder sb = new StringBuilder(type.callee);
            appendParameters(emitter, fx, sb, type.parameters(fx.insn()), true);
            appendOperands(emitter, sb.append(' '), type.targets(fx.insn()));
            emitter.println(sb.append(';').toString());
            List<Var> results = fx.getAssignsTo();
            return new Bindings().forward(emitter,
                    type.targets(fx.insn()),
                    results.subList(type.classicalResults.size(), results.size()));
        });
        FX_HANDLERS.put(QtxOps.MZ, (emitter, fx) -> {
            QasmLegality.checkMeasure(emitter, fx);
            QType bitsType = QtxOps.MZ.cast(fx.insn().op).arg;
            Var target = fx.insn().args().get(0);
            QType targetType = target.getExtOrThrow(QtxExts.TYPE);
            int width = bitsType.isVector() ? bitsType.size : 1;
            if (width != (targetType.isArray() ? targetType.size : 1)) {
                throw new IllegalStateException("cannot measure " + targetType + " into " + bitsType);
            }

            String name = emitter.createName(emitter.getConventions().cregPrefix);
            emitter.printf("creg %s[%d];", name, width);
            String destination = targetType.isArray() ? name : name + "[0]";
            emitter.printf("measure %s -> %s;", emitter.getName(target), destination);

            List<Var> results = fx.getAssignsTo();
            return new Bindings()
                    .bind(results.get(0), bitsType.isVector() ? name : name + "[0]")
                    .forward(emitter, fx.insn().args(), results.subList(1, results.size()));
        });
        FX_HANDLERS.put(QtxOps.RESET.key, (emitter, fx) -> {
            QasmLegality.checkTopLevel(emitter, fx);
            for (Var target : fx.insn().args()) {
                emitter.printf("reset %s;", emitter.getName(target));
            }
            return new Bindings().forward(emitter, fx.insn().args(), fx.getAssignsTo());
        });
        FX_HANDLERS.put(QtxOps.ARRAY_SPLIT.key, (emitter, fx) -> {
            String arrayName = emitter.getName(fx.insn().args().get(0));
            Bindings bindings = new Bindings();
            List<Var> wires = fx.getAssignsTo();
            for (int i = 0; i < wires.size(); i++) {
                bindings.bind(wires.get(i), arrayName + "[" + i + "]");
            }
            return bindings;
        });
        FX_HANDLERS.put(QtxOps.ARRAY_BORROW.key, (emitter, fx) -> {
            List<Var> args = fx.insn().args();
            List<Var> results = fx.getAssignsTo();
            Var array = args.get(0);
            List<Var> indices = args.subList(1, args.size());
            List<Var> wires = results.subList(0, results.size() - 1);
            Var newArray = results.get(results.size() - 1);
            if (indices.size() != wires.size()) {
                throw new IllegalStateException("borrowing " + indices.size() + " indices into " + wires.size() + " wires");
            }

            String arrayName = emitter.getName(array);
            int size = array.getExtOrThrow(QtxExts.TYPE).size;
            Bindings bindings = new Bindings();
            for (int i = 0; i < indices.size(); i++) {
                OptionalLong index = IRUtils.indexLiteral(indices.get(i));
                if (!index.isPresent()) {
                    throw new QasmTranslationException(UNSUPPORTED_CONSTRUCT, fx,
                            "cannot translate runtime index to OpenQASM 2.0");
                }
                if (index.getAsLong() >= size) {
                    throw new IllegalStateException("index " + index.getAsLong() + " out of bounds for " + array);
                }
                bindings.bind(wires.get(i), arrayName + "[" + index.getAsLong() + "]");
            }
            return bindings.bind(newArray, arrayName);
        });
        FX_HANDLERS.put(QtxOps.ARRAY_YIELD.key, (emitter, fx) -> {
            List<Var> args = fx.insn().args();
            return new Bindings().bind(fx.getAssignsTo().get(0), emitter.getName(args.get(args.size() - 1)));
        });
    }

    private static Bindings emitOperator(QasmEmitter emitter, Effect fx) {
        Op op = fx.insn().op;
        QtxOps.OperatorType type = QtxOps.operatorType(op);
        if (type == null) {
            throw new IllegalStateException("operator " + op + " has no operator payload");
        }
        OpKey key = op.key;
        QasmLegality.checkOperator(fx, type);
        String mnemonic = GateNames.resolve(key.mnemonic, type.controls)
                .orElseThrow(() -> new QasmTranslationException(UNREPRESENTABLE_GATE, fx,
                        "cannot convert operation to OpenQASM 2.0"));

        StringBuilder sb = new StringBuilder(mnemonic);
        appendParameters(emitter, fx, sb, type.parameters(fx.insn()), false);
        sb.append(' ');
        if (type.controls > 0) {
            appendOperands(emitter, sb, type.controls(fx.insn()));
            sb.append(',');
        }
        appendOperands(emitter, sb, type.targets(fx.insn()));
        emitter.println(sb.append(';').toString());
        return new Bindings().forward(emitter, type.targets(fx.insn()), fx.getAssignsTo());
    }

    private static void appendOperands(QasmEmitter emitter, StringBuilder sb, List<Var> operands) {
        StringJoiner sj = new StringJoiner(",");
        for (Var operand : operands) {
            sj.add(emitter.getName(operand));
        }
        sb.append(sj);
    }

    private static void appendParameters(QasmEmitter emitter,
                                         Effect fx,
                                         StringBuilder sb,
                                         List<Var> parameters,
                                         boolean allowFormals) {
        if (parameters.isEmpty()) return;
        StringJoiner sj = new StringJoiner(",", "(", ")");
        List<Var> formals = emitter.scope().getCircuit().getParameters();
        for (Var param : parameters) {
            OptionalDouble literal = IRUtils.realLiteral(param);
            if (literal.isPresent()) {
                sj.add(Double.toString(literal.getAsDouble()));
            } else if (allowFormals && formals.contains(param)) {
                sj.add(emitter.getName(param));
            } else {
                throw new QasmTranslationException(UNRESOLVABLE_PARAMETER, fx, "failed to emit parameters");
            }
        }
        sb.append(sj);
    }
}

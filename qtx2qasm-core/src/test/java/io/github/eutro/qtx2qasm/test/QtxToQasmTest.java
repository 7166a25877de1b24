package io.github.eutro.qtx2qasm.test;

import io.github.eutro.qtx2qasm.core.ext.CommonExts;
import io.github.eutro.qtx2qasm.core.ops.CommonOps;
import io.github.eutro.qtx2qasm.core.ops.Op;
import io.github.eutro.qtx2qasm.core.ops.OpKey;
import io.github.eutro.qtx2qasm.core.ops.QtxOps;
import io.github.eutro.qtx2qasm.core.ops.SimpleOpKey;
import io.github.eutro.qtx2qasm.core.passes.convert.QtxToQasm;
import io.github.eutro.qtx2qasm.core.qasm.QasmConventions;
import io.github.eutro.qtx2qasm.core.qasm.QasmLegality;
import io.github.eutro.qtx2qasm.core.qasm.QasmTranslationException;
import io.github.eutro.qtx2qasm.core.ssa.Circuit;
import io.github.eutro.qtx2qasm.core.ssa.IRBuilder;
import io.github.eutro.qtx2qasm.core.ssa.Module;
import io.github.eutro.qtx2qasm.core.ssa.QType;
import io.github.eutro.qtx2qasm.core.ssa.Var;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static io.github.eutro.qtx2qasm.core.qasm.QasmTranslationException.Kind.*;
import static io.github.eutro.qtx2qasm.test.Utils.*;
import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;
import static org.junit.jupiter.api.Assertions.*;

public class QtxToQasmTest {
    @Test
    void controlledNotAndMeasure() {
        Module module = module();
        IRBuilder ib = new IRBuilder(entryPoint(module));
        Var q = ib.alloca(QType.WIRE);
        q = ib.gate(QtxOps.X, q);
        Var array = ib.alloca(QType.wireArray(2));
        List<Var> wires = ib.split(array);
        List<Var> cx = ib.operator(QtxOps.X, emptyList(), singletonList(wires.get(0)), singletonList(wires.get(1)));
        List<Var> mz = ib.measure(QType.BIT, wires.get(0));
        ib.dealloc(q, cx.get(0), mz.get(1));
        ib.ret();

        assertEquals(HEADER
                        + "qreg q0[1];\n"
                        + "x q0[0];\n"
                        + "qreg q1[2];\n"
                        + "cx q1[0],q1[1];\n"
                        + "creg c0[1];\n"
                        + "measure q1[0] -> c0[0];\n",
                translate(module));
    }

    @Test
    void emptyEntryPoint() {
        Module module = module();
        new IRBuilder(entryPoint(module)).ret();
        assertEquals(HEADER, translate(module));
    }

    @Test
    void adjointFails() {
        Module module = module();
        IRBuilder ib = new IRBuilder(entryPoint(module));
        Var q = ib.alloca(QType.WIRE);
        ib.operator(QtxOps.S, true, emptyList(), emptyList(), singletonList(q));
        ib.ret();

        QasmTranslationException e = assertFails(UNSUPPORTED_CONSTRUCT,
                "cannot convert adjoint operations to OpenQASM 2.0",
                () -> translate(module));
        assertSame(module.circuits.get(0).getBody().getEffects().get(1), e.getLocation());
    }

    @Test
    void nonLiteralParameterFails() {
        Module module = module();
        IRBuilder ib = new IRBuilder(entryPoint(module));
        Var q = ib.alloca(QType.WIRE);
        Var theta = ib.insert(LLVM_LOAD.insn(), QType.REAL);
        ib.operator(QtxOps.RX, singletonList(theta), emptyList(), singletonList(q));
        ib.ret();

        assertFails(UNRESOLVABLE_PARAMETER, "failed to emit parameters", () -> translate(module));
    }

    @Test
    void literalParameters() {
        Module module = module();
        IRBuilder ib = new IRBuilder(entryPoint(module));
        Var q = ib.alloca(QType.wireArray(2));
        List<Var> wires = ib.split(q);
        Var folded = ib.insert(LLVM_LOAD.insn(), QType.REAL);
        folded.attachExt(CommonExts.CONSTANT_VALUE, 0.25);
        List<Var> rz = ib.operator(QtxOps.RZ, singletonList(ib.real(0.5)), emptyList(), singletonList(wires.get(0)));
        ib.operator(QtxOps.R1, singletonList(folded), singletonList(rz.get(0)), singletonList(wires.get(1)));
        ib.ret();

        assertEquals(HEADER
                        + "qreg q0[2];\n"
                        + "rz(0.5) q0[0];\n"
                        + "cu1(0.25) q0[0],q0[1];\n",
                translate(module));
    }

    @Test
    void nonFiniteParameterFails() {
        Module module = module();
        IRBuilder ib = new IRBuilder(entryPoint(module));
        Var q = ib.alloca(QType.WIRE);
        ib.operator(QtxOps.RY, singletonList(ib.real(Double.NaN)), emptyList(), singletonList(q));
        ib.ret();

        assertFails(UNRESOLVABLE_PARAMETER, "failed to emit parameters", () -> translate(module));
    }

    @Test
    void controlCounts() {
        Module module = module();
        IRBuilder ib = new IRBuilder(entryPoint(module));
        List<Var> w = ib.split(ib.alloca(QType.wireArray(3)));
        List<Var> ccx = ib.operator(QtxOps.X, emptyList(), Arrays.asList(w.get(0), w.get(1)), singletonList(w.get(2)));
        ib.operator(QtxOps.Y, emptyList(), singletonList(w.get(0)), singletonList(ccx.get(0)));
        ib.ret();
        assertEquals(HEADER
                        + "qreg q0[3];\n"
                        + "ccx q0[0],q0[1],q0[2];\n"
                        + "cy q0[0],q0[2];\n",
                translate(module));

        Module bad = module();
        IRBuilder bb = new IRBuilder(entryPoint(bad));
        List<Var> v = bb.split(bb.alloca(QType.wireArray(3)));
        bb.operator(QtxOps.Y, emptyList(), Arrays.asList(v.get(0), v.get(1)), singletonList(v.get(2)));
        bb.ret();
        assertFails(UNREPRESENTABLE_GATE, "cannot convert operation to OpenQASM 2.0", () -> translate(bad));
    }

    @Test
    void moduleShape() {
        Module none = module();
        new IRBuilder(none.newCircuit("main")).ret();
        assertFails(MODULE_SHAPE, "module does not contain an entrypoint", () -> translate(none));

        Module two = module();
        IRBuilder a = new IRBuilder(entryPoint(two));
        a.operator(QtxOps.S, true, emptyList(), emptyList(), singletonList(a.alloca(QType.WIRE)));
        a.ret();
        IRBuilder b = new IRBuilder(two.newCircuit("other").markEntryPoint());
        b.insert(new SimpleOpKey("cc", "if").create().insn());
        b.ret();
        assertFails(MODULE_SHAPE, "module has multiple entrypoints", () -> translate(two));
    }

    @Test
    void gateDefinitions() {
        Module module = module();
        Circuit bell = module.newCircuit("bell");
        Var a = bell.addTarget("a", QType.WIRE);
        Var b = bell.addTarget("b", QType.WIRE);
        IRBuilder gb = new IRBuilder(bell);
        Var a1 = gb.gate(QtxOps.H, a);
        List<Var> cx = gb.operator(QtxOps.X, emptyList(), singletonList(a1), singletonList(b));
        gb.ret(a1, cx.get(0));

        IRBuilder ib = new IRBuilder(entryPoint(module));
        List<Var> w = ib.split(ib.alloca(QType.wireArray(2)));
        List<Var> applied = ib.apply(bell, emptyList(), w);
        ib.dealloc(applied.toArray(new Var[0]));
        ib.ret();

        assertEquals(HEADER
                        + "gate bell q0,q1 {\n"
                        + "  h q0;\n"
                        + "  cx q0,q1;\n"
                        + "}\n"
                        + "\n"
                        + "qreg q0[2];\n"
                        + "bell q0[0],q0[1];\n",
                translate(module));
    }

    @Test
    void parameterisedGates() {
        Module module = module();
        Circuit rot = module.newCircuit("rot");
        rot.addParameter("theta");
        Var t = rot.addTarget("t", QType.WIRE);
        IRBuilder rb = new IRBuilder(rot);
        rb.ret(rb.operator(QtxOps.RX, singletonList(rb.real(0.5)), emptyList(), singletonList(t)).get(0));

        Circuit twice = module.newCircuit("twice");
        Var phi = twice.addParameter("phi");
        Var u = twice.addTarget("u", QType.WIRE);
        IRBuilder tb = new IRBuilder(twice);
        Var u1 = tb.apply(rot, singletonList(phi), singletonList(u)).get(0);
        tb.ret(tb.apply(rot, singletonList(tb.real(1.0)), singletonList(u1)).get(0));

        IRBuilder ib = new IRBuilder(entryPoint(module));
        Var q = ib.alloca(QType.WIRE);
        q = ib.apply(twice, singletonList(ib.real(Math.PI)), singletonList(q)).get(0);
        ib.dealloc(q);
        ib.ret();

        assertEquals(HEADER
                        + "gate rot(param0) q0 {\n"
                        + "  rx(0.5) q0;\n"
                        + "}\n"
                        + "\n"
                        + "gate twice(param0) q0 {\n"
                        + "  rot(param0) q0;\n"
                        + "  rot(1.0) q0;\n"
                        + "}\n"
                        + "\n"
                        + "qreg q0[1];\n"
                        + "twice(3.141592653589793) q0[0];\n",
                translate(module));
    }

    @Test
    void formalParameterOfOperatorFails() {
        Module module = module();
        Circuit rot = module.newCircuit("rot");
        Var theta = rot.addParameter("theta");
        Var t = rot.addTarget("t", QType.WIRE);
        IRBuilder rb = new IRBuilder(rot);
        rb.ret(rb.operator(QtxOps.RX, singletonList(theta), emptyList(), singletonList(t)).get(0));
        new IRBuilder(entryPoint(module)).ret();

        assertFails(UNRESOLVABLE_PARAMETER, "failed to emit parameters", () -> translate(module));
    }

    @Test
    void applyBeforeDefinitionFails() {
        Module module = module();
        Circuit first = module.newCircuit("first");
        Circuit second = module.newCircuit("second");
        Var a = first.addTarget("a", QType.WIRE);
        IRBuilder fb = new IRBuilder(first);
        fb.ret(fb.apply(second, emptyList(), singletonList(a)).get(0));
        Var b = second.addTarget("b", QType.WIRE);
        IRBuilder sb = new IRBuilder(second);
        sb.ret(sb.gate(QtxOps.X, b));
        new IRBuilder(entryPoint(module)).ret();

        assertFails(UNSUPPORTED_CONSTRUCT, "cannot apply @second before its gate definition", () -> translate(module));
    }

    @Test
    void applyArityFails() {
        Module module = module();
        Circuit bell = module.newCircuit("bell");
        Var a = bell.addTarget("a", QType.WIRE);
        Var b = bell.addTarget("b", QType.WIRE);
        IRBuilder gb = new IRBuilder(bell);
        List<Var> cx = gb.operator(QtxOps.X, emptyList(), singletonList(a), singletonList(b));
        gb.ret(a, cx.get(0));
        IRBuilder ib = new IRBuilder(entryPoint(module));
        ib.apply(bell, emptyList(), singletonList(ib.alloca(QType.WIRE)));
        ib.ret();

        assertFails(UNSUPPORTED_CONSTRUCT, "wrong number of arguments to @bell", () -> translate(module));
    }

    static Module gateNamed(String... names) {
        Module module = module();
        for (String name : names) {
            Circuit g = module.newCircuit(name);
            Var a = g.addTarget("a", QType.WIRE);
            IRBuilder gb = new IRBuilder(g);
            gb.ret(gb.gate(QtxOps.H, a));
        }
        IRBuilder ib = new IRBuilder(entryPoint(module));
        Var q = ib.alloca(QType.WIRE);
        ib.dealloc(ib.apply(names[0], false, emptyList(), singletonList(q), emptyList()).get(0));
        ib.ret();
        return module;
    }

    @Test
    void duplicateCircuitNamesFail() {
        assertFails(UNSUPPORTED_CONSTRUCT, "module has multiple circuits named @bell",
                () -> translate(gateNamed("bell", "bell")));
    }

    @Test
    void reservedGateNamesFail() {
        for (String name : Arrays.asList("x", "cx", "u3", "measure")) {
            assertFails(UNSUPPORTED_CONSTRUCT, "gate name @" + name + " is reserved in OpenQASM 2.0",
                    () -> translate(gateNamed(name)));
        }
        assertFails(UNSUPPORTED_CONSTRUCT, "cannot translate gate name @Bell into OpenQASM 2.0",
                () -> translate(gateNamed("Bell")));
        assertFails(UNSUPPORTED_CONSTRUCT, "cannot translate gate name @my.gate into OpenQASM 2.0",
                () -> translate(gateNamed("my.gate")));
    }

    @Test
    void freshNamesAvoidGateNames() {
        assertEquals(HEADER
                        + "gate q0 q1 {\n"
                        + "  h q1;\n"
                        + "}\n"
                        + "\n"
                        + "qreg q1[1];\n"
                        + "q0 q1[0];\n",
                translate(gateNamed("q0")));
    }

    @Test
    void adjointApplyFails() {
        Module module = module();
        Circuit g = module.newCircuit("g");
        Var a = g.addTarget("a", QType.WIRE);
        IRBuilder gb = new IRBuilder(g);
        gb.ret(gb.gate(QtxOps.T, a));
        IRBuilder ib = new IRBuilder(entryPoint(module));
        ib.apply("g", true, emptyList(), singletonList(ib.alloca(QType.WIRE)), emptyList());
        ib.ret();

        assertFails(UNSUPPORTED_CONSTRUCT, "cannot convert adjoint operations to OpenQASM 2.0", () -> translate(module));
    }

    @Test
    void classicalResultsFail() {
        Module module = module();
        Circuit g = module.newCircuit("g");
        Var a = g.addTarget("a", QType.WIRE);
        g.addClassicalResult(QType.BIT);
        IRBuilder gb = new IRBuilder(g);
        gb.ret(gb.gate(QtxOps.X, a));
        new IRBuilder(entryPoint(module)).ret();
        assertFails(UNSUPPORTED_CONSTRUCT, "cannot return classical results", () -> translate(module));

        Module applying = module();
        IRBuilder ib = new IRBuilder(entryPoint(applying));
        ib.apply("g", false, emptyList(), singletonList(ib.alloca(QType.WIRE)), singletonList(QType.BIT));
        ib.ret();
        assertFails(UNSUPPORTED_CONSTRUCT, "cannot return classical results", () -> translate(applying));
    }

    @Test
    void arrayArgumentsFail() {
        Module module = module();
        Circuit g = module.newCircuit("g");
        Var r = g.addTarget("r", QType.wireArray(2));
        new IRBuilder(g).ret(r);
        new IRBuilder(entryPoint(module)).ret();
        assertFails(UNSUPPORTED_CONSTRUCT, "cannot translate array arguments into OpenQASM 2.0", () -> translate(module));
    }

    @Test
    void entryPointSignatureFails() {
        Module module = module();
        Circuit main = entryPoint(module);
        Var q = main.addTarget("q", QType.WIRE);
        new IRBuilder(main).ret(q);
        assertFails(UNSUPPORTED_CONSTRUCT,
                "cannot translate entrypoint with parameters or targets into OpenQASM 2.0",
                () -> translate(module));
    }

    @Test
    void missingTerminatorFails() {
        Module module = module();
        new IRBuilder(entryPoint(module)).alloca(QType.WIRE);
        assertFails(UNSUPPORTED_CONSTRUCT, "cannot translate control flow into OpenQASM 2.0", () -> translate(module));
    }

    @Test
    void resetEachTarget() {
        Module module = module();
        IRBuilder ib = new IRBuilder(entryPoint(module));
        List<Var> w = ib.split(ib.alloca(QType.wireArray(2)));
        List<Var> reset = ib.reset(w.get(0), w.get(1));
        ib.gate(QtxOps.H, reset.get(1));
        ib.ret();
        assertEquals(HEADER
                        + "qreg q0[2];\n"
                        + "reset q0[0];\n"
                        + "reset q0[1];\n"
                        + "h q0[1];\n",
                translate(module));
    }

    @Test
    void multiTargetMeasureFails() {
        Module module = module();
        IRBuilder ib = new IRBuilder(entryPoint(module));
        List<Var> w = ib.split(ib.alloca(QType.wireArray(2)));
        ib.measure(QType.bitVector(2), w.get(0), w.get(1));
        ib.ret();
        assertFails(UNSUPPORTED_CONSTRUCT,
                "cannot translate measurements with more than one target",
                () -> translate(module));
    }

    @Test
    void measureWholeArray() {
        Module module = module();
        IRBuilder ib = new IRBuilder(entryPoint(module));
        Var array = ib.alloca(QType.wireArray(3));
        List<Var> borrowed = ib.borrow(array, ib.index(2));
        Var flipped = ib.gate(QtxOps.X, borrowed.get(0));
        Var yielded = ib.yieldWires(borrowed.get(1), flipped);
        List<Var> mz = ib.measure(QType.bitVector(3), yielded);
        ib.dealloc(mz.get(1));
        ib.ret();
        assertEquals(HEADER
                        + "qreg q0[3];\n"
                        + "x q0[2];\n"
                        + "creg c0[3];\n"
                        + "measure q0 -> c0;\n",
                translate(module));
    }

    @Test
    void runtimeIndexFails() {
        Module module = module();
        IRBuilder ib = new IRBuilder(entryPoint(module));
        Var array = ib.alloca(QType.wireArray(3));
        Var index = ib.insert(LLVM_LOAD.insn(), QType.INDEX);
        ib.borrow(array, index);
        ib.ret();
        assertFails(UNSUPPORTED_CONSTRUCT, "cannot translate runtime index to OpenQASM 2.0", () -> translate(module));
    }

    @Test
    void unknownOpFails() {
        Module module = module();
        IRBuilder ib = new IRBuilder(entryPoint(module));
        Op ifOp = new SimpleOpKey("cc", "if").create();
        ib.insert(ifOp.insn(ib.alloca(QType.WIRE)));
        ib.ret();
        assertFails(UNSUPPORTED_CONSTRUCT, "unable to translate op to OpenQASM 2.0", () -> translate(module));
    }

    @Test
    void llvmOpsAreSkipped() {
        Module module = module();
        IRBuilder ib = new IRBuilder(entryPoint(module));
        ib.insert(LLVM_LOAD.insn(), QType.REAL);
        ib.insert(new SimpleOpKey("llvm", "call").create().insn());
        ib.gate(QtxOps.Z, ib.alloca(QType.WIRE));
        ib.ret();
        assertEquals(HEADER
                        + "qreg q0[1];\n"
                        + "z q0[0];\n",
                translate(module));
    }

    @Test
    void wireFromSkippedOpFails() {
        Module module = module();
        IRBuilder ib = new IRBuilder(entryPoint(module));
        Var w = ib.insert(LLVM_LOAD.insn(), QType.WIRE);
        ib.dealloc(ib.gate(QtxOps.X, w));
        ib.ret();
        assertFails(UNSUPPORTED_CONSTRUCT, "cannot translate value produced by an untranslated op",
                () -> translate(module));
    }

    @Test
    void nonUnitaryInGateFails() {
        Module module = module();
        Circuit g = module.newCircuit("g");
        Var a = g.addTarget("a", QType.WIRE);
        IRBuilder gb = new IRBuilder(g);
        gb.ret(gb.measure(QType.BIT, a).get(1));
        new IRBuilder(entryPoint(module)).ret();
        assertFails(UNSUPPORTED_CONSTRUCT,
                "cannot translate non-unitary operation inside a gate definition",
                () -> translate(module));
    }

    @Test
    void conventions() {
        Module module = module();
        IRBuilder ib = new IRBuilder(entryPoint(module));
        ib.measure(QType.BIT, ib.alloca(QType.WIRE));
        ib.ret();
        QasmConventions conventions = QasmConventions.builder()
                .setCompilerName("test")
                .setQregPrefix("qr")
                .setCregPrefix("cr")
                .build();
        assertEquals("// Code generated by test compiler\n"
                        + "OPENQASM 2.0;\n"
                        + "\n"
                        + "include \"qelib1.inc\";\n"
                        + "\n"
                        + "qreg qr0[1];\n"
                        + "creg cr0[1];\n"
                        + "measure qr0[0] -> cr0[0];\n",
                new QtxToQasm(conventions).run(module));
    }

    @Test
    void everyQtxOpIsHandledOrIgnorable() {
        for (OpKey key : QtxOps.structuralKeys()) {
            assertTrue(QtxToQasm.handles(key) || QasmLegality.isIgnorable(key), key.toString());
        }
        for (OpKey key : QtxOps.operators()) {
            assertTrue(QtxToQasm.handles(key), key.toString());
        }
        assertTrue(QtxToQasm.handles(QtxOps.operator("custom")));
        assertTrue(QasmLegality.isIgnorable(CommonOps.CONST));
        assertTrue(QasmLegality.isIgnorable(CommonOps.RETURN.key));
        assertTrue(QasmLegality.isIgnorable(LLVM_LOAD.key));
        assertFalse(QtxToQasm.handles(QtxOps.DEALLOC.key));
        assertFalse(QasmLegality.isIgnorable(new SimpleOpKey("cc", "if")));
    }
}

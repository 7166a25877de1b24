package io.github.eutro.qtx2qasm.test;

import io.github.eutro.qtx2qasm.core.qasm.Bindings;
import io.github.eutro.qtx2qasm.core.qasm.QasmConventions;
import io.github.eutro.qtx2qasm.core.qasm.QasmEmitter;
import io.github.eutro.qtx2qasm.core.qasm.Scope;
import io.github.eutro.qtx2qasm.core.ssa.Circuit;
import io.github.eutro.qtx2qasm.core.ssa.Module;
import io.github.eutro.qtx2qasm.core.ssa.QType;
import io.github.eutro.qtx2qasm.core.ssa.Var;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class QasmEmitterTest {
    @Test
    void namesAreUniqueInScope() {
        Module module = Utils.module();
        Circuit main = Utils.entryPoint(module);
        QasmEmitter emitter = new QasmEmitter(QasmConventions.DEFAULT);
        try (Scope ignored = emitter.openScope(main)) {
            Set<String> names = new HashSet<>();
            for (int i = 0; i < 20; i++) {
                assertTrue(names.add(emitter.createName("q")));
                assertTrue(names.add(emitter.createName("c")));
            }
        }
    }

    @Test
    void createNameSkipsTakenNames() {
        Module module = Utils.module();
        Circuit main = Utils.entryPoint(module);
        Var a = main.newVar("a", QType.wireArray(2));
        QasmEmitter emitter = new QasmEmitter(QasmConventions.DEFAULT);
        try (Scope ignored = emitter.openScope(main)) {
            assertEquals("q0", emitter.createName("q"));
            emitter.getOrAssignName(a, "q1");
            assertEquals("q2", emitter.createName("q"));
        }
    }

    @Test
    void scopesAreIndependent() {
        Module module = Utils.module();
        Circuit gate = module.newCircuit("g");
        Circuit main = Utils.entryPoint(module);
        Var v = gate.newVar("v", QType.WIRE);
        QasmEmitter emitter = new QasmEmitter(QasmConventions.DEFAULT);
        try (Scope ignored = emitter.openScope(gate)) {
            assertEquals("q0", emitter.createName("q"));
            emitter.getOrAssignName(v, "q0");
            assertEquals(Optional.of("q0"), emitter.findName(v));
        }
        try (Scope scope = emitter.openScope(main)) {
            assertTrue(scope.isEntryPoint());
            assertEquals("q0", emitter.createName("q"));
            assertEquals(Optional.empty(), emitter.findName(v));
            assertThrows(IllegalStateException.class, () -> emitter.getName(v));
        }
    }

    @Test
    void getOrAssignNameKeepsExisting() {
        Module module = Utils.module();
        Circuit main = Utils.entryPoint(module);
        Var wire = main.newVar("w", QType.WIRE);
        Var bit = main.newVar("b", QType.BIT);
        QasmEmitter emitter = new QasmEmitter(QasmConventions.DEFAULT);
        try (Scope ignored = emitter.openScope(main)) {
            String name = emitter.getOrAssignName(wire);
            assertEquals("q0", name);
            assertEquals(name, emitter.getOrAssignName(wire));
            assertEquals(name, emitter.getOrAssignName(wire, "other"));
            assertEquals("c0", emitter.getOrAssignName(bit));
        }
    }

    @Test
    void forwardingSharesSymbols() {
        Module module = Utils.module();
        Circuit main = Utils.entryPoint(module);
        Var a = main.newVar("a", QType.WIRE);
        Var b = main.newVar("b", QType.WIRE);
        Var a1 = main.newVar("a", QType.WIRE);
        Var b1 = main.newVar("b", QType.WIRE);
        QasmEmitter emitter = new QasmEmitter(QasmConventions.DEFAULT);
        try (Scope ignored = emitter.openScope(main)) {
            emitter.getOrAssignName(a, "q0[0]");
            emitter.getOrAssignName(b, "q0[1]");
            emitter.mapValuesName(Arrays.asList(a, b), Arrays.asList(a1, b1));
            assertEquals("q0[0]", emitter.getName(a1));
            assertEquals("q0[1]", emitter.getName(b1));
            assertEquals("q0[0]", emitter.getName(a));
            assertThrows(IllegalStateException.class, () -> emitter.merge(new Bindings().bind(a1, "q9")));
            assertThrows(IllegalStateException.class, () -> new Bindings()
                    .forward(emitter, Collections.singletonList(a), Collections.emptyList()));
        }
    }

    @Test
    void indentation() {
        QasmEmitter emitter = new QasmEmitter(QasmConventions.builder().setIndent("\t").build());
        emitter.println("gate g q0 {");
        emitter.indent();
        emitter.printf("%s %s;", "h", "q0");
        emitter.println("");
        emitter.unindent();
        emitter.println("}");
        assertEquals("gate g q0 {\n\th q0;\n\n}\n", emitter.getOutput());
        assertThrows(IllegalStateException.class, emitter::unindent);
    }

    @Test
    void noScope() {
        QasmEmitter emitter = new QasmEmitter(QasmConventions.DEFAULT);
        assertThrows(IllegalStateException.class, () -> emitter.createName("q"));
    }

    @Test
    void badPrefix() {
        assertThrows(IllegalArgumentException.class, () -> QasmConventions.builder().setQregPrefix("Q"));
        assertThrows(IllegalArgumentException.class, () -> QasmConventions.builder().setParamPrefix("1p"));
    }
}

package io.github.eutro.qtx2qasm.test;

import io.github.eutro.qtx2qasm.core.ops.Op;
import io.github.eutro.qtx2qasm.core.ops.SimpleOpKey;
import io.github.eutro.qtx2qasm.core.passes.convert.QtxToQasm;
import io.github.eutro.qtx2qasm.core.qasm.QasmTranslationException;
import io.github.eutro.qtx2qasm.core.ssa.Circuit;
import io.github.eutro.qtx2qasm.core.ssa.Module;
import org.junit.jupiter.api.function.Executable;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class Utils {
    public static final String HEADER = "// Code generated by qtx2qasm compiler\n"
            + "OPENQASM 2.0;\n"
            + "\n"
            + "include \"qelib1.inc\";\n"
            + "\n";

    public static final Op LLVM_LOAD = new SimpleOpKey("llvm", "load").create();

    public static Module module() {
        return new Module("test");
    }

    public static Circuit entryPoint(Module module) {
        return module.newCircuit("main").markEntryPoint();
    }

    public static String translate(Module module) {
        return QtxToQasm.INSTANCE.run(module);
    }

    public static QasmTranslationException assertFails(QasmTranslationException.Kind kind,
                                                       String diagnostic,
                                                       Executable executable) {
        QasmTranslationException e = assertThrows(QasmTranslationException.class, executable);
        assertEquals(kind, e.getKind());
        assertEquals(diagnostic, e.getDiagnostic());
        return e;
    }
}

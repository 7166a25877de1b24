package io.github.eutro.qtx2qasm.core.qasm;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps QTX gate identifiers to the mnemonics of {@code qelib1.inc}.
 */
public final class GateNames {
    private static final Map<String, String> SINGLY_CONTROLLED = new HashMap<>();
    private static final Map<String, String> DOUBLY_CONTROLLED = new HashMap<>();

    static {
        SINGLY_CONTROLLED.put("h", "ch");
        SINGLY_CONTROLLED.put("x", "cx");
        SINGLY_CONTROLLED.put("y", "cy");
        SINGLY_CONTROLLED.put("z", "cz");
        SINGLY_CONTROLLED.put("r1", "cu1");
        SINGLY_CONTROLLED.put("rx", "crx");
        SINGLY_CONTROLLED.put("ry", "cry");
        SINGLY_CONTROLLED.put("rz", "crz");

        DOUBLY_CONTROLLED.put("x", "ccx");
    }

    private GateNames() {
    }

    /**
     * Resolve the mnemonic for a gate with some number of controls.
     * <p>
     * Uncontrolled gates keep their name, except {@code r1}, which is {@code cu1}.
     *
     * @param name     The gate identifier.
     * @param controls The number of controls.
     * @return The mnemonic, or empty if OpenQASM 2.0 has none.
     */
    public static Optional<String> resolve(String name, int controls) {
        switch (controls) {
            case 0:
                return Optional.of("r1".equals(name) ? "cu1" : name);
            case 1:
                return Optional.ofNullable(SINGLY_CONTROLLED.get(name));
            case 2:
                return Optional.ofNullable(DOUBLY_CONTROLLED.get(name));
            default:
                return Optional.empty();
        }
    }
}

package io.github.eutro.qtx2qasm.core.ssa;

import io.github.eutro.qtx2qasm.core.ext.CommonExts;
import io.github.eutro.qtx2qasm.core.ext.ExtHolder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A QTX module: an ordered collection of {@link Circuit circuits}, exactly one of which
 * should be the entry point.
 */
public final class Module extends ExtHolder {
    /**
     * The name of the module.
     */
    public final String name;

    /**
     * The circuits of this module, in definition order.
     */
    public final List<Circuit> circuits = new TrackedList<Circuit>(new ArrayList<>()) {
        @Override
        protected void onAdded(Circuit elt) {
            elt.attachExt(CommonExts.OWNING_MODULE, Module.this);
        }

        @Override
        protected void onRemoved(Circuit elt) {
            elt.removeExt(CommonExts.OWNING_MODULE);
        }
    };

    public Module(String name) {
        this.name = name;
    }

    /**
     * Create a new circuit at the end of this module.
     *
     * @param name The name of the circuit.
     * @return The circuit.
     */
    public Circuit newCircuit(String name) {
        Circuit circuit = new Circuit(name);
        circuits.add(circuit);
        return circuit;
    }

    /**
     * Find a circuit by name.
     *
     * @param name The name.
     * @return The first circuit with that name, if any.
     */
    public Optional<Circuit> findCircuit(String name) {
        return circuits.stream().filter(c -> c.name.equals(name)).findFirst();
    }

    /**
     * Get every circuit marked as the entry point. In a well-formed module there is exactly one.
     *
     * @return The entry points.
     */
    public List<Circuit> getEntryPoints() {
        return circuits.stream().filter(Circuit::isEntryPoint).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("module @").append(name).append(" {\n");
        for (Circuit circuit : circuits) {
            sb.append(circuit.toListing()).append('\n');
        }
        return sb.append('}').toString();
    }
}

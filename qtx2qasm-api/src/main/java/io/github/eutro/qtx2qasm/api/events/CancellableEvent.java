package io.github.eutro.qtx2qasm.api.events;

/**
 * An event that a listener can cancel, so that no later listener receives it.
 * <p>
 * Cancelling {@link EmitQasmEvent} suppresses the output of a module.
 */
public interface CancellableEvent {
    boolean isCancelled();

    void cancel();
}

package io.github.eutro.qtx2qasm.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Something that events can be listened to on.
 *
 * @param <S> The supertype of the events that can be listened to.
 */
public interface EventDispatcher<S> {
    /**
     * Listen to the given event type.
     * <p>
     * Listeners are matched on the exact class an event is dispatched as,
     * so listening to a superclass or interface of an event receives nothing.
     *
     * @param eventClass The event class.
     * @param listener   The listener.
     * @param <T>        The event type.
     */
    <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener);
}

package io.github.eutro.qtx2qasm.api.events;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Consumer;

/**
 * An {@link EventDispatcher} that also fires its own events, used as the base of both
 * the compiler and each module compilation.
 * <p>
 * Listeners of one event class are called in registration order. Registering a listener
 * from inside another is allowed, and takes effect from the next dispatch.
 *
 * @param <S> The common supertype of the events fired here.
 */
public class EventSupplier<S> implements EventDispatcher<S> {
    private final Map<Class<?>, Set<Consumer<?>>> listeners = new ConcurrentHashMap<>();

    @Override
    public <T extends S> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
        listeners.computeIfAbsent(eventClass, $ -> new CopyOnWriteArraySet<>()).add(listener);
    }

    /**
     * Fire an event at the listeners of exactly {@code eventClass}.
     * <p>
     * A {@link CancellableEvent} stops reaching further listeners once one cancels it.
     *
     * @param eventClass The class the event is fired as.
     * @param event      The event.
     * @param <T>        The type of the event.
     * @return {@code event}, so callers can read back what listeners changed.
     */
    public <T extends S> T dispatch(Class<T> eventClass, T event) {
        @SuppressWarnings("unchecked")
        Set<Consumer<T>> registered = (Set<Consumer<T>>) (Object)
                listeners.getOrDefault(eventClass, Collections.emptySet());
        for (Consumer<T> listener : registered) {
            if (event instanceof CancellableEvent && ((CancellableEvent) event).isCancelled()) {
                break;
            }
            listener.accept(event);
        }
        return event;
    }
}

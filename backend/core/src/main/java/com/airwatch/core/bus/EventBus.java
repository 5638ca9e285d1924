package com.airwatch.core.bus;

import com.airwatch.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Consumer<? super Event>>> handlersByType = new ConcurrentHashMap<>();
    private final BiConsumer<Event, Exception> errorCallback;

    public EventBus() {
        this((event, error) -> LOGGER.log(Level.WARNING, "Handler for " + event.type() + " failed", error));
    }

    public EventBus(BiConsumer<Event, Exception> errorCallback) {
        this.errorCallback = errorCallback;
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        Consumer<? super Event> adapter = event -> handler.accept(type.cast(event));
        handlersByType.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(adapter);
    }

    public void publish(Event event) {
        List<Consumer<? super Event>> handlers = handlersByType.get(event.getClass());
        if (handlers == null) {
            return;
        }
        for (Consumer<? super Event> handler : handlers) {
            try {
                handler.accept(event);
            } catch (Exception ex) {
                errorCallback.accept(event, ex);
            }
        }
    }

    public int subscriberCount(Class<? extends Event> type) {
        List<Consumer<? super Event>> handlers = handlersByType.get(type);
        return handlers == null ? 0 : handlers.size();
    }
}

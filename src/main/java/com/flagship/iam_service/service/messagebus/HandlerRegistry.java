package com.flagship.iam_service.service.messagebus;

import com.flagship.iam_service.eventsourcing.model.Command;
import com.flagship.iam_service.eventsourcing.model.DomainEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only handler tables: one handler per command type, an ordered list
 * of handlers per event type.
 */
public final class HandlerRegistry {

    private final Map<Class<?>, MessageHandler<Command>> commandHandlers;
    private final Map<Class<?>, List<MessageHandler<DomainEvent>>> eventHandlers;

    private HandlerRegistry(Map<Class<?>, MessageHandler<Command>> commandHandlers,
                            Map<Class<?>, List<MessageHandler<DomainEvent>>> eventHandlers) {
        this.commandHandlers = Map.copyOf(commandHandlers);
        Map<Class<?>, List<MessageHandler<DomainEvent>>> copy = new LinkedHashMap<>();
        eventHandlers.forEach((type, handlers) -> copy.put(type, List.copyOf(handlers)));
        this.eventHandlers = Map.copyOf(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws UnregisteredMessageException if the command type has no handler
     */
    public MessageHandler<Command> commandHandler(Class<? extends Command> type) {
        MessageHandler<Command> handler = commandHandlers.get(type);
        if (handler == null) {
            throw new UnregisteredMessageException(type);
        }
        return handler;
    }

    /**
     * @throws UnregisteredMessageException if the event type was never registered
     */
    public List<MessageHandler<DomainEvent>> eventHandlers(Class<? extends DomainEvent> type) {
        List<MessageHandler<DomainEvent>> handlers = eventHandlers.get(type);
        if (handlers == null) {
            throw new UnregisteredMessageException(type);
        }
        return handlers;
    }

    public static final class Builder {

        private final Map<Class<?>, MessageHandler<Command>> commandHandlers = new LinkedHashMap<>();
        private final Map<Class<?>, List<MessageHandler<DomainEvent>>> eventHandlers = new LinkedHashMap<>();

        private Builder() {
        }

        public <C extends Command> Builder command(Class<C> type, MessageHandler<C> handler) {
            if (commandHandlers.putIfAbsent(type, handler.widen(type)) != null) {
                throw new IllegalArgumentException("Command already has a handler: " + type.getName());
            }
            return this;
        }

        /**
         * Appends a handler; handlers run in registration order.
         */
        public <E extends DomainEvent> Builder event(Class<E> type, MessageHandler<E> handler) {
            eventHandlers.computeIfAbsent(type, key -> new ArrayList<>()).add(handler.widen(type));
            return this;
        }

        public HandlerRegistry build() {
            return new HandlerRegistry(commandHandlers, eventHandlers);
        }
    }
}

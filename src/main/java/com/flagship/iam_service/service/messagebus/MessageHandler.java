package com.flagship.iam_service.service.messagebus;

import com.flagship.iam_service.eventsourcing.model.Message;
import com.flagship.iam_service.service.unitofwork.UnitOfWork;
import lombok.Getter;

import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * A handler function plus the flag telling the bus whether to pass the
 * unit of work. The flag is fixed at registration.
 */
@Getter
public final class MessageHandler<M extends Message> {

    private final String name;
    private final boolean unitOfWorkRequired;
    private final BiFunction<M, UnitOfWork, Object> function;

    private MessageHandler(String name, boolean unitOfWorkRequired, BiFunction<M, UnitOfWork, Object> function) {
        this.name = name;
        this.unitOfWorkRequired = unitOfWorkRequired;
        this.function = function;
    }

    public static <M extends Message> MessageHandler<M> withUnitOfWork(
            String name, BiFunction<? super M, UnitOfWork, ?> function) {
        return new MessageHandler<>(name, true, function::apply);
    }

    public static <M extends Message> MessageHandler<M> standalone(
            String name, Function<? super M, ?> function) {
        return new MessageHandler<>(name, false, (message, uow) -> function.apply(message));
    }

    /**
     * The same handler behind a wider message type. Messages are cast to
     * the registered type before the function sees them.
     */
    <W extends Message> MessageHandler<W> widen(Class<? extends M> type) {
        return new MessageHandler<>(name, unitOfWorkRequired,
                (message, uow) -> function.apply(type.cast(message), uow));
    }

    public Object invoke(M message, UnitOfWork uow) {
        return function.apply(message, unitOfWorkRequired ? uow : null);
    }

    @Override
    public String toString() {
        return name;
    }
}

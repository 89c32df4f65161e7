package com.flagship.iam_service.service.messagebus;

import com.flagship.iam_service.eventsourcing.model.Command;
import com.flagship.iam_service.eventsourcing.model.DomainEvent;
import com.flagship.iam_service.eventsourcing.model.Message;
import com.flagship.iam_service.observability.MessageBusMetrics;
import com.flagship.iam_service.observability.RequestContext;
import com.flagship.iam_service.service.unitofwork.Backlog;
import com.flagship.iam_service.service.unitofwork.UnitOfWork;
import com.flagship.iam_service.service.unitofwork.UnitOfWorkFactory;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Processes a message and every internal event it leads to.
 *
 * One handle() call:
 * 1. Queues the message and creates one unit of work for the whole run
 * 2. Pops messages until the queue is empty
 *    - Command: runs its single handler, then queues the internal backlog.
 *      A failure aborts the run and propagates.
 *    - Event: runs every handler in order, queueing the internal backlog
 *      after each one. A StopSentinel skips the remaining handlers; any
 *      other failure is logged and the run goes on.
 * 3. Returns the handler results in the order they were produced
 *
 * Internal events are handled breadth-first after the message that caused them.
 */
@Slf4j
public class MessageBus {

    private final UnitOfWorkFactory unitOfWorkFactory;
    private final HandlerRegistry handlers;
    private final MessageBusMetrics metrics;

    public MessageBus(UnitOfWorkFactory unitOfWorkFactory, HandlerRegistry handlers, MessageBusMetrics metrics) {
        this.unitOfWorkFactory = unitOfWorkFactory;
        this.handlers = handlers;
        this.metrics = metrics;
    }

    public List<Object> handle(Message message) {
        return handle(message, null);
    }

    /**
     * Handles the message with the given request id in the logging context.
     * A null id keeps the current one, or generates a new one.
     */
    public List<Object> handle(Message message, String requestId) {
        boolean ownsContext = requestId != null || !RequestContext.hasRequestId();
        if (ownsContext) {
            RequestContext.setRequestId(requestId);
        }
        MDC.put(RequestContext.REQUEST_ID_MDC_KEY, RequestContext.getRequestId());
        try (UnitOfWork uow = unitOfWorkFactory.create()) {
            return run(message, uow);
        } finally {
            if (ownsContext) {
                MDC.remove(RequestContext.REQUEST_ID_MDC_KEY);
                RequestContext.clear();
            }
        }
    }

    private List<Object> run(Message message, UnitOfWork uow) {
        Deque<Message> queue = new ArrayDeque<>();
        queue.add(message);
        List<Object> results = new ArrayList<>();

        while (!queue.isEmpty()) {
            Message current = queue.poll();
            if (current instanceof DomainEvent event) {
                handleEvent(event, uow, queue, results);
            } else if (current instanceof Command command) {
                results.add(handleCommand(command, uow, queue));
            } else {
                throw new UnregisteredMessageException(current.getClass());
            }
        }
        return results;
    }

    private void handleEvent(DomainEvent event, UnitOfWork uow, Deque<Message> queue, List<Object> results) {
        String eventType = event.getClass().getSimpleName();
        for (MessageHandler<DomainEvent> handler : handlers.eventHandlers(event.getClass())) {
            try {
                log.debug("Handling event {} with handler {}", eventType, handler);
                Object result = handler.invoke(event, uow);
                queue.addAll(uow.collectBacklogs(Backlog.INTERNAL));
                if (result != null) {
                    results.add(result);
                }
                metrics.recordHandled(eventType, MessageBusMetrics.Outcome.SUCCESS);
            } catch (StopSentinel stop) {
                uow.rollback();
                log.error("Stopped handling event {} in {}: {}", eventType, handler, stop.getMessage());
                if (stop.getFallbackEvent() != null) {
                    queue.add(stop.getFallbackEvent());
                }
                if (stop.getResult() != null) {
                    results.add(stop.getResult());
                }
                metrics.recordHandled(eventType, MessageBusMetrics.Outcome.STOPPED);
                break;
            } catch (RuntimeException e) {
                uow.rollback();
                log.error("Exception handling event {} in {}", eventType, handler, e);
                metrics.recordHandled(eventType, MessageBusMetrics.Outcome.FAILURE);
            }
        }
    }

    private Object handleCommand(Command command, UnitOfWork uow, Deque<Message> queue) {
        String commandType = command.getClass().getSimpleName();
        MessageHandler<Command> handler = handlers.commandHandler(command.getClass());
        try {
            log.debug("Handling command {} with handler {}", commandType, handler);
            Object result = handler.invoke(command, uow);
            queue.addAll(uow.collectBacklogs(Backlog.INTERNAL));
            metrics.recordHandled(commandType, MessageBusMetrics.Outcome.SUCCESS);
            return result;
        } catch (RuntimeException e) {
            log.error("Exception handling command {}: {}", commandType, e.getMessage());
            metrics.recordHandled(commandType, MessageBusMetrics.Outcome.FAILURE);
            throw e;
        }
    }
}

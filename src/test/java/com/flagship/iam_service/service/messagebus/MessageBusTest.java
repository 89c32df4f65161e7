package com.flagship.iam_service.service.messagebus;

import com.flagship.iam_service.domain.commands.CreateGroupRole;
import com.flagship.iam_service.domain.commands.CreateUser;
import com.flagship.iam_service.domain.commands.MakePurchase;
import com.flagship.iam_service.domain.commands.RequestCreateGroup;
import com.flagship.iam_service.domain.iam.AccessPermission;
import com.flagship.iam_service.domain.iam.Group;
import com.flagship.iam_service.domain.iam.User;
import com.flagship.iam_service.eventsourcing.mapper.EventMapper;
import com.flagship.iam_service.eventsourcing.model.AggregateNotFoundException;
import com.flagship.iam_service.eventsourcing.model.DomainEvent;
import com.flagship.iam_service.observability.MessageBusMetrics;
import com.flagship.iam_service.observability.RequestContext;
import com.flagship.iam_service.service.handlers.IamHandlers;
import com.flagship.iam_service.service.unitofwork.UnitOfWork;
import com.flagship.iam_service.support.InMemoryApplicationRecorder;
import com.flagship.iam_service.support.InMemoryOutboxStore;
import com.flagship.iam_service.support.InMemoryUnitOfWork;
import com.flagship.iam_service.support.TestEventSourcing;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static com.flagship.iam_service.service.messagebus.MessageHandler.standalone;
import static com.flagship.iam_service.service.messagebus.MessageHandler.withUnitOfWork;
import static org.junit.jupiter.api.Assertions.*;

class MessageBusTest {

    private EventMapper mapper;
    private InMemoryApplicationRecorder recorder;
    private InMemoryOutboxStore outboxStore;
    private MessageBusMetrics metrics;
    private IamHandlers handlers;

    @BeforeEach
    void setUp() {
        mapper = TestEventSourcing.eventMapper();
        recorder = new InMemoryApplicationRecorder();
        outboxStore = new InMemoryOutboxStore();
        metrics = new MessageBusMetrics(new SimpleMeterRegistry());
        handlers = new IamHandlers();
    }

    private MessageBus busWith(HandlerRegistry registry) {
        return new MessageBus(() -> new InMemoryUnitOfWork(mapper, recorder, outboxStore), registry, metrics);
    }

    private HandlerRegistry.Builder commands() {
        return HandlerRegistry.builder()
                .command(CreateUser.class, withUnitOfWork("createUser", handlers::createUser))
                .command(MakePurchase.class, withUnitOfWork("makePurchase", handlers::makePurchase))
                .command(RequestCreateGroup.class, withUnitOfWork("requestCreateGroup", handlers::requestCreateGroup))
                .command(CreateGroupRole.class, withUnitOfWork("createGroupRole", handlers::createGroupRole));
    }

    private UUID createUser(MessageBus bus) {
        return (UUID) bus.handle(new CreateUser("Migo", "whatsoever@mail.com")).get(0);
    }

    private Group loadGroup(UUID groupId) {
        try (UnitOfWork work = new InMemoryUnitOfWork(mapper, recorder, outboxStore).begin()) {
            return work.groups().get(groupId);
        }
    }

    @Test
    @DisplayName("Command result is returned and its events are stored")
    void commandResult() {
        MessageBus bus = busWith(commands().build());

        UUID userId = createUser(bus);
        List<Object> results = bus.handle(MakePurchase.forUser(userId, AccessPermission.ACADEMIC));

        assertEquals(List.of(3), results);
        assertEquals(3, recorder.size());
        assertEquals(2, outboxStore.rows().size());
        assertEquals(2, metrics.handledCount("MakePurchase", MessageBusMetrics.Outcome.SUCCESS)
                + metrics.handledCount("CreateUser", MessageBusMetrics.Outcome.SUCCESS));
    }

    @Test
    @DisplayName("Internal event is handled after the command in the same run")
    void internalEventChain() {
        MessageBus bus = busWith(commands()
                .event(User.CreateGroupRequested.class, withUnitOfWork("createGroup", handlers::createGroup))
                .build());
        UUID userId = createUser(bus);

        List<Object> results = bus.handle(new RequestCreateGroup(userId, "research"));

        assertEquals(2, results.size());
        UUID groupId = (UUID) results.get(0);
        assertEquals(groupId, results.get(1));
        Group group = loadGroup(groupId);
        assertEquals(userId, group.getCreatedBy());
        assertEquals("research", group.getName());
        // only User.Created reached the outbox
        assertEquals(1, outboxStore.rows().size());
    }

    @Test
    @DisplayName("Failing event handler is logged and the next handler still runs")
    void eventHandlerFailureIsContained() {
        MessageBus bus = busWith(commands()
                .event(User.CreateGroupRequested.class, standalone("broken", event -> {
                    throw new IllegalStateException("boom");
                }))
                .event(User.CreateGroupRequested.class, withUnitOfWork("createGroup", handlers::createGroup))
                .build());
        UUID userId = createUser(bus);

        List<Object> results = bus.handle(new RequestCreateGroup(userId, "research"));

        assertEquals(2, results.size());
        assertNotNull(loadGroup((UUID) results.get(0)));
        assertEquals(1, metrics.handledCount("CreateGroupRequested", MessageBusMetrics.Outcome.FAILURE));
        assertEquals(1, metrics.handledCount("CreateGroupRequested", MessageBusMetrics.Outcome.SUCCESS));
    }

    @Test
    @DisplayName("StopSentinel skips remaining handlers and queues its fallback event")
    void stopSentinel() {
        AtomicInteger skipped = new AtomicInteger();
        MessageBus bus = busWith(commands()
                .event(User.CreateGroupRequested.class, standalone("quota", event -> {
                    throw new StopSentinel("group quota reached",
                            new GroupRequestRejected(event.userId(), 0, Instant.now(), "quota"), "stopped");
                }))
                .event(User.CreateGroupRequested.class, standalone("counter", event -> skipped.incrementAndGet()))
                .event(GroupRequestRejected.class, standalone("rejected", event -> "rejected:" + event.reason()))
                .build());
        UUID userId = createUser(bus);

        List<Object> results = bus.handle(new RequestCreateGroup(userId, "research"));

        assertEquals(3, results.size());
        assertEquals("stopped", results.get(1));
        assertEquals("rejected:quota", results.get(2));
        assertEquals(0, skipped.get());
        assertThrows(AggregateNotFoundException.class, () -> loadGroup((UUID) results.get(0)));
        assertEquals(1, metrics.handledCount("CreateGroupRequested", MessageBusMetrics.Outcome.STOPPED));
    }

    @Test
    @DisplayName("Command failure propagates and nothing is stored")
    void commandFailurePropagates() {
        MessageBus bus = busWith(commands().build());

        assertThrows(AggregateNotFoundException.class,
                () -> bus.handle(MakePurchase.forUser(UUID.randomUUID(), AccessPermission.GPU)));

        assertEquals(0, recorder.size());
        assertEquals(1, metrics.handledCount("MakePurchase", MessageBusMetrics.Outcome.FAILURE));
    }

    @Test
    @DisplayName("Message without a handler is rejected")
    void unregisteredMessage() {
        MessageBus bus = busWith(HandlerRegistry.builder().build());

        assertThrows(UnregisteredMessageException.class,
                () -> bus.handle(new CreateUser("Migo", "whatsoever@mail.com")));
        assertThrows(UnregisteredMessageException.class,
                () -> bus.handle(new GroupRequestRejected(UUID.randomUUID(), 0, Instant.now(), "x")));
    }

    @Test
    @DisplayName("Request id is in the logging context while handlers run and cleared after")
    void requestIdInContext() {
        List<String> seen = new ArrayList<>();
        MessageBus bus = busWith(HandlerRegistry.builder()
                .command(CreateUser.class, standalone("capture", command -> {
                    seen.add(MDC.get(RequestContext.REQUEST_ID_MDC_KEY));
                    return null;
                }))
                .build());

        bus.handle(new CreateUser("Migo", "whatsoever@mail.com"), "req-42");

        assertEquals(List.of("req-42"), seen);
        assertNull(MDC.get(RequestContext.REQUEST_ID_MDC_KEY));
        assertFalse(RequestContext.hasRequestId());
    }

    @Test
    @DisplayName("Standalone handlers get no unit of work")
    void standaloneHandler() {
        MessageHandler<CreateUser> handler = standalone("noop", command -> command.name());
        List<UnitOfWork> received = new ArrayList<>();
        MessageHandler<CreateUser> withUow = withUnitOfWork("capture", (command, uow) -> received.add(uow));
        InMemoryUnitOfWork uow = new InMemoryUnitOfWork(mapper, recorder, outboxStore);

        assertEquals("Migo", handler.invoke(new CreateUser("Migo", "a@b.c"), uow));
        withUow.invoke(new CreateUser("Migo", "a@b.c"), uow);

        assertFalse(handler.isUnitOfWorkRequired());
        assertSame(uow, received.get(0));
    }

    record GroupRequestRejected(UUID id, int version, Instant timestamp, String reason) implements DomainEvent {
    }
}

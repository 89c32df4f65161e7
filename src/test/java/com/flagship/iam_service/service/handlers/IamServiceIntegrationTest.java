package com.flagship.iam_service.service.handlers;

import com.flagship.iam_service.domain.commands.CreateGroupRole;
import com.flagship.iam_service.domain.commands.CreateUser;
import com.flagship.iam_service.domain.commands.ExpirePermission;
import com.flagship.iam_service.domain.commands.MakePurchase;
import com.flagship.iam_service.domain.commands.RequestCreateGroup;
import com.flagship.iam_service.domain.iam.AccessPermission;
import com.flagship.iam_service.domain.iam.Group;
import com.flagship.iam_service.domain.iam.GroupPermission;
import com.flagship.iam_service.domain.iam.RoleNameTakenException;
import com.flagship.iam_service.domain.iam.User;
import com.flagship.iam_service.eventsourcing.model.StoredEvent;
import com.flagship.iam_service.eventsourcing.recorder.ApplicationRecorder;
import com.flagship.iam_service.outbox.OutboxEvent;
import com.flagship.iam_service.outbox.OutboxMessage;
import com.flagship.iam_service.outbox.OutboxService;
import com.flagship.iam_service.service.messagebus.MessageBus;
import com.flagship.iam_service.service.unitofwork.UnitOfWork;
import com.flagship.iam_service.service.unitofwork.UnitOfWorkFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end runs of the message bus on the real unit of work, event store
 * and outbox (H2 in PostgreSQL mode).
 */
@SpringBootTest
class IamServiceIntegrationTest {

    @Autowired
    private MessageBus messageBus;

    @Autowired
    private UnitOfWorkFactory unitOfWorkFactory;

    @Autowired
    private ApplicationRecorder recorder;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM iam_event_store");
        jdbcTemplate.update("DELETE FROM iam_service_outbox");
    }

    private UUID createUser() {
        return (UUID) messageBus.handle(new CreateUser("Migo", "whatsoever@mail.com")).get(0);
    }

    private User loadUser(UUID id) {
        try (UnitOfWork work = unitOfWorkFactory.create().begin()) {
            return work.users().get(id);
        }
    }

    private Group loadGroup(UUID id) {
        try (UnitOfWork work = unitOfWorkFactory.create().begin()) {
            return work.groups().get(id);
        }
    }

    private static void printTestHeader(String title) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println(title);
        System.out.println("=".repeat(60));
    }

    @Nested
    @DisplayName("Users")
    class Users {

        @Test
        @DisplayName("Creating a user stores version 1 and one outbox row")
        void createUserWritesEventAndOutbox() {
            UUID userId = createUser();

            List<StoredEvent> stored = recorder.get(userId);
            assertEquals(1, stored.size());
            assertEquals(1, stored.get(0).getVersion());

            List<OutboxEvent> rows = outboxService.getEventsForAggregate(userId);
            assertEquals(1, rows.size());
            assertEquals("com.flagship.iam_service.domain.iam#User.Created", rows.get(0).getTopic());
            assertFalse(rows.get(0).isProcessed());
        }

        @Test
        @DisplayName("Purchase then expiry is replayed from the store")
        void purchaseAndExpire() {
            printTestHeader("Purchase ACADEMIC and PATENT, expire ACADEMIC");

            // Given
            UUID userId = createUser();

            // When
            List<Object> purchase = messageBus.handle(
                    MakePurchase.forUser(userId, AccessPermission.ACADEMIC, AccessPermission.PATENT));
            List<Object> expiry = messageBus.handle(
                    new ExpirePermission(userId, List.of(AccessPermission.ACADEMIC)));

            // Then
            assertEquals(List.of(3), purchase);
            assertEquals(List.of(4), expiry);
            User user = loadUser(userId);
            assertEquals(4, user.getVersion());
            assertTrue(user.hasPermission(AccessPermission.PATENT));
            assertFalse(user.hasPermission(AccessPermission.ACADEMIC));
            // Created, PermissionAssigned, PermissionExpired
            assertEquals(3, outboxService.getEventsForAggregate(userId).size());
        }

        @Test
        @DisplayName("Outbox rows decode to the events that were committed")
        void outboxDecodesEvents() {
            UUID userId = createUser();
            messageBus.handle(MakePurchase.forUser(userId, AccessPermission.GPU));

            List<OutboxMessage> messages = outboxService.findUnprocessed(10);

            assertEquals(2, messages.size());
            User.PermissionAssigned assigned = messages.stream()
                    .map(OutboxMessage::getEvent)
                    .filter(User.PermissionAssigned.class::isInstance)
                    .map(User.PermissionAssigned.class::cast)
                    .findFirst()
                    .orElseThrow();
            assertEquals(userId, assigned.id());
            assertEquals(3, assigned.version());
            assertEquals(List.of(AccessPermission.GPU), assigned.requestedAccess());
        }
    }

    @Nested
    @DisplayName("Groups")
    class Groups {

        @Test
        @DisplayName("Group request creates the group through the internal event")
        void requestCreateGroup() {
            printTestHeader("RequestCreateGroup -> CreateGroupRequested -> createGroup");

            UUID userId = createUser();

            List<Object> results = messageBus.handle(new RequestCreateGroup(userId, "research"));

            UUID groupId = (UUID) results.get(0);
            assertEquals(List.of(groupId, groupId), results);
            Group group = loadGroup(groupId);
            assertEquals(userId, group.getCreatedBy());
            assertEquals(2, loadUser(userId).getVersion());
            // neither the request nor the group creation is published
            assertEquals(1, outboxService.countUnprocessed());
            assertTrue(outboxService.getEventsForAggregate(groupId).isEmpty());
        }

        @Test
        @DisplayName("Group purchase grants the group and publishes the grant")
        void groupPurchase() {
            UUID userId = createUser();
            UUID groupId = (UUID) messageBus.handle(new RequestCreateGroup(userId, "research")).get(0);

            List<Object> results = messageBus.handle(MakePurchase.forGroup(groupId, AccessPermission.CONTRACT));

            assertEquals(List.of(3), results);
            assertTrue(loadGroup(groupId).hasPermission(AccessPermission.CONTRACT));
            List<OutboxEvent> rows = outboxService.getEventsForAggregate(groupId);
            assertEquals(1, rows.size());
            assertEquals("com.flagship.iam_service.domain.iam#Group.PermissionAssigned", rows.get(0).getTopic());
        }

        @Test
        @DisplayName("Duplicate role name fails and leaves the group unchanged")
        void duplicateRole() {
            UUID userId = createUser();
            UUID groupId = (UUID) messageBus.handle(new RequestCreateGroup(userId, "research")).get(0);
            messageBus.handle(new CreateGroupRole(groupId, "manager", List.of(GroupPermission.ADD_USER)));

            assertThrows(RoleNameTakenException.class, () -> messageBus.handle(
                    new CreateGroupRole(groupId, "manager", List.of(GroupPermission.ADMIN))));

            Group group = loadGroup(groupId);
            assertEquals(2, group.getVersion());
            assertTrue(group.findRole("manager").orElseThrow().hasGroupPermission(GroupPermission.ADD_USER));
            assertFalse(group.findRole("manager").orElseThrow().hasGroupPermission(GroupPermission.ADMIN));
        }
    }

    @Nested
    @DisplayName("Transactions")
    class Transactions {

        @Test
        @DisplayName("Unit of work closed without commit leaves no events and no outbox rows")
        void rollbackOnClose() {
            User user = User.create(new CreateUser("Migo", "whatsoever@mail.com"));

            try (UnitOfWork work = unitOfWorkFactory.create().begin()) {
                work.users().add(user);
            }

            assertTrue(recorder.get(user.getId()).isEmpty());
            assertEquals(0, outboxService.countUnprocessed());
        }

        @Test
        @DisplayName("Stale copy of a user cannot overwrite a newer version")
        void optimisticConflict() {
            UUID userId = createUser();
            User stale = loadUser(userId);
            messageBus.handle(MakePurchase.forUser(userId, AccessPermission.GPU));

            stale.execute(MakePurchase.forUser(userId, AccessPermission.LEGAL));
            try (UnitOfWork work = unitOfWorkFactory.create().begin()) {
                assertThrows(RuntimeException.class, () -> work.users().add(stale));
            }

            User current = loadUser(userId);
            assertEquals(3, current.getVersion());
            assertFalse(current.hasPermission(AccessPermission.LEGAL));
            assertEquals(2, outboxService.countUnprocessed());
        }
    }
}

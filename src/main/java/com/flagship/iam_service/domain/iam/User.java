package com.flagship.iam_service.domain.iam;

import com.flagship.iam_service.domain.commands.AssignPermission;
import com.flagship.iam_service.domain.commands.CreateUser;
import com.flagship.iam_service.domain.commands.ExpirePermission;
import com.flagship.iam_service.domain.commands.MakePurchase;
import com.flagship.iam_service.domain.commands.RequestCreateGroup;
import com.flagship.iam_service.eventsourcing.model.Aggregate;
import com.flagship.iam_service.eventsourcing.model.AggregateCreated;
import com.flagship.iam_service.eventsourcing.model.AggregateEvent;
import com.flagship.iam_service.eventsourcing.topic.TopicResolver;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A platform user and the access permissions they hold.
 *
 * Each command type has its own execute() overload. Commands only trigger
 * events; every field change happens in an event's apply().
 */
@Getter
public class User extends Aggregate {

    private final String name;
    private final String email;
    private boolean emailVerified;

    @Getter(AccessLevel.NONE)
    private final PermissionSet<AccessPermission> permissions;

    private User(Created created) {
        super(created);
        this.name = created.name();
        this.email = created.email();
        this.emailVerified = false;
        this.permissions = PermissionSet.of(AccessPermission.class, created.permissions());
    }

    public static User create(CreateUser command) {
        return Aggregate.create(new Created(
                UUID.randomUUID(),
                1,
                Instant.now(),
                TopicResolver.topicFor(User.class),
                command.name(),
                command.email(),
                AccessPermission.DEFAULT.getValue()
        ));
    }

    /**
     * Records the purchase; an individual purchase is granted right away.
     */
    public void execute(MakePurchase command) {
        trigger((id, version, timestamp) ->
                new PurchaseMade(id, version, timestamp, command.requestedAccess()));
        if (!command.groupPurchase()) {
            execute(command.toAssignPermission());
        }
    }

    public void execute(AssignPermission command) {
        trigger((id, version, timestamp) ->
                new PermissionAssigned(id, version, timestamp, command.requestedAccess()));
    }

    public void execute(ExpirePermission command) {
        trigger((id, version, timestamp) ->
                new PermissionExpired(id, version, timestamp, command.expiredPermissions()));
    }

    /**
     * @return the id reserved for the requested group
     */
    public UUID execute(RequestCreateGroup command) {
        UUID groupId = UUID.randomUUID();
        trigger((id, version, timestamp) ->
                new CreateGroupRequested(id, version, timestamp, command.name(), id, groupId));
        return groupId;
    }

    public boolean hasPermission(AccessPermission... requested) {
        return permissions.has(requested);
    }

    public Set<AccessPermission> listPermissions() {
        return permissions.list();
    }

    public int getPermissions() {
        return permissions.getMask();
    }

    // ==================== Events ====================

    public interface Event extends AggregateEvent<User> {
        @Override
        default Class<User> aggregateType() {
            return User.class;
        }
    }

    public record Created(UUID id, int version, Instant timestamp, String topic,
                          String name, String email, int permissions)
            implements AggregateCreated<User>, Event {

        @Override
        public User construct() {
            return new User(this);
        }

        @Override
        public boolean externallyNotifiable() {
            return true;
        }
    }

    public record PurchaseMade(UUID id, int version, Instant timestamp,
                               List<AccessPermission> requestedAccess) implements Event {

        public PurchaseMade {
            requestedAccess = requestedAccess == null ? List.of() : List.copyOf(requestedAccess);
        }
    }

    public record PermissionAssigned(UUID id, int version, Instant timestamp,
                                     List<AccessPermission> requestedAccess) implements Event {

        public PermissionAssigned {
            requestedAccess = requestedAccess == null ? List.of() : List.copyOf(requestedAccess);
        }

        @Override
        public void apply(User user) {
            user.permissions.add(requestedAccess);
        }

        @Override
        public boolean externallyNotifiable() {
            return true;
        }
    }

    public record PermissionExpired(UUID id, int version, Instant timestamp,
                                    List<AccessPermission> expiredPermissions) implements Event {

        public PermissionExpired {
            expiredPermissions = expiredPermissions == null ? List.of() : List.copyOf(expiredPermissions);
        }

        @Override
        public void apply(User user) {
            user.permissions.remove(expiredPermissions);
        }

        @Override
        public boolean externallyNotifiable() {
            return true;
        }
    }

    /**
     * Handled inside the service: the group is created by the event handler.
     */
    public record CreateGroupRequested(UUID id, int version, Instant timestamp,
                                       String name, UUID userId, UUID groupId) implements Event {

        @Override
        public boolean internallyNotifiable() {
            return true;
        }
    }

    public static List<Class<?>> eventTypes() {
        return Arrays.asList(
                Created.class,
                PurchaseMade.class,
                PermissionAssigned.class,
                PermissionExpired.class,
                CreateGroupRequested.class
        );
    }
}

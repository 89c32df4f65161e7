package com.flagship.iam_service.domain.iam;

import com.flagship.iam_service.domain.commands.AssignPermission;
import com.flagship.iam_service.domain.commands.CreateGroup;
import com.flagship.iam_service.domain.commands.CreateGroupRole;
import com.flagship.iam_service.domain.commands.MakePurchase;
import com.flagship.iam_service.eventsourcing.model.Aggregate;
import com.flagship.iam_service.eventsourcing.model.AggregateCreated;
import com.flagship.iam_service.eventsourcing.model.AggregateEvent;
import com.flagship.iam_service.eventsourcing.topic.TopicResolver;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A group of users sharing purchased access permissions.
 *
 * Every group starts with a "default" role and an "owner" role holding all
 * group permissions. Purchases on a group must be flagged as group purchases.
 */
@Getter
public class Group extends Aggregate {

    public static final String DEFAULT_ROLE = "default";
    public static final String OWNER_ROLE = "owner";

    private final UUID createdBy;
    private final String name;

    @Getter(AccessLevel.NONE)
    private final PermissionSet<AccessPermission> permissions;

    @Getter(AccessLevel.NONE)
    private final PermissionSet<GroupPermission> groupPermissions;

    @Getter(AccessLevel.NONE)
    private final Map<String, GroupRole> roles = new LinkedHashMap<>();

    private Group(Created created) {
        super(created);
        this.createdBy = created.createdBy();
        this.name = created.name();
        this.permissions = PermissionSet.of(AccessPermission.class, AccessPermission.DEFAULT.getValue());
        this.groupPermissions = PermissionSet.of(GroupPermission.class, GroupPermission.DEFAULT.getValue());
        addRole(GroupRole.create(getId(), DEFAULT_ROLE, GroupPermission.DEFAULT.getValue()));
        addRole(GroupRole.create(getId(), OWNER_ROLE,
                PermissionSet.maskOf(EnumSet.allOf(GroupPermission.class))));
    }

    public static Group create(CreateGroup command) {
        return Aggregate.create(new Created(
                command.groupId(),
                1,
                Instant.now(),
                TopicResolver.topicFor(Group.class),
                command.name(),
                command.userId()
        ));
    }

    /**
     * @throws InvalidOperationException if the purchase is not flagged as a group purchase
     */
    public void execute(MakePurchase command) {
        if (!command.groupPurchase()) {
            throw new InvalidOperationException("Purchases on a group must be group purchases");
        }
        trigger((id, version, timestamp) ->
                new PurchaseMade(id, version, timestamp, command.requestedAccess()));
        execute(command.toAssignPermission());
    }

    public void execute(AssignPermission command) {
        trigger((id, version, timestamp) ->
                new PermissionAssigned(id, version, timestamp, command.requestedAccess()));
    }

    /**
     * @throws RoleNameTakenException if the group already has a role with that name
     */
    public void execute(CreateGroupRole command) {
        if (roles.containsKey(command.roleName())) {
            throw new RoleNameTakenException(getId(), command.roleName());
        }
        trigger((id, version, timestamp) -> new GroupRoleCreated(
                id, version, timestamp, command.roleName(), command.groupPermissions(), id));
    }

    public boolean hasPermission(AccessPermission... requested) {
        return permissions.has(requested);
    }

    public int getPermissions() {
        return permissions.getMask();
    }

    public boolean hasGroupPermission(GroupPermission... requested) {
        return groupPermissions.has(requested);
    }

    public int getGroupPermissions() {
        return groupPermissions.getMask();
    }

    public List<GroupRole> getRoles() {
        return List.copyOf(roles.values());
    }

    public Optional<GroupRole> findRole(String roleName) {
        return Optional.ofNullable(roles.get(roleName));
    }

    private void addRole(GroupRole role) {
        roles.putIfAbsent(role.getName(), role);
    }

    // ==================== Events ====================

    public interface Event extends AggregateEvent<Group> {
        @Override
        default Class<Group> aggregateType() {
            return Group.class;
        }
    }

    public record Created(UUID id, int version, Instant timestamp, String topic,
                          String name, UUID createdBy)
            implements AggregateCreated<Group>, Event {

        @Override
        public Group construct() {
            return new Group(this);
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
        public void apply(Group group) {
            group.permissions.add(requestedAccess);
        }

        @Override
        public boolean externallyNotifiable() {
            return true;
        }
    }

    public record GroupRoleCreated(UUID id, int version, Instant timestamp, String roleName,
                                   List<GroupPermission> groupPermissions, UUID groupId) implements Event {

        public GroupRoleCreated {
            groupPermissions = groupPermissions == null ? List.of() : List.copyOf(groupPermissions);
        }

        @Override
        public void apply(Group group) {
            group.addRole(GroupRole.create(groupId, roleName, PermissionSet.sumOf(groupPermissions)));
        }
    }

    public static List<Class<?>> eventTypes() {
        return Arrays.asList(
                Created.class,
                PurchaseMade.class,
                PermissionAssigned.class,
                GroupRoleCreated.class
        );
    }
}

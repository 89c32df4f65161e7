package com.flagship.iam_service.domain.commands;

import com.flagship.iam_service.domain.iam.AccessPermission;
import com.flagship.iam_service.eventsourcing.model.Command;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Purchase of access permissions by a user or, when groupPurchase is set, by a group.
 */
public record MakePurchase(UUID aggregateId, List<AccessPermission> requestedAccess,
                           boolean groupPurchase) implements Command {

    public MakePurchase {
        Objects.requireNonNull(aggregateId, "aggregateId");
        requestedAccess = List.copyOf(requestedAccess);
    }

    public static MakePurchase forUser(UUID userId, AccessPermission... requestedAccess) {
        return new MakePurchase(userId, List.of(requestedAccess), false);
    }

    public static MakePurchase forGroup(UUID groupId, AccessPermission... requestedAccess) {
        return new MakePurchase(groupId, List.of(requestedAccess), true);
    }

    /**
     * The permission grant that follows a completed purchase.
     */
    public AssignPermission toAssignPermission() {
        return new AssignPermission(aggregateId, requestedAccess);
    }
}

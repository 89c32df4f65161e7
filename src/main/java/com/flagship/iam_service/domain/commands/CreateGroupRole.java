package com.flagship.iam_service.domain.commands;

import com.flagship.iam_service.domain.iam.GroupPermission;
import com.flagship.iam_service.eventsourcing.model.Command;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

public record CreateGroupRole(UUID groupId, String roleName, List<GroupPermission> groupPermissions)
        implements Command {

    public CreateGroupRole {
        Objects.requireNonNull(groupId, "groupId");
        if (roleName == null || roleName.isBlank()) {
            throw new IllegalArgumentException("Role name is required");
        }
        groupPermissions = List.copyOf(groupPermissions);
    }
}

package com.flagship.iam_service.domain.commands;

import com.flagship.iam_service.domain.iam.AccessPermission;
import com.flagship.iam_service.eventsourcing.model.Command;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

public record ExpirePermission(UUID userId, List<AccessPermission> expiredPermissions) implements Command {

    public ExpirePermission {
        Objects.requireNonNull(userId, "userId");
        expiredPermissions = List.copyOf(expiredPermissions);
    }
}

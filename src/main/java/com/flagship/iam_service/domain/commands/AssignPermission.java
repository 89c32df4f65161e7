package com.flagship.iam_service.domain.commands;

import com.flagship.iam_service.domain.iam.AccessPermission;
import com.flagship.iam_service.eventsourcing.model.Command;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

public record AssignPermission(UUID aggregateId, List<AccessPermission> requestedAccess) implements Command {

    public AssignPermission {
        Objects.requireNonNull(aggregateId, "aggregateId");
        requestedAccess = List.copyOf(requestedAccess);
    }
}

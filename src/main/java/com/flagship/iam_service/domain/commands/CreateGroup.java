package com.flagship.iam_service.domain.commands;

import com.flagship.iam_service.eventsourcing.model.Command;

import java.util.Objects;
import java.util.UUID;

public record CreateGroup(String name, UUID userId, UUID groupId) implements Command {

    public CreateGroup {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(groupId, "groupId");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Group name is required");
        }
    }
}

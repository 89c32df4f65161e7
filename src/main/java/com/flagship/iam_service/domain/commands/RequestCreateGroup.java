package com.flagship.iam_service.domain.commands;

import com.flagship.iam_service.eventsourcing.model.Command;

import java.util.Objects;
import java.util.UUID;

/**
 * A user asks for a new group. The group itself is created by the handler
 * of the resulting internal event.
 */
public record RequestCreateGroup(UUID userId, String name) implements Command {

    public RequestCreateGroup {
        Objects.requireNonNull(userId, "userId");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Group name is required");
        }
    }
}

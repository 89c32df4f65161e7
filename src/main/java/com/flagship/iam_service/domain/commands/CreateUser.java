package com.flagship.iam_service.domain.commands;

import com.flagship.iam_service.eventsourcing.model.Command;

public record CreateUser(String name, String email) implements Command {

    public CreateUser {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("User name is required");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("User email is required");
        }
    }
}

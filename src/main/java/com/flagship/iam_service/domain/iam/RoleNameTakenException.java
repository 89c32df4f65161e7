package com.flagship.iam_service.domain.iam;

import java.util.UUID;

public class RoleNameTakenException extends RuntimeException {

    public RoleNameTakenException(UUID groupId, String roleName) {
        super(String.format("Role name '%s' is already taken in group %s", roleName, groupId));
    }
}

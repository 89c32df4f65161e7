package com.flagship.iam_service.domain.iam;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Management rights inside a group, held by group roles as a bitmask.
 */
@Getter
@RequiredArgsConstructor
public enum GroupPermission implements Permission {
    DEFAULT(1),
    ADD_USER(1 << 1),
    REMOVE_USER(1 << 2),
    GRANT_ACCESS_PERMISSION(1 << 3),
    REVOKE_ACCESS_PERMISSION(1 << 4),
    ADMIN(1 << 5);

    private final int value;

    public static GroupPermission fromValue(int value) {
        for (GroupPermission permission : values()) {
            if (permission.value == value) {
                return permission;
            }
        }
        throw new IllegalArgumentException("Unknown group permission: " + value);
    }
}

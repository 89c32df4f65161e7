package com.flagship.iam_service.domain.iam;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Access to product features, held by users and groups as a bitmask.
 */
@Getter
@RequiredArgsConstructor
public enum AccessPermission implements Permission {
    DEFAULT(0),
    PATENT(1),
    ELEC(1 << 1),
    CLAIMS(1 << 2),
    LEGAL(1 << 3),
    CHEM(1 << 4),
    CONTRACT(1 << 5),
    ACADEMIC(1 << 6),
    STATUTE(1 << 7),
    GENERAL(1 << 8),
    DOCS(1 << 9),
    PDF(1 << 10),
    PROJECT(1 << 11),
    GPU(1 << 12),
    GPU_FOR_DOC(1 << 13);

    private final int value;

    public static AccessPermission fromValue(int value) {
        for (AccessPermission permission : values()) {
            if (permission.value == value) {
                return permission;
            }
        }
        throw new IllegalArgumentException("Unknown access permission: " + value);
    }
}

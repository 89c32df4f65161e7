package com.flagship.iam_service.domain.iam;

import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Set;
import java.util.UUID;

/**
 * A named role inside a group.
 *
 * The id is derived from group id and role name, so replaying a group's
 * log always produces the same role ids.
 */
@Value
public class GroupRole {
    UUID id;
    String name;
    UUID groupId;
    int permissions;        // AccessPermission mask
    int groupPermissions;   // GroupPermission mask

    public static GroupRole create(UUID groupId, String name, int groupPermissions) {
        UUID id = UUID.nameUUIDFromBytes((groupId + ":" + name).getBytes(StandardCharsets.UTF_8));
        return new GroupRole(id, name, groupId, AccessPermission.DEFAULT.getValue(), groupPermissions);
    }

    public boolean hasGroupPermission(GroupPermission... requested) {
        return PermissionSet.holds(groupPermissions, Arrays.asList(requested));
    }

    public Set<GroupPermission> listGroupPermissions() {
        return PermissionSet.of(GroupPermission.class, groupPermissions).list();
    }
}

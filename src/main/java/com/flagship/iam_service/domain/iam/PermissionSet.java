package com.flagship.iam_service.domain.iam;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Mutable bitmask over one permission enum.
 *
 * has() is true only when every requested bit is set, so the zero-valued
 * DEFAULT permission is always held.
 */
public final class PermissionSet<P extends Enum<P> & Permission> {

    private final Class<P> type;
    private int mask;

    private PermissionSet(Class<P> type, int mask) {
        this.type = type;
        this.mask = mask;
    }

    public static <P extends Enum<P> & Permission> PermissionSet<P> of(Class<P> type, int mask) {
        return new PermissionSet<>(type, mask);
    }

    public static int maskOf(Collection<? extends Permission> permissions) {
        int mask = 0;
        for (Permission permission : permissions) {
            mask |= permission.getValue();
        }
        return mask;
    }

    /**
     * Arithmetic sum of the permission values. Unlike maskOf, a permission
     * listed twice is counted twice.
     */
    public static int sumOf(Collection<? extends Permission> permissions) {
        int sum = 0;
        for (Permission permission : permissions) {
            sum += permission.getValue();
        }
        return sum;
    }

    public static boolean holds(int mask, Collection<? extends Permission> permissions) {
        for (Permission permission : permissions) {
            if ((mask & permission.getValue()) != permission.getValue()) {
                return false;
            }
        }
        return true;
    }

    public void add(Collection<P> permissions) {
        for (P permission : permissions) {
            if (!has(permission)) {
                mask |= permission.getValue();
            }
        }
    }

    public void remove(Collection<P> permissions) {
        for (P permission : permissions) {
            if (has(permission)) {
                mask &= ~permission.getValue();
            }
        }
    }

    @SafeVarargs
    public final boolean has(P... permissions) {
        return has(Arrays.asList(permissions));
    }

    public boolean has(Collection<P> permissions) {
        return holds(mask, permissions);
    }

    public Set<P> list() {
        Set<P> held = EnumSet.noneOf(type);
        for (P permission : type.getEnumConstants()) {
            if (has(permission)) {
                held.add(permission);
            }
        }
        return held;
    }

    public int getMask() {
        return mask;
    }
}

package com.flagship.iam_service.domain.iam;

import com.flagship.iam_service.eventsourcing.transcoder.JsonTranscoder;

/**
 * Registers the permission enums with a transcoder, written as their bit values.
 */
public final class IamTranscodings {

    private IamTranscodings() {
    }

    public static JsonTranscoder registerAll(JsonTranscoder transcoder) {
        transcoder.register("access_permission", AccessPermission.class,
                AccessPermission::getValue,
                data -> AccessPermission.fromValue(((Number) data).intValue()));
        transcoder.register("group_permission", GroupPermission.class,
                GroupPermission::getValue,
                data -> GroupPermission.fromValue(((Number) data).intValue()));
        return transcoder;
    }
}

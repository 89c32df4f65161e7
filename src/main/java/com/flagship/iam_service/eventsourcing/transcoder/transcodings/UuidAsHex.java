package com.flagship.iam_service.eventsourcing.transcoder.transcodings;

import com.flagship.iam_service.eventsourcing.transcoder.Transcoding;

import java.util.UUID;

/**
 * UUID as 32 lowercase hex digits without dashes.
 */
public class UuidAsHex implements Transcoding<UUID> {

    @Override
    public Class<UUID> type() {
        return UUID.class;
    }

    @Override
    public String name() {
        return "uuid_hex";
    }

    @Override
    public Object encode(UUID value) {
        return toHex(value);
    }

    @Override
    public UUID decode(Object data) {
        return fromHex((String) data);
    }

    static String toHex(UUID value) {
        return value.toString().replace("-", "");
    }

    static UUID fromHex(String hex) {
        if (hex.length() == 36) {
            return UUID.fromString(hex);
        }
        if (hex.length() != 32) {
            throw new IllegalArgumentException("Invalid UUID hex: " + hex);
        }
        return new UUID(
                Long.parseUnsignedLong(hex.substring(0, 16), 16),
                Long.parseUnsignedLong(hex.substring(16), 16));
    }
}

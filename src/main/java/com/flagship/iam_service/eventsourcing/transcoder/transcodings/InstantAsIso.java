package com.flagship.iam_service.eventsourcing.transcoder.transcodings;

import com.flagship.iam_service.eventsourcing.transcoder.Transcoding;

import java.time.Instant;

/**
 * Instant as an ISO-8601 string.
 */
public class InstantAsIso implements Transcoding<Instant> {

    @Override
    public Class<Instant> type() {
        return Instant.class;
    }

    @Override
    public String name() {
        return "datetime_iso";
    }

    @Override
    public Object encode(Instant value) {
        return value.toString();
    }

    @Override
    public Instant decode(Object data) {
        return Instant.parse((String) data);
    }
}

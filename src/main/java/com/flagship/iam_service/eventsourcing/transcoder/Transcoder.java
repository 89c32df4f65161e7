package com.flagship.iam_service.eventsourcing.transcoder;

/**
 * Converts trees of primitives, lists, maps and registered custom types
 * into bytes and back.
 */
public interface Transcoder {

    /**
     * Adds a codec for a custom type. A transcoding registered under an
     * existing name replaces the previous one.
     */
    void register(Transcoding<?> transcoding);

    byte[] encode(Object value);

    Object decode(byte[] data);
}

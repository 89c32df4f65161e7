package com.flagship.iam_service.eventsourcing.transcoder;

/**
 * Codec for one custom type.
 *
 * encode() must return something the transcoder can serialize itself
 * (a primitive, list, map or another registered type). decode() receives
 * that value after it has been decoded.
 *
 * @param <T> the custom type
 */
public interface Transcoding<T> {

    Class<T> type();

    /**
     * Short tag written next to the encoded data.
     */
    String name();

    Object encode(T value);

    T decode(Object data);
}

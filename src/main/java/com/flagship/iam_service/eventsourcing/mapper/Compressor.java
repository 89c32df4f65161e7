package com.flagship.iam_service.eventsourcing.mapper;

/**
 * Optional compression step applied to stored event state.
 */
public interface Compressor {

    byte[] compress(byte[] data);

    byte[] decompress(byte[] data);
}

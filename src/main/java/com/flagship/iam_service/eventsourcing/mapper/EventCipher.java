package com.flagship.iam_service.eventsourcing.mapper;

/**
 * Optional encryption step applied to stored event state, after compression.
 */
public interface EventCipher {

    byte[] encrypt(byte[] plaintext);

    byte[] decrypt(byte[] ciphertext);
}

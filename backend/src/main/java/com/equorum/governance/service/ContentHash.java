package com.equorum.governance.service;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Key of a timelock entry: lowercase hex SHA-256 over the length-prefixed
 * UTF-8 target, decimal value, signature and calldata, followed by the
 * 8-byte epoch second of the eta.
 */
public final class ContentHash {

    private ContentHash() {}

    public static String of(String target, BigInteger value, String signature, String calldata, Instant eta) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        update(digest, target);
        update(digest, value.toString());
        update(digest, signature);
        update(digest, calldata);
        digest.update(ByteBuffer.allocate(Long.BYTES).putLong(eta.getEpochSecond()).array());
        return HexFormat.of().formatHex(digest.digest());
    }

    private static void update(MessageDigest digest, String field) {
        byte[] bytes = field.getBytes(StandardCharsets.UTF_8);
        digest.update(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        digest.update(bytes);
    }
}

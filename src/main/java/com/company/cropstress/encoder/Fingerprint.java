package com.company.cropstress.encoder;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 over parameter bit patterns, so any weight change yields a new identifier.
 */
final class Fingerprint {

    private final MessageDigest digest;
    private final ByteBuffer buffer = ByteBuffer.allocate(Double.BYTES);

    Fingerprint() {
        try {
            this.digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    void update(String text) {
        digest.update(text.getBytes(StandardCharsets.UTF_8));
    }

    void update(byte[] bytes) {
        digest.update(bytes);
    }

    void update(double[] values) {
        for (double v : values) {
            buffer.clear();
            buffer.putLong(Double.doubleToLongBits(v));
            digest.update(buffer.array(), 0, Double.BYTES);
        }
    }

    void update(float[] values) {
        for (float v : values) {
            buffer.clear();
            buffer.putInt(Float.floatToIntBits(v));
            digest.update(buffer.array(), 0, Float.BYTES);
        }
    }

    String hex() {
        return "sha256:" + HexFormat.of().formatHex(digest.digest());
    }
}

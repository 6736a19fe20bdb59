package com.contract.extractor.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * Fixed-width content hash identifying everything that affects extraction output for one
 * method. Two bodies with equal fingerprints must yield equal contract sets.
 */
public final class Fingerprint {

    public static final int LENGTH = 32;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;

    private Fingerprint(byte[] bytes) {
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException("Fingerprint must be " + LENGTH + " bytes, got " + bytes.length);
        }
        this.bytes = bytes.clone();
    }

    public static Fingerprint of(byte[] bytes) {
        return new Fingerprint(bytes);
    }

    public static Fingerprint fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Fingerprint hex must be " + (LENGTH * 2) + " characters: " + hex);
        }
        byte[] bytes = new byte[LENGTH];
        for (int i = 0; i < LENGTH; i++) {
            int high = Character.digit(hex.charAt(i * 2), 16);
            int low = Character.digit(hex.charAt(i * 2 + 1), 16);
            if (high < 0 || low < 0) {
                throw new IllegalArgumentException("Not a hex fingerprint: " + hex);
            }
            bytes[i] = (byte) ((high << 4) | low);
        }
        return new Fingerprint(bytes);
    }

    /**
     * SHA-256 over the given parts, each prefixed by its length so that part boundaries count.
     * Helper for front ends; the extraction core never fingerprints bodies itself.
     */
    public static Fingerprint sha256(byte[]... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (byte[] part : parts) {
                int length = part.length;
                digest.update(new byte[] {
                        (byte) (length >>> 24), (byte) (length >>> 16), (byte) (length >>> 8), (byte) length
                });
                digest.update(part);
            }
            return new Fingerprint(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static Fingerprint sha256(String... parts) {
        byte[][] encoded = new byte[parts.length][];
        for (int i = 0; i < parts.length; i++) {
            encoded[i] = parts[i].getBytes(StandardCharsets.UTF_8);
        }
        return sha256(encoded);
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        char[] out = new char[LENGTH * 2];
        for (int i = 0; i < LENGTH; i++) {
            out[i * 2] = HEX[(bytes[i] >> 4) & 0x0f];
            out[i * 2 + 1] = HEX[bytes[i] & 0x0f];
        }
        return new String(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fingerprint)) return false;
        return Arrays.equals(bytes, ((Fingerprint) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex().substring(0, 12);
    }
}

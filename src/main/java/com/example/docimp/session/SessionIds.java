package com.example.docimp.session;

import java.math.BigInteger;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Session identifiers: 22-character base57 encodings of a random UUID. Canonical UUID
 * strings written by older versions remain valid.
 */
public final class SessionIds {
    public static final String ALPHABET = "23456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
    public static final int ENCODED_LENGTH = 22;

    private static final BigInteger BASE = BigInteger.valueOf(ALPHABET.length());
    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private SessionIds() {
    }

    public static String newId() {
        return encode(UUID.randomUUID());
    }

    /**
     * Encodes the 128 bits of {@code uuid}, most significant digit first, padded to 22
     * characters.
     */
    public static String encode(UUID uuid) {
        BigInteger value = new BigInteger(1, toBytes(uuid));
        StringBuilder digits = new StringBuilder(ENCODED_LENGTH);
        while (value.signum() > 0) {
            BigInteger[] division = value.divideAndRemainder(BASE);
            digits.append(ALPHABET.charAt(division[1].intValue()));
            value = division[0];
        }
        while (digits.length() < ENCODED_LENGTH) {
            digits.append(ALPHABET.charAt(0));
        }
        return digits.reverse().toString();
    }

    public static UUID decode(String encoded) {
        BigInteger value = BigInteger.ZERO;
        for (int i = 0; i < encoded.length(); i++) {
            int digit = ALPHABET.indexOf(encoded.charAt(i));
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid character '" + encoded.charAt(i) + "' in session id");
            }
            value = value.multiply(BASE).add(BigInteger.valueOf(digit));
        }
        if (value.bitLength() > 128) {
            throw new IllegalArgumentException("Session id out of range: " + encoded);
        }
        long most = value.shiftRight(64).longValue();
        long least = value.longValue();
        return new UUID(most, least);
    }

    public static boolean isValid(String id) {
        if (id == null) {
            return false;
        }
        if (UUID_PATTERN.matcher(id).matches()) {
            return true;
        }
        if (id.length() != ENCODED_LENGTH) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            if (ALPHABET.indexOf(id.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    private static byte[] toBytes(UUID uuid) {
        byte[] bytes = new byte[16];
        long most = uuid.getMostSignificantBits();
        long least = uuid.getLeastSignificantBits();
        for (int i = 0; i < 8; i++) {
            bytes[i] = (byte) (most >>> (56 - 8 * i));
            bytes[8 + i] = (byte) (least >>> (56 - 8 * i));
        }
        return bytes;
    }
}

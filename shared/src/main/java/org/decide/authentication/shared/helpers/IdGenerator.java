package org.decide.authentication.shared.helpers;

import org.apache.commons.codec.binary.Hex;

import java.security.SecureRandom;

public class IdGenerator {
    private static final int ENTROPY_BYTES = 20;
    private static final SecureRandom RANDOM = new SecureRandom();

    private IdGenerator() {}

    /** 40 lowercase hex characters, the shape of a session token key. */
    public static String generateHex() {
        return Hex.encodeHexString(randomBytes());
    }

    public static byte[] randomBytes() {
        byte[] buffer = new byte[ENTROPY_BYTES];
        RANDOM.nextBytes(buffer);
        return buffer;
    }
}

package org.decide.authentication.sharedtest.helper;

import org.apache.commons.codec.binary.Base32;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/** Plays the part of an authenticator app holding a shared secret. */
public class AuthAppStub {
    private static final int CODE_DIGITS = 6;
    private static final long TIME_WINDOW_IN_MILLISECONDS = TimeUnit.SECONDS.toMillis(30);

    // secret must parse as valid base32
    public String getAuthAppOneTimeCode(String secret) {
        return getAuthAppOneTimeCode(secret, Instant.now().toEpochMilli());
    }

    public String getAuthAppOneTimeCode(String secret, long timeInMillis) {
        int code =
                getCodeAsInt(
                        decodeBase32Secret(secret), timeInMillis / TIME_WINDOW_IN_MILLISECONDS);
        return String.format(Locale.ROOT, "%0" + CODE_DIGITS + "d", code);
    }

    /** A code from {@code offset} windows away from {@code timeInMillis}. */
    public String getAuthAppOneTimeCode(String secret, long timeInMillis, int offset) {
        return getAuthAppOneTimeCode(secret, timeInMillis + offset * TIME_WINDOW_IN_MILLISECONDS);
    }

    int getCodeAsInt(byte[] secret, long window) {
        byte[] data = new byte[8];
        long value = window;
        for (int i = 8; i-- > 0; value >>>= 8) {
            data[i] = (byte) value;
        }

        try {
            Mac mac = Mac.getInstance("HmacSHA1");
            mac.init(new SecretKeySpec(secret, "HmacSHA1"));
            byte[] hash = mac.doFinal(data);

            int offset = hash[hash.length - 1] & 0xF;
            long truncatedHash = 0;
            for (int i = 0; i < 4; ++i) {
                truncatedHash <<= 8;
                truncatedHash |= (hash[offset + i] & 0xFF);
            }
            truncatedHash &= 0x7FFFFFFF;
            truncatedHash %= (int) Math.pow(10, CODE_DIGITS);
            return (int) truncatedHash;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA1 is unavailable", e);
        }
    }

    public byte[] decodeBase32Secret(String secret) {
        return new Base32().decode(secret.toUpperCase(Locale.ROOT));
    }
}

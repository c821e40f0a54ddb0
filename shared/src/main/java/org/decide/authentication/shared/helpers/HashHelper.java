package org.decide.authentication.shared.helpers;

import org.apache.commons.codec.binary.Hex;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class HashHelper {

    private HashHelper() {}

    public static String hashSha256String(String value) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
        return Hex.encodeHexString(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
    }
}

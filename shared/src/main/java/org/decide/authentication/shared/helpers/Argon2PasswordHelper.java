package org.decide.authentication.shared.helpers;

import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;

/**
 * Argon2id password hashing in the PHC string format, {@code
 * $argon2id$v=19$m=15360,t=2,p=1$<salt>$<hash>}.
 */
public class Argon2PasswordHelper {

    private static final int MEMORY_IN_KIBIBYTES = 15360;
    private static final int PARALLELISM = 1;
    private static final int ITERATIONS = 2;
    private static final int SALT_LENGTH = 16;
    private static final int HASH_LENGTH = 32;
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder BASE64_ENCODER = Base64.getEncoder().withoutPadding();
    private static final Base64.Decoder BASE64_DECODER = Base64.getDecoder();
    // Hash of a random password nobody holds; checked in place of a missing account's hash.
    private static final String UNMATCHABLE_HASH = hashPassword(IdGenerator.generateHex());

    private Argon2PasswordHelper() {}

    public static String hashPassword(String rawPassword) {
        byte[] salt = new byte[SALT_LENGTH];
        RANDOM.nextBytes(salt);

        var parameters =
                new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
                        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
                        .withIterations(ITERATIONS)
                        .withSalt(salt)
                        .withMemoryAsKB(MEMORY_IN_KIBIBYTES)
                        .withParallelism(PARALLELISM)
                        .build();

        byte[] hash = new byte[HASH_LENGTH];
        var generator = new Argon2BytesGenerator();
        generator.init(parameters);
        generator.generateBytes(rawPassword.toCharArray(), hash);

        return "$argon2id$v="
                + parameters.getVersion()
                + "$m="
                + parameters.getMemory()
                + ",t="
                + parameters.getIterations()
                + ",p="
                + parameters.getLanes()
                + "$"
                + BASE64_ENCODER.encodeToString(salt)
                + "$"
                + BASE64_ENCODER.encodeToString(hash);
    }

    /**
     * Runs a full Argon2 check whether or not there is a stored hash, so a missing account costs
     * as much as a wrong password.
     */
    public static boolean matches(String rawPassword, Optional<String> encodedPassword) {
        boolean matched = matches(rawPassword, encodedPassword.orElse(UNMATCHABLE_HASH));
        return matched && encodedPassword.isPresent();
    }

    public static boolean matches(String rawPassword, String encodedPassword) {
        if (rawPassword == null || encodedPassword == null) {
            return false;
        }
        String[] parts = encodedPassword.split("\\$");
        if (parts.length != 6 || !"argon2id".equals(parts[1])) {
            return false;
        }
        try {
            var builder = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id);
            if (!parts[2].startsWith("v=")) {
                return false;
            }
            builder.withVersion(Integer.parseInt(parts[2].substring(2)));

            String[] performanceParams = parts[3].split(",");
            if (performanceParams.length != 3
                    || !performanceParams[0].startsWith("m=")
                    || !performanceParams[1].startsWith("t=")
                    || !performanceParams[2].startsWith("p=")) {
                return false;
            }
            builder.withMemoryAsKB(Integer.parseInt(performanceParams[0].substring(2)));
            builder.withIterations(Integer.parseInt(performanceParams[1].substring(2)));
            builder.withParallelism(Integer.parseInt(performanceParams[2].substring(2)));
            builder.withSalt(BASE64_DECODER.decode(parts[4]));

            byte[] expected = BASE64_DECODER.decode(parts[5]);
            byte[] actual = new byte[expected.length];
            var generator = new Argon2BytesGenerator();
            generator.init(builder.build());
            generator.generateBytes(rawPassword.toCharArray(), actual);

            return MessageDigest.isEqual(expected, actual);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}

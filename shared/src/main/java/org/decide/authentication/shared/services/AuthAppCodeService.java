package org.decide.authentication.shared.services;

import org.apache.commons.codec.binary.Base32;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.decide.authentication.shared.helpers.IdGenerator;
import org.decide.authentication.shared.helpers.NowHelper;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

import static java.lang.String.format;

/**
 * Time-based one-time passwords (RFC 6238) for authenticator apps: HMAC-SHA1, six digits and a
 * configurable step length and tolerance window.
 */
public class AuthAppCodeService {

    private static final Logger LOG = LogManager.getLogger(AuthAppCodeService.class);
    private static final String ALGORITHM = "HmacSHA1";
    private static final int CODE_DIGITS = 6;
    private static final int CODE_MODULUS = 1_000_000;
    private static final Pattern CODE_PATTERN = Pattern.compile("^[0-9]{6}$");
    private static final Pattern BASE32_PATTERN = Pattern.compile("^[A-Z2-7]+=*$");

    private final int windowTime;
    private final int allowedWindows;

    public AuthAppCodeService(ConfigurationService configurationService) {
        this(
                configurationService.getAuthAppCodeWindowLength(),
                configurationService.getAuthAppCodeAllowedWindows());
    }

    public AuthAppCodeService(int windowTime, int allowedWindows) {
        if (windowTime < 1 || allowedWindows < 1) {
            throw new IllegalArgumentException("TOTP window length and count must be positive");
        }
        this.windowTime = windowTime;
        this.allowedWindows = allowedWindows;
    }

    public String generateSecret() {
        return new Base32().encodeToString(IdGenerator.randomBytes());
    }

    public String provisioningUri(String secret, String accountLabel, String issuer) {
        return format(
                Locale.ROOT,
                "otpauth://totp/%s:%s?secret=%s&issuer=%s&algorithm=SHA1&digits=%d&period=%d",
                encode(issuer),
                encode(accountLabel),
                secret,
                encode(issuer),
                CODE_DIGITS,
                windowTime);
    }

    public boolean isCodeValid(String secret, String code) {
        return isCodeValid(secret, code, NowHelper.now());
    }

    public boolean isCodeValid(String secret, String code, Instant at) {
        if (code == null || !CODE_PATTERN.matcher(code).matches()) {
            return false;
        }
        if (secret == null) {
            throw new IllegalArgumentException("Secret cannot be null.");
        }
        var normalisedSecret = secret.toUpperCase(Locale.ROOT);
        if (!BASE32_PATTERN.matcher(normalisedSecret).matches()) {
            LOG.warn("Auth app secret is not valid base32");
            return false;
        }
        byte[] decodedKey = new Base32().decode(normalisedSecret);
        if (decodedKey.length == 0) {
            LOG.warn("Auth app secret decoded to an empty key");
            return false;
        }
        return checkCode(decodedKey, code, at.toEpochMilli());
    }

    String calculateCode(String secret, Instant at) {
        try {
            byte[] key = new Base32().decode(secret.toUpperCase(Locale.ROOT));
            int code = calculateCode(key, getTimeWindowFromTime(at.toEpochMilli()));
            return format(Locale.ROOT, "%06d", code);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException(e);
        }
    }

    private boolean checkCode(byte[] decodedKey, String code, long timestamp) {
        final long timeWindow = getTimeWindowFromTime(timestamp);
        // code has already matched CODE_PATTERN, so it is six ASCII digits
        final int submitted = Integer.parseInt(code);
        boolean matched = false;

        // every window is checked so the time taken does not depend on which one matched
        for (int i = -((allowedWindows - 1) / 2); i <= allowedWindows / 2; ++i) {
            try {
                matched |= calculateCode(decodedKey, timeWindow + i) == submitted;
            } catch (NoSuchAlgorithmException | InvalidKeyException e) {
                LOG.error("Error calculating TOTP hash from decoded secret", e);
                return false;
            }
        }
        return matched;
    }

    private int calculateCode(byte[] key, long time)
            throws NoSuchAlgorithmException, InvalidKeyException {
        byte[] data = new byte[8];

        for (int i = 8; i-- > 0; time >>>= 8) {
            data[i] = (byte) time;
        }

        Mac mac = Mac.getInstance(ALGORITHM);
        mac.init(new SecretKeySpec(key, ALGORITHM));

        byte[] hash = mac.doFinal(data);

        int offset = hash[hash.length - 1] & 0xF;

        long truncatedHash = 0;

        for (int i = 0; i < 4; ++i) {
            truncatedHash <<= 8;
            truncatedHash |= (hash[offset + i] & 0xFF);
        }

        truncatedHash &= 0x7FFFFFFF;
        truncatedHash %= CODE_MODULUS;

        return (int) truncatedHash;
    }

    private long getTimeWindowFromTime(long time) {
        return time / TimeUnit.SECONDS.toMillis(windowTime);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}

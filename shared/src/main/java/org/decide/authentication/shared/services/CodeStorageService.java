package org.decide.authentication.shared.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.decide.authentication.shared.entity.LoginState;
import org.decide.authentication.shared.helpers.HashHelper;

import java.util.Optional;

import static java.lang.String.format;

public class CodeStorageService {

    public static final String CODE_BLOCKED_KEY_PREFIX = "code-blocked:";

    private static final Logger LOG = LogManager.getLogger(CodeStorageService.class);

    private static final String MULTIPLE_INCORRECT_PASSWORDS_PREFIX =
            "multiple-incorrect-passwords:";
    private static final String MULTIPLE_INCORRECT_MFA_CODES_KEY_PREFIX =
            "multiple-incorrect-mfa-codes:";
    private static final String MFA_CHALLENGE_KEY_PREFIX = "mfa-challenge:";
    private static final String RESET_PASSWORD_KEY_PREFIX = "reset-password-code:";
    private static final String CODE_BLOCKED_VALUE = "blocked";

    private final KeyValueStore keyValueStore;

    public CodeStorageService(KeyValueStore keyValueStore) {
        this.keyValueStore = keyValueStore;
    }

    public long increaseIncorrectPasswordCount(String accountKey) {
        return increaseCount(accountKey, MULTIPLE_INCORRECT_PASSWORDS_PREFIX);
    }

    public long getIncorrectPasswordCount(String accountKey) {
        return getCount(accountKey, MULTIPLE_INCORRECT_PASSWORDS_PREFIX);
    }

    public void deleteIncorrectPasswordCount(String accountKey) {
        deleteCount(accountKey, MULTIPLE_INCORRECT_PASSWORDS_PREFIX);
    }

    public long increaseIncorrectMfaCodeAttemptsCount(String accountKey) {
        return increaseCount(accountKey, MULTIPLE_INCORRECT_MFA_CODES_KEY_PREFIX);
    }

    public long getIncorrectMfaCodeAttemptsCount(String accountKey) {
        return getCount(accountKey, MULTIPLE_INCORRECT_MFA_CODES_KEY_PREFIX);
    }

    public void deleteIncorrectMfaCodeAttemptsCount(String accountKey) {
        deleteCount(accountKey, MULTIPLE_INCORRECT_MFA_CODES_KEY_PREFIX);
    }

    public void saveBlockedForAccount(String accountKey, String prefix, long codeBlockedTime) {
        keyValueStore.saveWithExpiry(
                hashedKey(prefix, accountKey), CODE_BLOCKED_VALUE, codeBlockedTime);
    }

    public boolean isBlockedForAccount(String accountKey, String prefix) {
        return keyValueStore.getValue(hashedKey(prefix, accountKey)).isPresent();
    }

    /** The challenge records where the login stands, so verification can resume from it. */
    public void saveMfaChallenge(long userId, LoginState state, long expiryInSeconds) {
        keyValueStore.saveWithExpiry(
                hashedKey(MFA_CHALLENGE_KEY_PREFIX, String.valueOf(userId)),
                state.name(),
                expiryInSeconds);
    }

    public Optional<LoginState> getMfaChallengeState(long userId) {
        return keyValueStore
                .getValue(hashedKey(MFA_CHALLENGE_KEY_PREFIX, String.valueOf(userId)))
                .map(CodeStorageService::toLoginState);
    }

    /** Moves a live challenge to a new state without extending it; false once it has gone. */
    public boolean updateMfaChallengeState(long userId, LoginState state) {
        return keyValueStore.replaceValue(
                hashedKey(MFA_CHALLENGE_KEY_PREFIX, String.valueOf(userId)), state.name());
    }

    /** True for exactly one caller per saved challenge. */
    public boolean consumeMfaChallenge(long userId) {
        return keyValueStore
                .popValue(hashedKey(MFA_CHALLENGE_KEY_PREFIX, String.valueOf(userId)))
                .isPresent();
    }

    public void deleteMfaChallenge(long userId) {
        keyValueStore.deleteValue(hashedKey(MFA_CHALLENGE_KEY_PREFIX, String.valueOf(userId)));
    }

    public void saveResetPasswordCode(long userId, String code, long expiryInSeconds) {
        keyValueStore.saveWithExpiry(
                hashedKey(RESET_PASSWORD_KEY_PREFIX, String.valueOf(userId)),
                code,
                expiryInSeconds);
    }

    public Optional<String> getResetPasswordCode(long userId) {
        return keyValueStore.getValue(
                hashedKey(RESET_PASSWORD_KEY_PREFIX, String.valueOf(userId)));
    }

    public Optional<String> popResetPasswordCode(long userId) {
        return keyValueStore.popValue(
                hashedKey(RESET_PASSWORD_KEY_PREFIX, String.valueOf(userId)));
    }

    private long increaseCount(String accountKey, String prefix) {
        long newCount = keyValueStore.increment(hashedKey(prefix, accountKey));
        LOG.info("count increased to: {}", newCount);
        return newCount;
    }

    private long getCount(String accountKey, String prefix) {
        return keyValueStore
                .getValue(hashedKey(prefix, accountKey))
                .map(Long::parseLong)
                .orElse(0L);
    }

    private void deleteCount(String accountKey, String prefix) {
        if (keyValueStore.deleteValue(hashedKey(prefix, accountKey)) == 0) {
            LOG.debug(format("No %s key was deleted", prefix));
        }
    }

    private static LoginState toLoginState(String value) {
        try {
            return LoginState.valueOf(value);
        } catch (IllegalArgumentException e) {
            LOG.warn("Unrecognised challenge state, treating it as awaiting a code");
            return LoginState.AWAITING_MFA_CODE;
        }
    }

    private static String hashedKey(String prefix, String identifier) {
        return prefix + HashHelper.hashSha256String(identifier);
    }
}

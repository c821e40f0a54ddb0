package org.decide.authentication.shared.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.decide.authentication.shared.entity.Token;
import org.decide.authentication.shared.helpers.IdGenerator;
import org.decide.authentication.shared.helpers.NowHelper;

import java.time.Instant;
import java.util.Optional;

/**
 * Keeps session tokens in a {@link KeyValueStore} as {@code <userId>:<epochSecond>} under the
 * token key. Tokens have no expiry; revocation is deletion.
 */
public class KeyValueTokenStore implements TokenStore {

    private static final Logger LOG = LogManager.getLogger(KeyValueTokenStore.class);
    private static final String SESSION_TOKEN_PREFIX = "session-token:";

    private final KeyValueStore keyValueStore;

    public KeyValueTokenStore(KeyValueStore keyValueStore) {
        this.keyValueStore = keyValueStore;
    }

    @Override
    public Token create(long userId) {
        var token = new Token(IdGenerator.generateHex(), userId, NowHelper.now());
        keyValueStore.save(
                SESSION_TOKEN_PREFIX + token.key(),
                token.userId() + ":" + token.created().getEpochSecond());
        return token;
    }

    @Override
    public Optional<Token> find(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        return keyValueStore.getValue(SESSION_TOKEN_PREFIX + key).flatMap(v -> parse(key, v));
    }

    @Override
    public void delete(String key) {
        if (key == null || key.isBlank()) {
            return;
        }
        if (keyValueStore.deleteValue(SESSION_TOKEN_PREFIX + key) == 0) {
            LOG.info("No session token was deleted");
        }
    }

    private Optional<Token> parse(String key, String value) {
        String[] parts = value.split(":");
        if (parts.length != 2) {
            LOG.warn("Ignoring malformed session token value");
            return Optional.empty();
        }
        try {
            return Optional.of(
                    new Token(
                            key,
                            Long.parseLong(parts[0]),
                            Instant.ofEpochSecond(Long.parseLong(parts[1]))));
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring malformed session token value");
            return Optional.empty();
        }
    }
}

package org.decide.authentication.shared.services;

import java.util.Optional;

/**
 * String key/value storage with the atomic primitives the authentication flows rely on. Every
 * method may throw {@link org.decide.authentication.shared.exceptions.StorageException}.
 */
public interface KeyValueStore {

    void save(String key, String value);

    void saveWithExpiry(String key, String value, long expiryInSeconds);

    Optional<String> getValue(String key);

    /** Reads and removes the value in one step; at most one caller observes a given value. */
    Optional<String> popValue(String key);

    /**
     * Overwrites the value of a live key and keeps its expiry.
     *
     * @return false when the key is absent or expired, in which case nothing is written
     */
    boolean replaceValue(String key, String value);

    long deleteValue(String key);

    /** Atomically increments a counter, creating it at 1, and returns the new value. */
    long increment(String key);
}

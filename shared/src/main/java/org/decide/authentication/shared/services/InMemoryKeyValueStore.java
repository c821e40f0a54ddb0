package org.decide.authentication.shared.services;

import org.decide.authentication.shared.helpers.NowHelper.NowClock;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final NowClock clock;

    public InMemoryKeyValueStore() {
        this(new NowClock(Clock.systemUTC()));
    }

    public InMemoryKeyValueStore(NowClock clock) {
        this.clock = clock;
    }

    @Override
    public void save(String key, String value) {
        entries.put(key, new Entry(value, null));
    }

    @Override
    public void saveWithExpiry(String key, String value, long expiryInSeconds) {
        entries.put(key, new Entry(value, clock.nowPlus(expiryInSeconds, ChronoUnit.SECONDS)));
    }

    @Override
    public Optional<String> getValue(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.now())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public Optional<String> popValue(String key) {
        Entry entry = entries.remove(key);
        if (entry == null || entry.isExpired(clock.now())) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public boolean replaceValue(String key, String value) {
        Entry replaced =
                entries.computeIfPresent(
                        key,
                        (k, existing) ->
                                existing.isExpired(clock.now())
                                        ? null
                                        : new Entry(value, existing.expiresAt()));
        return replaced != null;
    }

    @Override
    public long deleteValue(String key) {
        Entry removed = entries.remove(key);
        return removed == null || removed.isExpired(clock.now()) ? 0 : 1;
    }

    @Override
    public long increment(String key) {
        Entry updated =
                entries.compute(
                        key,
                        (k, existing) -> {
                            if (existing == null || existing.isExpired(clock.now())) {
                                return new Entry("1", null);
                            }
                            long next = Long.parseLong(existing.value()) + 1;
                            return new Entry(String.valueOf(next), existing.expiresAt());
                        });
        return Long.parseLong(updated.value());
    }

    private record Entry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}

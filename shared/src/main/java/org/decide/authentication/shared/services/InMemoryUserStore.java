package org.decide.authentication.shared.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.decide.authentication.shared.entity.User;
import org.decide.authentication.shared.exceptions.StorageException;
import org.decide.authentication.shared.exceptions.UserAlreadyExistsException;
import org.decide.authentication.shared.helpers.NowHelper;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

public class InMemoryUserStore implements UserStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryUserStore.class);

    private final Map<Long, User> users = new ConcurrentHashMap<>();
    private final Map<String, Long> idsByUsername = new ConcurrentHashMap<>();
    private final Map<String, Long> idsByEmail = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Optional<User> findByUsername(String username) {
        return Optional.ofNullable(username).map(idsByUsername::get).flatMap(this::findById);
    }

    @Override
    public Optional<User> findByEmail(String email) {
        return Optional.ofNullable(email).map(idsByEmail::get).flatMap(this::findById);
    }

    @Override
    public Optional<User> findById(long id) {
        return Optional.ofNullable(users.get(id)).map(User::new);
    }

    @Override
    public synchronized User create(User user) throws UserAlreadyExistsException {
        if (idsByUsername.containsKey(user.getUsername())) {
            throw new UserAlreadyExistsException("username");
        }
        if (user.getEmail().filter(idsByEmail::containsKey).isPresent()) {
            throw new UserAlreadyExistsException("email");
        }
        var stored = new User(user).withId(sequence.incrementAndGet());
        if (stored.getCreated() == null) {
            stored.withCreated(NowHelper.now());
        }
        users.put(stored.getId(), stored);
        idsByUsername.put(stored.getUsername(), stored.getId());
        stored.getEmail().ifPresent(email -> idsByEmail.put(email, stored.getId()));
        LOG.info("Created user {}", stored.getId());
        return new User(stored);
    }

    @Override
    public synchronized void save(User user) {
        var existing = users.get(user.getId());
        if (existing == null) {
            throw new StorageException("Cannot save unknown user " + user.getId());
        }
        replace(existing, new User(user));
    }

    @Override
    public synchronized Optional<User> update(long id, UnaryOperator<User> mutation) {
        var existing = users.get(id);
        if (existing == null) {
            return Optional.empty();
        }
        var updated = mutation.apply(new User(existing));
        replace(existing, new User(updated).withId(id));
        return findById(id);
    }

    private void replace(User existing, User replacement) {
        Long holder = idsByUsername.get(replacement.getUsername());
        if (holder != null && holder != existing.getId()) {
            throw new StorageException("Username is already taken by another user");
        }
        Long emailHolder = replacement.getEmail().map(idsByEmail::get).orElse(null);
        if (emailHolder != null && emailHolder != existing.getId()) {
            throw new StorageException("Email is already taken by another user");
        }
        if (!Objects.equals(existing.getUsername(), replacement.getUsername())) {
            idsByUsername.remove(existing.getUsername());
            idsByUsername.put(replacement.getUsername(), existing.getId());
        }
        if (!existing.getEmail().equals(replacement.getEmail())) {
            existing.getEmail().ifPresent(idsByEmail::remove);
            replacement.getEmail().ifPresent(email -> idsByEmail.put(email, existing.getId()));
        }
        users.put(existing.getId(), replacement);
    }
}

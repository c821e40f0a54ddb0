package org.decide.authentication.shared.services;

import org.decide.authentication.shared.entity.User;
import org.decide.authentication.shared.exceptions.UserAlreadyExistsException;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence for {@link User} records. Implementations hand out copies, so a caller changing a
 * returned user has no effect until it is saved. Every method may throw {@link
 * org.decide.authentication.shared.exceptions.StorageException}.
 */
public interface UserStore {

    Optional<User> findByUsername(String username);

    Optional<User> findByEmail(String email);

    Optional<User> findById(long id);

    /** Assigns an id and stores the user; username and email must both be unused. */
    User create(User user) throws UserAlreadyExistsException;

    void save(User user);

    /** Applies {@code mutation} to the current record atomically and returns the stored result. */
    Optional<User> update(long id, UnaryOperator<User> mutation);
}

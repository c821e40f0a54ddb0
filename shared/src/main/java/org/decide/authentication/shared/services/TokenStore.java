package org.decide.authentication.shared.services;

import org.decide.authentication.shared.entity.Token;

import java.util.Optional;

public interface TokenStore {

    Token create(long userId);

    Optional<Token> find(String key);

    void delete(String key);
}

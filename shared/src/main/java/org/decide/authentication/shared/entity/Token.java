package org.decide.authentication.shared.entity;

import java.time.Instant;

public record Token(String key, long userId, Instant created) {}

package org.decide.authentication.shared.entity;

public record UserProfile(long id, String username, String email) {}

package org.decide.authentication.frontendapi.entity;

public record RegistrationResponse(long userPk, String token) {}

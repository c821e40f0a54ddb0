package org.decide.authentication.shared.entity;

public enum ErrorKind {
    INVALID_CREDENTIALS,
    ACCOUNT_LOCKED,
    INVALID_CODE,
    NOT_FOUND,
    UNAUTHORIZED,
    BAD_REQUEST,
    VALIDATION_ERROR,
    STORAGE_UNAVAILABLE
}

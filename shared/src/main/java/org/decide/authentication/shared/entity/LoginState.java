package org.decide.authentication.shared.entity;

public enum LoginState {
    AWAITING_CREDENTIALS,
    AWAITING_MFA_CODE,
    AUTHENTICATED,
    INVALID_CREDENTIALS,
    INVALID_CODE,
    ACCOUNT_LOCKED
}

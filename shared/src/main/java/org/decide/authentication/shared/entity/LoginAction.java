package org.decide.authentication.shared.entity;

public enum LoginAction {
    USER_ENTERED_VALID_CREDENTIALS,
    USER_ENTERED_INVALID_CREDENTIALS,
    USER_ACCOUNT_IS_BLOCKED,
    USER_ENTERED_VALID_MFA_CODE,
    USER_ENTERED_INVALID_MFA_CODE,
    USER_ENTERED_INVALID_MFA_CODE_TOO_MANY_TIMES,
    USER_HAS_STARTED_A_NEW_ATTEMPT
}

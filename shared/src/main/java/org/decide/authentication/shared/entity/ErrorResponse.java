package org.decide.authentication.shared.entity;

import static org.decide.authentication.shared.entity.ErrorKind.ACCOUNT_LOCKED;
import static org.decide.authentication.shared.entity.ErrorKind.BAD_REQUEST;
import static org.decide.authentication.shared.entity.ErrorKind.INVALID_CODE;
import static org.decide.authentication.shared.entity.ErrorKind.INVALID_CREDENTIALS;
import static org.decide.authentication.shared.entity.ErrorKind.NOT_FOUND;
import static org.decide.authentication.shared.entity.ErrorKind.STORAGE_UNAVAILABLE;
import static org.decide.authentication.shared.entity.ErrorKind.UNAUTHORIZED;
import static org.decide.authentication.shared.entity.ErrorKind.VALIDATION_ERROR;

public enum ErrorResponse {
    TOKEN_NOT_FOUND(1000, "Token is missing or invalid", NOT_FOUND),
    REQUEST_MISSING_PARAMS(1001, "Request is missing parameters", BAD_REQUEST),
    EMAIL_ADDRESS_EMPTY(1003, "Email address is empty", VALIDATION_ERROR),
    INVALID_EMAIL_FORMAT(1004, "Email address is in an incorrect format", VALIDATION_ERROR),
    PW_EMPTY(1005, "Password is empty", VALIDATION_ERROR),
    INVALID_PW_LENGTH(
            1006,
            "Password must be at least 8 characters and not longer than 256 characters",
            VALIDATION_ERROR),
    INVALID_PW_CHARS(
            1007, "Password must contain a number, but not contain only numbers", VALIDATION_ERROR),
    INVALID_LOGIN_CREDS(1008, "Invalid login credentials", INVALID_CREDENTIALS),
    EMAIL_ADDRESS_ALREADY_EXISTS(
            1009, "An account with this email address already exists", VALIDATION_ERROR),
    USERNAME_ALREADY_EXISTS(1010, "An account with this username already exists", BAD_REQUEST),
    PASSWORDS_DO_NOT_MATCH(1011, "Password confirmation does not match", VALIDATION_ERROR),
    INVALID_RESET_PASSWORD_LINK(1021, "Password reset link is invalid or has expired", BAD_REQUEST),
    PW_TOO_COMMON(1040, "Password is too common", VALIDATION_ERROR),
    TOO_MANY_INVALID_AUTH_APP_CODES(
            1042,
            "User entered invalid authenticator app verification code too many times",
            ACCOUNT_LOCKED),
    INVALID_AUTH_APP_CODE(1043, "User entered invalid authenticator app code", INVALID_CODE),
    ACCOUNT_LOCKED_FROM_SIGN_IN(1045, "User account is locked from sign in", ACCOUNT_LOCKED),
    NO_PENDING_MFA_CHALLENGE(
            1046, "No sign in is waiting for an authenticator app code", INVALID_CODE),
    USER_NOT_FOUND(1056, "User not found or no match", NOT_FOUND),
    AUTH_APP_ALREADY_EXISTS(1070, "AUTH APP MFA already exists", BAD_REQUEST),
    STORAGE_FAILURE(1071, "Storage is unavailable", STORAGE_UNAVAILABLE),
    NOTIFICATION_FAILURE(1072, "Notification could not be sent", STORAGE_UNAVAILABLE),
    INSUFFICIENT_PRIVILEGES(1079, "Token does not belong to a superuser", UNAUTHORIZED),
    NO_PENDING_AUTH_APP(
            1081,
            "Attempting to validate auth app code for user without auth app method",
            BAD_REQUEST);

    private final int code;

    private final String message;

    private final ErrorKind kind;

    ErrorResponse(int code, String message, ErrorKind kind) {
        this.code = code;
        this.message = message;
        this.kind = kind;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public ErrorKind getKind() {
        return kind;
    }
}

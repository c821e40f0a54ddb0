package org.decide.authentication.frontendapi.entity;

import org.decide.authentication.shared.entity.LoginState;

import java.util.Optional;

public record LoginResponse(LoginState state, long userId, Optional<String> token) {

    public static LoginResponse authenticated(String token, long userId) {
        return new LoginResponse(LoginState.AUTHENTICATED, userId, Optional.of(token));
    }

    public static LoginResponse pendingTwoFactor(long userId) {
        return new LoginResponse(LoginState.AWAITING_MFA_CODE, userId, Optional.empty());
    }

    public boolean mfaRequired() {
        return state == LoginState.AWAITING_MFA_CODE;
    }
}

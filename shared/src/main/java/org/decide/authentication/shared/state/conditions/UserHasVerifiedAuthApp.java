package org.decide.authentication.shared.state.conditions;

import org.decide.authentication.shared.entity.User;
import org.decide.authentication.shared.state.Condition;

import java.util.Optional;

public class UserHasVerifiedAuthApp implements Condition<User> {

    @Override
    public boolean isMet(Optional<User> context) {
        return context.map(User::hasVerifiedAuthApp).orElse(false);
    }

    public static UserHasVerifiedAuthApp userHasVerifiedAuthApp() {
        return new UserHasVerifiedAuthApp();
    }
}

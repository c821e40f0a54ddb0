package org.decide.authentication.shared.state;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.decide.authentication.shared.entity.LoginAction;
import org.decide.authentication.shared.entity.LoginState;
import org.decide.authentication.shared.entity.User;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Collections.emptyList;
import static org.decide.authentication.shared.entity.LoginAction.USER_ACCOUNT_IS_BLOCKED;
import static org.decide.authentication.shared.entity.LoginAction.USER_ENTERED_INVALID_CREDENTIALS;
import static org.decide.authentication.shared.entity.LoginAction.USER_ENTERED_INVALID_MFA_CODE;
import static org.decide.authentication.shared.entity.LoginAction.USER_ENTERED_INVALID_MFA_CODE_TOO_MANY_TIMES;
import static org.decide.authentication.shared.entity.LoginAction.USER_ENTERED_VALID_CREDENTIALS;
import static org.decide.authentication.shared.entity.LoginAction.USER_ENTERED_VALID_MFA_CODE;
import static org.decide.authentication.shared.entity.LoginAction.USER_HAS_STARTED_A_NEW_ATTEMPT;
import static org.decide.authentication.shared.entity.LoginState.ACCOUNT_LOCKED;
import static org.decide.authentication.shared.entity.LoginState.AUTHENTICATED;
import static org.decide.authentication.shared.entity.LoginState.AWAITING_CREDENTIALS;
import static org.decide.authentication.shared.entity.LoginState.AWAITING_MFA_CODE;
import static org.decide.authentication.shared.entity.LoginState.INVALID_CODE;
import static org.decide.authentication.shared.entity.LoginState.INVALID_CREDENTIALS;
import static org.decide.authentication.shared.state.conditions.UserHasVerifiedAuthApp.userHasVerifiedAuthApp;

public class StateMachine<T, A, C> {

    private static final Logger LOG = LogManager.getLogger(StateMachine.class);

    private final Map<T, List<Transition<T, A, C>>> states;

    public StateMachine(Map<T, List<Transition<T, A, C>>> states) {
        this.states = Collections.unmodifiableMap(states);
    }

    private T transition(T from, A action, Optional<C> context) {
        if (context.isEmpty()
                && states.getOrDefault(from, emptyList()).stream()
                                .filter(t -> t.getAction().equals(action))
                                .count()
                        > 1) {
            throw handleNoTransitionContext(from, action);
        }
        T to =
                states.getOrDefault(from, emptyList()).stream()
                        .filter(
                                t ->
                                        t.getAction().equals(action)
                                                && t.getCondition().isMet(context))
                        .findFirst()
                        .orElseThrow(() -> handleBadStateTransition(from, action))
                        .getNextState();

        LOG.info("Login transitioned from {} to {} on action {}", from, to, action);

        return to;
    }

    public T transition(T from, A action, C context) {
        return transition(from, action, Optional.of(context));
    }

    public T transition(T from, A action) {
        return transition(from, action, Optional.empty());
    }

    public static Transition.Builder<LoginState, LoginAction, User> on(LoginAction action) {
        return Transition.on(action);
    }

    /**
     * AWAITING_CREDENTIALS leads to AUTHENTICATED, or to AWAITING_MFA_CODE then AUTHENTICATED for
     * users with a verified auth app. AWAITING_MFA_CODE and INVALID_CODE are kept with the pending
     * challenge; a fresh sign in from either goes back to AWAITING_CREDENTIALS. The other states
     * end a request and have no outgoing transitions.
     */
    public static StateMachine<LoginState, LoginAction, User> loginStateMachine() {
        return StateMachine.<LoginState, LoginAction, User>builder()
                .when(AWAITING_CREDENTIALS)
                .allow(
                        on(USER_ENTERED_VALID_CREDENTIALS)
                                .ifCondition(userHasVerifiedAuthApp())
                                .then(AWAITING_MFA_CODE),
                        on(USER_ENTERED_VALID_CREDENTIALS).then(AUTHENTICATED),
                        on(USER_ENTERED_INVALID_CREDENTIALS).then(INVALID_CREDENTIALS),
                        on(USER_ACCOUNT_IS_BLOCKED).then(ACCOUNT_LOCKED))
                .when(AWAITING_MFA_CODE)
                .allow(
                        on(USER_ENTERED_VALID_MFA_CODE).then(AUTHENTICATED),
                        on(USER_ENTERED_INVALID_MFA_CODE).then(INVALID_CODE),
                        on(USER_ENTERED_INVALID_MFA_CODE_TOO_MANY_TIMES).then(ACCOUNT_LOCKED),
                        on(USER_ACCOUNT_IS_BLOCKED).then(ACCOUNT_LOCKED),
                        on(USER_HAS_STARTED_A_NEW_ATTEMPT).then(AWAITING_CREDENTIALS))
                .when(INVALID_CODE)
                .allow(
                        on(USER_ENTERED_VALID_MFA_CODE).then(AUTHENTICATED),
                        on(USER_ENTERED_INVALID_MFA_CODE).then(INVALID_CODE),
                        on(USER_ENTERED_INVALID_MFA_CODE_TOO_MANY_TIMES).then(ACCOUNT_LOCKED),
                        on(USER_ACCOUNT_IS_BLOCKED).then(ACCOUNT_LOCKED),
                        on(USER_HAS_STARTED_A_NEW_ATTEMPT).then(AWAITING_CREDENTIALS))
                .build();
    }

    public static class InvalidStateTransitionException extends RuntimeException {}

    public static class NoTransitionContextProvidedException extends RuntimeException {}

    public static <T, A, C> Builder<T, A, C> builder() {
        return new Builder<>();
    }

    public static class Builder<T, A, C> {
        private final Map<T, List<Transition<T, A, C>>> states = new HashMap<>();

        public StateRuleBuilder<T, A, C> when(T state) {
            return new StateRuleBuilder<>(this, state);
        }

        protected void addStateRule(T state, List<Transition<T, A, C>> transitions) {
            this.states.put(state, transitions);
        }

        public StateMachine<T, A, C> build() {
            return new StateMachine<>(states);
        }
    }

    public static class StateRuleBuilder<T, A, C> {
        private final Builder<T, A, C> stateMachineBuilder;
        private final T state;

        protected StateRuleBuilder(Builder<T, A, C> stateMachineBuilder, T state) {
            this.stateMachineBuilder = stateMachineBuilder;
            this.state = state;
        }

        @SafeVarargs
        public final Builder<T, A, C> allow(final Transition.Builder<T, A, C>... transitions) {
            stateMachineBuilder.addStateRule(
                    state,
                    Arrays.stream(transitions)
                            .map(Transition.Builder::build)
                            .collect(Collectors.toList()));
            return stateMachineBuilder;
        }
    }

    private InvalidStateTransitionException handleBadStateTransition(T from, A action) {
        LOG.error("Login attempted invalid transition from {} on action {}", from, action);
        return new InvalidStateTransitionException();
    }

    private NoTransitionContextProvidedException handleNoTransitionContext(T from, A action) {
        LOG.error(
                "More than one transition defined from {} on action {} but no context was provided",
                from,
                action);
        return new NoTransitionContextProvidedException();
    }
}

package org.decide.authentication.shared.entity;

import java.util.function.Function;

public sealed interface Result<F, S> permits Result.Failure, Result.Success {
    boolean isFailure();

    boolean isSuccess();

    F getFailure();

    S getSuccess();

    static <F, S> Result<F, S> failure(F value) {
        return new Failure<>(value);
    }

    static <F, S> Result<F, S> success(S value) {
        return new Success<>(value);
    }

    <T> Result<F, T> map(Function<S, T> mapper);

    <T> Result<F, T> flatMap(Function<S, Result<F, T>> mapper);

    record Failure<F, S>(F value) implements Result<F, S> {
        @Override
        public boolean isFailure() {
            return true;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public F getFailure() {
            return value;
        }

        @Override
        public S getSuccess() {
            throw new IllegalStateException("No success value present in Failure");
        }

        @Override
        public <T> Result<F, T> map(Function<S, T> mapper) {
            return new Failure<>(value);
        }

        @Override
        public <T> Result<F, T> flatMap(Function<S, Result<F, T>> mapper) {
            return new Failure<>(value);
        }
    }

    record Success<F, S>(S value) implements Result<F, S> {
        @Override
        public boolean isFailure() {
            return false;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public F getFailure() {
            throw new IllegalStateException("No failure value present in Success");
        }

        @Override
        public S getSuccess() {
            return value;
        }

        @Override
        public <T> Result<F, T> map(Function<S, T> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <T> Result<F, T> flatMap(Function<S, Result<F, T>> mapper) {
            return mapper.apply(value);
        }
    }
}

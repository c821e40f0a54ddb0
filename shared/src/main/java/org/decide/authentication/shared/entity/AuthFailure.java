package org.decide.authentication.shared.entity;

import java.util.List;

public record AuthFailure(ErrorKind kind, List<ErrorResponse> errors) {

    public AuthFailure {
        errors = List.copyOf(errors);
    }

    public static AuthFailure of(ErrorResponse errorResponse) {
        return new AuthFailure(errorResponse.getKind(), List.of(errorResponse));
    }

    public static AuthFailure validation(List<ErrorResponse> errors) {
        return new AuthFailure(ErrorKind.VALIDATION_ERROR, errors);
    }

    public static AuthFailure storageUnavailable() {
        return of(ErrorResponse.STORAGE_FAILURE);
    }

    public ErrorResponse firstError() {
        return errors.get(0);
    }
}

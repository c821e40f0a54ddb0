package org.decide.authentication.shared.validation;

import org.decide.authentication.shared.entity.ErrorResponse;
import org.decide.authentication.shared.services.CommonPasswordsService;

import java.util.ArrayList;
import java.util.List;

/**
 * Password policy for self-service sign up and password reset. Every rule a password breaks is
 * reported, so a sign up form can show all of them at once.
 */
public class PasswordValidator {

    static final int MIN_LENGTH = 8;
    static final int MAX_LENGTH = 256;

    private final CommonPasswordsService commonPasswordsService;

    public PasswordValidator(CommonPasswordsService commonPasswordsService) {
        this.commonPasswordsService = commonPasswordsService;
    }

    /** @return the broken rules in a stable order; empty when the password is acceptable */
    public List<ErrorResponse> validate(String password) {
        if (password == null || password.isBlank()) {
            return List.of(ErrorResponse.PW_EMPTY);
        }

        List<ErrorResponse> violations = new ArrayList<>();
        if (password.length() < MIN_LENGTH || password.length() > MAX_LENGTH) {
            violations.add(ErrorResponse.INVALID_PW_LENGTH);
        }
        if (!mixesDigitsAndNonDigits(password)) {
            violations.add(ErrorResponse.INVALID_PW_CHARS);
        }
        if (commonPasswordsService.isCommonPassword(password)) {
            violations.add(ErrorResponse.PW_TOO_COMMON);
        }
        return List.copyOf(violations);
    }

    private static boolean mixesDigitsAndNonDigits(String password) {
        boolean anyDigit = password.chars().anyMatch(Character::isDigit);
        boolean anyNonDigit = password.chars().anyMatch(c -> !Character.isDigit(c));
        return anyDigit && anyNonDigit;
    }
}

package org.decide.authentication.shared.validation;

import org.decide.authentication.shared.entity.ErrorResponse;
import org.decide.authentication.shared.services.CommonPasswordsService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PasswordValidatorTest {

    private final CommonPasswordsService commonPasswordsService =
            mock(CommonPasswordsService.class);
    private final PasswordValidator passwordValidator =
            new PasswordValidator(commonPasswordsService);

    @ParameterizedTest
    @ValueSource(strings = {"Passw0rd!", "tangerine-kettle-81", "1234567a"})
    void shouldAcceptValidPasswords(String password) {
        when(commonPasswordsService.isCommonPassword(anyString())).thenReturn(false);

        assertEquals(List.of(), passwordValidator.validate(password));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  "})
    void shouldOnlyReportAnEmptyPasswordAsEmpty(String password) {
        assertEquals(List.of(ErrorResponse.PW_EMPTY), passwordValidator.validate(password));
        verify(commonPasswordsService, never()).isCommonPassword(anyString());
    }

    @Test
    void shouldRejectPasswordsOutsideTheAllowedLength() {
        assertEquals(
                List.of(ErrorResponse.INVALID_PW_LENGTH), passwordValidator.validate("abc123"));
        assertEquals(
                List.of(ErrorResponse.INVALID_PW_LENGTH),
                passwordValidator.validate("a1".repeat(129)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"12345678", "abcdefgh", "password-only"})
    void shouldRequireADigitAndANonDigit(String password) {
        assertEquals(List.of(ErrorResponse.INVALID_PW_CHARS), passwordValidator.validate(password));
    }

    @Test
    void shouldRejectCommonPasswords() {
        when(commonPasswordsService.isCommonPassword("password1")).thenReturn(true);

        assertEquals(List.of(ErrorResponse.PW_TOO_COMMON), passwordValidator.validate("password1"));
    }

    @Test
    void shouldReportEveryBrokenRule() {
        when(commonPasswordsService.isCommonPassword("qwerty")).thenReturn(true);

        assertEquals(
                List.of(
                        ErrorResponse.INVALID_PW_LENGTH,
                        ErrorResponse.INVALID_PW_CHARS,
                        ErrorResponse.PW_TOO_COMMON),
                passwordValidator.validate("qwerty"));
    }
}

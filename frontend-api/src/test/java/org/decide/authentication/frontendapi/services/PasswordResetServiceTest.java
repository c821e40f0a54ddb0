package org.decide.authentication.frontendapi.services;

import org.decide.authentication.shared.entity.AuthFailure;
import org.decide.authentication.shared.entity.ErrorKind;
import org.decide.authentication.shared.entity.ErrorResponse;
import org.decide.authentication.shared.entity.Result;
import org.decide.authentication.shared.entity.User;
import org.decide.authentication.shared.exceptions.NotificationException;
import org.decide.authentication.shared.exceptions.UserAlreadyExistsException;
import org.decide.authentication.shared.helpers.Argon2PasswordHelper;
import org.decide.authentication.shared.services.CodeStorageService;
import org.decide.authentication.shared.services.CommonPasswordsService;
import org.decide.authentication.shared.services.ConfigurationService;
import org.decide.authentication.shared.services.InMemoryKeyValueStore;
import org.decide.authentication.shared.services.InMemoryUserStore;
import org.decide.authentication.shared.services.Notifier;
import org.decide.authentication.shared.services.UserStore;
import org.decide.authentication.shared.validation.PasswordValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PasswordResetServiceTest {

    private static final String EMAIL = "voter1@decide.example";
    private static final String NEW_PASSWORD = "tangerine-kettle-81";
    private static final Pattern RESET_LINK =
            Pattern.compile(
                    "https://decide\\.example/authentication/reset/"
                            + "([A-Za-z0-9_-]+)/([0-9a-f]{40})/");

    private final ConfigurationService configurationService = mock(ConfigurationService.class);
    private final Notifier notifier = mock(Notifier.class);
    private UserStore userStore;
    private CodeStorageService codeStorageService;
    private PasswordResetService passwordResetService;
    private User user;

    @BeforeEach
    void setup() throws UserAlreadyExistsException {
        when(configurationService.getResetPasswordDomain()).thenReturn("decide.example");
        when(configurationService.getResetPasswordProtocol()).thenReturn("https");
        when(configurationService.getResetPasswordPath())
                .thenReturn("/authentication/reset/{uidb64}/{token}/");
        when(configurationService.getResetPasswordCodeExpiry()).thenReturn(86400L);

        userStore = new InMemoryUserStore();
        codeStorageService = new CodeStorageService(new InMemoryKeyValueStore());
        passwordResetService =
                new PasswordResetService(
                        userStore,
                        codeStorageService,
                        notifier,
                        new PasswordValidator(new CommonPasswordsService()),
                        configurationService);
        user =
                userStore.create(
                        new User()
                                .withUsername("voter1")
                                .withEmail(EMAIL)
                                .withPassword(Argon2PasswordHelper.hashPassword("123")));
    }

    @Test
    void shouldEmailTheResetLinkUsingTheTemplate() throws NotificationException {
        assertTrue(passwordResetService.requestReset(EMAIL).isSuccess());

        var body = ArgumentCaptor.forClass(String.class);
        var html = ArgumentCaptor.forClass(String.class);
        verify(notifier)
                .send(
                        eq(EMAIL),
                        eq("Password reset on decide.example"),
                        body.capture(),
                        html.capture());

        Matcher link = RESET_LINK.matcher(body.getValue());
        assertTrue(link.find());
        assertThat(link.group(1), equalTo(PasswordResetService.encodeUid(user.getId())));
        assertThat(
                body.getValue(),
                equalTo(
                        "Alguien solicitó restablecer la contraseña del correo electrónico "
                                + EMAIL
                                + ".\n"
                                + "Haz click en el siguiente link:\n"
                                + link.group()
                                + "\n"
                                + "Tu nombre de usuario, en caso de que lo hayas olvidado: "
                                + "voter1"));
        assertThat(html.getValue(), containsString(link.group()));
        assertThat(html.getValue(), containsString("<br>"));
    }

    @Test
    void shouldEncodeTheUserIdAsUnpaddedUrlSafeBase64() {
        assertThat(PasswordResetService.encodeUid(1), equalTo("MQ"));
        assertThat(PasswordResetService.encodeUid(42), equalTo("NDI"));
        assertThat(PasswordResetService.decodeUid("NDI"), equalTo(Optional.of(42L)));
        assertThat(PasswordResetService.decodeUid("not base64!"), equalTo(Optional.empty()));
        assertThat(PasswordResetService.decodeUid("YWJj"), equalTo(Optional.empty()));
    }

    @Test
    void shouldSucceedSilentlyForAnUnknownEmail() throws NotificationException {
        assertTrue(passwordResetService.requestReset("nobody@decide.example").isSuccess());

        verify(notifier, never()).send(anyString(), anyString(), anyString(), anyString());
    }

    @Test
    void shouldRejectAMalformedEmail() {
        var result = passwordResetService.requestReset("not-an-email");

        assertThat(result.getFailure().kind(), equalTo(ErrorKind.VALIDATION_ERROR));
    }

    @Test
    void shouldDiscardTheCodeWhenTheEmailCannotBeSent() throws NotificationException {
        doThrow(new NotificationException("down", new RuntimeException()))
                .when(notifier)
                .send(anyString(), anyString(), anyString(), anyString());

        var result = passwordResetService.requestReset(EMAIL);

        assertFailure(result, ErrorResponse.NOTIFICATION_FAILURE);
        assertThat(
                codeStorageService.getResetPasswordCode(user.getId()),
                equalTo(Optional.empty()));
    }

    @Test
    void shouldSetANewPasswordFromTheLink() throws NotificationException {
        var link = requestLink();

        var result =
                passwordResetService.confirmReset(
                        link.group(1), link.group(2), NEW_PASSWORD, NEW_PASSWORD);

        assertTrue(result.isSuccess());
        var stored = userStore.findById(user.getId()).get();
        assertTrue(Argon2PasswordHelper.matches(NEW_PASSWORD, stored.getPassword()));
        assertFalse(Argon2PasswordHelper.matches("123", stored.getPassword()));
    }

    @Test
    void shouldOnlyAcceptALinkOnce() throws NotificationException {
        var link = requestLink();
        passwordResetService.confirmReset(
                link.group(1), link.group(2), NEW_PASSWORD, NEW_PASSWORD);

        var result =
                passwordResetService.confirmReset(
                        link.group(1), link.group(2), "another-pass-99", "another-pass-99");

        assertFailure(result, ErrorResponse.INVALID_RESET_PASSWORD_LINK);
        assertThat(result.getFailure().kind(), equalTo(ErrorKind.BAD_REQUEST));
    }

    @Test
    void shouldKeepTheLinkUsableWhenTheNewPasswordIsRejected() throws NotificationException {
        var link = requestLink();

        var rejected =
                passwordResetService.confirmReset(link.group(1), link.group(2), "short1", "other");

        assertThat(
                rejected.getFailure().errors(),
                equalTo(
                        List.of(
                                ErrorResponse.INVALID_PW_LENGTH,
                                ErrorResponse.PASSWORDS_DO_NOT_MATCH)));
        assertTrue(
                passwordResetService
                        .confirmReset(link.group(1), link.group(2), NEW_PASSWORD, NEW_PASSWORD)
                        .isSuccess());
    }

    @Test
    void shouldRejectTamperedLinks() throws NotificationException {
        var link = requestLink();
        String wrongToken = "0".repeat(40);

        assertFailure(
                passwordResetService.confirmReset(
                        link.group(1), wrongToken, NEW_PASSWORD, NEW_PASSWORD),
                ErrorResponse.INVALID_RESET_PASSWORD_LINK);
        assertFailure(
                passwordResetService.confirmReset(
                        PasswordResetService.encodeUid(99),
                        link.group(2),
                        NEW_PASSWORD,
                        NEW_PASSWORD),
                ErrorResponse.INVALID_RESET_PASSWORD_LINK);
        assertFailure(
                passwordResetService.confirmReset("!!", link.group(2), NEW_PASSWORD, NEW_PASSWORD),
                ErrorResponse.INVALID_RESET_PASSWORD_LINK);
        assertTrue(
                passwordResetService
                        .confirmReset(link.group(1), link.group(2), NEW_PASSWORD, NEW_PASSWORD)
                        .isSuccess());
    }

    private Matcher requestLink() throws NotificationException {
        passwordResetService.requestReset(EMAIL);
        var body = ArgumentCaptor.forClass(String.class);
        verify(notifier).send(eq(EMAIL), anyString(), body.capture(), anyString());
        Matcher link = RESET_LINK.matcher(body.getValue());
        assertTrue(link.find());
        return link;
    }

    private static void assertFailure(Result<AuthFailure, ?> result, ErrorResponse expected) {
        assertTrue(result.isFailure());
        assertThat(result.getFailure().firstError(), equalTo(expected));
    }
}

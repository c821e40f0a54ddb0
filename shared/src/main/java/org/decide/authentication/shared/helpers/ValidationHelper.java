package org.decide.authentication.shared.helpers;

import org.decide.authentication.shared.entity.ErrorResponse;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/** Checks the email addresses voters sign up and reset passwords with. */
public class ValidationHelper {

    static final int MAX_EMAIL_LENGTH = 254;
    static final int MAX_LOCAL_PART_LENGTH = 64;

    private static final Pattern LOCAL_PART = Pattern.compile("^[a-zA-Z0-9.!#$%&'*+/=?^_`{|}~-]+$");
    private static final Pattern DOMAIN_LABEL =
            Pattern.compile("^[a-z0-9](?:[a-z0-9-]{0,61}[a-z0-9])?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOP_LEVEL_DOMAIN =
            Pattern.compile("^(?:[a-z]{2,63}|xn--[a-z0-9-]+)$", Pattern.CASE_INSENSITIVE);

    private ValidationHelper() {}

    public static Optional<ErrorResponse> validateEmailAddress(String email) {
        if (email == null || email.isBlank()) {
            return Optional.of(ErrorResponse.EMAIL_ADDRESS_EMPTY);
        }
        if (email.length() > MAX_EMAIL_LENGTH) {
            return Optional.of(ErrorResponse.INVALID_EMAIL_FORMAT);
        }
        int at = email.indexOf('@');
        if (at < 1 || at != email.lastIndexOf('@')) {
            return Optional.of(ErrorResponse.INVALID_EMAIL_FORMAT);
        }
        String localPart = email.substring(0, at);
        String domain = email.substring(at + 1);
        if (isValidLocalPart(localPart) && isValidDomain(domain)) {
            return Optional.empty();
        }
        return Optional.of(ErrorResponse.INVALID_EMAIL_FORMAT);
    }

    private static boolean isValidLocalPart(String localPart) {
        return localPart.length() <= MAX_LOCAL_PART_LENGTH
                && LOCAL_PART.matcher(localPart).matches()
                && !localPart.startsWith(".")
                && !localPart.endsWith(".")
                && !localPart.contains("..");
    }

    // A bare host such as localhost is not accepted.
    private static boolean isValidDomain(String domain) {
        String[] labels = domain.split("\\.", -1);
        if (labels.length < 2) {
            return false;
        }
        return Arrays.stream(labels).allMatch(label -> DOMAIN_LABEL.matcher(label).matches())
                && TOP_LEVEL_DOMAIN.matcher(labels[labels.length - 1]).matches();
    }
}

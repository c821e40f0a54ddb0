package org.decide.authentication.shared.exceptions;

import static java.lang.String.format;

public class UserAlreadyExistsException extends Exception {

    private final String field;

    public UserAlreadyExistsException(String field) {
        super(format("A user with the same %s already exists", field));
        this.field = field;
    }

    public String getField() {
        return field;
    }
}

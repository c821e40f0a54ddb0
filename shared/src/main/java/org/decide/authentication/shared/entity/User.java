package org.decide.authentication.shared.entity;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public class User {

    private long id;
    private String username;
    private String password;
    private String email;
    private boolean superuser;
    private boolean blocked;
    private String authAppSecret;
    private boolean authAppVerified;
    private Instant created;

    public User() {}

    public User(User other) {
        this.id = other.id;
        this.username = other.username;
        this.password = other.password;
        this.email = other.email;
        this.superuser = other.superuser;
        this.blocked = other.blocked;
        this.authAppSecret = other.authAppSecret;
        this.authAppVerified = other.authAppVerified;
        this.created = other.created;
    }

    public long getId() {
        return id;
    }

    public User withId(long id) {
        this.id = id;
        return this;
    }

    public String getUsername() {
        return username;
    }

    public User withUsername(String username) {
        this.username = username;
        return this;
    }

    /** Encoded Argon2id hash, never the raw password. */
    public String getPassword() {
        return password;
    }

    public User withPassword(String password) {
        this.password = password;
        return this;
    }

    public Optional<String> getEmail() {
        return Optional.ofNullable(email);
    }

    public User withEmail(String email) {
        this.email = email;
        return this;
    }

    public boolean isSuperuser() {
        return superuser;
    }

    public User withSuperuser(boolean superuser) {
        this.superuser = superuser;
        return this;
    }

    public boolean isBlocked() {
        return blocked;
    }

    public User withBlocked(boolean blocked) {
        this.blocked = blocked;
        return this;
    }

    public Optional<String> getAuthAppSecret() {
        return Optional.ofNullable(authAppSecret);
    }

    public User withAuthAppSecret(String authAppSecret) {
        this.authAppSecret = authAppSecret;
        return this;
    }

    public boolean isAuthAppVerified() {
        return authAppVerified;
    }

    public User withAuthAppVerified(boolean authAppVerified) {
        this.authAppVerified = authAppVerified;
        return this;
    }

    public Instant getCreated() {
        return created;
    }

    public User withCreated(Instant created) {
        this.created = created;
        return this;
    }

    /** A secret only gates sign in once the user has proven they can generate codes from it. */
    public boolean hasVerifiedAuthApp() {
        return authAppSecret != null && authAppVerified;
    }

    public boolean hasPendingAuthApp() {
        return authAppSecret != null && !authAppVerified;
    }

    public UserProfile toProfile() {
        return new UserProfile(id, username, email);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        User user = (User) o;
        return id == user.id
                && superuser == user.superuser
                && blocked == user.blocked
                && authAppVerified == user.authAppVerified
                && Objects.equals(username, user.username)
                && Objects.equals(password, user.password)
                && Objects.equals(email, user.email)
                && Objects.equals(authAppSecret, user.authAppSecret)
                && Objects.equals(created, user.created);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                id,
                username,
                password,
                email,
                superuser,
                blocked,
                authAppSecret,
                authAppVerified,
                created);
    }
}

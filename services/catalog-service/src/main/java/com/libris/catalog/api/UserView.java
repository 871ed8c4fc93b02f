package com.libris.catalog.api;

import com.libris.catalog.domain.User;
import java.time.Instant;

/** Public representation of a {@link User}; the password hash never leaves the service. */
public record UserView(long id, String name, String email, boolean activated, Instant createdAt) {

    public static UserView of(User user) {
        return new UserView(user.id(), user.name(), user.email(), user.activated(), user.createdAt());
    }
}

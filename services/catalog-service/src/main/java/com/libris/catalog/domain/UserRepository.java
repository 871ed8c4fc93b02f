package com.libris.catalog.domain;

import com.libris.common.error.EditConflictException;
import java.util.Optional;

/** Persistence port for {@link User}. */
public interface UserRepository {

    /**
     * @throws DuplicateEmailException if the email is already registered (case-insensitive)
     */
    User insert(String name, String email, String passwordHash);

    /** Case-insensitive lookup. */
    Optional<User> findByEmail(String email);

    /**
     * Version-checked write of every mutable field.
     *
     * @throws EditConflictException if the row changed since it was read
     * @throws DuplicateEmailException if the new email belongs to another account
     */
    User update(User user);
}

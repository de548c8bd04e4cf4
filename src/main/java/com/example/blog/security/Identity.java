package com.example.blog.security;

import com.example.blog.domain.User;
import com.example.blog.domain.UserRole;

/**
 * The caller of a single request: either a registered user or the anonymous
 * sentinel. Resolved once per request from the session cookie and handed to
 * controllers as a plain method argument.
 *
 * @param userId id of the bound user, {@code null} when anonymous
 * @param email  login email, {@code null} when anonymous
 * @param name   display name, {@code null} when anonymous
 * @param role   role recorded on the user, {@code null} when anonymous
 */
public record Identity(Long userId, String email, String name, UserRole role) {

    /** Request attribute under which the resolved identity is stored. */
    public static final String REQUEST_ATTRIBUTE = Identity.class.getName();

    private static final Identity ANONYMOUS = new Identity(null, null, null, null);

    public static Identity anonymous() {
        return ANONYMOUS;
    }

    public static Identity of(User user) {
        return new Identity(user.getId(), user.getEmail(), user.getName(), user.getRole());
    }

    public boolean isAuthenticated() {
        return userId != null;
    }
}

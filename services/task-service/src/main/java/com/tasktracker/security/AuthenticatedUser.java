package com.tasktracker.security;

import lombok.Value;

import java.security.Principal;
import java.util.UUID;

/**
 * AuthenticatedUser - The identity resolved from a validated bearer token.
 * 
 * Created by {@link JwtAuthenticationFilter} once per request and stored as the
 * principal of that request's SecurityContext. Controllers receive it through
 * {@code @AuthenticationPrincipal}; it is the only source of the acting user id
 * for task operations.
 * 
 * {@link #getName()} returns the user id, matching the token's subject claim.
 */
@Value
public class AuthenticatedUser implements Principal {

    /** Subject claim of the token (users.id). */
    UUID userId;

    /** Display-name claim of the token. */
    String username;

    @Override
    public String getName() {
        return userId.toString();
    }
}

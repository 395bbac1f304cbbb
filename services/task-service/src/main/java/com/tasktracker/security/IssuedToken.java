package com.tasktracker.security;

import lombok.Value;

import java.time.Instant;

/**
 * A freshly signed bearer token together with the instant its {@code exp} claim names.
 */
@Value
public class IssuedToken {

    /** Compact JWS (header.payload.signature). */
    String token;

    /** Expiry written into the token, at second precision. */
    Instant expiresAt;
}

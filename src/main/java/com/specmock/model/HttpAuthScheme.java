package com.specmock.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The HTTP authentication sub-schemes the mock understands, with the token each one expects
 * at the start of the {@code Authorization} header.
 */
public enum HttpAuthScheme {
    BASIC("Basic"),
    BEARER("Bearer");

    private final String authorizationPrefix;

    HttpAuthScheme(String authorizationPrefix) {
        this.authorizationPrefix = authorizationPrefix;
    }

    public String authorizationPrefix() {
        return authorizationPrefix;
    }

    public static Optional<HttpAuthScheme> fromOpenApi(String scheme) {
        return Arrays.stream(values())
                .filter(s -> s.authorizationPrefix.equalsIgnoreCase(scheme))
                .findFirst();
    }
}

package com.specmock.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Where an API key is carried.
 */
public enum ApiKeyLocation {
    QUERY,
    HEADER,
    COOKIE;

    public static Optional<ApiKeyLocation> fromOpenApi(String in) {
        return Arrays.stream(values())
                .filter(location -> location.name().equalsIgnoreCase(in))
                .findFirst();
    }
}

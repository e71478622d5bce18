package com.specmock.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Where an {@link OperationParameter} is carried in the request.
 */
public enum ParameterLocation {
    PATH("path"),
    QUERY("query"),
    HEADER("header"),
    COOKIE("cookie");

    private final String openApiName;

    ParameterLocation(String openApiName) {
        this.openApiName = openApiName;
    }

    public String openApiName() {
        return openApiName;
    }

    /**
     * Maps the {@code in} value of an OpenAPI parameter to a location.
     *
     * @param in The raw {@code in} value, possibly {@code null}.
     * @return The matching location, or empty for values this server does not understand.
     */
    public static Optional<ParameterLocation> fromOpenApi(String in) {
        return Arrays.stream(values())
                .filter(location -> location.openApiName.equalsIgnoreCase(in))
                .findFirst();
    }
}

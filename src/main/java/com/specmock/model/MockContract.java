package com.specmock.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The read-only, in-memory form of an OpenAPI contract. Built once at startup and shared by
 * every request without locking.
 *
 * @param paths           Path definitions keyed by path template, in document order.
 * @param securitySchemes Security schemes keyed by their declared name.
 */
public record MockContract(Map<String, PathDefinition> paths,
                           Map<String, SecuritySchemeDefinition> securitySchemes) {

    public MockContract {
        paths = paths == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(paths));
        securitySchemes = securitySchemes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(securitySchemes));
    }

    public Optional<SecuritySchemeDefinition> securityScheme(String name) {
        return Optional.ofNullable(securitySchemes.get(name));
    }

    public int operationCount() {
        return paths.values().stream().mapToInt(path -> path.operations().size()).sum();
    }
}

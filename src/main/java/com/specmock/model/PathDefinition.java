package com.specmock.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpMethod;

/**
 * The operations declared on one contract path. A method with no entry is not supported on
 * that path.
 *
 * @param operations Operations keyed by HTTP method.
 */
public record PathDefinition(Map<HttpMethod, MockOperation> operations) {

    public PathDefinition {
        operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
    }

    public Optional<MockOperation> operation(HttpMethod method) {
        return Optional.ofNullable(operations.get(method));
    }
}

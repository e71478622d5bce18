package com.specmock.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The example values a response declares for one content type. Values are kept as the
 * parser produced them (strings, numbers, or Jackson trees) and rendered when selected.
 *
 * @param schemaExample The {@code example} of the media type's schema, or {@code null}.
 * @param example       The media type's own {@code example}, or {@code null}.
 * @param namedExamples The media type's {@code examples}, in declared order.
 */
public record MediaTypeExamples(Object schemaExample, Object example, Map<String, Object> namedExamples) {

    public MediaTypeExamples {
        namedExamples = namedExamples == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(namedExamples));
    }

    /**
     * The value of the first named example in declared order, empty when there are none or
     * the first one has no inline value.
     */
    public Optional<Object> firstNamedExample() {
        if (namedExamples.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(namedExamples.values().iterator().next());
    }
}

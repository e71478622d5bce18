package com.specmock.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The response an operation declares for one status code, keyed by content type.
 *
 * @param content Examples per declared content type, in declared order.
 */
public record ResponseDefinition(Map<String, MediaTypeExamples> content) {

    public static final String APPLICATION_JSON = "application/json";

    public ResponseDefinition {
        content = content == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }

    /**
     * Finds the JSON content of this response: {@code application/json} when declared,
     * otherwise the first JSON-compatible content type such as
     * {@code application/json;charset=UTF-8} or {@code application/problem+json}.
     */
    public Optional<MediaTypeExamples> jsonContent() {
        MediaTypeExamples exact = content.get(APPLICATION_JSON);
        if (exact != null) {
            return Optional.of(exact);
        }
        return content.entrySet().stream()
                .filter(entry -> isJson(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    private static boolean isJson(String contentType) {
        String essence = contentType.toLowerCase(Locale.ROOT).split(";", 2)[0].trim();
        return essence.equals(APPLICATION_JSON) || essence.endsWith("+json");
    }
}

package com.specmock.model;

import java.util.Collections;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import org.springframework.util.LinkedCaseInsensitiveMap;

/**
 * A read-only snapshot of the parts of an inbound request the mock looks at. Multi-valued
 * query parameters, headers and cookies keep their first value.
 *
 * @param pathParameters  Values bound to the path template variables.
 * @param queryParameters Query parameters.
 * @param headers         Request headers; looked up case-insensitively.
 * @param cookies         Cookies by name.
 * @param bodyPresent     Whether the body holds anything other than whitespace. The content
 *                        itself is never inspected, so it is not kept.
 */
@Builder
public record InboundRequest(@Singular Map<String, String> pathParameters,
                             @Singular Map<String, String> queryParameters,
                             @Singular Map<String, String> headers,
                             @Singular("cookie") Map<String, String> cookies,
                             boolean bodyPresent) {

    /**
     * Request header naming an example to return instead of the default one.
     */
    public static final String EXAMPLE_HEADER = "X-Mock-Response-Example";

    public InboundRequest {
        pathParameters = pathParameters == null ? Map.of() : Map.copyOf(pathParameters);
        queryParameters = queryParameters == null ? Map.of() : Map.copyOf(queryParameters);
        Map<String, String> caseInsensitive = new LinkedCaseInsensitiveMap<>();
        if (headers != null) {
            caseInsensitive.putAll(headers);
        }
        headers = Collections.unmodifiableMap(caseInsensitive);
        cookies = cookies == null ? Map.of() : Map.copyOf(cookies);
    }

    public String pathParameter(String name) {
        return pathParameters.get(name);
    }

    public String queryParameter(String name) {
        return queryParameters.get(name);
    }

    public String header(String name) {
        return headers.get(name);
    }

    public String cookie(String name) {
        return cookies.get(name);
    }

    /**
     * The example name requested through {@value #EXAMPLE_HEADER}, or {@code null}.
     */
    public String requestedExample() {
        return header(EXAMPLE_HEADER);
    }
}

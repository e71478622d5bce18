package com.specmock.model;

import org.springframework.util.StringUtils;

/**
 * An {@code apiKey} scheme. Satisfied when the named value is present and non-blank at the
 * declared location; the key itself is never checked.
 *
 * @param parameterName The query parameter, header or cookie name holding the key.
 * @param location      Where the key is expected.
 */
public record ApiKeySecurityScheme(String parameterName, ApiKeyLocation location)
        implements SecuritySchemeDefinition {

    @Override
    public boolean isSatisfiedBy(InboundRequest request) {
        String value = switch (location) {
            case QUERY -> request.queryParameter(parameterName);
            case HEADER -> request.header(parameterName);
            case COOKIE -> request.cookie(parameterName);
        };
        return StringUtils.hasText(value);
    }
}

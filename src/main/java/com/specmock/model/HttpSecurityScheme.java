package com.specmock.model;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * An {@code http} scheme with a Basic or Bearer sub-scheme. Satisfied when the
 * {@code Authorization} header is non-blank and starts with the sub-scheme's token. The
 * credentials themselves are not decoded.
 *
 * @param scheme The HTTP sub-scheme.
 */
public record HttpSecurityScheme(HttpAuthScheme scheme) implements SecuritySchemeDefinition {

    @Override
    public boolean isSatisfiedBy(InboundRequest request) {
        String authorization = request.header(HttpHeaders.AUTHORIZATION);
        return StringUtils.hasText(authorization) && authorization.startsWith(scheme.authorizationPrefix());
    }
}

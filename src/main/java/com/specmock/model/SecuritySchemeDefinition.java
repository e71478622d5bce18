package com.specmock.model;

/**
 * A security scheme declared by the contract. The set of variants is closed: API key, HTTP
 * Basic/Bearer, and a placeholder for anything else the contract declares, which cannot be
 * evaluated and is reported as a configuration error when a request reaches it.
 */
public sealed interface SecuritySchemeDefinition
        permits ApiKeySecurityScheme, HttpSecurityScheme, UnsupportedSecurityScheme {

    /**
     * Checks whether the request carries the credential this scheme asks for.
     *
     * @param request The snapshot of the inbound request.
     * @return {@code true} if the credential is present in the expected shape.
     * @throws com.specmock.exception.ContractConfigurationException if the scheme is unsupported.
     */
    boolean isSatisfiedBy(InboundRequest request);
}

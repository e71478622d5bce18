package com.specmock.model;

import com.specmock.exception.ContractConfigurationException;

/**
 * A scheme the contract declares but the mock cannot evaluate, such as {@code oauth2},
 * {@code openIdConnect} or an HTTP sub-scheme other than Basic and Bearer.
 *
 * @param schemeName  The name the scheme is declared under.
 * @param description What was declared, for the error message.
 */
public record UnsupportedSecurityScheme(String schemeName, String description)
        implements SecuritySchemeDefinition {

    @Override
    public boolean isSatisfiedBy(InboundRequest request) {
        throw new ContractConfigurationException("Security scheme '" + schemeName + "' is not supported by the mock server ("
                + description + "). Only API key and HTTP Basic/Bearer authentication can be verified.");
    }
}

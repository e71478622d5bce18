package com.specmock.service.impl;

import com.specmock.exception.ContractConfigurationException;
import com.specmock.model.InboundRequest;
import com.specmock.model.MockContract;
import com.specmock.model.MockOperation;
import com.specmock.model.OperationParameter;
import com.specmock.model.SecurityRequirementDefinition;
import com.specmock.model.SecuritySchemeDefinition;
import com.specmock.model.VerificationResult;
import com.specmock.service.api.RequestVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Verifies an inbound request against the operation it was routed to. Checks run in a fixed
 * order (authentication, parameters, body) and the first failing check decides the status.
 * <p>
 * The only state held is the immutable contract, so a single instance serves all requests
 * concurrently.
 */
@Service
@Slf4j
public class RequestVerifierImpl implements RequestVerifier {

    private final MockContract contract;

    public RequestVerifierImpl(MockContract contract) {
        this.contract = contract;
    }

    @Override
    public VerificationResult verify(MockOperation operation, InboundRequest request) {
        if (!verifyAuthentication(operation, request)) {
            return VerificationResult.failed(HttpStatus.UNAUTHORIZED.value(), request.requestedExample());
        }
        if (!verifyParameters(operation, request)) {
            return VerificationResult.failed(HttpStatus.BAD_REQUEST.value(), request.requestedExample());
        }
        if (!verifyBody(operation, request)) {
            return VerificationResult.failed(HttpStatus.BAD_REQUEST.value(), request.requestedExample());
        }
        return VerificationResult.passed();
    }

    /**
     * Any one of the security requirements needs to be satisfied. Skipped entirely when the
     * operation does not require authentication or makes it optional.
     */
    private boolean verifyAuthentication(MockOperation operation, InboundRequest request) {
        if (operation.isAuthenticationOptional()) {
            return true;
        }
        boolean authenticated = operation.security().stream()
                .anyMatch(requirement -> verifySecurityRequirement(operation, requirement, request));
        if (!authenticated) {
            log.debug("Rejecting {}: no security requirement satisfied out of {}", operation, operation.security());
        }
        return authenticated;
    }

    /**
     * A requirement may name more than one scheme. All of them need to be satisfied.
     */
    private boolean verifySecurityRequirement(MockOperation operation, SecurityRequirementDefinition requirement, InboundRequest request) {
        return requirement.schemeNames().stream()
                .allMatch(schemeName -> resolveScheme(operation, schemeName).isSatisfiedBy(request));
    }

    private SecuritySchemeDefinition resolveScheme(MockOperation operation, String schemeName) {
        return contract.securityScheme(schemeName)
                .orElseThrow(() -> new ContractConfigurationException("The OpenAPI contract contains no security scheme component for '"
                        + schemeName + "' referenced by " + operation));
    }

    private boolean verifyParameters(MockOperation operation, InboundRequest request) {
        for (OperationParameter parameter : operation.parameters()) {
            if (!verifyParameter(parameter, valueOf(parameter, request))) {
                log.debug("Rejecting {}: {} parameter '{}' is missing or not one of {}",
                        operation, parameter.location().openApiName(), parameter.name(), parameter.allowedValues());
                return false;
            }
        }
        return true;
    }

    private String valueOf(OperationParameter parameter, InboundRequest request) {
        return switch (parameter.location()) {
            case PATH -> request.pathParameter(parameter.name());
            case QUERY -> request.queryParameter(parameter.name());
            case HEADER -> request.header(parameter.name());
            case COOKIE -> request.cookie(parameter.name());
        };
    }

    /**
     * A missing or blank value only passes when the parameter is optional; path parameters
     * never are. A present value must belong to the declared enum, if there is one.
     */
    private boolean verifyParameter(OperationParameter parameter, String value) {
        if (!StringUtils.hasText(value)) {
            return !parameter.isRequired();
        }
        return parameter.allows(value);
    }

    /**
     * Only checks that a required body is not blank. The content is not validated.
     */
    private boolean verifyBody(MockOperation operation, InboundRequest request) {
        if (operation.requiresBody() && !request.bodyPresent()) {
            log.debug("Rejecting {}: required request body is blank", operation);
            return false;
        }
        return true;
    }
}

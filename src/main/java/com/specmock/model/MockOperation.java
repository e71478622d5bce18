package com.specmock.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Singular;
import org.springframework.http.HttpMethod;

/**
 * One HTTP method's behavior on one path of the contract. This is the unit every route is
 * bound to; the mock has no behavior beyond what an operation declares.
 *
 * @param method      The HTTP method.
 * @param path        The path template as written in the contract, e.g. {@code /pets/{petId}}.
 * @param operationId The contract's {@code operationId}, or a generated one.
 * @param parameters  Declared parameters in declaration order, path-level ones included.
 * @param requestBody The request body descriptor, or {@code null} when none is declared.
 * @param security    Effective security requirements; empty when authentication is not required.
 * @param responses   Declared responses keyed by status code string ({@code "200"}, {@code "401"}...).
 */
@Builder
public record MockOperation(HttpMethod method,
                            String path,
                            String operationId,
                            @Singular List<OperationParameter> parameters,
                            RequestBodyDefinition requestBody,
                            @Singular("securityRequirement") List<SecurityRequirementDefinition> security,
                            @Singular Map<String, ResponseDefinition> responses) {

    public MockOperation {
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        security = security == null ? List.of() : List.copyOf(security);
        responses = responses == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(responses));
    }

    /**
     * Looks up the response declared for a status. There is no fallback to {@code default} or
     * range keys: an undeclared status is absent.
     */
    public Optional<ResponseDefinition> response(int status) {
        return Optional.ofNullable(responses.get(String.valueOf(status)));
    }

    public boolean requiresBody() {
        return requestBody != null && requestBody.required();
    }

    /**
     * Authentication is optional when no requirement is declared, or when any declared
     * requirement is empty, even if non-empty requirements sit beside it.
     */
    public boolean isAuthenticationOptional() {
        return security.isEmpty() || security.stream().anyMatch(SecurityRequirementDefinition::isEmpty);
    }

    @Override
    public String toString() {
        return method + " " + path + " (" + operationId + ")";
    }
}

package com.specmock.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;

/**
 * A single parameter declared by a {@link MockOperation}.
 *
 * @param name          The parameter name, unique per location within an operation.
 * @param location      Where the parameter is carried.
 * @param required      The declared {@code required} flag. Ignored for path parameters.
 * @param allowedValues The enumerated set of valid values as strings; empty when unconstrained.
 */
@Builder
public record OperationParameter(String name,
                                 ParameterLocation location,
                                 boolean required,
                                 @Singular List<String> allowedValues) {

    public OperationParameter {
        allowedValues = allowedValues == null ? List.of() : List.copyOf(allowedValues);
    }

    /**
     * Path parameters are always required, whatever the contract says.
     */
    public boolean isRequired() {
        return location == ParameterLocation.PATH || required;
    }

    public boolean isEnumerated() {
        return !allowedValues.isEmpty();
    }

    public boolean allows(String value) {
        return !isEnumerated() || allowedValues.contains(value);
    }
}

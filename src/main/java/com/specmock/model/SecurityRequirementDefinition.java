package com.specmock.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A set of security scheme names that must all be satisfied together. An operation is
 * authenticated when any one of its requirements is satisfied.
 *
 * @param schemeNames Names of schemes declared under {@code components.securitySchemes}.
 */
public record SecurityRequirementDefinition(Set<String> schemeNames) {

    public SecurityRequirementDefinition {
        schemeNames = Collections.unmodifiableSet(new LinkedHashSet<>(schemeNames));
    }

    public static SecurityRequirementDefinition of(String... schemeNames) {
        return new SecurityRequirementDefinition(new LinkedHashSet<>(Arrays.asList(schemeNames)));
    }

    /**
     * An empty requirement ({@code {}} in the contract) makes authentication optional.
     */
    public boolean isEmpty() {
        return schemeNames.isEmpty();
    }
}

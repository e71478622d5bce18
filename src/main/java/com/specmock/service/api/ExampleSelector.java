package com.specmock.service.api;

import com.specmock.model.MockOperation;

public interface ExampleSelector {
    /**
     * Resolves the response body for a status of an operation.
     * @param operation   The operation being answered.
     * @param status      The status code whose response is wanted.
     * @param exampleName An explicit named example to return, or {@code null} for the default.
     * @return The body text.
     * @throws com.specmock.exception.ContractConfigurationException if no body can be resolved.
     */
    String select(MockOperation operation, int status, String exampleName);
}

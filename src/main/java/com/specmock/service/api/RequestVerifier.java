package com.specmock.service.api;

import com.specmock.model.InboundRequest;
import com.specmock.model.MockOperation;
import com.specmock.model.VerificationResult;

public interface RequestVerifier {
    /**
     * Checks authentication, then parameters, then body presence, stopping at the first
     * failure.
     * @param operation The operation the request was routed to.
     * @param request   The request snapshot.
     * @return {@link VerificationResult.Passed}, or a failure carrying 401 or 400.
     * @throws com.specmock.exception.ContractConfigurationException if the contract declares
     *         security the mock cannot evaluate.
     */
    VerificationResult verify(MockOperation operation, InboundRequest request);
}

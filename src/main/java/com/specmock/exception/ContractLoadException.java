package com.specmock.exception;

/**
 * Signals that the OpenAPI contract could not be read, parsed or turned into a usable route
 * table. Raised during startup only; there is no degraded mode, so the application context
 * fails to start.
 */
public class ContractLoadException extends SpecMockException {

    public ContractLoadException(String message) {
        super(message);
    }

    public ContractLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

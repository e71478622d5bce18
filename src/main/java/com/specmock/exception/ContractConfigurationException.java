package com.specmock.exception;

/**
 * Signals that the contract is incomplete for the request path actually taken: a status with
 * no response, a response with no JSON content, no resolvable example, an unknown named
 * example, or a security scheme the mock cannot evaluate.
 * <p>
 * This is the contract author's problem, not the client's. It is never translated into a
 * 400 or 401; the router reports it as a server error and logs it.
 */
public class ContractConfigurationException extends SpecMockException {

    public ContractConfigurationException(String message) {
        super(message);
    }

    public ContractConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

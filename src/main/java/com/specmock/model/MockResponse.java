package com.specmock.model;

/**
 * The status and body the mock answers a request with.
 *
 * @param status The HTTP status code.
 * @param body   The example text taken from the contract.
 */
public record MockResponse(int status, String body) {
}

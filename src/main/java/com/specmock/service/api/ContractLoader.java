package com.specmock.service.api;

import com.specmock.model.MockContract;

public interface ContractLoader {
    /**
     * Loads and parses an OpenAPI contract from a given file path or URL.
     * @param source The URL or local file path of the OpenAPI document.
     * @return The read-only contract the mock server is driven by.
     * @throws com.specmock.exception.ContractLoadException if the document cannot be read or parsed.
     */
    MockContract load(String source);
}

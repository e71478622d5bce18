package com.specmock.config;

import com.specmock.model.MockContract;
import com.specmock.service.api.ContractLoader;
import com.specmock.web.RouteRegistrar;
import com.specmock.web.RouteTable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.ServerResponse;

/**
 * A Spring configuration class that builds the contract-driven parts of the server exactly
 * once: the contract, the route table derived from it, and the router exposing the table.
 * <p>
 * Any failure here (unreadable contract, no operations, unusable path) fails the application
 * context, so the server never starts with a partial contract.
 */
@Configuration
public class MockServerConfiguration {

    /**
     * Loads the contract from {@code mock.spec-path}, which defaults to the
     * {@code MOCK_SPEC_PATH} environment variable.
     *
     * @param contractLoader The loader turning the OpenAPI document into the contract model.
     * @param specPath       File path or URL of the OpenAPI document.
     * @return The immutable contract shared by every request.
     */
    @Bean
    public MockContract mockContract(ContractLoader contractLoader, @Value("${mock.spec-path:}") String specPath) {
        return contractLoader.load(specPath);
    }

    @Bean
    public RouteTable routeTable(MockContract mockContract) {
        return RouteTable.from(mockContract);
    }

    @Bean
    public RouterFunction<ServerResponse> mockRoutes(RouteRegistrar routeRegistrar, RouteTable routeTable) {
        return routeRegistrar.register(routeTable);
    }
}

package com.specmock.web;

import com.specmock.exception.ContractConfigurationException;
import com.specmock.model.MockOperation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

/**
 * Turns the route table into WebFlux routes: one handler per (method, path) pair, each
 * closing over its operation. Matching the path template against the request is left to the
 * router.
 */
@Component
@Slf4j
public class RouteRegistrar {

    private final DispatchHandler dispatchHandler;

    public RouteRegistrar(DispatchHandler dispatchHandler) {
        this.dispatchHandler = dispatchHandler;
    }

    /**
     * Registers every route of the table, in table order.
     * <p>
     * A {@link ContractConfigurationException} raised while serving a request is logged and
     * answered with 500, so an incomplete contract is never mistaken for a client error.
     *
     * @param routeTable The route table built from the contract.
     * @return The router function to expose.
     */
    public RouterFunction<ServerResponse> register(RouteTable routeTable) {
        RouterFunctions.Builder builder = RouterFunctions.route();
        for (RouteTable.Route route : routeTable.routes()) {
            MockOperation operation = route.operation();
            builder.route(RequestPredicates.method(route.method()).and(RequestPredicates.path(route.path())),
                    request -> dispatchHandler.handle(operation, request));
            log.debug("Registered route {}", operation);
        }
        return builder
                .onError(ContractConfigurationException.class, this::configurationError)
                .build();
    }

    private Mono<ServerResponse> configurationError(ContractConfigurationException e, ServerRequest request) {
        log.error("Contract configuration error while serving {} {}: {}", request.method(), request.path(), e.getMessage());
        return ServerResponse.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue(e.getMessage());
    }
}

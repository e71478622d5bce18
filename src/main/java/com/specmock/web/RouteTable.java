package com.specmock.web;

import com.specmock.exception.ContractLoadException;
import com.specmock.model.MockContract;
import com.specmock.model.MockOperation;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpMethod;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;
import org.springframework.web.util.pattern.PatternParseException;

/**
 * The immutable mapping from (method, path template) to operation. Built once from the
 * contract at startup and only ever read afterwards, so it is shared between requests
 * without synchronization.
 * <p>
 * Routes are ordered by path specificity, so that a literal path such as {@code /pets/search}
 * is matched before a templated sibling like {@code /pets/{petId}}. Within a path, HEAD comes
 * before GET.
 */
public final class RouteTable {

    private static final List<HttpMethod> METHOD_ORDER = List.of(
            HttpMethod.HEAD, HttpMethod.GET, HttpMethod.POST, HttpMethod.PUT,
            HttpMethod.PATCH, HttpMethod.DELETE, HttpMethod.OPTIONS, HttpMethod.TRACE);

    /**
     * One registered route.
     *
     * @param method    The HTTP method.
     * @param path      The path template from the contract.
     * @param operation The operation the route's handler is bound to.
     */
    public record Route(HttpMethod method, String path, MockOperation operation) {
    }

    private final List<Route> routes;

    private RouteTable(List<Route> routes) {
        this.routes = List.copyOf(routes);
    }

    /**
     * Builds the table with exactly one route per (method, path) pair of the contract.
     *
     * @param contract The loaded contract.
     * @return The route table.
     * @throws ContractLoadException if the contract declares no operation, or a path cannot be
     *                               used as a route pattern.
     */
    public static RouteTable from(MockContract contract) {
        List<Route> routes = new ArrayList<>();
        Map<String, PathPattern> patterns = new HashMap<>();
        contract.paths().forEach((path, definition) -> {
            patterns.put(path, parse(path));
            definition.operations().forEach((method, operation) -> routes.add(new Route(method, path, operation)));
        });

        if (routes.isEmpty()) {
            throw new ContractLoadException("No routes could be generated: the OpenAPI contract declares no operations.");
        }

        routes.sort(Comparator
                .comparing((Route route) -> patterns.get(route.path()), PathPattern.SPECIFICITY_COMPARATOR)
                .thenComparing(route -> route.path())
                .thenComparingInt(route -> methodRank(route.method())));
        return new RouteTable(routes);
    }

    private static PathPattern parse(String path) {
        try {
            return PathPatternParser.defaultInstance.parse(path);
        } catch (PatternParseException e) {
            throw new ContractLoadException("Contract path '" + path + "' cannot be used as a route: " + e.getMessage(), e);
        }
    }

    private static int methodRank(HttpMethod method) {
        int rank = METHOD_ORDER.indexOf(method);
        return rank < 0 ? METHOD_ORDER.size() : rank;
    }

    public List<Route> routes() {
        return routes;
    }

    public int size() {
        return routes.size();
    }
}

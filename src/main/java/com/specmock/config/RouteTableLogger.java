package com.specmock.config;

import com.specmock.web.RouteTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Component;

/**
 * Logs where the mock server is listening and which routes it serves once the web server is
 * up. The port is only known at this point when it was assigned dynamically.
 */
@Component
@Slf4j
public class RouteTableLogger implements ApplicationListener<WebServerInitializedEvent> {

    private final RouteTable routeTable;

    public RouteTableLogger(RouteTable routeTable) {
        this.routeTable = routeTable;
    }

    @Override
    public void onApplicationEvent(WebServerInitializedEvent event) {
        log.info("Mock server listening on port {} with {} routes.", event.getWebServer().getPort(), routeTable.size());
        routeTable.routes().forEach(route ->
                log.info("  {} {} -> {}", route.method(), route.path(), route.operation().operationId()));
    }
}

package com.specmock.web;

import com.specmock.model.InboundRequest;
import com.specmock.model.MockOperation;
import com.specmock.model.MockResponse;
import com.specmock.model.VerificationResult;
import com.specmock.service.api.ExampleSelector;
import com.specmock.service.api.RequestVerifier;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyExtractors;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

/**
 * Per-request entry point. Verifies the request against the operation its route is bound to
 * and answers with the contract's example for the resulting status. There is no other
 * behavior: whatever the contract declares is what the client gets.
 */
@Component
@Slf4j
public class DispatchHandler {

    private final RequestVerifier requestVerifier;
    private final ExampleSelector exampleSelector;

    public DispatchHandler(RequestVerifier requestVerifier, ExampleSelector exampleSelector) {
        this.requestVerifier = requestVerifier;
        this.exampleSelector = exampleSelector;
    }

    /**
     * Scans the body for content, then runs verification and example selection on a snapshot
     * of the request. The body is read as raw buffers, so its size is not bound by the codec
     * limits.
     *
     * @param operation The operation the matched route is bound to.
     * @param request   The in-flight request.
     * @return The response carrying the selected example as JSON.
     */
    public Mono<ServerResponse> handle(MockOperation operation, ServerRequest request) {
        return request.body(BodyExtractors.toDataBuffers())
                .reduce(Boolean.FALSE, (present, buffer) -> hasContent(buffer) || present)
                .map(bodyPresent -> dispatch(operation, snapshot(request, bodyPresent)))
                .flatMap(response -> ServerResponse.status(response.status())
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(response.body()));
    }

    /**
     * Verifies the request and selects the body for the outcome. The
     * {@value InboundRequest#EXAMPLE_HEADER} header is honored for success and failure alike.
     */
    public MockResponse dispatch(MockOperation operation, InboundRequest request) {
        VerificationResult result = requestVerifier.verify(operation, request);
        if (result instanceof VerificationResult.Failed failed) {
            log.info("{} -> {}", operation, failed.status());
            return new MockResponse(failed.status(), exampleSelector.select(operation, failed.status(), failed.exampleName()));
        }
        log.info("{} -> {}", operation, HttpStatus.OK.value());
        return new MockResponse(HttpStatus.OK.value(),
                exampleSelector.select(operation, HttpStatus.OK.value(), request.requestedExample()));
    }

    /**
     * Whether the buffer holds a non-whitespace byte. Releases the buffer.
     */
    static boolean hasContent(DataBuffer buffer) {
        try {
            for (int i = buffer.readPosition(); i < buffer.writePosition(); i++) {
                if (!Character.isWhitespace((char) (buffer.getByte(i) & 0xFF))) {
                    return true;
                }
            }
            return false;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }

    static InboundRequest snapshot(ServerRequest request, boolean bodyPresent) {
        Map<String, String> queryParameters = new LinkedHashMap<>();
        request.queryParams().forEach((name, values) -> putFirst(queryParameters, name, values));

        Map<String, String> headers = new LinkedHashMap<>();
        request.headers().asHttpHeaders().forEach((name, values) -> putFirst(headers, name, values));

        Map<String, String> cookies = new LinkedHashMap<>();
        request.cookies().forEach((name, values) -> putFirst(cookies, name,
                values.stream().map(HttpCookie::getValue).toList()));

        return InboundRequest.builder()
                .pathParameters(request.pathVariables())
                .queryParameters(queryParameters)
                .headers(headers)
                .cookies(cookies)
                .bodyPresent(bodyPresent)
                .build();
    }

    private static void putFirst(Map<String, String> target, String name, List<String> values) {
        values.stream()
                .filter(Objects::nonNull)
                .findFirst()
                .ifPresent(value -> target.put(name, value));
    }
}

package com.specmock.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.specmock.model.InboundRequest;
import com.specmock.model.MockContract;
import com.specmock.service.impl.ContractLoaderImpl;
import com.specmock.service.impl.ExampleSelectorImpl;
import com.specmock.service.impl.RequestVerifierImpl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.net.URL;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the registered routes through the WebFlux router, with the contract loaded from
 * {@code petstore-mock.yaml}.
 */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class RouteRegistrarTest {

    private WebTestClient client;

    @BeforeAll
    void setUp() throws Exception {
        URL resource = getClass().getClassLoader().getResource("petstore-mock.yaml");
        assertThat(resource).isNotNull();
        MockContract contract = new ContractLoaderImpl().load(Paths.get(resource.toURI()).toFile().getAbsolutePath());

        DispatchHandler dispatchHandler = new DispatchHandler(
                new RequestVerifierImpl(contract), new ExampleSelectorImpl(new ObjectMapper()));
        client = WebTestClient
                .bindToRouterFunction(new RouteRegistrar(dispatchHandler).register(RouteTable.from(contract)))
                .build();
    }

    @Test
    void get_returnsSchemaExampleBeforeMediaTypeExample() {
        client.get().uri("/pets")
                .header("X-Trace-Id", "t-1")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_JSON)
                .expectBody().json("[{\"id\":1,\"name\":\"Rex\"}]");
    }

    @Test
    void get_missingRequiredHeader_returnsFirstDeclared400Example() {
        client.get().uri("/pets")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().json("{\"error\":\"missing trace\"}");
    }

    @Test
    void get_invalidEnumValue_honorsExampleHeaderOnErrorResponses() {
        client.get().uri("/pets?status=lost")
                .header("X-Trace-Id", "t-1")
                .header(InboundRequest.EXAMPLE_HEADER, "badStatus")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().json("{\"error\":\"bad status\"}");
    }

    @Test
    void get_literalPathWinsOverTemplateAndAllowsAnonymousAccess() {
        client.get().uri("/pets/search")
                .exchange()
                .expectStatus().isOk()
                .expectBody().json("{\"results\":[]}");
    }

    @Test
    void get_apiKeyInQuery_isRequired() {
        client.get().uri("/pets/42")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody().json("{\"error\":\"api key required\"}");

        client.get().uri("/pets/42?key=")
                .exchange()
                .expectStatus().isUnauthorized();

        client.get().uri("/pets/42?key=secret")
                .exchange()
                .expectStatus().isOk()
                .expectBody().json("{\"id\":1,\"name\":\"Rex\"}");
    }

    @Test
    void get_exampleHeader_selectsNamedSuccessExample() {
        client.get().uri("/pets/42?key=secret")
                .header(InboundRequest.EXAMPLE_HEADER, "fido")
                .exchange()
                .expectStatus().isOk()
                .expectBody().json("{\"id\":4,\"name\":\"Fido\"}");
    }

    @Test
    void post_requiredBody_isCheckedAfterAuthentication() {
        client.post().uri("/pets")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"name\":\"Rex\"}")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody().json("{\"error\":\"unauthorized\"}");

        client.post().uri("/pets")
                .header(HttpHeaders.AUTHORIZATION, "Bearer token")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().json("{\"error\":\"body required\"}");

        client.post().uri("/pets")
                .header(HttpHeaders.AUTHORIZATION, "Bearer token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("anything at all")
                .exchange()
                .expectStatus().isOk()
                .expectBody().json("{\"id\":3}");
    }

    @Test
    void post_bodyLargerThanTheCodecBuffer_isAccepted() {
        String largeBody = "{\"name\":\"" + "x".repeat(300_000) + "\"}";

        client.post().uri("/pets")
                .header(HttpHeaders.AUTHORIZATION, "Bearer token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(largeBody)
                .exchange()
                .expectStatus().isOk()
                .expectBody().json("{\"id\":3}");
    }

    @Test
    void post_whitespaceOnlyBody_countsAsMissing() {
        client.post().uri("/pets")
                .header(HttpHeaders.AUTHORIZATION, "Bearer token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(" \n\t ")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().json("{\"error\":\"body required\"}");
    }

    @Test
    void delete_requirementWithTwoSchemes_passesWhenBothArePresent() {
        client.delete().uri("/pets/42")
                .header("X-API-Key", "secret")
                .header(HttpHeaders.AUTHORIZATION, "Basic dXNlcjpwYXNz")
                .exchange()
                .expectStatus().isOk()
                .expectBody().json("{\"deleted\":true}");
    }

    @Test
    void delete_unsupportedSchemeReached_isReportedAsServerError() {
        client.delete().uri("/pets/42")
                .header("X-API-Key", "secret")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody(String.class).value(body -> assertThat(body).contains("OAuth"));
    }

    @Test
    void get_responseWithoutJsonContent_isReportedAsServerError() {
        client.get().uri("/pets/42/toys")
                .cookie("session", "s-1")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody(String.class).value(body -> assertThat(body).contains("JSON"));
    }

    @Test
    void undeclaredMethod_isNotRouted() {
        client.put().uri("/pets")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void repeatedRequests_returnIdenticalBodies() {
        String first = client.get().uri("/pets/42?key=secret")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).returnResult().getResponseBody();

        for (int i = 0; i < 5; i++) {
            client.get().uri("/pets/42?key=secret")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody(String.class).isEqualTo(first);
        }
    }
}

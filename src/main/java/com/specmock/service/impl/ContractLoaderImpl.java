package com.specmock.service.impl;

import com.specmock.exception.ContractLoadException;
import com.specmock.model.ApiKeyLocation;
import com.specmock.model.ApiKeySecurityScheme;
import com.specmock.model.HttpAuthScheme;
import com.specmock.model.HttpSecurityScheme;
import com.specmock.model.MediaTypeExamples;
import com.specmock.model.MockContract;
import com.specmock.model.MockOperation;
import com.specmock.model.OperationParameter;
import com.specmock.model.ParameterLocation;
import com.specmock.model.PathDefinition;
import com.specmock.model.RequestBodyDefinition;
import com.specmock.model.ResponseDefinition;
import com.specmock.model.SecurityRequirementDefinition;
import com.specmock.model.SecuritySchemeDefinition;
import com.specmock.model.UnsupportedSecurityScheme;
import com.specmock.service.api.ContractLoader;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.examples.Example;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.parser.OpenAPIV3Parser;
import io.swagger.v3.parser.core.models.ParseOptions;
import io.swagger.v3.parser.core.models.SwaggerParseResult;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class ContractLoaderImpl implements ContractLoader {

    /**
     * {@inheritDoc}
     * This implementation uses the swagger-parser library with full reference resolution, so
     * {@code $ref} parameters, bodies, responses and examples arrive inlined. It then walks
     * every path and operation once, converting them into the immutable contract model.
     */
    @Override
    public MockContract load(String source) {
        if (!StringUtils.hasText(source)) {
            throw new ContractLoadException("No OpenAPI contract configured. Set 'mock.spec-path' (or MOCK_SPEC_PATH) to a file path or URL.");
        }
        log.info("Loading OpenAPI contract from: {}", source);

        ParseOptions options = new ParseOptions();
        options.setResolve(true);
        options.setResolveFully(true);

        SwaggerParseResult result;
        try {
            result = new OpenAPIV3Parser().readLocation(source, null, options);
        } catch (RuntimeException e) {
            throw new ContractLoadException("Failed to read the OpenAPI contract from: " + source, e);
        }

        OpenAPI openAPI = result == null ? null : result.getOpenAPI();
        if (openAPI == null) {
            List<String> messages = result == null || result.getMessages() == null ? List.of() : result.getMessages();
            throw new ContractLoadException("OpenAPI contract could not be read from " + source
                    + ". Check the path to the file and verify it is correctly formatted. " + messages);
        }
        if (result.getMessages() != null) {
            result.getMessages().forEach(message -> log.warn("Contract {}: {}", source, message));
        }

        Map<String, SecuritySchemeDefinition> securitySchemes = new LinkedHashMap<>();
        if (openAPI.getComponents() != null && openAPI.getComponents().getSecuritySchemes() != null) {
            openAPI.getComponents().getSecuritySchemes()
                    .forEach((name, scheme) -> securitySchemes.put(name, toSecurityScheme(name, scheme)));
        }

        Map<String, PathDefinition> paths = new LinkedHashMap<>();
        if (openAPI.getPaths() != null) {
            openAPI.getPaths().forEach((path, pathItem) -> paths.put(path, toPathDefinition(path, pathItem, openAPI)));
        }

        MockContract contract = new MockContract(paths, securitySchemes);
        log.info("Successfully parsed {} operations on {} paths from the contract.", contract.operationCount(), paths.size());
        return contract;
    }

    private PathDefinition toPathDefinition(String path, PathItem pathItem, OpenAPI openAPI) {
        Map<HttpMethod, MockOperation> operations = new LinkedHashMap<>();
        pathItem.readOperationsMap().forEach((method, operation) -> operations.put(
                HttpMethod.valueOf(method.name()),
                toOperation(HttpMethod.valueOf(method.name()), path, pathItem, operation, openAPI)));
        return new PathDefinition(operations);
    }

    private MockOperation toOperation(HttpMethod method, String path, PathItem pathItem, Operation operation, OpenAPI openAPI) {
        // Use the operationId if present, otherwise generate a predictable one
        String operationId = operation.getOperationId() != null
                ? operation.getOperationId()
                : generateOperationId(method.name(), path);

        return MockOperation.builder()
                .method(method)
                .path(path)
                .operationId(operationId)
                .parameters(mergeParameters(operationId, pathItem.getParameters(), operation.getParameters()))
                .requestBody(operation.getRequestBody() == null
                        ? null
                        : new RequestBodyDefinition(Boolean.TRUE.equals(operation.getRequestBody().getRequired())))
                .security(toSecurityRequirements(operation.getSecurity() != null ? operation.getSecurity() : openAPI.getSecurity()))
                .responses(toResponses(operation))
                .build();
    }

    /**
     * Path-level parameters apply to every operation on the path. An operation-level
     * parameter with the same name and location replaces the path-level one.
     */
    private List<OperationParameter> mergeParameters(String operationId, List<Parameter> pathLevel, List<Parameter> operationLevel) {
        Map<String, OperationParameter> merged = new LinkedHashMap<>();
        for (List<Parameter> parameters : List.of(
                Optional.ofNullable(pathLevel).orElse(Collections.emptyList()),
                Optional.ofNullable(operationLevel).orElse(Collections.emptyList()))) {
            for (Parameter parameter : parameters) {
                toParameter(operationId, parameter)
                        .ifPresent(p -> merged.put(p.location() + ":" + p.name(), p));
            }
        }
        return new ArrayList<>(merged.values());
    }

    private Optional<OperationParameter> toParameter(String operationId, Parameter parameter) {
        Optional<ParameterLocation> location = ParameterLocation.fromOpenApi(parameter.getIn());
        if (parameter.getName() == null || location.isEmpty()) {
            log.warn("Ignoring parameter '{}' (in: {}) of operation '{}': unsupported or unresolved parameter.",
                    parameter.getName(), parameter.getIn(), operationId);
            return Optional.empty();
        }

        List<String> allowedValues = List.of();
        if (parameter.getSchema() != null && parameter.getSchema().getEnum() != null) {
            allowedValues = ((List<?>) parameter.getSchema().getEnum()).stream()
                    .filter(Objects::nonNull)
                    .map(String::valueOf)
                    .collect(Collectors.toList());
        }

        return Optional.of(OperationParameter.builder()
                .name(parameter.getName())
                .location(location.get())
                .required(Boolean.TRUE.equals(parameter.getRequired()))
                .allowedValues(allowedValues)
                .build());
    }

    private List<SecurityRequirementDefinition> toSecurityRequirements(List<SecurityRequirement> security) {
        if (security == null) {
            return List.of();
        }
        return security.stream()
                .map(requirement -> new SecurityRequirementDefinition(requirement.keySet()))
                .collect(Collectors.toList());
    }

    private Map<String, ResponseDefinition> toResponses(Operation operation) {
        Map<String, ResponseDefinition> responses = new LinkedHashMap<>();
        if (operation.getResponses() == null) {
            return responses;
        }
        for (Map.Entry<String, ApiResponse> entry : operation.getResponses().entrySet()) {
            Map<String, MediaTypeExamples> content = new LinkedHashMap<>();
            if (entry.getValue().getContent() != null) {
                entry.getValue().getContent().forEach((contentType, mediaType) -> content.put(contentType, toExamples(mediaType)));
            }
            responses.put(entry.getKey(), new ResponseDefinition(content));
        }
        return responses;
    }

    private MediaTypeExamples toExamples(MediaType mediaType) {
        Map<String, Object> named = new LinkedHashMap<>();
        if (mediaType.getExamples() != null) {
            for (Map.Entry<String, Example> example : mediaType.getExamples().entrySet()) {
                named.put(example.getKey(), example.getValue() == null ? null : example.getValue().getValue());
            }
        }
        Object schemaExample = mediaType.getSchema() == null ? null : mediaType.getSchema().getExample();
        return new MediaTypeExamples(asContractText(schemaExample), mediaType.getExample(), named);
    }

    /**
     * The parser turns examples of {@code format: date} and {@code format: date-time} schemas
     * into {@link Date} and {@link OffsetDateTime}. Those are written back as ISO text so they
     * are served like any other string example.
     */
    private Object asContractText(Object example) {
        if (example instanceof Date date) {
            return date.toInstant().atOffset(ZoneOffset.UTC).toLocalDate().format(DateTimeFormatter.ISO_LOCAL_DATE);
        }
        if (example instanceof OffsetDateTime dateTime) {
            return dateTime.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        return example;
    }

    private SecuritySchemeDefinition toSecurityScheme(String name, SecurityScheme scheme) {
        if (scheme.getType() == SecurityScheme.Type.APIKEY) {
            Optional<ApiKeyLocation> location = scheme.getIn() == null
                    ? Optional.empty()
                    : ApiKeyLocation.fromOpenApi(scheme.getIn().name());
            if (location.isEmpty() || !StringUtils.hasText(scheme.getName())) {
                return new UnsupportedSecurityScheme(name, "apiKey without a supported location or a parameter name");
            }
            return new ApiKeySecurityScheme(scheme.getName(), location.get());
        }
        if (scheme.getType() == SecurityScheme.Type.HTTP) {
            return HttpAuthScheme.fromOpenApi(scheme.getScheme())
                    .<SecuritySchemeDefinition>map(HttpSecurityScheme::new)
                    .orElseGet(() -> new UnsupportedSecurityScheme(name, "http scheme '" + scheme.getScheme() + "'"));
        }
        return new UnsupportedSecurityScheme(name, "type '" + scheme.getType() + "'");
    }

    private String generateOperationId(String httpMethod, String path) {
        String sanitizedPath = path
                .replaceAll("\\{", "by_")
                .replaceAll("[{}/]", "_")
                .replaceAll("__", "_")
                .replaceAll("^_|_$", "");
        return httpMethod.toLowerCase() + "_" + sanitizedPath;
    }
}

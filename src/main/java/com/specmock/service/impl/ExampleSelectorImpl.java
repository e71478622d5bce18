package com.specmock.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specmock.exception.ContractConfigurationException;
import com.specmock.model.MediaTypeExamples;
import com.specmock.model.MockOperation;
import com.specmock.model.ResponseDefinition;
import com.specmock.service.api.ExampleSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ExampleSelectorImpl implements ExampleSelector {

    private final ObjectMapper objectMapper;

    public ExampleSelectorImpl(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * {@inheritDoc}
     * <p>
     * The priority order for fetching examples is as follows:
     * <ol>
     *     <li>If an example name is given (from the {@code X-Mock-Response-Example} header),
     *     that named example is returned, and it must exist.</li>
     *     <li>Otherwise the {@code example} of the media type's schema.</li>
     *     <li>Then the media type's own {@code example}.</li>
     *     <li>Then the first of the media type's {@code examples}.</li>
     * </ol>
     * If none of these yield a value, a {@link ContractConfigurationException} is raised.
     */
    @Override
    public String select(MockOperation operation, int status, String exampleName) {
        ResponseDefinition response = operation.response(status)
                .orElseThrow(() -> new ContractConfigurationException("The OpenAPI contract contains no " + status
                        + " response for " + operation));
        MediaTypeExamples json = response.jsonContent()
                .orElseThrow(() -> new ContractConfigurationException("The OpenAPI contract contains no JSON " + status
                        + " response for " + operation));

        Object example;
        if (exampleName != null) {
            if (!json.namedExamples().containsKey(exampleName) || json.namedExamples().get(exampleName) == null) {
                throw new ContractConfigurationException("The OpenAPI contract contains no example named '" + exampleName
                        + "' in the " + status + " response for " + operation);
            }
            example = json.namedExamples().get(exampleName);
        } else {
            example = json.schemaExample() != null ? json.schemaExample() : exampleFromMediaType(json);
            if (example == null) {
                throw new ContractConfigurationException("The OpenAPI contract contains no " + status
                        + " response examples for " + operation);
            }
        }
        log.debug("Selected {} example{} for {}", status, exampleName == null ? "" : " '" + exampleName + "'", operation);
        return render(example);
    }

    private Object exampleFromMediaType(MediaTypeExamples json) {
        return json.example() != null ? json.example() : json.firstNamedExample().orElse(null);
    }

    /**
     * Strings are returned verbatim; everything else (Jackson trees, numbers, booleans) is
     * written as JSON.
     */
    private String render(Object example) {
        if (example instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(example);
        } catch (JsonProcessingException e) {
            throw new ContractConfigurationException("Example value of type " + example.getClass().getName()
                    + " could not be written as JSON", e);
        }
    }
}

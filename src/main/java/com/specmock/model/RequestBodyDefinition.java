package com.specmock.model;

/**
 * The request body descriptor of an operation. Only presence is ever checked.
 *
 * @param required Whether a non-blank body must be sent.
 */
public record RequestBodyDefinition(boolean required) {
}

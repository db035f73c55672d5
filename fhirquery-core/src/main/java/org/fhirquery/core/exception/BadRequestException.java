package org.fhirquery.core.exception;

/**
 * Exception thrown when a search request is syntactically or semantically malformed.
 */
public class BadRequestException extends FhirException {

    public BadRequestException(String message) {
        super(message, "invalid");
    }

    public BadRequestException(String message, Throwable cause) {
        super(message, "invalid", cause);
    }
}

package org.fhirquery.core.exception;

/**
 * Exception thrown when the shape of a search request is invalid,
 * e.g. an unknown compartment type or a missing compartment id.
 */
public class InvalidSearchOperationException extends FhirException {

    public InvalidSearchOperationException(String message) {
        super(message, "invalid");
    }
}

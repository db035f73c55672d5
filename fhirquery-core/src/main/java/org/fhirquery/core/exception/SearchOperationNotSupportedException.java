package org.fhirquery.core.exception;

/**
 * Exception thrown when a search request is valid but asks for behaviour
 * this server does not implement.
 */
public class SearchOperationNotSupportedException extends FhirException {

    public SearchOperationNotSupportedException(String message) {
        super(message, "not-supported");
    }
}

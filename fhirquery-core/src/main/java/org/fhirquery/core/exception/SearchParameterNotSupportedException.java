package org.fhirquery.core.exception;

/**
 * Exception thrown when a search parameter is not defined for a resource type.
 * <p>
 * Callers compiling a whole query treat this as recoverable and report the
 * parameter back to the client instead of failing the request.
 * </p>
 */
public class SearchParameterNotSupportedException extends FhirException {

    private final String resourceType;
    private final String parameterName;

    public SearchParameterNotSupportedException(String resourceType, String parameterName) {
        super(String.format("Search parameter '%s' is not supported for resource type '%s'",
                        parameterName, resourceType),
                "not-supported");
        this.resourceType = resourceType;
        this.parameterName = parameterName;
    }

    public SearchParameterNotSupportedException(String message) {
        super(message, "not-supported");
        this.resourceType = null;
        this.parameterName = null;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getParameterName() {
        return parameterName;
    }
}

package org.fhirquery.core.exception;

/**
 * Exception thrown when a resource type is not known to the server.
 */
public class ResourceNotSupportedException extends FhirException {

    private final String resourceType;

    public ResourceNotSupportedException(String resourceType) {
        super(String.format("Resource type '%s' is not supported", resourceType),
                "not-supported",
                String.format("The resource type %s is not a known FHIR resource type", resourceType));
        this.resourceType = resourceType;
    }

    public String getResourceType() {
        return resourceType;
    }
}

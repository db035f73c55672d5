package org.fhirquery.core.resource;

import org.fhirquery.core.context.FhirContextFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Knows which resource type names are valid FHIR resource types.
 */
@Component
public class ResourceTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(ResourceTypeRegistry.class);

    private final FhirContextFactory contextFactory;
    private volatile Set<String> resourceTypes;

    public ResourceTypeRegistry(FhirContextFactory contextFactory) {
        this.contextFactory = contextFactory;
    }

    /**
     * Returns true if the name is a concrete FHIR resource type. Matching is case-sensitive.
     */
    public boolean isKnownResourceType(String resourceType) {
        if (resourceType == null || resourceType.isBlank()) {
            return false;
        }
        return getResourceTypes().contains(resourceType);
    }

    /**
     * Returns the names of all concrete resource types.
     */
    public Set<String> getResourceTypes() {
        Set<String> result = resourceTypes;
        if (result == null) {
            result = Set.copyOf(contextFactory.getContext().getResourceTypes());
            resourceTypes = result;
            log.debug("Resolved {} resource types", result.size());
        }
        return result;
    }
}

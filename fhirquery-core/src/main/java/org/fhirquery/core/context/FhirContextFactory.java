package org.fhirquery.core.context;

import ca.uhn.fhir.context.FhirContext;

/**
 * Supplies the shared HAPI FHIR context.
 * <p>
 * HAPI FHIR contexts are expensive to create and should be reused.
 * Search parameter definitions and resource type names are read from it.
 * </p>
 */
public interface FhirContextFactory {

    /**
     * Returns the cached FhirContext instance.
     */
    FhirContext getContext();
}

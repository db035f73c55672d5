package org.fhirquery.core.searchparam;

/**
 * Codes of search parameters the search compiler refers to directly.
 */
public final class SearchParameterNames {

    public static final String RESOURCE_TYPE = "_type";

    /**
     * Root type used when a search is not scoped to a resource type.
     * Only parameters common to all domain resources resolve against it.
     */
    public static final String DOMAIN_RESOURCE = "DomainResource";

    /**
     * Type owning the parameters that apply to every resource.
     */
    public static final String RESOURCE = "Resource";

    private SearchParameterNames() {
    }
}

package org.fhirquery.core.searchparam;

import org.fhirquery.core.exception.SearchParameterNotSupportedException;

import java.util.List;
import java.util.Optional;

/**
 * Resolves search parameter definitions by resource type and code.
 */
public interface SearchParameterDefinitionManager {

    /**
     * Returns the parameter with the given code for a resource type, including
     * parameters inherited from Resource and DomainResource.
     *
     * @throws SearchParameterNotSupportedException if no such parameter is defined
     */
    SearchParameterInfo getSearchParameter(String resourceType, String code);

    /**
     * Returns the parameter with the given code, or empty if it is not defined.
     */
    Optional<SearchParameterInfo> findSearchParameter(String resourceType, String code);

    /**
     * Returns every parameter applicable to a resource type.
     */
    List<SearchParameterInfo> getSearchParameters(String resourceType);
}

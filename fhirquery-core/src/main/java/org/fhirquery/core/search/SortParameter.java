package org.fhirquery.core.search;

import org.fhirquery.core.searchparam.SearchParameterInfo;

/**
 * A resolved, sortable {@code _sort} key.
 */
public record SortParameter(SearchParameterInfo searchParameter, SortOrder sortOrder) {
}

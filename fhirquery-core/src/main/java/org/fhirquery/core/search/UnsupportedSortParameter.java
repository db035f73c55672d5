package org.fhirquery.core.search;

/**
 * A {@code _sort} key that was dropped, with the reason reported back to the client.
 */
public record UnsupportedSortParameter(String parameterName, String reason) {
}

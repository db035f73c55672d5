package org.fhirquery.core.search;

/**
 * One raw {@code key=value} pair from the request query string.
 */
public record QueryParameter(String key, String value) {

    public static QueryParameter of(String key, String value) {
        return new QueryParameter(key, value);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}

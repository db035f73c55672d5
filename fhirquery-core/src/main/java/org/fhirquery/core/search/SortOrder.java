package org.fhirquery.core.search;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a {@code _sort} key.
 */
public enum SortOrder {

    ASCENDING("asc"),
    DESCENDING("desc");

    private final String code;

    SortOrder(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}

package org.fhirquery.core.search.expression;

/**
 * Index columns a leaf comparison can target.
 */
public enum FieldName {

    STRING("String"),
    TOKEN_CODE("TokenCode"),
    TOKEN_SYSTEM("TokenSystem"),
    NUMBER("Number"),
    DATE_TIME_START("DateTimeStart"),
    DATE_TIME_END("DateTimeEnd"),
    REFERENCE_BASE_URI("ReferenceBaseUri"),
    REFERENCE_RESOURCE_TYPE("ReferenceResourceType"),
    REFERENCE_RESOURCE_ID("ReferenceResourceId"),
    URI("Uri"),
    QUANTITY("Quantity"),
    QUANTITY_CODE("QuantityCode"),
    QUANTITY_SYSTEM("QuantitySystem");

    private final String displayName;

    FieldName(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}

package org.fhirquery.core.search.expression;

/**
 * Operators of {@link StringExpression}.
 */
public enum StringOperator {
    EQUALS,
    NOT_EQUALS,
    STARTS_WITH,
    ENDS_WITH,
    CONTAINS
}

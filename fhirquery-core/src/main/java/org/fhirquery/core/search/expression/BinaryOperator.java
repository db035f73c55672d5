package org.fhirquery.core.search.expression;

/**
 * Comparison operators of {@link BinaryExpression}.
 */
public enum BinaryOperator {
    EQUAL,
    NOT_EQUAL,
    GREATER_THAN,
    GREATER_THAN_OR_EQUAL,
    LESS_THAN,
    LESS_THAN_OR_EQUAL
}

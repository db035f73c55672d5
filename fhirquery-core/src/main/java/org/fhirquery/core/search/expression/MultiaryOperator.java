package org.fhirquery.core.search.expression;

/**
 * Boolean combinators of {@link MultiaryExpression}.
 */
public enum MultiaryOperator {
    AND,
    OR
}

package org.fhirquery.sql.expression;

/**
 * Role of a {@link TableExpression} in a search plan.
 */
public enum TableExpressionKind {

    /**
     * Base filter producing the matching resources.
     */
    ALL,

    /**
     * Intermediate filter over a normalized search parameter table.
     */
    NORMAL,

    /**
     * Paging: keeps the first page of matches.
     */
    TOP,

    /**
     * Counts the matches instead of returning them.
     */
    COUNT,

    /**
     * Pulls in resources through an _include or _revinclude step.
     */
    INCLUDE,

    /**
     * Bounds the rows the preceding include step may add.
     */
    INCLUDE_LIMIT,

    /**
     * Unions the matches with the rows of every include step.
     */
    INCLUDE_UNION_ALL
}

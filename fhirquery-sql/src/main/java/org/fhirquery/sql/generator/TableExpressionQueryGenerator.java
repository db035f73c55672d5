package org.fhirquery.sql.generator;

/**
 * Handle selecting the SQL generator for one entry of a search plan.
 * <p>
 * Plan rewriting copies these handles between entries but never calls them.
 * </p>
 */
public interface TableExpressionQueryGenerator {

    /**
     * Stable name, used in plan dumps and logs.
     */
    String getName();
}

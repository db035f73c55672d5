package org.fhirquery.sql.generator;

/**
 * Joins the resources referenced by (or referencing) the current result set.
 */
public final class IncludeQueryGenerator implements TableExpressionQueryGenerator {

    public static final IncludeQueryGenerator INSTANCE = new IncludeQueryGenerator();

    private IncludeQueryGenerator() {
    }

    @Override
    public String getName() {
        return "Include";
    }

    @Override
    public String toString() {
        return getName();
    }
}

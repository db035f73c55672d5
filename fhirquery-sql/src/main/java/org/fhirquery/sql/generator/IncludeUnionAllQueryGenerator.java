package org.fhirquery.sql.generator;

/**
 * Unions the search matches with the rows of all include steps.
 */
public final class IncludeUnionAllQueryGenerator implements TableExpressionQueryGenerator {

    public static final IncludeUnionAllQueryGenerator INSTANCE = new IncludeUnionAllQueryGenerator();

    private IncludeUnionAllQueryGenerator() {
    }

    @Override
    public String getName() {
        return "IncludeUnionAll";
    }

    @Override
    public String toString() {
        return getName();
    }
}

package org.fhirquery.sql.generator;

/**
 * Caps the rows added by the include step it follows.
 */
public final class IncludeLimitQueryGenerator implements TableExpressionQueryGenerator {

    public static final IncludeLimitQueryGenerator INSTANCE = new IncludeLimitQueryGenerator();

    private IncludeLimitQueryGenerator() {
    }

    @Override
    public String getName() {
        return "IncludeLimit";
    }

    @Override
    public String toString() {
        return getName();
    }
}

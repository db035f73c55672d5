package org.fhirquery.sql.expression;

import org.fhirquery.core.search.expression.Expression;
import org.fhirquery.sql.generator.TableExpressionQueryGenerator;

import java.util.Objects;

/**
 * One step of a search plan.
 *
 * @param queryGenerator        generator handling this step, null for steps without a dedicated generator
 * @param normalizedPredicate   predicate over a search parameter table, may be null
 * @param denormalizedPredicate predicate over the resource table, may be null
 * @param kind                  role of the step
 */
public record TableExpression(TableExpressionQueryGenerator queryGenerator,
                              Expression normalizedPredicate,
                              Expression denormalizedPredicate,
                              TableExpressionKind kind) {

    public TableExpression {
        Objects.requireNonNull(kind, "kind");
    }

    public static TableExpression of(TableExpressionKind kind) {
        return new TableExpression(null, null, null, kind);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(Table ").append(kind);
        if (queryGenerator != null) {
            sb.append(' ').append(queryGenerator.getName());
        }
        if (normalizedPredicate != null) {
            sb.append(" Normalized:").append(normalizedPredicate);
        }
        if (denormalizedPredicate != null) {
            sb.append(" Denormalized:").append(denormalizedPredicate);
        }
        return sb.append(')').toString();
    }
}

package org.fhirquery.sql.expression;

import org.fhirquery.core.search.expression.Expression;

import java.util.List;

/**
 * A search plan: ordered table steps plus the predicates evaluated directly on the resource table.
 */
public record SqlRootExpression(List<TableExpression> tableExpressions, List<Expression> denormalizedExpressions) {

    public SqlRootExpression {
        tableExpressions = tableExpressions != null ? List.copyOf(tableExpressions) : List.of();
        denormalizedExpressions = denormalizedExpressions != null ? List.copyOf(denormalizedExpressions) : List.of();
    }

    /**
     * Returns a plan with the same denormalized predicates and different table steps.
     */
    public SqlRootExpression withTableExpressions(List<TableExpression> newTableExpressions) {
        return new SqlRootExpression(newTableExpressions, denormalizedExpressions);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(SqlRoot");
        if (!denormalizedExpressions.isEmpty()) {
            sb.append(" (DenormalizedPredicates");
            denormalizedExpressions.forEach(e -> sb.append(' ').append(e));
            sb.append(')');
        }
        sb.append(" (TableExpressions");
        tableExpressions.forEach(t -> sb.append(' ').append(t));
        return sb.append("))").toString();
    }
}

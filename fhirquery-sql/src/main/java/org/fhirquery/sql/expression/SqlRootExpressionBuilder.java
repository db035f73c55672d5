package org.fhirquery.sql.expression;

import org.fhirquery.core.search.SearchOptions;
import org.fhirquery.core.search.expression.Expression;
import org.fhirquery.core.search.expression.IncludeExpression;
import org.fhirquery.core.search.expression.MultiaryExpression;
import org.fhirquery.core.search.expression.MultiaryOperator;
import org.fhirquery.sql.generator.IncludeQueryGenerator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the initial search plan for compiled search options.
 * <p>
 * The plan starts with an {@link TableExpressionKind#ALL} step filtering on every
 * non-include predicate, followed by one {@link TableExpressionKind#INCLUDE} step per
 * include directive in submission order, and ends with {@link TableExpressionKind#TOP}.
 * Count-only searches end with {@link TableExpressionKind#COUNT} and skip includes.
 * </p>
 */
@Component
public class SqlRootExpressionBuilder {

    public SqlRootExpression build(SearchOptions options) {
        List<Expression> denormalized = new ArrayList<>();
        List<TableExpression> includes = new ArrayList<>();

        for (Expression expression : topLevelOperands(options)) {
            if (expression instanceof IncludeExpression include) {
                includes.add(new TableExpression(IncludeQueryGenerator.INSTANCE, include, null, TableExpressionKind.INCLUDE));
            } else {
                denormalized.add(expression);
            }
        }

        List<TableExpression> tables = new ArrayList<>();
        Expression filter = denormalized.isEmpty() ? null : Expression.andIfNeeded(denormalized);
        tables.add(new TableExpression(null, null, filter, TableExpressionKind.ALL));

        if (options.isCountOnly()) {
            tables.add(TableExpression.of(TableExpressionKind.COUNT));
        } else {
            tables.addAll(includes);
            tables.add(TableExpression.of(TableExpressionKind.TOP));
        }

        return new SqlRootExpression(tables, denormalized);
    }

    private static List<Expression> topLevelOperands(SearchOptions options) {
        return options.getExpression()
                .map(expression -> {
                    if (expression instanceof MultiaryExpression multiary
                            && multiary.getOperator() == MultiaryOperator.AND) {
                        return multiary.getExpressions();
                    }
                    return List.of(expression);
                })
                .orElse(List.of());
    }
}

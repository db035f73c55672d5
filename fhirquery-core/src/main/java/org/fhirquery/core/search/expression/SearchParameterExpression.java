package org.fhirquery.core.search.expression;

import org.fhirquery.core.searchparam.SearchParameterInfo;

import java.util.Objects;

/**
 * Scopes a predicate to the index entries of one search parameter.
 */
public final class SearchParameterExpression extends Expression {

    private final SearchParameterInfo parameter;
    private final Expression expression;

    SearchParameterExpression(SearchParameterInfo parameter, Expression expression) {
        this.parameter = Objects.requireNonNull(parameter, "parameter");
        this.expression = Objects.requireNonNull(expression, "expression");
    }

    public SearchParameterInfo getParameter() {
        return parameter;
    }

    public Expression getExpression() {
        return expression;
    }

    @Override
    public <C, R> R accept(ExpressionVisitor<C, R> visitor, C context) {
        return visitor.visitSearchParameter(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SearchParameterExpression other)) {
            return false;
        }
        return parameter.equals(other.parameter) && expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameter, expression);
    }

    @Override
    public String toString() {
        return "(Param " + parameter.getCode() + " " + expression + ")";
    }
}

package org.fhirquery.core.search.expression;

import org.fhirquery.core.searchparam.SearchParameterInfo;

import java.util.Objects;

/**
 * Result of {@code :missing}: matches resources that do (or do not) have any value
 * for a search parameter.
 */
public final class MissingSearchParameterExpression extends Expression {

    private final SearchParameterInfo parameter;
    private final boolean isMissing;

    MissingSearchParameterExpression(SearchParameterInfo parameter, boolean isMissing) {
        this.parameter = Objects.requireNonNull(parameter, "parameter");
        this.isMissing = isMissing;
    }

    public SearchParameterInfo getParameter() {
        return parameter;
    }

    public boolean isMissing() {
        return isMissing;
    }

    @Override
    public <C, R> R accept(ExpressionVisitor<C, R> visitor, C context) {
        return visitor.visitMissingSearchParameter(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MissingSearchParameterExpression other)) {
            return false;
        }
        return parameter.equals(other.parameter) && isMissing == other.isMissing;
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameter, isMissing);
    }

    @Override
    public String toString() {
        return "(" + (isMissing ? "Missing" : "NotMissing") + "Param " + parameter.getCode() + ")";
    }
}

package org.fhirquery.core.search.expression;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * AND or OR over an ordered, non-empty list of operands.
 */
public final class MultiaryExpression extends Expression {

    private final MultiaryOperator operator;
    private final List<Expression> expressions;

    MultiaryExpression(MultiaryOperator operator, List<? extends Expression> expressions) {
        Objects.requireNonNull(expressions, "expressions");
        if (expressions.isEmpty()) {
            throw new IllegalArgumentException(operator + " expression requires at least one operand");
        }
        this.operator = Objects.requireNonNull(operator, "operator");
        this.expressions = List.copyOf(expressions);
    }

    public MultiaryOperator getOperator() {
        return operator;
    }

    public List<Expression> getExpressions() {
        return expressions;
    }

    @Override
    public <C, R> R accept(ExpressionVisitor<C, R> visitor, C context) {
        return visitor.visitMultiary(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MultiaryExpression other)) {
            return false;
        }
        return operator == other.operator && expressions.equals(other.expressions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, expressions);
    }

    @Override
    public String toString() {
        String name = operator == MultiaryOperator.AND ? "And" : "Or";
        return expressions.stream()
                .map(Expression::toString)
                .collect(Collectors.joining(" ", "(" + name + " ", ")"));
    }
}

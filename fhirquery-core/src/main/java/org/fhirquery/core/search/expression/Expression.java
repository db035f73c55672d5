package org.fhirquery.core.search.expression;

import org.fhirquery.core.searchparam.SearchParameterInfo;

import java.util.Arrays;
import java.util.List;

/**
 * Node of a compiled search predicate tree.
 * <p>
 * The set of node types is closed: every subclass lives in this package and is
 * handled by {@link ExpressionVisitor}. Nodes are immutable.
 * </p>
 */
public abstract class Expression {

    Expression() {
    }

    /**
     * Dispatches to the visitor method for this node type.
     */
    public abstract <C, R> R accept(ExpressionVisitor<C, R> visitor, C context);

    public static SearchParameterExpression searchParameter(SearchParameterInfo parameter, Expression expression) {
        return new SearchParameterExpression(parameter, expression);
    }

    public static StringExpression stringEquals(FieldName fieldName, Integer componentIndex, String value, boolean ignoreCase) {
        return new StringExpression(StringOperator.EQUALS, fieldName, componentIndex, value, ignoreCase);
    }

    public static StringExpression string(StringOperator operator, FieldName fieldName, Integer componentIndex,
                                          String value, boolean ignoreCase) {
        return new StringExpression(operator, fieldName, componentIndex, value, ignoreCase);
    }

    public static BinaryExpression binary(BinaryOperator operator, FieldName fieldName, Integer componentIndex, Object value) {
        return new BinaryExpression(operator, fieldName, componentIndex, value);
    }

    public static MissingFieldExpression missingField(FieldName fieldName, Integer componentIndex) {
        return new MissingFieldExpression(fieldName, componentIndex);
    }

    public static MissingSearchParameterExpression missingSearchParameter(SearchParameterInfo parameter, boolean isMissing) {
        return new MissingSearchParameterExpression(parameter, isMissing);
    }

    public static MultiaryExpression and(Expression... expressions) {
        return and(Arrays.asList(expressions));
    }

    public static MultiaryExpression and(List<? extends Expression> expressions) {
        return new MultiaryExpression(MultiaryOperator.AND, expressions);
    }

    public static MultiaryExpression or(Expression... expressions) {
        return or(Arrays.asList(expressions));
    }

    public static MultiaryExpression or(List<? extends Expression> expressions) {
        return new MultiaryExpression(MultiaryOperator.OR, expressions);
    }

    /**
     * Combines operands with AND, returning a lone operand unwrapped.
     */
    public static Expression andIfNeeded(List<? extends Expression> expressions) {
        return expressions.size() == 1 ? expressions.get(0) : and(expressions);
    }

    /**
     * Combines operands with OR, returning a lone operand unwrapped.
     */
    public static Expression orIfNeeded(List<? extends Expression> expressions) {
        return expressions.size() == 1 ? expressions.get(0) : or(expressions);
    }

    public static CompartmentSearchExpression compartmentSearch(String compartmentType, String compartmentId) {
        return new CompartmentSearchExpression(compartmentType, compartmentId);
    }
}

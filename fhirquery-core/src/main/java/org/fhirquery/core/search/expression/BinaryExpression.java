package org.fhirquery.core.search.expression;

import java.util.Objects;

/**
 * Compares a numeric or temporal field with a literal.
 */
public final class BinaryExpression extends Expression {

    private final BinaryOperator operator;
    private final FieldName fieldName;
    private final Integer componentIndex;
    private final Object value;

    BinaryExpression(BinaryOperator operator, FieldName fieldName, Integer componentIndex, Object value) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.componentIndex = componentIndex;
        this.value = Objects.requireNonNull(value, "value");
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public FieldName getFieldName() {
        return fieldName;
    }

    public Integer getComponentIndex() {
        return componentIndex;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public <C, R> R accept(ExpressionVisitor<C, R> visitor, C context) {
        return visitor.visitBinary(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BinaryExpression other)) {
            return false;
        }
        return operator == other.operator
                && fieldName == other.fieldName
                && Objects.equals(componentIndex, other.componentIndex)
                && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, fieldName, componentIndex, value);
    }

    @Override
    public String toString() {
        return "(" + operator + " " + fieldName + " " + value + ")";
    }
}

package org.fhirquery.core.search.expression;

import java.util.Objects;

/**
 * Compares a string-valued field with a literal.
 */
public final class StringExpression extends Expression {

    private final StringOperator operator;
    private final FieldName fieldName;
    private final Integer componentIndex;
    private final String value;
    private final boolean ignoreCase;

    StringExpression(StringOperator operator, FieldName fieldName, Integer componentIndex, String value, boolean ignoreCase) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.componentIndex = componentIndex;
        this.value = Objects.requireNonNull(value, "value");
        this.ignoreCase = ignoreCase;
    }

    public StringOperator getOperator() {
        return operator;
    }

    public FieldName getFieldName() {
        return fieldName;
    }

    /**
     * Component of a composite parameter, or null.
     */
    public Integer getComponentIndex() {
        return componentIndex;
    }

    public String getValue() {
        return value;
    }

    public boolean isIgnoreCase() {
        return ignoreCase;
    }

    @Override
    public <C, R> R accept(ExpressionVisitor<C, R> visitor, C context) {
        return visitor.visitString(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StringExpression other)) {
            return false;
        }
        return operator == other.operator
                && fieldName == other.fieldName
                && Objects.equals(componentIndex, other.componentIndex)
                && value.equals(other.value)
                && ignoreCase == other.ignoreCase;
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, fieldName, componentIndex, value, ignoreCase);
    }

    @Override
    public String toString() {
        return "(String" + operator + (ignoreCase ? "IgnoreCase " : " ") + fieldName + " '" + value + "')";
    }
}

package org.fhirquery.core.search.expression;

import java.util.Objects;

/**
 * Matches index entries where a field has no value.
 */
public final class MissingFieldExpression extends Expression {

    private final FieldName fieldName;
    private final Integer componentIndex;

    MissingFieldExpression(FieldName fieldName, Integer componentIndex) {
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.componentIndex = componentIndex;
    }

    public FieldName getFieldName() {
        return fieldName;
    }

    public Integer getComponentIndex() {
        return componentIndex;
    }

    @Override
    public <C, R> R accept(ExpressionVisitor<C, R> visitor, C context) {
        return visitor.visitMissingField(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MissingFieldExpression other)) {
            return false;
        }
        return fieldName == other.fieldName && Objects.equals(componentIndex, other.componentIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldName, componentIndex);
    }

    @Override
    public String toString() {
        return "(MissingField " + fieldName + ")";
    }
}

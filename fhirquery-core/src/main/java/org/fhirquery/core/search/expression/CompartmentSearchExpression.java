package org.fhirquery.core.search.expression;

import java.util.Objects;

/**
 * Restricts results to the members of one compartment, e.g. everything in Patient/123.
 */
public final class CompartmentSearchExpression extends Expression {

    private final String compartmentType;
    private final String compartmentId;

    CompartmentSearchExpression(String compartmentType, String compartmentId) {
        this.compartmentType = Objects.requireNonNull(compartmentType, "compartmentType");
        this.compartmentId = Objects.requireNonNull(compartmentId, "compartmentId");
    }

    public String getCompartmentType() {
        return compartmentType;
    }

    public String getCompartmentId() {
        return compartmentId;
    }

    @Override
    public <C, R> R accept(ExpressionVisitor<C, R> visitor, C context) {
        return visitor.visitCompartment(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompartmentSearchExpression other)) {
            return false;
        }
        return compartmentType.equals(other.compartmentType) && compartmentId.equals(other.compartmentId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(compartmentType, compartmentId);
    }

    @Override
    public String toString() {
        return "(Compartment " + compartmentType + " '" + compartmentId + "')";
    }
}

package org.fhirquery.core.search.expression;

import org.fhirquery.core.exception.BadRequestException;
import org.fhirquery.core.searchparam.SearchParameterInfo;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An {@code _include} or {@code _revinclude} directive.
 * <p>
 * A forward include pulls in the resources referenced through
 * {@link #getReferenceSearchParameter()} by resources of
 * {@link #getSourceResourceType()}; a reversed include pulls in resources of the
 * source type that reference resources already in the result. With
 * {@link #isIterate()} the directive also applies to resources added by other
 * include steps.
 * </p>
 */
public final class IncludeExpression extends Expression {

    private final String resourceType;
    private final SearchParameterInfo referenceSearchParameter;
    private final String sourceResourceType;
    private final String targetResourceType;
    private final boolean wildCard;
    private final boolean reversed;
    private final boolean iterate;

    /**
     * @param resourceType             the resource type being searched
     * @param referenceSearchParameter the reference parameter followed, null for a wildcard
     * @param sourceResourceType       the type owning the reference
     * @param targetResourceType       the referenced type, null when not narrowed by the client
     * @throws BadRequestException if a reversed iterate include needs a target type to be unambiguous
     */
    public IncludeExpression(String resourceType,
                             SearchParameterInfo referenceSearchParameter,
                             String sourceResourceType,
                             String targetResourceType,
                             boolean wildCard,
                             boolean reversed,
                             boolean iterate) {
        this.resourceType = Objects.requireNonNull(resourceType, "resourceType");
        this.sourceResourceType = Objects.requireNonNull(sourceResourceType, "sourceResourceType");
        if (!wildCard) {
            Objects.requireNonNull(referenceSearchParameter, "referenceSearchParameter");
        }

        if (reversed && iterate && targetResourceType == null
                && referenceSearchParameter != null
                && referenceSearchParameter.getTargetResourceTypes().size() > 1) {
            throw new BadRequestException(String.format(
                    "The target resource type must be specified for _revinclude:iterate on '%s:%s' "
                            + "because the parameter can reference more than one resource type: %s",
                    sourceResourceType, referenceSearchParameter.getCode(),
                    referenceSearchParameter.getTargetResourceTypes()));
        }

        this.referenceSearchParameter = referenceSearchParameter;
        this.targetResourceType = targetResourceType;
        this.wildCard = wildCard;
        this.reversed = reversed;
        this.iterate = iterate;
    }

    public String getResourceType() {
        return resourceType;
    }

    public SearchParameterInfo getReferenceSearchParameter() {
        return referenceSearchParameter;
    }

    public String getSourceResourceType() {
        return sourceResourceType;
    }

    public String getTargetResourceType() {
        return targetResourceType;
    }

    public boolean isWildCard() {
        return wildCard;
    }

    public boolean isReversed() {
        return reversed;
    }

    public boolean isIterate() {
        return iterate;
    }

    /**
     * Resource types this step adds to the result.
     */
    public Set<String> produces() {
        if (reversed) {
            return Set.of(sourceResourceType);
        }
        return referencedTypes();
    }

    /**
     * Resource types that must already be in the result for this step to find anything.
     * Empty unless the step iterates.
     */
    public Set<String> requires() {
        if (!iterate) {
            return Set.of();
        }
        if (reversed) {
            return referencedTypes();
        }
        return Set.of(sourceResourceType);
    }

    private Set<String> referencedTypes() {
        if (targetResourceType != null) {
            return Set.of(targetResourceType);
        }
        if (referenceSearchParameter == null) {
            return Set.of();
        }
        List<String> targets = referenceSearchParameter.getTargetResourceTypes();
        return Set.copyOf(targets);
    }

    @Override
    public <C, R> R accept(ExpressionVisitor<C, R> visitor, C context) {
        return visitor.visitInclude(this, context);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IncludeExpression other)) {
            return false;
        }
        return wildCard == other.wildCard
                && reversed == other.reversed
                && iterate == other.iterate
                && resourceType.equals(other.resourceType)
                && Objects.equals(referenceSearchParameter, other.referenceSearchParameter)
                && sourceResourceType.equals(other.sourceResourceType)
                && Objects.equals(targetResourceType, other.targetResourceType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resourceType, referenceSearchParameter, sourceResourceType, targetResourceType,
                wildCard, reversed, iterate);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(")
                .append(reversed ? "RevInclude" : "Include")
                .append(iterate ? ":iterate " : " ")
                .append(sourceResourceType)
                .append(':')
                .append(wildCard ? "*" : referenceSearchParameter.getCode());
        if (targetResourceType != null) {
            sb.append(':').append(targetResourceType);
        }
        return sb.append(')').toString();
    }
}

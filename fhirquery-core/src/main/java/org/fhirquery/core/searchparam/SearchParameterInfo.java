package org.fhirquery.core.searchparam;

import org.hl7.fhir.r5.model.Enumerations.SearchParamType;

import java.util.List;
import java.util.Objects;

/**
 * Immutable view of a search parameter definition as search compilation needs it.
 * <p>
 * Built by {@link SearchParameterRegistry} from FHIR SearchParameter resources, or
 * directly for parameters synthesized by the server.
 * </p>
 */
public final class SearchParameterInfo {

    private final String code;
    private final String name;
    private final String url;
    private final SearchParamType type;
    private final String expression;
    private final List<String> targetResourceTypes;
    private final boolean sortSupported;

    public SearchParameterInfo(String code, String name, String url, SearchParamType type,
                               String expression, List<String> targetResourceTypes, boolean sortSupported) {
        this.code = Objects.requireNonNull(code, "code");
        this.name = name != null ? name : code;
        this.url = url;
        this.type = type;
        this.expression = expression;
        this.targetResourceTypes = targetResourceTypes != null ? List.copyOf(targetResourceTypes) : List.of();
        this.sortSupported = sortSupported;
    }

    /**
     * Creates an untyped parameter known only by its code.
     */
    public SearchParameterInfo(String code) {
        this(code, code, null, null, null, List.of(), false);
    }

    /**
     * Creates a reference parameter with the given target types.
     */
    public static SearchParameterInfo reference(String code, List<String> targetResourceTypes) {
        return new SearchParameterInfo(code, code, null, SearchParamType.REFERENCE, null, targetResourceTypes, false);
    }

    /**
     * The code used in query strings (e.g. "general-practitioner").
     */
    public String getCode() {
        return code;
    }

    public String getName() {
        return name;
    }

    public String getUrl() {
        return url;
    }

    public SearchParamType getType() {
        return type;
    }

    /**
     * The FHIRPath expression, filtered to the resource type the parameter was resolved for.
     */
    public String getExpression() {
        return expression;
    }

    /**
     * Resource types a reference parameter may point to; empty for other types.
     */
    public List<String> getTargetResourceTypes() {
        return targetResourceTypes;
    }

    public boolean isSortSupported() {
        return sortSupported;
    }

    public boolean isReference() {
        return type == SearchParamType.REFERENCE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SearchParameterInfo other)) {
            return false;
        }
        return code.equals(other.code) && Objects.equals(url, other.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, url);
    }

    @Override
    public String toString() {
        return "SearchParameterInfo{code=" + code + ", type=" + (type != null ? type.toCode() : null) + "}";
    }
}

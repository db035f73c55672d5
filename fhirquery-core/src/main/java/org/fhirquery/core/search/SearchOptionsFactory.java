package org.fhirquery.core.search;

import org.fhirquery.core.config.SearchProperties;
import org.fhirquery.core.exception.BadRequestException;
import org.fhirquery.core.exception.InvalidSearchOperationException;
import org.fhirquery.core.exception.ResourceNotSupportedException;
import org.fhirquery.core.exception.SearchOperationNotSupportedException;
import org.fhirquery.core.exception.SearchParameterNotSupportedException;
import org.fhirquery.core.resource.ResourceTypeRegistry;
import org.fhirquery.core.search.expression.Expression;
import org.fhirquery.core.search.expression.FieldName;
import org.fhirquery.core.search.expression.IncludeExpression;
import org.fhirquery.core.search.expression.parser.ExpressionParser;
import org.fhirquery.core.searchparam.SearchParameterDefinitionManager;
import org.fhirquery.core.searchparam.SearchParameterInfo;
import org.fhirquery.core.searchparam.SearchParameterNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Compiles the query parameters of a search request into {@link SearchOptions}.
 * <p>
 * Structural parameters (continuation token, {@code _total}, {@code _count},
 * {@code _summary}, {@code _sort}, includes) are validated and applied; every other
 * parameter is parsed into an expression scoped to the resource type. Parameters the
 * server does not support, and sort keys it cannot sort on, are reported in the result
 * instead of failing the request. All other problems abort compilation with a
 * {@link org.fhirquery.core.exception.FhirException}.
 * </p>
 */
@Component
public class SearchOptionsFactory {

    private static final Logger log = LoggerFactory.getLogger(SearchOptionsFactory.class);

    static final String SUPPORTED_TOTAL_TYPES = "'" + TotalType.ACCURATE.getCode() + "', '" + TotalType.NONE.getCode() + "'";

    private final ExpressionParser expressionParser;
    private final SearchParameterDefinitionManager definitionManager;
    private final ResourceTypeRegistry resourceTypeRegistry;

    private final int defaultItemCountPerSearch;
    private final int maxItemCountPerSearch;
    private final int defaultIncludeCountPerSearch;
    private final TotalType includeTotalInBundle;

    public SearchOptionsFactory(ExpressionParser expressionParser,
                                SearchParameterDefinitionManager definitionManager,
                                ResourceTypeRegistry resourceTypeRegistry,
                                SearchProperties properties) {
        this.expressionParser = expressionParser;
        this.definitionManager = definitionManager;
        this.resourceTypeRegistry = resourceTypeRegistry;
        this.defaultItemCountPerSearch = properties.getDefaultItemCountPerSearch();
        this.maxItemCountPerSearch = properties.getMaxItemCountPerSearch();
        this.defaultIncludeCountPerSearch = properties.getDefaultIncludeCountPerSearch();
        this.includeTotalInBundle = properties.getIncludeTotalInBundle();
    }

    /**
     * Compiles a search that is not scoped to a compartment.
     */
    public SearchOptions create(String resourceType, List<QueryParameter> queryParameters) {
        return create(null, null, resourceType, queryParameters);
    }

    /**
     * Compiles a search.
     *
     * @param compartmentType the compartment type (e.g. "Patient"), or null
     * @param compartmentId   the compartment owner id, required with a compartment type
     * @param resourceType    the resource type searched, or null for a system-wide search
     * @param queryParameters the query parameters in request order
     */
    public SearchOptions create(String compartmentType, String compartmentId, String resourceType,
                                List<QueryParameter> queryParameters) {
        SearchOptions.Builder options = SearchOptions.builder();

        String continuationToken = null;
        TotalType includeTotal = null;
        boolean setDefaultBundleTotal = true;

        SearchParams searchParams = new SearchParams();
        List<QueryParameter> unsupportedSearchParameters = new ArrayList<>();

        for (QueryParameter query : queryParameters != null ? queryParameters : List.<QueryParameter>of()) {
            String key = query.key();
            String value = query.value();

            if (KnownQueryParameterNames.CONTINUATION_TOKEN.equals(key)) {
                // Query parameter mapping upstream keeps only one continuation token
                if (continuationToken != null) {
                    throw new InvalidSearchOperationException(String.format(
                            "Only one '%s' query parameter is allowed", KnownQueryParameterNames.CONTINUATION_TOKEN));
                }

                continuationToken = decodeContinuationToken(value);
                setDefaultBundleTotal = false;
            } else if (KnownQueryParameterNames.FORMAT.equals(key)) {
                // Content negotiation is handled by the HTTP layer
                log.trace("Ignoring {} parameter", KnownQueryParameterNames.FORMAT);
            } else if (isBlank(key) || isBlank(value)) {
                unsupportedSearchParameters.add(query);
            } else if (KnownQueryParameterNames.TOTAL.equalsIgnoreCase(key)) {
                TotalType totalType = TotalType.parse(value)
                        .orElseThrow(() -> new BadRequestException(String.format(
                                "The '%s' value for _total is not valid. The supported values are: %s.",
                                value, SUPPORTED_TOTAL_TYPES)));
                validateTotalType(totalType);

                includeTotal = totalType;
                setDefaultBundleTotal = false;
            } else {
                try {
                    searchParams.add(key, value);
                } catch (IllegalArgumentException e) {
                    throw new BadRequestException(e.getMessage(), e);
                }
            }
        }

        options.continuationToken(continuationToken);

        if (setDefaultBundleTotal) {
            validateTotalType(includeTotalInBundle);
            includeTotal = includeTotalInBundle;
        }
        options.includeTotal(includeTotal != null ? includeTotal : TotalType.NONE);

        Integer count = searchParams.getCount();
        if (count != null) {
            if (count > maxItemCountPerSearch) {
                throw new BadRequestException(String.format(
                        "The _count parameter exceeds the maximum of %d items per search (requested %d).",
                        maxItemCountPerSearch, count));
            }
            options.maxItemCount(count);
        } else {
            options.maxItemCount(defaultItemCountPerSearch);
        }

        options.includeCount(defaultIncludeCountPerSearch);
        options.countOnly(searchParams.getSummary() == SummaryType.COUNT);
        options.elements(searchParams.getElements());

        // Without a resource type only the parameters common to all resources resolve
        String parsedResourceType = SearchParameterNames.DOMAIN_RESOURCE;
        if (!isBlank(resourceType)) {
            if (!resourceTypeRegistry.isKnownResourceType(resourceType)) {
                throw new ResourceNotSupportedException(resourceType);
            }
            parsedResourceType = resourceType;
        }

        List<Expression> searchExpressions = new ArrayList<>();

        if (!isBlank(resourceType)) {
            SearchParameterInfo resourceTypeParameter = definitionManager.getSearchParameter(
                    SearchParameterNames.RESOURCE, SearchParameterNames.RESOURCE_TYPE);
            searchExpressions.add(Expression.searchParameter(resourceTypeParameter,
                    Expression.stringEquals(FieldName.TOKEN_CODE, null, resourceType, false)));
        }

        for (QueryParameter parameter : searchParams.getParameters()) {
            if (KnownQueryParameterNames.isAnyIncludeIterate(parameter.key())) {
                continue;
            }
            try {
                searchExpressions.add(expressionParser.parse(parsedResourceType, parameter.key(), parameter.value()));
            } catch (SearchParameterNotSupportedException e) {
                log.debug("Search parameter {} is not supported for {}: {}", parameter.key(), parsedResourceType, e.getMessage());
                unsupportedSearchParameters.add(parameter);
            }
        }

        for (String include : searchParams.getInclude()) {
            searchExpressions.add(expressionParser.parseInclude(parsedResourceType, include, false, false));
        }

        for (String revInclude : searchParams.getRevInclude()) {
            searchExpressions.add(expressionParser.parseInclude(parsedResourceType, revInclude, true, false));
        }

        // _include:iterate may appear without a preceding _include when applied on a circular reference
        searchExpressions.addAll(parseIncludeIterateExpressions(searchParams, false));
        searchExpressions.addAll(parseIncludeIterateExpressions(searchParams, true));

        if (!isBlank(compartmentType)) {
            if (CompartmentType.fromCode(compartmentType).isEmpty()) {
                throw new InvalidSearchOperationException(String.format(
                        "Compartment type '%s' is invalid.", compartmentType));
            }
            if (isBlank(compartmentId)) {
                throw new InvalidSearchOperationException("Compartment id is null or empty.");
            }
            searchExpressions.add(Expression.compartmentSearch(compartmentType, compartmentId));
        }

        if (searchExpressions.size() == 1) {
            options.expression(searchExpressions.get(0));
        } else if (searchExpressions.size() > 1) {
            options.expression(Expression.and(searchExpressions));
        }

        if (!unsupportedSearchParameters.isEmpty()) {
            log.debug("Ignoring unsupported search parameters for {}: {}", parsedResourceType, unsupportedSearchParameters);
        }
        options.unsupportedSearchParams(unsupportedSearchParameters);

        resolveSort(searchParams, parsedResourceType, options);

        return options.build();
    }

    private List<IncludeExpression> parseIncludeIterateExpressions(SearchParams searchParams, boolean reversed) {
        List<IncludeExpression> expressions = new ArrayList<>();

        for (QueryParameter parameter : searchParams.getParameters()) {
            if (!KnownQueryParameterNames.isIncludeIterate(parameter.key(), reversed)) {
                continue;
            }

            String includeResourceType = parameter.value().split(":", -1)[0];
            String parsedIncludeResourceType = SearchParameterNames.DOMAIN_RESOURCE;
            if (!isBlank(includeResourceType)) {
                if (!resourceTypeRegistry.isKnownResourceType(includeResourceType)) {
                    throw new ResourceNotSupportedException(includeResourceType);
                }
                parsedIncludeResourceType = includeResourceType;
            }

            // Reversed iterate includes on a polymorphic reference are rejected by IncludeExpression
            expressions.add(expressionParser.parseInclude(parsedIncludeResourceType, parameter.value(), reversed, true));
        }

        return expressions;
    }

    private void resolveSort(SearchParams searchParams, String resourceType, SearchOptions.Builder options) {
        List<SortParameter> sortings = new ArrayList<>();
        List<UnsupportedSortParameter> unsupportedSortings = new ArrayList<>();

        for (SearchParams.SortEntry sorting : searchParams.getSort()) {
            Optional<SearchParameterInfo> parameter = definitionManager.findSearchParameter(resourceType, sorting.parameterName());

            if (parameter.isPresent() && parameter.get().isSortSupported()) {
                sortings.add(new SortParameter(parameter.get(), sorting.sortOrder()));
            } else {
                log.debug("Sort parameter {} is not supported for {}", sorting.parameterName(), resourceType);
                unsupportedSortings.add(new UnsupportedSortParameter(sorting.parameterName(),
                        String.format("The sort parameter '%s' is not supported.", sorting.parameterName())));
            }
        }

        options.sort(sortings);
        options.unsupportedSortingParams(unsupportedSortings);
    }

    private static String decodeContinuationToken(String value) {
        if (value == null) {
            throw new BadRequestException("The continuation token is invalid.");
        }
        try {
            return new String(Base64.getDecoder().decode(value), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("The continuation token is invalid.", e);
        }
    }

    private static void validateTotalType(TotalType totalType) {
        if (totalType == TotalType.ESTIMATE) {
            throw new SearchOperationNotSupportedException(String.format(
                    "The '%s' value for _total is not supported. The supported values are: %s.",
                    totalType.getCode(), SUPPORTED_TOTAL_TYPES));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

package org.fhirquery.core.search;

import org.fhirquery.core.search.expression.Expression;

import java.util.List;
import java.util.Optional;

/**
 * Compiled form of a search request: the predicate tree plus paging, sorting and
 * total-count settings, and the inputs that were not understood.
 * <p>
 * Instances are immutable and created by {@link SearchOptionsFactory}.
 * </p>
 */
public class SearchOptions {

    private final String continuationToken;
    private final int maxItemCount;
    private final int includeCount;
    private final boolean countOnly;
    private final TotalType includeTotal;
    private final Expression expression;
    private final List<SortParameter> sort;
    private final List<QueryParameter> unsupportedSearchParams;
    private final List<UnsupportedSortParameter> unsupportedSortingParams;
    private final List<String> elements;

    private SearchOptions(Builder builder) {
        if (builder.includeTotal == TotalType.ESTIMATE) {
            throw new IllegalStateException("Total type 'estimate' cannot be part of compiled search options");
        }
        this.continuationToken = builder.continuationToken;
        this.maxItemCount = builder.maxItemCount;
        this.includeCount = builder.includeCount;
        this.countOnly = builder.countOnly;
        this.includeTotal = builder.includeTotal != null ? builder.includeTotal : TotalType.NONE;
        this.expression = builder.expression;
        this.sort = builder.sort != null ? List.copyOf(builder.sort) : List.of();
        this.unsupportedSearchParams = builder.unsupportedSearchParams != null
                ? List.copyOf(builder.unsupportedSearchParams) : List.of();
        this.unsupportedSortingParams = builder.unsupportedSortingParams != null
                ? List.copyOf(builder.unsupportedSortingParams) : List.of();
        this.elements = builder.elements != null ? List.copyOf(builder.elements) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The decoded continuation token, if the client is paging.
     */
    public Optional<String> getContinuationToken() {
        return Optional.ofNullable(continuationToken);
    }

    /**
     * Page size.
     */
    public int getMaxItemCount() {
        return maxItemCount;
    }

    /**
     * Maximum number of resources each include step may add.
     */
    public int getIncludeCount() {
        return includeCount;
    }

    public boolean isCountOnly() {
        return countOnly;
    }

    public TotalType getIncludeTotal() {
        return includeTotal;
    }

    /**
     * The root predicate, or empty when the search has no criteria.
     */
    public Optional<Expression> getExpression() {
        return Optional.ofNullable(expression);
    }

    public List<SortParameter> getSort() {
        return sort;
    }

    /**
     * Query parameters that were ignored because they are empty or not supported.
     */
    public List<QueryParameter> getUnsupportedSearchParams() {
        return unsupportedSearchParams;
    }

    /**
     * Sort keys that were ignored, with the reason for each.
     */
    public List<UnsupportedSortParameter> getUnsupportedSortingParams() {
        return unsupportedSortingParams;
    }

    /**
     * Element names requested with {@code _elements}, empty when the full resource is returned.
     */
    public List<String> getElements() {
        return elements;
    }

    @Override
    public String toString() {
        return "SearchOptions{" +
                "continuationToken=" + continuationToken +
                ", maxItemCount=" + maxItemCount +
                ", includeCount=" + includeCount +
                ", countOnly=" + countOnly +
                ", includeTotal=" + includeTotal +
                ", expression=" + expression +
                ", sort=" + sort +
                ", unsupportedSearchParams=" + unsupportedSearchParams +
                ", unsupportedSortingParams=" + unsupportedSortingParams +
                ", elements=" + elements +
                '}';
    }

    public static class Builder {
        private String continuationToken;
        private int maxItemCount;
        private int includeCount;
        private boolean countOnly;
        private TotalType includeTotal;
        private Expression expression;
        private List<SortParameter> sort;
        private List<QueryParameter> unsupportedSearchParams;
        private List<UnsupportedSortParameter> unsupportedSortingParams;
        private List<String> elements;

        public Builder continuationToken(String continuationToken) {
            this.continuationToken = continuationToken;
            return this;
        }

        public Builder maxItemCount(int maxItemCount) {
            this.maxItemCount = maxItemCount;
            return this;
        }

        public Builder includeCount(int includeCount) {
            this.includeCount = includeCount;
            return this;
        }

        public Builder countOnly(boolean countOnly) {
            this.countOnly = countOnly;
            return this;
        }

        public Builder includeTotal(TotalType includeTotal) {
            this.includeTotal = includeTotal;
            return this;
        }

        public Builder expression(Expression expression) {
            this.expression = expression;
            return this;
        }

        public Builder sort(List<SortParameter> sort) {
            this.sort = sort;
            return this;
        }

        public Builder unsupportedSearchParams(List<QueryParameter> unsupportedSearchParams) {
            this.unsupportedSearchParams = unsupportedSearchParams;
            return this;
        }

        public Builder unsupportedSortingParams(List<UnsupportedSortParameter> unsupportedSortingParams) {
            this.unsupportedSortingParams = unsupportedSortingParams;
            return this;
        }

        public Builder elements(List<String> elements) {
            this.elements = elements;
            return this;
        }

        public SearchOptions build() {
            return new SearchOptions(this);
        }
    }
}

package org.fhirquery.core.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates the non-structural query parameters of a search.
 * <p>
 * Only syntax is checked here (integer {@code _count}, known {@code _summary} codes,
 * well formed {@code _sort}); whether a parameter exists for the resource type is
 * decided later by the expression parser. Invalid input raises
 * {@link IllegalArgumentException}.
 * </p>
 * <p>
 * Modifiers on {@code _include}/{@code _revinclude} are not modelled: such keys
 * (e.g. {@code _include:iterate}) are kept in {@link #getParameters()}.
 * </p>
 */
public class SearchParams {

    private Integer count;
    private SummaryType summary;
    private final List<SortEntry> sort = new ArrayList<>();
    private final List<String> include = new ArrayList<>();
    private final List<String> revInclude = new ArrayList<>();
    private final List<String> elements = new ArrayList<>();
    private final List<QueryParameter> parameters = new ArrayList<>();

    /**
     * Adds one query parameter.
     *
     * @throws IllegalArgumentException if the value is not valid for a structural key
     */
    public SearchParams add(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Search parameter name cannot be empty");
        }

        switch (key) {
            case KnownQueryParameterNames.COUNT -> setCount(value);
            case KnownQueryParameterNames.SUMMARY -> setSummary(value);
            case KnownQueryParameterNames.SORT -> addSort(value);
            case KnownQueryParameterNames.INCLUDE -> include.add(requireValue(key, value));
            case KnownQueryParameterNames.REVINCLUDE -> revInclude.add(requireValue(key, value));
            case KnownQueryParameterNames.ELEMENTS -> addElements(value);
            default -> parameters.add(QueryParameter.of(key, value));
        }
        return this;
    }

    private void setCount(String value) {
        if (count != null) {
            throw new IllegalArgumentException("The _count parameter can only be specified once");
        }
        int parsed;
        try {
            parsed = Integer.parseInt(requireValue(KnownQueryParameterNames.COUNT, value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("The _count parameter must be an integer, got '" + value + "'", e);
        }
        if (parsed < 0) {
            throw new IllegalArgumentException("The _count parameter must be zero or greater, got '" + value + "'");
        }
        count = parsed;
    }

    private void setSummary(String value) {
        summary = SummaryType.fromCode(value)
                .orElseThrow(() -> new IllegalArgumentException(
                        "The _summary parameter value '" + value + "' is not valid. Supported values: true, false, text, data, count"));
    }

    private void addSort(String value) {
        for (String item : requireValue(KnownQueryParameterNames.SORT, value).split(",", -1)) {
            String name = item.trim();
            SortOrder order = SortOrder.ASCENDING;
            if (name.startsWith("-")) {
                order = SortOrder.DESCENDING;
                name = name.substring(1).trim();
            }
            if (name.isEmpty()) {
                throw new IllegalArgumentException("The _sort parameter contains an empty sort key: '" + value + "'");
            }
            sort.add(new SortEntry(name, order));
        }
    }

    private void addElements(String value) {
        for (String element : requireValue(KnownQueryParameterNames.ELEMENTS, value).split(",")) {
            if (!element.isBlank()) {
                elements.add(element.trim());
            }
        }
    }

    private static String requireValue(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("The " + key + " parameter requires a value");
        }
        return value;
    }

    /**
     * The requested page size, or null if {@code _count} was not given.
     */
    public Integer getCount() {
        return count;
    }

    public SummaryType getSummary() {
        return summary;
    }

    public List<SortEntry> getSort() {
        return Collections.unmodifiableList(sort);
    }

    public List<String> getInclude() {
        return Collections.unmodifiableList(include);
    }

    public List<String> getRevInclude() {
        return Collections.unmodifiableList(revInclude);
    }

    public List<String> getElements() {
        return Collections.unmodifiableList(elements);
    }

    /**
     * Every parameter without a structural meaning, in submission order.
     */
    public List<QueryParameter> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    /**
     * A requested sort key before it is resolved against the parameter definitions.
     */
    public record SortEntry(String parameterName, SortOrder sortOrder) {
    }
}

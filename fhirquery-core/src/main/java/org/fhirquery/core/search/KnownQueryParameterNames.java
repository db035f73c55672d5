package org.fhirquery.core.search;

import java.util.List;

/**
 * Query parameter names with a structural meaning to search.
 */
public final class KnownQueryParameterNames {

    public static final String CONTINUATION_TOKEN = "ct";
    public static final String FORMAT = "_format";
    public static final String TOTAL = "_total";
    public static final String COUNT = "_count";
    public static final String SUMMARY = "_summary";
    public static final String SORT = "_sort";
    public static final String ELEMENTS = "_elements";
    public static final String INCLUDE = "_include";
    public static final String REVINCLUDE = "_revinclude";

    /**
     * Spellings of {@code _include} with the iterate modifier. The parameter accumulator
     * does not model modifiers on {@code _include}, so these stay in the generic
     * parameter list and are matched by name, ignoring case.
     */
    public static final List<String> INCLUDE_ITERATE_MODIFIERS = List.of("_include:iterate", "_include:recurse");

    /**
     * Spellings of {@code _revinclude} with the iterate modifier.
     */
    public static final List<String> REVINCLUDE_ITERATE_MODIFIERS = List.of("_revinclude:iterate", "_revinclude:recurse");

    private KnownQueryParameterNames() {
    }

    public static boolean isIncludeIterate(String key, boolean reversed) {
        List<String> modifiers = reversed ? REVINCLUDE_ITERATE_MODIFIERS : INCLUDE_ITERATE_MODIFIERS;
        return key != null && modifiers.stream().anyMatch(m -> m.equalsIgnoreCase(key));
    }

    public static boolean isAnyIncludeIterate(String key) {
        return isIncludeIterate(key, false) || isIncludeIterate(key, true);
    }
}

package org.fhirquery.core.search;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Values of the {@code _summary} search result parameter.
 */
public enum SummaryType {

    TRUE("true"),
    FALSE("false"),
    TEXT("text"),
    DATA("data"),
    COUNT("count");

    private static final Map<String, SummaryType> CODE_MAP = Arrays.stream(values())
            .collect(Collectors.toMap(s -> s.code, Function.identity()));

    private final String code;

    SummaryType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Parses a summary type from its exact code.
     */
    public static Optional<SummaryType> fromCode(String code) {
        return Optional.ofNullable(code == null ? null : CODE_MAP.get(code));
    }
}

package org.fhirquery.core.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Values of the {@code _total} search result parameter.
 */
public enum TotalType {

    /**
     * No total is calculated.
     */
    NONE("none"),

    /**
     * An estimated total. Accepted by the grammar but not implemented.
     */
    ESTIMATE("estimate"),

    /**
     * The exact number of matches.
     */
    ACCURATE("accurate");

    private static final Map<String, TotalType> CODE_MAP = Arrays.stream(values())
            .collect(Collectors.toMap(t -> t.code, Function.identity()));

    private final String code;

    TotalType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Parses a total type from its code, ignoring case.
     *
     * @return the matching type, or empty if the code is unknown
     */
    public static Optional<TotalType> parse(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(CODE_MAP.get(code.trim().toLowerCase(Locale.ROOT)));
    }

    @JsonCreator
    public static TotalType fromCode(String code) {
        return parse(code).orElseThrow(() -> new IllegalArgumentException(
                "Unknown total type: " + code + ". Supported types: " + Arrays.toString(values())));
    }
}

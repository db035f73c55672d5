package org.fhirquery.core.search;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * FHIR compartment types a search can be scoped to.
 */
public enum CompartmentType {

    PATIENT("Patient"),
    ENCOUNTER("Encounter"),
    RELATED_PERSON("RelatedPerson"),
    PRACTITIONER("Practitioner"),
    DEVICE("Device");

    private static final Map<String, CompartmentType> CODE_MAP = Arrays.stream(values())
            .collect(Collectors.toMap(c -> c.code, Function.identity()));

    private final String code;

    CompartmentType(String code) {
        this.code = code;
    }

    /**
     * Returns the resource type name owning the compartment (e.g. "Patient").
     */
    public String getCode() {
        return code;
    }

    /**
     * Parses a compartment type from its resource type name. Matching is case-sensitive,
     * as resource type names are.
     */
    public static Optional<CompartmentType> fromCode(String code) {
        return Optional.ofNullable(code == null ? null : CODE_MAP.get(code));
    }
}

package org.fhirquery.core.search.expression;

import org.fhirquery.core.exception.BadRequestException;
import org.fhirquery.core.searchparam.SearchParameterInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IncludeExpression")
class IncludeExpressionTest {

    private static final SearchParameterInfo GENERAL_PRACTITIONER = SearchParameterInfo.reference(
            "general-practitioner", List.of("Organization", "Practitioner", "PractitionerRole"));
    private static final SearchParameterInfo PATIENT = SearchParameterInfo.reference("patient", List.of("Patient"));

    @Test
    @DisplayName("should produce the referenced types of a forward include")
    void shouldProduceReferencedTypes() {
        IncludeExpression include = new IncludeExpression("Patient", GENERAL_PRACTITIONER, "Patient",
                null, false, false, false);

        assertEquals(Set.of("Organization", "Practitioner", "PractitionerRole"), include.produces());
        assertEquals(Set.of(), include.requires());
    }

    @Test
    @DisplayName("should narrow produced types to the target type")
    void shouldNarrowToTargetType() {
        IncludeExpression include = new IncludeExpression("Patient", GENERAL_PRACTITIONER, "Patient",
                "Practitioner", false, false, true);

        assertEquals(Set.of("Practitioner"), include.produces());
        assertEquals(Set.of("Patient"), include.requires());
    }

    @Test
    @DisplayName("should produce the source type of a revinclude and require the referenced type when iterating")
    void shouldDescribeReversedInclude() {
        IncludeExpression include = new IncludeExpression("Organization", PATIENT, "MedicationRequest",
                null, false, true, true);

        assertEquals(Set.of("MedicationRequest"), include.produces());
        assertEquals(Set.of("Patient"), include.requires());
    }

    @Test
    @DisplayName("should reject revinclude:iterate on a polymorphic reference without target type")
    void shouldRejectAmbiguousReversedIterate() {
        BadRequestException ex = assertThrows(BadRequestException.class,
                () -> new IncludeExpression("Organization", GENERAL_PRACTITIONER, "Patient", null, false, true, true));
        assertEquals("invalid", ex.getIssueCode());
    }

    @Test
    @DisplayName("should allow a polymorphic revinclude without iterate")
    void shouldAllowPolymorphicRevInclude() {
        assertDoesNotThrow(() -> new IncludeExpression("Organization", GENERAL_PRACTITIONER, "Patient",
                null, false, true, false));
    }

    @Test
    @DisplayName("should describe itself")
    void shouldDescribeItself() {
        IncludeExpression include = new IncludeExpression("Organization", GENERAL_PRACTITIONER, "Patient",
                "Organization", false, true, true);

        assertEquals("(RevInclude:iterate Patient:general-practitioner:Organization)", include.toString());
    }
}

package org.fhirquery.core.config;

import org.fhirquery.core.exception.BadRequestException;
import org.fhirquery.core.exception.ResourceNotSupportedException;
import org.fhirquery.core.search.QueryParameter;
import org.fhirquery.core.search.SearchOptions;
import org.fhirquery.core.search.SearchOptionsFactory;
import org.fhirquery.core.search.SortOrder;
import org.fhirquery.core.search.TotalType;
import org.fhirquery.core.search.UnsupportedSortParameter;
import org.fhirquery.core.search.expression.IncludeExpression;
import org.fhirquery.core.search.expression.MultiaryExpression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Wires the auto-configured search beans against the bundled search parameter definitions.
 */
@SpringBootTest(classes = SearchCoreConfigurationTest.TestConfig.class)
@DisplayName("SearchCoreConfiguration")
class SearchCoreConfigurationTest {

    @Configuration
    @EnableAutoConfiguration
    static class TestConfig {
    }

    @Autowired
    private SearchProperties searchProperties;

    @Autowired
    private SearchOptionsFactory searchOptionsFactory;

    @Test
    @DisplayName("should bind fhirquery.search properties")
    void shouldBindProperties() {
        assertThat(searchProperties.getDefaultItemCountPerSearch()).isEqualTo(20);
        assertThat(searchProperties.getMaxItemCountPerSearch()).isEqualTo(500);
        assertThat(searchProperties.getDefaultIncludeCountPerSearch()).isEqualTo(100);
        assertThat(searchProperties.getIncludeTotalInBundle()).isEqualTo(TotalType.ACCURATE);
    }

    @Test
    @DisplayName("should compile a search with the configured defaults")
    void shouldCompileWithConfiguredDefaults() {
        SearchOptions options = searchOptionsFactory.create("Patient", List.of(
                QueryParameter.of("family", "Smith"),
                QueryParameter.of("shoe-size", "42"),
                QueryParameter.of("_sort", "-birthdate,gender")));

        assertThat(options.getMaxItemCount()).isEqualTo(20);
        assertThat(options.getIncludeTotal()).isEqualTo(TotalType.ACCURATE);
        assertThat(options.getUnsupportedSearchParams()).containsExactly(QueryParameter.of("shoe-size", "42"));
        assertThat(options.getSort()).hasSize(1);
        assertThat(options.getSort().get(0).searchParameter().getCode()).isEqualTo("birthdate");
        assertThat(options.getSort().get(0).sortOrder()).isEqualTo(SortOrder.DESCENDING);
        assertThat(options.getUnsupportedSortingParams()).extracting(UnsupportedSortParameter::parameterName).containsExactly("gender");
        assertThat(options.getExpression()).get().isInstanceOf(MultiaryExpression.class);
    }

    @Test
    @DisplayName("should compile include chains against the bundled definitions")
    void shouldCompileIncludeChain() {
        SearchOptions options = searchOptionsFactory.create("MedicationDispense", List.of(
                QueryParameter.of("_include:iterate", "Patient:general-practitioner"),
                QueryParameter.of("_include:iterate", "MedicationRequest:patient"),
                QueryParameter.of("_include", "MedicationDispense:prescription"),
                QueryParameter.of("_id", "smart-MedicationDispense-567")));

        MultiaryExpression and = (MultiaryExpression) options.getExpression().orElseThrow();
        assertThat(and.getExpressions()).hasSize(5);
        assertThat(and.getExpressions().subList(2, 5))
                .allSatisfy(expression -> assertThat(expression).isInstanceOf(IncludeExpression.class))
                .extracting(expression -> ((IncludeExpression) expression).getSourceResourceType())
                .containsExactly("MedicationDispense", "Patient", "MedicationRequest");
    }

    @Test
    @DisplayName("should enforce the configured maximum page size")
    void shouldEnforceConfiguredMaximum() {
        assertThatThrownBy(() -> searchOptionsFactory.create("Patient", List.of(QueryParameter.of("_count", "501"))))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("500");
    }

    @Test
    @DisplayName("should reject resource types unknown to the FHIR context")
    void shouldRejectUnknownResourceType() {
        assertThatThrownBy(() -> searchOptionsFactory.create("Unicorn", List.of()))
                .isInstanceOf(ResourceNotSupportedException.class);
    }
}

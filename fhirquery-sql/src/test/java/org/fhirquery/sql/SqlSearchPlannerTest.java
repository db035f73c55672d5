package org.fhirquery.sql;

import org.fhirquery.core.search.QueryParameter;
import org.fhirquery.core.search.SearchOptions;
import org.fhirquery.core.search.SearchOptionsFactory;
import org.fhirquery.core.search.expression.IncludeExpression;
import org.fhirquery.sql.expression.SqlRootExpression;
import org.fhirquery.sql.expression.TableExpression;
import org.fhirquery.sql.expression.TableExpressionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Configuration;

import java.util.List;

import static org.fhirquery.sql.expression.TableExpressionKind.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Compiles query strings with the real search parameter definitions and plans them.
 */
@SpringBootTest(classes = SqlSearchPlannerTest.TestConfig.class)
@DisplayName("SqlSearchPlanner")
class SqlSearchPlannerTest {

    @Configuration
    @EnableAutoConfiguration
    static class TestConfig {
    }

    @Autowired
    private SearchOptionsFactory searchOptionsFactory;

    @Autowired
    private SqlSearchPlanner planner;

    @Test
    @DisplayName("should linearize an include:iterate chain on MedicationDispense")
    void shouldLinearizeMedicationDispenseChain() {
        SearchOptions options = searchOptionsFactory.create("MedicationDispense", List.of(
                QueryParameter.of("_include:iterate", "Patient:general-practitioner"),
                QueryParameter.of("_include:iterate", "MedicationRequest:patient"),
                QueryParameter.of("_include", "MedicationDispense:prescription"),
                QueryParameter.of("_id", "smart-MedicationDispense-567")));

        SqlRootExpression root = planner.plan(options);

        List<TableExpression> tables = root.tableExpressions();
        assertEquals(List.of(ALL, TOP, INCLUDE, INCLUDE_LIMIT, INCLUDE, INCLUDE_LIMIT, INCLUDE, INCLUDE_LIMIT,
                INCLUDE_UNION_ALL), tables.stream().map(TableExpression::kind).toList());

        assertInclude(tables.get(2), "MedicationDispense", "prescription");
        assertInclude(tables.get(4), "MedicationRequest", "patient");
        assertInclude(tables.get(6), "Patient", "general-practitioner");

        assertEquals(2, root.denormalizedExpressions().size());
    }

    @Test
    @DisplayName("should place revinclude steps before the include reading their output")
    void shouldLinearizeOrganizationRevincludeChain() {
        SearchOptions options = searchOptionsFactory.create("Organization", List.of(
                QueryParameter.of("_include:iterate", "MedicationDispense:prescription"),
                QueryParameter.of("_revinclude:iterate", "MedicationDispense:patient"),
                QueryParameter.of("_revinclude", "Patient:organization")));

        List<TableExpression> tables = planner.plan(options).tableExpressions();

        assertEquals(9, tables.size());
        assertInclude(tables.get(2), "Patient", "organization");
        assertInclude(tables.get(4), "MedicationDispense", "patient");
        assertInclude(tables.get(6), "MedicationDispense", "prescription");
    }

    @Test
    @DisplayName("should plan a count-only search without include steps")
    void shouldPlanCountOnlySearch() {
        SearchOptions options = searchOptionsFactory.create("Patient", List.of(
                QueryParameter.of("_summary", "count"),
                QueryParameter.of("_revinclude", "MedicationRequest:patient")));

        List<TableExpressionKind> kinds = planner.plan(options).tableExpressions().stream()
                .map(TableExpression::kind)
                .toList();

        assertEquals(List.of(ALL, COUNT), kinds);
    }

    private static void assertInclude(TableExpression table, String sourceType, String parameterCode) {
        assertEquals(INCLUDE, table.kind());
        IncludeExpression include = assertInstanceOf(IncludeExpression.class, table.normalizedPredicate());
        assertEquals(sourceType, include.getSourceResourceType());
        assertEquals(parameterCode, include.getReferenceSearchParameter().getCode());
    }
}

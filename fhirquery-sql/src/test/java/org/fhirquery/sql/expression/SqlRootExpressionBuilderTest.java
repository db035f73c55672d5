package org.fhirquery.sql.expression;

import org.fhirquery.core.search.SearchOptions;
import org.fhirquery.core.search.expression.Expression;
import org.fhirquery.core.search.expression.FieldName;
import org.fhirquery.core.search.expression.IncludeExpression;
import org.fhirquery.core.searchparam.SearchParameterInfo;
import org.fhirquery.sql.generator.IncludeQueryGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SqlRootExpressionBuilder")
class SqlRootExpressionBuilderTest {

    private static final Expression TYPE_FILTER = Expression.searchParameter(new SearchParameterInfo("_type"),
            Expression.stringEquals(FieldName.TOKEN_CODE, null, "MedicationDispense", false));
    private static final Expression ID_FILTER = Expression.searchParameter(new SearchParameterInfo("_id"),
            Expression.stringEquals(FieldName.TOKEN_CODE, null, "md1", false));
    private static final IncludeExpression PRESCRIPTION = new IncludeExpression("MedicationDispense",
            SearchParameterInfo.reference("prescription", List.of("MedicationRequest")),
            "MedicationDispense", null, false, false, false);

    private final SqlRootExpressionBuilder builder = new SqlRootExpressionBuilder();

    @Test
    @DisplayName("should build All and Top for a search without criteria")
    void shouldBuildEmptyPlan() {
        SqlRootExpression root = builder.build(SearchOptions.builder().maxItemCount(10).build());

        assertThat(root.tableExpressions())
                .extracting(TableExpression::kind)
                .containsExactly(TableExpressionKind.ALL, TableExpressionKind.TOP);
        assertThat(root.tableExpressions().get(0).denormalizedPredicate()).isNull();
        assertThat(root.denormalizedExpressions()).isEmpty();
    }

    @Test
    @DisplayName("should use a single predicate without an And wrapper")
    void shouldUseSinglePredicate() {
        SqlRootExpression root = builder.build(SearchOptions.builder().expression(TYPE_FILTER).build());

        assertThat(root.tableExpressions().get(0).denormalizedPredicate()).isEqualTo(TYPE_FILTER);
        assertThat(root.denormalizedExpressions()).containsExactly(TYPE_FILTER);
    }

    @Test
    @DisplayName("should split includes from filters in a top-level And")
    void shouldSplitIncludesFromFilters() {
        SearchOptions options = SearchOptions.builder()
                .expression(Expression.and(TYPE_FILTER, ID_FILTER, PRESCRIPTION))
                .build();

        SqlRootExpression root = builder.build(options);

        assertThat(root.tableExpressions())
                .extracting(TableExpression::kind)
                .containsExactly(TableExpressionKind.ALL, TableExpressionKind.INCLUDE, TableExpressionKind.TOP);
        assertThat(root.tableExpressions().get(0).denormalizedPredicate())
                .isEqualTo(Expression.and(TYPE_FILTER, ID_FILTER));

        TableExpression include = root.tableExpressions().get(1);
        assertThat(include.queryGenerator()).isSameAs(IncludeQueryGenerator.INSTANCE);
        assertThat(include.normalizedPredicate()).isEqualTo(PRESCRIPTION);
        assertThat(root.denormalizedExpressions()).containsExactly(TYPE_FILTER, ID_FILTER);
    }

    @Test
    @DisplayName("should keep a top-level Or as a single filter")
    void shouldKeepTopLevelOr() {
        Expression or = Expression.or(TYPE_FILTER, ID_FILTER);

        SqlRootExpression root = builder.build(SearchOptions.builder().expression(or).build());

        assertThat(root.denormalizedExpressions()).containsExactly(or);
    }

    @Test
    @DisplayName("should end with Count and drop includes for count-only searches")
    void shouldBuildCountPlan() {
        SearchOptions options = SearchOptions.builder()
                .countOnly(true)
                .expression(Expression.and(TYPE_FILTER, PRESCRIPTION))
                .build();

        SqlRootExpression root = builder.build(options);

        assertThat(root.tableExpressions())
                .extracting(TableExpression::kind)
                .containsExactly(TableExpressionKind.ALL, TableExpressionKind.COUNT);
    }
}

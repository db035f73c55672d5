package org.fhirquery.sql;

import org.fhirquery.core.search.SearchOptions;
import org.fhirquery.sql.expression.IncludeRewriter;
import org.fhirquery.sql.expression.SqlRootExpression;
import org.fhirquery.sql.expression.SqlRootExpressionBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Produces the search plan a SQL generator executes for compiled search options.
 */
@Service
public class SqlSearchPlanner {

    private static final Logger log = LoggerFactory.getLogger(SqlSearchPlanner.class);

    private final SqlRootExpressionBuilder rootExpressionBuilder;
    private final IncludeRewriter includeRewriter;

    public SqlSearchPlanner(SqlRootExpressionBuilder rootExpressionBuilder, IncludeRewriter includeRewriter) {
        this.rootExpressionBuilder = rootExpressionBuilder;
        this.includeRewriter = includeRewriter;
    }

    public SqlRootExpression plan(SearchOptions options) {
        SqlRootExpression root = includeRewriter.linearize(rootExpressionBuilder.build(options));
        log.debug("Search plan: {}", root);
        return root;
    }
}

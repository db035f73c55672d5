package org.fhirquery.sql.config;

import org.fhirquery.core.config.SearchCoreConfiguration;
import org.fhirquery.sql.SqlSearchPlanner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Import;

/**
 * Registers the search planning beans on top of the core search beans.
 */
@AutoConfiguration(after = SearchCoreConfiguration.class)
@ComponentScan(basePackages = "org.fhirquery.sql.expression")
@Import(SqlSearchPlanner.class)
public class SqlSearchConfiguration {
}

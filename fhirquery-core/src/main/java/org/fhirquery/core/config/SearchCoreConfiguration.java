package org.fhirquery.core.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;

/**
 * Registers the search compilation components: FHIR context, search parameter
 * registry, expression parser and {@code SearchOptionsFactory}.
 */
@AutoConfiguration
@EnableConfigurationProperties(SearchProperties.class)
@ComponentScan(basePackages = {
        "org.fhirquery.core.context",
        "org.fhirquery.core.resource",
        "org.fhirquery.core.searchparam",
        "org.fhirquery.core.search"
})
public class SearchCoreConfiguration {
}

package org.fhirquery.core.searchparam;

import ca.uhn.fhir.parser.IParser;
import jakarta.annotation.PostConstruct;
import org.fhirquery.core.context.FhirContextFactory;
import org.fhirquery.core.exception.SearchParameterNotSupportedException;
import org.hl7.fhir.r5.model.Enumerations.SearchParamType;
import org.hl7.fhir.r5.model.SearchParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of FHIR search parameter definitions.
 * <p>
 * Loads SearchParameter resources from JSON files and follows the FHIR search
 * parameter inheritance model:
 * - Resource-* parameters apply to all resources
 * - DomainResource-* parameters apply to all except Bundle, Parameters, Binary
 * - ResourceType-* parameters apply to the resource types listed in their base
 * </p>
 */
@Component
public class SearchParameterRegistry implements SearchParameterDefinitionManager {

    private static final Logger log = LoggerFactory.getLogger(SearchParameterRegistry.class);

    private static final Set<String> NON_DOMAIN_RESOURCES = Set.of("Bundle", "Parameters", "Binary");

    private static final Set<SearchParamType> SORTABLE_TYPES = EnumSet.of(
            SearchParamType.DATE,
            SearchParamType.STRING,
            SearchParamType.NUMBER,
            SearchParamType.QUANTITY,
            SearchParamType.URI);

    private final FhirContextFactory contextFactory;
    private final PathMatchingResourcePatternResolver resourceResolver;
    private final String basePath;

    // Resource-* search parameters (applies to all resources)
    private final List<SearchParameterInfo> resourceBaseParams = new CopyOnWriteArrayList<>();

    // DomainResource-* search parameters (applies to non-Bundle/Parameters/Binary)
    private final List<SearchParameterInfo> domainResourceParams = new CopyOnWriteArrayList<>();

    // "ResourceType:code" -> SearchParameterInfo
    private final Map<String, SearchParameterInfo> parameterLookup = new ConcurrentHashMap<>();

    // ResourceType -> resource-specific parameters
    private final Map<String, List<SearchParameterInfo>> resourceSpecificParams = new ConcurrentHashMap<>();

    public SearchParameterRegistry(FhirContextFactory contextFactory,
                                   @Value("${fhirquery.config.base-path:classpath:fhir-config/}") String basePath) {
        this.contextFactory = contextFactory;
        this.basePath = basePath;
        this.resourceResolver = new PathMatchingResourcePatternResolver();
    }

    @PostConstruct
    public void loadSearchParameters() {
        String path = basePath + "searchparameters/";
        log.info("Loading search parameters from: {}", path);

        resourceBaseParams.clear();
        domainResourceParams.clear();
        parameterLookup.clear();
        resourceSpecificParams.clear();

        try {
            Resource[] files = resourceResolver.getResources(path + "SearchParameter-*.json");
            log.debug("Found {} search parameter files", files.length);

            IParser parser = contextFactory.getContext().newJsonParser();

            for (Resource file : files) {
                loadSearchParameterFile(file, parser);
            }
        } catch (IOException e) {
            log.warn("Failed to load search parameters from {}: {}", path, e.getMessage());
        }

        int specificCount = resourceSpecificParams.values().stream().mapToInt(List::size).sum();
        log.info("Search parameters loaded: Resource={}, DomainResource={}, ResourceSpecific={}",
                resourceBaseParams.size(), domainResourceParams.size(), specificCount);
    }

    private void loadSearchParameterFile(Resource file, IParser parser) {
        String filename = file.getFilename();
        try (InputStream is = file.getInputStream()) {
            SearchParameter sp = parser.parseResource(SearchParameter.class, is);

            if (sp.getBase() == null || sp.getBase().isEmpty()) {
                log.warn("Skipping search parameter {} - no base resource types", filename);
                return;
            }

            if (filename != null && filename.startsWith("SearchParameter-Resource-")) {
                resourceBaseParams.add(toInfo(sp, SearchParameterNames.RESOURCE));
            } else if (filename != null && filename.startsWith("SearchParameter-DomainResource-")) {
                domainResourceParams.add(toInfo(sp, SearchParameterNames.DOMAIN_RESOURCE));
            } else {
                for (var base : sp.getBase()) {
                    String resourceType = base.getValueAsString();
                    SearchParameterInfo info = toInfo(sp, resourceType);

                    resourceSpecificParams
                            .computeIfAbsent(resourceType, k -> new CopyOnWriteArrayList<>())
                            .add(info);
                    parameterLookup.put(resourceType + ":" + sp.getCode(), info);

                    log.trace("Associating search parameter {} with resource type {}", sp.getCode(), resourceType);
                }
            }
        } catch (Exception e) {
            log.error("Failed to parse search parameter file: {}", filename, e);
        }
    }

    private SearchParameterInfo toInfo(SearchParameter sp, String resourceType) {
        List<String> targets = sp.getTarget().stream()
                .map(target -> target.getValueAsString())
                .filter(Objects::nonNull)
                .toList();

        return new SearchParameterInfo(
                sp.getCode(),
                sp.getName(),
                sp.getUrl(),
                sp.getType(),
                filterExpressionByResourceType(sp.getExpression(), resourceType),
                targets,
                SORTABLE_TYPES.contains(sp.getType()));
    }

    /**
     * Filters a FHIRPath expression to only include paths for the specified resource type.
     *
     * @param expression Full expression possibly containing multiple resource types
     * @param resourceType The resource type to filter for
     * @return Filtered expression containing only paths starting with the resource type
     */
    private String filterExpressionByResourceType(String expression, String resourceType) {
        if (expression == null || expression.isEmpty()) {
            return expression;
        }

        List<String> matchingPaths = new ArrayList<>();
        for (String path : expression.split("\\s*\\|\\s*")) {
            if (path.trim().startsWith(resourceType + ".")) {
                matchingPaths.add(path.trim());
            }
        }

        return matchingPaths.isEmpty() ? expression : String.join(" | ", matchingPaths);
    }

    @Override
    public SearchParameterInfo getSearchParameter(String resourceType, String code) {
        return findSearchParameter(resourceType, code)
                .orElseThrow(() -> new SearchParameterNotSupportedException(resourceType, code));
    }

    @Override
    public Optional<SearchParameterInfo> findSearchParameter(String resourceType, String code) {
        if (code == null) {
            return Optional.empty();
        }

        SearchParameterInfo specific = parameterLookup.get(resourceType + ":" + code);
        if (specific != null) {
            return Optional.of(specific);
        }

        for (SearchParameterInfo info : resourceBaseParams) {
            if (info.getCode().equals(code)) {
                return Optional.of(info);
            }
        }

        if (isDomainResource(resourceType)) {
            for (SearchParameterInfo info : domainResourceParams) {
                if (info.getCode().equals(code)) {
                    return Optional.of(info);
                }
            }
        }

        return Optional.empty();
    }

    @Override
    public List<SearchParameterInfo> getSearchParameters(String resourceType) {
        List<SearchParameterInfo> params = new ArrayList<>(resourceBaseParams);

        if (isDomainResource(resourceType)) {
            params.addAll(domainResourceParams);
        }

        params.addAll(resourceSpecificParams.getOrDefault(resourceType, Collections.emptyList()));

        return Collections.unmodifiableList(params);
    }

    /**
     * Checks if a resource type is a DomainResource (for inheritance purposes).
     */
    public boolean isDomainResource(String resourceType) {
        return !NON_DOMAIN_RESOURCES.contains(resourceType);
    }
}

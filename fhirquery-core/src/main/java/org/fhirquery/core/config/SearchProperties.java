package org.fhirquery.core.config;

import org.fhirquery.core.search.TotalType;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for search compilation.
 * <p>
 * Binds to {@code fhirquery.search.*} properties in application.yml.
 * </p>
 */
@ConfigurationProperties(prefix = "fhirquery.search")
public class SearchProperties {

    private int defaultItemCountPerSearch = 10;
    private int maxItemCountPerSearch = 1000;
    private int defaultIncludeCountPerSearch = 100;
    private TotalType includeTotalInBundle = TotalType.NONE;

    public int getDefaultItemCountPerSearch() {
        return defaultItemCountPerSearch;
    }

    public void setDefaultItemCountPerSearch(int defaultItemCountPerSearch) {
        this.defaultItemCountPerSearch = defaultItemCountPerSearch;
    }

    public int getMaxItemCountPerSearch() {
        return maxItemCountPerSearch;
    }

    public void setMaxItemCountPerSearch(int maxItemCountPerSearch) {
        this.maxItemCountPerSearch = maxItemCountPerSearch;
    }

    public int getDefaultIncludeCountPerSearch() {
        return defaultIncludeCountPerSearch;
    }

    public void setDefaultIncludeCountPerSearch(int defaultIncludeCountPerSearch) {
        this.defaultIncludeCountPerSearch = defaultIncludeCountPerSearch;
    }

    /**
     * Total policy applied when the request has neither {@code _total} nor a continuation token.
     */
    public TotalType getIncludeTotalInBundle() {
        return includeTotalInBundle;
    }

    public void setIncludeTotalInBundle(TotalType includeTotalInBundle) {
        this.includeTotalInBundle = includeTotalInBundle;
    }
}

package io.github.cyfko.cohortql.spring.autoconfigure;

import io.github.cyfko.cohortql.core.config.CachePolicy;
import io.github.cyfko.cohortql.core.config.EnumFallbackPolicy;
import io.github.cyfko.cohortql.core.config.QueryPolicy;
import io.github.cyfko.cohortql.core.config.ResolutionPolicy;
import io.github.cyfko.cohortql.core.config.SearchPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spring Boot properties under the {@code cohortql} prefix.
 *
 * <pre>{@code
 * cohortql.catalog-path=/data/pcdc_catalog.json
 * cohortql.search.fuzzy-threshold=0.85
 * cohortql.query.limit=500
 * cohortql.cache.size=2000
 * cohortql.resolution.enum-fallback=ESCALATE
 * }</pre>
 *
 * Each group maps onto the matching core policy; unset values keep the policy defaults.
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "cohortql")
public class CohortQlProperties {

    /** Catalog JSON file. The catalog beans are only created when it is set. */
    private String catalogPath;

    /** Build the catalog index at startup instead of on the first search. */
    private boolean eagerLoad = true;

    private Search search = new Search();
    private Query query = new Query();
    private Cache cache = new Cache();
    private Resolution resolution = new Resolution();

    public static class Search {
        private double fuzzyThreshold = SearchPolicy.defaults().fuzzyThreshold();
        private int maxCandidates = SearchPolicy.defaults().maxCandidates();
        private int minTermLength = SearchPolicy.defaults().minTermLength();
        private double partialThreshold = SearchPolicy.defaults().partialThreshold();

        public SearchPolicy toPolicy() {
            return SearchPolicy.builder()
                    .fuzzyThreshold(fuzzyThreshold)
                    .maxCandidates(maxCandidates)
                    .minTermLength(minTermLength)
                    .partialThreshold(partialThreshold)
                    .build();
        }

        public double getFuzzyThreshold() { return fuzzyThreshold; }
        public void setFuzzyThreshold(double fuzzyThreshold) { this.fuzzyThreshold = fuzzyThreshold; }
        public int getMaxCandidates() { return maxCandidates; }
        public void setMaxCandidates(int maxCandidates) { this.maxCandidates = maxCandidates; }
        public int getMinTermLength() { return minTermLength; }
        public void setMinTermLength(int minTermLength) { this.minTermLength = minTermLength; }
        public double getPartialThreshold() { return partialThreshold; }
        public void setPartialThreshold(double partialThreshold) { this.partialThreshold = partialThreshold; }
    }

    public static class Query {
        private String rootEntity = "subject";
        private int limit = 100;
        private String containsWildcard = "%";
        private List<String> scalarFields = new ArrayList<>(QueryPolicy.DEFAULT_SCALAR_FIELDS);
        private Map<String, List<String>> nestedSelections = new LinkedHashMap<>(QueryPolicy.DEFAULT_NESTED_SELECTIONS);
        private int maxQueryLength = 10_000;
        private int maxContainsFilters = 3;
        private int maxVariablesLength = 5_000;

        public QueryPolicy toPolicy() {
            return QueryPolicy.builder()
                    .rootEntity(rootEntity)
                    .limit(limit)
                    .containsWildcard(containsWildcard)
                    .scalarFields(scalarFields)
                    .nestedSelections(nestedSelections)
                    .maxQueryLength(maxQueryLength)
                    .maxContainsFilters(maxContainsFilters)
                    .maxVariablesLength(maxVariablesLength)
                    .build();
        }

        public String getRootEntity() { return rootEntity; }
        public void setRootEntity(String rootEntity) { this.rootEntity = rootEntity; }
        public int getLimit() { return limit; }
        public void setLimit(int limit) { this.limit = limit; }
        public String getContainsWildcard() { return containsWildcard; }
        public void setContainsWildcard(String containsWildcard) { this.containsWildcard = containsWildcard; }
        public List<String> getScalarFields() { return scalarFields; }
        public void setScalarFields(List<String> scalarFields) { this.scalarFields = scalarFields; }
        public Map<String, List<String>> getNestedSelections() { return nestedSelections; }
        public void setNestedSelections(Map<String, List<String>> nestedSelections) { this.nestedSelections = nestedSelections; }
        public int getMaxQueryLength() { return maxQueryLength; }
        public void setMaxQueryLength(int maxQueryLength) { this.maxQueryLength = maxQueryLength; }
        public int getMaxContainsFilters() { return maxContainsFilters; }
        public void setMaxContainsFilters(int maxContainsFilters) { this.maxContainsFilters = maxContainsFilters; }
        public int getMaxVariablesLength() { return maxVariablesLength; }
        public void setMaxVariablesLength(int maxVariablesLength) { this.maxVariablesLength = maxVariablesLength; }
    }

    public static class Cache {
        private boolean enabled = true;
        private int size = 1000;

        public CachePolicy toPolicy() {
            return enabled ? CachePolicy.custom(size) : CachePolicy.none();
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getSize() { return size; }
        public void setSize(int size) { this.size = size; }
    }

    public static class Resolution {
        private EnumFallbackPolicy enumFallback = EnumFallbackPolicy.FIRST_VALUE;

        public ResolutionPolicy toPolicy() {
            return new ResolutionPolicy(enumFallback);
        }

        public EnumFallbackPolicy getEnumFallback() { return enumFallback; }
        public void setEnumFallback(EnumFallbackPolicy enumFallback) { this.enumFallback = enumFallback; }
    }

    public String getCatalogPath() { return catalogPath; }
    public void setCatalogPath(String catalogPath) { this.catalogPath = catalogPath; }
    public boolean isEagerLoad() { return eagerLoad; }
    public void setEagerLoad(boolean eagerLoad) { this.eagerLoad = eagerLoad; }
    public Search getSearch() { return search; }
    public void setSearch(Search search) { this.search = search; }
    public Query getQuery() { return query; }
    public void setQuery(Query query) { this.query = query; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }
    public Resolution getResolution() { return resolution; }
    public void setResolution(Resolution resolution) { this.resolution = resolution; }
}

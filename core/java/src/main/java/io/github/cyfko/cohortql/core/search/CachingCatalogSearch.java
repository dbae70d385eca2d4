package io.github.cyfko.cohortql.core.search;

import io.github.cyfko.cohortql.core.cache.BoundedLRUCache;
import io.github.cyfko.cohortql.core.catalog.CatalogIndex;
import io.github.cyfko.cohortql.core.config.CachePolicy;
import io.github.cyfko.cohortql.core.utils.TextNormalizer;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link CatalogSearch} decorator caching results per cleaned term.
 * <p>
 * Each entry remembers the index generation it was computed from; an entry from an older generation
 * is ignored and recomputed, so a rebuild of the index never lets stale candidates through. Results
 * are cached only when no rebuild happened during the search. With {@link CachePolicy#cacheEnabled()}
 * false every call goes straight to the index.
 * </p>
 *
 * @since 1.0.0
 */
public class CachingCatalogSearch implements CatalogSearch {

    private static final Logger log = Logger.getLogger(CachingCatalogSearch.class.getName());

    private final CatalogIndex index;
    private final CachePolicy policy;
    private final BoundedLRUCache<String, CachedResult> cache;

    public CachingCatalogSearch(CatalogIndex index, CachePolicy policy) {
        this.index = Objects.requireNonNull(index, "index");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.cache = new BoundedLRUCache<>(policy.cacheSize());
    }

    @Override
    public List<FieldCandidate> search(String term) {
        return search(term, index.getPolicy().maxCandidates());
    }

    @Override
    public List<FieldCandidate> search(String term, int maxCandidates) {
        if (!policy.cacheEnabled()) {
            return index.search(term, maxCandidates);
        }
        String key = TextNormalizer.clean(term) + '\u0000' + maxCandidates;
        CachedResult cached = cache.get(key);
        long generation = index.getGeneration();
        if (cached != null && cached.generation() == generation) {
            log.fine(() -> "Search cache hit for '" + term + "'");
            return cached.candidates();
        }

        List<FieldCandidate> candidates = index.search(term, maxCandidates);
        long generationAfter = index.getGeneration();
        if (generationAfter == generation || (generation == 0 && generationAfter == 1)) {
            cache.put(key, new CachedResult(generationAfter, candidates));
        }
        return candidates;
    }

    /**
     * Drops every cached result.
     */
    public void invalidate() {
        cache.clear();
    }

    public BoundedLRUCache<String, CachedResult> getCache() {
        return cache;
    }

    /**
     * Candidates computed from index generation {@code generation}.
     */
    public record CachedResult(long generation, List<FieldCandidate> candidates) {
    }
}

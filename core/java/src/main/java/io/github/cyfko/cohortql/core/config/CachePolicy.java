package io.github.cyfko.cohortql.core.config;

/**
 * Configuration of the optional search result cache.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>cacheEnabled</strong>: cache search results per normalized term (default: true)</li>
 *   <li><strong>cacheSize</strong>: maximum cached terms (default: 1000)</li>
 * </ul>
 *
 * <pre>{@code
 * CachePolicy policy = CachePolicy.defaults();
 * CachePolicy policy = CachePolicy.none();
 * CachePolicy policy = CachePolicy.custom(5000);
 * }</pre>
 *
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    /**
     * Canonical constructor with validation.
     */
    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    /**
     * @return caching enabled with 1000 entries
     */
    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    /**
     * Caching is completely disabled; the size is unused.
     *
     * @return a CachePolicy with caching disabled
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    /**
     * @param cacheSize maximum cached terms
     * @return caching enabled with the given size
     */
    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}

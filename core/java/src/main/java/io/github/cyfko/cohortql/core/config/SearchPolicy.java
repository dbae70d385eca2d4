package io.github.cyfko.cohortql.core.config;

/**
 * Configuration of the catalog search strategies.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>fuzzyThreshold</strong>: minimum similarity ratio for a fuzzy match (default: 0.8)</li>
 *   <li><strong>maxCandidates</strong>: default number of candidates returned per term (default: 5)</li>
 *   <li><strong>minTermLength</strong>: minimum length of an indexed or searched token (default: 2)</li>
 *   <li><strong>partialThreshold</strong>: minimum token overlap ratio for a partial match (default: 0.3)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * SearchPolicy policy = SearchPolicy.defaults();
 *
 * // Fewer, more precise candidates
 * SearchPolicy policy = SearchPolicy.strict();
 *
 * SearchPolicy policy = SearchPolicy.builder()
 *     .fuzzyThreshold(0.7)
 *     .maxCandidates(10)
 *     .build();
 * }</pre>
 *
 * @param fuzzyThreshold   similarity ratio in [0, 1] a fuzzy match must reach
 * @param maxCandidates    default truncation of search results
 * @param minTermLength    minimum token length kept by the tokenizer
 * @param partialThreshold token overlap ratio in [0, 1] a partial match must reach
 * @since 1.0.0
 */
public record SearchPolicy(
        double fuzzyThreshold,
        int maxCandidates,
        int minTermLength,
        double partialThreshold
) {

    /** Weight applied to exact matches. */
    public static final double EXACT_WEIGHT = 1.0;

    /** Weight applied to partial (token overlap) matches. */
    public static final double PARTIAL_WEIGHT = 0.8;

    /** Weight applied to fuzzy (similarity) matches. */
    public static final double FUZZY_WEIGHT = 0.6;

    /** Fuzzy matching is skipped for cleaned terms shorter than this. */
    public static final int MIN_FUZZY_LENGTH = 3;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any value is out of range
     */
    public SearchPolicy {
        if (fuzzyThreshold < 0.0 || fuzzyThreshold > 1.0) {
            throw new IllegalArgumentException("fuzzyThreshold must be within [0, 1], got: " + fuzzyThreshold);
        }
        if (maxCandidates <= 0) {
            throw new IllegalArgumentException("maxCandidates must be positive, got: " + maxCandidates);
        }
        if (minTermLength <= 0) {
            throw new IllegalArgumentException("minTermLength must be positive, got: " + minTermLength);
        }
        if (partialThreshold < 0.0 || partialThreshold > 1.0) {
            throw new IllegalArgumentException("partialThreshold must be within [0, 1], got: " + partialThreshold);
        }
    }

    /**
     * Default configuration.
     * <ul>
     *   <li>Fuzzy threshold: 0.8</li>
     *   <li>Max candidates: 5</li>
     *   <li>Min term length: 2</li>
     *   <li>Partial threshold: 0.3</li>
     * </ul>
     *
     * @return default configuration
     */
    public static SearchPolicy defaults() {
        return new SearchPolicy(0.8, 5, 2, 0.3);
    }

    /**
     * Strict configuration: higher thresholds and fewer candidates, for callers that prefer an
     * unmatched term over a doubtful match.
     *
     * @return strict configuration
     */
    public static SearchPolicy strict() {
        return new SearchPolicy(0.9, 3, 3, 0.5);
    }

    /**
     * Relaxed configuration: tolerant of typos, returns more candidates.
     *
     * @return relaxed configuration
     */
    public static SearchPolicy relaxed() {
        return new SearchPolicy(0.7, 10, 2, 0.25);
    }

    /**
     * Builder initialized with the {@link #defaults()} values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double _fuzzyThreshold = 0.8;
        private int _maxCandidates = 5;
        private int _minTermLength = 2;
        private double _partialThreshold = 0.3;

        private Builder() {}

        public SearchPolicy build() {
            return new SearchPolicy(_fuzzyThreshold, _maxCandidates, _minTermLength, _partialThreshold);
        }

        public Builder fuzzyThreshold(double fuzzyThreshold) { this._fuzzyThreshold = fuzzyThreshold; return this; }
        public Builder maxCandidates(int maxCandidates) { this._maxCandidates = maxCandidates; return this; }
        public Builder minTermLength(int minTermLength) { this._minTermLength = minTermLength; return this; }
        public Builder partialThreshold(double partialThreshold) { this._partialThreshold = partialThreshold; return this; }
    }
}

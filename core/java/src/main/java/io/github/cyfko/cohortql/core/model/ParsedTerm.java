package io.github.cyfko.cohortql.core.model;

/**
 * A term extracted from a user request.
 *
 * <h2>Component Details</h2>
 * <dl>
 *   <dt><strong>{@code original}</strong></dt>
 *   <dd>The term as it appears in the request; reported back when nothing matches it.</dd>
 *
 *   <dt><strong>{@code normalized}</strong></dt>
 *   <dd>The cleaned term that is searched in the catalog.</dd>
 *
 *   <dt><strong>{@code position}</strong></dt>
 *   <dd>Zero-based position of the term in the request.</dd>
 *
 *   <dt><strong>{@code confidence}</strong></dt>
 *   <dd>Extraction confidence in {@code [0, 1]}.</dd>
 * </dl>
 *
 * @since 1.0.0
 */
public record ParsedTerm(String original, String normalized, int position, double confidence) {

    public ParsedTerm {
        if (original == null || normalized == null) {
            throw new IllegalArgumentException("original and normalized terms are required");
        }
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0, got: " + position);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got: " + confidence);
        }
    }

    /**
     * @param term     a term already in normalized form
     * @param position its position
     * @return a term with full confidence
     */
    public static ParsedTerm of(String term, int position) {
        return new ParsedTerm(term, term, position, 1.0);
    }
}

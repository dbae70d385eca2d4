package io.github.cyfko.cohortql.core.resolve;

import io.github.cyfko.cohortql.core.catalog.CatalogField;
import io.github.cyfko.cohortql.core.catalog.FieldType;
import io.github.cyfko.cohortql.core.config.ResolutionPolicy;
import io.github.cyfko.cohortql.core.exception.ConflictResolutionException;
import io.github.cyfko.cohortql.core.search.FieldCandidate;
import io.github.cyfko.cohortql.core.search.FieldMatches;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Deterministic, rule-based choice of one catalog field per term.
 *
 * <h2>Scoring</h2>
 * <p>Candidates are grouped by term in first-seen order. A term with a single candidate is accepted
 * as is: its value is the term and its confidence the match score. Otherwise each candidate scores</p>
 * <pre>
 *   matchScore
 *   + 0.10 if the term occurs in the field path
 *   + 0.05 if the field is an enumeration
 *   + 0.02 if the field has a description
 *   + 0.15 if the term occurs in one of its enum values, or one of them occurs in the term
 * </pre>
 * <p>
 * (all comparisons case-insensitive). The highest score wins, the earliest candidate on ties, and
 * the confidence is {@code min(1, best * 0.9)}. A {@link ConflictRecord} is emitted for every such term.
 * </p>
 *
 * <h2>Enum Values</h2>
 * <p>
 * When the chosen field is an enumeration the value becomes the enum value equal to the term
 * (ignoring case), else the first enum value containing the term or contained in it. When nothing
 * matches, the {@link io.github.cyfko.cohortql.core.config.EnumFallbackPolicy} decides.
 * </p>
 *
 * @since 1.0.0
 */
public class ConflictResolver {

    private static final Logger log = Logger.getLogger(ConflictResolver.class.getName());

    static final double PATH_BONUS = 0.10;
    static final double ENUMERATION_BONUS = 0.05;
    static final double DESCRIPTION_BONUS = 0.02;
    static final double ENUM_VALUE_BONUS = 0.15;
    static final double CONFLICT_PENALTY = 0.9;

    private final ResolutionPolicy policy;

    public ConflictResolver() {
        this(ResolutionPolicy.defaults());
    }

    public ConflictResolver(ResolutionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Resolves the candidates of a search batch; unmatched terms are reported as warnings.
     *
     * @param matches the search output
     * @return the resolution
     * @throws ConflictResolutionException if {@code matches} is null or a term must be escalated
     */
    public Resolution resolve(FieldMatches matches) {
        if (matches == null) {
            throw new ConflictResolutionException("Field matches are required");
        }
        Resolution resolution = resolve(matches.candidates());
        if (matches.unmatchedTerms().isEmpty()) {
            return resolution;
        }
        List<String> warnings = new ArrayList<>(resolution.warnings());
        for (String term : matches.unmatchedTerms()) {
            warnings.add("No catalog field matched term '" + term + "'");
        }
        return new Resolution(resolution.resolved(), resolution.conflicts(), warnings);
    }

    /**
     * Resolves a flat list of candidates.
     *
     * @param candidates candidates of any number of terms
     * @return one resolved field per term that could be resolved
     * @throws ConflictResolutionException if {@code candidates} is null or a term must be escalated
     */
    public Resolution resolve(List<FieldCandidate> candidates) {
        if (candidates == null) {
            throw new ConflictResolutionException("Candidate list is required");
        }
        Map<String, List<FieldCandidate>> byTerm = new LinkedHashMap<>();
        for (FieldCandidate candidate : candidates) {
            if (candidate == null) {
                log.warning("Skipping null candidate");
                continue;
            }
            byTerm.computeIfAbsent(candidate.term(), t -> new ArrayList<>()).add(candidate);
        }

        List<ResolvedField> resolved = new ArrayList<>();
        List<ConflictRecord> conflicts = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (Map.Entry<String, List<FieldCandidate>> group : byTerm.entrySet()) {
            String term = group.getKey();
            try {
                resolveTerm(term, group.getValue(), resolved, conflicts, warnings);
            } catch (ConflictResolutionException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warning(() -> "Failed to resolve term '" + term + "': " + e.getMessage());
                warnings.add("Term '" + term + "' skipped: " + e.getMessage());
            }
        }
        log.fine(() -> String.format("Resolved %d of %d terms with %d conflicts",
                resolved.size(), byTerm.size(), conflicts.size()));
        return new Resolution(resolved, conflicts, warnings);
    }

    private void resolveTerm(String term, List<FieldCandidate> candidates, List<ResolvedField> resolved,
                             List<ConflictRecord> conflicts, List<String> warnings) {
        if (candidates.size() == 1) {
            FieldCandidate only = candidates.get(0);
            CatalogField field = only.field();
            resolved.add(new ResolvedField(term, field.path(), field.fieldType(), term,
                    defaultOperator(field.fieldType()), only.matchScore()));
            return;
        }

        FieldCandidate best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (FieldCandidate candidate : candidates) {
            double score = score(term, candidate);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }

        CatalogField chosen = best.field();
        double confidence = Math.min(1.0, bestScore * CONFLICT_PENALTY);
        List<String> paths = new ArrayList<>(candidates.size());
        candidates.forEach(c -> paths.add(c.fieldPath()));
        conflicts.add(new ConflictRecord(term, paths, chosen.path(),
                String.format(Locale.ROOT, "Highest score (%.3f) using rule-based heuristics", bestScore),
                confidence));

        Object value = term;
        if (chosen.isEnumeration()) {
            Optional<String> enumValue = extractEnumValue(term, chosen, warnings);
            if (enumValue.isEmpty()) {
                return;
            }
            value = enumValue.get();
        }
        resolved.add(new ResolvedField(term, chosen.path(), chosen.fieldType(), value,
                defaultOperator(chosen.fieldType()), confidence));
    }

    /**
     * Heuristic score of a candidate for a term with several candidates.
     *
     * @param term      the term
     * @param candidate one of its candidates
     * @return the boosted score, may exceed 1
     */
    double score(String term, FieldCandidate candidate) {
        CatalogField field = candidate.field();
        String lowerTerm = term.toLowerCase(Locale.ROOT);
        double score = candidate.matchScore();
        if (field.path().toLowerCase(Locale.ROOT).contains(lowerTerm)) {
            score += PATH_BONUS;
        }
        if (field.isEnumeration()) {
            score += ENUMERATION_BONUS;
        }
        if (field.hasDescription()) {
            score += DESCRIPTION_BONUS;
        }
        for (String enumValue : field.enumValues()) {
            String lowerValue = enumValue.toLowerCase(Locale.ROOT);
            if (lowerValue.contains(lowerTerm) || lowerTerm.contains(lowerValue)) {
                score += ENUM_VALUE_BONUS;
                break;
            }
        }
        return score;
    }

    private Optional<String> extractEnumValue(String term, CatalogField field, List<String> warnings) {
        if (field.enumValues().isEmpty()) {
            return Optional.of(term);
        }
        String lowerTerm = term.toLowerCase(Locale.ROOT);
        for (String enumValue : field.enumValues()) {
            if (enumValue.toLowerCase(Locale.ROOT).equals(lowerTerm)) {
                return Optional.of(enumValue);
            }
        }
        for (String enumValue : field.enumValues()) {
            String lowerValue = enumValue.toLowerCase(Locale.ROOT);
            if (lowerValue.contains(lowerTerm) || lowerTerm.contains(lowerValue)) {
                return Optional.of(enumValue);
            }
        }

        switch (policy.enumFallback()) {
            case FIRST_VALUE: {
                String fallback = field.enumValues().get(0);
                String warning = "No enum value of '" + field.path() + "' matches term '" + term
                        + "'; falling back to first value '" + fallback + "'";
                log.warning(warning);
                warnings.add(warning);
                return Optional.of(fallback);
            }
            case DROP: {
                String warning = "No enum value of '" + field.path() + "' matches term '" + term + "'; term dropped";
                log.warning(warning);
                warnings.add(warning);
                return Optional.empty();
            }
            default:
                throw new ConflictResolutionException(
                        "No enum value of '" + field.path() + "' matches term '" + term + "'");
        }
    }

    /**
     * Default resolver operator for a field type: {@code contains} for strings, {@code eq} otherwise.
     *
     * @param type the field type, may be null
     * @return the operator name
     */
    public static String defaultOperator(FieldType type) {
        if (type == null || type == FieldType.STRING) {
            return "contains";
        }
        return "eq";
    }
}

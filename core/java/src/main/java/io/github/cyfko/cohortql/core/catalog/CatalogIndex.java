package io.github.cyfko.cohortql.core.catalog;

import io.github.cyfko.cohortql.core.config.SearchPolicy;
import io.github.cyfko.cohortql.core.exception.CatalogException;
import io.github.cyfko.cohortql.core.search.CatalogSearch;
import io.github.cyfko.cohortql.core.search.FieldCandidate;
import io.github.cyfko.cohortql.core.search.MatchStrategy;
import io.github.cyfko.cohortql.core.utils.SequenceSimilarity;
import io.github.cyfko.cohortql.core.utils.TextNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Searchable index over the catalog fields.
 *
 * <h2>Indexing</h2>
 * <p>
 * Every searchable term of a field is cleaned with {@link TextNormalizer#clean(String)} and indexed
 * in full, together with each of its tokens of at least {@link SearchPolicy#minTermLength()}
 * characters. Fields are also indexed by path.
 * </p>
 *
 * <h2>Search Strategies</h2>
 * <ol>
 *   <li><strong>Exact</strong>: the cleaned term is an indexed term; score 1.0.</li>
 *   <li><strong>Partial</strong>: share of the distinct query tokens that are indexed for a field;
 *       kept when at least {@link SearchPolicy#partialThreshold()}, weighted by 0.8.</li>
 *   <li><strong>Fuzzy</strong>: terms of 3+ characters only; best similarity ratio between the term
 *       and the field's searchable terms, kept when at least {@link SearchPolicy#fuzzyThreshold()},
 *       weighted by 0.6.</li>
 * </ol>
 * <p>
 * Only the best candidate per field path is kept. Candidates are sorted by descending score; ties
 * keep the order in which the fields were first found.
 * </p>
 *
 * <h2>Lifecycle and Concurrency</h2>
 * <p>
 * The index is built lazily on first use or explicitly with {@link #buildIndex(boolean)}. A build
 * produces a new immutable snapshot which is published in a single volatile write, so readers see
 * either the previous snapshot or the new one, never a partial one. Builds are serialized by a lock.
 * A failed build leaves the previous snapshot in place.
 * </p>
 *
 * <pre>{@code
 * CatalogIndex index = new CatalogIndex(new JsonCatalogLoader(Path.of("catalog.json")), SearchPolicy.defaults());
 * index.buildIndex(false);
 * List<FieldCandidate> candidates = index.search("gender");
 * }</pre>
 *
 * @since 1.0.0
 */
public class CatalogIndex implements CatalogSearch {

    private static final Logger log = Logger.getLogger(CatalogIndex.class.getName());

    private final CatalogLoader loader;
    private final SearchPolicy policy;
    private final ReentrantLock buildLock = new ReentrantLock();

    private volatile Snapshot snapshot;

    public CatalogIndex(CatalogLoader loader) {
        this(loader, SearchPolicy.defaults());
    }

    public CatalogIndex(CatalogLoader loader, SearchPolicy policy) {
        this.loader = Objects.requireNonNull(loader, "loader");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Builds the index from the loader.
     * <p>
     * Without {@code forceRebuild} an already built index is kept. With it, the loader is asked to
     * reload its source and a new snapshot replaces the current one.
     * </p>
     *
     * @param forceRebuild rebuild even if an index already exists
     * @throws CatalogException if the catalog cannot be loaded; the previous index stays in use
     */
    public void buildIndex(boolean forceRebuild) {
        buildLock.lock();
        try {
            Snapshot current = snapshot;
            if (current != null && !forceRebuild) {
                return;
            }
            log.info("Building catalog search index");
            List<CatalogField> fields;
            try {
                fields = forceRebuild ? loader.reloadFields() : loader.loadFields();
            } catch (CatalogException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new CatalogException("Failed to load catalog fields: " + e.getMessage(), e);
            }
            if (fields == null) {
                throw new CatalogException("Catalog loader returned no field list");
            }
            long generation = current == null ? 1 : current.generation() + 1;
            Snapshot built = Snapshot.build(fields, policy.minTermLength(), generation);
            snapshot = built;
            log.info(() -> String.format("Built index with %d fields and %d terms (generation %d)",
                    built.fields().size(), built.termIndex().size(), built.generation()));
        } finally {
            buildLock.unlock();
        }
    }

    @Override
    public List<FieldCandidate> search(String term) {
        return search(term, policy.maxCandidates());
    }

    @Override
    public List<FieldCandidate> search(String term, int maxCandidates) {
        if (maxCandidates <= 0) {
            throw new IllegalArgumentException("maxCandidates must be positive, got: " + maxCandidates);
        }
        Snapshot current = ensureBuilt();
        String cleaned = TextNormalizer.clean(term);
        if (cleaned.isEmpty()) {
            return List.of();
        }

        Map<String, FieldCandidate> bestPerPath = new LinkedHashMap<>();
        exactMatches(current, cleaned).forEach(c -> keepBest(bestPerPath, c));
        partialMatches(current, cleaned).forEach(c -> keepBest(bestPerPath, c));
        fuzzyMatches(current, cleaned).forEach(c -> keepBest(bestPerPath, c));

        List<FieldCandidate> ranked = new ArrayList<>(bestPerPath.values());
        ranked.sort(Comparator.comparingDouble(FieldCandidate::matchScore).reversed());
        List<FieldCandidate> result = ranked.size() > maxCandidates ? ranked.subList(0, maxCandidates) : ranked;
        log.fine(() -> String.format("Found %d candidates for '%s'", result.size(), term));
        return List.copyOf(result);
    }

    private List<FieldCandidate> exactMatches(Snapshot current, String cleaned) {
        List<FieldCandidate> candidates = new ArrayList<>();
        for (int fieldIndex : current.termIndex().getOrDefault(cleaned, List.of())) {
            candidates.add(new FieldCandidate(cleaned, current.fields().get(fieldIndex),
                    SearchPolicy.EXACT_WEIGHT, "Exact term match", MatchStrategy.EXACT));
        }
        return candidates;
    }

    private List<FieldCandidate> partialMatches(Snapshot current, String cleaned) {
        Set<String> tokens = new LinkedHashSet<>(TextNormalizer.tokenize(cleaned, policy.minTermLength()));
        if (tokens.isEmpty()) {
            return List.of();
        }
        Map<Integer, Integer> hitsPerField = new LinkedHashMap<>();
        for (String token : tokens) {
            for (int fieldIndex : current.termIndex().getOrDefault(token, List.of())) {
                hitsPerField.merge(fieldIndex, 1, Integer::sum);
            }
        }
        List<FieldCandidate> candidates = new ArrayList<>();
        hitsPerField.forEach((fieldIndex, hits) -> {
            double overlap = (double) hits / tokens.size();
            if (overlap >= policy.partialThreshold()) {
                candidates.add(new FieldCandidate(cleaned, current.fields().get(fieldIndex),
                        overlap * SearchPolicy.PARTIAL_WEIGHT,
                        String.format("Partial match (%d/%d words)", hits, tokens.size()),
                        MatchStrategy.PARTIAL));
            }
        });
        return candidates;
    }

    private List<FieldCandidate> fuzzyMatches(Snapshot current, String cleaned) {
        if (cleaned.length() < SearchPolicy.MIN_FUZZY_LENGTH) {
            return List.of();
        }
        List<FieldCandidate> candidates = new ArrayList<>();
        for (CatalogField field : current.fields()) {
            double bestRatio = 0.0;
            String bestTerm = null;
            for (String searchable : field.searchableTerms()) {
                double ratio = SequenceSimilarity.ratio(cleaned, searchable);
                if (ratio > bestRatio) {
                    bestRatio = ratio;
                    bestTerm = searchable;
                }
            }
            if (bestTerm != null && bestRatio >= policy.fuzzyThreshold()) {
                candidates.add(new FieldCandidate(cleaned, field, bestRatio * SearchPolicy.FUZZY_WEIGHT,
                        String.format(Locale.ROOT, "Fuzzy match with '%s' (similarity: %.2f)", bestTerm, bestRatio),
                        MatchStrategy.FUZZY));
            }
        }
        return candidates;
    }

    private static void keepBest(Map<String, FieldCandidate> bestPerPath, FieldCandidate candidate) {
        FieldCandidate existing = bestPerPath.get(candidate.fieldPath());
        if (existing == null || candidate.matchScore() > existing.matchScore()) {
            bestPerPath.put(candidate.fieldPath(), candidate);
        }
    }

    /**
     * @param path a field path
     * @return the field with that path, if indexed
     */
    public Optional<CatalogField> getFieldByPath(String path) {
        Snapshot current = ensureBuilt();
        Integer fieldIndex = current.pathIndex().get(path);
        return fieldIndex == null ? Optional.empty() : Optional.of(current.fields().get(fieldIndex));
    }

    /**
     * @return every indexed field path, in catalog order
     */
    public List<String> getAllPaths() {
        Snapshot current = ensureBuilt();
        List<String> paths = new ArrayList<>(current.fields().size());
        current.fields().forEach(field -> paths.add(field.path()));
        return paths;
    }

    /**
     * @return every indexed field, in catalog order
     */
    public List<CatalogField> getFields() {
        return ensureBuilt().fields();
    }

    /**
     * @return true once an index with at least one field has been built
     */
    public boolean isLoaded() {
        Snapshot current = snapshot;
        return current != null && !current.fields().isEmpty();
    }

    /**
     * @return number of indexed fields, 0 when not built; never triggers a build
     */
    public int getEntryCount() {
        Snapshot current = snapshot;
        return current == null ? 0 : current.fields().size();
    }

    /**
     * @return index statistics, building the index if needed
     */
    public IndexStats getStats() {
        Snapshot current = ensureBuilt();
        return new IndexStats(current.fields().size(), current.termIndex().size(), current.pathIndex().size());
    }

    /**
     * Generation of the current snapshot, incremented by every successful build.
     *
     * @return the generation, 0 when not built
     */
    public long getGeneration() {
        Snapshot current = snapshot;
        return current == null ? 0 : current.generation();
    }

    public SearchPolicy getPolicy() {
        return policy;
    }

    private Snapshot ensureBuilt() {
        Snapshot current = snapshot;
        if (current == null) {
            buildIndex(false);
            current = snapshot;
        }
        return current;
    }

    /**
     * Immutable built state. Term lists hold field indices in catalog order, without duplicates.
     */
    private record Snapshot(
            List<CatalogField> fields,
            Map<String, List<Integer>> termIndex,
            Map<String, Integer> pathIndex,
            long generation
    ) {

        static Snapshot build(List<CatalogField> source, int minTermLength, long generation) {
            List<CatalogField> fields = new ArrayList<>(source.size());
            Map<String, Integer> pathIndex = new HashMap<>();
            Map<String, Set<Integer>> terms = new HashMap<>();

            for (CatalogField field : source) {
                if (field == null) continue;
                if (pathIndex.containsKey(field.path())) {
                    log.warning(() -> "Duplicate catalog path ignored while indexing: " + field.path());
                    continue;
                }
                int fieldIndex = fields.size();
                fields.add(field);
                pathIndex.put(field.path(), fieldIndex);

                for (String term : field.searchableTerms()) {
                    String cleaned = TextNormalizer.clean(term);
                    if (cleaned.isEmpty()) continue;
                    terms.computeIfAbsent(cleaned, k -> new LinkedHashSet<>()).add(fieldIndex);
                    for (String token : TextNormalizer.tokenize(cleaned, minTermLength)) {
                        terms.computeIfAbsent(token, k -> new LinkedHashSet<>()).add(fieldIndex);
                    }
                }
            }

            Map<String, List<Integer>> termIndex = new HashMap<>(terms.size() * 2);
            terms.forEach((term, indices) -> termIndex.put(term, List.copyOf(indices)));
            return new Snapshot(Collections.unmodifiableList(fields), Collections.unmodifiableMap(termIndex),
                    Collections.unmodifiableMap(pathIndex), generation);
        }
    }
}

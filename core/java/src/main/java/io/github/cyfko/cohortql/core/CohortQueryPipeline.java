package io.github.cyfko.cohortql.core;

import io.github.cyfko.cohortql.core.api.FilterStructure;
import io.github.cyfko.cohortql.core.compose.FilterComposer;
import io.github.cyfko.cohortql.core.exception.ConflictResolutionException;
import io.github.cyfko.cohortql.core.exception.FieldMappingException;
import io.github.cyfko.cohortql.core.exception.FilterCompositionException;
import io.github.cyfko.cohortql.core.exception.PipelineException;
import io.github.cyfko.cohortql.core.exception.QueryGenerationException;
import io.github.cyfko.cohortql.core.model.ParsedQuery;
import io.github.cyfko.cohortql.core.model.ParsedTerm;
import io.github.cyfko.cohortql.core.model.PipelineResult;
import io.github.cyfko.cohortql.core.query.GraphQLQuery;
import io.github.cyfko.cohortql.core.query.QueryBuilder;
import io.github.cyfko.cohortql.core.resolve.ConflictResolver;
import io.github.cyfko.cohortql.core.resolve.Resolution;
import io.github.cyfko.cohortql.core.search.CatalogSearch;
import io.github.cyfko.cohortql.core.search.FieldCandidate;
import io.github.cyfko.cohortql.core.search.FieldMatches;
import io.github.cyfko.cohortql.core.spi.ExecutionResult;
import io.github.cyfko.cohortql.core.spi.GraphQLExecutionClient;
import io.github.cyfko.cohortql.core.spi.TermExtractor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * High-level facade turning extracted terms into an executable GraphQL query.
 *
 * <p><strong>Stages:</strong></p>
 * <ol>
 *   <li><strong>Extract</strong> (optional): free text to terms through a {@link TermExtractor}</li>
 *   <li><strong>Search</strong>: catalog candidates for every term through {@link CatalogSearch}</li>
 *   <li><strong>Resolve</strong>: one field per term through {@link ConflictResolver}</li>
 *   <li><strong>Compose</strong>: the nested filter tree through {@link FilterComposer}</li>
 *   <li><strong>Build</strong>: query text, variables and description through {@link QueryBuilder}</li>
 * </ol>
 *
 * <pre>{@code
 * CohortQueryPipeline pipeline = CohortQueryPipeline.builder(index).build();
 * PipelineResult result = pipeline.process(ParsedQuery.of(Combinator.AND, "gender", "liver"));
 * String query = result.query().query();
 * }</pre>
 *
 * <p><strong>Error Handling:</strong></p>
 * <p>
 * Each stage failure is raised as the matching {@link PipelineException} subclass and aborts the
 * current request only. Collaborators are called once; nothing is retried.
 * </p>
 *
 * <p>Instances are immutable and thread-safe as long as their collaborators are.</p>
 *
 * @since 1.0.0
 */
public class CohortQueryPipeline {

    private static final Logger log = Logger.getLogger(CohortQueryPipeline.class.getName());

    private final CatalogSearch search;
    private final ConflictResolver resolver;
    private final FilterComposer composer;
    private final QueryBuilder queryBuilder;
    private final TermExtractor termExtractor;
    private final GraphQLExecutionClient executionClient;

    private CohortQueryPipeline(Builder builder) {
        this.search = Objects.requireNonNull(builder._search, "Catalog search cannot be null");
        this.resolver = Objects.requireNonNull(builder._resolver, "Conflict resolver cannot be null");
        this.composer = Objects.requireNonNull(builder._composer, "Filter composer cannot be null");
        this.queryBuilder = Objects.requireNonNull(builder._queryBuilder, "Query builder cannot be null");
        this.termExtractor = builder._termExtractor;
        this.executionClient = builder._executionClient;
    }

    /**
     * @param search the catalog search, e.g. a {@link io.github.cyfko.cohortql.core.catalog.CatalogIndex}
     * @return a builder with default resolver, composer and query builder
     */
    public static Builder builder(CatalogSearch search) {
        return new Builder(search);
    }

    /**
     * Extracts terms from {@code text} and runs the remaining stages.
     *
     * @param text      the user request
     * @param sessionId caller session, {@code null} to generate one
     * @return every stage output
     * @throws PipelineException if any stage fails
     * @throws IllegalStateException if no {@link TermExtractor} is configured
     */
    public PipelineResult process(String text, String sessionId) {
        if (termExtractor == null) {
            throw new IllegalStateException("No TermExtractor configured; pass a ParsedQuery instead");
        }
        ParsedQuery parsed;
        try {
            parsed = termExtractor.extract(text);
        } catch (RuntimeException e) {
            throw new PipelineException(PipelineException.Stage.TERM_EXTRACTION,
                    "Failed to extract terms: " + e.getMessage(), e);
        }
        if (parsed == null) {
            throw new PipelineException(PipelineException.Stage.TERM_EXTRACTION, "Term extractor returned no result");
        }
        return process(parsed, sessionId);
    }

    /**
     * @param parsedQuery the extracted terms
     * @return every stage output
     * @throws PipelineException if any stage fails
     */
    public PipelineResult process(ParsedQuery parsedQuery) {
        return process(parsedQuery, null);
    }

    /**
     * Runs search, resolution, composition and query generation.
     *
     * @param parsedQuery the extracted terms
     * @param sessionId   caller session, {@code null} to generate one
     * @return every stage output
     * @throws PipelineException if any stage fails
     */
    public PipelineResult process(ParsedQuery parsedQuery, String sessionId) {
        Objects.requireNonNull(parsedQuery, "Parsed query cannot be null");
        String session = sessionId != null ? sessionId : UUID.randomUUID().toString();
        long start = System.nanoTime();
        log.info(() -> "Starting pipeline for " + parsedQuery.terms().size() + " terms (session: " + session + ")");

        long stageStart = System.nanoTime();
        FieldMatches matches = findMatchingFields(parsedQuery);
        logStage("find_fields", stageStart, matches.candidates().size() + " candidates, "
                + matches.unmatchedTerms().size() + " unmatched");

        stageStart = System.nanoTime();
        Resolution resolution = resolveConflicts(matches);
        logStage("resolve_conflicts", stageStart, resolution.resolved().size() + " resolved");

        stageStart = System.nanoTime();
        FilterStructure structure = composeFilter(resolution, parsedQuery);
        logStage("build_filter", stageStart, structure.conditions().size() + " conditions");

        stageStart = System.nanoTime();
        GraphQLQuery query = generateQuery(structure);
        logStage("generate_query", stageStart, query.query().length() + " chars");

        List<String> warnings = new ArrayList<>(composer.validateStructure(structure));
        warnings.addAll(queryBuilder.validateQuery(query));

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.info(() -> String.format("Pipeline completed in %.3fs (session: %s)", elapsed.toNanos() / 1e9, session));
        return new PipelineResult(session, parsedQuery, matches, resolution, structure, query, warnings, elapsed);
    }

    /**
     * Sends a generated query through the configured client.
     *
     * @param query the query to run
     * @return the client's result
     * @throws PipelineException with stage {@code QUERY_EXECUTION} if the client throws
     * @throws IllegalStateException if no {@link GraphQLExecutionClient} is configured
     */
    public ExecutionResult execute(GraphQLQuery query) {
        Objects.requireNonNull(query, "Query cannot be null");
        if (executionClient == null) {
            throw new IllegalStateException("No GraphQLExecutionClient configured");
        }
        ExecutionResult result;
        try {
            result = executionClient.execute(query.query(), query.variables());
        } catch (RuntimeException e) {
            log.warning("GraphQL execution failed: " + e.getMessage());
            throw new PipelineException(PipelineException.Stage.QUERY_EXECUTION,
                    "Failed to execute query: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new PipelineException(PipelineException.Stage.QUERY_EXECUTION, "Execution client returned no result");
        }
        if (!result.success()) {
            log.warning("GraphQL execution reported an error: " + result.error());
        }
        return result;
    }

    /**
     * Searches the catalog for every term; terms without any candidate are reported by their
     * original spelling.
     *
     * @param parsedQuery the terms
     * @return all candidates and the unmatched terms
     * @throws FieldMappingException if the search fails
     */
    public FieldMatches findMatchingFields(ParsedQuery parsedQuery) {
        try {
            List<FieldCandidate> candidates = new ArrayList<>();
            List<String> unmatched = new ArrayList<>();
            for (ParsedTerm term : parsedQuery.terms()) {
                List<FieldCandidate> found = search.search(term.normalized());
                if (found.isEmpty()) {
                    unmatched.add(term.original());
                } else {
                    candidates.addAll(found);
                }
            }
            return new FieldMatches(candidates, unmatched);
        } catch (RuntimeException e) {
            throw new FieldMappingException("Failed to find matching fields: " + e.getMessage(), e);
        }
    }

    private Resolution resolveConflicts(FieldMatches matches) {
        try {
            return resolver.resolve(matches);
        } catch (ConflictResolutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConflictResolutionException("Failed to resolve conflicts: " + e.getMessage(), e);
        }
    }

    private FilterStructure composeFilter(Resolution resolution, ParsedQuery parsedQuery) {
        try {
            return composer.compose(resolution.resolved(), parsedQuery.logic());
        } catch (FilterCompositionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FilterCompositionException("Failed to build filter: " + e.getMessage(), e);
        }
    }

    private GraphQLQuery generateQuery(FilterStructure structure) {
        try {
            return queryBuilder.build(structure);
        } catch (QueryGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new QueryGenerationException("Failed to generate query: " + e.getMessage(), e);
        }
    }

    private static void logStage(String stage, long startNanos, String summary) {
        long micros = (System.nanoTime() - startNanos) / 1_000;
        log.fine(() -> "Stage " + stage + " completed in " + micros + "us: " + summary);
    }

    public static class Builder {
        private final CatalogSearch _search;
        private ConflictResolver _resolver = new ConflictResolver();
        private FilterComposer _composer = new FilterComposer();
        private QueryBuilder _queryBuilder = new QueryBuilder();
        private TermExtractor _termExtractor;
        private GraphQLExecutionClient _executionClient;

        private Builder(CatalogSearch search) {
            this._search = search;
        }

        public CohortQueryPipeline build() {
            return new CohortQueryPipeline(this);
        }

        public Builder resolver(ConflictResolver resolver) { this._resolver = resolver; return this; }
        public Builder composer(FilterComposer composer) { this._composer = composer; return this; }
        public Builder queryBuilder(QueryBuilder queryBuilder) { this._queryBuilder = queryBuilder; return this; }
        public Builder termExtractor(TermExtractor termExtractor) { this._termExtractor = termExtractor; return this; }
        public Builder executionClient(GraphQLExecutionClient executionClient) { this._executionClient = executionClient; return this; }
    }
}

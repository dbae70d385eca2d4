package io.github.cyfko.cohortql.core;

import io.github.cyfko.cohortql.core.api.Combinator;
import io.github.cyfko.cohortql.core.api.FilterCondition;
import io.github.cyfko.cohortql.core.api.FilterNode;
import io.github.cyfko.cohortql.core.catalog.CatalogField;
import io.github.cyfko.cohortql.core.catalog.FieldType;
import io.github.cyfko.cohortql.core.compose.FilterComposer;
import io.github.cyfko.cohortql.core.exception.ConflictResolutionException;
import io.github.cyfko.cohortql.core.exception.FieldMappingException;
import io.github.cyfko.cohortql.core.exception.FilterCompositionException;
import io.github.cyfko.cohortql.core.exception.PipelineException;
import io.github.cyfko.cohortql.core.model.ParsedQuery;
import io.github.cyfko.cohortql.core.model.ParsedTerm;
import io.github.cyfko.cohortql.core.model.PipelineResult;
import io.github.cyfko.cohortql.core.query.GraphQLQuery;
import io.github.cyfko.cohortql.core.resolve.ConflictResolver;
import io.github.cyfko.cohortql.core.search.CatalogSearch;
import io.github.cyfko.cohortql.core.search.FieldCandidate;
import io.github.cyfko.cohortql.core.search.FieldMatches;
import io.github.cyfko.cohortql.core.search.MatchStrategy;
import io.github.cyfko.cohortql.core.spi.ExecutionResult;
import io.github.cyfko.cohortql.core.spi.GraphQLExecutionClient;
import io.github.cyfko.cohortql.core.spi.TermExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("CohortQueryPipeline Tests")
class CohortQueryPipelineTest {

    private static final CatalogField SEX = new CatalogField("sex", FieldType.ENUMERATION,
            List.of("Male", "Female", "Unknown"), "Biological sex of the subject", List.of("sex", "gender"));
    private static final CatalogField SUBMITTER_ID = new CatalogField("subject_submitter_id", FieldType.STRING,
            List.of(), null, List.of("submitter id"));
    private static final CatalogField TUMOR_SITE = new CatalogField("tumor_assessments.tumor_site",
            FieldType.ENUMERATION, List.of("Bone", "Liver"), "Anatomic site of the tumor", List.of("tumor site"));

    private CatalogSearch search;

    @BeforeEach
    void setUp() {
        search = mock(CatalogSearch.class);
        when(search.search("male")).thenReturn(List.of(
                new FieldCandidate("male", SEX, 0.9, "Fuzzy", MatchStrategy.FUZZY),
                new FieldCandidate("male", SUBMITTER_ID, 0.5, "Fuzzy", MatchStrategy.FUZZY)));
        when(search.search("liver")).thenReturn(List.of(
                new FieldCandidate("liver", TUMOR_SITE, 0.8, "Partial", MatchStrategy.PARTIAL)));
        when(search.search("xyzzy")).thenReturn(List.of());
    }

    private static ParsedQuery maleLiverQuery() {
        return new ParsedQuery(List.of(
                ParsedTerm.of("male", 0),
                ParsedTerm.of("liver", 1),
                new ParsedTerm("XYZZY!", "xyzzy", 2, 0.4)), Combinator.AND, "male liver XYZZY!", 0.8);
    }

    // ========================================================================
    // Processing
    // ========================================================================

    @Nested
    @DisplayName("Processing terms")
    class Processing {

        @Test
        @DisplayName("Should run every stage and keep their outputs")
        void shouldProcessTerms() {
            // Given
            CohortQueryPipeline pipeline = CohortQueryPipeline.builder(search).build();

            // When
            PipelineResult result = pipeline.process(maleLiverQuery(), "session-1");

            // Then
            assertEquals("session-1", result.sessionId());
            assertEquals(List.of("XYZZY!"), result.fieldMatches().unmatchedTerms());
            assertEquals(3, result.fieldMatches().candidates().size());
            assertEquals(1, result.resolution().conflicts().size());
            assertTrue(result.resolution().warnings().contains("No catalog field matched term 'XYZZY!'"));

            FilterNode expected = new FilterNode.Logical(Combinator.AND, List.of(
                    FilterNode.leaf(FilterCondition.in("sex", List.of("Male"))),
                    new FilterNode.Nested("tumor_assessments", Combinator.AND, List.of(
                            FilterNode.leaf(FilterCondition.in("tumor_site", List.of("liver")))))));
            assertEquals(expected, result.filterStructure().root());

            GraphQLQuery query = result.query();
            assertTrue(query.hasFilter());
            assertEquals("Cases where Sex equals 'Male' and Tumor Site equals 'liver'", query.description());
            assertTrue(result.warnings().isEmpty());
            assertFalse(result.processingTime().isNegative());
        }

        @Test
        @DisplayName("Should generate a session id and warn when nothing matched")
        void shouldHandleNoMatches() {
            CohortQueryPipeline pipeline = CohortQueryPipeline.builder(search).build();

            PipelineResult result = pipeline.process(ParsedQuery.of(Combinator.OR, "xyzzy"));

            assertNotNull(result.sessionId());
            assertTrue(result.filterStructure().isEmpty());
            assertFalse(result.query().hasFilter());
            assertEquals(List.of("No filters generated - query may return all records"), result.warnings());
        }

        @Test
        @DisplayName("Should search each term by its normalized form")
        void shouldSearchNormalizedTerms() {
            CohortQueryPipeline pipeline = CohortQueryPipeline.builder(search).build();

            FieldMatches matches = pipeline.findMatchingFields(maleLiverQuery());

            verify(search).search("xyzzy");
            verify(search, never()).search("XYZZY!");
            assertEquals(List.of("XYZZY!"), matches.unmatchedTerms());
        }
    }

    // ========================================================================
    // Stage failures
    // ========================================================================

    @Nested
    @DisplayName("Stage failures")
    class StageFailures {

        @Test
        @DisplayName("Should report search failures as field mapping errors")
        void shouldWrapSearchFailure() {
            when(search.search("liver")).thenThrow(new IllegalStateException("index unavailable"));
            CohortQueryPipeline pipeline = CohortQueryPipeline.builder(search).build();

            FieldMappingException e = assertThrows(FieldMappingException.class,
                    () -> pipeline.process(maleLiverQuery()));

            assertEquals(PipelineException.Stage.FIELD_MAPPING, e.getStage());
            assertEquals("Failed to find matching fields: index unavailable", e.getMessage());
        }

        @Test
        @DisplayName("Should report unexpected resolver failures as resolution errors")
        void shouldWrapResolverFailure() {
            ConflictResolver resolver = mock(ConflictResolver.class);
            when(resolver.resolve(any(FieldMatches.class))).thenThrow(new IllegalArgumentException("bad"));
            CohortQueryPipeline pipeline = CohortQueryPipeline.builder(search).resolver(resolver).build();

            PipelineException e = assertThrows(ConflictResolutionException.class,
                    () -> pipeline.process(maleLiverQuery()));

            assertEquals(PipelineException.Stage.CONFLICT_RESOLUTION, e.getStage());
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
        }

        @Test
        @DisplayName("Should rethrow stage exceptions unchanged")
        void shouldRethrowStageExceptions() {
            FilterComposer composer = mock(FilterComposer.class);
            FilterCompositionException failure = new FilterCompositionException("two levels");
            when(composer.compose(any(), any())).thenThrow(failure);
            CohortQueryPipeline pipeline = CohortQueryPipeline.builder(search).composer(composer).build();

            FilterCompositionException e = assertThrows(FilterCompositionException.class,
                    () -> pipeline.process(maleLiverQuery()));

            assertSame(failure, e);
        }
    }

    // ========================================================================
    // Extraction and execution
    // ========================================================================

    @Nested
    @DisplayName("Collaborators")
    class Collaborators {

        @Test
        @DisplayName("Should extract terms from text when an extractor is configured")
        void shouldExtractTerms() {
            TermExtractor extractor = mock(TermExtractor.class);
            when(extractor.extract("male patients with liver tumors")).thenReturn(ParsedQuery.of(Combinator.AND, "male"));
            CohortQueryPipeline pipeline = CohortQueryPipeline.builder(search).termExtractor(extractor).build();

            PipelineResult result = pipeline.process("male patients with liver tumors", "s");

            assertEquals(1, result.resolution().resolved().size());
            assertThrows(IllegalStateException.class,
                    () -> CohortQueryPipeline.builder(search).build().process("text", null));
        }

        @Test
        @DisplayName("Should report extraction failures")
        void shouldWrapExtractionFailure() {
            TermExtractor failing = text -> {
                throw new IllegalStateException("model offline");
            };
            TermExtractor empty = text -> null;

            PipelineException e = assertThrows(PipelineException.class,
                    () -> CohortQueryPipeline.builder(search).termExtractor(failing).build().process("x", null));
            PipelineException noResult = assertThrows(PipelineException.class,
                    () -> CohortQueryPipeline.builder(search).termExtractor(empty).build().process("x", null));

            assertEquals(PipelineException.Stage.TERM_EXTRACTION, e.getStage());
            assertEquals(PipelineException.Stage.TERM_EXTRACTION, noResult.getStage());
        }

        @Test
        @DisplayName("Should delegate execution to the client")
        void shouldExecuteQuery() {
            GraphQLExecutionClient client = mock(GraphQLExecutionClient.class);
            ExecutionResult success = ExecutionResult.success(Map.of("subject", List.of()), Duration.ofMillis(12));
            when(client.execute(anyString(), any())).thenReturn(success);
            CohortQueryPipeline pipeline = CohortQueryPipeline.builder(search).executionClient(client).build();
            GraphQLQuery query = pipeline.process(maleLiverQuery()).query();

            ExecutionResult result = pipeline.execute(query);

            assertSame(success, result);
            verify(client).execute(query.query(), query.variables());
        }

        @Test
        @DisplayName("Should report execution failures")
        void shouldWrapExecutionFailure() {
            GraphQLExecutionClient throwing = (query, variables) -> {
                throw new IllegalStateException("HTTP 502");
            };
            GraphQLQuery query = new GraphQLQuery("query { subject { sex } }", Map.of(), "all", "{}");

            PipelineException e = assertThrows(PipelineException.class,
                    () -> CohortQueryPipeline.builder(search).executionClient(throwing).build().execute(query));
            assertEquals(PipelineException.Stage.QUERY_EXECUTION, e.getStage());

            assertThrows(PipelineException.class,
                    () -> CohortQueryPipeline.builder(search).executionClient((q, v) -> null).build().execute(query));
            assertThrows(IllegalStateException.class,
                    () -> CohortQueryPipeline.builder(search).build().execute(query));

            ExecutionResult failure = CohortQueryPipeline.builder(search)
                    .executionClient((q, v) -> ExecutionResult.failure("syntax error", Duration.ZERO))
                    .build().execute(query);
            assertFalse(failure.success());
            assertEquals("syntax error", failure.error());
        }
    }
}

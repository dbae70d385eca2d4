package io.github.cyfko.cohortql.core.catalog;

import io.github.cyfko.cohortql.core.config.SearchPolicy;
import io.github.cyfko.cohortql.core.exception.CatalogException;
import io.github.cyfko.cohortql.core.search.FieldCandidate;
import io.github.cyfko.cohortql.core.search.MatchStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CatalogIndex Tests")
class CatalogIndexTest {

    private CatalogIndex index;

    @BeforeEach
    void setUp() {
        index = TestCatalogs.index();
    }

    // ============================================================================
    // Search strategies
    // ============================================================================

    @Nested
    @DisplayName("Search strategies")
    class SearchStrategies {

        @Test
        @DisplayName("Should rank an exact searchable term first with full score")
        void shouldRankExactMatchFirst() {
            // When
            List<FieldCandidate> candidates = index.search("gender");

            // Then
            FieldCandidate best = candidates.get(0);
            assertEquals("sex", best.fieldPath());
            assertEquals(1.0, best.matchScore());
            assertEquals(MatchStrategy.EXACT, best.strategy());
            assertEquals("Exact term match", best.matchReason());
            assertEquals("gender", best.term());
        }

        @Test
        @DisplayName("Should score partial word overlap at 0.8 per full overlap")
        void shouldScorePartialMatch() {
            List<FieldCandidate> candidates = index.search("tumor site liver");

            FieldCandidate best = candidates.get(0);
            assertEquals("tumor_assessments.tumor_site", best.fieldPath());
            assertEquals(0.8, best.matchScore(), 1e-9);
            assertEquals(MatchStrategy.PARTIAL, best.strategy());
            assertEquals("Partial match (3/3 words)", best.matchReason());
        }

        @Test
        @DisplayName("Should find misspelled terms through fuzzy matching")
        void shouldFindFuzzyMatch() {
            List<FieldCandidate> candidates = index.search("etnicity");

            FieldCandidate best = candidates.get(0);
            assertEquals("ethnicity", best.fieldPath());
            assertEquals(MatchStrategy.FUZZY, best.strategy());
            assertEquals(0.6 * 16.0 / 17.0, best.matchScore(), 1e-9);
            assertEquals("Fuzzy match with 'ethnicity' (similarity: 0.94)", best.matchReason());
        }

        @Test
        @DisplayName("Should keep one candidate per field with the best score")
        void shouldKeepBestCandidatePerField() {
            List<FieldCandidate> candidates = index.search("unknown");

            assertEquals(List.of("sex", "race", "tumor_assessments.tumor_state"),
                    candidates.stream().map(FieldCandidate::fieldPath).toList());
            candidates.forEach(c -> assertEquals(MatchStrategy.EXACT, c.strategy()));
        }

        @Test
        @DisplayName("Should clean the term before searching")
        void shouldCleanTerm() {
            List<FieldCandidate> candidates = index.search("  GENDER!! ");

            assertEquals("sex", candidates.get(0).fieldPath());
            assertEquals("gender", candidates.get(0).term());
        }

        @Test
        @DisplayName("Should truncate to the requested number of candidates")
        void shouldTruncate() {
            assertEquals(2, index.search("unknown", 2).size());
        }

        @Test
        @DisplayName("Should sort candidates by descending score")
        void shouldSortByDescendingScore() {
            List<FieldCandidate> candidates = index.search("tumor site liver", 10);

            for (int i = 1; i < candidates.size(); i++) {
                assertTrue(candidates.get(i - 1).matchScore() >= candidates.get(i).matchScore());
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "!!!", "zzzzqqqq"})
        @DisplayName("Should return no candidate for blank or unknown terms")
        void shouldReturnNothingForUnknownTerms(String term) {
            assertTrue(index.search(term).isEmpty());
        }

        @Test
        @DisplayName("Should reject a non-positive candidate limit")
        void shouldRejectNonPositiveLimit() {
            assertThrows(IllegalArgumentException.class, () -> index.search("sex", 0));
        }

        @Test
        @DisplayName("Should not fuzzy match terms shorter than three characters")
        void shouldSkipFuzzyForShortTerms() {
            List<FieldCandidate> candidates = index.search("se");

            assertTrue(candidates.stream().noneMatch(c -> c.strategy() == MatchStrategy.FUZZY));
        }

        @Test
        @DisplayName("Should honor a stricter fuzzy threshold")
        void shouldHonorStrictPolicy() {
            CatalogIndex strict = new CatalogIndex(new JsonCatalogLoader(TestCatalogs.catalogPath()),
                    SearchPolicy.builder().fuzzyThreshold(0.95).build());

            assertTrue(strict.search("etnicity").isEmpty());
        }
    }

    // ============================================================================
    // Lookups
    // ============================================================================

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("Should look up fields by path")
        void shouldLookUpByPath() {
            assertTrue(index.getFieldByPath("tumor_assessments.tumor_site").isPresent());
            assertTrue(index.getFieldByPath("tumor_site").isEmpty());
        }

        @Test
        @DisplayName("Should list paths in catalog order")
        void shouldListPaths() {
            List<String> paths = index.getAllPaths();

            assertEquals(13, paths.size());
            assertEquals("sex", paths.get(0));
            assertEquals("enrollment_date", paths.get(12));
        }

        @Test
        @DisplayName("Should report stats without building twice")
        void shouldReportStats() {
            assertEquals(0, index.getEntryCount());
            assertFalse(index.isLoaded());

            IndexStats stats = index.getStats();

            assertEquals(13, stats.totalFields());
            assertEquals(13, stats.pathsIndexed());
            assertTrue(stats.indexedTerms() > 13);
            assertTrue(index.isLoaded());
            assertEquals(1, index.getGeneration());
        }
    }

    // ============================================================================
    // Build lifecycle
    // ============================================================================

    @Nested
    @DisplayName("Build lifecycle")
    class BuildLifecycle {

        @Test
        @DisplayName("Should build lazily once and rebuild only when forced")
        void shouldBuildOnce() {
            CatalogLoader loader = mock(CatalogLoader.class);
            when(loader.loadFields()).thenReturn(List.of(TestCatalogs.field("sex", FieldType.STRING)));
            when(loader.reloadFields()).thenReturn(List.of(TestCatalogs.field("race", FieldType.STRING)));
            CatalogIndex lazy = new CatalogIndex(loader);

            lazy.search("sex");
            lazy.buildIndex(false);
            assertEquals(1, lazy.getGeneration());
            verify(loader, times(1)).loadFields();

            lazy.buildIndex(true);
            assertEquals(2, lazy.getGeneration());
            assertEquals(List.of("race"), lazy.getAllPaths());
        }

        @Test
        @DisplayName("Should ignore duplicate paths returned by a loader")
        void shouldIgnoreDuplicatePaths() {
            CatalogLoader loader = () -> List.of(
                    TestCatalogs.field("sex", FieldType.STRING),
                    TestCatalogs.field("sex", FieldType.NUMBER));

            CatalogIndex duplicated = new CatalogIndex(loader);
            duplicated.buildIndex(false);

            assertEquals(1, duplicated.getEntryCount());
            assertEquals(FieldType.STRING, duplicated.getFieldByPath("sex").orElseThrow().fieldType());
        }

        @Test
        @DisplayName("Should keep the previous index when a rebuild fails")
        void shouldKeepPreviousIndexOnFailure() {
            // Given
            CatalogLoader loader = mock(CatalogLoader.class);
            when(loader.loadFields()).thenReturn(List.of(TestCatalogs.field("sex", FieldType.STRING)));
            when(loader.reloadFields()).thenThrow(new IllegalStateException("disk gone"));
            CatalogIndex failing = new CatalogIndex(loader);
            failing.buildIndex(false);

            // When
            CatalogException exception = assertThrows(CatalogException.class, () -> failing.buildIndex(true));

            // Then
            assertInstanceOf(IllegalStateException.class, exception.getCause());
            assertEquals(1, failing.getGeneration());
            assertEquals("sex", failing.search("sex").get(0).fieldPath());
        }

        @Test
        @DisplayName("Should propagate catalog load failures unchanged")
        void shouldPropagateCatalogException() {
            CatalogIndex missing = new CatalogIndex(new JsonCatalogLoader(java.nio.file.Path.of("does-not-exist.json")));

            assertThrows(CatalogException.class, () -> missing.search("sex"));
            assertEquals(0, missing.getGeneration());
        }

        @Test
        @DisplayName("Should serve consistent results while rebuilding concurrently")
        void shouldSearchWhileRebuilding() throws Exception {
            index.buildIndex(false);
            ExecutorService executor = Executors.newFixedThreadPool(4);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<String>> results = new ArrayList<>();
                for (int i = 0; i < 20; i++) {
                    final int round = i;
                    results.add(executor.submit(() -> {
                        start.await();
                        if (round % 5 == 0) {
                            index.buildIndex(true);
                        }
                        return index.search("gender").get(0).fieldPath();
                    }));
                }
                start.countDown();
                for (Future<String> result : results) {
                    assertEquals("sex", result.get(10, TimeUnit.SECONDS));
                }
                assertEquals(5, index.getGeneration());
            } finally {
                executor.shutdownNow();
            }
        }
    }
}

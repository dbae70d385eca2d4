package io.github.cyfko.cohortql.core.search;

import io.github.cyfko.cohortql.core.catalog.CatalogIndex;
import io.github.cyfko.cohortql.core.catalog.TestCatalogs;
import io.github.cyfko.cohortql.core.config.CachePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("CachingCatalogSearch Tests")
class CachingCatalogSearchTest {

    private CatalogIndex index;

    @BeforeEach
    void setUp() {
        index = spy(TestCatalogs.index());
    }

    @Test
    @DisplayName("Should serve repeated normalized terms from the cache")
    void shouldCacheByNormalizedTerm() {
        // Given
        CachingCatalogSearch search = new CachingCatalogSearch(index, CachePolicy.defaults());

        // When
        List<FieldCandidate> first = search.search("gender");
        List<FieldCandidate> second = search.search("  GENDER! ");

        // Then
        assertEquals(first, second);
        verify(index, times(1)).search(anyString(), anyInt());
        assertEquals(1, search.getCache().getHitCount());
    }

    @Test
    @DisplayName("Should key the cache by candidate limit")
    void shouldKeyByLimit() {
        CachingCatalogSearch search = new CachingCatalogSearch(index, CachePolicy.defaults());

        assertEquals(3, search.search("unknown", 5).size());
        assertEquals(1, search.search("unknown", 1).size());
        verify(index, times(2)).search(anyString(), anyInt());
    }

    @Test
    @DisplayName("Should ignore entries computed before a rebuild")
    void shouldRecomputeAfterRebuild() {
        // Given
        CachingCatalogSearch search = new CachingCatalogSearch(index, CachePolicy.defaults());
        search.search("gender");

        // When
        index.buildIndex(true);
        List<FieldCandidate> afterRebuild = search.search("gender");

        // Then
        assertEquals("sex", afterRebuild.get(0).fieldPath());
        verify(index, times(2)).search(anyString(), anyInt());
    }

    @Test
    @DisplayName("Should always delegate when caching is disabled")
    void shouldDelegateWhenDisabled() {
        CachingCatalogSearch search = new CachingCatalogSearch(index, CachePolicy.none());

        search.search("gender");
        search.search("gender");

        verify(index, times(2)).search(anyString(), anyInt());
        assertEquals(0, search.getCache().size());
    }

    @Test
    @DisplayName("Should drop every entry on invalidate")
    void shouldInvalidate() {
        CachingCatalogSearch search = new CachingCatalogSearch(index, CachePolicy.custom(10));
        search.search("gender");

        search.invalidate();
        search.search("gender");

        verify(index, times(2)).search(anyString(), anyInt());
    }
}

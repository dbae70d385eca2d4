package io.github.cyfko.cohortql.core.catalog;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics about the last catalog load.
 *
 * @param totalEntries number of records in the source
 * @param validFields  number of records that produced a field
 * @param fieldTypes   number of fields per type
 * @param lastLoaded   time of the last successful load, {@code null} if never loaded
 * @param source       description of the source, typically the file path
 * @since 1.0.0
 */
public record CatalogStats(
        int totalEntries,
        int validFields,
        Map<FieldType, Integer> fieldTypes,
        Instant lastLoaded,
        String source
) {

    public CatalogStats {
        fieldTypes = Map.copyOf(fieldTypes);
    }
}

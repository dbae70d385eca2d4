package io.github.cyfko.cohortql.core.catalog;

import java.util.List;

/**
 * Source of catalog field descriptors.
 * <p>
 * Implementations return the full field set on every call. Failures to read the underlying source
 * are fatal and reported as {@link io.github.cyfko.cohortql.core.exception.CatalogException};
 * individual malformed records are skipped.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface CatalogLoader {

    /**
     * @return the catalog fields, unique by path, in source order
     * @throws io.github.cyfko.cohortql.core.exception.CatalogException if the source cannot be read
     */
    List<CatalogField> loadFields();

    /**
     * Loads the fields, bypassing any cache the implementation keeps.
     *
     * @return the catalog fields
     */
    default List<CatalogField> reloadFields() {
        return loadFields();
    }
}

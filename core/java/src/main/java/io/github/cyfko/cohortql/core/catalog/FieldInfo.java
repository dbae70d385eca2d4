package io.github.cyfko.cohortql.core.catalog;

import java.util.List;

/**
 * Summary of a catalog field for display.
 *
 * @param path            field path
 * @param type            canonical type name, e.g. {@code "enumeration"}
 * @param description     description, may be {@code null}
 * @param searchableTerms searchable terms
 * @param enumValues      enum values, empty for non-enumeration fields
 * @param enumCount       number of enum values
 * @since 1.0.0
 */
public record FieldInfo(
        String path,
        String type,
        String description,
        List<String> searchableTerms,
        List<String> enumValues,
        int enumCount
) {

    static FieldInfo of(CatalogField field) {
        return new FieldInfo(field.path(), field.fieldType().catalogName(), field.description(),
                field.searchableTerms(), field.enumValues(), field.enumValues().size());
    }
}

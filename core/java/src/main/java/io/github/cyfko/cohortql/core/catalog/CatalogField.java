package io.github.cyfko.cohortql.core.catalog;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable descriptor of one filterable field of the catalog.
 * <p>
 * {@code path} is dot-separated for fields of a related entity: {@code "sex"} is a subject field,
 * {@code "tumor_assessments.tumor_site"} a field of the {@code tumor_assessments} entity.
 * {@code searchableTerms} are lower-cased, stripped and de-duplicated, in declaration order.
 * </p>
 *
 * @param path            unique field path
 * @param fieldType       value type
 * @param enumValues      accepted values in catalog casing, empty unless {@link FieldType#ENUMERATION}
 * @param description     human readable description, may be {@code null}
 * @param searchableTerms terms the field can be found by
 * @since 1.0.0
 */
public record CatalogField(
        String path,
        FieldType fieldType,
        List<String> enumValues,
        String description,
        List<String> searchableTerms
) {

    public CatalogField {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Field path is required");
        }
        Objects.requireNonNull(fieldType, "fieldType");
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
        searchableTerms = searchableTerms == null ? List.of() : List.copyOf(searchableTerms);
    }

    public boolean isEnumeration() {
        return fieldType == FieldType.ENUMERATION;
    }

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }

    /**
     * @return the related entity name for a nested field, empty for a subject field
     */
    public Optional<String> entity() {
        int separator = path.indexOf('.');
        return separator < 0 ? Optional.empty() : Optional.of(path.substring(0, separator));
    }
}

package io.github.cyfko.cohortql.core.catalog;

import java.util.Locale;
import java.util.Optional;

/**
 * Value type of a catalog field.
 *
 * @since 1.0.0
 */
public enum FieldType {
    ENUMERATION("enumeration", "enum"),
    STRING("string", "text"),
    NUMBER("number", "int", "integer", "float"),
    BOOLEAN("boolean", "bool"),
    DATE("date", "datetime");

    private final String[] aliases;

    FieldType(String... aliases) {
        this.aliases = aliases;
    }

    /**
     * Finds a type by one of its catalog aliases, ignoring case.
     *
     * @param name alias such as {@code "enum"} or {@code "Integer"}
     * @return the type, or empty for {@code null} or an unknown alias
     */
    public static Optional<FieldType> fromAlias(String name) {
        if (name == null) return Optional.empty();
        String normalized = name.strip().toLowerCase(Locale.ROOT);
        for (FieldType type : values()) {
            for (String alias : type.aliases) {
                if (alias.equals(normalized)) return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the type declared by a catalog record. A missing or unknown declaration is inferred:
     * {@link #ENUMERATION} when the record lists enum values, {@link #STRING} otherwise.
     *
     * @param declared      the record's {@code type}, may be {@code null}
     * @param hasEnumValues whether the record lists at least one enum value
     * @return the resolved type
     */
    public static FieldType fromCatalogType(String declared, boolean hasEnumValues) {
        return fromAlias(declared).orElse(hasEnumValues ? ENUMERATION : STRING);
    }

    /**
     * @return the canonical catalog name, e.g. {@code "enumeration"}
     */
    public String catalogName() {
        return aliases[0];
    }
}

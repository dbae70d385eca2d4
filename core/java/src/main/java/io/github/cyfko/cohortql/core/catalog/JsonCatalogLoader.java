package io.github.cyfko.cohortql.core.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.cohortql.core.exception.CatalogException;
import io.github.cyfko.cohortql.core.utils.TextNormalizer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * {@link CatalogLoader} reading a JSON array of field records from a file.
 *
 * <h2>Record Format</h2>
 * <pre>{@code
 * [
 *   {
 *     "field_path": "tumor_assessments.tumor_site",
 *     "type": "enum",
 *     "enum_values": ["Adrenal Gland", "Bone", "Liver"],
 *     "searchable_terms": ["tumor site", "tumor location"],
 *     "field_name": "tumor site",
 *     "description": "Anatomic site of the tumor"
 *   }
 * ]
 * }</pre>
 * <p>
 * Only {@code field_path} is required. A missing or unknown {@code type} is inferred from the
 * presence of {@code enum_values}; enum values are kept for enumeration fields only. The searchable
 * terms of a field are its declared {@code searchable_terms}, its {@code field_name}, its
 * {@code description} and its enum values, lower-cased, stripped and de-duplicated in that order.
 * </p>
 *
 * <h2>Failure Model</h2>
 * <ul>
 *   <li>Missing file, unreadable file, invalid JSON or a non-array root: {@link CatalogException}.</li>
 *   <li>A record without {@code field_path} or with a wrong shape: skipped with a warning.</li>
 *   <li>A duplicate {@code field_path}: the first record wins, later ones are skipped with a warning.</li>
 * </ul>
 *
 * <h2>Caching</h2>
 * <p>
 * Parsed fields are reused while the file's modification time is unchanged.
 * {@link #reloadFields()} always reads the file again.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonCatalogLoader implements CatalogLoader {

    private static final Logger log = Logger.getLogger(JsonCatalogLoader.class.getName());

    private final Path catalogPath;
    private final ObjectMapper objectMapper;

    private List<CatalogField> cachedFields;
    private FileTime cachedModifiedTime;
    private int lastTotalEntries;
    private Instant lastLoaded;

    public JsonCatalogLoader(Path catalogPath) {
        this(catalogPath, new ObjectMapper());
    }

    public JsonCatalogLoader(Path catalogPath, ObjectMapper objectMapper) {
        this.catalogPath = Objects.requireNonNull(catalogPath, "catalogPath");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        log.fine(() -> "Initialized catalog loader with path: " + catalogPath);
    }

    @Override
    public List<CatalogField> loadFields() {
        return loadFields(false);
    }

    @Override
    public List<CatalogField> reloadFields() {
        return loadFields(true);
    }

    /**
     * Loads the catalog, reusing the cached fields while the file is unchanged.
     *
     * @param forceReload read the file even if the cache is valid
     * @return the parsed fields
     * @throws CatalogException if the file cannot be read or is not a JSON array
     */
    public synchronized List<CatalogField> loadFields(boolean forceReload) {
        if (!forceReload && isCacheValid()) {
            log.fine("Using cached catalog data");
            return cachedFields;
        }

        log.info(() -> "Loading catalog from: " + catalogPath);
        if (!Files.isRegularFile(catalogPath)) {
            throw new CatalogException("Catalog file not found: " + catalogPath);
        }

        JsonNode root;
        FileTime modifiedTime;
        try {
            modifiedTime = Files.getLastModifiedTime(catalogPath);
            root = objectMapper.readTree(catalogPath.toFile());
        } catch (JsonProcessingException e) {
            throw new CatalogException("Invalid JSON in catalog file " + catalogPath + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CatalogException("Failed to read catalog file " + catalogPath, e);
        }
        if (root == null || !root.isArray()) {
            throw new CatalogException("Catalog file must contain a JSON array: " + catalogPath);
        }

        List<CatalogField> fields = parseEntries(root);
        cachedFields = List.copyOf(fields);
        cachedModifiedTime = modifiedTime;
        lastTotalEntries = root.size();
        lastLoaded = Instant.now();
        log.info(() -> String.format("Loaded catalog with %d entries (%d valid fields)", root.size(), fields.size()));
        return cachedFields;
    }

    /**
     * @return statistics about the last load; a never loaded catalog reports zero entries
     */
    public synchronized CatalogStats getStats() {
        Map<FieldType, Integer> types = new EnumMap<>(FieldType.class);
        List<CatalogField> fields = cachedFields == null ? List.of() : cachedFields;
        for (CatalogField field : fields) {
            types.merge(field.fieldType(), 1, Integer::sum);
        }
        return new CatalogStats(lastTotalEntries, fields.size(), types, lastLoaded, catalogPath.toString());
    }

    public Path getCatalogPath() {
        return catalogPath;
    }

    private boolean isCacheValid() {
        if (cachedFields == null || cachedModifiedTime == null) return false;
        try {
            return cachedModifiedTime.equals(Files.getLastModifiedTime(catalogPath));
        } catch (IOException e) {
            return false;
        }
    }

    private List<CatalogField> parseEntries(JsonNode root) {
        List<CatalogField> fields = new ArrayList<>();
        Set<String> seenPaths = new LinkedHashSet<>();
        int position = 0;
        for (JsonNode entry : root) {
            final int index = position++;
            CatalogField field;
            try {
                field = parseEntry(entry);
            } catch (IllegalArgumentException e) {
                log.warning(() -> "Skipping catalog entry #" + index + ": " + e.getMessage());
                continue;
            }
            String path = field.path();
            if (!seenPaths.add(path)) {
                log.warning(() -> "Skipping duplicate catalog entry #" + index + " for path: " + path);
                continue;
            }
            fields.add(field);
        }
        return fields;
    }

    private CatalogField parseEntry(JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            throw new IllegalArgumentException("entry is not an object");
        }
        String path = textOrNull(entry.get("field_path"));
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("missing field_path");
        }

        List<String> declaredEnumValues = stringList(entry.get("enum_values"), "enum_values");
        FieldType type = FieldType.fromCatalogType(textOrNull(entry.get("type")), !declaredEnumValues.isEmpty());
        List<String> enumValues = type == FieldType.ENUMERATION ? declaredEnumValues : List.of();
        String description = textOrNull(entry.get("description"));

        List<String> rawTerms = new ArrayList<>(stringList(entry.get("searchable_terms"), "searchable_terms"));
        String fieldName = textOrNull(entry.get("field_name"));
        if (fieldName != null) rawTerms.add(fieldName);
        if (description != null) rawTerms.add(description);
        rawTerms.addAll(enumValues);

        Set<String> terms = new LinkedHashSet<>();
        for (String term : rawTerms) {
            String normalized = TextNormalizer.lowerStrip(term);
            if (!normalized.isEmpty()) terms.add(normalized);
        }

        return new CatalogField(path.strip(), type, enumValues, description, new ArrayList<>(terms));
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (!node.isTextual()) {
            throw new IllegalArgumentException("expected a string but got " + node.getNodeType());
        }
        return node.asText();
    }

    private static List<String> stringList(JsonNode node, String name) {
        if (node == null || node.isNull()) return List.of();
        if (node.isTextual()) return List.of(node.asText());
        if (!node.isArray()) {
            throw new IllegalArgumentException(name + " must be an array of strings");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (item.isTextual() && !item.asText().isBlank()) {
                values.add(item.asText());
            }
        }
        return values;
    }
}

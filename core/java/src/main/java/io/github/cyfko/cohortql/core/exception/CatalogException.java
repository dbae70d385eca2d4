package io.github.cyfko.cohortql.core.exception;

/**
 * Exception thrown when the field catalog cannot be loaded, parsed or indexed.
 * <p>
 * Catalog failures are fatal at load time: the caller asking for a (re)build receives this
 * exception immediately. A failing rebuild never invalidates an index that was already built,
 * so callers searching an existing index are not affected.
 * </p>
 *
 * <p><strong>Typical causes:</strong></p>
 * <ul>
 *   <li>Catalog file missing or unreadable</li>
 *   <li>Invalid JSON in the catalog file</li>
 *   <li>Root element is not a JSON array of field records</li>
 * </ul>
 *
 * <pre>{@code
 * try {
 *     index.buildIndex(true);
 * } catch (CatalogException e) {
 *     log.warning("Catalog rebuild failed, previous index kept: " + e.getMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class CatalogException extends RuntimeException {

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message description of the catalog failure
     */
    public CatalogException(String message) {
        super(message);
    }

    /**
     * Creates an exception with an explanatory message and the underlying cause
     * (typically an {@link java.io.IOException} or a JSON processing error).
     *
     * @param message description of the catalog failure
     * @param cause   the original cause
     */
    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}

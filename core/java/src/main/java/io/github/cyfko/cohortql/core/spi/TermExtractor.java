package io.github.cyfko.cohortql.core.spi;

import io.github.cyfko.cohortql.core.model.ParsedQuery;

/**
 * Turns free text into catalog search terms.
 * <p>
 * Implementations live outside the core (rule based tokenizers, language models, ...). The pipeline
 * calls {@link #extract(String)} once per request and never retries; any exception is reported as a
 * {@link io.github.cyfko.cohortql.core.exception.PipelineException.Stage#TERM_EXTRACTION} failure.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface TermExtractor {

    /**
     * @param text the user request
     * @return the extracted terms, never {@code null}
     */
    ParsedQuery extract(String text);
}

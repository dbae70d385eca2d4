package io.github.cyfko.cohortql.core.spi;

import java.time.Duration;
import java.util.Map;

/**
 * Outcome of a remote query execution.
 *
 * @param success       whether the endpoint returned data
 * @param data          response data, empty on failure
 * @param error         error message, {@code null} on success
 * @param executionTime time spent by the client
 * @since 1.0.0
 */
public record ExecutionResult(boolean success, Map<String, Object> data, String error, Duration executionTime) {

    public ExecutionResult {
        data = data == null ? Map.of() : data;
        executionTime = executionTime == null ? Duration.ZERO : executionTime;
    }

    public static ExecutionResult success(Map<String, Object> data, Duration executionTime) {
        return new ExecutionResult(true, data, null, executionTime);
    }

    public static ExecutionResult failure(String error, Duration executionTime) {
        return new ExecutionResult(false, Map.of(), error, executionTime);
    }
}

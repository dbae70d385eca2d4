package io.github.cyfko.cohortql.core.codec;

import io.github.cyfko.cohortql.core.api.Combinator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flat, UI-facing representation of selected filter conditions.
 * <p>
 * A {@link FilterKind#STANDARD} state maps keys to {@link FilterValue}s. A key is either a subject
 * field ({@code "race"}) or an entity-qualified field ({@code "tumor_assessments.tumor_site"}); only
 * one level of nesting exists. A {@link FilterKind#COMPOSED} state instead holds child states joined
 * by {@code combineMode}. Key order is preserved.
 * </p>
 *
 * <pre>{@code
 * FilterState state = FilterState.standard(Combinator.AND, Map.of(
 *     "race", FilterValue.Option.of("Asian"),
 *     "age_at_censor_status", new FilterValue.Range(0, 18)));
 * }</pre>
 *
 * @param combineMode how values or children combine
 * @param kind        standard or composed
 * @param values      key to selection, empty for composed states
 * @param children    sub-states, empty for standard states
 * @since 1.0.0
 */
public record FilterState(
        Combinator combineMode,
        FilterKind kind,
        Map<String, FilterValue> values,
        List<FilterState> children
) {

    public FilterState {
        Objects.requireNonNull(combineMode, "combineMode");
        Objects.requireNonNull(kind, "kind");
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        children = children == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(children));
    }

    public static FilterState standard(Combinator combineMode, Map<String, FilterValue> values) {
        return new FilterState(combineMode, FilterKind.STANDARD, values, List.of());
    }

    public static FilterState composed(Combinator combineMode, List<FilterState> children) {
        return new FilterState(combineMode, FilterKind.COMPOSED, Map.of(), children);
    }

    /**
     * @return true when there is nothing to encode
     */
    public boolean isEmpty() {
        return kind == FilterKind.COMPOSED ? children.isEmpty() : values.isEmpty();
    }
}

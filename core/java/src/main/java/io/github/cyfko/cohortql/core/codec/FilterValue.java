package io.github.cyfko.cohortql.core.codec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Selection held by one key of a {@link FilterState}.
 *
 * @since 1.0.0
 */
public sealed interface FilterValue permits FilterValue.Option, FilterValue.Range, FilterValue.Anchored {

    /**
     * A set of selected values. {@code exclusion} means "none of these"; the wire grammar has no
     * negation, so the encoder ignores it. Selected values may not be {@code null}.
     */
    record Option(List<Object> selectedValues, boolean exclusion) implements FilterValue {
        public Option {
            if (selectedValues != null && selectedValues.stream().anyMatch(Objects::isNull)) {
                throw new IllegalArgumentException("Option selections must not contain null");
            }
            selectedValues = selectedValues == null
                    ? List.of()
                    : Collections.unmodifiableList(new ArrayList<>(selectedValues));
        }

        public static Option of(Object... values) {
            return new Option(Arrays.asList(values), false);
        }
    }

    /**
     * Inclusive bounds; either may be {@code null} for an open side.
     */
    record Range(Object lowerBound, Object upperBound) implements FilterValue {
        public boolean isUnbounded() {
            return lowerBound == null && upperBound == null;
        }
    }

    /**
     * An ordered ("anchored") selection. Kept as raw properties: the wire grammar cannot express it
     * and the encoder rejects it.
     */
    record Anchored(Map<String, Object> properties) implements FilterValue {
        public Anchored {
            properties = properties == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }
    }
}

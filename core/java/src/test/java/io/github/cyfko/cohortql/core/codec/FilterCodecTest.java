package io.github.cyfko.cohortql.core.codec;

import io.github.cyfko.cohortql.core.api.Combinator;
import io.github.cyfko.cohortql.core.api.FilterCondition;
import io.github.cyfko.cohortql.core.api.FilterNode;
import io.github.cyfko.cohortql.core.api.Op;
import io.github.cyfko.cohortql.core.exception.UnsupportedFilterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FilterCodec Tests")
class FilterCodecTest {

    private final FilterCodec codec = new FilterCodec();

    private static FilterNode leaf(String field, Op op, Object value) {
        return FilterNode.leaf(new FilterCondition(field, op, value));
    }

    private static FilterState raceAndAge() {
        Map<String, FilterValue> values = new LinkedHashMap<>();
        values.put("race", FilterValue.Option.of("Asian"));
        values.put("age_at_censor_status", new FilterValue.Range(0, 18));
        return FilterState.standard(Combinator.AND, values);
    }

    // ========================================================================
    // Encoding
    // ========================================================================

    @Nested
    @DisplayName("Encoding")
    class Encoding {

        @Test
        @DisplayName("Should encode nothing for null or empty states")
        void shouldEncodeEmptyAsNull() {
            assertNull(codec.encode(null));
            assertNull(codec.encode(FilterState.standard(Combinator.AND, Map.of())));
            assertNull(codec.encode(FilterState.composed(Combinator.OR, List.of())));
        }

        @Test
        @DisplayName("Should encode a single option unwrapped")
        void shouldEncodeOption() {
            FilterState state = FilterState.standard(Combinator.AND, Map.of("race", FilterValue.Option.of("Asian")));

            assertEquals(leaf("race", Op.IN, List.of("Asian")), codec.encode(state));
        }

        @Test
        @DisplayName("Should encode options, ranges and nested keys in order")
        void shouldEncodeMixedState() {
            // Given
            Map<String, FilterValue> values = new LinkedHashMap<>();
            values.put("tumor_assessments.tumor_site", FilterValue.Option.of("Liver"));
            values.put("race", FilterValue.Option.of("Asian"));
            values.put("age_at_censor_status", new FilterValue.Range(0, 18));
            values.put("enrollment_date", new FilterValue.Range(null, "2020-01-01"));

            // When
            FilterNode encoded = codec.encode(FilterState.standard(Combinator.OR, values));

            // Then
            FilterNode expected = new FilterNode.Logical(Combinator.OR, List.of(
                    leaf("race", Op.IN, List.of("Asian")),
                    new FilterNode.Logical(Combinator.AND, List.of(
                            leaf("age_at_censor_status", Op.GTE, 0),
                            leaf("age_at_censor_status", Op.LTE, 18))),
                    leaf("enrollment_date", Op.LTE, "2020-01-01"),
                    new FilterNode.Nested("tumor_assessments", Combinator.OR, List.of(
                            leaf("tumor_site", Op.IN, List.of("Liver"))))));
            assertEquals(expected, encoded);
        }

        @Test
        @DisplayName("Should skip empty selections and unbounded ranges")
        void shouldSkipEmptyValues() {
            Map<String, FilterValue> values = new LinkedHashMap<>();
            values.put("race", new FilterValue.Option(List.of(), false));
            values.put("age_at_censor_status", new FilterValue.Range(null, null));

            assertNull(codec.encode(FilterState.standard(Combinator.AND, values)));
        }

        @Test
        @DisplayName("Should join composed children and drop empty ones")
        void shouldEncodeComposedState() {
            FilterState composed = FilterState.composed(Combinator.OR, List.of(
                    FilterState.standard(Combinator.AND, Map.of("race", FilterValue.Option.of("Asian"))),
                    FilterState.standard(Combinator.AND, Map.of()),
                    FilterState.standard(Combinator.AND, Map.of("sex", FilterValue.Option.of("Male")))));

            FilterNode.Logical root = assertInstanceOf(FilterNode.Logical.class, codec.encode(composed));

            assertEquals(Combinator.OR, root.combinator());
            assertEquals(2, root.children().size());
        }

        @Test
        @DisplayName("Should encode an excluded option as a plain IN")
        void shouldEncodeExclusionAsIn() {
            // Given
            FilterState state = FilterState.standard(Combinator.AND,
                    Map.of("race", new FilterValue.Option(List.of("Asian"), true)));

            // When
            FilterNode encoded = codec.encode(state);

            // Then
            assertEquals(leaf("race", Op.IN, List.of("Asian")), encoded);
        }

        @Test
        @DisplayName("Should refuse null selections when the option is built")
        void shouldRejectNullSelections() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> new FilterValue.Option(Arrays.asList("Asian", null), false));
            assertEquals("Option selections must not contain null", e.getMessage());
            assertThrows(IllegalArgumentException.class, () -> FilterValue.Option.of("Asian", null));
        }

        @Test
        @DisplayName("Should reject anchored values")
        void shouldRejectAnchored() {
            FilterState state = FilterState.standard(Combinator.AND,
                    Map.of("age_at_censor_status", new FilterValue.Anchored(Map.of("anchor", "diagnosis"))));

            assertThrows(UnsupportedFilterException.class, () -> codec.encode(state));
        }
    }

    // ========================================================================
    // Decoding
    // ========================================================================

    @Nested
    @DisplayName("Decoding")
    class Decoding {

        @Test
        @DisplayName("Should restore options and ranges")
        void shouldRestoreEncodedState() {
            FilterState original = raceAndAge();

            FilterState decoded = codec.decode(codec.encode(original));

            assertEquals(Combinator.AND, decoded.combineMode());
            assertEquals(FilterKind.STANDARD, decoded.kind());
            assertEquals(original.values(), decoded.values());
        }

        @Test
        @DisplayName("Should read a bare condition as the only AND child")
        void shouldDecodeBareCondition() {
            FilterState decoded = codec.decode(leaf("sex", Op.IN, List.of("Male", "Female")));

            assertEquals(Combinator.AND, decoded.combineMode());
            assertEquals(Map.of("sex", FilterValue.Option.of("Male", "Female")), decoded.values());
        }

        @Test
        @DisplayName("Should read nested IN conditions as qualified keys and skip nested ranges")
        void shouldDecodeNested() {
            FilterNode filter = new FilterNode.Logical(Combinator.OR, List.of(
                    new FilterNode.Nested("tumor_assessments", Combinator.AND, List.of(
                            leaf("tumor_site", Op.IN, List.of("Liver")),
                            leaf("age_at_tumor_assessment", Op.GTE, 5)))));

            FilterState decoded = codec.decode(filter);

            assertEquals(Combinator.OR, decoded.combineMode());
            assertEquals(Map.of("tumor_assessments.tumor_site", FilterValue.Option.of("Liver")), decoded.values());
        }

        @Test
        @DisplayName("Should read every field of a multi-field IN inside a nested block")
        void shouldDecodeNestedMultiFieldIn() {
            // Given
            FilterNode filter = new WireFilterMapper().read("{\"AND\":["
                    + "{\"IN\":{\"sex\":[\"Male\"]}},"
                    + "{\"nested\":{\"path\":\"tumor_assessments\",\"AND\":["
                    + "{\"IN\":{\"tumor_site\":[\"Liver\"],\"tumor_state\":[\"Present\"]}}]}}]}");

            // When
            FilterState decoded = codec.decode(filter);

            // Then
            Map<String, FilterValue> expected = new LinkedHashMap<>();
            expected.put("sex", FilterValue.Option.of("Male"));
            expected.put("tumor_assessments.tumor_site", FilterValue.Option.of("Liver"));
            expected.put("tumor_assessments.tumor_state", FilterValue.Option.of("Present"));
            assertEquals(expected, decoded.values());
        }

        @Test
        @DisplayName("Should restore two nested selections on the same entity")
        void shouldRoundTripNestedSelections() {
            Map<String, FilterValue> values = new LinkedHashMap<>();
            values.put("tumor_assessments.tumor_site", FilterValue.Option.of("Liver"));
            values.put("tumor_assessments.tumor_state", FilterValue.Option.of("Present"));
            FilterState state = FilterState.standard(Combinator.AND, values);

            FilterNode wire = new WireFilterMapper().read(new WireFilterMapper().writeJson(codec.encode(state)));

            assertEquals(values, codec.decode(wire).values());
        }

        @Test
        @DisplayName("Should skip operators without a state form")
        void shouldSkipUnrepresentableOperators() {
            FilterNode filter = new FilterNode.Logical(Combinator.AND, List.of(
                    leaf("subject_submitter_id", Op.CONTAINS, "%sub%"),
                    leaf("age_at_censor_status", Op.GT, 3),
                    new FilterNode.Logical(Combinator.OR, List.of(leaf("sex", Op.IN, List.of("Male")))),
                    leaf("race", Op.IN, List.of("Asian"))));

            FilterState decoded = codec.decode(filter);

            assertEquals(Map.of("race", FilterValue.Option.of("Asian")), decoded.values());
        }

        @Test
        @DisplayName("Should let a later IN replace an earlier one")
        void shouldKeepLastOption() {
            FilterNode filter = new FilterNode.Logical(Combinator.AND, List.of(
                    leaf("race", Op.IN, List.of("Asian")),
                    leaf("race", Op.IN, List.of("White"))));

            assertEquals(FilterValue.Option.of("White"), codec.decode(filter).values().get("race"));
        }

        @Test
        @DisplayName("Should merge separate bounds into one range")
        void shouldMergeBounds() {
            FilterNode filter = new FilterNode.Logical(Combinator.AND, List.of(
                    leaf("age_at_censor_status", Op.LTE, 18),
                    leaf("sex", Op.IN, List.of("Male")),
                    leaf("age_at_censor_status", Op.GTE, 2)));

            assertEquals(new FilterValue.Range(2, 18), codec.decode(filter).values().get("age_at_censor_status"));
        }

        @Test
        @DisplayName("Should decode nothing from null")
        void shouldDecodeNull() {
            assertNull(codec.decode(null));
        }
    }
}

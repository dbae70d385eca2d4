package io.github.cyfko.cohortql.core.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Filter grammar Tests")
class FilterNodeTest {

    private static final FilterNode SEX_MALE = FilterNode.leaf(FilterCondition.in("sex", List.of("Male")));
    private static final FilterNode RACE_ASIAN = FilterNode.leaf(FilterCondition.in("race", List.of("Asian")));

    @Test
    @DisplayName("Should combine none, one or several nodes")
    void shouldCombineNodes() {
        assertNull(FilterNode.combine(Combinator.AND, List.of()));
        assertSame(SEX_MALE, FilterNode.combine(Combinator.OR, List.of(SEX_MALE)));
        assertEquals(new FilterNode.Logical(Combinator.OR, List.of(SEX_MALE, RACE_ASIAN)),
                FilterNode.combine(Combinator.OR, List.of(SEX_MALE, RACE_ASIAN)));
    }

    @Test
    @DisplayName("Should reject empty groups")
    void shouldRejectEmptyGroups() {
        assertThrows(IllegalArgumentException.class, () -> new FilterNode.Logical(Combinator.AND, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new FilterNode.Nested("tumor_assessments", Combinator.AND, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new FilterNode.Nested(" ", Combinator.AND, List.of(SEX_MALE)));
    }

    @Test
    @DisplayName("Should reject nested blocks inside nested blocks")
    void shouldRejectDeepNesting() {
        FilterNode inner = new FilterNode.Nested("histologies", Combinator.AND, List.of(SEX_MALE));
        FilterNode group = new FilterNode.Logical(Combinator.OR, List.of(RACE_ASIAN, inner));

        assertThrows(IllegalArgumentException.class,
                () -> new FilterNode.Nested("tumor_assessments", Combinator.AND, List.of(inner)));
        assertThrows(IllegalArgumentException.class,
                () -> new FilterNode.Nested("tumor_assessments", Combinator.AND, List.of(group)));
    }

    @Test
    @DisplayName("Should require a list for IN conditions")
    void shouldValidateConditions() {
        assertThrows(IllegalArgumentException.class, () -> new FilterCondition("sex", Op.IN, "Male"));
        assertThrows(IllegalArgumentException.class, () -> new FilterCondition("", Op.GT, 1));
        assertThrows(NullPointerException.class, () -> new FilterCondition("age", Op.GT, null));
        assertEquals(List.of(3), new FilterCondition("age", Op.GT, 3).valuesAsList());
    }

    @ParameterizedTest
    @CsvSource({"eq, IN", "IN, IN", "gte, GTE", "Lt, LT", "startswith, CONTAINS", "endswith, CONTAINS", "between, IN"})
    @DisplayName("Should map resolver operators to wire operators")
    void shouldMapResolverOperators(String operator, Op expected) {
        assertEquals(expected, Op.fromResolverOperator(operator));
    }

    @Test
    @DisplayName("Should parse combinators leniently and wire keys strictly")
    void shouldParseKeys() {
        assertEquals(Combinator.OR, Combinator.fromString(" or "));
        assertThrows(IllegalArgumentException.class, () -> Combinator.fromString("xor"));
        assertFalse(Combinator.isCombinatorKey("and"));
        assertTrue(Op.fromWireKey("CONTAINS").isPresent());
        assertTrue(Op.fromWireKey("contains").isEmpty());
        assertEquals(Op.IN, Op.fromResolverOperator(null));
    }
}

package io.github.cyfko.cohortql.core.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ValueCoercion Tests")
class ValueCoercionTest {

    @Nested
    @DisplayName("Numbers")
    class Numbers {

        @Test
        @DisplayName("Should parse integral and decimal strings")
        void shouldParseNumbers() {
            assertEquals(42L, ValueCoercion.toNumberIfNumeric("42"));
            assertEquals(-3L, ValueCoercion.toNumberIfNumeric("-3"));
            assertEquals(4.5, ValueCoercion.toNumberIfNumeric("4.5"));
        }

        @Test
        @DisplayName("Should keep non numeric values as strings")
        void shouldKeepText() {
            assertEquals("twelve", ValueCoercion.toNumberIfNumeric("twelve"));
            assertEquals("12-3", ValueCoercion.toNumberIfNumeric("12-3"));
            assertEquals("1.2.3", ValueCoercion.toNumberIfNumeric("1.2.3"));
        }

        @Test
        @DisplayName("Should leave numbers and null untouched")
        void shouldPassThroughNumbers() {
            assertEquals(7, ValueCoercion.toNumberIfNumeric(7));
            assertNull(ValueCoercion.toNumberIfNumeric(null));
        }
    }

    @Nested
    @DisplayName("Booleans")
    class Booleans {

        @ParameterizedTest
        @ValueSource(strings = {"true", "YES", " 1 ", "y"})
        @DisplayName("Should read truthy literals")
        void shouldReadTruthy(String value) {
            assertTrue(ValueCoercion.toBoolean(value));
            assertTrue(ValueCoercion.isBooleanLiteral(value));
        }

        @ParameterizedTest
        @ValueSource(strings = {"false", "No", "0", "n", "maybe"})
        @DisplayName("Should read anything else as false")
        void shouldReadFalsy(String value) {
            assertFalse(ValueCoercion.toBoolean(value));
        }

        @Test
        @DisplayName("Should coerce non string values")
        void shouldCoerceOtherTypes() {
            assertTrue(ValueCoercion.toBoolean(Boolean.TRUE));
            assertFalse(ValueCoercion.toBoolean(0));
            assertTrue(ValueCoercion.toBoolean(2L));
            assertFalse(ValueCoercion.toBoolean(null));
            assertFalse(ValueCoercion.isBooleanLiteral("maybe"));
        }
    }

    @Test
    @DisplayName("Should wrap scalars and drop null elements")
    void shouldConvertToList() {
        assertEquals(List.of("a"), ValueCoercion.toList("a"));
        assertEquals(List.of("a", "b"), ValueCoercion.toList(Arrays.asList("a", null, "b")));
        assertTrue(ValueCoercion.toList(null).isEmpty());
    }

    @Test
    @DisplayName("Should detect empty values")
    void shouldDetectEmpty() {
        assertTrue(ValueCoercion.isEmpty(null));
        assertTrue(ValueCoercion.isEmpty("  "));
        assertTrue(ValueCoercion.isEmpty(List.of()));
        assertFalse(ValueCoercion.isEmpty(0));
        assertFalse(ValueCoercion.isEmpty(List.of("x")));
    }
}

package com.streamclient.common.configuration;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OptionTypeTest {

    @Test
    void testListFromCommaSeparatedString() {
        assertEquals(List.of("a", "b", "c"), OptionType.LIST.convert(" a, b,,c "));
    }

    @Test
    void testListFromCollection() {
        assertEquals(List.of("kafka-1:9092", "kafka-2:9092"),
                OptionType.LIST.convert(List.of("kafka-1:9092 ", " kafka-2:9092", "")));
    }

    @Test
    void testNumbersFromStrings() {
        assertEquals(3, OptionType.INTEGER.convert("3"));
        assertEquals(250L, OptionType.LONG.convert(" 250 "));
        assertEquals(1.5, OptionType.DOUBLE.convert("1.5"));
        assertEquals(2L, OptionType.LONG.convert(2));
    }

    @Test
    void testBoolean() {
        assertEquals(Boolean.FALSE, OptionType.BOOLEAN.convert("FALSE"));
        assertEquals(Boolean.TRUE, OptionType.BOOLEAN.convert(true));
        assertThrows(IllegalArgumentException.class, () -> OptionType.BOOLEAN.convert("yes"));
    }

    @Test
    void testInvalidNumber() {
        assertThrows(IllegalArgumentException.class, () -> OptionType.INTEGER.convert("three"));
    }

    @Test
    void testFractionalNumberIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> OptionType.INTEGER.convert(2.9));
        assertThrows(IllegalArgumentException.class, () -> OptionType.LONG.convert(250.5));
        assertEquals(2, OptionType.INTEGER.convert(2.0));
    }

    @Test
    void testOutOfRangeNumberIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> OptionType.INTEGER.convert(3_000_000_000L));
        assertThrows(IllegalArgumentException.class, () -> OptionType.LONG.convert(1e30));
        assertEquals(3_000_000_000L, OptionType.LONG.convert(3_000_000_000L));
    }
}

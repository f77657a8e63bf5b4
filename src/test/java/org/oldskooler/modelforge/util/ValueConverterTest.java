package org.oldskooler.modelforge.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ValueConverterTest {

    @Test
    void integers_acceptWholeNumbersAndNumericText() {
        assertEquals(42, ValueConverter.convert("42", Integer.class));
        assertEquals(42, ValueConverter.convert(42L, int.class));
        assertEquals(7L, ValueConverter.convert(new BigDecimal("7.0"), Long.class));
    }

    @Test
    void integers_rejectFractionsAndOverflow() {
        assertThrows(IllegalArgumentException.class, () -> ValueConverter.convert(1.5, Integer.class));
        assertThrows(IllegalArgumentException.class, () -> ValueConverter.convert(Long.MAX_VALUE, Integer.class));
        assertThrows(IllegalArgumentException.class, () -> ValueConverter.convert(true, Integer.class));
    }

    @Test
    void booleans_acceptCommonSpellings() {
        assertEquals(Boolean.TRUE, ValueConverter.convert("yes", Boolean.class));
        assertEquals(Boolean.FALSE, ValueConverter.convert(0, boolean.class));
        assertThrows(IllegalArgumentException.class, () -> ValueConverter.convert(2, Boolean.class));
        assertThrows(IllegalArgumentException.class, () -> ValueConverter.convert("maybe", Boolean.class));
    }

    @Test
    void dateTimes_acceptIsoAndSqlText() {
        LocalDateTime expected = LocalDateTime.of(2025, 9, 27, 15, 30);
        assertEquals(expected, ValueConverter.convert("2025-09-27T15:30:00", LocalDateTime.class));
        assertEquals(expected, ValueConverter.convert("2025-09-27 15:30:00", LocalDateTime.class));
        assertEquals(LocalDate.of(2025, 9, 27), ValueConverter.convert("2025-09-27", LocalDate.class));
        assertThrows(IllegalArgumentException.class, () -> ValueConverter.convert("yesterday", LocalDate.class));
    }

    @Test
    void strings_acceptNumbersButNotArbitraryObjects() {
        assertEquals("5", ValueConverter.convert(5, String.class));
        assertThrows(IllegalArgumentException.class, () -> ValueConverter.convert(new Object(), String.class));
    }

    @Test
    void uuid_parsesText() {
        UUID id = UUID.randomUUID();
        assertEquals(id, ValueConverter.convert(id.toString(), UUID.class));
    }

    @Test
    void toItems_coversCollectionsAndArraysOnly() {
        assertEquals(Arrays.asList(1, 2), ValueConverter.toItems(new int[]{1, 2}));
        assertEquals(Arrays.asList("a", "b"), ValueConverter.toItems(Arrays.asList("a", "b")));
        assertNull(ValueConverter.toItems("ab"));
    }
}

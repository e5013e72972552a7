package com.finlens.backend.services.statements.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.LocalDate;

import org.junit.jupiter.api.Test;

class DateParserTest {

    @Test
    void parsesIsoLayouts() {
        assertEquals(LocalDate.of(2024, 1, 15), DateParser.parse("2024-01-15"));
        assertEquals(LocalDate.of(2024, 1, 15), DateParser.parse("2024/01/15"));
        assertEquals(LocalDate.of(2024, 1, 15), DateParser.parse("2024-01-15T10:30:00"));
        assertEquals(LocalDate.of(2024, 1, 15), DateParser.parse("2024-01-15 10:30:00"));
    }

    @Test
    void prefersUsOverEuWhenBothAreValid() {
        assertEquals(LocalDate.of(2024, 1, 2), DateParser.parse("01/02/2024"));
        assertEquals(LocalDate.of(2024, 1, 15), DateParser.parse("01/15/2024"));
        assertEquals(LocalDate.of(2024, 1, 5), DateParser.parse("1/5/2024"));
        assertEquals(LocalDate.of(2024, 1, 15), DateParser.parse("01/15/24"));
    }

    @Test
    void fallsThroughToEuWhenUsIsImpossible() {
        assertEquals(LocalDate.of(2024, 1, 13), DateParser.parse("13/01/2024"));
        assertEquals(LocalDate.of(2024, 1, 15), DateParser.parse("15.01.2024"));
        assertEquals(LocalDate.of(2024, 1, 15), DateParser.parse("15-01-2024"));
    }

    @Test
    void parsesTextualMonths() {
        assertEquals(LocalDate.of(2024, 1, 15), DateParser.parse("15 Jan 2024"));
        assertEquals(LocalDate.of(2024, 1, 15), DateParser.parse("Jan 15, 2024"));
        assertEquals(LocalDate.of(2024, 3, 5), DateParser.parse("5 MAR 2024"));
    }

    @Test
    void rejectsImpossibleOrGarbageDates() {
        assertNull(DateParser.parse("31/02/2024"));
        assertNull(DateParser.parse("not a date"));
        assertNull(DateParser.parse(""));
        assertNull(DateParser.parse(null));
    }

    @Test
    void parsesDayMonthAgainstGivenYear() {
        assertEquals(LocalDate.of(2024, 3, 5), DateParser.parseDayMonth("05/03", 2024));
        assertEquals(LocalDate.of(2023, 3, 5), DateParser.parseDayMonth("05 MAR", 2023));
        assertNull(DateParser.parseDayMonth("32/01", 2024));
    }
}

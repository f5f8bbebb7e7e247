package me.golemcore.hindsight.adapter.outbound.temporal;

import me.golemcore.hindsight.domain.model.DateRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RuleBasedTemporalParserTest {

    // Saturday
    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private RuleBasedTemporalParser parser;

    @BeforeEach
    void setUp() {
        parser = new RuleBasedTemporalParser(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ===== Absolute =====

    @Test
    void shouldResolveIsoDateToWholeDay() {
        assertRange("2024-03-05", "2024-03-05", parser.detect("what happened on 2024-03-05?"));
    }

    @Test
    void shouldResolveIsoDateRangeInclusively() {
        assertRange("2024-03-01", "2024-03-15", parser.detect("between 2024-03-01 to 2024-03-15"));
    }

    @Test
    void shouldResolveWrittenDate() {
        assertRange("2024-03-05", "2024-03-05", parser.detect("On March 5th, 2024 we met"));
    }

    @Test
    void shouldResolveMonthAndYear() {
        assertRange("2024-02-01", "2024-02-29", parser.detect("trips in February 2024"));
        assertRange("2023-11-01", "2023-11-30", parser.detect("2023-11"));
    }

    @Test
    void shouldResolveMonthRangeCrossingYearBoundary() {
        assertRange("2024-03-01", "2024-05-31", parser.detect("March to May 2024"));
        assertRange("2023-11-01", "2024-02-29", parser.detect("nov - feb 2024"));
    }

    @Test
    void shouldResolveSeasons() {
        assertRange("2023-06-01", "2023-08-31", parser.detect("summer of 2023"));
        assertRange("2023-12-01", "2024-02-29", parser.detect("winter 2023"));
    }

    @Test
    void shouldResolveYears() {
        assertRange("2021-01-01", "2021-12-31", parser.detect("What happened in 2021?"));
        assertRange("2023-01-01", "2023-12-31", parser.detect(" 2023 "));
        assertRange("2022-01-01", "2024-06-15", parser.detect("everything since 2022"));
    }

    // ===== Relative =====

    @Test
    void shouldResolveTodayAndYesterday() {
        assertRange("2024-06-15", "2024-06-15", parser.detect("today"));
        assertRange("2024-06-14", "2024-06-14", parser.detect("What did I do yesterday?"));
    }

    @Test
    void shouldResolveLastAndThisPeriods() {
        assertRange("2024-06-03", "2024-06-09", parser.detect("last week"));
        assertRange("2024-06-10", "2024-06-15", parser.detect("this week"));
        assertRange("2024-05-01", "2024-05-31", parser.detect("last month"));
        assertRange("2024-06-01", "2024-06-15", parser.detect("this month"));
        assertRange("2023-01-01", "2023-12-31", parser.detect("previous year"));
    }

    @Test
    void shouldResolveTrailingWindows() {
        assertRange("2024-06-12", "2024-06-15", parser.detect("in the last 3 days"));
        assertRange("2024-04-15", "2024-06-15", parser.detect("past 2 months"));
    }

    @Test
    void shouldResolveAgoExpressions() {
        assertRange("2024-06-12", "2024-06-12", parser.detect("3 days ago"));
        assertRange("2024-05-27", "2024-06-02", parser.detect("2 weeks ago"));
        assertRange("2023-01-01", "2023-12-31", parser.detect("a year ago"));
    }

    @Test
    void shouldResolveBareMonthToMostRecentOccurrence() {
        assertRange("2024-03-01", "2024-03-31", parser.detect("in March"));
        assertRange("2023-12-01", "2023-12-31", parser.detect("during december"));
    }

    // ===== No expression =====

    @Test
    void shouldReturnEmptyWithoutTimeExpression() {
        assertTrue(parser.detect("What does Alice like?").isEmpty());
        assertTrue(parser.detect("I have 2023 apples").isEmpty());
        assertTrue(parser.detect("").isEmpty());
        assertTrue(parser.detect(null).isEmpty());
    }

    @Test
    void shouldSkipInvalidCalendarValues() {
        assertTrue(parser.detect("2024-13-45").isEmpty());
    }

    @Test
    void shouldCompleteParseFutureImmediately() {
        Optional<DateRange> range = parser.parse("yesterday").join();

        assertRange("2024-06-14", "2024-06-14", range);
    }

    private static void assertRange(String firstDay, String lastDay, Optional<DateRange> actual) {
        assertTrue(actual.isPresent(), "expected a range");
        assertEquals(Instant.parse(firstDay + "T00:00:00Z"), actual.get().start());
        assertEquals(Instant.parse(lastDay + "T23:59:59.999Z"), actual.get().end());
    }
}

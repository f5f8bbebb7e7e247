package me.golemcore.hindsight.adapter.outbound.temporal;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.hindsight.domain.model.DateRange;
import me.golemcore.hindsight.port.outbound.TemporalParserPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects a time expression in free text and resolves it to a UTC date range
 * relative to the injected {@link Clock}.
 *
 * <p>
 * Supported forms, most specific first:
 * <ul>
 * <li>ISO date ranges ({@code 2024-03-01 to 2024-03-15}) and month ranges
 * ({@code March to May 2024})
 * <li>ISO dates and months, {@code March 5, 2024}, {@code summer 2023},
 * {@code June 2024}
 * <li>relative expressions: {@code today}, {@code yesterday},
 * {@code last week}, {@code this month}, {@code last 3 days},
 * {@code 2 weeks ago}, {@code in March}
 * <li>{@code since 2022}, {@code in 2023} and an expression that is only a
 * year
 * </ul>
 * Ranges are inclusive: a day ends at its last millisecond. Weeks start on
 * Monday; seasons follow the northern hemisphere.
 */
@Component
@Slf4j
public class RuleBasedTemporalParser implements TemporalParserPort {

    private static final String MONTH = "(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?"
            + "|aug(?:ust)?|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)";
    private static final String YEAR = "((?:19|20)\\d{2})";
    private static final String UNIT = "(days?|weeks?|months?|years?)";
    private static final String RANGE_JOIN = "\\s*(?:to|until|through|thru|-|–)\\s*";

    private static final Map<String, Month> MONTH_PREFIXES = Map.ofEntries(
            Map.entry("jan", Month.JANUARY), Map.entry("feb", Month.FEBRUARY), Map.entry("mar", Month.MARCH),
            Map.entry("apr", Month.APRIL), Map.entry("may", Month.MAY), Map.entry("jun", Month.JUNE),
            Map.entry("jul", Month.JULY), Map.entry("aug", Month.AUGUST), Map.entry("sep", Month.SEPTEMBER),
            Map.entry("oct", Month.OCTOBER), Map.entry("nov", Month.NOVEMBER), Map.entry("dec", Month.DECEMBER));

    private final Clock clock;
    private final List<Rule> rules;

    public RuleBasedTemporalParser(Clock clock) {
        this.clock = clock;
        this.rules = List.of(
                rule("(\\d{4}-\\d{2}-\\d{2})" + RANGE_JOIN + "(\\d{4}-\\d{2}-\\d{2})",
                        (m, today) -> days(LocalDate.parse(m.group(1)), LocalDate.parse(m.group(2)))),
                rule("\\b" + MONTH + RANGE_JOIN + MONTH + ",?\\s+" + YEAR + "\\b",
                        (m, today) -> monthRange(month(m.group(1)), month(m.group(2)), year(m.group(3)))),
                rule("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b",
                        (m, today) -> day(LocalDate.of(year(m.group(1)), Integer.parseInt(m.group(2)),
                                Integer.parseInt(m.group(3))))),
                rule("\\b(\\d{4})-(\\d{2})\\b",
                        (m, today) -> month(YearMonth.of(year(m.group(1)), Integer.parseInt(m.group(2))))),
                rule("\\b" + MONTH + "\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+" + YEAR + "\\b",
                        (m, today) -> day(LocalDate.of(year(m.group(3)), month(m.group(1)),
                                Integer.parseInt(m.group(2))))),
                rule("\\b(spring|summer|fall|autumn|winter)\\s+(?:of\\s+)?" + YEAR + "\\b",
                        (m, today) -> season(m.group(1), year(m.group(2)))),
                rule("\\b" + MONTH + ",?\\s+(?:of\\s+)?" + YEAR + "\\b",
                        (m, today) -> month(YearMonth.of(year(m.group(2)), month(m.group(1))))),
                rule("\\btoday\\b", (m, today) -> day(today)),
                rule("\\byesterday\\b", (m, today) -> day(today.minusDays(1))),
                rule("\\b(?:last|past|previous)\\s+(\\d{1,3})\\s+" + UNIT + "\\b",
                        (m, today) -> days(minus(today, Integer.parseInt(m.group(1)), m.group(2)), today)),
                rule("\\b(\\d{1,3}|a|an|one)\\s+" + UNIT + "\\s+ago\\b",
                        (m, today) -> ago(today, count(m.group(1)), m.group(2))),
                rule("\\b(last|this|past|previous)\\s+(week|month|year)\\b",
                        (m, today) -> period(today, m.group(2), !"this".equals(m.group(1)))),
                rule("\\b(?:in|during|last|this)\\s+" + MONTH + "\\b",
                        (m, today) -> month(latestMonth(today, month(m.group(1))))),
                rule("\\bsince\\s+" + YEAR + "\\b",
                        (m, today) -> days(LocalDate.of(year(m.group(1)), 1, 1), today)),
                rule("^\\s*" + YEAR + "\\s*$", (m, today) -> wholeYear(year(m.group(1)))),
                rule("\\b(?:in|during|from|of|year)\\s+" + YEAR + "\\b",
                        (m, today) -> wholeYear(year(m.group(1)))));
    }

    @Override
    public CompletableFuture<Optional<DateRange>> parse(String expression) {
        return CompletableFuture.completedFuture(detect(expression));
    }

    Optional<DateRange> detect(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        for (Rule rule : rules) {
            Matcher matcher = rule.pattern().matcher(lower);
            if (!matcher.find()) {
                continue;
            }
            try {
                DateRange range = rule.resolver().apply(matcher, today);
                log.trace("[Recall] Time expression '{}' resolved to {}", matcher.group(), range);
                return Optional.of(range);
            } catch (DateTimeException | IllegalArgumentException e) {
                log.debug("[Recall] Ignoring invalid time expression '{}': {}", matcher.group(), e.getMessage());
            }
        }
        return Optional.empty();
    }

    private static Rule rule(String regex, BiFunction<Matcher, LocalDate, DateRange> resolver) {
        return new Rule(Pattern.compile(regex), resolver);
    }

    private static DateRange day(LocalDate date) {
        return days(date, date);
    }

    private static DateRange days(LocalDate first, LocalDate last) {
        return new DateRange(first.atStartOfDay(ZoneOffset.UTC).toInstant(),
                last.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusMillis(1));
    }

    private static DateRange wholeYear(int year) {
        return days(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
    }

    private static DateRange month(YearMonth month) {
        return days(month.atDay(1), month.atEndOfMonth());
    }

    private static DateRange monthRange(Month first, Month last, int year) {
        int firstYear = first.compareTo(last) > 0 ? year - 1 : year;
        return days(YearMonth.of(firstYear, first).atDay(1), YearMonth.of(year, last).atEndOfMonth());
    }

    private static DateRange season(String season, int year) {
        return switch (season) {
        case "spring" -> days(LocalDate.of(year, 3, 1), LocalDate.of(year, 5, 31));
        case "summer" -> days(LocalDate.of(year, 6, 1), LocalDate.of(year, 8, 31));
        case "fall", "autumn" -> days(LocalDate.of(year, 9, 1), LocalDate.of(year, 11, 30));
        default -> days(LocalDate.of(year, 12, 1), YearMonth.of(year + 1, 2).atEndOfMonth());
        };
    }

    private static DateRange period(LocalDate today, String unit, boolean previous) {
        return switch (unit) {
        case "week" -> {
            LocalDate monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            yield previous ? days(monday.minusWeeks(1), monday.minusDays(1)) : days(monday, today);
        }
        case "month" -> previous ? month(YearMonth.from(today).minusMonths(1)) : days(today.withDayOfMonth(1), today);
        default -> previous
                ? days(LocalDate.of(today.getYear() - 1, 1, 1), LocalDate.of(today.getYear() - 1, 12, 31))
                : days(today.withDayOfYear(1), today);
        };
    }

    private static DateRange ago(LocalDate today, int count, String unit) {
        LocalDate anchor = minus(today, count, unit);
        return switch (chronoUnit(unit)) {
        case WEEKS -> days(anchor.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)),
                anchor.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY)));
        case MONTHS -> month(YearMonth.from(anchor));
        case YEARS -> days(anchor.withDayOfYear(1), LocalDate.of(anchor.getYear(), 12, 31));
        default -> day(anchor);
        };
    }

    private static LocalDate minus(LocalDate today, int count, String unit) {
        return today.minus(count, chronoUnit(unit));
    }

    private static ChronoUnit chronoUnit(String unit) {
        if (unit.startsWith("week")) {
            return ChronoUnit.WEEKS;
        }
        if (unit.startsWith("month")) {
            return ChronoUnit.MONTHS;
        }
        if (unit.startsWith("year")) {
            return ChronoUnit.YEARS;
        }
        return ChronoUnit.DAYS;
    }

    private static YearMonth latestMonth(LocalDate today, Month month) {
        YearMonth candidate = YearMonth.of(today.getYear(), month);
        return candidate.isAfter(YearMonth.from(today)) ? candidate.minusYears(1) : candidate;
    }

    private static int count(String raw) {
        return switch (raw) {
        case "a", "an", "one" -> 1;
        default -> Integer.parseInt(raw);
        };
    }

    private static int year(String raw) {
        return Integer.parseInt(raw);
    }

    private static Month month(String raw) {
        Month month = MONTH_PREFIXES.get(raw.substring(0, 3));
        if (month == null) {
            throw new IllegalArgumentException("Unknown month: " + raw);
        }
        return month;
    }

    private record Rule(Pattern pattern, BiFunction<Matcher, LocalDate, DateRange> resolver) {
    }
}

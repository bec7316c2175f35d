package com.dbkeeper.server.util;

import com.dbkeeper.server.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Locale;
import java.util.Map;

/**
 * Five field cron expressions: minute, hour, day-of-month, month, day-of-week.
 * <p>
 * Supports wildcards, lists, ranges {@code a-b} and stepped ranges such as
 * {@code a-b/n} or {@code a/n}. Months accept JAN-DEC and days of week accept SUN-SAT, where 0 and 7
 * are both Sunday. When day-of-month and day-of-week are both restricted a day
 * matches if either matches. A field that starts with {@code *} counts as
 * unrestricted.
 */
public class CronEvaluator {

    private static final int SEARCH_YEARS = 5;

    private static final Map<String, Integer> MONTH_NAMES = Map.ofEntries(
            Map.entry("JAN", 1), Map.entry("FEB", 2), Map.entry("MAR", 3),
            Map.entry("APR", 4), Map.entry("MAY", 5), Map.entry("JUN", 6),
            Map.entry("JUL", 7), Map.entry("AUG", 8), Map.entry("SEP", 9),
            Map.entry("OCT", 10), Map.entry("NOV", 11), Map.entry("DEC", 12));

    private static final Map<String, Integer> DAY_NAMES = Map.of(
            "SUN", 0, "MON", 1, "TUE", 2, "WED", 3, "THU", 4, "FRI", 5, "SAT", 6);

    /**
     * Earliest minute strictly after {@code after}, in the zone of {@code after}.
     *
     * @throws ValidationException the expression is malformed or never fires
     */
    public static ZonedDateTime nextFireTime(String cronExpression, ZonedDateTime after) throws ValidationException {
        if (after == null) {
            throw new ValidationException("nextFireTime failed. after is null");
        }
        return parse(cronExpression).next(after);
    }

    public static void validate(String cronExpression, ZoneId zoneId) throws ValidationException {
        nextFireTime(cronExpression, ZonedDateTime.now(zoneId));
    }

    public static boolean isValid(String cronExpression, ZoneId zoneId) {
        try {
            validate(cronExpression, zoneId);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    static CronSchedule parse(String cronExpression) throws ValidationException {
        if (StringUtils.isBlank(cronExpression)) {
            throw new ValidationException("parse cron failed. cronExpression is blank");
        }
        String[] fields = cronExpression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new ValidationException(
                    "parse cron failed. expected 5 fields but got %d. cronExpression is %s"
                            .formatted(fields.length, cronExpression));
        }
        try {
            return new CronSchedule(
                    parseField(fields[0], 0, 59, null),
                    parseField(fields[1], 0, 23, null),
                    parseField(fields[2], 1, 31, null),
                    parseField(fields[3], 1, 12, MONTH_NAMES),
                    normalizeDayOfWeek(parseField(fields[4], 0, 7, DAY_NAMES)),
                    !fields[2].startsWith("*"),
                    !fields[4].startsWith("*"));
        } catch (ValidationException e) {
            throw new ValidationException("parse cron failed. cronExpression is %s".formatted(cronExpression), e);
        }
    }

    private static BitSet parseField(
            String field,
            int min,
            int max,
            Map<String, Integer> names) throws ValidationException {
        BitSet result = new BitSet(max + 1);
        for (String part : field.split(",", -1)) {
            if (part.isEmpty()) {
                throw new ValidationException("empty list item in field %s".formatted(field));
            }
            String range = part;
            int step = 1;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = parseNumber(part.substring(slash + 1), null);
                if (step <= 0) {
                    throw new ValidationException("step must be positive. part is %s".formatted(part));
                }
            }
            int start;
            int end;
            if ("*".equals(range)) {
                start = min;
                end = max;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", -1);
                if (bounds.length != 2) {
                    throw new ValidationException("invalid range. part is %s".formatted(part));
                }
                start = parseNumber(bounds[0], names);
                end = parseNumber(bounds[1], names);
            } else {
                start = parseNumber(range, names);
                // "a/n" runs from a to the top of the field
                end = slash >= 0 ? max : start;
            }
            if (start < min || end > max) {
                throw new ValidationException(
                        "value out of range [%d, %d]. part is %s".formatted(min, max, part));
            }
            if (start > end) {
                throw new ValidationException("range start after end. part is %s".formatted(part));
            }
            for (int value = start; value <= end; value += step) {
                result.set(value);
            }
        }
        return result;
    }

    private static int parseNumber(String token, Map<String, Integer> names) throws ValidationException {
        if (names != null) {
            Integer named = names.get(token.toUpperCase(Locale.ROOT));
            if (named != null) {
                return named;
            }
        }
        if (!StringUtils.isNumeric(token)) {
            throw new ValidationException("not a number. token is %s".formatted(token));
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new ValidationException("not a number. token is %s".formatted(token), e);
        }
    }

    private static BitSet normalizeDayOfWeek(BitSet daysOfWeek) {
        if (daysOfWeek.get(7)) {
            daysOfWeek.clear(7);
            daysOfWeek.set(0);
        }
        return daysOfWeek;
    }

    static final class CronSchedule {

        private final BitSet minutes;

        private final BitSet hours;

        private final BitSet daysOfMonth;

        private final BitSet months;

        // 0 = Sunday
        private final BitSet daysOfWeek;

        private final boolean dayOfMonthRestricted;

        private final boolean dayOfWeekRestricted;

        CronSchedule(
                BitSet minutes,
                BitSet hours,
                BitSet daysOfMonth,
                BitSet months,
                BitSet daysOfWeek,
                boolean dayOfMonthRestricted,
                boolean dayOfWeekRestricted) {
            this.minutes = minutes;
            this.hours = hours;
            this.daysOfMonth = daysOfMonth;
            this.months = months;
            this.daysOfWeek = daysOfWeek;
            this.dayOfMonthRestricted = dayOfMonthRestricted;
            this.dayOfWeekRestricted = dayOfWeekRestricted;
        }

        ZonedDateTime next(ZonedDateTime after) throws ValidationException {
            ZoneId zone = after.getZone();
            ZonedDateTime limit = after.plusYears(SEARCH_YEARS);
            ZonedDateTime candidate = after.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
            while (candidate.isBefore(limit)) {
                LocalDate date = candidate.toLocalDate();
                if (!this.months.get(candidate.getMonthValue())) {
                    candidate = ZonedDateTime.of(date.withDayOfMonth(1).plusMonths(1), LocalTime.MIDNIGHT, zone);
                    continue;
                }
                if (!this.matchesDay(date)) {
                    candidate = ZonedDateTime.of(date.plusDays(1), LocalTime.MIDNIGHT, zone);
                    continue;
                }
                if (!this.hours.get(candidate.getHour())) {
                    candidate = candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                    continue;
                }
                if (!this.minutes.get(candidate.getMinute())) {
                    candidate = candidate.plusMinutes(1);
                    continue;
                }
                return candidate;
            }
            throw new ValidationException(
                    "cron never fires within %d years after %s".formatted(SEARCH_YEARS, after));
        }

        private boolean matchesDay(LocalDate date) {
            boolean domMatches = this.daysOfMonth.get(date.getDayOfMonth());
            boolean dowMatches = this.daysOfWeek.get(date.getDayOfWeek().getValue() % 7);
            if (this.dayOfMonthRestricted && this.dayOfWeekRestricted) {
                return domMatches || dowMatches;
            }
            if (this.dayOfMonthRestricted) {
                return domMatches;
            }
            if (this.dayOfWeekRestricted) {
                return dowMatches;
            }
            return true;
        }
    }
}

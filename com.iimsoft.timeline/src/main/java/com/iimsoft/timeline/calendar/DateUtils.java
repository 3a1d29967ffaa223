package com.iimsoft.timeline.calendar;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naive wall-clock date arithmetic for the chart.
 *
 * All values are {@link LocalDateTime}: no zone, no DST. Month indexes follow the ISO numbering
 * (1..12) at the API surface.
 */
public final class DateUtils {

    public static final String DEFAULT_FORMAT = "YYYY-MM-DD HH:mm:ss.SSS";

    private static final Pattern TIME_SEPARATOR = Pattern.compile("[.:]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Format tokens, longest first. */
    private static final String[] TOKENS = {"YYYY", "MMMM", "SSS", "MMM", "MM", "DD", "HH", "mm", "ss", "D"};

    private DateUtils() {
    }

    /**
     * 解析 "YYYY-MM-DD[ HH[:mm[:ss[.SSS]]]]"。
     *
     * @return null for null/blank input
     * @throws IllegalArgumentException if the text is malformed or a field is out of range
     */
    public static LocalDateTime parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String[] parts = WHITESPACE.split(text.trim(), 2);
        String[] dateParts = parts[0].split("-");
        if (dateParts.length < 2 || dateParts.length > 3) {
            throw new IllegalArgumentException("Malformed date: " + text);
        }
        try {
            int year = Integer.parseInt(dateParts[0]);
            int month = Integer.parseInt(dateParts[1]);
            int day = dateParts.length == 3 ? Integer.parseInt(dateParts[2]) : 1;

            int hour = 0;
            int minute = 0;
            int second = 0;
            int millis = 0;
            if (parts.length > 1) {
                String[] timeParts = TIME_SEPARATOR.split(parts[1]);
                if (timeParts.length > 4) {
                    throw new IllegalArgumentException("Malformed time: " + text);
                }
                hour = Integer.parseInt(timeParts[0]);
                if (timeParts.length > 1) minute = Integer.parseInt(timeParts[1]);
                if (timeParts.length > 2) second = Integer.parseInt(timeParts[2]);
                if (timeParts.length == 4) {
                    // fraction of a second, "5" means 500 ms
                    millis = (int) Math.round(Double.parseDouble("0." + timeParts[3]) * 1000);
                }
            }
            return LocalDateTime.of(year, month, day, hour, minute, second)
                    .plus(millis, ChronoUnit.MILLIS);
        } catch (NumberFormatException | DateTimeException e) {
            throw new IllegalArgumentException("Malformed date: " + text, e);
        }
    }

    public static LocalDateTime parse(LocalDateTime date) {
        return date;
    }

    public static String toString(LocalDateTime date, boolean withTime) {
        if (date == null) {
            throw new IllegalArgumentException("date must not be null");
        }
        String dateString = String.format("%04d-%02d-%02d",
                date.getYear(), date.getMonthValue(), date.getDayOfMonth());
        if (!withTime) {
            return dateString;
        }
        return dateString + String.format(" %02d:%02d:%02d.%03d",
                date.getHour(), date.getMinute(), date.getSecond(), date.getNano() / 1_000_000);
    }

    public static String format(LocalDateTime date) {
        return format(date, DEFAULT_FORMAT, MonthNames.DEFAULT_LANGUAGE);
    }

    public static String format(LocalDateTime date, String pattern) {
        return format(date, pattern, MonthNames.DEFAULT_LANGUAGE);
    }

    /**
     * Token based formatting. Each token is replaced at its first occurrence only,
     * {@code D} is the zero-padded day and {@code MMM} yields the full month name.
     */
    public static String format(LocalDateTime date, String pattern, String language) {
        Map<String, String> values = new LinkedHashMap<>();
        String monthName = MonthNames.get(language, date.getMonthValue());
        values.put("YYYY", pad(date.getYear(), 4));
        values.put("MMMM", monthName);
        values.put("SSS", pad(date.getNano() / 1_000_000, 3));
        values.put("MMM", monthName);
        values.put("MM", pad(date.getMonthValue(), 2));
        values.put("DD", pad(date.getDayOfMonth(), 2));
        values.put("HH", pad(date.getHour(), 2));
        values.put("mm", pad(date.getMinute(), 2));
        values.put("ss", pad(date.getSecond(), 2));
        values.put("D", pad(date.getDayOfMonth(), 2));

        // placeholders first so a replaced value is never matched by a shorter token
        String str = pattern;
        List<String> formatted = new ArrayList<>();
        for (String token : TOKENS) {
            if (str.contains(token)) {
                str = str.replaceFirst(Pattern.quote(token), Matcher.quoteReplacement("$" + formatted.size()));
                formatted.add(values.get(token));
            }
        }
        for (int i = 0; i < formatted.size(); i++) {
            str = str.replaceFirst(Pattern.quote("$" + i), Matcher.quoteReplacement(formatted.get(i)));
        }
        return str;
    }

    /**
     * Whole units elapsed from {@code b} to {@code a}, floored (negative spans floor away from zero).
     */
    public static long diff(LocalDateTime a, LocalDateTime b, DateUnit unit) {
        long millis = Duration.between(b, a).toMillis();
        return Math.floorDiv(millis, unit.getMillis());
    }

    /**
     * Component-wise add. Year and month additions roll the day-of-month over into the next
     * month instead of clamping it (31 Jan + 1 month is 2 or 3 Mar).
     */
    public static LocalDateTime add(LocalDateTime date, long qty, DateUnit unit) {
        switch (unit) {
            case YEAR:
                return rollOver(date.getYear() + qty, date.getMonthValue() - 1, date);
            case MONTH:
                return rollOver(date.getYear(), date.getMonthValue() - 1 + qty, date);
            case DAY:
                return date.plusDays(qty);
            case HOUR:
                return date.plusHours(qty);
            case MINUTE:
                return date.plusMinutes(qty);
            case SECOND:
                return date.plusSeconds(qty);
            case MILLISECOND:
            default:
                return date.plus(qty, ChronoUnit.MILLIS);
        }
    }

    private static LocalDateTime rollOver(long year, long monthIndex, LocalDateTime date) {
        LocalDate day = LocalDate.of(Math.toIntExact(year), 1, 1)
                .plusMonths(monthIndex)
                .plusDays(date.getDayOfMonth() - 1L);
        return day.atTime(date.toLocalTime());
    }

    /**
     * Resets every component finer than {@code unit}.
     */
    public static LocalDateTime startOf(LocalDateTime date, DateUnit unit) {
        int rank = unit.ordinal();
        int month = rank >= DateUnit.YEAR.ordinal() ? 1 : date.getMonthValue();
        int day = rank >= DateUnit.MONTH.ordinal() ? 1 : date.getDayOfMonth();
        int hour = rank >= DateUnit.DAY.ordinal() ? 0 : date.getHour();
        int minute = rank >= DateUnit.HOUR.ordinal() ? 0 : date.getMinute();
        int second = rank >= DateUnit.MINUTE.ordinal() ? 0 : date.getSecond();
        int nanos = rank >= DateUnit.SECOND.ordinal() ? 0 : (date.getNano() / 1_000_000) * 1_000_000;
        return LocalDateTime.of(LocalDate.of(date.getYear(), month, day), LocalTime.of(hour, minute, second, nanos));
    }

    public static int daysInMonth(LocalDateTime date) {
        int month = date.getMonthValue();
        if (month != 2) {
            return new int[]{31, 28, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31}[month - 1];
        }
        int year = date.getYear();
        if ((year % 4 == 0 && year % 100 != 0) || year % 400 == 0) {
            return 29;
        }
        return 28;
    }

    public static LocalDateTime today(Clock clock) {
        return LocalDate.now(clock).atStartOfDay();
    }

    /** True when hour, minute, second and millisecond are all zero. */
    public static boolean isMidnight(LocalDateTime date) {
        return date.toLocalTime().equals(LocalTime.MIDNIGHT);
    }

    private static String pad(int value, int length) {
        String s = Integer.toString(value);
        StringBuilder sb = new StringBuilder();
        for (int i = s.length(); i < length; i++) {
            sb.append('0');
        }
        return sb.append(s).toString();
    }
}

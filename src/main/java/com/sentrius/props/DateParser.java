package com.sentrius.props;

import java.time.*;
import java.time.format.*;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Parses stored values into {@link ZonedDateTime}s and checks values against
 * PHP-style date formats such as {@code Y-m-d}.
 * Values without an offset or zone are placed in this parser's zone.
 */
public class DateParser {
    private static final List<DateTimeFormatter> LOCAL_DATE_TIME_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss"),
        DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm")
    );

    private final ZoneId zone;
    private final List<Function<String, ZonedDateTime>> textShapes;

    public DateParser() {
        this(ZoneOffset.UTC);
    }

    public DateParser(ZoneId zone) {
        if (zone == null) {
            throw new IllegalArgumentException("Zone cannot be null");
        }
        this.zone = zone;
        this.textShapes = List.of(
            text -> ZonedDateTime.parse(text, DateTimeFormatter.ISO_ZONED_DATE_TIME),
            text -> Instant.parse(text).atZone(zone),
            text -> ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME),
            text -> LocalDateTime.parse(text, LOCAL_DATE_TIME_FORMATS.get(0)).atZone(zone),
            text -> LocalDateTime.parse(text, LOCAL_DATE_TIME_FORMATS.get(1)).atZone(zone),
            text -> LocalDateTime.parse(text, LOCAL_DATE_TIME_FORMATS.get(2)).atZone(zone),
            text -> LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay(zone)
        );
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * Parse a value as a date.
     * @param value A date string or a java.time value
     * @return The parsed date
     * @throws DateTimeParseException if the value is not a recognizable date
     */
    public ZonedDateTime parse(Object value) {
        if (value == null) {
            throw new DateTimeParseException("Cannot parse null as a date", "", 0);
        }
        if (value instanceof ZonedDateTime) {
            return (ZonedDateTime) value;
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toZonedDateTime();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atZone(zone);
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay(zone);
        }
        if (value instanceof Instant) {
            return ((Instant) value).atZone(zone);
        }
        if (value instanceof Date) {
            return ((Date) value).toInstant().atZone(zone);
        }
        if (!(value instanceof CharSequence)) {
            String text = value.toString();
            throw new DateTimeParseException("Cannot parse " + value.getClass().getSimpleName() + " as a date", text, 0);
        }

        String text = value.toString().trim();
        DateTimeParseException failure = null;
        for (Function<String, ZonedDateTime> shape : textShapes) {
            try {
                return shape.apply(text);
            } catch (DateTimeParseException e) {
                failure = e;
            }
        }

        throw new DateTimeParseException("Text '" + text + "' could not be parsed as a date", text, 0, failure);
    }

    public boolean isParseable(Object value) {
        try {
            parse(value);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    /**
     * Check that a string parses with the given format and that formatting the
     * parsed date again reproduces the string exactly.
     * @param value The candidate value
     * @param format A PHP-style format, e.g. {@code Y-m-d H:i:s}
     */
    public boolean matchesFormat(Object value, String format) {
        if (!(value instanceof CharSequence)) {
            return false;
        }

        String text = value.toString();
        DateTimeFormatter formatter = translateFormat(format);
        try {
            TemporalAccessor parsed = formatter.parse(text);
            return formatter.format(parsed).equals(text);
        } catch (DateTimeException e) {
            return false;
        }
    }

    /**
     * Translate a PHP-style date format into a strict {@link DateTimeFormatter}.
     * @throws IllegalArgumentException if the format uses an unsupported letter
     */
    public static DateTimeFormatter translateFormat(String format) {
        if (format == null) {
            throw new IllegalArgumentException("Date format cannot be null");
        }

        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder();
        for (int i = 0; i < format.length(); i++) {
            char c = format.charAt(i);
            switch (c) {
                case 'Y':
                    builder.appendValue(ChronoField.YEAR, 4, 10, SignStyle.EXCEEDS_PAD);
                    break;
                case 'y':
                    builder.appendValueReduced(ChronoField.YEAR, 2, 2, 2000);
                    break;
                case 'm':
                    builder.appendValue(ChronoField.MONTH_OF_YEAR, 2);
                    break;
                case 'n':
                    builder.appendValue(ChronoField.MONTH_OF_YEAR);
                    break;
                case 'd':
                    builder.appendValue(ChronoField.DAY_OF_MONTH, 2);
                    break;
                case 'j':
                    builder.appendValue(ChronoField.DAY_OF_MONTH);
                    break;
                case 'H':
                    builder.appendValue(ChronoField.HOUR_OF_DAY, 2);
                    break;
                case 'G':
                    builder.appendValue(ChronoField.HOUR_OF_DAY);
                    break;
                case 'h':
                    builder.appendValue(ChronoField.CLOCK_HOUR_OF_AMPM, 2);
                    break;
                case 'g':
                    builder.appendValue(ChronoField.CLOCK_HOUR_OF_AMPM);
                    break;
                case 'i':
                    builder.appendValue(ChronoField.MINUTE_OF_HOUR, 2);
                    break;
                case 's':
                    builder.appendValue(ChronoField.SECOND_OF_MINUTE, 2);
                    break;
                case 'A':
                    builder.appendText(ChronoField.AMPM_OF_DAY, Map.of(0L, "AM", 1L, "PM"));
                    break;
                case 'a':
                    builder.appendText(ChronoField.AMPM_OF_DAY, Map.of(0L, "am", 1L, "pm"));
                    break;
                case 'D':
                    builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.SHORT);
                    break;
                case 'l':
                    builder.appendText(ChronoField.DAY_OF_WEEK, TextStyle.FULL);
                    break;
                case 'M':
                    builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.SHORT);
                    break;
                case 'F':
                    builder.appendText(ChronoField.MONTH_OF_YEAR, TextStyle.FULL);
                    break;
                case '\\':
                    if (i + 1 < format.length()) {
                        builder.appendLiteral(format.charAt(++i));
                    }
                    break;
                default:
                    if (Character.isLetter(c)) {
                        throw new IllegalArgumentException("Unsupported date format character '" + c + "' in " + format);
                    }
                    builder.appendLiteral(c);
            }
        }

        return builder.toFormatter(Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }
}

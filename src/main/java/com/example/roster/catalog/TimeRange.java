package com.example.roster.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed shift window such as {@code "06:00 - 15:00"}.
 * An end that is not after the start means the shift finishes on the following day.
 */
public record TimeRange(LocalTime start, LocalTime end) {

    private static final Logger logger = LoggerFactory.getLogger(TimeRange.class);
    private static final Pattern RANGE = Pattern.compile("^\\s*(\\d{1,2}:\\d{2})\\s*-\\s*(\\d{1,2}:\\d{2})\\s*$");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("H:mm");
    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("HH:mm");
    private static final int MINUTES_PER_DAY = 24 * 60;

    /**
     * Returns empty for "TBD", blanks or anything that is not two clock times.
     */
    public static Optional<TimeRange> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher m = RANGE.matcher(text);
        if (!m.matches()) {
            logger.debug("Unparsable shift time '{}'", text);
            return Optional.empty();
        }
        try {
            return Optional.of(new TimeRange(LocalTime.parse(m.group(1), TIME), LocalTime.parse(m.group(2), TIME)));
        } catch (DateTimeParseException e) {
            logger.debug("Unparsable shift time '{}': {}", text, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean endsNextDay() {
        return !end.isAfter(start);
    }

    public LocalDateTime startOn(LocalDate date) {
        return date.atTime(start);
    }

    public LocalDateTime endOn(LocalDate date) {
        return endsNextDay() ? date.plusDays(1).atTime(end) : date.atTime(end);
    }

    /**
     * Whether this window shares at least one minute with {@code [from, to)} on the same calendar day.
     */
    public boolean overlaps(LocalTime from, LocalTime to) {
        int s = toMinutes(start);
        int e = endsNextDay() ? MINUTES_PER_DAY : toMinutes(end);
        int ps = toMinutes(from);
        int pe = to.isAfter(from) ? toMinutes(to) : MINUTES_PER_DAY;
        if (s < pe && ps < e) {
            return true;
        }
        // overnight tail after midnight
        return endsNextDay() && ps < toMinutes(end);
    }

    public String format() {
        return DISPLAY.format(start) + " - " + DISPLAY.format(end);
    }

    private static int toMinutes(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }
}

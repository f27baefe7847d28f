package com.example.parkmaster.Utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses wall-clock times such as "17:00", "8:30", "08:30 AM" or "5:15pm".
 */
public final class TimeOfDayParser {

    public static final LocalTime FALLBACK_TIME = LocalTime.of(8, 0);

    private static final Logger logger = LoggerFactory.getLogger(TimeOfDayParser.class);
    private static final Pattern TIME_PATTERN =
            Pattern.compile("(\\d{1,2}):(\\d{2})\\s*(AM|PM)?", Pattern.CASE_INSENSITIVE);

    private TimeOfDayParser() {
    }

    /**
     * Returns {@link #FALLBACK_TIME} when the value cannot be read as a time of day.
     * The fallback changes the resulting reservation, so it is logged.
     */
    // TODO: reject unparseable times once clients stop relying on the 08:00 default
    public static LocalTime parse(String value) {
        if (value == null) {
            return fallback(value);
        }
        Matcher matcher = TIME_PATTERN.matcher(value);
        if (!matcher.find()) {
            return fallback(value);
        }

        int hours = Integer.parseInt(matcher.group(1));
        int minutes = Integer.parseInt(matcher.group(2));
        String meridiem = matcher.group(3) != null ? matcher.group(3).toUpperCase(Locale.ROOT) : null;

        if ("PM".equals(meridiem) && hours < 12) {
            hours += 12;
        }
        if ("AM".equals(meridiem) && hours == 12) {
            hours = 0;
        }

        if (hours > 23 || minutes > 59) {
            return fallback(value);
        }
        return LocalTime.of(hours, minutes);
    }

    private static LocalTime fallback(String value) {
        logger.warn("Could not parse time of day '{}'. Falling back to {}.", value, FALLBACK_TIME);
        return FALLBACK_TIME;
    }
}

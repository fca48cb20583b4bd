package com.sqlpush.rewrite;

import com.sqlpush.exception.TranslationException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Weekday name tables used by the week arithmetic rewrites.
 *
 * <p>Two numberings are supported:
 * <ul>
 *   <li>{@link #offsetOf(String)}: distance of a week start day from the epoch
 *       day 1970-01-01, which is a Thursday (offset 0)</li>
 *   <li>{@link #dayOfWeekNumber(String)}: the remote DAYOFWEEK numbering,
 *       Sunday = 1 through Saturday = 7</li>
 * </ul>
 */
public final class WeekdayOffsets {

    private static final Map<String, Integer> EPOCH_OFFSETS = new HashMap<>();
    private static final Map<String, Integer> DAY_OF_WEEK_NUMBERS = new HashMap<>();

    static {
        registerOffset(0, "TH", "THU", "THURSDAY");
        registerOffset(1, "WE", "WED", "WEDNESDAY");
        registerOffset(2, "TU", "TUE", "TUESDAY");
        registerOffset(3, "MO", "MON", "MONDAY");
        registerOffset(4, "SU", "SUN", "SUNDAY");
        registerOffset(5, "SA", "SAT", "SATURDAY");
        registerOffset(6, "FR", "FRI", "FRIDAY");

        String[] days = {"sunday", "monday", "tuesday", "wednesday", "thursday", "friday", "saturday"};
        for (int i = 0; i < days.length; i++) {
            String day = days[i];
            DAY_OF_WEEK_NUMBERS.put(day, i + 1);
            DAY_OF_WEEK_NUMBERS.put(day.substring(0, 2), i + 1);
            DAY_OF_WEEK_NUMBERS.put(day.substring(0, 3), i + 1);
        }
    }

    private WeekdayOffsets() {
    }

    private static void registerOffset(int offset, String... spellings) {
        for (String spelling : spellings) {
            EPOCH_OFFSETS.put(spelling, offset);
        }
    }

    /**
     * Returns the offset of a week start day from the epoch Thursday.
     *
     * @param day two-letter, three-letter or full day name, any case
     * @return offset in 0..6
     * @throws TranslationException if the name is not a weekday
     */
    public static int offsetOf(String day) {
        Integer offset = day == null ? null : EPOCH_OFFSETS.get(day.trim().toUpperCase(Locale.ROOT));
        if (offset == null) {
            throw new TranslationException("Illegal input for day of week: " + day);
        }
        return offset;
    }

    /**
     * Returns the remote DAYOFWEEK number of a day name.
     *
     * @param day two-letter, three-letter or full day name, any case
     * @return 1 (Sunday) to 7 (Saturday), or empty for an unknown name
     */
    public static OptionalInt dayOfWeekNumber(String day) {
        if (day == null) {
            return OptionalInt.empty();
        }
        Integer number = DAY_OF_WEEK_NUMBERS.get(day.trim().toLowerCase(Locale.ROOT));
        return number == null ? OptionalInt.empty() : OptionalInt.of(number);
    }
}

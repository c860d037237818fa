package com.example.sniper.service.util;

import com.example.sniper.model.Watch;
import com.example.sniper.service.exception.InvalidWatchException;

import java.util.regex.Pattern;

public final class WatchRules {

    private static final Pattern HH_MM = Pattern.compile("([01]\\d|2[0-3]):[0-5]\\d");

    private WatchRules() {
    }

    public static void validate(Watch watch) {
        if (watch.getVenueId() == null || watch.getVenueId().isBlank()) {
            throw new InvalidWatchException("venue id is required");
        }
        if (watch.getPartySize() == null || watch.getPartySize() < 1) {
            throw new InvalidWatchException("party size must be positive");
        }
        if (watch.getDateStart() == null) {
            throw new InvalidWatchException("start date is required");
        }
        if (watch.getDateStart().isAfter(watch.effectiveDateEnd())) {
            throw new InvalidWatchException(
                    "date range is reversed: " + watch.getDateStart() + " > " + watch.getDateEnd());
        }
        requireTime("earliest time", watch.getTimeEarliest());
        requireTime("latest time", watch.getTimeLatest());
    }

    /**
     * Both bounds are inclusive; a missing bound leaves that side open.
     * Times compare as HH:MM strings.
     */
    public static boolean withinWindow(String timeOfDay, String earliest, String latest) {
        if (isSet(earliest) && timeOfDay.compareTo(earliest) < 0) {
            return false;
        }
        return !(isSet(latest) && timeOfDay.compareTo(latest) > 0);
    }

    public static boolean isValidTime(String value) {
        return value != null && HH_MM.matcher(value).matches();
    }

    private static void requireTime(String label, String value) {
        if (isSet(value) && !isValidTime(value)) {
            throw new InvalidWatchException(label + " must be HH:MM, got '" + value + "'");
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}

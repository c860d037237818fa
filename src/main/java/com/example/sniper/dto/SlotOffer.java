package com.example.sniper.dto;

/**
 * An open slot as returned by a venue/day lookup.
 *
 * @param start       raw start timestamp, e.g. "2024-06-01 19:00:00"
 * @param configToken opaque token needed to ask for booking details; may be blank
 * @param type        seating type ("Dining Room", "Bar", ...); may be null
 */
public record SlotOffer(String start, String configToken, String type) {

    /** HH:MM part of the start timestamp, or an empty string when there is no start. */
    public String timeOfDay() {
        if (start == null || start.isBlank()) {
            return "";
        }
        String trimmed = start.trim();
        int space = trimmed.lastIndexOf(' ');
        String timePart = space >= 0 ? trimmed.substring(space + 1) : trimmed;
        return timePart.length() > 5 ? timePart.substring(0, 5) : timePart;
    }

    public boolean hasConfigToken() {
        return configToken != null && !configToken.isBlank();
    }
}

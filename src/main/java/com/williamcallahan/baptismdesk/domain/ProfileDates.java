package com.williamcallahan.baptismdesk.domain;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Lenient ISO-8601 date parsing shared by extraction results, manual edits and layout overrides.
 */
public final class ProfileDates {

    private ProfileDates() {}

    /**
     * Parses {@code yyyy-MM-dd} text, discarding anything unparsable.
     *
     * @param isoText candidate date text, may be null
     * @return parsed date, or null when the text is absent or invalid
     */
    public static LocalDate parseOrNull(String isoText) {
        if (isoText == null || isoText.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(isoText.trim());
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }
}

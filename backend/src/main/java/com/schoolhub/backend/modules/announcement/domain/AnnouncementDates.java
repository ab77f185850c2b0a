package com.schoolhub.backend.modules.announcement.domain;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import org.springframework.util.StringUtils;

public final class AnnouncementDates {

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private AnnouncementDates() {
    }

    public static boolean isValid(String value) {
        if (value == null || value.length() != 10) {
            return false;
        }
        try {
            LocalDate.parse(value, ISO_DATE);
            return true;
        } catch (DateTimeParseException ex) {
            return false;
        }
    }

    /**
     * Blank optional dates count as not supplied.
     */
    public static String normalizeOptional(String value) {
        return StringUtils.hasText(value) ? value : null;
    }

    public static String today(Clock clock) {
        return LocalDate.now(clock).format(ISO_DATE);
    }
}

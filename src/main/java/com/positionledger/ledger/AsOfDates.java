package com.positionledger.ledger;

import com.positionledger.domain.model.PositionSnapshot;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/** Parses the snapshot {@code as_of_date} column into a calendar date. */
public final class AsOfDates {

    private static final int ISO_DATE_LENGTH = 10;

    private AsOfDates() {}

    /**
     * Date of a snapshot row. A null row has no date, so every stage skips it exactly like a
     * row with a missing or unparseable {@code as_of_date}.
     */
    public static Optional<LocalDate> dateOf(PositionSnapshot snapshot) {
        return snapshot == null ? Optional.empty() : parse(snapshot.getAsOfDate());
    }

    /**
     * Parses the leading {@code YYYY-MM-DD} of {@code raw}; any time-of-day suffix is dropped.
     * Returns empty for null, blank or unparseable input.
     */
    public static Optional<LocalDate> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim();
        String datePart = trimmed.length() > ISO_DATE_LENGTH ? trimmed.substring(0, ISO_DATE_LENGTH) : trimmed;
        try {
            return Optional.of(LocalDate.parse(datePart));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}

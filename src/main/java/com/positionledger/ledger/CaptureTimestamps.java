package com.positionledger.ledger;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Parses snapshot {@code captured_at} values. The sync writes ISO-8601 with an offset; older
 * rows carry a naive local timestamp, which is read as UTC. A space separator is accepted.
 */
public final class CaptureTimestamps {

    private CaptureTimestamps() {}

    public static Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().replace(' ', 'T');
        try {
            return Optional.of(OffsetDateTime.parse(normalized).toInstant());
        } catch (DateTimeParseException withOffset) {
            try {
                return Optional.of(LocalDateTime.parse(normalized).toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException naive) {
                return Optional.empty();
            }
        }
    }
}

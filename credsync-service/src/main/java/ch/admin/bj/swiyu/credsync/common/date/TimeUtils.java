/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.common.date;

import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static java.util.Objects.isNull;

@UtilityClass
public class TimeUtils {

    private static final DateTimeFormatter ISO_MILLIS_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    /**
     * Renders the instant in UTC with exactly three fraction digits, e.g. 2025-01-09T10:15:30.123Z.
     * This is the representation the credential hash is computed over.
     */
    public static String instantToIsoMillis(Instant instant) {
        if (isNull(instant)) {
            return null;
        }
        return ISO_MILLIS_FORMATTER.format(instant.truncatedTo(ChronoUnit.MILLIS));
    }

    /**
     * Parses an instant rendered by {@link #instantToIsoMillis(Instant)}. Other renderings of the
     * same instant are rejected since they would hash differently.
     */
    public static Optional<Instant> parseIsoMillis(String value) {
        return parseIso8601(value)
                .filter(instant -> instantToIsoMillis(instant).equals(value));
    }

    /**
     * Lenient ISO-8601 parsing accepting any offset, e.g. 2025-01-09T11:15:30+01:00.
     */
    public static Optional<Instant> parseIso8601(String value) {
        if (isNull(value) || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(value.trim()).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}

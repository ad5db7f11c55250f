// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.microsoft.azure.kusto.core.data.exceptions.KustoParseException;

/**
 * Conversions between the service's datetime and timespan literals and java.time values.
 */
public class TimeUtils {
    private static final DateTimeFormatter kustoDateTimeFormatter = new DateTimeFormatterBuilder().parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME).appendLiteral('Z').toFormatter();

    // [-][d.]hh:mm:ss[.fffffff]
    private static final Pattern KUSTO_TIMESPAN_REGEX = Pattern.compile("(-?)(?:(\\d+)(\\.))?(?:([0-2]?\\d)(:))?([0-5]?\\d)(:)([0-5]?\\d)(?:(\\.)(\\d+))?",
            Pattern.CASE_INSENSITIVE);
    private static final int NANO_DIGITS = 9;

    private TimeUtils() {
        // Hide constructor, as this is a static utility class
    }

    public static Instant parseDateTime(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }

        try {
            return LocalDateTime.parse(value, kustoDateTimeFormatter).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
            } catch (DateTimeParseException inner) {
                throw new KustoParseException(String.format("Failed to parse datetime value '%s'", value), inner);
            }
        }
    }

    public static Duration parseTimespan(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }

        Matcher matcher = KUSTO_TIMESPAN_REGEX.matcher(value.trim());
        if (!matcher.matches()) {
            throw new KustoParseException(String.format("Failed to parse timespan value '%s'", value));
        }

        long days = matcher.group(2) == null ? 0 : Long.parseLong(matcher.group(2));
        long hours = matcher.group(4) == null ? 0 : Long.parseLong(matcher.group(4));
        long minutes = Long.parseLong(matcher.group(6));
        long seconds = Long.parseLong(matcher.group(8));
        long nanos = 0;
        if (matcher.group(10) != null) {
            String fraction = StringUtils.left(StringUtils.rightPad(matcher.group(10), NANO_DIGITS, '0'), NANO_DIGITS);
            nanos = Long.parseLong(fraction);
        }

        Duration duration = Duration.ofDays(days).plusHours(hours).plusMinutes(minutes).plusSeconds(seconds).plusNanos(nanos);
        return "-".equals(matcher.group(1)) ? duration.negated() : duration;
    }

    public static String formatDurationAsTimespan(Duration duration) {
        boolean negative = duration.isNegative();
        Duration abs = duration.abs();
        long durationInSeconds = abs.getSeconds();
        long days = TimeUnit.SECONDS.toDays(durationInSeconds);
        long hours = TimeUnit.SECONDS.toHours(durationInSeconds) % TimeUnit.DAYS.toHours(1);
        long minutes = TimeUnit.SECONDS.toMinutes(durationInSeconds) % TimeUnit.HOURS.toMinutes(1);
        long seconds = durationInSeconds % TimeUnit.MINUTES.toSeconds(1);
        int nanos = abs.getNano();

        StringBuilder sb = new StringBuilder();
        if (negative) {
            sb.append('-');
        }
        if (days > 0) {
            sb.append(days).append('.');
        }
        sb.append(String.format("%02d:%02d:%02d", hours, minutes, seconds));
        if (nanos > 0) {
            // the service keeps 100ns ticks
            sb.append('.').append(String.format("%07d", nanos / 100));
        }
        return sb.toString();
    }
}

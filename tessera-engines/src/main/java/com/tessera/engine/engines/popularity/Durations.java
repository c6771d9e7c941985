/*
 * Copyright (c) 2025 Tessera Engine Host
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.engine.engines.popularity;

import com.tessera.engine.api.exceptions.ValidationException;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses window lengths written either as {@code "<n> <unit>"} (days, hours,
 * minutes, seconds; singular or plural) or as ISO-8601 ({@code P30D}, {@code PT12H}).
 */
final class Durations {

    private static final Pattern HUMAN = Pattern.compile("(\\d+)\\s*([a-zA-Z]+)");

    private Durations() {
        // utility class
    }

    static Duration parse(String field, String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException(field, "'" + field + "' must not be empty");
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
            try {
                return positive(field, Duration.parse(trimmed.toUpperCase(Locale.ROOT)));
            } catch (DateTimeParseException e) {
                throw new ValidationException(field, "Cannot parse '" + field + "' value '" + text + "'");
            }
        }
        Matcher m = HUMAN.matcher(trimmed);
        if (!m.matches()) {
            throw new ValidationException(field, "Cannot parse '" + field + "' value '" + text
                    + "', expected e.g. \"30 days\" or \"PT12H\"");
        }
        String unit = m.group(2).toLowerCase(Locale.ROOT);
        try {
            long amount = Long.parseLong(m.group(1));
            Duration duration = switch (unit) {
                case "day", "days", "d" -> Duration.ofDays(amount);
                case "hour", "hours", "h" -> Duration.ofHours(amount);
                case "minute", "minutes", "min", "m" -> Duration.ofMinutes(amount);
                case "second", "seconds", "sec", "s" -> Duration.ofSeconds(amount);
                default -> throw new ValidationException(field, "Unknown time unit '" + m.group(2) + "' in '" + field + "'");
            };
            return positive(field, duration);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ValidationException(field, "'" + field + "' value '" + text + "' is out of range");
        }
    }

    private static Duration positive(String field, Duration duration) {
        if (duration.isNegative() || duration.isZero()) {
            throw new ValidationException(field, "'" + field + "' must be positive");
        }
        return duration;
    }
}

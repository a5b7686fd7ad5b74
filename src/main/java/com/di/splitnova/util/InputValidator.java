package com.di.splitnova.util;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Validation of user-supplied job locations and tuning values before a pipeline is built.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    // ============================================================================
    // Location Validation
    // ============================================================================

    /** Scheme-qualified ({@code gs://bucket/...}) or plain filesystem location. */
    private static final Pattern LOCATION_PATTERN = Pattern.compile(
            "^([a-z][a-z0-9+.-]*://)?[^\\u0000-\\u001f]+$"
    );

    /** Parent-directory segments are rejected so jobs cannot escape their configured roots. */
    private static final Pattern TRAVERSAL_PATTERN = Pattern.compile("(^|[/\\\\])\\.\\.([/\\\\]|$)");

    private static final int MAX_LOCATION_LENGTH = 1024;

    // ============================================================================
    // Numeric Limits
    // ============================================================================

    private static final int MIN_PARTITIONS = 1;
    private static final int MAX_PARTITIONS = 10_000;

    /**
     * Validates an input pattern or output directory.
     *
     * @param location      the location to validate
     * @param locationType  type of location for error messages (e.g. "input", "output directory")
     * @return the trimmed location
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateLocation(String location, String locationType) {
        if (location == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", locationType));
        }
        String trimmed = location.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", locationType));
        }
        if (trimmed.length() > MAX_LOCATION_LENGTH) {
            throw new IllegalArgumentException(String.format(
                    "%s exceeds maximum length of %d characters", locationType, MAX_LOCATION_LENGTH));
        }
        if (TRAVERSAL_PATTERN.matcher(trimmed).find()) {
            log.warn("Rejected {} containing parent-directory segment: {}", locationType, trimmed);
            throw new IllegalArgumentException(String.format(
                    "Invalid %s: parent-directory segments ('..') are not allowed", locationType));
        }
        if (!LOCATION_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(String.format(
                    "Invalid %s: contains control characters or a malformed scheme", locationType));
        }
        return trimmed;
    }

    /**
     * Validates the number of partitions an inline preview is split into.
     *
     * @throws IllegalArgumentException if outside {@code [1, 10000]}
     */
    public static int validatePartitionCount(int partitions) {
        if (partitions < MIN_PARTITIONS || partitions > MAX_PARTITIONS) {
            throw new IllegalArgumentException(String.format(
                    "Partition count must be between %d and %d, got: %d", MIN_PARTITIONS, MAX_PARTITIONS, partitions));
        }
        return partitions;
    }

    /**
     * Validates an explicit population size.
     *
     * @return the count, or {@code null} when it should be computed from the input
     */
    public static Long validatePopulation(Long count) {
        if (count != null && count <= 0) {
            throw new IllegalArgumentException("Population count must be positive when given, got: " + count);
        }
        return count;
    }
}

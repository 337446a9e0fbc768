package com.bbthechange.watcher.util;

import java.util.Locale;

/**
 * Canonical forms for the (source-unit, filter) pair that keys groups and checkpoints.
 */
public final class SourceUnitNormalizer {

    private SourceUnitNormalizer() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * "  r/WatchExchange " and "/r/watchexchange" both become "watchexchange".
     */
    public static String normalizeSourceUnit(String sourceUnit) {
        if (sourceUnit == null) {
            throw new IllegalArgumentException("Source unit cannot be null");
        }
        String normalized = sourceUnit.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (normalized.startsWith("r/")) {
            normalized = normalized.substring(2);
        }
        normalized = normalized.trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Source unit cannot be blank: '" + sourceUnit + "'");
        }
        return normalized;
    }

    /**
     * Filters are trimmed but keep their case; matching is case-insensitive anyway.
     */
    public static String normalizeFilter(String filter) {
        if (filter == null || filter.trim().isEmpty()) {
            throw new IllegalArgumentException("Filter cannot be null or blank");
        }
        return filter.trim();
    }
}

package de.mirkosertic.querywarmup.schema;

/**
 * Precision datetime values are truncated to before they are indexed or compared.
 */
public enum DatetimePrecision {
    SECONDS(1_000_000L),
    MILLISECONDS(1_000L),
    MICROSECONDS(1L);

    private final long micros;

    DatetimePrecision(final long micros) {
        this.micros = micros;
    }

    /**
     * Truncates a timestamp given in microseconds since epoch, rounding towards negative infinity.
     */
    public long truncate(final long timestampMicros) {
        return Math.floorDiv(timestampMicros, micros) * micros;
    }

    public static DatetimePrecision fromName(final String name) {
        return switch (name.toLowerCase()) {
            case "seconds" -> SECONDS;
            case "milliseconds" -> MILLISECONDS;
            case "microseconds" -> MICROSECONDS;
            default -> throw new IllegalArgumentException("Unknown datetime precision: " + name);
        };
    }
}

package de.mirkosertic.querywarmup.schema;

import org.apache.lucene.index.IndexOptions;

/**
 * How much posting information a text or json field records.
 */
public enum IndexRecordOption {
    BASIC(IndexOptions.DOCS),
    FREQ(IndexOptions.DOCS_AND_FREQS),
    POSITION(IndexOptions.DOCS_AND_FREQS_AND_POSITIONS);

    private final IndexOptions indexOptions;

    IndexRecordOption(final IndexOptions indexOptions) {
        this.indexOptions = indexOptions;
    }

    public IndexOptions indexOptions() {
        return indexOptions;
    }

    public boolean hasPositions() {
        return this == POSITION;
    }

    public static IndexRecordOption fromName(final String name) {
        return switch (name.toLowerCase()) {
            case "basic" -> BASIC;
            case "freq" -> FREQ;
            case "position" -> POSITION;
            default -> throw new IllegalArgumentException("Unknown index record option: " + name);
        };
    }
}

package com.jfind.scan.model;

/**
 * Which of a host's snapshots a history query returns.
 */
public record HistorySelection(Kind kind, int count) {

    public enum Kind {
        ALL,
        CURRENT_ONLY,
        MOST_RECENT
    }

    private static final HistorySelection ALL_SCANS = new HistorySelection(Kind.ALL, 0);
    private static final HistorySelection CURRENT_SCAN = new HistorySelection(Kind.CURRENT_ONLY, 1);

    public HistorySelection {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (kind == Kind.MOST_RECENT && count < 1) {
            throw new IllegalArgumentException("most recent count must be positive: " + count);
        }
    }

    public static HistorySelection all() {
        return ALL_SCANS;
    }

    public static HistorySelection currentOnly() {
        return CURRENT_SCAN;
    }

    public static HistorySelection mostRecent(int count) {
        return new HistorySelection(Kind.MOST_RECENT, count);
    }

    /**
     * Maps the signed {@code limit} query parameter: negative selects every scan, zero the
     * current scan, positive the {@code limit} newest scans.
     */
    public static HistorySelection fromLimit(int limit) {
        if (limit < 0) {
            return all();
        }
        if (limit == 0) {
            return currentOnly();
        }
        return mostRecent(limit);
    }
}

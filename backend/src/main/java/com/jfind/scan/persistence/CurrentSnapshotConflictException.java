package com.jfind.scan.persistence;

/**
 * A host was found with more than one current snapshot. Submissions never produce this state,
 * so it is reported as an internal failure rather than a client error.
 */
public class CurrentSnapshotConflictException extends RuntimeException {
    private final String host;
    private final int currentCount;

    public CurrentSnapshotConflictException(String host, int currentCount) {
        super("Host " + host + " has " + currentCount + " current scans");
        this.host = host;
        this.currentCount = currentCount;
    }

    public String getHost() {
        return host;
    }

    public int getCurrentCount() {
        return currentCount;
    }
}

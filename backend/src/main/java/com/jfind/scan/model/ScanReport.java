package com.jfind.scan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Report posted by the scanning agent: one metadata block plus the runtimes it found.
 */
public record ScanReport(
    @JsonProperty("meta") ScanMeta meta,
    @JsonProperty("runtimes") List<RuntimeEntry> runtimes
) {
    public List<RuntimeEntry> runtimesOrEmpty() {
        return runtimes == null ? List.of() : runtimes;
    }
}

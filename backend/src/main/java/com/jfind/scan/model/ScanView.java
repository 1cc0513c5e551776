package com.jfind.scan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ScanView(
    @JsonProperty("meta") ScanSnapshot meta,
    @JsonProperty("runtimes") List<RuntimeRecord> runtimes
) {
    public static ScanView of(ScanSnapshot snapshot) {
        List<RuntimeRecord> runtimes = snapshot.runtimes() == null ? List.of() : snapshot.runtimes();
        return new ScanView(snapshot, runtimes);
    }
}

package com.jfind.scan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScanSubmitResponse(
    @JsonProperty("result") String result,
    @JsonProperty("scan_id") long scanId
) {
    public static ScanSubmitResponse ok(long scanId) {
        return new ScanSubmitResponse("ok", scanId);
    }
}

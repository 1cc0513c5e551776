package com.jfind.scan.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * One stored scan. {@code current} is true for at most one snapshot per host.
 */
public record ScanSnapshot(
    @JsonProperty("scan_id") long id,
    @JsonProperty("scan_ts") Instant scanTs,
    @JsonProperty("computer_name") String computerName,
    @JsonProperty("user_name") String userName,
    @JsonProperty("scan_duration") String scanDuration,
    @JsonProperty("has_oracle_jdk") Boolean hasOracleJdk,
    @JsonProperty("count_result") Integer countResult,
    @JsonProperty("count_require_license") Integer countRequireLicense,
    @JsonProperty("scanned_dirs") Integer scannedDirs,
    @JsonProperty("scan_path") String scanPath,
    @JsonProperty("platform_info") String platformInfo,
    @JsonProperty("most_recent") boolean current,
    @JsonProperty("created_at") Instant createdAt,
    @JsonIgnore List<RuntimeRecord> runtimes
) {
    public ScanSnapshot withRuntimes(List<RuntimeRecord> attached) {
        return new ScanSnapshot(
            id,
            scanTs,
            computerName,
            userName,
            scanDuration,
            hasOracleJdk,
            countResult,
            countRequireLicense,
            scannedDirs,
            scanPath,
            platformInfo,
            current,
            createdAt,
            attached == null ? List.of() : List.copyOf(attached)
        );
    }
}

package com.jfind.scan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScanMeta(
    @JsonProperty("scan_ts") String scanTs,
    @JsonProperty("computer_name") String computerName,
    @JsonProperty("user_name") String userName,
    @JsonProperty("scan_duration") String scanDuration,
    @JsonProperty("has_oracle_jdk") Boolean hasOracleJdk,
    @JsonProperty("count_result") Integer countResult,
    @JsonProperty("count_require_license") Integer countRequireLicense,
    @JsonProperty("scanned_dirs") Integer scannedDirs,
    @JsonProperty("scan_path") String scanPath,
    @JsonProperty("platform_info") String platformInfo
) {}

package com.jfind.scan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RuntimeEntry(
    @JsonProperty("java_executable") String javaExecutable,
    @JsonProperty("java_runtime") String javaRuntime,
    @JsonProperty("java_vendor") String javaVendor,
    @JsonProperty("is_oracle") Boolean oracle,
    @JsonProperty("java_version") String javaVersion,
    @JsonProperty("java_version_major") Integer javaVersionMajor,
    @JsonProperty("java_version_update") Integer javaVersionUpdate,
    @JsonProperty("require_license") Boolean requireLicense
) {}

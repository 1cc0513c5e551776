package com.jfind.scan.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LicenseCheckResponse(
    @JsonProperty("computer_name") String computerName,
    @JsonProperty("require_license") LicenseRequirement requireLicense
) {}

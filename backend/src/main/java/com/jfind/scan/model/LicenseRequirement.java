package com.jfind.scan.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a host runs a JDK that needs a commercial license. {@link #UNKNOWN} means the host
 * never submitted a scan, which is different from a scan that found nothing licensable.
 */
public enum LicenseRequirement {
    TRUE("true"),
    FALSE("false"),
    UNKNOWN("unknown");

    private final String wireValue;

    LicenseRequirement(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static LicenseRequirement fromScan(boolean anyRuntimeRequiresLicense) {
        return anyRuntimeRequiresLicense ? TRUE : FALSE;
    }
}

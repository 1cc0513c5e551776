package com.jfind.scan.util;

import com.jfind.scan.model.RuntimeEntry;
import com.jfind.scan.model.ScanMeta;
import com.jfind.scan.model.ScanReport;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;

public final class ScanReportValidator {
    // Column widths from V1__scan_schema.sql.
    static final int MAX_NAME_LENGTH = 255;
    static final int MAX_PATH_LENGTH = 1024;
    static final int MAX_SHORT_TEXT_LENGTH = 50;

    private ScanReportValidator() {
    }

    /**
     * Checks the fields a submission cannot be stored without and returns the parsed scan time.
     */
    public static Instant validate(ScanReport report) {
        if (report == null) {
            throw new ScanValidationException("report body is required");
        }
        ScanMeta meta = report.meta();
        if (meta == null) {
            throw new ScanValidationException("meta is required");
        }
        if (meta.computerName() == null || meta.computerName().isBlank()) {
            throw new ScanValidationException("meta.computer_name is required");
        }
        Instant scanTs = parseScanTimestamp(meta.scanTs());
        checkLength("meta.computer_name", meta.computerName().trim(), MAX_NAME_LENGTH);
        checkLength("meta.user_name", meta.userName(), MAX_NAME_LENGTH);
        checkLength("meta.scan_duration", meta.scanDuration(), MAX_SHORT_TEXT_LENGTH);
        checkLength("meta.scan_path", meta.scanPath(), MAX_PATH_LENGTH);
        checkLength("meta.platform_info", meta.platformInfo(), MAX_NAME_LENGTH);

        List<RuntimeEntry> runtimes = report.runtimesOrEmpty();
        for (int i = 0; i < runtimes.size(); i++) {
            RuntimeEntry runtime = runtimes.get(i);
            if (runtime == null) {
                throw new ScanValidationException("runtimes[" + i + "] is null");
            }
            if (runtime.javaExecutable() == null || runtime.javaExecutable().isBlank()) {
                throw new ScanValidationException("runtimes[" + i + "].java_executable is required");
            }
            String prefix = "runtimes[" + i + "].";
            checkLength(prefix + "java_executable", runtime.javaExecutable(), MAX_PATH_LENGTH);
            checkLength(prefix + "java_runtime", runtime.javaRuntime(), MAX_NAME_LENGTH);
            checkLength(prefix + "java_vendor", runtime.javaVendor(), MAX_NAME_LENGTH);
            checkLength(prefix + "java_version", runtime.javaVersion(), MAX_SHORT_TEXT_LENGTH);
        }
        return scanTs;
    }

    private static void checkLength(String field, String value, int max) {
        if (value != null && value.length() > max) {
            throw new ScanValidationException(field + " exceeds " + max + " characters");
        }
    }

    /**
     * Parses an ISO-8601 timestamp. Values without an offset are taken as UTC; a bare date
     * means midnight UTC.
     */
    public static Instant parseScanTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ScanValidationException("meta.scan_ts is required");
        }
        String value = raw.trim();
        if (value.length() > 10 && value.charAt(10) == ' ') {
            value = value.substring(0, 10) + 'T' + value.substring(11);
        }
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                value,
                OffsetDateTime::from,
                LocalDateTime::from
            );
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new ScanValidationException("Invalid datetime format: " + raw, e);
        }
    }
}

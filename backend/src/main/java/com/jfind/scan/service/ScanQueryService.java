package com.jfind.scan.service;

import com.jfind.config.JFindProperties;
import com.jfind.scan.model.HistorySelection;
import com.jfind.scan.model.LicenseRequirement;
import com.jfind.scan.model.RuntimeRecord;
import com.jfind.scan.model.ScanSnapshot;
import com.jfind.scan.persistence.ScanJdbcRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the scan store. Nothing is cached, so every call sees the latest committed submit.
 */
@Service
public class ScanQueryService {
    private final ScanJdbcRepository repository;
    private final JFindProperties properties;

    public ScanQueryService(ScanJdbcRepository repository, JFindProperties properties) {
        this.repository = repository;
        this.properties = properties;
    }

    public ScanSnapshot getScan(long scanId) {
        return repository.fetchById(scanId)
            .orElseThrow(() -> new ScanNotFoundException(scanId));
    }

    public Optional<ScanSnapshot> getCurrentScan(String computerName) {
        String host = normalizeHost(computerName);
        if (host == null) {
            return Optional.empty();
        }
        return repository.fetchCurrent(host);
    }

    public List<ScanSnapshot> getHostScans(String computerName, Integer limit) {
        String host = normalizeHost(computerName);
        if (host == null) {
            return List.of();
        }
        int signedLimit = limit == null ? properties.getApi().getDefaultHistoryLimit() : limit;
        return repository.fetchHistory(host, HistorySelection.fromLimit(signedLimit));
    }

    public List<ScanSnapshot> getLatestScans(Integer limit) {
        return repository.fetchLatestFleet(clampLimit(limit, properties.getApi().getDefaultScanLimit()));
    }

    public List<RuntimeRecord> getOracleRuntimes(Integer limit) {
        return repository.fetchOracleRuntimes(clampLimit(limit, properties.getApi().getDefaultOracleLimit()));
    }

    public LicenseRequirement checkLicenseRequirement(String computerName) {
        String host = normalizeHost(computerName);
        if (host == null || !repository.hasAnySnapshot(host)) {
            return LicenseRequirement.UNKNOWN;
        }
        return LicenseRequirement.fromScan(repository.currentSnapshotRequiresLicense(host));
    }

    private int clampLimit(Integer limit, int defaultLimit) {
        int requested = limit == null || limit < 1 ? defaultLimit : limit;
        return Math.max(1, Math.min(requested, properties.getApi().getMaxLimit()));
    }

    private String normalizeHost(String computerName) {
        if (computerName == null || computerName.isBlank()) {
            return null;
        }
        return computerName.trim();
    }
}

package com.jfind.scan.persistence;

import com.jfind.scan.model.HistorySelection;
import com.jfind.scan.model.RuntimeEntry;
import com.jfind.scan.model.RuntimeRecord;
import com.jfind.scan.model.ScanMeta;
import com.jfind.scan.model.ScanReport;
import com.jfind.scan.model.ScanSnapshot;
import com.jfind.scan.util.ScanValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

import static com.jfind.scan.ScanReportFixtures.openJdk;
import static com.jfind.scan.ScanReportFixtures.oracleLicensed;
import static com.jfind.scan.ScanReportFixtures.report;
import static com.jfind.scan.ScanReportFixtures.uniqueHost;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ScanJdbcRepositorySubmitTest {

    @Autowired
    private ScanJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void submitStoresSnapshotWithRuntimes() {
        String host = uniqueHost("submit");
        ScanSnapshot saved = repository.submit(report(
            host,
            "2025-05-01T08:00:00Z",
            oracleLicensed("/usr/bin/java1"),
            openJdk("/usr/bin/java2")
        ));

        assertTrue(saved.id() > 0);
        assertTrue(saved.current());
        assertEquals(host, saved.computerName());
        assertEquals(Instant.parse("2025-05-01T08:00:00Z"), saved.scanTs());
        assertEquals("test-user", saved.userName());
        assertEquals("1s", saved.scanDuration());
        assertTrue(saved.hasOracleJdk());
        assertEquals(2, saved.countResult());
        assertEquals(1, saved.countRequireLicense());
        assertEquals(10, saved.scannedDirs());
        assertEquals("/test/path", saved.scanPath());
        assertEquals("linux/amd64", saved.platformInfo());
        assertTrue(saved.createdAt() != null);
        assertEquals(2, saved.runtimes().size());

        RuntimeRecord java1 = saved.runtimes().stream()
            .filter(runtime -> "/usr/bin/java1".equals(runtime.javaExecutable()))
            .findFirst()
            .orElseThrow();
        assertEquals(saved.id(), java1.scanId());
        assertEquals(host, java1.computerName());
        assertEquals("Oracle Corporation", java1.javaVendor());
        assertEquals(Boolean.TRUE, java1.oracle());
        assertEquals("1.8.0_292", java1.javaVersion());
        assertEquals(8, java1.javaVersionMajor());
        assertEquals(292, java1.javaVersionUpdate());
        assertEquals(Boolean.TRUE, java1.requireLicense());
    }

    @Test
    void secondSubmitRetiresPreviousCurrent() {
        String host = uniqueHost("alpha");
        ScanSnapshot first = repository.submit(report(
            host,
            "2025-05-01T08:00:00Z",
            oracleLicensed("/opt/jdk8/bin/java"),
            openJdk("/opt/jdk11/bin/java")
        ));
        assertEquals(first, repository.fetchCurrent(host).orElseThrow());
        assertEquals(2, repository.fetchCurrent(host).orElseThrow().runtimes().size());

        ScanSnapshot second = repository.submit(report(host, "2025-05-02T08:00:00Z", openJdk("/opt/jdk11/bin/java")));

        ScanSnapshot current = repository.fetchCurrent(host).orElseThrow();
        assertEquals(second.id(), current.id());
        assertFalse(repository.fetchById(first.id()).orElseThrow().current());
        assertEquals(1, repository.countCurrentSnapshots(host));

        List<ScanSnapshot> history = repository.fetchHistory(host, HistorySelection.all());
        assertEquals(List.of(second.id(), first.id()), history.stream().map(ScanSnapshot::id).toList());
    }

    @Test
    void submissionOrderDecidesCurrentNotScanTimestamp() {
        String host = uniqueHost("order");
        ScanSnapshot newerScan = repository.submit(report(host, "2025-06-10T00:00:00Z"));
        ScanSnapshot olderScanSubmittedLater = repository.submit(report(host, "2025-06-01T00:00:00Z"));

        assertEquals(olderScanSubmittedLater.id(), repository.fetchCurrent(host).orElseThrow().id());
        List<ScanSnapshot> history = repository.fetchHistory(host, HistorySelection.all());
        assertEquals(newerScan.id(), history.get(0).id());
        assertFalse(history.get(0).current());
    }

    @Test
    void fetchCurrentIsStableBetweenReads() {
        String host = uniqueHost("stable");
        repository.submit(report(host, "2025-05-01T08:00:00Z", openJdk("/usr/bin/java")));

        assertEquals(repository.fetchCurrent(host), repository.fetchCurrent(host));
    }

    @Test
    void malformedReportIsRejectedBeforeAnyWrite() {
        String host = uniqueHost("invalid");

        assertThrows(ScanValidationException.class, () -> repository.submit(report(host, "not-a-timestamp")));

        assertFalse(repository.hasAnySnapshot(host));
        Integer hostRows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM scan_hosts WHERE host_name = :host",
            new MapSqlParameterSource().addValue("host", host),
            Integer.class
        );
        assertEquals(0, hostRows);
    }

    @Test
    void overlongRuntimeFieldIsRejectedBeforeAnyWrite() {
        String host = uniqueHost("overlong");
        RuntimeEntry longVersion = new RuntimeEntry(
            "/usr/bin/java",
            "OpenJDK Runtime Environment",
            "Eclipse Adoptium",
            false,
            "11.0.3+7-" + "b".repeat(58),
            11,
            3,
            false
        );

        assertThrows(ScanValidationException.class, () -> repository.submit(report(host, "2025-05-01T08:00:00Z", longVersion)));

        assertFalse(repository.hasAnySnapshot(host));
        Integer hostRows = jdbc.queryForObject(
            "SELECT COUNT(*) FROM scan_hosts WHERE host_name = :host",
            new MapSqlParameterSource().addValue("host", host),
            Integer.class
        );
        assertEquals(0, hostRows);
    }

    @Test
    void missingOracleFlagIsStoredAsSent() {
        String host = uniqueHost("no-flag");
        ScanMeta meta = new ScanMeta(
            "2025-05-01T08:00:00Z",
            host,
            "test-user",
            "1s",
            null,
            0,
            0,
            3,
            "/",
            "linux/amd64"
        );

        ScanSnapshot saved = repository.submit(new ScanReport(meta, List.of()));

        assertNull(saved.hasOracleJdk());
        assertNull(repository.fetchById(saved.id()).orElseThrow().hasOracleJdk());
    }

    @Test
    void unknownIdAndHostReturnEmpty() {
        assertTrue(repository.fetchById(Long.MAX_VALUE).isEmpty());
        assertTrue(repository.fetchCurrent(uniqueHost("never")).isEmpty());
        assertTrue(repository.fetchHistory(uniqueHost("never"), HistorySelection.all()).isEmpty());
    }

    @Test
    void deletingSnapshotCascadesToRuntimes() {
        String host = uniqueHost("cascade");
        ScanSnapshot saved = repository.submit(report(
            host,
            "2025-05-01T08:00:00Z",
            oracleLicensed("/usr/bin/java1"),
            openJdk("/usr/bin/java2")
        ));
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("scanId", saved.id());

        jdbc.update("DELETE FROM scan_snapshots WHERE id = :scanId", params);

        Integer remaining = jdbc.queryForObject(
            "SELECT COUNT(*) FROM runtime_records WHERE scan_id = :scanId",
            params,
            Integer.class
        );
        assertEquals(0, remaining);
    }

    @Test
    void secondCurrentRowIsReportedAsConflict() {
        String host = uniqueHost("conflict");
        ScanSnapshot first = repository.submit(report(host, "2025-05-01T08:00:00Z"));
        repository.submit(report(host, "2025-05-02T08:00:00Z"));
        jdbc.update(
            "UPDATE scan_snapshots SET is_current = TRUE WHERE id = :scanId",
            new MapSqlParameterSource().addValue("scanId", first.id())
        );

        CurrentSnapshotConflictException ex =
            assertThrows(CurrentSnapshotConflictException.class, () -> repository.fetchCurrent(host));
        assertEquals(2, ex.getCurrentCount());
    }
}

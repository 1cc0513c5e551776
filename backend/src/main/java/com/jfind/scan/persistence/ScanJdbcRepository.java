package com.jfind.scan.persistence;

import com.jfind.scan.model.HistorySelection;
import com.jfind.scan.model.RuntimeEntry;
import com.jfind.scan.model.RuntimeRecord;
import com.jfind.scan.model.ScanMeta;
import com.jfind.scan.model.ScanReport;
import com.jfind.scan.model.ScanSnapshot;
import com.jfind.scan.util.ScanReportValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores scan snapshots and their runtime records. {@link #submit} is the only write path and
 * keeps at most one current snapshot per host.
 */
@Repository
public class ScanJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(ScanJdbcRepository.class);

    private static final String SNAPSHOT_COLUMNS = """
        s.id,
        s.scan_ts,
        s.computer_name,
        s.user_name,
        s.scan_duration,
        s.has_oracle_jdk,
        s.count_result,
        s.count_require_license,
        s.scanned_dirs,
        s.scan_path,
        s.platform_info,
        s.is_current,
        s.created_at
        """;

    private static final String RUNTIME_COLUMNS = """
        r.id,
        r.scan_id,
        r.computer_name,
        r.java_executable,
        r.java_runtime,
        r.java_vendor,
        r.is_oracle,
        r.java_version,
        r.java_version_major,
        r.java_version_update,
        r.require_license,
        r.created_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate submitTransaction;

    public ScanJdbcRepository(
        NamedParameterJdbcTemplate jdbc,
        @Qualifier("submitTransactionTemplate") TransactionTemplate submitTransaction
    ) {
        this.jdbc = jdbc;
        this.submitTransaction = submitTransaction;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    /**
     * Records a report as the host's current snapshot. The host is registered, the previous
     * current snapshot is retired and the new snapshot and its runtimes are inserted, all in one
     * transaction that holds the host's {@code scan_hosts} row lock, so concurrent submissions for
     * one host serialize and the last to commit is current. A failure rolls back every step.
     *
     * @throws com.jfind.scan.util.ScanValidationException if the report is malformed; nothing is written
     */
    public ScanSnapshot submit(ScanReport report) {
        Instant scanTs = ScanReportValidator.validate(report);
        ScanMeta meta = report.meta();
        String host = meta.computerName().trim();
        Instant now = Instant.now();

        ScanSnapshot saved = submitTransaction.execute(status -> {
            registerHost(host, now);
            lockHost(host, now);
            int retired = retireCurrent(host);
            long scanId = insertSnapshot(meta, host, scanTs, now);
            insertRuntimes(scanId, host, report.runtimesOrEmpty(), now);
            log.debug("Scan {} for {} is current; retired {} previous", scanId, host, retired);
            return fetchById(scanId)
                .orElseThrow(() -> new IllegalStateException("Inserted scan not readable: " + scanId));
        });
        if (saved == null) {
            throw new IllegalStateException("Scan submit for " + host + " returned no snapshot");
        }
        return saved;
    }

    public Optional<ScanSnapshot> fetchById(long scanId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("scanId", scanId);
        List<ScanSnapshot> snapshots = jdbc.query(
            "SELECT " + SNAPSHOT_COLUMNS + """
                FROM scan_snapshots s
                WHERE s.id = :scanId
                """,
            params,
            snapshotRowMapper()
        );
        if (snapshots.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(attachRuntimes(snapshots).get(0));
    }

    /**
     * Current snapshot of a host.
     *
     * @throws CurrentSnapshotConflictException if the store holds more than one current snapshot for the host
     */
    public Optional<ScanSnapshot> fetchCurrent(String host) {
        List<ScanSnapshot> current = fetchHistory(host, HistorySelection.currentOnly());
        if (current.size() > 1) {
            throw new CurrentSnapshotConflictException(host, current.size());
        }
        return current.isEmpty() ? Optional.empty() : Optional.of(current.get(0));
    }

    public List<ScanSnapshot> fetchHistory(String host, HistorySelection selection) {
        if (host == null || host.isBlank()) {
            return List.of();
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("host", host.trim());
        String sql = switch (selection.kind()) {
            case ALL -> "SELECT " + SNAPSHOT_COLUMNS + """
                FROM scan_snapshots s
                WHERE s.computer_name = :host
                ORDER BY s.scan_ts DESC, s.id DESC
                """;
            case CURRENT_ONLY -> "SELECT " + SNAPSHOT_COLUMNS + """
                FROM scan_snapshots s
                WHERE s.computer_name = :host
                  AND s.is_current = TRUE
                ORDER BY s.scan_ts DESC, s.id DESC
                """;
            case MOST_RECENT -> {
                params.addValue("limit", selection.count());
                yield "SELECT " + SNAPSHOT_COLUMNS + """
                    FROM scan_snapshots s
                    WHERE s.computer_name = :host
                    ORDER BY s.scan_ts DESC, s.id DESC
                    LIMIT :limit
                    """;
            }
        };
        return attachRuntimes(jdbc.query(sql, params, snapshotRowMapper()));
    }

    public List<ScanSnapshot> fetchLatestFleet(int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", limit);
        List<ScanSnapshot> snapshots = jdbc.query(
            "SELECT " + SNAPSHOT_COLUMNS + """
                FROM scan_snapshots s
                WHERE s.is_current = TRUE
                ORDER BY s.scan_ts DESC, s.id DESC
                LIMIT :limit
                """,
            params,
            snapshotRowMapper()
        );
        return attachRuntimes(snapshots);
    }

    public List<RuntimeRecord> fetchOracleRuntimes(int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("limit", limit);
        return jdbc.query(
            "SELECT " + RUNTIME_COLUMNS + """
                FROM runtime_records r
                JOIN scan_snapshots s ON s.id = r.scan_id
                WHERE r.is_oracle = TRUE
                  AND s.is_current = TRUE
                ORDER BY s.scan_ts DESC, r.id DESC
                LIMIT :limit
                """,
            params,
            runtimeRowMapper()
        );
    }

    public boolean hasAnySnapshot(String host) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("host", host);
        Boolean found = jdbc.queryForObject(
            """
                SELECT EXISTS (
                    SELECT 1
                    FROM scan_snapshots
                    WHERE computer_name = :host
                )
                """,
            params,
            Boolean.class
        );
        return Boolean.TRUE.equals(found);
    }

    public boolean currentSnapshotRequiresLicense(String host) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("host", host);
        Boolean found = jdbc.queryForObject(
            """
                SELECT EXISTS (
                    SELECT 1
                    FROM runtime_records r
                    JOIN scan_snapshots s ON s.id = r.scan_id
                    WHERE s.computer_name = :host
                      AND s.is_current = TRUE
                      AND r.require_license = TRUE
                )
                """,
            params,
            Boolean.class
        );
        return Boolean.TRUE.equals(found);
    }

    public int countCurrentSnapshots(String host) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("host", host);
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM scan_snapshots
                WHERE computer_name = :host
                  AND is_current = TRUE
                """,
            params,
            Integer.class
        );
        return count == null ? 0 : count;
    }

    private void registerHost(String host, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("host", host)
            .addValue("now", toTimestamp(now));
        int inserted = jdbc.update(
            """
                INSERT INTO scan_hosts (host_name, first_seen_at, submission_count)
                VALUES (:host, :now, 0)
                ON CONFLICT DO NOTHING
                """,
            params
        );
        if (inserted > 0) {
            log.debug("Registered new host {}", host);
        }
    }

    private void lockHost(String host, Instant now) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("host", host)
            .addValue("now", toTimestamp(now));
        int updated = jdbc.update(
            """
                UPDATE scan_hosts
                SET last_submitted_at = :now,
                    submission_count = submission_count + 1
                WHERE host_name = :host
                """,
            params
        );
        if (updated != 1) {
            throw new IllegalStateException("Host is not registered: " + host);
        }
    }

    private int retireCurrent(String host) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("host", host);
        return jdbc.update(
            """
                UPDATE scan_snapshots
                SET is_current = FALSE
                WHERE computer_name = :host
                  AND is_current = TRUE
                """,
            params
        );
    }

    private long insertSnapshot(ScanMeta meta, String host, Instant scanTs, Instant createdAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("scanTs", toTimestamp(scanTs))
            .addValue("computerName", host)
            .addValue("userName", meta.userName())
            .addValue("scanDuration", meta.scanDuration())
            .addValue("hasOracleJdk", meta.hasOracleJdk())
            .addValue("countResult", meta.countResult())
            .addValue("countRequireLicense", meta.countRequireLicense())
            .addValue("scannedDirs", meta.scannedDirs())
            .addValue("scanPath", meta.scanPath())
            .addValue("platformInfo", meta.platformInfo())
            .addValue("createdAt", toTimestamp(createdAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scan_snapshots (
                    scan_ts,
                    computer_name,
                    user_name,
                    scan_duration,
                    has_oracle_jdk,
                    count_result,
                    count_require_license,
                    scanned_dirs,
                    scan_path,
                    platform_info,
                    is_current,
                    created_at
                )
                VALUES (
                    :scanTs,
                    :computerName,
                    :userName,
                    :scanDuration,
                    :hasOracleJdk,
                    :countResult,
                    :countRequireLicense,
                    :scannedDirs,
                    :scanPath,
                    :platformInfo,
                    TRUE,
                    :createdAt
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert scan snapshot for " + host);
        }
        return key.longValue();
    }

    private void insertRuntimes(long scanId, String host, List<RuntimeEntry> runtimes, Instant createdAt) {
        if (runtimes.isEmpty()) {
            return;
        }
        MapSqlParameterSource[] batch = new MapSqlParameterSource[runtimes.size()];
        for (int i = 0; i < runtimes.size(); i++) {
            RuntimeEntry runtime = runtimes.get(i);
            batch[i] = new MapSqlParameterSource()
                .addValue("scanId", scanId)
                .addValue("computerName", host)
                .addValue("javaExecutable", runtime.javaExecutable())
                .addValue("javaRuntime", runtime.javaRuntime())
                .addValue("javaVendor", runtime.javaVendor())
                .addValue("isOracle", runtime.oracle())
                .addValue("javaVersion", runtime.javaVersion())
                .addValue("javaVersionMajor", runtime.javaVersionMajor())
                .addValue("javaVersionUpdate", runtime.javaVersionUpdate())
                .addValue("requireLicense", runtime.requireLicense())
                .addValue("createdAt", toTimestamp(createdAt));
        }
        jdbc.batchUpdate(
            """
                INSERT INTO runtime_records (
                    scan_id,
                    computer_name,
                    java_executable,
                    java_runtime,
                    java_vendor,
                    is_oracle,
                    java_version,
                    java_version_major,
                    java_version_update,
                    require_license,
                    created_at
                )
                VALUES (
                    :scanId,
                    :computerName,
                    :javaExecutable,
                    :javaRuntime,
                    :javaVendor,
                    :isOracle,
                    :javaVersion,
                    :javaVersionMajor,
                    :javaVersionUpdate,
                    :requireLicense,
                    :createdAt
                )
                """,
            batch
        );
    }

    private List<ScanSnapshot> attachRuntimes(List<ScanSnapshot> snapshots) {
        if (snapshots.isEmpty()) {
            return snapshots;
        }
        Map<Long, List<RuntimeRecord>> byScan = new LinkedHashMap<>();
        for (ScanSnapshot snapshot : snapshots) {
            byScan.put(snapshot.id(), new ArrayList<>());
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("scanIds", new ArrayList<>(byScan.keySet()));
        RowMapper<RuntimeRecord> mapper = runtimeRowMapper();
        jdbc.query(
            "SELECT " + RUNTIME_COLUMNS + """
                FROM runtime_records r
                WHERE r.scan_id IN (:scanIds)
                ORDER BY r.id
                """,
            params,
            rs -> {
                RuntimeRecord runtime = mapper.mapRow(rs, rs.getRow());
                byScan.get(runtime.scanId()).add(runtime);
            }
        );
        List<ScanSnapshot> out = new ArrayList<>(snapshots.size());
        for (ScanSnapshot snapshot : snapshots) {
            out.add(snapshot.withRuntimes(byScan.get(snapshot.id())));
        }
        return out;
    }

    private RowMapper<ScanSnapshot> snapshotRowMapper() {
        return (rs, rowNum) -> new ScanSnapshot(
            rs.getLong("id"),
            toInstant(rs.getTimestamp("scan_ts")),
            rs.getString("computer_name"),
            rs.getString("user_name"),
            rs.getString("scan_duration"),
            getBoolean(rs, "has_oracle_jdk"),
            getInteger(rs, "count_result"),
            getInteger(rs, "count_require_license"),
            getInteger(rs, "scanned_dirs"),
            rs.getString("scan_path"),
            rs.getString("platform_info"),
            rs.getBoolean("is_current"),
            toInstant(rs.getTimestamp("created_at")),
            List.of()
        );
    }

    private RowMapper<RuntimeRecord> runtimeRowMapper() {
        return (rs, rowNum) -> new RuntimeRecord(
            rs.getLong("id"),
            rs.getLong("scan_id"),
            rs.getString("computer_name"),
            rs.getString("java_executable"),
            rs.getString("java_runtime"),
            rs.getString("java_vendor"),
            getBoolean(rs, "is_oracle"),
            rs.getString("java_version"),
            getInteger(rs, "java_version_major"),
            getInteger(rs, "java_version_update"),
            getBoolean(rs, "require_license"),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    private Integer getInteger(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private Boolean getBoolean(ResultSet rs, String column) throws SQLException {
        boolean value = rs.getBoolean(column);
        return rs.wasNull() ? null : value;
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}

package com.policyparser.discovery.repository;

import com.policyparser.discovery.domain.DomainModels;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class QueueJdbcRepository {
    public static final int ERROR_MAX_CHARS = 2048;

    private final JdbcTemplate jdbcTemplate;

    public QueueJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Plain insert; a duplicate domain surfaces as {@link org.springframework.dao.DuplicateKeyException}.
     */
    public void insertPending(String domain) {
        String now = JdbcTimestamps.now();
        jdbcTemplate.update(
                "INSERT INTO discovery_jobs(domain, status, attempts, created_at, updated_at) VALUES (?,?,0,?,?)",
                domain, DomainModels.JobStatus.PENDING.dbValue(), now, now
        );
    }

    public Optional<String> oldestPending() {
        return jdbcTemplate.query(
                "SELECT domain FROM discovery_jobs WHERE status = ? ORDER BY seq LIMIT 1",
                (rs, n) -> rs.getString(1),
                DomainModels.JobStatus.PENDING.dbValue()
        ).stream().findFirst();
    }

    /**
     * Compare-and-swap on status: only one caller can move a given row out of {@code expected}.
     */
    public boolean transition(String domain, DomainModels.JobStatus expected, DomainModels.JobStatus next,
                              String result, String error, boolean countAttempt) {
        int updated = jdbcTemplate.update(
                "UPDATE discovery_jobs SET status = ?, result = COALESCE(?, result), error = ?, attempts = attempts + ?, updated_at = ? WHERE domain = ? AND status = ?",
                next.dbValue(), result, fitError(error), countAttempt ? 1 : 0, JdbcTimestamps.now(), domain, expected.dbValue()
        );
        return updated == 1;
    }

    // discovery_jobs.error is VARCHAR(2048)
    static String fitError(String error) {
        if (error == null || error.length() <= ERROR_MAX_CHARS) return error;
        return error.substring(0, ERROR_MAX_CHARS - 3) + "...";
    }

    public Optional<DomainModels.DiscoveryJob> find(String domain) {
        return jdbcTemplate.query(
                "SELECT domain, status, result, error, attempts, created_at, updated_at FROM discovery_jobs WHERE domain = ?",
                (rs, n) -> new DomainModels.DiscoveryJob(rs.getString(1), DomainModels.JobStatus.fromDb(rs.getString(2)),
                        rs.getString(3), rs.getString(4), rs.getInt(5),
                        Instant.parse(rs.getString(6)), Instant.parse(rs.getString(7))),
                domain
        ).stream().findFirst();
    }

    public Map<DomainModels.JobStatus, Long> countByStatus() {
        Map<DomainModels.JobStatus, Long> counts = new LinkedHashMap<>();
        for (DomainModels.JobStatus s : DomainModels.JobStatus.values()) counts.put(s, 0L);
        jdbcTemplate.query("SELECT status, COUNT(*) FROM discovery_jobs GROUP BY status",
                rs -> {
                    counts.put(DomainModels.JobStatus.fromDb(rs.getString(1)), rs.getLong(2));
                });
        return counts;
    }

    public List<String> staleProcessing(Instant olderThan) {
        return jdbcTemplate.query(
                "SELECT domain FROM discovery_jobs WHERE status = ? AND updated_at < ?",
                (rs, n) -> rs.getString(1),
                DomainModels.JobStatus.PROCESSING.dbValue(), JdbcTimestamps.format(olderThan)
        );
    }

    public int deleteTerminal(String domain) {
        return jdbcTemplate.update("DELETE FROM discovery_jobs WHERE domain = ? AND status IN (?, ?)",
                domain, DomainModels.JobStatus.COMPLETED.dbValue(), DomainModels.JobStatus.FAILED.dbValue());
    }
}

package com.policyparser.discovery.repository;

import com.policyparser.discovery.domain.DomainModels;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class PolicyDocumentJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public PolicyDocumentJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void upsert(String domain, DomainModels.PolicyDocument doc) {
        jdbcTemplate.update(
                "MERGE INTO policy_documents(domain, doc_type, url, title, text_content, confidence, source, cached_at) KEY(domain, doc_type) VALUES (?,?,?,?,?,?,?,?)",
                domain, doc.type().name(), doc.url(), doc.title(), doc.text(), doc.confidence(), doc.source().name(), JdbcTimestamps.now()
        );
    }

    public List<CachedDocument> findByDomain(String domain) {
        return jdbcTemplate.query(
                "SELECT url, title, text_content, doc_type, confidence, source, cached_at FROM policy_documents WHERE domain = ? ORDER BY doc_type",
                (rs, n) -> new CachedDocument(
                        new DomainModels.PolicyDocument(rs.getString(1), rs.getString(2), rs.getString(3),
                                DomainModels.DocumentType.valueOf(rs.getString(4)), rs.getDouble(5),
                                DomainModels.StrategyKind.valueOf(rs.getString(6))),
                        Instant.parse(rs.getString(7))
                ),
                domain
        );
    }

    public int deleteByDomain(String domain) {
        return jdbcTemplate.update("DELETE FROM policy_documents WHERE domain = ?", domain);
    }

    /**
     * Timestamps are ISO-8601 UTC strings, so lexical order matches time order.
     */
    public int deleteOlderThan(Instant cutoff) {
        return jdbcTemplate.update("DELETE FROM policy_documents WHERE cached_at < ?", JdbcTimestamps.format(cutoff));
    }

    public record CachedDocument(DomainModels.PolicyDocument document, Instant cachedAt) {
    }
}

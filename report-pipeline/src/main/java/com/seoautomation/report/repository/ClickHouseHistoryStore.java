package com.seoautomation.report.repository;

import com.seoautomation.report.model.HistoricalPoint;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Score history kept in ClickHouse. Rows are never updated; the ReplacingMergeTree
 * ordering key (url, point_date) collapses duplicate appends for the same day.
 */
@Repository
@Slf4j
@ConditionalOnProperty(name = "seo-report.storage.history", havingValue = "clickhouse")
public class ClickHouseHistoryStore implements HistoryStore {

    private static final RowMapper<HistoricalPoint> ROW_MAPPER = (rs, rowNum) -> new HistoricalPoint(
            rs.getDate("point_date").toLocalDate(),
            rs.getDouble("overall_score"),
            rs.getInt("issue_count"),
            rs.getInt("fix_count"),
            rs.getLong("traffic_estimate"));

    private final JdbcTemplate jdbcTemplate;

    public ClickHouseHistoryStore(@Qualifier("historyJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @PostConstruct
    public void ensureSchema() {
        log.info("Ensuring ClickHouse history schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS score_history
            (
                url                 String,
                point_date          Date,
                overall_score       Float64,
                issue_count         Int32,
                fix_count           Int32,
                traffic_estimate    Int64,
                recorded_at         DateTime DEFAULT now()
            )
            ENGINE = ReplacingMergeTree()
            ORDER BY (url, point_date)
        """);

        log.info("ClickHouse history schema ready.");
    }

    @Override
    public List<HistoricalPoint> getHistory(String url, int limit) {
        List<HistoricalPoint> newestFirst = jdbcTemplate.query("""
                SELECT point_date, overall_score, issue_count, fix_count, traffic_estimate
                FROM score_history FINAL
                WHERE url = ?
                ORDER BY point_date DESC
                LIMIT ?
                """, ROW_MAPPER, url, limit);

        return oldestFirst(newestFirst);
    }

    @Override
    public List<HistoricalPoint> getHistoryBefore(String url, LocalDate before, int limit) {
        List<HistoricalPoint> newestFirst = jdbcTemplate.query("""
                SELECT point_date, overall_score, issue_count, fix_count, traffic_estimate
                FROM score_history FINAL
                WHERE url = ? AND point_date < ?
                ORDER BY point_date DESC
                LIMIT ?
                """, ROW_MAPPER, url, Date.valueOf(before), limit);

        return oldestFirst(newestFirst);
    }

    @Override
    public void append(String url, HistoricalPoint point) {
        jdbcTemplate.update("""
                INSERT INTO score_history (url, point_date, overall_score, issue_count, fix_count, traffic_estimate)
                VALUES (?, ?, ?, ?, ?, ?)
                """,
                url, Date.valueOf(point.date()), point.overallScore(), point.issueCount(), point.fixCount(),
                point.trafficEstimate());
        log.debug("Appended history point for {} on {}", url, point.date());
    }

    private static List<HistoricalPoint> oldestFirst(List<HistoricalPoint> newestFirst) {
        List<HistoricalPoint> points = new ArrayList<>(newestFirst);
        Collections.reverse(points);
        return points;
    }
}

package com.histora.service.storage.impl;

import com.histora.record.model.MeasurementRecord;
import com.histora.service.core.error.BackendUnavailableException;
import com.histora.service.core.query.BackendQuery;
import com.histora.service.core.query.TimeSeriesRow;
import com.histora.service.core.spi.TimeSeriesBackend;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Stores one row per record field in {@code history_points}. Every record of a batch draws its own
 * {@code record_id} from {@code history_record_seq}, so fields of one record stay together and separate records at
 * the same instant keep their write order. Downsampled queries bucket on
 * {@code floor(epoch / step)} and average numeric values; text and boolean fields only appear in raw queries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JdbcTimeSeriesBackend implements TimeSeriesBackend {

    static final String INSERT_SQL =
            """
            INSERT INTO history_points (ts, source, measurement, field, num_value, text_value, bool_value, record_id)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

    static final String RECORD_IDS_SQL =
            "SELECT nextval('history_record_seq') FROM generate_series(1, :count) ORDER BY 1";

    private static final String SELECTOR_CLAUSE =
            "(measurement IN (:metrics) OR measurement || '/' || field IN (:metrics))";

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate txTemplate;

    @Override
    public void write(List<MeasurementRecord> batch) {
        if (batch.isEmpty()) {
            return;
        }
        List<Point> points = new ArrayList<>();
        try {
            txTemplate.execute(status -> {
                List<Long> recordIds = jdbc.queryForList(
                        RECORD_IDS_SQL, new MapSqlParameterSource("count", batch.size()), Long.class);
                if (recordIds.size() != batch.size()) {
                    throw new IllegalStateException(
                            "Expected " + batch.size() + " record ids, got " + recordIds.size());
                }
                for (int r = 0; r < batch.size(); r++) {
                    MeasurementRecord record = batch.get(r);
                    for (Map.Entry<String, Object> field : record.fields().entrySet()) {
                        points.add(new Point(recordIds.get(r), record, field.getKey(), field.getValue()));
                    }
                }
                jdbc.getJdbcOperations().batchUpdate(INSERT_SQL, new BatchPreparedStatementSetter() {
                    @Override
                    public void setValues(PreparedStatement ps, int i) throws SQLException {
                        Point point = points.get(i);
                        ps.setTimestamp(1, Timestamp.from(point.record().timestamp()));
                        ps.setString(2, point.record().source());
                        ps.setString(3, point.record().measurement());
                        ps.setString(4, point.field());
                        bindValue(ps, point.value());
                        ps.setLong(8, point.recordId());
                    }

                    @Override
                    public int getBatchSize() {
                        return points.size();
                    }
                });
                return null;
            });
        } catch (DataAccessException | TransactionException ex) {
            throw new BackendUnavailableException("Failed to write " + batch.size() + " records", ex);
        }
        log.debug("Stored {} records as {} points", batch.size(), points.size());
    }

    @Override
    public List<TimeSeriesRow> query(BackendQuery query) {
        MapSqlParameterSource params = new MapSqlParameterSource().addValue("metrics", query.metrics());
        StringBuilder where = new StringBuilder(" WHERE ").append(SELECTOR_CLAUSE);
        if (query.start() != null) {
            where.append(" AND ts >= :start");
            params.addValue("start", Timestamp.from(query.start()), Types.TIMESTAMP);
        }
        if (query.end() != null) {
            where.append(" AND ts < :end");
            params.addValue("end", Timestamp.from(query.end()), Types.TIMESTAMP);
        }

        String sql;
        if (query.step() == null) {
            sql = "SELECT record_id, source, measurement, field, ts, num_value, text_value, bool_value"
                    + " FROM history_points"
                    + where
                    + " ORDER BY ts, record_id, id";
        } else {
            params.addValue("step", query.step().toMillis() / 1000.0);
            sql = "SELECT 0 AS record_id, source, measurement, field,"
                    + " to_timestamp(floor(extract(epoch FROM ts) / :step) * :step) AS ts,"
                    + " avg(num_value) AS num_value, NULL AS text_value, NULL AS bool_value FROM history_points"
                    + where
                    + " AND num_value IS NOT NULL"
                    + " GROUP BY 2, 3, 4, 5 ORDER BY 5, 2, 3, 4";
        }
        try {
            return jdbc.query(sql, params, (rs, rowNum) -> mapRow(rs));
        } catch (DataAccessException ex) {
            throw new BackendUnavailableException("History query failed", ex);
        }
    }

    @Override
    public List<String> listMetrics(Instant since) {
        String sql =
                """
                SELECT DISTINCT measurement || '/' || field AS metric
                FROM history_points
                WHERE ts >= :since
                ORDER BY metric
                """;
        try {
            return jdbc.queryForList(
                    sql, new MapSqlParameterSource("since", Timestamp.from(since)), String.class);
        } catch (DataAccessException ex) {
            throw new BackendUnavailableException("Metric listing failed", ex);
        }
    }

    @Override
    public void ping() {
        try {
            jdbc.getJdbcOperations().queryForObject("SELECT 1", Integer.class);
        } catch (DataAccessException ex) {
            throw new BackendUnavailableException("History database is unreachable", ex);
        }
    }

    static void bindValue(PreparedStatement ps, Object value) throws SQLException {
        ps.setNull(5, Types.DOUBLE);
        ps.setNull(6, Types.VARCHAR);
        ps.setNull(7, Types.BOOLEAN);
        if (value instanceof Double d) {
            ps.setDouble(5, d);
        } else if (value instanceof String s) {
            ps.setString(6, s);
        } else if (value instanceof Boolean b) {
            ps.setBoolean(7, b);
        }
    }

    private static TimeSeriesRow mapRow(ResultSet rs) throws SQLException {
        Object value = rs.getObject("num_value");
        if (value instanceof Number n) {
            value = n.doubleValue();
        } else {
            value = rs.getString("text_value");
            if (value == null) {
                value = rs.getObject("bool_value");
            }
        }
        return new TimeSeriesRow(
                rs.getLong("record_id"),
                rs.getString("source"),
                rs.getString("measurement"),
                rs.getString("field"),
                rs.getTimestamp("ts").toInstant(),
                value);
    }

    private record Point(long recordId, MeasurementRecord record, String field, Object value) {}
}

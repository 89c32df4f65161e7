package com.flagship.iam_service.eventsourcing.recorder;

import com.flagship.iam_service.eventsourcing.model.Notification;
import com.flagship.iam_service.eventsourcing.model.StoredEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.UUID;

/**
 * Event store on the iam_event_store table, using JDBC directly.
 *
 * Key properties:
 * - Rows are only ever inserted
 * - UNIQUE (id, version) turns a concurrent write to the same aggregate
 *   version into a RecorderIntegrityException
 * - nt_id is assigned by the database and gives a total order across aggregates
 *
 * All statements join the transaction bound to the current thread, so a
 * unit of work decides when the rows become visible.
 */
@Slf4j
public class JdbcApplicationRecorder implements ApplicationRecorder {

    private static final String INSERT_EVENT =
            "INSERT INTO iam_event_store (id, version, topic, state) VALUES (?, ?, ?, ?)";

    private static final String SELECT_EVENTS =
            "SELECT id, version, topic, state FROM iam_event_store WHERE id = ? ORDER BY version ASC";

    private static final String SELECT_NOTIFICATIONS =
            "SELECT nt_id, id, version, topic, state FROM iam_event_store " +
            "WHERE nt_id >= ? ORDER BY nt_id ASC LIMIT ?";

    private static final String SELECT_MAX_NOTIFICATION_ID =
            "SELECT MAX(nt_id) FROM iam_event_store";

    private static final RowMapper<StoredEvent> STORED_EVENT_MAPPER = (rs, rowNum) -> new StoredEvent(
            rs.getObject("id", UUID.class).toString(),
            rs.getInt("version"),
            rs.getString("topic"),
            rs.getBytes("state")
    );

    private static final RowMapper<Notification> NOTIFICATION_MAPPER = (rs, rowNum) -> new Notification(
            rs.getLong("nt_id"),
            rs.getObject("id", UUID.class).toString(),
            rs.getInt("version"),
            rs.getString("topic"),
            rs.getBytes("state")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcApplicationRecorder(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void add(List<StoredEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        try {
            jdbcTemplate.batchUpdate(INSERT_EVENT, events, events.size(), (ps, event) -> {
                ps.setObject(1, UUID.fromString(event.getId()));
                ps.setInt(2, event.getVersion());
                ps.setString(3, event.getTopic());
                ps.setBytes(4, event.getState());
            });
        } catch (DataAccessException e) {
            StoredEvent first = events.get(0);
            throw new RecorderIntegrityException(
                    String.format("Failed to append %d event(s) starting at id=%s version=%d",
                            events.size(), first.getId(), first.getVersion()), e);
        }
        log.debug("Appended {} event(s) to event store", events.size());
    }

    @Override
    public List<StoredEvent> get(UUID aggregateId) {
        return jdbcTemplate.query(SELECT_EVENTS, STORED_EVENT_MAPPER, aggregateId);
    }

    @Override
    public List<Notification> selectNotifications(long start, int limit) {
        return jdbcTemplate.query(SELECT_NOTIFICATIONS, NOTIFICATION_MAPPER, start, limit);
    }

    @Override
    public long maxNotificationId() {
        Long max = jdbcTemplate.queryForObject(SELECT_MAX_NOTIFICATION_ID, Long.class);
        return max != null ? max : 0L;
    }
}

package io.github.geevly.ese.core.store.jdbc;

/*-
 * #%L
 * ese
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.geevly.ese.core.EventEnvelope;
import io.github.geevly.ese.core.store.SnapshotMetadata;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Schema with one table for events of all aggregates and one table of latest snapshots.
 *
 * <p>Event table (name configurable, e.g. {@code student_events}):</p>
 * <ul>
 *     <li>{@code id}: generated surrogate key</li>
 *     <li>{@code type}: varchar, tag of the event</li>
 *     <li>{@code data}: varbinary, serialized payload</li>
 *     <li>{@code version}: bigint</li>
 *     <li>{@code timestamp}: timestamp of issuing the event</li>
 *     <li>{@code aggregate_id}: varchar</li>
 * </ul>
 * with unique constraint on {@code (aggregate_id, version)}.
 *
 * <p>Snapshot table:</p>
 * <ul>
 *     <li>{@code aggregate_id}: varchar, primary key</li>
 *     <li>{@code version}: bigint</li>
 *     <li>{@code timestamp}: timestamp of the snapshot</li>
 *     <li>{@code data}: varbinary, exported state</li>
 * </ul>
 */
public class DefaultJdbcSchema extends JdbcSchema {

    private final String eventTable;
    private final String snapshotTable;

    public DefaultJdbcSchema(String eventTable, String snapshotTable) {
        this.eventTable = eventTable;
        this.snapshotTable = snapshotTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getSnapshotTable() {
        return snapshotTable;
    }

    @Override
    protected PreparedStatement selectLastVersion(Connection connection, String aggregateId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT MAX(version) FROM " + getEventTable()
                + " WHERE aggregate_id=?");
        st.setString(1, aggregateId);
        return st;
    }

    @Override
    protected long readLastVersion(ResultSet rs) throws SQLException {
        long version = rs.getLong(1);
        return rs.wasNull() ? -1 : version;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection, String aggregateId) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (type, data, version, timestamp, aggregate_id) VALUES (?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, EventEnvelope envelope) throws SQLException {
        insertEvent.setString(1, envelope.type());
        insertEvent.setBytes(2, envelope.payload());
        insertEvent.setLong(3, envelope.version());
        insertEvent.setTimestamp(4, Timestamp.from(envelope.timestamp()));
        insertEvent.setString(5, envelope.aggregateId());
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, String aggregateId, long afterVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT type, data, version, timestamp, aggregate_id "
                + "FROM " + getEventTable() + " WHERE aggregate_id=? AND version > ? ORDER BY version");
        st.setString(1, aggregateId);
        st.setLong(2, afterVersion);
        return st;
    }

    @Override
    protected EventEnvelope readEvent(ResultSet rs) throws SQLException {
        return EventEnvelope.builder()
                .type(rs.getString(1))
                .payload(rs.getBytes(2))
                .version(rs.getLong(3))
                .timestamp(rs.getTimestamp(4).toInstant())
                .aggregateId(rs.getString(5))
                .build();
    }

    @Override
    protected PreparedStatement selectSnapshot(Connection connection, String aggregateId) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("SELECT aggregate_id, version, timestamp, data FROM "
                + getSnapshotTable() + " WHERE aggregate_id = ?");
        ps.setString(1, aggregateId);
        return ps;
    }

    @Override
    protected PreparedStatement updateSnapshot(Connection connection, String aggregateId, long version,
            byte[] state) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("UPDATE " + getSnapshotTable()
                + " SET version=?, timestamp=?, data=? WHERE aggregate_id = ?");
        ps.setLong(1, version);
        ps.setTimestamp(2, new Timestamp(System.currentTimeMillis()));
        ps.setBytes(3, state);
        ps.setString(4, aggregateId);
        return ps;
    }

    @Override
    protected PreparedStatement insertSnapshot(Connection connection, String aggregateId, long version,
            byte[] state) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("INSERT INTO " + getSnapshotTable()
                + " (aggregate_id, version, timestamp, data) VALUES (?, ?, ?, ?)");
        ps.setString(1, aggregateId);
        ps.setLong(2, version);
        ps.setTimestamp(3, new Timestamp(System.currentTimeMillis()));
        ps.setBytes(4, state);
        return ps;
    }

    @Override
    protected SnapshotMetadata readSnapshotMetadata(ResultSet rs) throws SQLException {
        return new SnapshotMetadata.Default(rs.getString(1), Instant.ofEpochMilli(rs.getTimestamp(3).getTime()),
            rs.getLong(2));
    }

    @Override
    protected byte[] readSnapshotPayload(ResultSet rs) throws SQLException {
        return rs.getBytes(4);
    }
}

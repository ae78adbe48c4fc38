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

import io.github.geevly.ese.core.store.SnapshotMetadata;
import io.github.geevly.ese.core.store.SnapshotStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Snapshot store keeping latest snapshot of every aggregate in a table.
 */
public class JdbcSnapshotStore extends SnapshotStore {
    private final DataSource ds;
    private final JdbcSchema schema;

    public JdbcSnapshotStore(DataSource ds, JdbcSchema schema) {
        this.ds = ds;
        this.schema = schema;
    }

    @Override
    protected SnapshotRecord retrieveSnapshotRecord(String aggregateId) {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectSnapshot(connection, aggregateId);
                ResultSet rs = st.executeQuery()) {
            if (rs.next()) {
                SnapshotMetadata header = schema.readSnapshotMetadata(rs);
                return new SnapshotRecord(header, schema.readSnapshotPayload(rs));
            } else {
                return null;
            }
        } catch (SQLException se) {
            logger.error("Cannot read snapshot of {}", aggregateId, se);
        }
        return null;
    }

    @Override
    protected void storeSnapshotRecord(SnapshotRecord snapshotRecord) {
        SnapshotMetadata sm = snapshotRecord.getHeader();
        String aggregateId = sm.aggregateId();
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectSnapshot(connection, aggregateId);
                ResultSet rs = st.executeQuery();
                PreparedStatement store = rs.next()
                        ? schema.updateSnapshot(connection, aggregateId, sm.version(), snapshotRecord.getPayload())
                        : schema.insertSnapshot(connection, aggregateId, sm.version(), snapshotRecord.getPayload())) {
            int result = store.executeUpdate();
            if (result != 1) {
                throw new IllegalStateException("Snapshot update did not create/update a row for aggregate "
                        + aggregateId);
            }
        } catch (SQLException se) {
            throw new IllegalStateException("Failed to store snapshot of " + aggregateId, se);
        }
    }
}

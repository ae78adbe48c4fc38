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
import java.sql.SQLIntegrityConstraintViolationException;

/**
 * Strategy of accessing event and snapshot tables. The stores only drive the statements created here, the actual
 * names and shapes of the tables are up to the implementation.
 *
 * <p>The event table is expected to enforce uniqueness of aggregate id and version, as that is the final guard
 * against concurrent writers.</p>
 */
public abstract class JdbcSchema {
    /**
     * SQLState of unique constraint violation.
     */
    public static final String UNIQUE_VIOLATION = "23505";

    protected abstract PreparedStatement selectLastVersion(Connection connection, String aggregateId)
            throws SQLException;

    /**
     * Read the result of {@link #selectLastVersion(Connection, String)} positioned on its row.
     * @param rs result set
     * @return last stored version, {@code -1} if aggregate has no events
     * @throws SQLException on access error
     */
    protected abstract long readLastVersion(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection, String aggregateId) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, EventEnvelope envelope) throws SQLException;

    protected abstract PreparedStatement selectEvents(Connection connection, String aggregateId, long afterVersion)
            throws SQLException;

    protected abstract EventEnvelope readEvent(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement selectSnapshot(Connection connection, String aggregateId)
            throws SQLException;

    protected abstract PreparedStatement updateSnapshot(Connection connection, String aggregateId, long version,
            byte[] state) throws SQLException;

    protected abstract PreparedStatement insertSnapshot(Connection connection, String aggregateId, long version,
            byte[] state) throws SQLException;

    protected abstract SnapshotMetadata readSnapshotMetadata(ResultSet rs) throws SQLException;

    protected abstract byte[] readSnapshotPayload(ResultSet rs) throws SQLException;

    /**
     * Decide whether failure of insert was caused by another writer storing the same version first.
     * @param e exception of insert statement
     * @return true when the exception is a unique constraint violation
     */
    protected boolean isDuplicateVersion(SQLException e) {
        for (SQLException ex = e; ex != null; ex = ex.getNextException()) {
            if (ex instanceof SQLIntegrityConstraintViolationException || UNIQUE_VIOLATION.equals(ex.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}

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
import io.github.geevly.ese.core.store.EventStore;
import io.github.geevly.ese.core.store.EventStoreException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Event store appending into relational table. Version is checked early by reading the last stored version, and
 * concurrent writers that pass the check at the same time are stopped by unique constraint on aggregate id and
 * version.
 */
public class JdbcEventStore implements EventStore {
    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final TxHandler txHandler;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema) {
        this(dataSource, schema, CONTAINER_HANDLER);
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, TxHandler handler) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.txHandler = handler;
    }

    @Override
    public void appendIfVersion(String aggregateId, long expectedVersion, EventEnvelope envelope)
            throws EventStoreException {
        EventStore.checkAppendable(aggregateId, expectedVersion, envelope);
        createTemplate(aggregateId, expectedVersion, envelope).persist();
    }

    protected PersistTemplate createTemplate(String aggregateId, long expectedVersion, EventEnvelope envelope) {
        return new PersistTemplate(aggregateId, expectedVersion, envelope);
    }

    protected class PersistTemplate {
        private final String aggregateId;
        private final long expectedVersion;
        private final EventEnvelope envelope;

        protected PersistTemplate(String aggregateId, long expectedVersion, EventEnvelope envelope) {
            this.aggregateId = aggregateId;
            this.expectedVersion = expectedVersion;
            this.envelope = envelope;
        }

        public void persist() throws EventStoreException {
            try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
                try {
                    checkSourceVersion(connection);
                    storeEvent(connection);
                    txHandler.commit(connection);
                } catch (SQLException | EventStoreException | RuntimeException e) {
                    txHandler.rollback(connection);
                    throw e;
                }
            } catch (SQLException ex) {
                if (schema.isDuplicateVersion(ex)) {
                    throw EventStoreException.concurrentAppend(aggregateId, envelope.version(), ex);
                }
                throw EventStoreException.storeFailed(aggregateId, ex);
            }
        }

        private void storeEvent(Connection connection) throws SQLException {
            try (PreparedStatement insertEvent = schema.insertEvent(connection, aggregateId)) {
                schema.prepareInsert(insertEvent, envelope);
                insertEvent.executeUpdate();
            }
        }

        private void checkSourceVersion(Connection connection) throws SQLException, EventStoreException {
            try (PreparedStatement selectVersion = schema.selectLastVersion(connection, aggregateId);
                    ResultSet rs = selectVersion.executeQuery()) {
                long version = rs.next() ? schema.readLastVersion(rs) : -1;
                if (version != expectedVersion) {
                    throw EventStoreException.optimisticLock(aggregateId, version, expectedVersion);
                }
            }
        }
    }

    /**
     * Transaction demarcation around single append.
     */
    public interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;
    }

    /**
     * Handler for connections, whose transactions are managed elsewhere, or that are in auto-commit mode.
     */
    public static final TxHandler CONTAINER_HANDLER = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) {
            return connection;
        }

        @Override
        public void commit(Connection connection) {
        }

        @Override
        public void rollback(Connection connection) {
        }
    };

    /**
     * Handler committing every append in its own local transaction.
     */
    public static final TxHandler LOCAL_HANDLER = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
            return connection;
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            connection.commit();
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            connection.rollback();
        }
    };
}

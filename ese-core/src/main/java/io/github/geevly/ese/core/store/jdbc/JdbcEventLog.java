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

import io.github.geevly.ese.core.store.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Event log reading from relational table. The events are streamed from open result set, therefore the returned
 * {@link StoredEvents} must be closed.
 */
public class JdbcEventLog implements EventLog {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventLog.class);

    private final DataSource ds;
    private final JdbcSchema schema;

    public JdbcEventLog(DataSource ds, JdbcSchema schema) {
        this.ds = ds;
        this.schema = schema;
    }

    @Override
    public StoredEvents readEvents(String aggregateId, long afterVersion) {
        try {
            return new JdbcStoredEvents(aggregateId, afterVersion);
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot access storage", e);
        }
    }

    @Override
    public long currentVersion(String aggregateId) {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectLastVersion(connection, aggregateId);
                ResultSet rs = st.executeQuery()) {
            return rs.next() ? schema.readLastVersion(rs) : -1;
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot read version of " + aggregateId, e);
        }
    }

    class JdbcStoredEvents implements StoredEvents {
        private final String aggregateId;
        private Connection connection;
        private PreparedStatement statement;
        private ResultSet resultSet;
        private boolean iterating;
        private boolean stop;

        JdbcStoredEvents(String aggregateId, long afterVersion) throws SQLException {
            this.aggregateId = aggregateId;
            try {
                connection = ds.getConnection();
                statement = schema.selectEvents(connection, aggregateId, afterVersion);
                resultSet = statement.executeQuery();
            } catch (SQLException e) {
                close();
                throw e;
            }
        }

        @Override
        public <X extends Exception> void foreach(EventConsumer<X> consumer) throws X {
            if (iterating) {
                throw new IllegalStateException("Iteration has already been done");
            }
            iterating = true;
            try {
                while (!stop && resultSet.next()) {
                    consumer.accept(schema.readEvent(resultSet));
                }
            } catch (SQLException e) {
                throw new IllegalStateException("Cannot read events of " + aggregateId, e);
            }
        }

        @Override
        public void stop() {
            stop = true;
        }

        @Override
        public void close() {
            cleanup(resultSet);
            cleanup(statement);
            cleanup(connection);
        }

        protected void cleanup(AutoCloseable resource) {
            if (resource != null) {
                try {
                    resource.close();
                } catch (Exception e) {
                    logger.warn("Suppressing cleanup exception", e);
                }
            }
        }
    }
}

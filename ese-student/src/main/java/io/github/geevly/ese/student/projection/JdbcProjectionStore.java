package io.github.geevly.ese.student.projection;

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

import io.github.geevly.ese.core.projection.ProjectionException;
import io.github.geevly.ese.core.store.jdbc.JdbcSchema;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Read model in relational tables.
 *
 * <p>Row table (default {@code student_projections}): {@code id} primary key, {@code first_name},
 * {@code last_name}, {@code date_of_birth}, {@code school_id}, {@code date_of_enrollment}, {@code lookup_code},
 * {@code version}, {@code active}, {@code updated_at}.</p>
 *
 * <p>Code table (default {@code student_codes}): {@code code} primary key, {@code student_id}.</p>
 */
public class JdbcProjectionStore implements ProjectionStore {
    private static final String COLUMNS = "first_name, last_name, date_of_birth, school_id, date_of_enrollment, "
            + "lookup_code, version, active, updated_at, id";

    private final DataSource ds;
    private final String projectionTable;
    private final String codeTable;

    public JdbcProjectionStore(DataSource ds) {
        this(ds, "student_projections", "student_codes");
    }

    public JdbcProjectionStore(DataSource ds, String projectionTable, String codeTable) {
        this.ds = ds;
        this.projectionTable = projectionTable;
        this.codeTable = codeTable;
    }

    @Override
    public boolean upsert(StudentProjection row) throws ProjectionException {
        try (Connection connection = ds.getConnection()) {
            if (update(connection, row, true)) {
                return true;
            }
            if (exists(connection, row.id())) {
                return false;
            }
            try {
                insert(connection, row);
                return true;
            } catch (SQLException e) {
                if (isDuplicate(e)) {
                    // inserted concurrently
                    return update(connection, row, true);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new ProjectionException(row.id(), "Cannot store row", e);
        }
    }

    @Override
    public void replace(StudentProjection row) throws ProjectionException {
        try (Connection connection = ds.getConnection()) {
            if (!update(connection, row, false)) {
                insert(connection, row);
            }
        } catch (SQLException e) {
            throw new ProjectionException(row.id(), "Cannot store row", e);
        }
    }

    @Override
    public Optional<StudentProjection> find(String studentId) throws ProjectionException {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = connection.prepareStatement("SELECT " + COLUMNS + " FROM "
                        + projectionTable + " WHERE id = ?")) {
            st.setString(1, studentId);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next() ? Optional.of(readRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new ProjectionException(studentId, "Cannot read row", e);
        }
    }

    @Override
    public void assignCode(String code, String studentId) throws ProjectionException {
        try (Connection connection = ds.getConnection()) {
            Optional<String> existing = selectCode(connection, code);
            checkOwner(code, studentId, existing);
            try (PreparedStatement st = connection.prepareStatement("DELETE FROM " + codeTable
                    + " WHERE student_id = ? AND code <> ?")) {
                st.setString(1, studentId);
                st.setString(2, code);
                st.executeUpdate();
            }
            if (!existing.isPresent()) {
                try (PreparedStatement st = connection.prepareStatement("INSERT INTO " + codeTable
                        + " (code, student_id) VALUES (?, ?)")) {
                    st.setString(1, code);
                    st.setString(2, studentId);
                    st.executeUpdate();
                } catch (SQLException e) {
                    if (!isDuplicate(e)) {
                        throw e;
                    }
                    checkOwner(code, studentId, selectCode(connection, code));
                }
            }
        } catch (SQLException e) {
            throw new ProjectionException(studentId, "Cannot store code " + code, e);
        }
    }

    @Override
    public void releaseCodes(String studentId) throws ProjectionException {
        try (Connection connection = ds.getConnection();
                PreparedStatement st = connection.prepareStatement("DELETE FROM " + codeTable
                        + " WHERE student_id = ?")) {
            st.setString(1, studentId);
            st.executeUpdate();
        } catch (SQLException e) {
            throw new ProjectionException(studentId, "Cannot release codes", e);
        }
    }

    private static void checkOwner(String code, String studentId, Optional<String> owner) throws ProjectionException {
        if (owner.isPresent() && !owner.get().equals(studentId)) {
            throw new ProjectionException(studentId, "Code " + code + " is already assigned to student "
                    + owner.get());
        }
    }

    @Override
    public Optional<String> findStudentByCode(String code) throws ProjectionException {
        try (Connection connection = ds.getConnection()) {
            return selectCode(connection, code);
        } catch (SQLException e) {
            throw new ProjectionException(code, "Cannot read code", e);
        }
    }

    private Optional<String> selectCode(Connection connection, String code) throws SQLException {
        try (PreparedStatement st = connection.prepareStatement("SELECT student_id FROM " + codeTable
                + " WHERE code = ?")) {
            st.setString(1, code);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        }
    }

    private boolean update(Connection connection, StudentProjection row, boolean onlyNewer) throws SQLException {
        String sql = "UPDATE " + projectionTable + " SET first_name=?, last_name=?, date_of_birth=?, school_id=?, "
                + "date_of_enrollment=?, lookup_code=?, version=?, active=?, updated_at=? WHERE id=?"
                + (onlyNewer ? " AND version < ?" : "");
        try (PreparedStatement st = connection.prepareStatement(sql)) {
            bindRow(st, row);
            if (onlyNewer) {
                st.setLong(11, row.version());
            }
            return st.executeUpdate() == 1;
        }
    }

    private void insert(Connection connection, StudentProjection row) throws SQLException {
        try (PreparedStatement st = connection.prepareStatement("INSERT INTO " + projectionTable + " (" + COLUMNS
                + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            bindRow(st, row);
            st.executeUpdate();
        }
    }

    private boolean exists(Connection connection, String studentId) throws SQLException {
        try (PreparedStatement st = connection.prepareStatement("SELECT 1 FROM " + projectionTable
                + " WHERE id = ?")) {
            st.setString(1, studentId);
            try (ResultSet rs = st.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static void bindRow(PreparedStatement st, StudentProjection row) throws SQLException {
        st.setString(1, row.firstName());
        st.setString(2, row.lastName());
        st.setObject(3, row.dateOfBirth());
        setOptionalString(st, 4, row.schoolId());
        if (row.dateOfEnrollment().isPresent()) {
            st.setObject(5, row.dateOfEnrollment().get());
        } else {
            st.setNull(5, Types.DATE);
        }
        setOptionalString(st, 6, row.lookupCode());
        st.setLong(7, row.version());
        st.setBoolean(8, row.active());
        st.setTimestamp(9, Timestamp.from(row.updatedAt()));
        st.setString(10, row.id());
    }

    private static void setOptionalString(PreparedStatement st, int index, Optional<String> value)
            throws SQLException {
        if (value.isPresent()) {
            st.setString(index, value.get());
        } else {
            st.setNull(index, Types.VARCHAR);
        }
    }

    private static StudentProjection readRow(ResultSet rs) throws SQLException {
        return ImmutableStudentProjection.builder()
                .firstName(rs.getString(1))
                .lastName(rs.getString(2))
                .dateOfBirth(rs.getObject(3, LocalDate.class))
                .schoolId(Optional.ofNullable(rs.getString(4)))
                .dateOfEnrollment(Optional.ofNullable(rs.getObject(5, LocalDate.class)))
                .lookupCode(Optional.ofNullable(rs.getString(6)))
                .version(rs.getLong(7))
                .active(rs.getBoolean(8))
                .updatedAt(rs.getTimestamp(9).toInstant())
                .id(rs.getString(10))
                .build();
    }

    private static boolean isDuplicate(SQLException e) {
        return e instanceof SQLIntegrityConstraintViolationException
                || JdbcSchema.UNIQUE_VIOLATION.equals(e.getSQLState());
    }
}

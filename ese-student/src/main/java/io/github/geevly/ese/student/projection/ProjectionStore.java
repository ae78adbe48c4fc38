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

import java.util.Optional;

/**
 * Storage of student read model: rows of students and index of lookup codes.
 */
public interface ProjectionStore {
    /**
     * Insert or overwrite the row, unless stored row is of the same or newer version.
     * @param row the row
     * @return true if row was written
     * @throws ProjectionException when storing fails
     */
    boolean upsert(StudentProjection row) throws ProjectionException;

    /**
     * Insert or overwrite the row regardless of version of stored row.
     * @param row the row
     * @throws ProjectionException when storing fails
     */
    void replace(StudentProjection row) throws ProjectionException;

    Optional<StudentProjection> find(String studentId) throws ProjectionException;

    /**
     * Map a lookup code to a student. Other codes mapped to the student are released, storing the same mapping again
     * has no effect. When the code belongs to another student, nothing is changed.
     * @param code the code
     * @param studentId id of the student
     * @throws ProjectionException when code is mapped to another student, or storing fails
     */
    void assignCode(String code, String studentId) throws ProjectionException;

    /**
     * Remove all codes mapped to a student.
     * @param studentId id of the student
     * @throws ProjectionException when storing fails
     */
    void releaseCodes(String studentId) throws ProjectionException;

    Optional<String> findStudentByCode(String code) throws ProjectionException;
}

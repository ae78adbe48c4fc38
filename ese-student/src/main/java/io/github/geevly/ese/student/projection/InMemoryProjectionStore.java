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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryProjectionStore implements ProjectionStore {
    private final ConcurrentMap<String, StudentProjection> rows = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> codes = new ConcurrentHashMap<>();

    @Override
    public boolean upsert(StudentProjection row) {
        StudentProjection stored = rows.merge(row.id(), row,
            (existing, update) -> update.version() > existing.version() ? update : existing);
        return stored == row;
    }

    @Override
    public void replace(StudentProjection row) {
        rows.put(row.id(), row);
    }

    @Override
    public Optional<StudentProjection> find(String studentId) {
        return Optional.ofNullable(rows.get(studentId));
    }

    @Override
    public synchronized void assignCode(String code, String studentId) throws ProjectionException {
        String existing = codes.get(code);
        if (existing != null && !existing.equals(studentId)) {
            throw new ProjectionException(studentId, "Code " + code + " is already assigned to student " + existing);
        }
        codes.entrySet().removeIf(e -> e.getValue().equals(studentId) && !e.getKey().equals(code));
        codes.put(code, studentId);
    }

    @Override
    public synchronized void releaseCodes(String studentId) {
        codes.values().removeIf(studentId::equals);
    }

    @Override
    public synchronized Optional<String> findStudentByCode(String code) {
        return Optional.ofNullable(codes.get(code));
    }
}

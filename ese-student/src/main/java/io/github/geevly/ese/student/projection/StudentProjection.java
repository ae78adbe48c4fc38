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

import io.github.geevly.ese.student.Student;
import io.github.geevly.ese.student.StudentState;
import org.immutables.value.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Denormalized row of a student in the read model.
 */
@Value.Immutable
public interface StudentProjection {
    String id();

    String firstName();

    String lastName();

    LocalDate dateOfBirth();

    Optional<String> schoolId();

    Optional<LocalDate> dateOfEnrollment();

    Optional<String> lookupCode();

    long version();

    boolean active();

    Instant updatedAt();

    /**
     * Row reflecting current state of a student.
     * @param student created student
     * @param updatedAt the time of projection
     * @return the row
     * @throws IllegalArgumentException when the student has not been created
     */
    static StudentProjection of(Student student, Instant updatedAt) {
        StudentState state = student.getState().orElseThrow(
            () -> new IllegalArgumentException("Student " + student.getIdentity() + " does not exist"));
        return ImmutableStudentProjection.builder()
                .id(student.getIdentity())
                .firstName(state.firstName())
                .lastName(state.lastName())
                .dateOfBirth(state.dateOfBirth())
                .schoolId(state.schoolId())
                .dateOfEnrollment(state.dateOfEnrollment())
                .lookupCode(state.lookupCode())
                .version(student.getStateVersion())
                .active(state.isActive())
                .updatedAt(updatedAt)
                .build();
    }
}

package io.github.geevly.ese.student;

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

import io.github.geevly.ese.core.EventRegistry;
import io.github.geevly.ese.core.InvariantViolationException;
import io.github.geevly.ese.core.store.JacksonSerialization;
import io.github.geevly.ese.core.store.Serialization;
import io.github.geevly.ese.student.event.AddStudentEvent;
import io.github.geevly.ese.student.event.EnrollStudentEvent;
import io.github.geevly.ese.student.event.SetLookupCodeEvent;
import io.github.geevly.ese.student.event.SetStudentStatusEvent;
import io.github.geevly.ese.student.event.UnenrollStudentEvent;
import io.github.geevly.ese.student.event.UpdateStudentEvent;

import java.util.Optional;

/**
 * Event table of students and the handlers computing student state.
 */
public final class StudentEvents {
    public static final EventRegistry<StudentEventType, StudentState> REGISTRY = EventRegistry
            .builder(StudentEventType.class, StudentState.class)
            .on(StudentEventType.ADD_STUDENT, AddStudentEvent.class, StudentEvents::created)
            .on(StudentEventType.SET_STUDENT_STATUS, SetStudentStatusEvent.class, StudentEvents::statusSet)
            .on(StudentEventType.UPDATE_STUDENT, UpdateStudentEvent.class, StudentEvents::updated)
            .on(StudentEventType.ENROLL_STUDENT, EnrollStudentEvent.class, StudentEvents::enrolled)
            .on(StudentEventType.UNENROLL_STUDENT, UnenrollStudentEvent.class, StudentEvents::unenrolled)
            .on(StudentEventType.SET_LOOKUP_CODE, SetLookupCodeEvent.class, StudentEvents::lookupCodeSet)
            .build();

    public static final Serialization<StudentState> STATE_SERIALIZATION =
            JacksonSerialization.forType(StudentState.class);

    private StudentEvents() {
    }

    static StudentState created(StudentState state, AddStudentEvent event) throws InvariantViolationException {
        if (state != null) {
            throw InvariantViolationException.alreadyExists("Student");
        }
        return StudentState.builder()
                .firstName(event.firstName())
                .lastName(event.lastName())
                .dateOfBirth(event.dateOfBirth())
                .schoolId(event.schoolId())
                .dateOfEnrollment(event.dateOfEnrollment())
                .status(StudentStatus.ACTIVE)
                .build();
    }

    static StudentState statusSet(StudentState state, SetStudentStatusEvent event)
            throws InvariantViolationException {
        return ImmutableStudentState.copyOf(existing(state)).withStatus(event.status());
    }

    static StudentState updated(StudentState state, UpdateStudentEvent event) throws InvariantViolationException {
        return ImmutableStudentState.copyOf(existing(state))
                .withFirstName(event.firstName())
                .withLastName(event.lastName())
                .withDateOfBirth(event.dateOfBirth())
                .withSchoolId(event.schoolId())
                .withDateOfEnrollment(event.dateOfEnrollment());
    }

    static StudentState enrolled(StudentState state, EnrollStudentEvent event) throws InvariantViolationException {
        return ImmutableStudentState.copyOf(existing(state))
                .withSchoolId(event.schoolId())
                .withDateOfEnrollment(event.dateOfEnrollment())
                .withDateOfUnenrollment(Optional.empty());
    }

    static StudentState unenrolled(StudentState state, UnenrollStudentEvent event)
            throws InvariantViolationException {
        return StudentState.builder()
                .from(existing(state))
                .schoolId(Optional.empty())
                .dateOfEnrollment(Optional.empty())
                .dateOfUnenrollment(event.dateOfUnenrollment())
                .build();
    }

    static StudentState lookupCodeSet(StudentState state, SetLookupCodeEvent event)
            throws InvariantViolationException {
        StudentState current = existing(state);
        if (event.code().trim().isEmpty()) {
            throw InvariantViolationException.invalidValue("Lookup code cannot be blank");
        }
        return ImmutableStudentState.copyOf(current).withLookupCode(event.code());
    }

    private static StudentState existing(StudentState state) throws InvariantViolationException {
        if (state == null) {
            throw InvariantViolationException.notFound("Student");
        }
        return state;
    }
}

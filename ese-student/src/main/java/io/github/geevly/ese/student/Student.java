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

import io.github.geevly.ese.core.AggregateRoot;
import io.github.geevly.ese.core.ApplyException;
import io.github.geevly.ese.core.EventEnvelope;
import io.github.geevly.ese.core.store.EventStore;
import io.github.geevly.ese.core.store.EventStoreException;
import io.github.geevly.ese.student.event.AddStudentEvent;
import io.github.geevly.ese.student.event.EnrollStudentEvent;
import io.github.geevly.ese.student.event.SetLookupCodeEvent;
import io.github.geevly.ese.student.event.SetStudentStatusEvent;
import io.github.geevly.ese.student.event.UnenrollStudentEvent;
import io.github.geevly.ese.student.event.UpdateStudentEvent;

import java.time.LocalDate;

/**
 * Student aggregate.
 *
 * <p>Every command takes the version the caller has observed, and fails with version conflict if the student has
 * changed in the meantime. The student is created by the event at version {@code 0}.</p>
 */
public class Student extends AggregateRoot<StudentEventType, StudentState> {

    public Student(String id, EventStore store) {
        super(id, StudentEvents.REGISTRY, StudentEvents.STATE_SERIALIZATION, store);
    }

    /**
     * Create new student. Creating a student this instance already knows is rejected by the handler, a student
     * created by another writer in the meantime is a version conflict.
     * @param event initial data of the student
     * @return the creation event
     * @throws ApplyException when student already exists
     * @throws EventStoreException when another writer has created the student first or storing fails
     */
    public EventEnvelope create(AddStudentEvent event) throws ApplyException, EventStoreException {
        return issue(StudentEventType.ADD_STUDENT, event, getStateVersion());
    }

    public EventEnvelope setStatus(StudentStatus status, long expectedVersion)
            throws ApplyException, EventStoreException {
        return issue(StudentEventType.SET_STUDENT_STATUS, SetStudentStatusEvent.of(status), expectedVersion);
    }

    public EventEnvelope update(UpdateStudentEvent event, long expectedVersion)
            throws ApplyException, EventStoreException {
        return issue(StudentEventType.UPDATE_STUDENT, event, expectedVersion);
    }

    public EventEnvelope enroll(String schoolId, LocalDate dateOfEnrollment, long expectedVersion)
            throws ApplyException, EventStoreException {
        return issue(StudentEventType.ENROLL_STUDENT, EnrollStudentEvent.of(schoolId, dateOfEnrollment),
            expectedVersion);
    }

    public EventEnvelope unenroll(LocalDate dateOfUnenrollment, long expectedVersion)
            throws ApplyException, EventStoreException {
        return issue(StudentEventType.UNENROLL_STUDENT, UnenrollStudentEvent.of(dateOfUnenrollment),
            expectedVersion);
    }

    /**
     * Assign lookup code to the student.
     * @param code non-blank code
     * @param expectedVersion version caller has observed
     * @return the stored event
     * @throws ApplyException when student does not exist or code is blank
     * @throws EventStoreException on version conflict or failure to store
     */
    public EventEnvelope setLookupCode(String code, long expectedVersion) throws ApplyException, EventStoreException {
        return issue(StudentEventType.SET_LOOKUP_CODE, SetLookupCodeEvent.of(code), expectedVersion);
    }
}

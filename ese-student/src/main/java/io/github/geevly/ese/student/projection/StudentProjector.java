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

import io.github.geevly.ese.core.ApplyException;
import io.github.geevly.ese.core.projection.ProjectionException;
import io.github.geevly.ese.core.projection.ProjectionRouter;
import io.github.geevly.ese.student.Student;
import io.github.geevly.ese.student.StudentEventType;
import io.github.geevly.ese.student.StudentRepository;
import io.github.geevly.ese.student.StudentState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;

/**
 * Maintains student read model. Events are not read by the projector, on every event it loads current state of the
 * student from the repository and overwrites the whole row.
 */
public class StudentProjector {
    private static final Logger logger = LoggerFactory.getLogger(StudentProjector.class);

    private final StudentRepository repository;
    private final ProjectionStore store;
    private final Clock clock;

    public StudentProjector(StudentRepository repository, ProjectionStore store) {
        this(repository, store, Clock.systemUTC());
    }

    public StudentProjector(StudentRepository repository, ProjectionStore store, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "Repository must be specified");
        this.store = Objects.requireNonNull(store, "Projection store must be specified");
        this.clock = Objects.requireNonNull(clock, "Clock must be specified");
    }

    /**
     * Router invoking this projector for every student event.
     * @return new router
     */
    public ProjectionRouter<StudentEventType> router() {
        return ProjectionRouter.builder(StudentEventType.class)
                .on(StudentEventType.ADD_STUDENT, this::refresh)
                .on(StudentEventType.UPDATE_STUDENT, this::refresh)
                .on(StudentEventType.ENROLL_STUDENT, this::refresh)
                .on(StudentEventType.UNENROLL_STUDENT, this::refresh)
                .on(StudentEventType.SET_STUDENT_STATUS, this::refresh)
                .on(StudentEventType.SET_LOOKUP_CODE, this::indexLookupCode)
                .build();
    }

    /**
     * Bring the row of a student up to date.
     * @param studentId id of the student
     * @param kind the event that triggered the update
     * @throws ProjectionException when student cannot be loaded or row stored
     */
    public void refresh(String studentId, StudentEventType kind) throws ProjectionException {
        Student student = load(studentId);
        if (store.upsert(StudentProjection.of(student, clock.instant()))) {
            logger.debug("Projected {} of student {} at version {}", kind, studentId, student.getStateVersion());
        } else {
            logger.debug("Row of student {} is already at version {}", studentId, student.getStateVersion());
        }
    }

    /**
     * Add lookup code of a student to the code index, releasing the code it had before, and bring the row up to date.
     * @param studentId id of the student
     * @param kind the event that triggered the update
     * @throws ProjectionException when student has no lookup code, the code belongs to another student or storing
     *         failed
     */
    public void indexLookupCode(String studentId, StudentEventType kind) throws ProjectionException {
        Student student = load(studentId);
        String code = student.getState().flatMap(StudentState::lookupCode).orElse("");
        if (code.isEmpty()) {
            throw new ProjectionException(studentId, "Lookup code is empty");
        }
        store.assignCode(code, studentId);
        store.upsert(StudentProjection.of(student, clock.instant()));
    }

    /**
     * Recompute the row of a student from its events, overwriting whatever is stored. The code index is brought in
     * line with current lookup code as well.
     * @param studentId id of the student
     * @throws ProjectionException when student cannot be loaded or row stored
     */
    public void rebuild(String studentId) throws ProjectionException {
        Student student = load(studentId);
        StudentProjection row = StudentProjection.of(student, clock.instant());
        if (row.lookupCode().isPresent()) {
            store.assignCode(row.lookupCode().get(), studentId);
        } else {
            store.releaseCodes(studentId);
        }
        store.replace(row);
        logger.info("Rebuilt projection of student {} at version {}", studentId, student.getStateVersion());
    }

    private Student load(String studentId) throws ProjectionException {
        Student student;
        try {
            student = repository.load(studentId);
        } catch (ApplyException e) {
            throw new ProjectionException(studentId, "Cannot load student", e);
        }
        if (!student.isCreated()) {
            throw new ProjectionException(studentId, "Student does not exist");
        }
        return student;
    }
}

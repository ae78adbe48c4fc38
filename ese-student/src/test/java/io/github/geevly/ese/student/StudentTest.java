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
import io.github.geevly.ese.core.InvariantViolationException;
import io.github.geevly.ese.core.store.EventLog;
import io.github.geevly.ese.core.store.EventStoreException;
import io.github.geevly.ese.core.store.inmemory.InMemoryEventStore;
import io.github.geevly.ese.student.event.AddStudentEvent;
import io.github.geevly.ese.student.event.UpdateStudentEvent;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class StudentTest {
    static final LocalDate BIRTH = LocalDate.of(2010, 5, 1);

    @Rule
    public TestName testName = new TestName();
    private InMemoryEventStore store;

    @Before
    public void setUp() {
        store = new InMemoryEventStore();
    }

    static AddStudentEvent ana() {
        return AddStudentEvent.builder()
                .firstName("Ana")
                .lastName("Novak")
                .dateOfBirth(BIRTH)
                .schoolId("S1")
                .build();
    }

    private Student student() {
        return new Student(testName.getMethodName(), store);
    }

    private List<EventEnvelope> history() {
        List<EventEnvelope> result = new ArrayList<>();
        try (EventLog.StoredEvents events = store.readEvents(testName.getMethodName(), AggregateRoot.NO_VERSION)) {
            events.foreach(result::add);
        }
        return result;
    }

    private static InvariantViolationException.Reason reason(ApplyException e) {
        return ((InvariantViolationException) e.getCause()).getReason();
    }

    @Test
    public void create_then_deactivate_and_replay_out_of_order() throws Exception {
        Student student = student();
        EventEnvelope created = student.create(ana());
        assertEquals(0, created.version());
        assertEquals("AddStudent", created.type());
        assertEquals("Ana", student.getState().get().firstName());
        assertEquals(0, student.getStateVersion());

        EventEnvelope deactivated = student.setStatus(StudentStatus.INACTIVE, 0);
        assertEquals(1, deactivated.version());
        assertEquals(1, student.getStateVersion());
        assertEquals(StudentStatus.INACTIVE, student.getState().get().status());
        assertFalse(student.getState().get().isActive());

        Student replayed = student();
        try {
            replayed.apply(deactivated);
            fail("should have failed");
        } catch (ApplyException e) {
            assertTrue(e.isInvariantViolation());
            assertEquals("SetStudentStatus", e.getEventType());
        }
        assertFalse(replayed.isCreated());
    }

    @Test
    public void created_student_is_active_and_enrolled() throws Exception {
        Student student = student();
        student.create(ana());
        StudentState state = student.getState().get();
        assertTrue(state.isActive());
        assertEquals("S1", state.schoolId().get());
        assertEquals(BIRTH, state.dateOfBirth());
        assertFalse(state.lookupCode().isPresent());
    }

    @Test
    public void missing_student_cannot_change() {
        Student student = student();
        try {
            student.setStatus(StudentStatus.ACTIVE, AggregateRoot.NO_VERSION);
            fail("should have failed");
        } catch (ApplyException e) {
            assertEquals(InvariantViolationException.Reason.NOT_FOUND, reason(e));
        } catch (EventStoreException e) {
            fail("unexpected " + e);
        }
        assertTrue(history().isEmpty());
    }

    @Test
    public void student_cannot_be_created_twice() throws Exception {
        Student student = student();
        student.create(ana());
        try {
            student.create(ana());
            fail("should have failed");
        } catch (ApplyException e) {
            assertEquals(InvariantViolationException.Reason.ALREADY_EXISTS, reason(e));
            assertEquals("AddStudent", e.getEventType());
        }
        assertEquals(0, student.getStateVersion());
        assertEquals(1, history().size());
    }

    @Test
    public void loaded_student_cannot_be_created_again() throws Exception {
        student().create(ana());
        Student loaded = student();
        for (EventEnvelope envelope : history()) {
            loaded.apply(envelope);
        }
        try {
            loaded.create(ana());
            fail("should have failed");
        } catch (ApplyException e) {
            assertEquals(InvariantViolationException.Reason.ALREADY_EXISTS, reason(e));
        }
        assertEquals(1, history().size());
    }

    @Test
    public void concurrent_creation_is_a_version_conflict() throws Exception {
        Student first = student();
        Student second = student();
        first.create(ana());
        try {
            second.create(ana());
            fail("should have failed");
        } catch (EventStoreException e) {
            assertTrue(e.isVersionConflict());
        }
        assertFalse(second.isCreated());
        assertEquals(1, history().size());
    }

    @Test
    public void update_overwrites_personal_data() throws Exception {
        Student student = student();
        student.create(ana());
        student.update(UpdateStudentEvent.builder()
                .firstName("Anna")
                .lastName("Horvat")
                .dateOfBirth(BIRTH.plusDays(1))
                .build(), 0);
        StudentState state = student.getState().get();
        assertEquals("Anna", state.firstName());
        assertEquals("Horvat", state.lastName());
        assertEquals(BIRTH.plusDays(1), state.dateOfBirth());
        assertFalse(state.schoolId().isPresent());
        assertTrue(state.isActive());
    }

    @Test
    public void enroll_and_unenroll() throws Exception {
        Student student = student();
        student.create(ana());
        LocalDate enrolled = LocalDate.of(2024, 9, 1);
        student.enroll("S2", enrolled, 0);
        assertEquals("S2", student.getState().get().schoolId().get());
        assertEquals(enrolled, student.getState().get().dateOfEnrollment().get());

        student.unenroll(LocalDate.of(2025, 6, 30), 1);
        assertFalse(student.getState().get().schoolId().isPresent());
        assertFalse(student.getState().get().dateOfEnrollment().isPresent());
        assertEquals(LocalDate.of(2025, 6, 30), student.getState().get().dateOfUnenrollment().get());
        assertEquals("Ana", student.getState().get().firstName());

        student.enroll("S3", LocalDate.of(2025, 9, 1), 2);
        assertEquals("S3", student.getState().get().schoolId().get());
        assertFalse(student.getState().get().dateOfUnenrollment().isPresent());
    }

    @Test
    public void lookup_code_is_set() throws Exception {
        Student student = student();
        student.create(ana());
        student.setLookupCode("ANA-42", 0);
        assertEquals("ANA-42", student.getState().get().lookupCode().get());
    }

    @Test
    public void blank_lookup_code_is_rejected() throws Exception {
        Student student = student();
        student.create(ana());
        try {
            student.setLookupCode("  ", 0);
            fail("should have failed");
        } catch (ApplyException e) {
            assertEquals(InvariantViolationException.Reason.INVALID_VALUE, reason(e));
        }
        assertEquals(0, student.getStateVersion());
        assertEquals(1, history().size());
    }

    @Test
    public void replay_reproduces_state() throws Exception {
        Student student = student();
        student.create(ana());
        student.setStatus(StudentStatus.INACTIVE, 0);
        student.enroll("S3", LocalDate.of(2024, 9, 1), 1);
        student.setLookupCode("CODE", 2);
        student.setStatus(StudentStatus.ACTIVE, 3);

        Student replayed = student();
        for (EventEnvelope envelope : history()) {
            replayed.apply(envelope);
        }
        assertEquals(student.getState().get(), replayed.getState().get());
        assertEquals(4, replayed.getStateVersion());
    }

    @Test
    public void snapshot_is_json_with_iso_dates() throws Exception {
        Student student = student();
        student.create(ana());
        String json = new String(student.exportState(), StandardCharsets.UTF_8);
        assertThat(json, containsString("\"dateOfBirth\":\"2010-05-01\""));
        assertThat(json, containsString("\"status\":\"ACTIVE\""));
        assertThat(json, not(containsString("active\"")));

        Student restored = student();
        restored.importState(student.exportState());
        assertEquals(student.getState().get(), restored.getState().get());
    }
}

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

import io.github.geevly.ese.core.EventKind;

/**
 * Closed set of events of {@link Student}. Tags are stored with the events and must never change.
 */
public enum StudentEventType implements EventKind {
    ADD_STUDENT("AddStudent"),
    SET_STUDENT_STATUS("SetStudentStatus"),
    UPDATE_STUDENT("UpdateStudent"),
    ENROLL_STUDENT("EnrollStudent"),
    UNENROLL_STUDENT("UnenrollStudent"),
    SET_LOOKUP_CODE("SetLookupCode");

    private final String tag;

    StudentEventType(String tag) {
        this.tag = tag;
    }

    @Override
    public String tag() {
        return tag;
    }
}

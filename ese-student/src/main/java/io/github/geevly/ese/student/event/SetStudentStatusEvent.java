package io.github.geevly.ese.student.event;

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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.github.geevly.ese.student.StudentStatus;
import org.immutables.value.Value;

@Value.Immutable
@JsonSerialize(as = ImmutableSetStudentStatusEvent.class)
@JsonDeserialize(as = ImmutableSetStudentStatusEvent.class)
public interface SetStudentStatusEvent {
    @Value.Parameter
    StudentStatus status();

    static SetStudentStatusEvent of(StudentStatus status) {
        return ImmutableSetStudentStatusEvent.of(status);
    }
}

package io.github.geevly.ese.core;

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

/**
 * Receives events after they were durably appended to the event log.
 */
@FunctionalInterface
public interface CommittedEventListener {
    /**
     * Called once for every committed event, in order of versions of single aggregate. Implementations must be
     * prepared to receive same event more than once.
     * @param envelope the committed event
     */
    void committed(EventEnvelope envelope);
}

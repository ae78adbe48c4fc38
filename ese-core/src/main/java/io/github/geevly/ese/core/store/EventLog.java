package io.github.geevly.ese.core.store;

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

import io.github.geevly.ese.core.EventEnvelope;

/**
 * Read side of the event log. Used to recover aggregates.
 */
public interface EventLog {
    /**
     * Read all events for an aggregate that happened after specified version.
     * @param aggregateId the id of an aggregate
     * @param afterVersion events that happened after this version. {@code -1} stands for uninitialized, will
     *                     therefore return entire history
     * @return accessor for the events in ascending order of versions
     */
    StoredEvents readEvents(String aggregateId, long afterVersion);

    /**
     * Version of the last stored event of an aggregate.
     * @param aggregateId the id of an aggregate
     * @return the version, {@code -1} if no events are stored
     */
    long currentVersion(String aggregateId);

    /**
     * Accessor that enables single iteration over found events.
     * The events need not to be materialized at once, rather it could for example wrap a JDBC ResultSet. This also
     * means that {@link #foreach(EventConsumer)} may be called only once on single instance.
     */
    interface StoredEvents extends AutoCloseable {
        /**
         * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration. Exception thrown by
         * the consumer stops the iteration and is propagated.
         * @param consumer consumer that will receive the events
         * @param <X> type of exception consumer may throw
         * @throws X when consumer fails
         */
        <X extends Exception> void foreach(EventConsumer<X> consumer) throws X;

        /**
         * Can be called from within the consumer to stop the iteration after current step.
         */
        void stop();

        // will not throw exception
        @Override
        void close();
    }

    @FunctionalInterface
    interface EventConsumer<X extends Exception> {
        void accept(EventEnvelope envelope) throws X;
    }
}

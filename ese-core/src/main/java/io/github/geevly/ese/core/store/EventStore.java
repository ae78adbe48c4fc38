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
 * Write side of the event log. All serialization of concurrent writers to the same aggregate happens here, the
 * aggregates themselves perform no locking.
 */
public interface EventStore {

    /**
     * Durably append an event, if the aggregate is still at expected version. Exactly one of concurrent writers
     * appending at the same expected version succeeds, others fail with {@link EventStoreException.Fault#OPTIMISTIC_LOCK}.
     * @param aggregateId the aggregate to append to
     * @param expectedVersion version of the last event writer has observed, {@code -1} for new aggregate
     * @param envelope event to store, its version must be {@code expectedVersion + 1}
     * @throws EventStoreException when storing fails, or if the aggregate was out of date
     */
    void appendIfVersion(String aggregateId, long expectedVersion, EventEnvelope envelope) throws EventStoreException;

    /**
     * Verify the envelope can be appended to the stream of an aggregate at given version.
     * @param aggregateId the aggregate to append to
     * @param expectedVersion the expected version
     * @param envelope event to store
     * @throws EventStoreException with fault {@link EventStoreException.Fault#PROGRAMMATIC_ERROR} when the event does
     *         not belong to the stream, or does not follow expected version
     */
    static void checkAppendable(String aggregateId, long expectedVersion, EventEnvelope envelope)
            throws EventStoreException {
        if (!aggregateId.equals(envelope.aggregateId())) {
            throw EventStoreException.foreignAggregate(aggregateId, envelope);
        }
        if (envelope.version() != expectedVersion + 1) {
            throw EventStoreException.nonMonotonic(aggregateId, expectedVersion + 1, envelope);
        }
    }
}

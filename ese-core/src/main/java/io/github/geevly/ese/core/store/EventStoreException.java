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
 * Failure to durably append an event.
 *
 * <p>Fault {@link Fault#OPTIMISTIC_LOCK} signals a version conflict: another writer advanced the aggregate since the
 * caller observed it. Caller should reload the aggregate and retry. Other faults are not recoverable by retrying.</p>
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        OPTIMISTIC_LOCK, TX_ERROR, PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public boolean isVersionConflict() {
        return fault == Fault.OPTIMISTIC_LOCK;
    }

    public static EventStoreException optimisticLock(String aggregateId, long currentVersion, long expectedVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Aggregate " + aggregateId
                + " storing event attempted at expected version " + expectedVersion + " while last known version is "
                + currentVersion, null);
    }

    public static EventStoreException concurrentAppend(String aggregateId, long eventVersion, Throwable cause) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Version " + eventVersion + " of aggregate "
                + aggregateId + " has been stored by another writer", cause);
    }

    public static EventStoreException storeFailed(String aggregateId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Store of aggregate " + aggregateId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException foreignAggregate(String expected, EventEnvelope violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event of aggregate " + violating.aggregateId()
                + " appended to stream of " + expected, null);
    }

    public static EventStoreException nonMonotonic(String aggregateId, long expectedVersion, EventEnvelope violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event for aggregate " + aggregateId
                + " does not follow sequence. Expected: " + expectedVersion + " actual: " + violating.version(), null);
    }
}
